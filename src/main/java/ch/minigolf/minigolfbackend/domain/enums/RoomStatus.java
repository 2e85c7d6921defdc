package ch.minigolf.minigolfbackend.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle phase of a room.
 *
 * <p>Allowed path is {@code WAITING -> PLAYING -> COMPLETED}. The only way back is an explicit
 * reset, which returns the room to {@code WAITING}.
 */
public enum RoomStatus {

    /**
     * Room is open for joining, no game is running.
     */
    @JsonProperty("waiting")
    WAITING,

    /**
     * Game is running, players take turns.
     */
    @JsonProperty("playing")
    PLAYING,

    /**
     * All shots are used up (or nobody eligible is left), a winner can be determined.
     */
    @JsonProperty("completed")
    COMPLETED
}
