package ch.minigolf.minigolfbackend.domain;

/**
 * Partial update of room settings. {@code null} fields are left unchanged.
 *
 * <p>Status, turn index and roster are not part of this type, they only change
 * through the game and membership operations.
 *
 * @param name new display name
 * @param hostId id of a seated player that becomes host
 * @param maxPlayers new roster cap (at least 2)
 * @param shotsPerPlayer new shots per player (at least 1), applied from the next reset or join
 * @param rewardAmount new opaque reward amount
 */
public record RoomUpdate(
        String name,
        String hostId,
        Integer maxPlayers,
        Integer shotsPerPlayer,
        Long rewardAmount
) {}
