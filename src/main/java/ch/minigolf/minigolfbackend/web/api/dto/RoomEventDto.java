package ch.minigolf.minigolfbackend.web.api.dto;

import ch.minigolf.minigolfbackend.domain.Player;
import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.enums.RoomEventType;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Event published after a room change has been written to the store.
 *
 * <p>{@code room} is an immutable snapshot of the committed state. For {@code ROOM_REMOVED} it is
 * the last state before removal.
 */
public record RoomEventDto(
        RoomEventType type,
        String roomId,
        RoomStatus roomStatus,
        Instant timeStamp,
        RoomDto room,
        Map<String, Object> payload
) {
    public static RoomEventDto roomCreated(Room room) {
        return of(RoomEventType.ROOM_CREATED, room, Map.of(
                "hostId", room.getHostId()
        ));
    }

    public static RoomEventDto playerJoined(Room room, Player player) {
        return of(RoomEventType.PLAYER_JOINED, room, Map.of(
                "playerId", player.getId(),
                "playerName", player.getName()
        ));
    }

    public static RoomEventDto playerLeft(Room room, String playerId) {
        return of(RoomEventType.PLAYER_LEFT, room, Map.of(
                "playerId", playerId
        ));
    }

    public static RoomEventDto playerUpdated(Room room, Player player) {
        return of(RoomEventType.PLAYER_UPDATED, room, Map.of(
                "playerId", player.getId()
        ));
    }

    public static RoomEventDto roomUpdated(Room room) {
        return of(RoomEventType.ROOM_UPDATED, room, Map.of());
    }

    public static RoomEventDto gameStarted(Room room, Player currentTurnPlayer) {
        return of(RoomEventType.GAME_STARTED, room, Map.of(
                "currentTurnPlayerId", currentTurnPlayer.getId()
        ));
    }

    public static RoomEventDto turnChanged(Room room, Player currentTurnPlayer) {
        return of(RoomEventType.TURN_CHANGED, room, Map.of(
                "playerId", currentTurnPlayer.getId()
        ));
    }

    public static RoomEventDto scoreUpdated(Room room, Player player) {
        return of(RoomEventType.SCORE_UPDATED, room, Map.of(
                "playerId", player.getId(),
                "newScore", player.getScore(),
                "shotsRemaining", player.getShotsRemaining()
        ));
    }

    public static RoomEventDto gameCompleted(Room room, Player winner) {
        // winner may be null, Map.of does not accept null values
        Map<String, Object> payload = new HashMap<>();
        payload.put("winnerPlayerId", winner == null ? null : winner.getId());
        payload.put("rewardAmount", room.getRewardAmount());
        return of(RoomEventType.GAME_COMPLETED, room, payload);
    }

    public static RoomEventDto gameReset(Room room) {
        return of(RoomEventType.GAME_RESET, room, Map.of());
    }

    public static RoomEventDto roomRemoved(Room room) {
        return of(RoomEventType.ROOM_REMOVED, room, Map.of());
    }

    private static RoomEventDto of(RoomEventType type, Room room, Map<String, Object> payload) {
        return new RoomEventDto(
                type,
                room.getId(),
                room.getStatus(),
                Instant.now(),
                RoomDto.from(room),
                payload
        );
    }
}
