package ch.minigolf.minigolfbackend.web.api.dto;

import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;

import java.time.Instant;
import java.util.List;

/**
 * Immutable client view of a room, players included in turn order.
 */
public record RoomDto(
        String id,
        String name,
        String hostId,
        List<PlayerDto> players,
        int maxPlayers,
        RoomStatus status,
        int currentPlayerIndex,
        int shotsPerPlayer,
        long rewardAmount,
        Instant created,
        Instant lastActivity
) {
    public static RoomDto from(Room room) {
        return new RoomDto(
                room.getId(),
                room.getName(),
                room.getHostId(),
                room.getPlayers().stream().map(PlayerDto::from).toList(),
                room.getMaxPlayers(),
                room.getStatus(),
                room.getCurrentPlayerIndex(),
                room.getShotsPerPlayer(),
                room.getRewardAmount(),
                room.getCreated(),
                room.getLastActivity()
        );
    }
}
