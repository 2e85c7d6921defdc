package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * Request DTO used to join (or re-join) a waiting room.
 *
 * @param playerId client generated player id, stable across reconnects
 * @param playerName display name
 * @param walletAddress wallet address, may be empty
 */
public record JoinRoomRequest(
        String playerId,
        String playerName,
        String walletAddress
) {}
