package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * Request DTO used to open a new room. The host becomes the first player.
 *
 * <p>{@code maxPlayers}, {@code shotsPerPlayer} and {@code rewardAmount} are optional; missing
 * values fall back to the configured defaults.
 *
 * @param hostId client generated id of the host player
 * @param hostName display name of the host
 * @param walletAddress wallet address of the host, may be empty
 * @param roomName display name of the room
 * @param maxPlayers roster cap, at least 2
 * @param shotsPerPlayer shots per player, at least 1
 * @param rewardAmount reward in stroops
 */
public record CreateRoomRequest(
        String hostId,
        String hostName,
        String walletAddress,
        String roomName,
        Integer maxPlayers,
        Integer shotsPerPlayer,
        Long rewardAmount
) {}
