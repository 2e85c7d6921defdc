package ch.minigolf.minigolfbackend.web.api.dto;

import ch.minigolf.minigolfbackend.domain.Player;

/**
 * DTO representing a seated player as seen by clients.
 *
 * @param id client supplied player id
 * @param name display name
 * @param walletAddress wallet address, may be empty
 * @param score accumulated score
 * @param shotsRemaining shots left in the current game
 * @param isConnected {@code false} while temporarily absent from a running game
 * @param isCurrentTurn {@code true} for the player allowed to submit the next score
 */
public record PlayerDto(
        String id,
        String name,
        String walletAddress,
        int score,
        int shotsRemaining,
        boolean isConnected,
        boolean isCurrentTurn
) {

    /**
     * Creates a {@code PlayerDto} from the given domain {@link Player}.
     *
     * @param player domain player
     * @return mapped DTO
     * @throws NullPointerException if {@code player} is null
     */
    public static PlayerDto from(Player player) {
        return new PlayerDto(
                player.getId(),
                player.getName(),
                player.getWalletAddress(),
                player.getScore(),
                player.getShotsRemaining(),
                player.isConnected(),
                player.isCurrentTurn()
        );
    }

    /**
     * Maps this DTO back to a detached domain {@link Player}.
     *
     * @return new domain player carrying all fields of this DTO
     */
    public Player toDomain() {
        Player player = new Player(id, name, walletAddress);
        player.setScore(score);
        player.setShotsRemaining(shotsRemaining);
        player.setConnected(isConnected);
        player.setCurrentTurn(isCurrentTurn);
        return player;
    }
}
