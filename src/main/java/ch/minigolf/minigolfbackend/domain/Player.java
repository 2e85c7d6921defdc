package ch.minigolf.minigolfbackend.domain;

import lombok.Getter;
import lombok.Setter;

/**
 * Represents a player seated in a room.
 *
 * <p>The {@code id} is supplied by the client and stays stable across reconnects. The wallet
 * address is never inspected here, it is only handed on to the reward layer.
 */
@Getter
@Setter
public class Player {

    private String id;

    /**
     * Display name, not unique.
     */
    private String name;

    /**
     * Wallet address of the player, may be empty.
     */
    private String walletAddress;

    private int score;

    private int shotsRemaining;

    /**
     * {@code false} while the player is temporarily absent from a running game.
     */
    private boolean connected;

    private boolean currentTurn;

    /**
     * Creates a connected player with no score and no shots assigned yet.
     *
     * @param id client supplied player id
     * @param name display name
     * @param walletAddress wallet address, {@code null} is stored as empty string
     */
    public Player(String id, String name, String walletAddress) {
        this.id = id;
        this.name = name;
        this.walletAddress = walletAddress == null ? "" : walletAddress;
        this.connected = true;
    }

    /**
     * Returns a detached copy of this player.
     */
    public Player copy() {
        Player copy = new Player(id, name, walletAddress);
        copy.score = score;
        copy.shotsRemaining = shotsRemaining;
        copy.connected = connected;
        copy.currentTurn = currentTurn;
        return copy;
    }
}
