package ch.minigolf.minigolfbackend.domain;

import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents one mini-golf game session with a fixed roster cap and shot count.
 *
 * <p>The room aggregates the runtime state (status, roster, current turn) and offers small helper
 * methods on that state. Rule enforcement (who may join, whose turn it is, when the game ends) is
 * handled in the service layer.
 */
@Getter
@Setter
public class Room {

    /**
     * Public room identifier used by clients to join and load a room.
     */
    private String id;

    private String name;

    /**
     * Id of the hosting player, always one of {@link #players}.
     */
    private String hostId;

    /**
     * Seated players. List order is turn order.
     */
    private List<Player> players = new ArrayList<>();

    private int maxPlayers;

    private RoomStatus status;

    /**
     * Index into {@link #players} of the player whose turn it is. Only meaningful while playing.
     */
    private int currentPlayerIndex;

    /**
     * Shots every player gets per game, fixed at creation.
     */
    private int shotsPerPlayer;

    /**
     * Reward in stroops (10^-7 XLM), passed through to the reward layer untouched.
     */
    private long rewardAmount;

    private Instant created;

    /**
     * Last read or write access, drives eviction of stale rooms.
     */
    private Instant lastActivity;

    /**
     * Creates a new waiting room without players.
     *
     * @param id public room identifier
     * @param name display name
     * @param maxPlayers roster cap
     * @param shotsPerPlayer shots per player and game
     * @param rewardAmount opaque reward amount
     * @param created creation time, also used as initial activity time
     */
    public Room(String id, String name, int maxPlayers, int shotsPerPlayer, long rewardAmount, Instant created) {
        this.id = Objects.requireNonNull(id);
        this.name = name;
        this.maxPlayers = maxPlayers;
        this.shotsPerPlayer = shotsPerPlayer;
        this.rewardAmount = rewardAmount;
        this.status = RoomStatus.WAITING;
        this.currentPlayerIndex = 0;
        this.created = created;
        this.lastActivity = created;
    }

    /**
     * Appends a player at the end of the turn order.
     *
     * @param player player to add
     */
    public void addPlayer(Player player) {
        this.players.add(player);
    }

    public Optional<Player> findPlayer(String playerId) {
        return players.stream()
                .filter(p -> Objects.equals(p.getId(), playerId))
                .findFirst();
    }

    /**
     * Returns the list position of the given player, or -1 if the player is not seated here.
     */
    public int indexOfPlayer(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (Objects.equals(players.get(i).getId(), playerId)) {
                return i;
            }
        }
        return -1;
    }

    public boolean isFull() {
        return players.size() >= maxPlayers;
    }

    /**
     * {@code true} if nobody is left who could keep the room alive.
     */
    public boolean isAbandoned() {
        return players.isEmpty() || players.stream().noneMatch(Player::isConnected);
    }

    /**
     * Moves the turn flag to the player at {@code index} and clears it everywhere else.
     *
     * @param index list position of the new current player
     */
    public void assignTurnTo(int index) {
        for (int i = 0; i < players.size(); i++) {
            players.get(i).setCurrentTurn(i == index);
        }
        this.currentPlayerIndex = index;
    }

    public void clearTurns() {
        players.forEach(p -> p.setCurrentTurn(false));
    }

    /**
     * Returns a detached deep copy, players included.
     */
    public Room copy() {
        Room copy = new Room(id, name, maxPlayers, shotsPerPlayer, rewardAmount, created);
        copy.hostId = hostId;
        copy.status = status;
        copy.currentPlayerIndex = currentPlayerIndex;
        copy.lastActivity = lastActivity;
        for (Player player : players) {
            copy.players.add(player.copy());
        }
        return copy;
    }
}
