package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.domain.Player;
import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.RoomUpdate;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;
import ch.minigolf.minigolfbackend.repository.RoomRepository;
import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Room lifecycle: creation, membership, settings and removal.
 *
 * <p>Turn and score handling lives in {@link GameService}. Both services only touch rooms through
 * {@link RoomRepository} and publish a {@link RoomEventDto} for every committed change.
 */
@Service
@Slf4j
public class RoomService {

    private static final String ROOM_ID_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int ROOM_ID_LENGTH = 8;

    private final RoomRepository roomRepository;
    private final GameService gameService;
    private final RoomEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${rooms.defaults.max-players:4}")
    private int defaultMaxPlayers;

    @Value("${rooms.defaults.shots-per-player:3}")
    private int defaultShotsPerPlayer;

    /**
     * Default reward in stroops, 10 000 000 = 1 XLM.
     */
    @Value("${rooms.defaults.reward-amount:10000000}")
    private long defaultRewardAmount;

    /**
     * Rooms that are not waiting disappear from the listing after this many hours without activity.
     */
    @Value("${rooms.cleanup.threshold-hours:24}")
    private int activeThresholdHours;

    public RoomService(RoomRepository roomRepository,
                       GameService gameService,
                       RoomEventPublisher eventPublisher,
                       Clock clock) {
        this.roomRepository = roomRepository;
        this.gameService = gameService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Opens a new waiting room with the host as its only player.
     *
     * <p>{@code null} settings fall back to the configured defaults. The room id is generated and
     * regenerated until it does not collide with an existing room.
     *
     * @param hostId id of the host player
     * @param hostName display name of the host
     * @param walletAddress wallet address of the host, may be {@code null}
     * @param roomName display name of the room
     * @param maxPlayers roster cap or {@code null}
     * @param shotsPerPlayer shots per player or {@code null}
     * @param rewardAmount reward in stroops or {@code null}
     * @return snapshot of the created room
     */
    public Room createRoom(String hostId,
                           String hostName,
                           String walletAddress,
                           String roomName,
                           Integer maxPlayers,
                           Integer shotsPerPlayer,
                           Long rewardAmount) {
        int max = maxPlayers != null ? maxPlayers : defaultMaxPlayers;
        int shots = shotsPerPlayer != null ? shotsPerPlayer : defaultShotsPerPlayer;
        long reward = rewardAmount != null ? rewardAmount : defaultRewardAmount;
        Instant now = clock.instant();

        Player host = new Player(hostId, hostName, walletAddress);
        host.setShotsRemaining(shots);
        host.setCurrentTurn(true);

        Room room;
        do {
            room = new Room(generateRoomId(), roomName, max, shots, reward, now);
            room.setHostId(hostId);
            room.addPlayer(host.copy());
        } while (!roomRepository.saveIfAbsent(room));

        log.info("Room {} created by host {} (maxPlayers={}, shotsPerPlayer={})",
                room.getId(), hostId, max, shots);

        eventPublisher.publish(RoomEventDto.roomCreated(room));
        return room;
    }

    public Optional<Room> getRoom(String roomId) {
        return roomRepository.findById(roomId);
    }

    /**
     * Checks whether a room exists without counting as activity.
     */
    public boolean roomExists(String roomId) {
        return roomRepository.existsById(roomId);
    }

    /**
     * Lists all waiting rooms plus running or finished rooms with recent activity, newest first.
     */
    public List<Room> listActiveRooms() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(activeThresholdHours));
        return roomRepository.findActive(cutoff);
    }

    /**
     * Seats a player in a waiting room.
     *
     * <p>A player whose id is already seated re-joins: the entry is replaced in place with a fresh
     * score and full shots, its turn flag is kept. A new player is appended without the turn.
     *
     * @param roomId public room identifier
     * @param player joining player, copied before it is stored
     * @return {@code false} if the room is unknown, full or not waiting
     */
    public boolean addPlayer(String roomId, Player player) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            if (room.isFull()) {
                log.debug("Player {} rejected, room {} is full", player.getId(), roomId);
                return false;
            }
            if (room.getStatus() != RoomStatus.WAITING) {
                log.debug("Player {} rejected, room {} is {}", player.getId(), roomId, room.getStatus());
                return false;
            }

            Player joining = player.copy();
            joining.setScore(0);
            joining.setShotsRemaining(room.getShotsPerPlayer());
            joining.setConnected(true);

            int existingIndex = room.indexOfPlayer(player.getId());
            if (existingIndex >= 0) {
                joining.setCurrentTurn(room.getPlayers().get(existingIndex).isCurrentTurn());
                room.getPlayers().set(existingIndex, joining);
            } else {
                joining.setCurrentTurn(false);
                room.addPlayer(joining);
            }

            Room saved = roomRepository.save(room);
            log.info("Player {} joined room {} ({}/{})",
                    joining.getId(), roomId, saved.getPlayers().size(), saved.getMaxPlayers());

            eventPublisher.publish(RoomEventDto.playerJoined(saved, joining));
            return true;
        });
    }

    /**
     * Removes a player from a room.
     *
     * <p>While a game is running the player stays seated as disconnected so the turn order is kept.
     * If it held the turn, the turn moves on at once. Outside a game the player is dropped from the
     * roster. A room left with nobody connected is deleted, otherwise a leaving host is replaced
     * by the first connected player.
     *
     * @param roomId public room identifier
     * @param playerId id of the leaving player
     * @return {@code false} if room or player is unknown
     */
    public boolean removePlayer(String roomId, String playerId) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            int index = room.indexOfPlayer(playerId);
            if (index < 0) {
                return false;
            }

            if (room.getStatus() == RoomStatus.PLAYING) {
                Player leaving = room.getPlayers().get(index);
                leaving.setConnected(false);
                roomRepository.save(room);

                if (leaving.isCurrentTurn()) {
                    gameService.advanceTurn(roomId);
                    room = roomRepository.peek(roomId)
                            .orElseThrow(() -> new IllegalStateException("Room vanished while locked: " + roomId));
                }
            } else {
                room.getPlayers().remove(index);
            }

            if (room.isAbandoned()) {
                roomRepository.deleteById(roomId);
                log.info("Player {} left room {}, room removed (no connected players)", playerId, roomId);

                eventPublisher.publish(RoomEventDto.playerLeft(room, playerId));
                eventPublisher.publish(RoomEventDto.roomRemoved(room));
                return true;
            }

            if (playerId.equals(room.getHostId())) {
                reassignHost(room);
            }

            Room saved = roomRepository.save(room);
            log.info("Player {} left room {}", playerId, roomId);

            eventPublisher.publish(RoomEventDto.playerLeft(saved, playerId));
            return true;
        });
    }

    /**
     * Replaces the stored player with the same id. Turn and score rules are not applied.
     *
     * @param roomId public room identifier
     * @param player new state of the player
     * @return {@code false} if room or player is unknown or {@code shotsRemaining} is negative
     */
    public boolean updatePlayer(String roomId, Player player) {
        if (player.getShotsRemaining() < 0) {
            return false;
        }

        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            int index = room.indexOfPlayer(player.getId());
            if (index < 0) {
                return false;
            }

            room.getPlayers().set(index, player.copy());

            Room saved = roomRepository.save(room);
            log.debug("Player {} in room {} updated", player.getId(), roomId);

            eventPublisher.publish(RoomEventDto.playerUpdated(saved, player));
            return true;
        });
    }

    /**
     * Applies a partial settings update. {@code null} fields are left as they are.
     *
     * @param roomId public room identifier
     * @param updates fields to change
     * @return {@code false} if the room is unknown or an update value is invalid
     */
    public boolean updateRoom(String roomId, RoomUpdate updates) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.findById(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            Room room = maybeRoom.get();
            if (!isValidUpdate(room, updates)) {
                log.debug("Rejected invalid update for room {}", roomId);
                return false;
            }

            if (updates.name() != null) {
                room.setName(updates.name());
            }
            if (updates.hostId() != null) {
                room.setHostId(updates.hostId());
            }
            if (updates.maxPlayers() != null) {
                room.setMaxPlayers(updates.maxPlayers());
            }
            if (updates.shotsPerPlayer() != null) {
                room.setShotsPerPlayer(updates.shotsPerPlayer());
            }
            if (updates.rewardAmount() != null) {
                room.setRewardAmount(updates.rewardAmount());
            }

            Room saved = roomRepository.save(room);
            log.info("Room {} settings updated", roomId);

            eventPublisher.publish(RoomEventDto.roomUpdated(saved));
            return true;
        });
    }

    /**
     * Deletes a room regardless of its state.
     *
     * @param roomId public room identifier
     * @return {@code false} if the room is unknown
     */
    public boolean removeRoom(String roomId) {
        return roomRepository.executeLocked(roomId, () -> {
            Optional<Room> maybeRoom = roomRepository.peek(roomId);
            if (maybeRoom.isEmpty()) {
                return false;
            }

            roomRepository.deleteById(roomId);
            log.info("Room {} removed", roomId);

            eventPublisher.publish(RoomEventDto.roomRemoved(maybeRoom.get()));
            return true;
        });
    }

    // ----------------- helpers -----------------

    private static boolean isValidUpdate(Room room, RoomUpdate updates) {
        if (updates.hostId() != null && room.indexOfPlayer(updates.hostId()) < 0) {
            return false;
        }
        if (updates.maxPlayers() != null) {
            if (updates.maxPlayers() < 2) {
                return false;
            }
            if (room.getStatus() == RoomStatus.WAITING && updates.maxPlayers() < room.getPlayers().size()) {
                return false;
            }
        }
        return updates.shotsPerPlayer() == null || updates.shotsPerPlayer() >= 1;
    }

    private static void reassignHost(Room room) {
        for (Player player : room.getPlayers()) {
            if (player.isConnected()) {
                room.setHostId(player.getId());
                return;
            }
        }
    }

    private static String generateRoomId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder(ROOM_ID_LENGTH);
        for (int i = 0; i < ROOM_ID_LENGTH; i++) {
            id.append(ROOM_ID_ALPHABET.charAt(random.nextInt(ROOM_ID_ALPHABET.length())));
        }
        return id.toString();
    }
}
