package ch.minigolf.minigolfbackend.repository;

import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.domain.enums.RoomStatus;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local {@link RoomRepository} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Rooms are ephemeral and are lost on restart. Room locks are striped: a fixed pool of
 * {@link ReentrantLock}s is shared by all room ids, so lock objects never have to be cleaned up
 * when rooms disappear.
 */
@Repository
public class InMemoryRoomRepository implements RoomRepository {

    private static final int LOCK_STRIPES = 64;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final Clock clock;

    public InMemoryRoomRepository(Clock clock) {
        this.clock = clock;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public Optional<Room> findById(String roomId) {
        return executeLocked(roomId, () -> {
            Room stored = rooms.get(roomId);
            if (stored == null) {
                return Optional.empty();
            }
            stored.setLastActivity(clock.instant());
            return Optional.of(stored.copy());
        });
    }

    @Override
    public Optional<Room> peek(String roomId) {
        return Optional.ofNullable(rooms.get(roomId)).map(Room::copy);
    }

    @Override
    public Room save(Room room) {
        Room stored = room.copy();
        stored.setLastActivity(clock.instant());
        executeLocked(room.getId(), () -> rooms.put(stored.getId(), stored));
        return stored.copy();
    }

    @Override
    public boolean saveIfAbsent(Room room) {
        Room stored = room.copy();
        stored.setLastActivity(clock.instant());
        return executeLocked(room.getId(), () -> rooms.putIfAbsent(stored.getId(), stored) == null);
    }

    @Override
    public boolean deleteById(String roomId) {
        return executeLocked(roomId, () -> rooms.remove(roomId) != null);
    }

    @Override
    public boolean existsById(String roomId) {
        return rooms.containsKey(roomId);
    }

    @Override
    public List<Room> findAll() {
        return rooms.values().stream()
                .map(Room::copy)
                .toList();
    }

    @Override
    public List<Room> findActive(Instant inactiveBefore) {
        return rooms.values().stream()
                .filter(room -> room.getStatus() == RoomStatus.WAITING
                        || room.getLastActivity().isAfter(inactiveBefore))
                .sorted(Comparator.comparing(Room::getCreated).reversed())
                .map(Room::copy)
                .toList();
    }

    @Override
    public long count() {
        return rooms.size();
    }

    @Override
    public <T> T executeLocked(String roomId, Supplier<T> action) {
        ReentrantLock lock = lockFor(roomId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String roomId) {
        return locks[Math.floorMod(roomId.hashCode(), locks.length)];
    }
}
