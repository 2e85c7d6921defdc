package ch.minigolf.minigolfbackend.repository;

import ch.minigolf.minigolfbackend.domain.Room;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Repository for {@link Room} aggregates.
 *
 * <p>Single source of truth for all rooms. Every method hands out detached copies, so callers
 * never hold a live reference into the store. Read-modify-write sequences for one room must run
 * inside {@link #executeLocked(String, Supplier)}.
 */
public interface RoomRepository {

    /**
     * Finds a room by id and refreshes its {@code lastActivity}.
     *
     * @param roomId public room identifier
     * @return snapshot of the room, empty if unknown
     */
    Optional<Room> findById(String roomId);

    /**
     * Finds a room by id without refreshing its {@code lastActivity}.
     *
     * @param roomId public room identifier
     * @return snapshot of the room, empty if unknown
     */
    Optional<Room> peek(String roomId);

    /**
     * Inserts or fully replaces the room with the same id and stamps {@code lastActivity}.
     *
     * @param room room to store
     * @return snapshot of the stored room
     */
    Room save(Room room);

    /**
     * Stores the room only if no room with the same id exists yet.
     *
     * @param room room to store
     * @return {@code true} if the room was stored
     */
    boolean saveIfAbsent(Room room);

    /**
     * Removes the room. Calling this for an unknown id is a no-op.
     *
     * @param roomId public room identifier
     * @return {@code true} if a room was removed
     */
    boolean deleteById(String roomId);

    boolean existsById(String roomId);

    List<Room> findAll();

    /**
     * Finds rooms that are waiting, or that were active after the given cutoff.
     *
     * @param inactiveBefore rooms not waiting and last active at or before this instant are skipped
     * @return matching rooms, newest created first
     */
    List<Room> findActive(Instant inactiveBefore);

    long count();

    /**
     * Runs the action while holding the lock of the given room. The lock is reentrant.
     *
     * @param roomId public room identifier
     * @param action work to run under the lock
     * @return result of the action
     */
    <T> T executeLocked(String roomId, Supplier<T> action);
}
