package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.repository.RoomRepository;
import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Service responsible for periodic eviction of stale rooms.
 *
 * <p>A room whose last read or write lies more than the configured threshold in the past is
 * deleted, whatever its status. Each room is re-read under its own lock before deletion, so a room
 * touched while the sweep runs is kept.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code rooms.cleanup.interval-ms}: how often the sweep runs (default: 1 hour)</li>
 *   <li>{@code rooms.cleanup.threshold-hours}: inactivity threshold (default: 24 hours)</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Getter
public class RoomCleanupService {

    private final RoomRepository roomRepository;
    private final RoomEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${rooms.cleanup.interval-ms:3600000}")
    private long cleanupIntervalMs;

    @Value("${rooms.cleanup.threshold-hours:24}")
    private int cleanupThresholdHours;

    @Scheduled(fixedRateString = "${rooms.cleanup.interval-ms:3600000}")
    public void cleanupInactiveRooms() {
        cleanupInactiveRooms(clock.instant());
    }

    /**
     * Evicts all rooms inactive for longer than the threshold, measured from {@code now}.
     *
     * @param now reference time of the sweep
     * @return number of evicted rooms
     */
    public int cleanupInactiveRooms(Instant now) {
        Instant threshold = thresholdFor(now);

        log.debug("Starting room cleanup. Removing rooms inactive since before {} (threshold: {} hours)",
                threshold, cleanupThresholdHours);

        int removed = 0;
        for (Room candidate : roomRepository.findAll()) {
            if (!candidate.getLastActivity().isBefore(threshold)) {
                continue;
            }
            String roomId = candidate.getId();
            if (roomRepository.executeLocked(roomId, () -> evictIfStale(roomId, threshold))) {
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Cleaned up {} inactive room(s) (inactive for more than {} hours)",
                    removed, cleanupThresholdHours);
        } else {
            log.debug("No inactive rooms to clean up");
        }
        return removed;
    }

    /**
     * Runs the sweep outside the schedule, e.g. from the dev endpoint.
     *
     * @return number of evicted rooms
     */
    public int triggerCleanup() {
        return cleanupInactiveRooms(clock.instant());
    }

    /**
     * Removes every room, regardless of activity.
     *
     * @return number of removed rooms
     */
    public int removeAllRooms() {
        int removed = 0;
        for (Room room : roomRepository.findAll()) {
            String roomId = room.getId();
            boolean deleted = roomRepository.executeLocked(roomId, () -> {
                Optional<Room> current = roomRepository.peek(roomId);
                if (current.isEmpty()) {
                    return false;
                }
                roomRepository.deleteById(roomId);
                eventPublisher.publish(RoomEventDto.roomRemoved(current.get()));
                return true;
            });
            if (deleted) {
                removed++;
            }
        }

        log.info("Removed all rooms ({})", removed);
        return removed;
    }

    /**
     * Instant before which a room counts as stale, relative to {@code now}.
     */
    public Instant thresholdFor(Instant now) {
        return now.minusSeconds(cleanupThresholdHours * 3600L);
    }

    private boolean evictIfStale(String roomId, Instant threshold) {
        Optional<Room> current = roomRepository.peek(roomId);
        if (current.isEmpty() || !current.get().getLastActivity().isBefore(threshold)) {
            return false;
        }

        roomRepository.deleteById(roomId);
        log.debug("Evicted room {} (last activity {})", roomId, current.get().getLastActivity());

        eventPublisher.publish(RoomEventDto.roomRemoved(current.get()));
        return true;
    }
}
