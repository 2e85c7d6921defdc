package ch.minigolf.minigolfbackend.web.api.controller;

import ch.minigolf.minigolfbackend.domain.Room;
import ch.minigolf.minigolfbackend.repository.RoomRepository;
import ch.minigolf.minigolfbackend.service.RoomCleanupService;
import ch.minigolf.minigolfbackend.web.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Development-only REST controller for manual room eviction.
 *
 * <p>Only available with the {@code dev} or {@code test} profile. Provides endpoints to run the
 * sweep on demand, inspect how many rooms are stale and wipe the store.
 *
 * <p><b>WARNING:</b> These endpoints must never be exposed in production.
 */
@RestController
@RequestMapping("/api/dev/cleanup")
@RequiredArgsConstructor
@Profile({"dev", "test"})
public class RoomCleanupController {

    private final RoomCleanupService cleanupService;
    private final RoomRepository roomRepository;
    private final Clock clock;

    /**
     * Runs the same sweep as the scheduled task.
     *
     * <p>Example response:
     * <pre>
     * {
     *   "message": "Cleanup completed",
     *   "deletedCount": 2,
     *   "roomsBefore": 5,
     *   "roomsAfter": 3,
     *   "thresholdHours": 24
     * }
     * </pre>
     *
     * @return cleanup result with statistics
     */
    @PostMapping("/rooms")
    @Operation(summary = "Manually triggers the room cleanup process")
    public ResponseEntity<CleanupResultDto> triggerRoomCleanup() {
        long countBefore = roomRepository.count();
        int deletedCount = cleanupService.triggerCleanup();
        long countAfter = roomRepository.count();

        CleanupResultDto result = new CleanupResultDto(
                "Cleanup completed",
                deletedCount,
                countBefore,
                countAfter,
                cleanupService.getCleanupThresholdHours()
        );

        return ResponseEntity.ok(result);
    }

    /**
     * Counts stale and active rooms without removing anything.
     *
     * @return statistics about rooms eligible for eviction
     */
    @GetMapping("/status")
    @Operation(summary = "Gets the status of rooms eligible for cleanup")
    public ResponseEntity<CleanupStatusDto> getCleanupStatus() {
        List<Room> rooms = roomRepository.findAll();
        Instant threshold = cleanupService.thresholdFor(clock.instant());

        long staleCount = rooms.stream()
                .filter(room -> room.getLastActivity().isBefore(threshold))
                .count();

        CleanupStatusDto status = new CleanupStatusDto(
                rooms.size(),
                staleCount,
                rooms.size() - staleCount,
                cleanupService.getCleanupThresholdHours(),
                threshold
        );

        return ResponseEntity.ok(status);
    }

    @GetMapping("/config")
    @Operation(summary = "Gets the current cleanup configuration")
    public ResponseEntity<CleanupConfigDto> getCleanupConfig() {
        long intervalMs = cleanupService.getCleanupIntervalMs();

        CleanupConfigDto config = new CleanupConfigDto(
                intervalMs,
                intervalMs / 3600000.0,
                cleanupService.getCleanupThresholdHours()
        );

        return ResponseEntity.ok(config);
    }

    /**
     * Deletes ALL rooms regardless of activity. Connected clients receive {@code ROOM_REMOVED}.
     *
     * @return deletion result with count
     */
    @DeleteMapping("/all")
    @Operation(summary = "Deletes ALL rooms")
    public ResponseEntity<DeleteAllResultDto> deleteAllRooms() {
        int deletedCount = cleanupService.removeAllRooms();
        return ResponseEntity.ok(new DeleteAllResultDto("All rooms deleted", deletedCount));
    }
}
