package ch.minigolf.minigolfbackend.web.api.dto;

import java.time.Instant;

/**
 * DTO with statistics about rooms eligible for eviction.
 *
 * @param totalRooms all rooms in the store
 * @param staleRooms rooms inactive for longer than the threshold
 * @param activeRooms rooms still within the threshold
 * @param thresholdHours inactivity threshold in hours
 * @param thresholdTimestamp rooms last active before this instant are stale
 */
public record CleanupStatusDto(
        long totalRooms,
        long staleRooms,
        long activeRooms,
        int thresholdHours,
        Instant thresholdTimestamp
) {
}
