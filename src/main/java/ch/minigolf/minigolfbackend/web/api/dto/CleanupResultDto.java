package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * DTO representing the result of a manual room sweep.
 *
 * @param message human-readable status message
 * @param deletedCount number of rooms that were evicted
 * @param roomsBefore total rooms before the sweep
 * @param roomsAfter total rooms after the sweep
 * @param thresholdHours inactivity threshold used for the sweep (in hours)
 */
public record CleanupResultDto(
        String message,
        long deletedCount,
        long roomsBefore,
        long roomsAfter,
        int thresholdHours
) {
}
