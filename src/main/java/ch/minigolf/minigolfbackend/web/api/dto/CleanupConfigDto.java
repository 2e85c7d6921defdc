package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * DTO with the configured sweep settings.
 *
 * @param cleanupIntervalMs sweep interval in milliseconds
 * @param cleanupIntervalHours sweep interval in hours
 * @param cleanupThresholdHours inactivity threshold in hours
 */
public record CleanupConfigDto(
        long cleanupIntervalMs,
        double cleanupIntervalHours,
        int cleanupThresholdHours
) {
}
