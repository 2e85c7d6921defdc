package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * DTO representing the result of removing every room.
 *
 * @param message human-readable status message
 * @param deletedCount number of rooms removed
 */
public record DeleteAllResultDto(
        String message,
        long deletedCount
) {
}
