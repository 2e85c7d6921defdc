package ch.minigolf.minigolfbackend.web.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform response envelope of the room API.
 *
 * @param success {@code true} if the requested operation was applied
 * @param data payload, may be {@code null} (e.g. no winner, room deleted on leave)
 * @param error human-readable failure reason, omitted on success
 * @param <T> payload type
 */
public record ApiResponse<T>(
        boolean success,
        T data,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> failure(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
