package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * Request DTO carrying the result of one shot.
 *
 * @param playerId player whose turn it is
 * @param score points of the shot as computed by the game client
 */
public record ScoreRequest(
        String playerId,
        Integer score
) {}
