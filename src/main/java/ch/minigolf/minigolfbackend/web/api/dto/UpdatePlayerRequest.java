package ch.minigolf.minigolfbackend.web.api.dto;

/**
 * Request DTO replacing a player record as a whole.
 *
 * @param player new player state, {@code player.id} must match the path
 */
public record UpdatePlayerRequest(
        PlayerDto player
) {}
