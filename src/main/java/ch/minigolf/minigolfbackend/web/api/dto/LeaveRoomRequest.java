package ch.minigolf.minigolfbackend.web.api.dto;

public record LeaveRoomRequest(
        String playerId
) {}
