package ch.minigolf.minigolfbackend.web.api.dto;

import ch.minigolf.minigolfbackend.domain.RoomUpdate;

public record UpdateRoomRequest(
        RoomUpdate updates
) {}
