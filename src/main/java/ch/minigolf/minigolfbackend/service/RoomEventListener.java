package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;

/**
 * Observer of room events.
 *
 * <p>Called synchronously on the thread that changed the room, after the change was written to
 * the store and while the room is still locked. Implementations must return quickly and must not
 * block on I/O.
 */
@FunctionalInterface
public interface RoomEventListener {

    void onRoomEvent(RoomEventDto event);
}
