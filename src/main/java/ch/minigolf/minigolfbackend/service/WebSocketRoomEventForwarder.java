package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.domain.enums.RoomEventType;
import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Pushes room events to STOMP subscribers.
 *
 * <p>Destinations:
 * <ul>
 *   <li>{@code /topic/rooms/{roomId}/events}: every event of that room</li>
 *   <li>{@code /topic/rooms}: events that change the lobby list (created, updated, removed)</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class WebSocketRoomEventForwarder implements RoomEventListener {

    static final String LOBBY_TOPIC = "/topic/rooms";

    private static final Set<RoomEventType> LOBBY_EVENTS = EnumSet.of(
            RoomEventType.ROOM_CREATED,
            RoomEventType.ROOM_UPDATED,
            RoomEventType.ROOM_REMOVED
    );

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onRoomEvent(RoomEventDto event) {
        String destination = LOBBY_TOPIC + "/" + event.roomId() + "/events";
        messagingTemplate.convertAndSend(destination, event);

        if (LOBBY_EVENTS.contains(event.type())) {
            messagingTemplate.convertAndSend(LOBBY_TOPIC, event);
        }
    }
}
