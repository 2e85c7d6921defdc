package ch.minigolf.minigolfbackend.service;

import ch.minigolf.minigolfbackend.web.api.dto.RoomEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process notification bus for room events.
 *
 * <p>Decouples the room coordinator from presentation and reward logic. Every Spring bean
 * implementing {@link RoomEventListener} is registered at startup, further listeners can be
 * added at runtime via {@link #subscribe(RoomEventListener)}.
 *
 * <p>Delivery is synchronous, in registration order and at most once per listener. Nothing is
 * buffered or replayed. A failing listener is logged and skipped, the remaining listeners still
 * receive the event.
 */
@Component
@Slf4j
public class RoomEventPublisher {

    private final List<RoomEventListener> listeners = new CopyOnWriteArrayList<>();

    public RoomEventPublisher(List<RoomEventListener> listeners) {
        this.listeners.addAll(listeners);
    }

    public void subscribe(RoomEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(RoomEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Delivers the event to all current listeners.
     *
     * @param event event to deliver
     */
    public void publish(RoomEventDto event) {
        log.debug("Publishing {} for room {} to {} listener(s)",
                event.type(), event.roomId(), listeners.size());

        for (RoomEventListener listener : listeners) {
            try {
                listener.onRoomEvent(event);
            } catch (RuntimeException e) {
                log.warn("Room event listener {} failed on {} for room {}: {}",
                        listener.getClass().getSimpleName(), event.type(), event.roomId(), e.getMessage(), e);
            }
        }
    }
}
