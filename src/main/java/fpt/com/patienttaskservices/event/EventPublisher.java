package fpt.com.patienttaskservices.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * In-process publisher for registry and ledger events (Spring events).
 */
@Slf4j
@Component
public class EventPublisher {

    private final ApplicationEventPublisher publisher;

    public EventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(EventType type, String registrationNumber, String description) {
        publish(EventPayload.of(type, registrationNumber, description));
    }

    public void publish(EventPayload payload) {
        log.debug("[EVENT] {} {} for {} - {}",
                payload.getEventCode(),
                payload.getType(),
                payload.getRegistrationNumber(),
                payload.getDescription());
        publisher.publishEvent(payload);
    }
}
