package fpt.com.patienttaskservices.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Logs registry and ledger events once the surrounding transaction has committed.
 */
@Slf4j
@Component
public class EventListenerComponent {

    @TransactionalEventListener(fallbackExecution = true)
    public void handleEvent(EventPayload payload) {
        log.info("Received event: {} ({}) | patient {} | {}",
                payload.getEventCode(), payload.getType(),
                payload.getRegistrationNumber(), payload.getDescription());
    }
}
