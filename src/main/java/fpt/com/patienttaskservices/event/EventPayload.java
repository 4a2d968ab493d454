package fpt.com.patienttaskservices.event;

import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventPayload {
    private EventType type;
    private String registrationNumber;
    private String description;
    private LocalDateTime timestamp;

    public String getEventCode() {
        return type != null ? type.getCode() : null;
    }

    public static EventPayload of(EventType type, String registrationNumber, String description) {
        return EventPayload.builder()
                .type(type)
                .registrationNumber(registrationNumber)
                .description(description)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
