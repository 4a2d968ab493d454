package fpt.com.patienttaskservices.domain.workitem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of adding a consultation. Archival consultations are not stored twice for the
 * same patient and text; the second attempt reports {@link Outcome#ALREADY_EXISTS}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsultationAddResult {

    public enum Outcome {
        CREATED,
        ALREADY_EXISTS
    }

    private Outcome outcome;
    private ConsultationItemDto item;

    public static ConsultationAddResult created(ConsultationItemDto item) {
        return new ConsultationAddResult(Outcome.CREATED, item);
    }

    public static ConsultationAddResult alreadyExists() {
        return new ConsultationAddResult(Outcome.ALREADY_EXISTS, null);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
