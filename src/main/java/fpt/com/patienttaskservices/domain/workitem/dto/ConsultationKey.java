package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsultationKey {

    String registrationNumber;
    LocalDateTime dateTime;
    String consult;

    public static ConsultationKey of(String registrationNumber, LocalDateTime dateTime, String consult) {
        if (consult == null || consult.isBlank()) {
            throw new ValidationException("CONSULT_REQUIRED");
        }
        return new ConsultationKey(KeyChecks.registrationNumber(registrationNumber), KeyChecks.dateTime(dateTime),
                consult.trim());
    }
}
