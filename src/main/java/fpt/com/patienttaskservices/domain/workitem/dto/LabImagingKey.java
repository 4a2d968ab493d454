package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Natural key of a lab/imaging row: registration number, timestamp and the full payload.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabImagingKey {

    String registrationNumber;
    LocalDateTime dateTime;
    WorkItemPayload payload;

    public static LabImagingKey of(String registrationNumber, LocalDateTime dateTime, WorkItemPayload payload) {
        if (payload == null) {
            throw new ValidationException("PAYLOAD_REQUIRED");
        }
        return new LabImagingKey(KeyChecks.registrationNumber(registrationNumber), KeyChecks.dateTime(dateTime), payload);
    }
}
