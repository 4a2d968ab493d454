package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.common.exception.ValidationException;

import java.time.LocalDateTime;

final class KeyChecks {

    private KeyChecks() {}

    static String registrationNumber(String registrationNumber) {
        if (registrationNumber == null || registrationNumber.isBlank()) {
            throw new ValidationException("REGISTRATION_NUMBER_REQUIRED");
        }
        return registrationNumber.trim();
    }

    static LocalDateTime dateTime(LocalDateTime dateTime) {
        if (dateTime == null) {
            throw new ValidationException("DATE_TIME_REQUIRED");
        }
        return dateTime;
    }
}
