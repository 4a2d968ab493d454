package fpt.com.patienttaskservices.domain.workitem.entity;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Which of the two mutually exclusive payloads a lab/imaging row carries.
 */
public enum WorkItemCategory {
    LAB,
    IMAGING;

    @JsonCreator
    public static WorkItemCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        return WorkItemCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
