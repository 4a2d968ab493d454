package fpt.com.patienttaskservices.domain.patient.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.patienttaskservices.common.persistence.CodedEnum;
import fpt.com.patienttaskservices.common.persistence.CodedEnumConverter;

/**
 * Fixed set of wards a patient can be placed in.
 */
public enum WardLocation implements CodedEnum {
    EMERGENCY("Emergency"),
    ICU("ICU"),
    HDU("HDU"),
    WARD_MALE("Ward Male"),
    WARD_FEMALE("Ward Female"),
    OTHER("Other");

    private final String code;

    WardLocation(String code) {
        this.code = code;
    }

    @JsonValue
    @Override
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static WardLocation fromCode(String code) {
        return CodedEnum.fromCode(WardLocation.class, code);
    }

    @Override
    public String toString() {
        return code;
    }

    @jakarta.persistence.Converter
    public static class Converter extends CodedEnumConverter<WardLocation> {
        public Converter() {
            super(WardLocation.class);
        }
    }
}
