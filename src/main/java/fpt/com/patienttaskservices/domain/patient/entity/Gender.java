package fpt.com.patienttaskservices.domain.patient.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.patienttaskservices.common.persistence.CodedEnum;
import fpt.com.patienttaskservices.common.persistence.CodedEnumConverter;

public enum Gender implements CodedEnum {
    MALE("Male"),
    FEMALE("Female"),
    OTHER("Other");

    private final String code;

    Gender(String code) {
        this.code = code;
    }

    @JsonValue
    @Override
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Gender fromCode(String code) {
        return CodedEnum.fromCode(Gender.class, code);
    }

    @Override
    public String toString() {
        return code;
    }

    @jakarta.persistence.Converter
    public static class Converter extends CodedEnumConverter<Gender> {
        public Converter() {
            super(Gender.class);
        }
    }
}
