package fpt.com.patienttaskservices.domain.workitem.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.patienttaskservices.common.persistence.CodedEnum;
import fpt.com.patienttaskservices.common.persistence.CodedEnumConverter;

public enum ImagingType implements CodedEnum {
    X_RAY("X-RAY"),
    CT("CT"),
    MRI("MRI"),
    USG("USG");

    private final String code;

    ImagingType(String code) {
        this.code = code;
    }

    @JsonValue
    @Override
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ImagingType fromCode(String code) {
        return CodedEnum.fromCode(ImagingType.class, code);
    }

    @Override
    public String toString() {
        return code;
    }

    @jakarta.persistence.Converter
    public static class Converter extends CodedEnumConverter<ImagingType> {
        public Converter() {
            super(ImagingType.class);
        }
    }
}
