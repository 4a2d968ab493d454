package fpt.com.patienttaskservices.domain.workitem.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.patienttaskservices.common.persistence.CodedEnum;
import fpt.com.patienttaskservices.common.persistence.CodedEnumConverter;

public enum LabType implements CodedEnum {
    BLOOD("blood"),
    URINE("urine"),
    MISCELLANEOUS("miscellaneous");

    private final String code;

    LabType(String code) {
        this.code = code;
    }

    @JsonValue
    @Override
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static LabType fromCode(String code) {
        return CodedEnum.fromCode(LabType.class, code);
    }

    @Override
    public String toString() {
        return code;
    }

    @jakarta.persistence.Converter
    public static class Converter extends CodedEnumConverter<LabType> {
        public Converter() {
            super(LabType.class);
        }
    }
}
