package fpt.com.patienttaskservices.domain.workitem.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.patienttaskservices.common.persistence.CodedEnum;
import fpt.com.patienttaskservices.common.persistence.CodedEnumConverter;

/**
 * Workflow state of a current task or consultation.
 * Intended order is unsent -> sent -> collected, collected being terminal.
 */
public enum TaskStatus implements CodedEnum {
    UNSENT("unsent"),
    SENT("sent"),
    COLLECTED("collected");

    private final String code;

    TaskStatus(String code) {
        this.code = code;
    }

    @JsonValue
    @Override
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static TaskStatus fromCode(String code) {
        return CodedEnum.fromCode(TaskStatus.class, code);
    }

    /**
     * True when moving from this status to {@code next} does not go backwards.
     * Rewriting the same status is allowed.
     */
    public boolean canMoveTo(TaskStatus next) {
        return next != null && next.ordinal() >= ordinal();
    }

    @Override
    public String toString() {
        return code;
    }

    @jakarta.persistence.Converter
    public static class Converter extends CodedEnumConverter<TaskStatus> {
        public Converter() {
            super(TaskStatus.class);
        }
    }
}
