package fpt.com.patienttaskservices.domain.workitem.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four relations that hold work items for a patient.
 */
public enum WorkItemTable {
    TASKS("tasks", true, true, Shape.LAB_IMAGING),
    OLDLABS("oldlabs", false, false, Shape.LAB_IMAGING),
    CONSULTATIONS("consultations", true, true, Shape.CONSULTATION),
    // archival consultations keep a status column, archival labs do not
    OLDCONSULTATIONS("oldconsultations", false, true, Shape.CONSULTATION);

    public enum Shape {
        LAB_IMAGING,
        CONSULTATION
    }

    private final String storeName;
    private final boolean current;
    private final boolean statusColumn;
    private final Shape shape;

    WorkItemTable(String storeName, boolean current, boolean statusColumn, Shape shape) {
        this.storeName = storeName;
        this.current = current;
        this.statusColumn = statusColumn;
        this.shape = shape;
    }

    @JsonValue
    public String getStoreName() {
        return storeName;
    }

    public boolean hasStatusColumn() {
        return statusColumn;
    }

    public boolean isConsultation() {
        return shape == Shape.CONSULTATION;
    }

    /** Status transitions are only driven on current tables. */
    public boolean acceptsStatusChange() {
        return current && statusColumn;
    }

    @JsonCreator
    public static WorkItemTable fromStoreName(String value) {
        if (value == null) {
            return null;
        }
        for (WorkItemTable table : values()) {
            if (table.storeName.equalsIgnoreCase(value.trim()) || table.name().equalsIgnoreCase(value.trim())) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown work item table: " + value);
    }

    @Override
    public String toString() {
        return storeName;
    }
}
