package fpt.com.patienttaskservices.event;

/**
 * Event codes raised by the patient registry and the work-item ledger.
 */
public enum EventType {
    PATIENT_CREATED("E_00001"),
    PATIENT_UPDATED("E_00002"),
    PATIENT_RENAMED("E_00003"),
    PATIENT_DISCHARGED("E_00004"),
    PATIENT_READMITTED("E_00005"),
    WORK_ITEM_ADDED("E_00006"),
    WORK_ITEM_STATUS_CHANGED("E_00007"),
    WORK_ITEM_EDITED("E_00008"),
    WORK_ITEM_DELETED("E_00009");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
