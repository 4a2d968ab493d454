package fpt.com.patienttaskservices.domain.workitem.service;

import fpt.com.patienttaskservices.common.config.PatientTaskProperties;
import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.common.persistence.StoreReadiness;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationAddResult;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationKey;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingEditKey;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingKey;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.store.ConsultationLedgerStore;
import fpt.com.patienttaskservices.domain.workitem.store.LabImagingStore;
import fpt.com.patienttaskservices.event.EventPublisher;
import fpt.com.patienttaskservices.event.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Adds, edits, advances and deletes work items in the four patient-owned relations.
 * Update and delete return the affected-row count; zero means no row matched the key.
 */
@Slf4j
@Service
@Transactional
public class WorkItemLedgerService {

    private final Map<WorkItemTable, LabImagingStore> labImagingStores = new EnumMap<>(WorkItemTable.class);
    private final Map<WorkItemTable, ConsultationLedgerStore> consultationStores = new EnumMap<>(WorkItemTable.class);
    private final StoreReadiness storeReadiness;
    private final PatientTaskProperties properties;
    private final EventPublisher eventPublisher;

    public WorkItemLedgerService(List<LabImagingStore> labImagingStores,
                                 List<ConsultationLedgerStore> consultationStores,
                                 StoreReadiness storeReadiness,
                                 PatientTaskProperties properties,
                                 EventPublisher eventPublisher) {
        labImagingStores.forEach(store -> this.labImagingStores.put(store.table(), store));
        consultationStores.forEach(store -> this.consultationStores.put(store.table(), store));
        this.storeReadiness = storeReadiness;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    // ---- lab / imaging ----

    public LabImagingItemDto addLabOrImaging(WorkItemTable table, String registrationNumber, WorkItemPayload payload) {
        LabImagingStore store = labImagingStore(table);
        String key = requireRegistrationNumber(registrationNumber);
        if (payload == null) {
            throw new ValidationException("PAYLOAD_REQUIRED");
        }
        storeReadiness.ensureReady();

        LabImagingItemDto created = store.add(key, payload);
        log.info("Added {} to {} for patient {}", payload, table, key);
        eventPublisher.publish(EventType.WORK_ITEM_ADDED, key, table + " " + payload);
        return created;
    }

    public int advanceStatus(WorkItemTable table, LabImagingKey key, TaskStatus status) {
        LabImagingStore store = labImagingStore(table);
        requireKey(key);
        requireStatusTable(table);
        requireStatus(status);
        storeReadiness.ensureReady();

        int affected = store.changeStatus(key, status, properties.getStatus().isEnforceMonotonic());
        afterStatusChange(table, key.getRegistrationNumber(), status, affected);
        return affected;
    }

    /**
     * Rewrites the subtype of the rows matching registration number, timestamp and type.
     * A status may be written at the same time, on current tables only.
     */
    public int editSubtypeAndStatus(WorkItemTable table, LabImagingEditKey key, String newSubtype, TaskStatus newStatus) {
        LabImagingStore store = labImagingStore(table);
        requireKey(key);
        if (newSubtype == null || newSubtype.isBlank()) {
            throw new ValidationException("SUBTYPE_REQUIRED");
        }
        if (newStatus != null && !table.acceptsStatusChange()) {
            throw new ValidationException("STATUS_NOT_SUPPORTED", Map.of("table", table.getStoreName()));
        }
        storeReadiness.ensureReady();

        int affected = store.editSubtype(key, newSubtype.trim(), newStatus, properties.getStatus().isEnforceMonotonic());
        if (affected == 0) {
            log.debug("No {} row matched {} for subtype edit", table, key);
        } else {
            log.info("Edited {} {} row(s) for patient {}", affected, table, key.getRegistrationNumber());
            eventPublisher.publish(EventType.WORK_ITEM_EDITED, key.getRegistrationNumber(),
                    table + " " + key.getCategory() + " subtype -> " + newSubtype.trim());
        }
        return affected;
    }

    public int deleteItem(WorkItemTable table, LabImagingKey key) {
        LabImagingStore store = labImagingStore(table);
        requireKey(key);
        storeReadiness.ensureReady();

        int affected = store.delete(key);
        afterDelete(table, key.getRegistrationNumber(), affected);
        return affected;
    }

    @Transactional(readOnly = true)
    public List<LabImagingItemDto> findLabImaging(WorkItemTable table, String registrationNumber) {
        LabImagingStore store = labImagingStore(table);
        String key = requireRegistrationNumber(registrationNumber);
        storeReadiness.ensureReady();
        return store.findByPatient(key);
    }

    // ---- consultations ----

    public ConsultationAddResult addConsultation(WorkItemTable table, String registrationNumber, String consult) {
        ConsultationLedgerStore store = consultationStore(table);
        String key = requireRegistrationNumber(registrationNumber);
        if (consult == null || consult.isBlank()) {
            throw new ValidationException("CONSULT_REQUIRED");
        }
        storeReadiness.ensureReady();

        ConsultationAddResult result = store.add(key, consult.trim());
        if (result.isCreated()) {
            log.info("Added consultation to {} for patient {}", table, key);
            eventPublisher.publish(EventType.WORK_ITEM_ADDED, key, table + " consultation");
        }
        return result;
    }

    public int advanceStatus(WorkItemTable table, ConsultationKey key, TaskStatus status) {
        ConsultationLedgerStore store = consultationStore(table);
        requireKey(key);
        requireStatusTable(table);
        requireStatus(status);
        storeReadiness.ensureReady();

        int affected = store.changeStatus(key, status, properties.getStatus().isEnforceMonotonic());
        afterStatusChange(table, key.getRegistrationNumber(), status, affected);
        return affected;
    }

    public int deleteConsultation(WorkItemTable table, ConsultationKey key) {
        ConsultationLedgerStore store = consultationStore(table);
        requireKey(key);
        storeReadiness.ensureReady();

        int affected = store.delete(key);
        afterDelete(table, key.getRegistrationNumber(), affected);
        return affected;
    }

    @Transactional(readOnly = true)
    public List<ConsultationItemDto> findConsultations(WorkItemTable table, String registrationNumber) {
        ConsultationLedgerStore store = consultationStore(table);
        String key = requireRegistrationNumber(registrationNumber);
        storeReadiness.ensureReady();
        return store.findByPatient(key);
    }

    // ---- helpers ----

    private LabImagingStore labImagingStore(WorkItemTable table) {
        if (table == null) {
            throw new ValidationException("TABLE_REQUIRED");
        }
        LabImagingStore store = labImagingStores.get(table);
        if (store == null) {
            throw new ValidationException("NOT_A_LAB_IMAGING_TABLE", Map.of("table", table.getStoreName()));
        }
        return store;
    }

    private ConsultationLedgerStore consultationStore(WorkItemTable table) {
        if (table == null) {
            throw new ValidationException("TABLE_REQUIRED");
        }
        ConsultationLedgerStore store = consultationStores.get(table);
        if (store == null) {
            throw new ValidationException("NOT_A_CONSULTATION_TABLE", Map.of("table", table.getStoreName()));
        }
        return store;
    }

    private static String requireRegistrationNumber(String registrationNumber) {
        if (registrationNumber == null || registrationNumber.isBlank()) {
            throw new ValidationException("REGISTRATION_NUMBER_REQUIRED");
        }
        return registrationNumber.trim();
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new ValidationException("KEY_REQUIRED");
        }
    }

    private static void requireStatusTable(WorkItemTable table) {
        if (!table.acceptsStatusChange()) {
            throw new ValidationException("STATUS_NOT_SUPPORTED", Map.of("table", table.getStoreName()));
        }
    }

    private static void requireStatus(TaskStatus status) {
        if (status == null) {
            throw new ValidationException("STATUS_REQUIRED");
        }
    }

    private void afterStatusChange(WorkItemTable table, String registrationNumber, TaskStatus status, int affected) {
        if (affected == 0) {
            log.debug("No {} row matched for patient {}, status unchanged", table, registrationNumber);
            return;
        }
        log.info("Set {} {} row(s) to {} for patient {}", affected, table, status, registrationNumber);
        eventPublisher.publish(EventType.WORK_ITEM_STATUS_CHANGED, registrationNumber, table + " -> " + status);
    }

    private void afterDelete(WorkItemTable table, String registrationNumber, int affected) {
        if (affected == 0) {
            log.debug("No {} row matched for patient {}, nothing deleted", table, registrationNumber);
            return;
        }
        log.info("Deleted {} {} row(s) for patient {}", affected, table, registrationNumber);
        eventPublisher.publish(EventType.WORK_ITEM_DELETED, registrationNumber, table + " x" + affected);
    }
}
