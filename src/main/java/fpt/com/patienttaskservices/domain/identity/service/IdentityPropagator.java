package fpt.com.patienttaskservices.domain.identity.service;

import fpt.com.patienttaskservices.common.config.PatientTaskProperties;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.store.PatientOwnedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Carries a registration number change into every relation that references the patient by value.
 * Never opens a transaction of its own: the patient row update and the cascade commit or roll back together.
 */
@Slf4j
@Component
public class IdentityPropagator {

    private final List<PatientOwnedStore> stores;
    private final PatientTaskProperties properties;

    public IdentityPropagator(List<PatientOwnedStore> stores, PatientTaskProperties properties) {
        this.stores = stores.stream()
                .sorted(Comparator.comparing(PatientOwnedStore::table))
                .collect(Collectors.toList());
        this.properties = properties;
    }

    /**
     * @return rows moved per relation; relations skipped by configuration are absent
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<WorkItemTable, Integer> propagateRename(String oldKey, String newKey) {
        boolean includeConsultations = properties.getRename().isCascadeConsultations();
        Map<WorkItemTable, Integer> moved = new EnumMap<>(WorkItemTable.class);

        for (PatientOwnedStore store : stores) {
            WorkItemTable table = store.table();
            if (table.isConsultation() && !includeConsultations) {
                continue;
            }
            int rows = store.reassignRegistrationNumber(oldKey, newKey);
            moved.put(table, rows);
            log.debug("Moved {} {} row(s) from {} to {}", rows, table, oldKey, newKey);
        }

        if (!includeConsultations) {
            log.warn("Consultation history of {} left on the old registration number", oldKey);
        }
        return moved;
    }
}
