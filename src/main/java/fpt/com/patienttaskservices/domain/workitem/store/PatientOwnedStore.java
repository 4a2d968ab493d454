package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;

/**
 * A relation whose rows point at a patient by registration number value.
 */
public interface PatientOwnedStore {

    WorkItemTable table();

    /**
     * Moves every row of {@code oldKey} onto {@code newKey}. Must run inside the caller's transaction.
     *
     * @return number of rows moved
     */
    int reassignRegistrationNumber(String oldKey, String newKey);
}
