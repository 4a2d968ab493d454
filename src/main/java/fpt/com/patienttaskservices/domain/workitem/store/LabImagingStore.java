package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingEditKey;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingKey;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;

import java.util.List;

/**
 * One implementation per lab/imaging relation ({@code tasks}, {@code oldlabs}).
 * Mutations return the number of affected rows; zero means nothing matched.
 */
public interface LabImagingStore extends PatientOwnedStore {

    LabImagingItemDto add(String registrationNumber, WorkItemPayload payload);

    List<LabImagingItemDto> findByPatient(String registrationNumber);

    int changeStatus(LabImagingKey key, TaskStatus status, boolean enforceMonotonic);

    int editSubtype(LabImagingEditKey key, String newSubtype, TaskStatus newStatus, boolean enforceMonotonic);

    int delete(LabImagingKey key);
}
