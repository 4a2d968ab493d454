package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationAddResult;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationKey;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;

import java.util.List;

/**
 * One implementation per consultation relation ({@code consultations}, {@code oldconsultations}).
 */
public interface ConsultationLedgerStore extends PatientOwnedStore {

    ConsultationAddResult add(String registrationNumber, String consult);

    List<ConsultationItemDto> findByPatient(String registrationNumber);

    int changeStatus(ConsultationKey key, TaskStatus status, boolean enforceMonotonic);

    int delete(ConsultationKey key);
}
