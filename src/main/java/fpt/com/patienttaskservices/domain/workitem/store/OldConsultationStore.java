package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationAddResult;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationKey;
import fpt.com.patienttaskservices.domain.workitem.entity.OldConsultation;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.repository.OldConsultationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Archival consultations. One row per (registration number, text); the status column
 * is kept but not driven.
 */
@Slf4j
@Component
public class OldConsultationStore extends AbstractConsultationStore<OldConsultation> {

    public OldConsultationStore(OldConsultationRepository repository) {
        super(repository);
    }

    @Override
    public WorkItemTable table() {
        return WorkItemTable.OLDCONSULTATIONS;
    }

    @Override
    protected OldConsultation newItem() {
        return new OldConsultation();
    }

    @Override
    public ConsultationAddResult add(String registrationNumber, String consult) {
        if (repository.existsByRegistrationNumberAndConsult(registrationNumber, consult)) {
            log.warn("Archived consultation already exists for {}, not stored again", registrationNumber);
            return ConsultationAddResult.alreadyExists();
        }
        return ConsultationAddResult.created(toDto(insert(registrationNumber, consult)));
    }

    @Override
    public int changeStatus(ConsultationKey key, TaskStatus status, boolean enforceMonotonic) {
        throw new ValidationException("STATUS_NOT_SUPPORTED", Map.of("table", table().getStoreName()));
    }
}
