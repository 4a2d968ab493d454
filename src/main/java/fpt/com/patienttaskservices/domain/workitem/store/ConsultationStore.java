package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationAddResult;
import fpt.com.patienttaskservices.domain.workitem.entity.Consultation;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.repository.ConsultationRepository;
import org.springframework.stereotype.Component;

/**
 * Current consultations. The same text may be ordered more than once.
 */
@Component
public class ConsultationStore extends AbstractConsultationStore<Consultation> {

    public ConsultationStore(ConsultationRepository repository) {
        super(repository);
    }

    @Override
    public WorkItemTable table() {
        return WorkItemTable.CONSULTATIONS;
    }

    @Override
    protected Consultation newItem() {
        return new Consultation();
    }

    @Override
    public ConsultationAddResult add(String registrationNumber, String consult) {
        return ConsultationAddResult.created(toDto(insert(registrationNumber, consult)));
    }
}
