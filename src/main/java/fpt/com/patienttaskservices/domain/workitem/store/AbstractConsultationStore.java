package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationKey;
import fpt.com.patienttaskservices.domain.workitem.entity.AbstractConsultation;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.repository.ConsultationItemRepository;

import java.util.List;
import java.util.stream.Collectors;

public abstract class AbstractConsultationStore<T extends AbstractConsultation> implements ConsultationLedgerStore {

    protected final ConsultationItemRepository<T> repository;

    protected AbstractConsultationStore(ConsultationItemRepository<T> repository) {
        this.repository = repository;
    }

    protected abstract T newItem();

    protected T insert(String registrationNumber, String consult) {
        T item = newItem();
        item.setRegistrationNumber(registrationNumber);
        item.setConsult(consult);
        item.setTaskStatus(TaskStatus.UNSENT);
        return repository.save(item);
    }

    @Override
    public List<ConsultationItemDto> findByPatient(String registrationNumber) {
        return repository.findByRegistrationNumberOrderByDateTimeDescIdDesc(registrationNumber)
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Override
    public int changeStatus(ConsultationKey key, TaskStatus status, boolean enforceMonotonic) {
        List<T> rows = matching(key);
        rows.forEach(row -> StatusTransitions.check(row.getTaskStatus(), status, enforceMonotonic));
        rows.forEach(row -> row.setTaskStatus(status));
        repository.saveAll(rows);
        return rows.size();
    }

    @Override
    public int delete(ConsultationKey key) {
        List<Long> ids = matching(key).stream()
                .map(AbstractConsultation::getId)
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            return 0;
        }
        repository.deleteAllByIdInBatch(ids);
        return ids.size();
    }

    @Override
    public int reassignRegistrationNumber(String oldKey, String newKey) {
        return repository.reassignRegistrationNumber(oldKey, newKey);
    }

    protected List<T> matching(ConsultationKey key) {
        return repository.findByRegistrationNumberAndDateTimeAndConsult(
                key.getRegistrationNumber(), key.getDateTime(), key.getConsult());
    }

    protected ConsultationItemDto toDto(T item) {
        return ConsultationItemDto.builder()
                .table(table())
                .registrationNumber(item.getRegistrationNumber())
                .consult(item.getConsult())
                .dateTime(item.getDateTime())
                .taskStatus(item.getTaskStatus())
                .build();
    }
}
