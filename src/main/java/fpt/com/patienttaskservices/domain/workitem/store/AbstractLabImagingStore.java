package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingEditKey;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingKey;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.AbstractLabImagingItem;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import fpt.com.patienttaskservices.domain.workitem.repository.LabImagingItemRepository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Natural-key lookups resolve to rows of one payload category only, then the
 * change is applied to those rows by id.
 */
public abstract class AbstractLabImagingStore<T extends AbstractLabImagingItem> implements LabImagingStore {

    protected final LabImagingItemRepository<T> repository;

    protected AbstractLabImagingStore(LabImagingItemRepository<T> repository) {
        this.repository = repository;
    }

    protected abstract T newItem();

    /** Status of the row, or null when the relation has no status column. */
    protected abstract TaskStatus statusOf(T item);

    protected abstract void applyStatus(List<T> rows, TaskStatus status, boolean enforceMonotonic);

    @Override
    public LabImagingItemDto add(String registrationNumber, WorkItemPayload payload) {
        T item = newItem();
        item.setRegistrationNumber(registrationNumber);
        if (payload.getCategory() == WorkItemCategory.LAB) {
            item.assignLab(payload.getLabType(), payload.getSubtype());
        } else {
            item.assignImaging(payload.getImagingType(), payload.getSubtype());
        }
        return toDto(repository.save(item));
    }

    @Override
    public List<LabImagingItemDto> findByPatient(String registrationNumber) {
        return repository.findByRegistrationNumberOrderByDateTimeDescIdDesc(registrationNumber)
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Override
    public int changeStatus(LabImagingKey key, TaskStatus status, boolean enforceMonotonic) {
        List<T> rows = matching(key);
        applyStatus(rows, status, enforceMonotonic);
        repository.saveAll(rows);
        return rows.size();
    }

    @Override
    public int editSubtype(LabImagingEditKey key, String newSubtype, TaskStatus newStatus, boolean enforceMonotonic) {
        List<T> rows = matching(key);
        if (newStatus != null) {
            applyStatus(rows, newStatus, enforceMonotonic);
        }
        rows.forEach(row -> row.changeSubtype(newSubtype));
        repository.saveAll(rows);
        return rows.size();
    }

    @Override
    public int delete(LabImagingKey key) {
        List<Long> ids = matching(key).stream()
                .map(AbstractLabImagingItem::getId)
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

    protected List<T> matching(LabImagingKey key) {
        WorkItemPayload payload = key.getPayload();
        if (payload.getCategory() == WorkItemCategory.LAB) {
            return repository.findByRegistrationNumberAndDateTimeAndLabTypeAndLabSubtype(
                    key.getRegistrationNumber(), key.getDateTime(), payload.getLabType(), payload.getSubtype());
        }
        return repository.findByRegistrationNumberAndDateTimeAndImagingTypeAndImagingSubtype(
                key.getRegistrationNumber(), key.getDateTime(), payload.getImagingType(), payload.getSubtype());
    }

    protected List<T> matching(LabImagingEditKey key) {
        if (key.getCategory() == WorkItemCategory.LAB) {
            return repository.findByRegistrationNumberAndDateTimeAndLabType(
                    key.getRegistrationNumber(), key.getDateTime(), key.getLabType());
        }
        return repository.findByRegistrationNumberAndDateTimeAndImagingType(
                key.getRegistrationNumber(), key.getDateTime(), key.getImagingType());
    }

    protected LabImagingItemDto toDto(T item) {
        return LabImagingItemDto.builder()
                .table(table())
                .registrationNumber(item.getRegistrationNumber())
                .category(item.getCategory())
                .type(item.getTypeCode())
                .subtype(item.getSubtype())
                .dateTime(item.getDateTime())
                .taskStatus(statusOf(item))
                .build();
    }
}
