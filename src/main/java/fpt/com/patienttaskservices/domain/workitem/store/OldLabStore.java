package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.entity.OldLab;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.repository.OldLabRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class OldLabStore extends AbstractLabImagingStore<OldLab> {

    public OldLabStore(OldLabRepository repository) {
        super(repository);
    }

    @Override
    public WorkItemTable table() {
        return WorkItemTable.OLDLABS;
    }

    @Override
    protected OldLab newItem() {
        return new OldLab();
    }

    @Override
    protected TaskStatus statusOf(OldLab item) {
        return null;
    }

    @Override
    protected void applyStatus(List<OldLab> rows, TaskStatus status, boolean enforceMonotonic) {
        throw new ValidationException("STATUS_NOT_SUPPORTED", Map.of("table", table().getStoreName()));
    }
}
