package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.domain.workitem.entity.Task;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.repository.TaskRepository;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TaskStore extends AbstractLabImagingStore<Task> {

    public TaskStore(TaskRepository repository) {
        super(repository);
    }

    @Override
    public WorkItemTable table() {
        return WorkItemTable.TASKS;
    }

    @Override
    protected Task newItem() {
        Task task = new Task();
        task.setTaskStatus(TaskStatus.UNSENT);
        return task;
    }

    @Override
    protected TaskStatus statusOf(Task item) {
        return item.getTaskStatus();
    }

    @Override
    protected void applyStatus(List<Task> rows, TaskStatus status, boolean enforceMonotonic) {
        // all rows are checked before any is changed
        rows.forEach(row -> StatusTransitions.check(row.getTaskStatus(), status, enforceMonotonic));
        rows.forEach(row -> row.setTaskStatus(status));
    }
}
