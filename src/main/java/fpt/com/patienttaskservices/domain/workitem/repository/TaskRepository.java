package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.Task;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskRepository extends LabImagingItemRepository<Task> {

    List<Task> findByTaskStatusAndLabTypeIsNotNullOrderByDateTimeAscIdAsc(TaskStatus taskStatus);

    List<Task> findByTaskStatusAndImagingTypeIsNotNullOrderByDateTimeAscIdAsc(TaskStatus taskStatus);
}
