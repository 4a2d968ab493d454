package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.Consultation;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConsultationRepository extends ConsultationItemRepository<Consultation> {

    List<Consultation> findByTaskStatusOrderByDateTimeAscIdAsc(TaskStatus taskStatus);
}
