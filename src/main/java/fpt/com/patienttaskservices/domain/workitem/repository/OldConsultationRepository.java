package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.OldConsultation;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OldConsultationRepository extends ConsultationItemRepository<OldConsultation> {

    List<OldConsultation> findByTaskStatusOrderByDateTimeAscIdAsc(TaskStatus taskStatus);
}
