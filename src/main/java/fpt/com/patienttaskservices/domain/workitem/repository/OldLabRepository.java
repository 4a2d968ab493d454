package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.OldLab;
import org.springframework.stereotype.Repository;

@Repository
public interface OldLabRepository extends LabImagingItemRepository<OldLab> {
}
