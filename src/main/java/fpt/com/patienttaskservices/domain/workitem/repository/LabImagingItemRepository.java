package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.AbstractLabImagingItem;
import fpt.com.patienttaskservices.domain.workitem.entity.ImagingType;
import fpt.com.patienttaskservices.domain.workitem.entity.LabType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Queries shared by the two lab/imaging relations. Every natural-key lookup constrains
 * the columns of one payload only.
 */
@NoRepositoryBean
public interface LabImagingItemRepository<T extends AbstractLabImagingItem> extends JpaRepository<T, Long> {

    List<T> findByRegistrationNumberOrderByDateTimeDescIdDesc(String registrationNumber);

    List<T> findByRegistrationNumberAndDateTimeAndLabTypeAndLabSubtype(
            String registrationNumber, LocalDateTime dateTime, LabType labType, String labSubtype);

    List<T> findByRegistrationNumberAndDateTimeAndImagingTypeAndImagingSubtype(
            String registrationNumber, LocalDateTime dateTime, ImagingType imagingType, String imagingSubtype);

    List<T> findByRegistrationNumberAndDateTimeAndLabType(
            String registrationNumber, LocalDateTime dateTime, LabType labType);

    List<T> findByRegistrationNumberAndDateTimeAndImagingType(
            String registrationNumber, LocalDateTime dateTime, ImagingType imagingType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update #{#entityName} i set i.registrationNumber = :newKey where i.registrationNumber = :oldKey")
    int reassignRegistrationNumber(@Param("oldKey") String oldKey, @Param("newKey") String newKey);
}
