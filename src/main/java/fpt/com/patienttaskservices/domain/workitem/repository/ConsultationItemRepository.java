package fpt.com.patienttaskservices.domain.workitem.repository;

import fpt.com.patienttaskservices.domain.workitem.entity.AbstractConsultation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

@NoRepositoryBean
public interface ConsultationItemRepository<T extends AbstractConsultation> extends JpaRepository<T, Long> {

    List<T> findByRegistrationNumberOrderByDateTimeDescIdDesc(String registrationNumber);

    List<T> findByRegistrationNumberAndDateTimeAndConsult(
            String registrationNumber, LocalDateTime dateTime, String consult);

    boolean existsByRegistrationNumberAndConsult(String registrationNumber, String consult);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update #{#entityName} c set c.registrationNumber = :newKey where c.registrationNumber = :oldKey")
    int reassignRegistrationNumber(@Param("oldKey") String oldKey, @Param("newKey") String newKey);
}
