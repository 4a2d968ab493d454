package fpt.com.patienttaskservices.domain.patient.repository;

import fpt.com.patienttaskservices.domain.patient.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Long> {

    Optional<Patient> findByRegistrationNumber(String registrationNumber);

    // uniqueness covers discharged patients too
    boolean existsByRegistrationNumber(String registrationNumber);

    boolean existsByRegistrationNumberAndIdNot(String registrationNumber, Long id);

    List<Patient> findByDischargedOrderByRegDateDescIdDesc(boolean discharged);

    List<Patient> findByRegistrationNumberIn(Collection<String> registrationNumbers);

    @Query("select p.location as location, count(p) as total from Patient p "
            + "where p.discharged = :discharged group by p.location")
    List<LocationCount> countByLocation(@Param("discharged") boolean discharged);

    // query arrives with backslash, % and _ already escaped
    @Query("select p from Patient p where p.discharged = :discharged "
            + "and (lower(p.patientName) like lower(concat('%', :query, '%')) escape '\\' "
            + "or lower(p.registrationNumber) like lower(concat('%', :query, '%')) escape '\\') "
            + "order by p.regDate desc, p.id desc")
    List<Patient> search(@Param("discharged") boolean discharged, @Param("query") String query);
}
