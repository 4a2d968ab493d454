package fpt.com.patienttaskservices.support;

import fpt.com.patienttaskservices.domain.patient.dto.PatientRequest;
import fpt.com.patienttaskservices.domain.patient.entity.Gender;
import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Base for tests running against the in-memory store. The store outlives a single
 * Spring context, so every relation is emptied before each test.
 */
public abstract class StoreTestSupport {

    private static final List<String> RELATIONS =
            List.of("tasks", "oldlabs", "consultations", "oldconsultations", "patients");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void emptyStore() {
        RELATIONS.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }

    protected int countRows(String table, String registrationNumber) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE registrationNumber = ?", Integer.class, registrationNumber);
        return count == null ? 0 : count;
    }

    public static PatientRequest patientRequest(String registrationNumber, String name) {
        return PatientRequest.builder()
                .registrationNumber(registrationNumber)
                .patientName(name)
                .age(42)
                .gender(Gender.FEMALE)
                .location(WardLocation.WARD_FEMALE)
                .bedNumber(7)
                .chiefComplaints("Fever for three days")
                .provisionalDiagnosis("Enteric fever")
                .contact("555-0101")
                .build();
    }
}
