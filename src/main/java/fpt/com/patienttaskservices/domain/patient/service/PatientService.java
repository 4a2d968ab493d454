package fpt.com.patienttaskservices.domain.patient.service;

import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.common.exception.DuplicateRegistrationException;
import fpt.com.patienttaskservices.common.exception.NotFoundException;
import fpt.com.patienttaskservices.common.exception.StoreAccessException;
import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.common.persistence.StoreReadiness;
import fpt.com.patienttaskservices.domain.identity.service.IdentityPropagator;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.patient.dto.PatientRequest;
import fpt.com.patienttaskservices.domain.patient.entity.Patient;
import fpt.com.patienttaskservices.domain.patient.repository.PatientRepository;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.event.EventPublisher;
import fpt.com.patienttaskservices.event.EventType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class PatientService {

    private final PatientRepository patientRepository;
    private final IdentityPropagator identityPropagator;
    private final StoreReadiness storeReadiness;
    private final EventPublisher eventPublisher;
    private final Validator validator;
    private final Clock clock;

    // --- Helpers ---

    private void validatePatientData(PatientRequest request) {
        if (request == null) {
            throw new ValidationException(Constants.ERR_VALIDATION);
        }
        Set<ConstraintViolation<PatientRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, Object> fields = new TreeMap<>();
            for (ConstraintViolation<PatientRequest> violation : violations) {
                fields.put(violation.getPropertyPath().toString(), violation.getMessage());
            }
            throw new ValidationException(Constants.ERR_VALIDATION, fields);
        }
    }

    private static String requireKey(String registrationNumber) {
        if (registrationNumber == null || registrationNumber.isBlank()) {
            throw new ValidationException("REGISTRATION_NUMBER_REQUIRED");
        }
        return registrationNumber.trim();
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Patient findExisting(String registrationNumber) {
        return patientRepository.findByRegistrationNumber(registrationNumber)
                .orElseThrow(() -> NotFoundException.patient(registrationNumber));
    }

    private void applyFields(Patient patient, PatientRequest request) {
        patient.setRegistrationNumber(request.getRegistrationNumber().trim());
        patient.setPatientName(request.getPatientName().trim());
        patient.setAge(request.getAge());
        patient.setGender(request.getGender());
        patient.setLocation(request.getLocation());
        patient.setBedNumber(request.getBedNumber());
        patient.setChiefComplaints(request.getChiefComplaints().trim());
        patient.setProvisionalDiagnosis(request.getProvisionalDiagnosis().trim());
        patient.setMiscNotes(trimToNull(request.getMiscNotes()));
        patient.setContact(request.getContact().trim());
    }

    public static PatientDTO mapToDTO(Patient patient) {
        return PatientDTO.builder()
                .registrationNumber(patient.getRegistrationNumber())
                .patientName(patient.getPatientName())
                .age(patient.getAge())
                .gender(patient.getGender())
                .location(patient.getLocation())
                .bedNumber(patient.getBedNumber())
                .chiefComplaints(patient.getChiefComplaints())
                .provisionalDiagnosis(patient.getProvisionalDiagnosis())
                .miscNotes(patient.getMiscNotes())
                .contact(patient.getContact())
                .regDate(patient.getRegDate())
                .discharged(patient.isDischarged())
                .build();
    }

    // --- Main Methods ---

    @Transactional
    public PatientDTO createPatient(PatientRequest request) {
        validatePatientData(request);
        storeReadiness.ensureReady();

        String registrationNumber = request.getRegistrationNumber().trim();
        if (patientRepository.existsByRegistrationNumber(registrationNumber)) {
            throw new DuplicateRegistrationException(registrationNumber);
        }

        Patient patient = new Patient();
        applyFields(patient, request);
        patient.setRegDate(LocalDate.now(clock));
        patient.setDischarged(false);

        Patient saved = patientRepository.save(patient);
        log.info("Registered patient {} in {}", saved.getRegistrationNumber(), saved.getLocation());
        eventPublisher.publish(EventType.PATIENT_CREATED, saved.getRegistrationNumber(), saved.getPatientName());
        return mapToDTO(saved);
    }

    /**
     * Rewrites the patient's fields. When the registration number changes, every work item of the
     * patient is moved to the new number in the same transaction; any store failure leaves both the
     * patient row and its work items on the original number.
     */
    @Transactional
    public PatientDTO updatePatient(String originalKey, PatientRequest request) {
        String oldKey = requireKey(originalKey);
        validatePatientData(request);
        storeReadiness.ensureReady();

        Patient existing = findExisting(oldKey);
        String newKey = request.getRegistrationNumber().trim();
        boolean renamed = !newKey.equals(oldKey);
        if (renamed && patientRepository.existsByRegistrationNumberAndIdNot(newKey, existing.getId())) {
            throw new DuplicateRegistrationException(newKey);
        }

        applyFields(existing, request);
        try {
            Patient saved = patientRepository.saveAndFlush(existing);
            if (renamed) {
                Map<WorkItemTable, Integer> moved = identityPropagator.propagateRename(oldKey, newKey);
                log.info("Patient {} renamed to {}, moved work items {}", oldKey, newKey, moved);
                eventPublisher.publish(EventType.PATIENT_RENAMED, newKey, oldKey + " -> " + newKey);
            }
            eventPublisher.publish(EventType.PATIENT_UPDATED, newKey, saved.getPatientName());
            return mapToDTO(saved);
        } catch (DataAccessException e) {
            log.warn("Update of patient {} failed, rolling back: {}", oldKey, e.getMessage());
            throw new StoreAccessException(e);
        }
    }

    /**
     * Idempotent: setting the flag it already has is a no-op success.
     */
    @Transactional
    public PatientDTO setDischarged(String registrationNumber, boolean discharged) {
        String key = requireKey(registrationNumber);
        storeReadiness.ensureReady();

        Patient patient = findExisting(key);
        if (patient.isDischarged() == discharged) {
            log.debug("Patient {} already has discharged={}", key, discharged);
            return mapToDTO(patient);
        }
        patient.setDischarged(discharged);
        Patient saved = patientRepository.save(patient);
        log.info("Patient {} {}", key, discharged ? "discharged" : "re-admitted");
        eventPublisher.publish(discharged ? EventType.PATIENT_DISCHARGED : EventType.PATIENT_READMITTED,
                key, saved.getPatientName());
        return mapToDTO(saved);
    }

    @Transactional
    public PatientDTO discharge(String registrationNumber) {
        return setDischarged(registrationNumber, true);
    }

    @Transactional
    public PatientDTO readmit(String registrationNumber) {
        return setDischarged(registrationNumber, false);
    }

    @Transactional(readOnly = true)
    public PatientDTO getPatient(String registrationNumber) {
        String key = requireKey(registrationNumber);
        storeReadiness.ensureReady();
        return mapToDTO(findExisting(key));
    }
}
