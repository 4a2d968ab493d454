package fpt.com.patienttaskservices.domain.patient.service;

import fpt.com.patienttaskservices.common.exception.DuplicateRegistrationException;
import fpt.com.patienttaskservices.common.exception.NotFoundException;
import fpt.com.patienttaskservices.common.exception.StoreAccessException;
import fpt.com.patienttaskservices.common.exception.StoreNotReadyException;
import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.common.persistence.StoreReadiness;
import fpt.com.patienttaskservices.domain.identity.service.IdentityPropagator;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.patient.dto.PatientRequest;
import fpt.com.patienttaskservices.domain.patient.entity.Patient;
import fpt.com.patienttaskservices.domain.patient.repository.PatientRepository;
import fpt.com.patienttaskservices.event.EventPublisher;
import fpt.com.patienttaskservices.support.StoreTestSupport;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatientServiceTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    @Mock
    private PatientRepository patientRepository;
    @Mock
    private IdentityPropagator identityPropagator;
    @Mock
    private StoreReadiness storeReadiness;
    @Mock
    private EventPublisher eventPublisher;

    private PatientService patientService;

    @BeforeEach
    void setUp() {
        patientService = new PatientService(patientRepository, identityPropagator, storeReadiness,
                eventPublisher, VALIDATOR, CLOCK);
    }

    private static Patient stored(String registrationNumber) {
        return Patient.builder()
                .id(1L)
                .registrationNumber(registrationNumber)
                .patientName("Jane Doe")
                .regDate(LocalDate.of(2024, 1, 1))
                .build();
    }

    @Test
    void createPatient_setsAdmissionDateAndAdmittedFlag() {
        when(patientRepository.existsByRegistrationNumber("R1")).thenReturn(false);
        when(patientRepository.save(any(Patient.class))).thenAnswer(inv -> inv.getArgument(0));

        PatientRequest request = StoreTestSupport.patientRequest("  R1 ", " Jane Doe ");
        request.setMiscNotes("   ");
        PatientDTO created = patientService.createPatient(request);

        assertThat(created.getRegistrationNumber()).isEqualTo("R1");
        assertThat(created.getPatientName()).isEqualTo("Jane Doe");
        assertThat(created.getRegDate()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(created.isDischarged()).isFalse();
        assertThat(created.getMiscNotes()).isNull();
    }

    @Test
    void createPatient_rejectsInvalidFieldsBeforeTouchingStore() {
        PatientRequest request = StoreTestSupport.patientRequest("R1", "");
        request.setAge(0);
        request.setBedNumber(-3);

        assertThatThrownBy(() -> patientService.createPatient(request))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getParams())
                        .containsOnlyKeys("patientName", "age", "bedNumber"));

        verifyNoInteractions(patientRepository, storeReadiness);
    }

    @Test
    void createPatient_withoutBedNumberIsAccepted() {
        when(patientRepository.existsByRegistrationNumber("R1")).thenReturn(false);
        when(patientRepository.save(any(Patient.class))).thenAnswer(inv -> inv.getArgument(0));

        PatientRequest request = StoreTestSupport.patientRequest("R1", "Jane Doe");
        request.setBedNumber(null);

        assertThat(patientService.createPatient(request).getBedNumber()).isNull();
    }

    @Test
    void createPatient_duplicateRegistrationNumberIsRejected() {
        when(patientRepository.existsByRegistrationNumber("R1")).thenReturn(true);

        assertThatThrownBy(() -> patientService.createPatient(StoreTestSupport.patientRequest("R1", "Jane Doe")))
                .isInstanceOf(DuplicateRegistrationException.class);
        verify(patientRepository, never()).save(any());
    }

    @Test
    void createPatient_failsWhenStoreNotReady() {
        doThrow(new StoreNotReadyException()).when(storeReadiness).ensureReady();

        assertThatThrownBy(() -> patientService.createPatient(StoreTestSupport.patientRequest("R1", "Jane Doe")))
                .isInstanceOf(StoreNotReadyException.class);
        verifyNoInteractions(patientRepository);
    }

    @Test
    void updatePatient_sameKeyDoesNotCascade() {
        when(patientRepository.findByRegistrationNumber("R1")).thenReturn(Optional.of(stored("R1")));
        when(patientRepository.saveAndFlush(any(Patient.class))).thenAnswer(inv -> inv.getArgument(0));

        PatientDTO updated = patientService.updatePatient("R1", StoreTestSupport.patientRequest("R1", "Jane Roe"));

        assertThat(updated.getPatientName()).isEqualTo("Jane Roe");
        assertThat(updated.getRegDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        verifyNoInteractions(identityPropagator);
    }

    @Test
    void updatePatient_newKeyCascadesToWorkItems() {
        when(patientRepository.findByRegistrationNumber("R100")).thenReturn(Optional.of(stored("R100")));
        when(patientRepository.existsByRegistrationNumberAndIdNot("R200", 1L)).thenReturn(false);
        when(patientRepository.saveAndFlush(any(Patient.class))).thenAnswer(inv -> inv.getArgument(0));
        when(identityPropagator.propagateRename("R100", "R200")).thenReturn(Map.of());

        PatientDTO updated = patientService.updatePatient("R100", StoreTestSupport.patientRequest("R200", "Jane Doe"));

        assertThat(updated.getRegistrationNumber()).isEqualTo("R200");
        verify(identityPropagator).propagateRename("R100", "R200");
    }

    @Test
    void updatePatient_renameIntoTakenKeyIsRejected() {
        when(patientRepository.findByRegistrationNumber("R100")).thenReturn(Optional.of(stored("R100")));
        when(patientRepository.existsByRegistrationNumberAndIdNot("R200", 1L)).thenReturn(true);

        assertThatThrownBy(() -> patientService.updatePatient("R100", StoreTestSupport.patientRequest("R200", "Jane Doe")))
                .isInstanceOf(DuplicateRegistrationException.class);
        verify(patientRepository, never()).saveAndFlush(any());
        verifyNoInteractions(identityPropagator);
    }

    @Test
    void updatePatient_cascadeFailureSurfacesAsStoreError() {
        when(patientRepository.findByRegistrationNumber("R100")).thenReturn(Optional.of(stored("R100")));
        when(patientRepository.existsByRegistrationNumberAndIdNot("R200", 1L)).thenReturn(false);
        when(patientRepository.saveAndFlush(any(Patient.class))).thenAnswer(inv -> inv.getArgument(0));
        when(identityPropagator.propagateRename(anyString(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        assertThatThrownBy(() -> patientService.updatePatient("R100", StoreTestSupport.patientRequest("R200", "Jane Doe")))
                .isInstanceOf(StoreAccessException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void updatePatient_unknownKeyIsNotFound() {
        when(patientRepository.findByRegistrationNumber("R9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> patientService.updatePatient("R9", StoreTestSupport.patientRequest("R9", "Jane Doe")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("PATIENT_NOT_FOUND");
    }

    @Test
    void discharge_alreadyDischargedIsNoOp() {
        Patient patient = stored("R1");
        patient.setDischarged(true);
        when(patientRepository.findByRegistrationNumber("R1")).thenReturn(Optional.of(patient));

        assertThat(patientService.discharge("R1").isDischarged()).isTrue();
        verify(patientRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void readmit_unknownKeyIsNotFound() {
        when(patientRepository.findByRegistrationNumber("R9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> patientService.readmit("R9")).isInstanceOf(NotFoundException.class);
    }
}
