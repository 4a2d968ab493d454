package fpt.com.patienttaskservices.domain.patient.controller;

import fpt.com.patienttaskservices.common.exception.DuplicateRegistrationException;
import fpt.com.patienttaskservices.common.exception.NotFoundException;
import fpt.com.patienttaskservices.common.exception.StoreAccessException;
import fpt.com.patienttaskservices.common.exception.StoreNotReadyException;
import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.patient.dto.PatientRequest;
import fpt.com.patienttaskservices.domain.patient.entity.Gender;
import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import fpt.com.patienttaskservices.domain.patient.service.PatientService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PatientController.class)
class PatientControllerTest {

    private static final String BODY = """
            {
              "registrationNumber": "R1",
              "patientName": "Jane Doe",
              "age": 42,
              "gender": "Female",
              "location": "Ward Female",
              "bedNumber": 7,
              "chiefComplaints": "Fever",
              "provisionalDiagnosis": "Enteric fever",
              "contact": "555-0101"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PatientService patientService;

    @Test
    void createReturnsCreatedPatient() throws Exception {
        when(patientService.createPatient(any(PatientRequest.class))).thenReturn(PatientDTO.builder()
                .registrationNumber("R1")
                .patientName("Jane Doe")
                .gender(Gender.FEMALE)
                .location(WardLocation.WARD_FEMALE)
                .regDate(LocalDate.of(2024, 3, 5))
                .build());

        mockMvc.perform(post("/api/v1/patients").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.location").value("Ward Female"))
                .andExpect(jsonPath("$.data.regDate").value("2024-03-05"))
                .andExpect(jsonPath("$.data.id").doesNotExist());
    }

    @Test
    void validationFailureIsBadRequest() throws Exception {
        when(patientService.createPatient(any(PatientRequest.class)))
                .thenThrow(new ValidationException("VALIDATION_FAILED", Map.of("age", "must be greater than 0")));

        mockMvc.perform(post("/api/v1/patients").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.data.age").exists());
    }

    @Test
    void unknownGenderCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/patients").contentType(MediaType.APPLICATION_JSON)
                        .content(BODY.replace("\"Female\"", "\"Unknown\"")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        when(patientService.updatePatient(eq("R1"), any(PatientRequest.class)))
                .thenThrow(new DuplicateRegistrationException("R2"));

        mockMvc.perform(put("/api/v1/patients/R1").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("REGISTRATION_NUMBER_EXISTS"));
    }

    @Test
    void unknownPatientIsNotFound() throws Exception {
        when(patientService.getPatient("R9")).thenThrow(NotFoundException.patient("R9"));

        mockMvc.perform(get("/api/v1/patients/R9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("PATIENT_NOT_FOUND"));
    }

    @Test
    void storeNotReadyIsServiceUnavailable() throws Exception {
        when(patientService.discharge("R1")).thenThrow(new StoreNotReadyException());

        mockMvc.perform(post("/api/v1/patients/R1/discharge"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("STORE_NOT_INITIALIZED"));
    }

    @Test
    void storeFailureIsGenericServerError() throws Exception {
        when(patientService.readmit("R1")).thenThrow(new StoreAccessException(new IllegalStateException("io")));

        mockMvc.perform(post("/api/v1/patients/R1/readmit"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("STORE_IO_ERROR"));
    }
}
