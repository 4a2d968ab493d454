package fpt.com.patienttaskservices.domain.patient.dto;

import fpt.com.patienttaskservices.domain.patient.entity.Gender;
import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Patient fields for create and update. The registration number here is the one to store;
 * on update it may differ from the key in the path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientRequest {

    @NotBlank
    private String registrationNumber;

    @NotBlank
    private String patientName;

    @NotNull
    @Positive
    private Integer age;

    @NotNull
    private Gender gender;

    @NotNull
    private WardLocation location;

    @Positive
    private Integer bedNumber;

    @NotBlank
    private String chiefComplaints;

    @NotBlank
    private String provisionalDiagnosis;

    private String miscNotes;

    @NotBlank
    private String contact;
}
