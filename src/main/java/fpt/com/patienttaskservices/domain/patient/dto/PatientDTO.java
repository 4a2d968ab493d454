package fpt.com.patienttaskservices.domain.patient.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.patient.entity.Gender;
import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientDTO {
    private String registrationNumber;
    private String patientName;
    private Integer age;
    private Gender gender;
    private WardLocation location;
    private Integer bedNumber;
    private String chiefComplaints;
    private String provisionalDiagnosis;
    private String miscNotes;
    private String contact;

    @JsonFormat(pattern = Constants.DATE_PATTERN)
    private LocalDate regDate;

    private boolean discharged;
}
