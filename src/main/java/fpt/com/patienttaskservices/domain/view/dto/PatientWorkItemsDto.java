package fpt.com.patienttaskservices.domain.view.dto;

import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientWorkItemsDto {
    // null when no patient holds the registration number
    private PatientDTO patient;

    private List<LabImagingItemDto> currentLabs;
    private List<LabImagingItemDto> currentImaging;
    private List<LabImagingItemDto> archivedLabs;
    private List<LabImagingItemDto> archivedImaging;
    private List<ConsultationItemDto> consultations;
    private List<ConsultationItemDto> archivedConsultations;
}
