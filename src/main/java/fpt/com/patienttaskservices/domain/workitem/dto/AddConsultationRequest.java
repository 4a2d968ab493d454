package fpt.com.patienttaskservices.domain.workitem.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddConsultationRequest {
    private String registrationNumber;
    private String consult;
}
