package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddLabImagingRequest {
    private String registrationNumber;
    private WorkItemCategory category;
    private String type;
    private String subtype;
}
