package fpt.com.patienttaskservices.domain.workitem.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LabImagingItemDto {
    private WorkItemTable table;
    private String registrationNumber;
    private WorkItemCategory category;
    private String type;
    private String subtype;

    @JsonFormat(pattern = Constants.DATETIME_PATTERN)
    private LocalDateTime dateTime;

    // absent for archival rows
    private TaskStatus taskStatus;
}
