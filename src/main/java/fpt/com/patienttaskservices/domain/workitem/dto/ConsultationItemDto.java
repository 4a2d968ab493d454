package fpt.com.patienttaskservices.domain.workitem.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
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
public class ConsultationItemDto {
    private WorkItemTable table;
    private String registrationNumber;
    private String consult;

    @JsonFormat(pattern = Constants.DATETIME_PATTERN)
    private LocalDateTime dateTime;

    private TaskStatus taskStatus;
}
