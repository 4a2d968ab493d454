package fpt.com.patienttaskservices.domain.view.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One unsent item on the pending board. Lab/imaging items carry type and subtype, consultations carry the text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PendingItemDto {
    private String registrationNumber;
    private String patientName;
    private WorkItemCategory category;
    private String type;
    private String subtype;
    private String consult;

    @JsonFormat(pattern = Constants.DATETIME_PATTERN)
    private LocalDateTime dateTime;
}
