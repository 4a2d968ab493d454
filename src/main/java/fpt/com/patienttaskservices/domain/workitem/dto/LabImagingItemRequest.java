package fpt.com.patienttaskservices.domain.workitem.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Identifies an existing lab/imaging row by its natural key, plus the change to apply.
 * {@code subtype} is the current subtype (status change, delete); {@code newSubtype} is used by edits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabImagingItemRequest {
    private String registrationNumber;

    @JsonFormat(pattern = Constants.DATETIME_PATTERN)
    private LocalDateTime dateTime;

    private WorkItemCategory category;
    private String type;
    private String subtype;

    private String newSubtype;
    private TaskStatus status;

    public LabImagingKey toKey() {
        return LabImagingKey.of(registrationNumber, dateTime, WorkItemPayload.of(category, type, subtype));
    }

    public LabImagingEditKey toEditKey() {
        return LabImagingEditKey.of(registrationNumber, dateTime, category, type);
    }
}
