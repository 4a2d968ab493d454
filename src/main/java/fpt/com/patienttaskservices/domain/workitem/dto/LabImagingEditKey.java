package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.entity.ImagingType;
import fpt.com.patienttaskservices.domain.workitem.entity.LabType;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Key used by subtype edits: registration number, timestamp and type, without the subtype being edited.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabImagingEditKey {

    String registrationNumber;
    LocalDateTime dateTime;
    WorkItemCategory category;
    LabType labType;
    ImagingType imagingType;

    public static LabImagingEditKey lab(String registrationNumber, LocalDateTime dateTime, LabType type) {
        if (type == null) {
            throw new ValidationException("LAB_TYPE_REQUIRED");
        }
        return new LabImagingEditKey(KeyChecks.registrationNumber(registrationNumber), KeyChecks.dateTime(dateTime),
                WorkItemCategory.LAB, type, null);
    }

    public static LabImagingEditKey imaging(String registrationNumber, LocalDateTime dateTime, ImagingType type) {
        if (type == null) {
            throw new ValidationException("IMAGING_TYPE_REQUIRED");
        }
        return new LabImagingEditKey(KeyChecks.registrationNumber(registrationNumber), KeyChecks.dateTime(dateTime),
                WorkItemCategory.IMAGING, null, type);
    }

    public static LabImagingEditKey of(String registrationNumber, LocalDateTime dateTime,
                                       WorkItemCategory category, String typeCode) {
        if (category == null) {
            throw new ValidationException("CATEGORY_REQUIRED");
        }
        if (category == WorkItemCategory.LAB) {
            return lab(registrationNumber, dateTime, WorkItemPayload.parseLabType(typeCode));
        }
        return imaging(registrationNumber, dateTime, WorkItemPayload.parseImagingType(typeCode));
    }
}
