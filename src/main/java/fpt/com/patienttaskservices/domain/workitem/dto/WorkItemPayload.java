package fpt.com.patienttaskservices.domain.workitem.dto;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.entity.ImagingType;
import fpt.com.patienttaskservices.domain.workitem.entity.LabType;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * Lab or imaging payload of a work item. Exactly one of {@code labType}/{@code imagingType}
 * is set, matching {@code category}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkItemPayload {

    WorkItemCategory category;
    LabType labType;
    ImagingType imagingType;
    String subtype;

    public static WorkItemPayload lab(LabType type, String subtype) {
        if (type == null) {
            throw new ValidationException("LAB_TYPE_REQUIRED");
        }
        return new WorkItemPayload(WorkItemCategory.LAB, type, null, requireSubtype(subtype));
    }

    public static WorkItemPayload imaging(ImagingType type, String subtype) {
        if (type == null) {
            throw new ValidationException("IMAGING_TYPE_REQUIRED");
        }
        return new WorkItemPayload(WorkItemCategory.IMAGING, null, type, requireSubtype(subtype));
    }

    /**
     * Builds a payload from a category and a store type code such as {@code "blood"} or {@code "X-RAY"}.
     */
    public static WorkItemPayload of(WorkItemCategory category, String typeCode, String subtype) {
        if (category == null) {
            throw new ValidationException("CATEGORY_REQUIRED");
        }
        if (category == WorkItemCategory.LAB) {
            return lab(parseLabType(typeCode), subtype);
        }
        return imaging(parseImagingType(typeCode), subtype);
    }

    public String getTypeCode() {
        return category == WorkItemCategory.LAB ? labType.getCode() : imagingType.getCode();
    }

    static LabType parseLabType(String typeCode) {
        try {
            return LabType.fromCode(typeCode);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("UNKNOWN_LAB_TYPE", Map.of("type", typeCode));
        }
    }

    static ImagingType parseImagingType(String typeCode) {
        try {
            return ImagingType.fromCode(typeCode);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("UNKNOWN_IMAGING_TYPE", Map.of("type", typeCode));
        }
    }

    static String requireSubtype(String subtype) {
        if (subtype == null || subtype.isBlank()) {
            throw new ValidationException("SUBTYPE_REQUIRED");
        }
        return subtype.trim();
    }

    @Override
    public String toString() {
        return category + "{" + getTypeCode() + ", " + subtype + "}";
    }
}
