package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Columns shared by {@code tasks} and {@code oldlabs}. A row carries either the lab pair
 * or the imaging pair, never both; the other pair stays null.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public abstract class AbstractLabImagingItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "registrationNumber", nullable = false, length = 100)
    private String registrationNumber;

    @Convert(converter = LabType.Converter.class)
    @Column(name = "lab_type", length = 20)
    private LabType labType;

    @Column(name = "lab_subtype", length = 500)
    private String labSubtype;

    @Convert(converter = ImagingType.Converter.class)
    @Column(name = "imaging_type", length = 10)
    private ImagingType imagingType;

    @Column(name = "imaging_subtype", length = 500)
    private String imagingSubtype;

    @CreatedDate
    @Column(name = "date_and_time", nullable = false, updatable = false)
    private LocalDateTime dateTime;

    public void assignLab(LabType type, String subtype) {
        this.labType = type;
        this.labSubtype = subtype;
        this.imagingType = null;
        this.imagingSubtype = null;
    }

    public void assignImaging(ImagingType type, String subtype) {
        this.imagingType = type;
        this.imagingSubtype = subtype;
        this.labType = null;
        this.labSubtype = null;
    }

    public WorkItemCategory getCategory() {
        return labType != null ? WorkItemCategory.LAB : WorkItemCategory.IMAGING;
    }

    public String getTypeCode() {
        return labType != null ? labType.getCode() : imagingType != null ? imagingType.getCode() : null;
    }

    public String getSubtype() {
        return labType != null ? labSubtype : imagingSubtype;
    }

    /** Rewrites the subtype of whichever payload the row already carries. */
    public void changeSubtype(String subtype) {
        if (labType != null) {
            this.labSubtype = subtype;
        } else {
            this.imagingSubtype = subtype;
        }
    }
}
