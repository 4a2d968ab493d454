package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

/**
 * Manually recorded historical order. Has no workflow, hence no status column.
 */
@Entity
@Table(name = "oldlabs")
@NoArgsConstructor
public class OldLab extends AbstractLabImagingItem {
}
