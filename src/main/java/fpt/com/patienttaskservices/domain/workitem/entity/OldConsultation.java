package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "oldconsultations")
@NoArgsConstructor
public class OldConsultation extends AbstractConsultation {
}
