package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "consultations")
@NoArgsConstructor
public class Consultation extends AbstractConsultation {
}
