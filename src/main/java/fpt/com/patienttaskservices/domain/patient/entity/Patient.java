package fpt.com.patienttaskservices.domain.patient.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.type.NumericBooleanConverter;

import java.time.LocalDate;

@Entity
@Table(name = "patients")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    // internal row id, never handed to callers
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "registrationNumber", nullable = false, unique = true, length = 100)
    private String registrationNumber;

    @Column(name = "patientName", nullable = false)
    private String patientName;

    @Column(nullable = false)
    private Integer age;

    @Convert(converter = Gender.Converter.class)
    @Column(nullable = false, length = 10)
    private Gender gender;

    @Convert(converter = WardLocation.Converter.class)
    @Column(nullable = false, length = 20)
    private WardLocation location;

    @Column(name = "bedNumber")
    private Integer bedNumber;

    @Column(name = "chiefComplaints", length = 2000)
    private String chiefComplaints;

    @Column(name = "provisionalDiagnosis", length = 2000)
    private String provisionalDiagnosis;

    @Column(name = "miscNotes", length = 4000)
    private String miscNotes;

    @Column(nullable = false, length = 100)
    private String contact;

    @Column(name = "reg_date", nullable = false, updatable = false)
    private LocalDate regDate;

    @Builder.Default
    @Convert(converter = NumericBooleanConverter.class)
    @Column(name = "is_discharged", nullable = false)
    private boolean discharged = false;
}
