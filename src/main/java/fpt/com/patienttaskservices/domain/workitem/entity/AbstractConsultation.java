package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public abstract class AbstractConsultation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "registrationNumber", nullable = false, length = 100)
    private String registrationNumber;

    @Column(nullable = false, length = 2000)
    private String consult;

    @CreatedDate
    @Column(name = "date_and_time", nullable = false, updatable = false)
    private LocalDateTime dateTime;

    @Convert(converter = TaskStatus.Converter.class)
    @Column(name = "task_status", nullable = false, length = 10)
    private TaskStatus taskStatus = TaskStatus.UNSENT;
}
