package fpt.com.patienttaskservices.domain.workitem.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tasks")
@Getter
@Setter
@NoArgsConstructor
public class Task extends AbstractLabImagingItem {

    @Convert(converter = TaskStatus.Converter.class)
    @Column(name = "task_status", nullable = false, length = 10)
    private TaskStatus taskStatus = TaskStatus.UNSENT;
}
