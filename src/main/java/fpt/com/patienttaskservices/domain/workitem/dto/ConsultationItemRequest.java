package fpt.com.patienttaskservices.domain.workitem.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsultationItemRequest {
    private String registrationNumber;

    @JsonFormat(pattern = Constants.DATETIME_PATTERN)
    private LocalDateTime dateTime;

    private String consult;
    private TaskStatus status;

    public ConsultationKey toKey() {
        return ConsultationKey.of(registrationNumber, dateTime, consult);
    }
}
