package fpt.com.patienttaskservices.domain.workitem.service;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationKey;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingKey;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.LabType;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.support.StoreTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable.CONSULTATIONS;
import static fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable.TASKS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "patient-tasks.status.enforce-monotonic=true")
class MonotonicStatusTest extends StoreTestSupport {

    @Autowired
    private WorkItemLedgerService ledgerService;

    @Test
    void backwardTransitionIsRejectedAndNothingIsWritten() {
        LabImagingItemDto created = ledgerService.addLabOrImaging(TASKS, "R1", WorkItemPayload.lab(LabType.BLOOD, "CBC"));
        LabImagingKey key = LabImagingKey.of("R1", created.getDateTime(), WorkItemPayload.lab(LabType.BLOOD, "CBC"));

        assertThat(ledgerService.advanceStatus(TASKS, key, TaskStatus.SENT)).isEqualTo(1);
        assertThat(ledgerService.advanceStatus(TASKS, key, TaskStatus.COLLECTED)).isEqualTo(1);

        assertThatThrownBy(() -> ledgerService.advanceStatus(TASKS, key, TaskStatus.UNSENT))
                .isInstanceOf(ValidationException.class)
                .hasMessage("STATUS_TRANSITION_NOT_ALLOWED");
        assertThat(ledgerService.findLabImaging(TASKS, "R1").get(0).getTaskStatus()).isEqualTo(TaskStatus.COLLECTED);
    }

    @Test
    void rewritingTheSameStatusIsAllowed() {
        ConsultationItemDto created = ledgerService.addConsultation(CONSULTATIONS, "R1", "Cardiology").getItem();
        ConsultationKey key = ConsultationKey.of("R1", created.getDateTime(), "Cardiology");

        assertThat(ledgerService.advanceStatus(CONSULTATIONS, key, TaskStatus.SENT)).isEqualTo(1);
        assertThat(ledgerService.advanceStatus(CONSULTATIONS, key, TaskStatus.SENT)).isEqualTo(1);
        assertThatThrownBy(() -> ledgerService.advanceStatus(CONSULTATIONS, key, TaskStatus.UNSENT))
                .isInstanceOf(ValidationException.class);
    }
}
