package fpt.com.patienttaskservices.domain.identity.service;

import fpt.com.patienttaskservices.domain.patient.service.PatientService;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.ImagingType;
import fpt.com.patienttaskservices.domain.workitem.entity.LabType;
import fpt.com.patienttaskservices.domain.workitem.service.WorkItemLedgerService;
import fpt.com.patienttaskservices.support.StoreTestSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "patient-tasks.rename.cascade-consultations=false")
@ExtendWith(OutputCaptureExtension.class)
class RenameWithoutConsultationCascadeTest extends StoreTestSupport {

    @Autowired
    private PatientService patientService;

    @Autowired
    private WorkItemLedgerService ledgerService;

    @Test
    void renameMovesLabsAndLeavesConsultationsOnOldNumber(CapturedOutput output) {
        patientService.createPatient(patientRequest("R100", "Jane Doe"));
        ledgerService.addLabOrImaging(TASKS, "R100", WorkItemPayload.lab(LabType.BLOOD, "CBC"));
        ledgerService.addLabOrImaging(TASKS, "R100", WorkItemPayload.imaging(ImagingType.CT, "Head"));
        ledgerService.addLabOrImaging(OLDLABS, "R100", WorkItemPayload.lab(LabType.URINE, "Culture"));
        ledgerService.addConsultation(CONSULTATIONS, "R100", "Cardiology");
        ledgerService.addConsultation(OLDCONSULTATIONS, "R100", "Neurology");

        patientService.updatePatient("R100", patientRequest("R200", "Jane Doe"));

        assertThat(patientService.getPatient("R200").getPatientName()).isEqualTo("Jane Doe");
        assertThat(countRows("tasks", "R200")).isEqualTo(2);
        assertThat(countRows("tasks", "R100")).isZero();
        assertThat(countRows("oldlabs", "R200")).isEqualTo(1);
        assertThat(countRows("consultations", "R100")).isEqualTo(1);
        assertThat(countRows("consultations", "R200")).isZero();
        assertThat(countRows("oldconsultations", "R100")).isEqualTo(1);
        assertThat(countRows("oldconsultations", "R200")).isZero();
        assertThat(output.getOut()).contains("Consultation history of R100 left on the old registration number");
    }
}
