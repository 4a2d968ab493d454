package fpt.com.patienttaskservices.domain.view.service;

import fpt.com.patienttaskservices.common.persistence.StoreReadiness;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.patient.entity.Patient;
import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import fpt.com.patienttaskservices.domain.patient.repository.LocationCount;
import fpt.com.patienttaskservices.domain.patient.repository.PatientRepository;
import fpt.com.patienttaskservices.domain.patient.service.PatientService;
import fpt.com.patienttaskservices.domain.view.dto.LocationCountDto;
import fpt.com.patienttaskservices.domain.view.dto.PatientWorkItemsDto;
import fpt.com.patienttaskservices.domain.view.dto.PendingBoardDto;
import fpt.com.patienttaskservices.domain.view.dto.PendingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.entity.AbstractConsultation;
import fpt.com.patienttaskservices.domain.workitem.entity.Consultation;
import fpt.com.patienttaskservices.domain.workitem.entity.OldConsultation;
import fpt.com.patienttaskservices.domain.workitem.entity.Task;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemCategory;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.repository.ConsultationRepository;
import fpt.com.patienttaskservices.domain.workitem.repository.OldConsultationRepository;
import fpt.com.patienttaskservices.domain.workitem.repository.TaskRepository;
import fpt.com.patienttaskservices.domain.workitem.service.WorkItemLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only projections behind the ward screens. Nothing here throws for a missing patient.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WardViewService {

    private final PatientRepository patientRepository;
    private final TaskRepository taskRepository;
    private final ConsultationRepository consultationRepository;
    private final OldConsultationRepository oldConsultationRepository;
    private final WorkItemLedgerService ledgerService;
    private final StoreReadiness storeReadiness;

    /**
     * Unsent work, oldest first. Archived consultations still waiting to be sent get their own list.
     * Items whose registration number matches no patient are left out.
     */
    public PendingBoardDto pendingByCategory() {
        storeReadiness.ensureReady();

        List<Task> labs = taskRepository.findByTaskStatusAndLabTypeIsNotNullOrderByDateTimeAscIdAsc(TaskStatus.UNSENT);
        List<Task> imaging = taskRepository.findByTaskStatusAndImagingTypeIsNotNullOrderByDateTimeAscIdAsc(TaskStatus.UNSENT);
        List<Consultation> consultations = consultationRepository.findByTaskStatusOrderByDateTimeAscIdAsc(TaskStatus.UNSENT);
        List<OldConsultation> archivedConsultations =
                oldConsultationRepository.findByTaskStatusOrderByDateTimeAscIdAsc(TaskStatus.UNSENT);

        Set<String> keys = labs.stream()
                .map(Task::getRegistrationNumber)
                .collect(Collectors.toCollection(HashSet::new));
        imaging.forEach(t -> keys.add(t.getRegistrationNumber()));
        consultations.forEach(c -> keys.add(c.getRegistrationNumber()));
        archivedConsultations.forEach(c -> keys.add(c.getRegistrationNumber()));
        Map<String, String> names = patientNames(keys);

        return PendingBoardDto.builder()
                .labs(toPending(labs, names))
                .imaging(toPending(imaging, names))
                .consultations(toPendingConsults(consultations, names))
                .archivedConsultations(toPendingConsults(archivedConsultations, names))
                .build();
    }

    public PatientWorkItemsDto patientWorkItems(String registrationNumber) {
        List<LabImagingItemDto> current = ledgerService.findLabImaging(WorkItemTable.TASKS, registrationNumber);
        List<LabImagingItemDto> archived = ledgerService.findLabImaging(WorkItemTable.OLDLABS, registrationNumber);
        PatientDTO patient = patientRepository.findByRegistrationNumber(registrationNumber.trim())
                .map(PatientService::mapToDTO)
                .orElse(null);

        return PatientWorkItemsDto.builder()
                .patient(patient)
                .currentLabs(ofCategory(current, WorkItemCategory.LAB))
                .currentImaging(ofCategory(current, WorkItemCategory.IMAGING))
                .archivedLabs(ofCategory(archived, WorkItemCategory.LAB))
                .archivedImaging(ofCategory(archived, WorkItemCategory.IMAGING))
                .consultations(ledgerService.findConsultations(WorkItemTable.CONSULTATIONS, registrationNumber))
                .archivedConsultations(ledgerService.findConsultations(WorkItemTable.OLDCONSULTATIONS, registrationNumber))
                .build();
    }

    /**
     * Admitted patients per ward, every ward listed in declaration order.
     */
    public List<LocationCountDto> locationCensus() {
        storeReadiness.ensureReady();
        Map<WardLocation, Long> counts = new EnumMap<>(WardLocation.class);
        for (LocationCount row : patientRepository.countByLocation(false)) {
            counts.put(row.getLocation(), row.getTotal());
        }
        return Arrays.stream(WardLocation.values())
                .map(location -> new LocationCountDto(location, counts.getOrDefault(location, 0L)))
                .collect(Collectors.toList());
    }

    public List<PatientDTO> admittedPatients() {
        storeReadiness.ensureReady();
        return toDtos(patientRepository.findByDischargedOrderByRegDateDescIdDesc(false));
    }

    public List<PatientDTO> dischargedPatients() {
        storeReadiness.ensureReady();
        return toDtos(patientRepository.findByDischargedOrderByRegDateDescIdDesc(true));
    }

    /**
     * Case-insensitive substring match on name or registration number. A blank query lists every admitted patient.
     */
    public List<PatientDTO> searchAdmitted(String query) {
        if (query == null || query.isBlank()) {
            return admittedPatients();
        }
        return search(false, query);
    }

    public List<PatientDTO> searchDischarged(String query) {
        if (query == null || query.isBlank()) {
            return dischargedPatients();
        }
        return search(true, query);
    }

    private List<PatientDTO> search(boolean discharged, String query) {
        storeReadiness.ensureReady();
        return toDtos(patientRepository.search(discharged, escapeLike(query.trim())));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private Map<String, String> patientNames(Set<String> registrationNumbers) {
        if (registrationNumbers.isEmpty()) {
            return Map.of();
        }
        return patientRepository.findByRegistrationNumberIn(registrationNumbers).stream()
                .collect(Collectors.toMap(Patient::getRegistrationNumber, Patient::getPatientName));
    }

    private static List<PendingItemDto> toPending(List<Task> tasks, Map<String, String> names) {
        return tasks.stream()
                .filter(t -> names.containsKey(t.getRegistrationNumber()))
                .map(t -> PendingItemDto.builder()
                        .registrationNumber(t.getRegistrationNumber())
                        .patientName(names.get(t.getRegistrationNumber()))
                        .category(t.getCategory())
                        .type(t.getTypeCode())
                        .subtype(t.getSubtype())
                        .dateTime(t.getDateTime())
                        .build())
                .collect(Collectors.toList());
    }

    private static List<PendingItemDto> toPendingConsults(List<? extends AbstractConsultation> consultations,
                                                          Map<String, String> names) {
        return consultations.stream()
                .filter(c -> names.containsKey(c.getRegistrationNumber()))
                .map(c -> PendingItemDto.builder()
                        .registrationNumber(c.getRegistrationNumber())
                        .patientName(names.get(c.getRegistrationNumber()))
                        .consult(c.getConsult())
                        .dateTime(c.getDateTime())
                        .build())
                .collect(Collectors.toList());
    }

    private static List<LabImagingItemDto> ofCategory(List<LabImagingItemDto> items, WorkItemCategory category) {
        return items.stream()
                .filter(item -> item.getCategory() == category)
                .collect(Collectors.toList());
    }

    private static List<PatientDTO> toDtos(List<Patient> patients) {
        return patients.stream().map(PatientService::mapToDTO).collect(Collectors.toList());
    }
}
