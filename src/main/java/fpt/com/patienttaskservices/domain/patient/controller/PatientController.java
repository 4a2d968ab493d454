package fpt.com.patienttaskservices.domain.patient.controller;

import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.common.util.ApiResponse;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.patient.dto.PatientRequest;
import fpt.com.patienttaskservices.domain.patient.service.PatientService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(Constants.API_PREFIX + "/patients")
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;

    @PostMapping
    public ResponseEntity<ApiResponse<PatientDTO>> createPatient(@RequestBody PatientRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.created(patientService.createPatient(request)));
    }

    @GetMapping("/{registrationNumber}")
    public ResponseEntity<ApiResponse<PatientDTO>> getPatient(@PathVariable("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(patientService.getPatient(registrationNumber)));
    }

    @PutMapping("/{registrationNumber}")
    public ResponseEntity<ApiResponse<PatientDTO>> updatePatient(@PathVariable("registrationNumber") String registrationNumber,
                                                                 @RequestBody PatientRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, patientService.updatePatient(registrationNumber, request)));
    }

    @PostMapping("/{registrationNumber}/discharge")
    public ResponseEntity<ApiResponse<PatientDTO>> discharge(@PathVariable("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, patientService.discharge(registrationNumber)));
    }

    @PostMapping("/{registrationNumber}/readmit")
    public ResponseEntity<ApiResponse<PatientDTO>> readmit(@PathVariable("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, patientService.readmit(registrationNumber)));
    }
}
