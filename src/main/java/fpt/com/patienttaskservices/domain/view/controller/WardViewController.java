package fpt.com.patienttaskservices.domain.view.controller;

import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.common.util.ApiResponse;
import fpt.com.patienttaskservices.domain.patient.dto.PatientDTO;
import fpt.com.patienttaskservices.domain.view.dto.LocationCountDto;
import fpt.com.patienttaskservices.domain.view.dto.PatientWorkItemsDto;
import fpt.com.patienttaskservices.domain.view.dto.PendingBoardDto;
import fpt.com.patienttaskservices.domain.view.service.WardViewService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping(Constants.API_PREFIX + "/views")
@RequiredArgsConstructor
public class WardViewController {

    private final WardViewService viewService;

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse<PendingBoardDto>> pending() {
        return ResponseEntity.ok(ApiResponse.ok(viewService.pendingByCategory()));
    }

    @GetMapping("/patients/{registrationNumber}/work-items")
    public ResponseEntity<ApiResponse<PatientWorkItemsDto>> workItems(
            @PathVariable("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(viewService.patientWorkItems(registrationNumber)));
    }

    @GetMapping("/census")
    public ResponseEntity<ApiResponse<List<LocationCountDto>>> census() {
        return ResponseEntity.ok(ApiResponse.ok(viewService.locationCensus()));
    }

    @GetMapping("/patients/admitted")
    public ResponseEntity<ApiResponse<List<PatientDTO>>> admitted(
            @RequestParam(value = "q", required = false) String query) {
        return ResponseEntity.ok(ApiResponse.ok(viewService.searchAdmitted(query)));
    }

    @GetMapping("/patients/discharged")
    public ResponseEntity<ApiResponse<List<PatientDTO>>> discharged(
            @RequestParam(value = "q", required = false) String query) {
        return ResponseEntity.ok(ApiResponse.ok(viewService.searchDischarged(query)));
    }
}
