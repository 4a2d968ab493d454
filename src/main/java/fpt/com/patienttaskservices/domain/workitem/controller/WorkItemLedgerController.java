package fpt.com.patienttaskservices.domain.workitem.controller;

import fpt.com.patienttaskservices.common.constants.Constants;
import fpt.com.patienttaskservices.common.util.ApiResponse;
import fpt.com.patienttaskservices.domain.workitem.dto.AddConsultationRequest;
import fpt.com.patienttaskservices.domain.workitem.dto.AddLabImagingRequest;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationAddResult;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.ConsultationItemRequest;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemDto;
import fpt.com.patienttaskservices.domain.workitem.dto.LabImagingItemRequest;
import fpt.com.patienttaskservices.domain.workitem.dto.WorkItemPayload;
import fpt.com.patienttaskservices.domain.workitem.entity.WorkItemTable;
import fpt.com.patienttaskservices.domain.workitem.service.WorkItemLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(Constants.API_PREFIX + "/ledger/{table}")
@RequiredArgsConstructor
public class WorkItemLedgerController {

    private final WorkItemLedgerService ledgerService;

    @PostMapping("/lab-imaging")
    public ResponseEntity<ApiResponse<LabImagingItemDto>> addLabOrImaging(
            @PathVariable("table") WorkItemTable table,
            @RequestBody AddLabImagingRequest request) {
        WorkItemPayload payload = WorkItemPayload.of(request.getCategory(), request.getType(), request.getSubtype());
        LabImagingItemDto created = ledgerService.addLabOrImaging(table, request.getRegistrationNumber(), payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.created(created));
    }

    @GetMapping("/lab-imaging")
    public ResponseEntity<ApiResponse<List<LabImagingItemDto>>> listLabImaging(
            @PathVariable("table") WorkItemTable table,
            @RequestParam("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(ledgerService.findLabImaging(table, registrationNumber)));
    }

    @PutMapping("/lab-imaging/status")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> advanceLabImagingStatus(
            @PathVariable("table") WorkItemTable table,
            @RequestBody LabImagingItemRequest request) {
        int affected = ledgerService.advanceStatus(table, request.toKey(), request.getStatus());
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, affected(affected)));
    }

    @PutMapping("/lab-imaging/subtype")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> editSubtype(
            @PathVariable("table") WorkItemTable table,
            @RequestBody LabImagingItemRequest request) {
        int affected = ledgerService.editSubtypeAndStatus(table, request.toEditKey(),
                request.getNewSubtype(), request.getStatus());
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, affected(affected)));
    }

    @DeleteMapping("/lab-imaging")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> deleteLabImaging(
            @PathVariable("table") WorkItemTable table,
            @RequestBody LabImagingItemRequest request) {
        int affected = ledgerService.deleteItem(table, request.toKey());
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_DELETED, affected(affected)));
    }

    @PostMapping("/consultations")
    public ResponseEntity<ApiResponse<ConsultationAddResult>> addConsultation(
            @PathVariable("table") WorkItemTable table,
            @RequestBody AddConsultationRequest request) {
        ConsultationAddResult result = ledgerService.addConsultation(table, request.getRegistrationNumber(),
                request.getConsult());
        if (!result.isCreated()) {
            return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_ALREADY_EXISTS, result));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.created(result));
    }

    @GetMapping("/consultations")
    public ResponseEntity<ApiResponse<List<ConsultationItemDto>>> listConsultations(
            @PathVariable("table") WorkItemTable table,
            @RequestParam("registrationNumber") String registrationNumber) {
        return ResponseEntity.ok(ApiResponse.ok(ledgerService.findConsultations(table, registrationNumber)));
    }

    @PutMapping("/consultations/status")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> advanceConsultationStatus(
            @PathVariable("table") WorkItemTable table,
            @RequestBody ConsultationItemRequest request) {
        int affected = ledgerService.advanceStatus(table, request.toKey(), request.getStatus());
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_SUCCESS, affected(affected)));
    }

    @DeleteMapping("/consultations")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> deleteConsultation(
            @PathVariable("table") WorkItemTable table,
            @RequestBody ConsultationItemRequest request) {
        int affected = ledgerService.deleteConsultation(table, request.toKey());
        return ResponseEntity.ok(ApiResponse.ok(Constants.MSG_DELETED, affected(affected)));
    }

    private static Map<String, Integer> affected(int rows) {
        return Map.of("affectedRows", rows);
    }
}
