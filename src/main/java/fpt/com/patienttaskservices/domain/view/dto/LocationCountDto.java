package fpt.com.patienttaskservices.domain.view.dto;

import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationCountDto {
    private WardLocation location;
    private long count;
}
