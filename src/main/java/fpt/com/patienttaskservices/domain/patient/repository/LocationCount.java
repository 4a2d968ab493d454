package fpt.com.patienttaskservices.domain.patient.repository;

import fpt.com.patienttaskservices.domain.patient.entity.WardLocation;

public interface LocationCount {
    WardLocation getLocation();

    long getTotal();
}
