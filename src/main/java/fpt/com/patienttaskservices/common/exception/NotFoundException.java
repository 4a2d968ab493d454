package fpt.com.patienttaskservices.common.exception;

import fpt.com.patienttaskservices.common.constants.Constants;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class NotFoundException extends AppException {

    private NotFoundException(String code, Map<String, Object> params) {
        super(code, HttpStatus.NOT_FOUND, params);
    }

    public static NotFoundException patient(String registrationNumber) {
        return new NotFoundException(Constants.ERR_PATIENT_NOT_FOUND,
                Map.of("registrationNumber", registrationNumber));
    }
}
