package fpt.com.patienttaskservices.common.exception;

import fpt.com.patienttaskservices.common.constants.Constants;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class DuplicateRegistrationException extends AppException {
    public DuplicateRegistrationException(String registrationNumber) {
        super(Constants.ERR_DUPLICATE_REGISTRATION, HttpStatus.CONFLICT,
                Map.of("registrationNumber", registrationNumber));
    }
}
