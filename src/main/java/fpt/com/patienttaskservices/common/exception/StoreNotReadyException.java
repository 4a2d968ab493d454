package fpt.com.patienttaskservices.common.exception;

import fpt.com.patienttaskservices.common.constants.Constants;
import org.springframework.http.HttpStatus;

public class StoreNotReadyException extends AppException {
    public StoreNotReadyException() {
        super(Constants.ERR_STORE_NOT_READY, HttpStatus.SERVICE_UNAVAILABLE);
    }
}
