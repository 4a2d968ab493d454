package fpt.com.patienttaskservices.common.exception;

import fpt.com.patienttaskservices.common.constants.Constants;
import org.springframework.http.HttpStatus;

/**
 * Low-level store failure. The cause is kept for the log only; callers see a generic code.
 */
public class StoreAccessException extends AppException {
    public StoreAccessException(Throwable cause) {
        super(Constants.ERR_STORE_IO, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
