package fpt.com.patienttaskservices.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Empty or invalid input, raised before the store is touched.
 */
public class ValidationException extends AppException {
    public ValidationException(String code) {
        super(code, HttpStatus.BAD_REQUEST);
    }
    public ValidationException(String code, Map<String,Object> params) {
        super(code, HttpStatus.BAD_REQUEST, params);
    }
}
