package fpt.com.patienttaskservices.common.constants;


/**
 * Shared constants for the whole service.
 */
public final class Constants {

    private Constants() {}

    public static final String API_PREFIX = "/api/v1";

    // Store formats (UTC)
    public static final String DATE_PATTERN = "yyyy-MM-dd";
    public static final String DATETIME_PATTERN = "yyyy-MM-dd HH:mm:ss";

    // Common messages
    public static final String MSG_SUCCESS = "Operation successful";
    public static final String MSG_CREATED = "Resource created successfully";
    public static final String MSG_DELETED = "Resource deleted successfully";
    public static final String MSG_ALREADY_EXISTS = "This item already exists";

    // Error codes
    public static final String ERR_VALIDATION = "VALIDATION_FAILED";
    public static final String ERR_DUPLICATE_REGISTRATION = "REGISTRATION_NUMBER_EXISTS";
    public static final String ERR_PATIENT_NOT_FOUND = "PATIENT_NOT_FOUND";
    public static final String ERR_STORE_NOT_READY = "STORE_NOT_INITIALIZED";
    public static final String ERR_STORE_IO = "STORE_IO_ERROR";
    public static final String ERR_GENERAL = "GENERAL_ERROR";
}
