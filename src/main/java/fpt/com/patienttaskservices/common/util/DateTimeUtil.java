package fpt.com.patienttaskservices.common.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Store timestamps are UTC with whole-second precision, so a value read back
 * can be used again as part of a natural key.
 */
public class DateTimeUtil {

    private DateTimeUtil() {}

    public static LocalDateTime storeNow(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
