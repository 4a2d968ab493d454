package fpt.com.patienttaskservices.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Behaviour switches under {@code patient-tasks.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "patient-tasks")
public class PatientTaskProperties {

    private Rename rename = new Rename();
    private Status status = new Status();

    @Getter
    @Setter
    public static class Rename {
        /**
         * When false, a registration number change only reaches tasks and oldlabs,
         * leaving consultation history on the old number.
         */
        private boolean cascadeConsultations = true;
    }

    @Getter
    @Setter
    public static class Status {
        /**
         * Reject backward status writes such as collected -> unsent.
         */
        private boolean enforceMonotonic = false;
    }
}
