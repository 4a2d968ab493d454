package fpt.com.patienttaskservices;

import fpt.com.patienttaskservices.common.config.PatientTaskProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;


@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(PatientTaskProperties.class)
public class PatientTaskServicesApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatientTaskServicesApplication.class, args);
        log.info("PatientTaskServicesApplication started");
    }

}
