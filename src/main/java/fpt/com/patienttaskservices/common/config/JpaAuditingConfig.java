package fpt.com.patienttaskservices.common.config;

import fpt.com.patienttaskservices.common.util.DateTimeUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;
import java.util.Optional;

@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "storeDateTimeProvider")
public class JpaAuditingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // @CreatedDate columns take UTC wall time at whole seconds
    @Bean
    public DateTimeProvider storeDateTimeProvider(Clock clock) {
        return () -> Optional.of(DateTimeUtil.storeNow(clock));
    }
}
