package fpt.com.patienttaskservices.common.persistence;

import fpt.com.patienttaskservices.common.exception.StoreNotReadyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreReadinessTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void notReadyBeforeRefresh() {
        StoreReadiness readiness = new StoreReadiness(jdbcTemplate);

        assertThat(readiness.isReady()).isFalse();
        assertThatThrownBy(readiness::ensureReady).isInstanceOf(StoreNotReadyException.class);
    }

    @Test
    void missingRelationKeepsStoreNotReady() {
        when(jdbcTemplate.execute(any(ConnectionCallback.class)))
                .thenReturn(Set.of("patients", "tasks", "oldlabs", "consultations"));
        StoreReadiness readiness = new StoreReadiness(jdbcTemplate);

        assertThat(readiness.refresh()).isFalse();
        assertThatThrownBy(readiness::ensureReady).isInstanceOf(StoreNotReadyException.class);
    }

    @Test
    void readyOnceAllRelationsExist() {
        when(jdbcTemplate.execute(any(ConnectionCallback.class)))
                .thenReturn(Set.copyOf(StoreReadiness.RELATIONS));
        StoreReadiness readiness = new StoreReadiness(jdbcTemplate);

        assertThat(readiness.refresh()).isTrue();
        assertThatNoException().isThrownBy(readiness::ensureReady);
    }
}
