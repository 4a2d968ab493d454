package fpt.com.patienttaskservices.common.persistence;

import fpt.com.patienttaskservices.common.exception.StoreNotReadyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gate for every core operation: the store counts as initialized once all relations exist.
 */
@Slf4j
@Component
public class StoreReadiness {

    static final List<String> RELATIONS = List.of("patients", "tasks", "oldlabs", "consultations", "oldconsultations");

    private final JdbcTemplate jdbcTemplate;
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public StoreReadiness(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        refresh();
    }

    public boolean refresh() {
        Set<String> present = jdbcTemplate.execute((ConnectionCallback<Set<String>>) connection -> {
            Set<String> names = new HashSet<>();
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getTables(null, null, "%", null)) {
                while (rs.next()) {
                    names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
            return names;
        });

        boolean complete = present != null && present.containsAll(RELATIONS);
        ready.set(complete);
        if (complete) {
            log.info("Store initialized with relations {}", RELATIONS);
        } else {
            log.error("Store is missing relations, expected {} but found {}", RELATIONS, present);
        }
        return complete;
    }

    public boolean isReady() {
        return ready.get();
    }

    public void ensureReady() {
        if (!ready.get()) {
            throw new StoreNotReadyException();
        }
    }
}
