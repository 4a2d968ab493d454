package fpt.com.patienttaskservices.domain.workitem.store;

import fpt.com.patienttaskservices.common.exception.ValidationException;
import fpt.com.patienttaskservices.domain.workitem.entity.TaskStatus;

import java.util.Map;

final class StatusTransitions {

    private StatusTransitions() {}

    static void check(TaskStatus current, TaskStatus next, boolean enforceMonotonic) {
        if (next == null) {
            throw new ValidationException("STATUS_REQUIRED");
        }
        if (enforceMonotonic && current != null && !current.canMoveTo(next)) {
            throw new ValidationException("STATUS_TRANSITION_NOT_ALLOWED",
                    Map.of("from", current.getCode(), "to", next.getCode()));
        }
    }
}
