package com.instaclustr.bulkrestore.impl.task;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum TaskState {
    PENDING,
    COMPLETED,
    FAILED,
    ABORTED,
    TIMED_OUT;

    private static final Logger logger = LoggerFactory.getLogger(TaskState.class);

    public static final Set<TaskState> FAILURE_STATES = EnumSet.of(FAILED, ABORTED);

    /**
     * Maps a status reported by the task endpoint. Unknown statuses are treated as pending.
     */
    public static TaskState fromStatus(final String status) {
        if (status == null) {
            logger.warn("Task status is missing, treating it as pending");
            return PENDING;
        }

        switch (status.trim().toLowerCase()) {
            case "queued":
            case "in_progress":
                return PENDING;
            case "completed":
                return COMPLETED;
            case "failed":
                return FAILED;
            case "aborted":
                return ABORTED;
            default:
                logger.warn("Unknown task status '{}', treating it as pending", status);
                return PENDING;
        }
    }

    public boolean isFailure() {
        return FAILURE_STATES.contains(this);
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
