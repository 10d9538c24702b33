package com.instaclustr.bulkrestore.impl;

import static java.lang.String.format;

/**
 * A restore task reached the failed or aborted state.
 */
public class TaskFailedException extends BulkRestoreException {

    private final String taskId;
    private final String status;

    public TaskFailedException(final String taskId, final String status) {
        super(format("task failed %s", status));
        this.taskId = taskId;
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getStatus() {
        return status;
    }

    @Override
    public int getStatusCode() {
        return 403;
    }
}
