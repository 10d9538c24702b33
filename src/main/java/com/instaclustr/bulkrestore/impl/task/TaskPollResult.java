package com.instaclustr.bulkrestore.impl.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

public class TaskPollResult {

    private final String taskId;
    private final TaskState state;
    private final String lastStatus;

    public TaskPollResult(final String taskId, final TaskState state, final String lastStatus) {
        this.taskId = taskId;
        this.state = state;
        this.lastStatus = lastStatus;
    }

    @JsonProperty("task")
    public String getTaskId() {
        return taskId;
    }

    @JsonProperty("state")
    public TaskState getState() {
        return state;
    }

    /**
     * @return status string of the last read, null when the task was never read
     */
    @JsonProperty("last_status")
    public String getLastStatus() {
        return lastStatus;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("taskId", taskId)
            .add("state", state)
            .add("lastStatus", lastStatus)
            .toString();
    }
}
