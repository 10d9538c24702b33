package com.instaclustr.bulkrestore.impl.backend;

import com.google.common.base.MoreObjects;

public final class SubmissionResponse {

    private final boolean ok;
    private final int statusCode;
    private final String taskId;
    private final String content;

    public SubmissionResponse(final boolean ok, final int statusCode, final String taskId, final String content) {
        this.ok = ok;
        this.statusCode = statusCode;
        this.taskId = taskId;
        this.content = content;
    }

    public static SubmissionResponse accepted(final String taskId) {
        return new SubmissionResponse(true, 202, taskId, null);
    }

    public boolean isOk() {
        return ok;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("ok", ok)
            .add("statusCode", statusCode)
            .add("taskId", taskId)
            .add("content", content)
            .toString();
    }
}
