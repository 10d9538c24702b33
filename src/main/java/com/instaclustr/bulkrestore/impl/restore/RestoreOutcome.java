package com.instaclustr.bulkrestore.impl.restore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;

/**
 * Result of restoring one backup. {@code status} is 200 for a completed task, 205 for a task which was
 * submitted but is not done yet, otherwise the status code of the error which stopped the restore, 500 for
 * failures without their own code.
 */
public final class RestoreOutcome {

    public static final int COMPLETED = 200;
    public static final int NOT_DONE = 205;
    public static final int ERROR = 500;

    private final ResourceType resourceType;
    private final String runToken;
    private final String taskId;
    private final String sourceBackupId;
    private final String sourceAssetId;
    private final int status;
    private final String message;

    @JsonCreator
    public RestoreOutcome(@JsonProperty("resource_type") final ResourceType resourceType,
                          @JsonProperty("run_token") final String runToken,
                          @JsonProperty("task") final String taskId,
                          @JsonProperty("source_backup_id") final String sourceBackupId,
                          @JsonProperty("source_asset_id") final String sourceAssetId,
                          @JsonProperty("status") final int status,
                          @JsonProperty("msg") final String message) {
        this.resourceType = resourceType;
        this.runToken = runToken;
        this.taskId = taskId;
        this.sourceBackupId = sourceBackupId;
        this.sourceAssetId = sourceAssetId;
        this.status = status;
        this.message = message;
    }

    static RestoreOutcome of(final RestoreGroup group, final String runToken, final String taskId, final int status, final String message) {
        return new RestoreOutcome(group.getResourceType(),
                                  runToken,
                                  taskId,
                                  group.getRecord().getSourceBackupId(),
                                  group.getRecord().getSourceAssetId(),
                                  status,
                                  message);
    }

    @JsonProperty("resource_type")
    public ResourceType getResourceType() {
        return resourceType;
    }

    @JsonProperty("run_token")
    public String getRunToken() {
        return runToken;
    }

    @JsonProperty("task")
    public String getTaskId() {
        return taskId;
    }

    @JsonProperty("source_backup_id")
    public String getSourceBackupId() {
        return sourceBackupId;
    }

    @JsonProperty("source_asset_id")
    public String getSourceAssetId() {
        return sourceAssetId;
    }

    @JsonProperty("status")
    public int getStatus() {
        return status;
    }

    @JsonProperty("msg")
    public String getMessage() {
        return message;
    }

    public boolean isCompleted() {
        return status == COMPLETED;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("resourceType", resourceType)
            .add("runToken", runToken)
            .add("taskId", taskId)
            .add("sourceBackupId", sourceBackupId)
            .add("sourceAssetId", sourceAssetId)
            .add("status", status)
            .add("message", message)
            .toString();
    }
}
