package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.MoreObjects.ToStringHelper;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

/**
 * Restore request submitted to the backend, one per backup. Requests are immutable and are serialized with
 * the backend's snake_case names.
 */
public abstract class RestoreRequest {

    private final String sourceBackupId;
    private final String environmentId;
    private final List<Tag> tags;

    protected RestoreRequest(final String sourceBackupId, final String environmentId, final List<Tag> tags) {
        this.sourceBackupId = sourceBackupId;
        this.environmentId = environmentId;
        this.tags = tags == null ? ImmutableList.of() : ImmutableList.copyOf(tags);
    }

    @JsonProperty("resource_type")
    public abstract ResourceType getResourceType();

    @JsonProperty("source_backup_id")
    public String getSourceBackupId() {
        return sourceBackupId;
    }

    @JsonProperty("environment_id")
    public String getEnvironmentId() {
        return environmentId;
    }

    @JsonProperty("tags")
    public List<Tag> getTags() {
        return tags;
    }

    protected ToStringHelper toStringHelper() {
        return MoreObjects.toStringHelper(this)
            .add("sourceBackupId", sourceBackupId)
            .add("environmentId", environmentId)
            .add("tags", tags);
    }

    @Override
    public String toString() {
        return toStringHelper().toString();
    }
}
