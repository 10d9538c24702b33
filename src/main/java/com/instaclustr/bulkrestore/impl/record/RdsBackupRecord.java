package com.instaclustr.bulkrestore.impl.record;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class RdsBackupRecord extends BackupRecord {

    private final String sourceEngine;
    private final String sourceEngineVersion;
    private final String sourceSubnetGroupName;
    private final List<String> sourceSecurityGroupNativeIds;
    private final String sourceKms;
    private final List<Instance> sourceInstances;

    @JsonCreator
    public RdsBackupRecord(@JsonProperty("source_backup_id") final String sourceBackupId,
                           @JsonProperty("source_asset_id") final String sourceResourceId,
                           @JsonProperty("source_tags") final List<Tag> sourceTags,
                           @JsonProperty("source_account") final String sourceAccount,
                           @JsonProperty("source_region") final String sourceRegion,
                           @JsonProperty("source_expire_time") final String sourceExpireTime,
                           @JsonProperty("source_engine") final String sourceEngine,
                           @JsonProperty("source_engine_version") final String sourceEngineVersion,
                           @JsonProperty("source_subnet_group_name") final String sourceSubnetGroupName,
                           @JsonProperty("source_security_group_native_ids") final List<String> sourceSecurityGroupNativeIds,
                           @JsonProperty("source_kms") final String sourceKms,
                           @JsonProperty("source_instances") final List<Instance> sourceInstances) {
        super(sourceBackupId, sourceResourceId, sourceTags, sourceAccount, sourceRegion, sourceExpireTime);
        this.sourceEngine = sourceEngine;
        this.sourceEngineVersion = sourceEngineVersion;
        this.sourceSubnetGroupName = sourceSubnetGroupName;
        this.sourceSecurityGroupNativeIds = sourceSecurityGroupNativeIds == null ? ImmutableList.of() : ImmutableList.copyOf(sourceSecurityGroupNativeIds);
        this.sourceKms = sourceKms;
        this.sourceInstances = sourceInstances == null ? ImmutableList.of() : ImmutableList.copyOf(sourceInstances);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.MANAGED_DATABASE;
    }

    @JsonProperty("source_engine")
    public String getSourceEngine() {
        return sourceEngine;
    }

    @JsonProperty("source_engine_version")
    public String getSourceEngineVersion() {
        return sourceEngineVersion;
    }

    @JsonProperty("source_subnet_group_name")
    public String getSourceSubnetGroupName() {
        return sourceSubnetGroupName;
    }

    @JsonProperty("source_security_group_native_ids")
    public List<String> getSourceSecurityGroupNativeIds() {
        return sourceSecurityGroupNativeIds;
    }

    @JsonProperty("source_kms")
    public String getSourceKms() {
        return sourceKms;
    }

    @JsonProperty("source_instances")
    public List<Instance> getSourceInstances() {
        return sourceInstances;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("sourceEngine", sourceEngine)
            .add("sourceEngineVersion", sourceEngineVersion)
            .add("sourceSubnetGroupName", sourceSubnetGroupName)
            .add("sourceSecurityGroupNativeIds", sourceSecurityGroupNativeIds)
            .add("sourceKms", sourceKms)
            .add("sourceInstances", sourceInstances)
            .toString();
    }

    /**
     * Database instance that was part of the backed up cluster or standalone database.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Instance {

        private final String name;
        private final String instanceClass;
        private final boolean publiclyAccessible;

        @JsonCreator
        public Instance(@JsonProperty("name") final String name,
                        @JsonProperty("instance_class") final String instanceClass,
                        @JsonProperty("is_publicly_accessible") final boolean publiclyAccessible) {
            this.name = name;
            this.instanceClass = instanceClass;
            this.publiclyAccessible = publiclyAccessible;
        }

        @JsonProperty("name")
        public String getName() {
            return name;
        }

        @JsonProperty("instance_class")
        public String getInstanceClass() {
            return instanceClass;
        }

        @JsonProperty("is_publicly_accessible")
        public boolean isPubliclyAccessible() {
            return publiclyAccessible;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("instanceClass", instanceClass)
                .add("publiclyAccessible", publiclyAccessible)
                .toString();
        }
    }
}
