package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class RdsRestoreRequest extends RestoreRequest {

    private final String name;
    private final String instanceClass;
    private final String kmsKeyNativeId;
    private final List<String> securityGroupNativeIds;
    private final String subnetGroupName;
    private final boolean publiclyAccessible;

    public RdsRestoreRequest(final String sourceBackupId,
                             final String environmentId,
                             final String name,
                             final String instanceClass,
                             final String kmsKeyNativeId,
                             final List<String> securityGroupNativeIds,
                             final String subnetGroupName,
                             final boolean publiclyAccessible,
                             final List<Tag> tags) {
        super(sourceBackupId, environmentId, tags);
        this.name = name;
        this.instanceClass = instanceClass;
        this.kmsKeyNativeId = kmsKeyNativeId;
        this.securityGroupNativeIds = securityGroupNativeIds == null ? ImmutableList.of() : ImmutableList.copyOf(securityGroupNativeIds);
        this.subnetGroupName = subnetGroupName;
        this.publiclyAccessible = publiclyAccessible;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.MANAGED_DATABASE;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("instance_class")
    public String getInstanceClass() {
        return instanceClass;
    }

    @JsonProperty("kms_key_native_id")
    public String getKmsKeyNativeId() {
        return kmsKeyNativeId;
    }

    @JsonProperty("security_group_native_ids")
    public List<String> getSecurityGroupNativeIds() {
        return securityGroupNativeIds;
    }

    @JsonProperty("subnet_group_name")
    public String getSubnetGroupName() {
        return subnetGroupName;
    }

    @JsonProperty("is_publicly_accessible")
    public boolean isPubliclyAccessible() {
        return publiclyAccessible;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("name", name)
            .add("instanceClass", instanceClass)
            .add("kmsKeyNativeId", kmsKeyNativeId)
            .add("securityGroupNativeIds", securityGroupNativeIds)
            .add("subnetGroupName", subnetGroupName)
            .add("publiclyAccessible", publiclyAccessible)
            .toString();
    }
}
