package com.instaclustr.bulkrestore.impl.backend;

import com.google.common.base.MoreObjects;

/**
 * Bucket protected by a protection group.
 */
public final class ProtectionGroupS3Asset {

    private final String id;
    private final String protectionGroupId;
    private final String bucketName;

    public ProtectionGroupS3Asset(final String id, final String protectionGroupId, final String bucketName) {
        this.id = id;
        this.protectionGroupId = protectionGroupId;
        this.bucketName = bucketName;
    }

    public String getId() {
        return id;
    }

    public String getProtectionGroupId() {
        return protectionGroupId;
    }

    public String getBucketName() {
        return bucketName;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("protectionGroupId", protectionGroupId)
            .add("bucketName", bucketName)
            .toString();
    }
}
