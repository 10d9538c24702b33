package com.instaclustr.bulkrestore.impl.backend;

import com.google.common.base.MoreObjects;

public final class ProtectionGroupBackup {

    private final String id;
    private final String protectionGroupId;
    private final String startTimestamp;
    private final String expirationTimestamp;

    public ProtectionGroupBackup(final String id, final String protectionGroupId, final String startTimestamp, final String expirationTimestamp) {
        this.id = id;
        this.protectionGroupId = protectionGroupId;
        this.startTimestamp = startTimestamp;
        this.expirationTimestamp = expirationTimestamp;
    }

    public String getId() {
        return id;
    }

    public String getProtectionGroupId() {
        return protectionGroupId;
    }

    public String getStartTimestamp() {
        return startTimestamp;
    }

    public String getExpirationTimestamp() {
        return expirationTimestamp;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("protectionGroupId", protectionGroupId)
            .add("startTimestamp", startTimestamp)
            .add("expirationTimestamp", expirationTimestamp)
            .toString();
    }
}
