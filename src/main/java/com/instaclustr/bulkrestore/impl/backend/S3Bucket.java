package com.instaclustr.bulkrestore.impl.backend;

import com.google.common.base.MoreObjects;

public final class S3Bucket {

    private final String id;
    private final String name;
    private final String environmentId;
    private final String accountNativeId;
    private final String region;

    public S3Bucket(final String id, final String name, final String environmentId, final String accountNativeId, final String region) {
        this.id = id;
        this.name = name;
        this.environmentId = environmentId;
        this.accountNativeId = accountNativeId;
        this.region = region;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEnvironmentId() {
        return environmentId;
    }

    public String getAccountNativeId() {
        return accountNativeId;
    }

    public String getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("name", name)
            .add("environmentId", environmentId)
            .add("accountNativeId", accountNativeId)
            .add("region", region)
            .toString();
    }
}
