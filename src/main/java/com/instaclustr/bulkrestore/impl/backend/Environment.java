package com.instaclustr.bulkrestore.impl.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * Connected (account, region) pair of the backend, restores are addressed to an environment by its id.
 */
public final class Environment {

    private final String id;
    private final String accountNativeId;
    private final String region;

    @JsonCreator
    public Environment(@JsonProperty("id") final String id,
                       @JsonProperty("account_native_id") final String accountNativeId,
                       @JsonProperty("aws_region") final String region) {
        this.id = id;
        this.accountNativeId = accountNativeId;
        this.region = region;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("account_native_id")
    public String getAccountNativeId() {
        return accountNativeId;
    }

    @JsonProperty("aws_region")
    public String getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("accountNativeId", accountNativeId)
            .add("region", region)
            .toString();
    }
}
