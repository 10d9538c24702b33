package com.instaclustr.bulkrestore.impl.backend;

import com.google.common.base.MoreObjects;

public final class ProtectionGroup {

    private final String id;
    private final String name;

    public ProtectionGroup(final String id, final String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", id).add("name", name).toString();
    }
}
