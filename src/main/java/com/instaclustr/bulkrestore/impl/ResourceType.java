package com.instaclustr.bulkrestore.impl;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.lang.String.format;

/**
 * Kinds of protected resources a bulk restore handles. The JSON name of each type is the name operators
 * use in input documents.
 */
public enum ResourceType {
    BLOCK_VOLUME("EBS"),
    COMPUTE_INSTANCE("EC2"),
    MANAGED_DATABASE("RDS"),
    KEY_VALUE_TABLE("DynamoDB"),
    OBJECT_PROTECTION_GROUP("ProtectionGroup");

    private final String jsonName;

    ResourceType(final String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonCreator
    public static ResourceType parse(final String value) {
        if (value == null) {
            throw new ValidationException("resource_type", "Resource type can not be null.");
        }

        for (final ResourceType type : values()) {
            if (type.jsonName.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }

        throw new ValidationException("resource_type", format("Unknown resource type '%s', possible types are %s", value, Arrays.toString(values())));
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }

    @Override
    public String toString() {
        return jsonName;
    }
}
