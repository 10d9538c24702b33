package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

public final class DynamoDbRestoreRequest extends RestoreRequest {

    private final String tableName;
    private final JsonNode sseSpecification;
    private final JsonNode provisionedThroughput;
    private final String billingMode;
    private final String tableClass;
    private final JsonNode globalSecondaryIndexes;
    private final JsonNode localSecondaryIndexes;

    public DynamoDbRestoreRequest(final String sourceBackupId,
                                  final String environmentId,
                                  final String tableName,
                                  final JsonNode sseSpecification,
                                  final JsonNode provisionedThroughput,
                                  final String billingMode,
                                  final String tableClass,
                                  final JsonNode globalSecondaryIndexes,
                                  final JsonNode localSecondaryIndexes,
                                  final List<Tag> tags) {
        super(sourceBackupId, environmentId, tags);
        this.tableName = tableName;
        this.sseSpecification = sseSpecification;
        this.provisionedThroughput = provisionedThroughput;
        this.billingMode = billingMode;
        this.tableClass = tableClass;
        this.globalSecondaryIndexes = globalSecondaryIndexes;
        this.localSecondaryIndexes = localSecondaryIndexes;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.KEY_VALUE_TABLE;
    }

    @JsonProperty("table_name")
    public String getTableName() {
        return tableName;
    }

    @JsonProperty("sse_specification")
    public JsonNode getSseSpecification() {
        return sseSpecification;
    }

    @JsonProperty("provisioned_throughput")
    public JsonNode getProvisionedThroughput() {
        return provisionedThroughput;
    }

    @JsonProperty("billing_mode")
    public String getBillingMode() {
        return billingMode;
    }

    @JsonProperty("table_class")
    public String getTableClass() {
        return tableClass;
    }

    @JsonProperty("global_secondary_indexes")
    public JsonNode getGlobalSecondaryIndexes() {
        return globalSecondaryIndexes;
    }

    @JsonProperty("local_secondary_indexes")
    public JsonNode getLocalSecondaryIndexes() {
        return localSecondaryIndexes;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("tableName", tableName)
            .add("billingMode", billingMode)
            .add("tableClass", tableClass)
            .toString();
    }
}
