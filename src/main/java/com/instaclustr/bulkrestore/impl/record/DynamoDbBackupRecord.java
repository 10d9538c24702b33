package com.instaclustr.bulkrestore.impl.record;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.Tag;

/**
 * Backup of a key-value table. Index descriptions, SSE specification and provisioned throughput are
 * carried verbatim, they are copied into a restore request without interpretation.
 */
public final class DynamoDbBackupRecord extends BackupRecord {

    private final String sourceTableName;
    private final String sourceBillingMode;
    private final String sourceTableClass;
    private final String sourceGlobalTableVersion;
    private final JsonNode sourceSseSpecification;
    private final JsonNode sourceProvisionedThroughput;
    private final JsonNode sourceGlobalSecondaryIndexes;
    private final JsonNode sourceLocalSecondaryIndexes;

    @JsonCreator
    public DynamoDbBackupRecord(@JsonProperty("source_backup_id") final String sourceBackupId,
                                @JsonProperty("source_asset_id") final String sourceTableId,
                                @JsonProperty("source_tags") final List<Tag> sourceTags,
                                @JsonProperty("source_account") final String sourceAccount,
                                @JsonProperty("source_region") final String sourceRegion,
                                @JsonProperty("source_expire_time") final String sourceExpireTime,
                                @JsonProperty("source_table_name") final String sourceTableName,
                                @JsonProperty("source_billing_mode") final String sourceBillingMode,
                                @JsonProperty("source_table_class") final String sourceTableClass,
                                @JsonProperty("source_global_table_version") final String sourceGlobalTableVersion,
                                @JsonProperty("source_sse_specification") final JsonNode sourceSseSpecification,
                                @JsonProperty("source_provisioned_throughput") final JsonNode sourceProvisionedThroughput,
                                @JsonProperty("source_global_secondary_indexes") final JsonNode sourceGlobalSecondaryIndexes,
                                @JsonProperty("source_local_secondary_indexes") final JsonNode sourceLocalSecondaryIndexes) {
        super(sourceBackupId, sourceTableId, sourceTags, sourceAccount, sourceRegion, sourceExpireTime);
        this.sourceTableName = sourceTableName;
        this.sourceBillingMode = sourceBillingMode;
        this.sourceTableClass = sourceTableClass;
        this.sourceGlobalTableVersion = sourceGlobalTableVersion;
        this.sourceSseSpecification = sourceSseSpecification;
        this.sourceProvisionedThroughput = sourceProvisionedThroughput;
        this.sourceGlobalSecondaryIndexes = sourceGlobalSecondaryIndexes;
        this.sourceLocalSecondaryIndexes = sourceLocalSecondaryIndexes;
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.KEY_VALUE_TABLE;
    }

    @JsonProperty("source_table_name")
    public String getSourceTableName() {
        return sourceTableName;
    }

    @JsonProperty("source_billing_mode")
    public String getSourceBillingMode() {
        return sourceBillingMode;
    }

    @JsonProperty("source_table_class")
    public String getSourceTableClass() {
        return sourceTableClass;
    }

    @JsonProperty("source_global_table_version")
    public String getSourceGlobalTableVersion() {
        return sourceGlobalTableVersion;
    }

    @JsonProperty("source_sse_specification")
    public JsonNode getSourceSseSpecification() {
        return sourceSseSpecification;
    }

    @JsonProperty("source_provisioned_throughput")
    public JsonNode getSourceProvisionedThroughput() {
        return sourceProvisionedThroughput;
    }

    @JsonProperty("source_global_secondary_indexes")
    public JsonNode getSourceGlobalSecondaryIndexes() {
        return sourceGlobalSecondaryIndexes;
    }

    @JsonProperty("source_local_secondary_indexes")
    public JsonNode getSourceLocalSecondaryIndexes() {
        return sourceLocalSecondaryIndexes;
    }

    @Override
    public String toString() {
        return toStringHelper()
            .add("sourceTableName", sourceTableName)
            .add("sourceBillingMode", sourceBillingMode)
            .add("sourceTableClass", sourceTableClass)
            .add("sourceGlobalTableVersion", sourceGlobalTableVersion)
            .toString();
    }
}
