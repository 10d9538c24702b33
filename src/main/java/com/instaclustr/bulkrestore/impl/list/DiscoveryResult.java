package com.instaclustr.bulkrestore.impl.list;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;

import static java.util.Collections.unmodifiableMap;

/**
 * Backups discovered in one source account, grouped by region and resource type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DiscoveryResult {

    private final String sourceAccount;
    private final List<RegionBackups> regions;

    @JsonCreator
    public DiscoveryResult(@JsonProperty("source_account") final String sourceAccount,
                           @JsonProperty("total_backup_lists") final List<RegionBackups> regions) {
        this.sourceAccount = sourceAccount;
        this.regions = regions == null ? ImmutableList.of() : ImmutableList.copyOf(regions);
    }

    @JsonProperty("source_account")
    public String getSourceAccount() {
        return sourceAccount;
    }

    @JsonProperty("total_backup_lists")
    public List<RegionBackups> getRegions() {
        return regions;
    }

    @JsonIgnore
    public int size() {
        return regions.stream().mapToInt(RegionBackups::size).sum();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("sourceAccount", sourceAccount)
            .add("regions", regions)
            .toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RegionBackups {

        private final String region;
        private final Map<ResourceType, List<BackupRecord>> backups;

        public RegionBackups(final String region, final Map<ResourceType, List<BackupRecord>> backups) {
            this.region = region;
            final Map<ResourceType, List<BackupRecord>> copy = new EnumMap<>(ResourceType.class);
            if (backups != null) {
                backups.forEach((type, records) -> copy.put(type, ImmutableList.copyOf(records)));
            }
            this.backups = unmodifiableMap(copy);
        }

        @JsonCreator
        static RegionBackups fromJson(@JsonProperty("region") final String region,
                                      @JsonProperty("backup_list") final Map<String, List<BackupRecord>> backupList) {
            final Map<ResourceType, List<BackupRecord>> backups = new EnumMap<>(ResourceType.class);
            if (backupList != null) {
                backupList.forEach((type, records) -> backups.put(ResourceType.parse(type), records == null ? ImmutableList.of() : records));
            }
            return new RegionBackups(region, backups);
        }

        @JsonProperty("region")
        public String getRegion() {
            return region;
        }

        @JsonIgnore
        public Map<ResourceType, List<BackupRecord>> getBackups() {
            return backups;
        }

        @JsonProperty("backup_list")
        public Map<String, List<BackupRecord>> getBackupList() {
            final Map<String, List<BackupRecord>> byName = new LinkedHashMap<>();
            backups.forEach((type, records) -> byName.put(type.getJsonName(), records));
            return byName;
        }

        @JsonIgnore
        public int size() {
            return backups.values().stream().mapToInt(List::size).sum();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("region", region)
                .add("backups", backups)
                .toString();
        }
    }
}
