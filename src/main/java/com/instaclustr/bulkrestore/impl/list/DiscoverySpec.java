package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.filter.SearchDirection;
import com.instaclustr.bulkrestore.impl.filter.SearchWindow;
import picocli.CommandLine.Option;

import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * What to look for when discovering backups of one source account and region.
 */
public class DiscoverySpec {

    public static final int DEFAULT_START_DAY_OFFSET = 1;
    public static final int DEFAULT_END_DAY_OFFSET = 0;
    public static final int DEFAULT_MAX_RESULTS = 500;

    @Option(names = "--source-account", description = "account the backups were taken in")
    @JsonProperty("source_account")
    public String sourceAccount;

    @Option(names = "--source-region", description = "region the backups were taken in")
    @JsonProperty("source_region")
    public String sourceRegion;

    @Option(names = "--search-tag-key", description = "key of a tag backups have to carry")
    @JsonProperty("search_tag_key")
    public String searchTagKey;

    @Option(names = "--search-tag-value", description = "value of the tag given by --search-tag-key")
    @JsonProperty("search_tag_value")
    public String searchTagValue;

    @Option(names = "--search-asset-id", description = "id of the volume, instance, database resource or table to restore")
    @JsonProperty("search_asset_id")
    public String searchAssetId;

    @Option(names = "--search-direction",
        description = "'before' lists backups up to the end offset, newest first, 'after' lists backups between start and end offset, oldest first")
    @JsonProperty("search_direction")
    public String searchDirection;

    @Option(names = "--start-search-day-offset", defaultValue = "1", description = "days back from today the search window starts, defaults to 1")
    @JsonProperty("start_search_day_offset")
    public int startDayOffset = DEFAULT_START_DAY_OFFSET;

    @Option(names = "--end-search-day-offset", defaultValue = "0", description = "days back from today the search window ends, defaults to 0")
    @JsonProperty("end_search_day_offset")
    public int endDayOffset = DEFAULT_END_DAY_OFFSET;

    @Option(names = "--max-results", defaultValue = "500", description = "number of backups a search may return before it fails, defaults to 500")
    @JsonProperty("max_results")
    public int maxResults = DEFAULT_MAX_RESULTS;

    @Option(names = "--latest-only", description = "keep only the most recent backup of every asset in the search order")
    @JsonProperty("latest_only")
    public boolean latestOnly;

    @Option(names = "--search-pg-name", description = "name of the protection group to list backups of")
    @JsonProperty("search_pg_name")
    public String protectionGroupName;

    @Option(names = "--search-bucket-name", description = "bucket of the protection group to restore, repeatable, all buckets when not set")
    @JsonProperty("search_bucket_names")
    public List<String> bucketNames = new ArrayList<>();

    @JsonProperty("search_object_filters")
    public Map<String, Object> objectFilters = new LinkedHashMap<>();

    public DiscoverySpec() {
        // for picocli
    }

    @JsonCreator
    public DiscoverySpec(@JsonProperty("source_account") final String sourceAccount,
                         @JsonProperty("source_region") final String sourceRegion,
                         @JsonProperty("search_tag_key") final String searchTagKey,
                         @JsonProperty("search_tag_value") final String searchTagValue,
                         @JsonProperty("search_asset_id") final String searchAssetId,
                         @JsonProperty("search_direction") final String searchDirection,
                         @JsonProperty("start_search_day_offset") final Integer startDayOffset,
                         @JsonProperty("end_search_day_offset") final Integer endDayOffset,
                         @JsonProperty("max_results") final Integer maxResults,
                         @JsonProperty("latest_only") final boolean latestOnly,
                         @JsonProperty("search_pg_name") final String protectionGroupName,
                         @JsonProperty("search_bucket_names") final List<String> bucketNames,
                         @JsonProperty("search_object_filters") final Map<String, Object> objectFilters) {
        this.sourceAccount = sourceAccount;
        this.sourceRegion = sourceRegion;
        this.searchTagKey = searchTagKey;
        this.searchTagValue = searchTagValue;
        this.searchAssetId = searchAssetId;
        this.searchDirection = searchDirection;
        this.startDayOffset = startDayOffset == null ? DEFAULT_START_DAY_OFFSET : startDayOffset;
        this.endDayOffset = endDayOffset == null ? DEFAULT_END_DAY_OFFSET : endDayOffset;
        this.maxResults = maxResults == null ? DEFAULT_MAX_RESULTS : maxResults;
        this.latestOnly = latestOnly;
        this.protectionGroupName = protectionGroupName;
        this.bucketNames = bucketNames == null ? new ArrayList<>() : new ArrayList<>(bucketNames);
        this.objectFilters = objectFilters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(objectFilters);
    }

    public SearchWindow searchWindow() {
        return new SearchWindow(SearchDirection.parse(searchDirection), startDayOffset, endDayOffset);
    }

    public void validate() {
        if (isNullOrEmpty(sourceAccount)) {
            throw new ValidationException("source_account", "source_account has to be set");
        }
        if (isNullOrEmpty(sourceRegion)) {
            throw new ValidationException("source_region", "source_region has to be set");
        }
        if (maxResults < 1) {
            throw new ValidationException("max_results", "max_results has to be a positive number");
        }
        searchWindow();
    }

    public DiscoverySpec forRegion(final String region) {
        return new DiscoverySpec(sourceAccount, region, searchTagKey, searchTagValue, searchAssetId, searchDirection,
                                 startDayOffset, endDayOffset, maxResults, latestOnly, protectionGroupName, bucketNames, objectFilters);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("sourceAccount", sourceAccount)
            .add("sourceRegion", sourceRegion)
            .add("searchTagKey", searchTagKey)
            .add("searchTagValue", searchTagValue)
            .add("searchAssetId", searchAssetId)
            .add("searchDirection", searchDirection)
            .add("startDayOffset", startDayOffset)
            .add("endDayOffset", endDayOffset)
            .add("maxResults", maxResults)
            .add("latestOnly", latestOnly)
            .add("protectionGroupName", protectionGroupName)
            .add("bucketNames", bucketNames)
            .add("objectFilters", objectFilters)
            .toString();
    }
}
