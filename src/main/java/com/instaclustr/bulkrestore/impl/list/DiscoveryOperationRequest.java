package com.instaclustr.bulkrestore.impl.list;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.operations.OperationRequest;
import picocli.CommandLine;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import static com.google.common.base.Strings.isNullOrEmpty;

public class DiscoveryOperationRequest extends OperationRequest {

    @Mixin
    @JsonProperty("discovery")
    public DiscoverySpec discovery;

    @Option(names = "--resource-type",
        converter = ResourceTypeConverter.class,
        description = "resource type to discover backups of, repeatable, all types when not set")
    @JsonProperty("resource_types")
    public List<ResourceType> resourceTypes = new ArrayList<>();

    @Option(names = "--all-regions", description = "discover backups in every region the source account is connected in")
    @JsonProperty("all_regions")
    public boolean allRegions;

    @JsonProperty("response")
    public DiscoveryResult response;

    public DiscoveryOperationRequest() {
        // for picocli
    }

    @JsonCreator
    public DiscoveryOperationRequest(@JsonProperty("type") final String type,
                                     @JsonProperty("discovery") final DiscoverySpec discovery,
                                     @JsonProperty("resource_types") final List<ResourceType> resourceTypes,
                                     @JsonProperty("all_regions") final boolean allRegions) {
        this.type = type;
        this.discovery = discovery;
        this.resourceTypes = resourceTypes == null ? new ArrayList<>() : new ArrayList<>(resourceTypes);
        this.allRegions = allRegions;
    }

    /**
     * @return requested resource types. When none was requested, every type, protection groups only when a
     * group name is searched for.
     */
    public List<ResourceType> effectiveResourceTypes() {
        if (resourceTypes != null && !resourceTypes.isEmpty()) {
            return resourceTypes;
        }
        final List<ResourceType> types = new ArrayList<>(Arrays.asList(ResourceType.values()));
        if (discovery == null || isNullOrEmpty(discovery.protectionGroupName)) {
            types.remove(ResourceType.OBJECT_PROTECTION_GROUP);
        }
        return types;
    }

    @Override
    public void validate() {
        if (discovery == null) {
            throw new ValidationException("discovery", "discovery has to be set");
        }
        if (allRegions) {
            if (isNullOrEmpty(discovery.sourceAccount)) {
                throw new ValidationException("source_account", "source_account has to be set");
            }
        } else {
            discovery.validate();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("discovery", discovery)
            .add("resourceTypes", resourceTypes)
            .add("allRegions", allRegions)
            .toString();
    }

    private static class ResourceTypeConverter implements CommandLine.ITypeConverter<ResourceType> {

        @Override
        public ResourceType convert(final String value) {
            return ResourceType.parse(value);
        }
    }
}
