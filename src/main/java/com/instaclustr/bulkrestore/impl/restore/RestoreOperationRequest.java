package com.instaclustr.bulkrestore.impl.restore;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.impl.task.PollingSpec;
import com.instaclustr.bulkrestore.operations.OperationRequest;

/**
 * Restores validated restore groups one after another. Outcomes are available in {@link #outcomes} once the
 * operation is done.
 */
public class RestoreOperationRequest extends OperationRequest {

    @JsonProperty("restore_groups")
    public List<RestoreGroup> restoreGroups;

    @JsonProperty("polling")
    public PollingSpec polling;

    @JsonProperty("outcomes")
    public List<RestoreOutcome> outcomes = new ArrayList<>();

    public RestoreOperationRequest() {
        this.polling = new PollingSpec();
    }

    @JsonCreator
    public RestoreOperationRequest(@JsonProperty("type") final String type,
                                   @JsonProperty("restore_groups") final List<RestoreGroup> restoreGroups,
                                   @JsonProperty("polling") final PollingSpec polling) {
        this.type = type;
        this.restoreGroups = restoreGroups;
        this.polling = polling == null ? new PollingSpec() : polling;
    }

    @Override
    public void validate() {
        if (restoreGroups == null) {
            throw new ValidationException("restore_groups", "restore_groups have to be set");
        }
        polling.validate();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("restoreGroups", restoreGroups)
            .add("polling", polling)
            .add("outcomes", outcomes)
            .toString();
    }
}
