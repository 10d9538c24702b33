package com.instaclustr.bulkrestore.operations;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class OperationRequest {

    @JsonProperty
    public String type;

    /**
     * Checks the request before its operation is created. Requests which can be detected as malformed
     * without any backend call fail here.
     */
    public void validate() {
    }
}
