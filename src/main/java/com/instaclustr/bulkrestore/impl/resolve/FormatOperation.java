package com.instaclustr.bulkrestore.impl.resolve;

import java.util.List;

import javax.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.inject.assistedinject.Assisted;
import com.instaclustr.bulkrestore.impl.list.DiscoveryResult;
import com.instaclustr.bulkrestore.impl.spec.BulkRestoreInput;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.impl.spec.TargetSpecs;
import com.instaclustr.bulkrestore.operations.Operation;

/**
 * Output is a document with restore groups only, ready to be completed by validation.
 */
public class FormatOperation extends Operation<FormatOperationRequest> {

    private final RestoreGroupFormatter formatter;
    private final ObjectMapper objectMapper;

    @Inject
    public FormatOperation(@Assisted final FormatOperationRequest request,
                           final RestoreGroupFormatter formatter,
                           final ObjectMapper objectMapper) {
        super(request);
        this.formatter = formatter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void run0() throws Exception {
        final DiscoveryResult discovery = request.discovery != null
            ? request.discovery
            : objectMapper.readValue(request.discoveryFile.toFile(), DiscoveryResult.class);

        final TargetSpecs targets = request.targets != null
            ? request.targets
            : objectMapper.readValue(request.targetsFile.toFile(), TargetSpecs.class);

        final List<RestoreGroup> groups = formatter.toRestoreGroups(discovery, targets);

        request.response = new BulkRestoreInput(ImmutableMap.of(), groups);

        OutputWriter.write(objectMapper, request.response, request.outputFile);
    }
}
