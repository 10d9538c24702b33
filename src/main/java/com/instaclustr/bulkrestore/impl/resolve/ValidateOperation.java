package com.instaclustr.bulkrestore.impl.resolve;

import java.util.List;

import javax.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.assistedinject.Assisted;
import com.instaclustr.bulkrestore.impl.spec.BulkRestoreInput;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.operations.Operation;

public class ValidateOperation extends Operation<ValidateOperationRequest> {

    private final InputValidator inputValidator;
    private final ObjectMapper objectMapper;

    @Inject
    public ValidateOperation(@Assisted final ValidateOperationRequest request,
                             final InputValidator inputValidator,
                             final ObjectMapper objectMapper) {
        super(request);
        this.inputValidator = inputValidator;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void run0() throws Exception {
        final BulkRestoreInput input = request.input != null
            ? request.input
            : objectMapper.readValue(request.inputFile.toFile(), BulkRestoreInput.class);

        final List<RestoreGroup> validated = inputValidator.validate(input.getDefaultInput(), input.getRestoreGroups());

        request.response = new BulkRestoreInput(input.getDefaultInput(), validated);

        OutputWriter.write(objectMapper, request.response, request.outputFile);
    }
}
