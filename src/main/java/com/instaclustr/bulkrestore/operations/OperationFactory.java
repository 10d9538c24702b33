package com.instaclustr.bulkrestore.operations;

@SuppressWarnings("rawtypes")
public interface OperationFactory<RequestT extends OperationRequest> {

    Operation createOperation(final RequestT request);
}
