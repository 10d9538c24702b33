package com.instaclustr.bulkrestore.operations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import com.google.common.collect.BiMap;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.instaclustr.bulkrestore.threading.Executors;
import com.instaclustr.bulkrestore.threading.Executors.ExecutorServiceSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;
import static java.util.stream.Collectors.toList;

/**
 * Creates operations from requests and runs them on a shared executor. Restore pipelines of independent
 * assets are submitted here concurrently, each operation owning its own request and result.
 */
public class OperationsService extends AbstractIdleService {

    private static final Logger logger = LoggerFactory.getLogger(OperationsService.class);

    public static final String EXECUTOR_SIZE_PROPERTY = "bulkrestore.operations.executor.size";

    private final ListeningExecutorService executorService;
    @SuppressWarnings("rawtypes")
    private final Map<Class<? extends OperationRequest>, OperationFactory> operationFactoriesByRequestType;
    private final Map<UUID, Operation<?>> operations = new ConcurrentHashMap<>();
    private final BiMap<Class<? extends OperationRequest>, String> typeMappings;

    @Inject
    @SuppressWarnings("rawtypes")
    public OperationsService(final Map<Class<? extends OperationRequest>, OperationFactory> operationFactoriesByRequestType,
                             final ExecutorServiceSupplier executorServiceSupplier,
                             final Map<String, Class<? extends OperationRequest>> typeMappings) {
        this.operationFactoriesByRequestType = operationFactoriesByRequestType;
        this.executorService = executorServiceSupplier.get(Integer.parseInt(System.getProperty(EXECUTOR_SIZE_PROPERTY,
                                                                                               Executors.DEFAULT_CONCURRENT_OPERATIONS.toString())));
        this.typeMappings = ImmutableBiMap.copyOf(typeMappings).inverse();
    }

    @Override
    protected void startUp() throws Exception {
    }

    @Override
    protected void shutDown() throws Exception {
        MoreExecutors.shutdownAndAwaitTermination(executorService, 1, TimeUnit.MINUTES);
    }

    public void submitOperation(final Operation<?> operation) {
        operations.put(operation.id, operation);
        executorService.submit(operation);
    }

    public void closeOperation(final UUID operationId) {
        operation(operationId).ifPresent(Operation::close);
    }

    @SuppressWarnings("unchecked")
    public <RequestT extends OperationRequest> Operation<RequestT> submitOperationRequest(final RequestT request) {
        final OperationFactory<RequestT> operationFactory = operationFactoriesByRequestType.get(request.getClass());

        if (operationFactory == null) {
            throw new IllegalStateException(format("There is no operation registered for request of type %s", request.getClass().getName()));
        }

        request.validate();

        final Operation<RequestT> operation = operationFactory.createOperation(request);
        operation.type = typeMappings.get(request.getClass());
        operation.request.type = operation.type;

        logger.debug("Submitting operation {} of type {}", operation.id, operation.type);

        submitOperation(operation);

        return operation;
    }

    public Map<UUID, Operation<?>> operations() {
        return Collections.unmodifiableMap(operations);
    }

    public Optional<Operation<?>> operation(final UUID id) {
        return Optional.ofNullable(operations.get(id));
    }

    public boolean noneIsRunning() {
        return allRunning().isEmpty();
    }

    public List<UUID> allRunning() {
        return getIdsOfOperations(operation -> !operation.state.isTerminalState());
    }

    public List<Operation<?>> getOperations(final Predicate<Operation<?>> predicate) {
        return Collections.unmodifiableList(operations.values().stream().filter(predicate).collect(toList()));
    }

    public List<UUID> getIdsOfOperations(final Predicate<Operation<?>> predicate) {
        final List<UUID> filteredOperations = new ArrayList<>();

        for (final Map.Entry<UUID, Operation<?>> operation : operations.entrySet()) {
            if (predicate.test(operation.getValue())) {
                filteredOperations.add(operation.getKey());
            }
        }

        return filteredOperations;
    }
}
