package com.instaclustr.bulkrestore.cli;

import java.util.Collections;
import java.util.List;

import com.google.inject.Inject;
import com.google.inject.Module;
import com.instaclustr.bulkrestore.guice.ResolutionModule;
import com.instaclustr.bulkrestore.impl.resolve.FormatOperationRequest;
import com.instaclustr.bulkrestore.operations.Operation;
import com.instaclustr.bulkrestore.operations.OperationsService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import static com.instaclustr.bulkrestore.operations.Operation.State.FAILED;
import static java.lang.String.format;
import static org.awaitility.Awaitility.await;

@Command(name = "format",
    description = "turns discovered backups and target specs into restore groups",
    sortOptions = false,
    mixinStandardHelpOptions = true
)
public class FormatApplication implements Runnable {

    @Mixin
    private FormatOperationRequest request;

    @Inject
    private OperationsService operationsService;

    public static void main(String[] args) {
        System.exit(BulkRestore.execute(new CommandLine(new FormatApplication()), args));
    }

    @Override
    public void run() {
        final List<Module> modules = Collections.singletonList(new ResolutionModule());

        BulkRestore.init(this, modules);

        final Operation<?> operation = operationsService.submitOperationRequest(request);

        await().forever().until(() -> operation.state.isTerminalState());

        if (operation.state == FAILED) {
            throw new IllegalStateException(format("Format operation %s was not successful.", operation.id));
        }
    }
}
