package com.instaclustr.bulkrestore.cli;

import java.util.ArrayList;
import java.util.List;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Stage;
import com.instaclustr.bulkrestore.jackson.JacksonModule;
import com.instaclustr.bulkrestore.operations.OperationsModule;
import com.instaclustr.bulkrestore.threading.ExecutorsModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(subcommands = {
    ValidateApplication.class,
    FormatApplication.class
},
    name = "bulk-restore",
    usageHelpWidth = 128,
    description = "Application preparing bulk restores of cloud resource backups.",
    mixinStandardHelpOptions = true
)
public class BulkRestore implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(BulkRestore.class);

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        main(args, true);
    }

    public static int mainWithoutExit(String[] args) {
        return main(args, false);
    }

    public static int main(String[] args, boolean exit) {
        int exitCode = execute(new CommandLine(new BulkRestore()), args);

        if (exit) {
            System.exit(exitCode);
        }

        return exitCode;
    }

    static int execute(final CommandLine commandLine, final String... args) {
        return commandLine
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                logger.error("Command {} failed: {}", cmd.getCommandName(), ex.getMessage(), ex);
                return cmd.getCommandSpec().exitCodeOnExecutionException();
            })
            .execute(args);
    }

    static void init(final Runnable command, final List<Module> appSpecificModules) {
        final List<Module> modules = new ArrayList<>();

        modules.add(new JacksonModule());
        modules.add(new OperationsModule());
        modules.add(new ExecutorsModule());
        modules.addAll(appSpecificModules);

        final Injector injector = Guice.createInjector(
            Stage.PRODUCTION, // production binds singletons as eager by default
            modules
        );

        injector.injectMembers(command);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand.");
    }
}
