package com.libragraph.depot.cli;

import io.quarkus.picocli.runtime.PicocliCommandLineFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;
import picocli.CommandLine;

/**
 * Turns any failure of a command into one error line and exit code 1.
 */
@ApplicationScoped
public class CommandLineConfiguration {

    private static final Logger log = Logger.getLogger(CommandLineConfiguration.class);

    static final int FAILURE = 1;

    @Produces
    CommandLine commandLine(PicocliCommandLineFactory factory) {
        return factory.create()
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    log.errorf("%s failed: %s", commandLine.getCommandName(), e.getMessage());
                    log.debug("Failure details", e);
                    return FAILURE;
                });
    }
}
