package com.waypoint.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code waypoint} command line once the Spring context is up and reports its exit code
 * to Spring Boot.
 * <p>
 * {@code waypoint serve} is left to the embedded web server. An exception escaping a subcommand
 * is printed as a one-line error with exit code 1; the stack trace goes to the log.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final WaypointCommand waypointCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WaypointCommand waypointCommand, IFactory factory) {
        this.waypointCommand = waypointCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            log.info("Serve mode, the web server handles missions");
            return;
        }
        exitCode = commandLine().execute(args);
    }

    /**
     * Only a leading {@code serve} selects serve mode, so a mission request such as
     * {@code mission "serve tree A"} still runs as a mission.
     */
    static boolean isServeMode(String... args) {
        return args.length > 0 && "serve".equals(args[0]);
    }

    CommandLine commandLine() {
        return new CommandLine(waypointCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.error("{} failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(cmd.getCommandName() + ": " + ConsoleOutput.rootCauseMessage(e));
                    return EXIT_FAILURE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
