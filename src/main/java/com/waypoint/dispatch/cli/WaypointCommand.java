package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Waypoint.
 * Routes to subcommands: mission, compile, health, serve.
 */
@Command(
        name = "waypoint",
        mixinStandardHelpOptions = true,
        version = "Waypoint 0.1.0",
        description = "Verified robot mission planning with Spin and LangGraph4j",
        subcommands = {
                MissionCommand.class,
                CompileCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WaypointCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
