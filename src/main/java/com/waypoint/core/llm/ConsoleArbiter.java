package com.waypoint.core.llm;

import com.waypoint.core.model.ArbiterVerdict;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link MissionArbiter} that shows the runs on the terminal and asks the operator.
 */
public class ConsoleArbiter implements MissionArbiter {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleArbiter(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public ArbiterVerdict judge(String request, List<String> runs) {
        out.println("Mission: " + request);
        out.println("Example runs of the generated specification:");
        for (int i = 0; i < runs.size(); i++) {
            out.println("  " + (i + 1) + ". " + runs.get(i));
        }
        try {
            while (true) {
                out.print("Do these runs match the mission? [y/n]: ");
                out.flush();
                String answer = in.readLine();
                if (answer == null) {
                    return new ArbiterVerdict(false, "Operator input closed before answering");
                }
                answer = answer.trim().toLowerCase();
                if (answer.equals("y") || answer.equals("yes")) {
                    return new ArbiterVerdict(true, "Approved by operator");
                }
                if (answer.equals("n") || answer.equals("no")) {
                    out.print("What is wrong with them? ");
                    out.flush();
                    String reason = in.readLine();
                    return new ArbiterVerdict(false, reason == null || reason.isBlank()
                            ? "The operator rejected the example runs" : reason.trim());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read operator answer", e);
        }
    }
}
