package com.waypoint.core.verification;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.logic.MacroAligner;
import com.waypoint.core.model.MacroBlock;
import com.waypoint.core.model.MacroDefinition;
import com.waypoint.core.model.VerificationModel;
import com.waypoint.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assembles model, macros and property into one Promela file and runs Spin on it.
 * <p>
 * The property is anchored to the initial state: {@code ltl mission { init && X(formula) }},
 * where {@code init} is the macro asserting the first task has not started yet. Spin writes
 * {@code <model file>.trail} into its working directory when it finds a violation; the trail
 * is moved next to the model file and replayed for a readable counterexample.
 */
@Component
public class VerificationDriver {

    private static final Logger log = LoggerFactory.getLogger(VerificationDriver.class);

    static final String SYNTHESIZED_INITIAL_MACRO = "initial_state";
    private static final Pattern ZERO_COMPARISON = Pattern.compile("\\.action\\.actionType\\s*==\\s*0\\b");

    private final CheckerProcessRunner runner;
    private final String spinBinary;
    private final Path workDirectory;
    private final Path logDirectory;
    private final Duration timeout;

    @Autowired
    public VerificationDriver(CheckerProcessRunner runner, WaypointProperties properties) {
        this(runner,
                properties.getVerification().getSpinBinary(),
                Path.of(properties.getVerification().getWorkDirectory()),
                Path.of(properties.getVerification().getLogDirectory()),
                Duration.ofSeconds(properties.getVerification().getTimeoutSeconds()));
    }

    public VerificationDriver(CheckerProcessRunner runner, String spinBinary, Path workDirectory,
                              Path logDirectory, Duration timeout) {
        this.runner = runner;
        this.spinBinary = spinBinary;
        this.workDirectory = workDirectory;
        this.logDirectory = logDirectory;
        this.timeout = timeout;
    }

    public VerificationResult verify(VerificationModel model, MacroBlock alignedMacros, String formula) {
        MacroBlock macros = alignedMacros;
        String initialMacro = findInitialStateMacro(alignedMacros).orElse(null);
        if (initialMacro == null) {
            Optional<String> firstTask = firstTask(model, alignedMacros);
            if (firstTask.isEmpty()) {
                Path modelPath = writeModel(model.source() + "\n" + alignedMacros.render() + "\n");
                log.warn("Cannot anchor the property of {}: no task to anchor on", modelPath.getFileName());
                return VerificationResult.setupFailure(modelPath,
                        "Cannot anchor the property: no macro references a task and the model declares no tasks");
            }
            macros = withSynthesizedInitialState(firstTask.get(), alignedMacros);
            initialMacro = SYNTHESIZED_INITIAL_MACRO;
        }

        String source = model.source()
                + "\n" + macros.render()
                + "\n" + "ltl mission { " + initialMacro + " && X(" + formula + ") }"
                + "\n";

        Path modelPath = writeModel(source);
        log.info("Verifying model {}", modelPath);

        ProcessOutcome search;
        try {
            search = runner.run(List.of(spinBinary, "-search", "-a", "-O2", modelPath.toString()),
                    workDirectory, timeout);
        } catch (CheckerProcessException e) {
            log.error("Spin could not be run: {}", e.getMessage());
            return VerificationResult.setupFailure(modelPath, e.getMessage());
        }

        Path trail = workDirectory.resolve(modelPath.getFileName() + ".trail");
        if (Files.exists(trail)) {
            return replayViolation(modelPath, moveNextToModel(trail, modelPath), search);
        }
        if (search.succeeded()) {
            log.info("Model {} satisfies the property", modelPath.getFileName());
            return VerificationResult.passed(modelPath);
        }
        log.warn("Spin failed on {} (exit {}, timedOut={})", modelPath.getFileName(),
                search.exitCode(), search.timedOut());
        String output = search.timedOut()
                ? "Spin timed out after " + timeout.toSeconds() + "s\n" + search.output()
                : search.output();
        return VerificationResult.setupFailure(modelPath, output);
    }

    /**
     * The name of a task macro comparing an action type against {@code 0}, if any.
     */
    static Optional<String> findInitialStateMacro(MacroBlock macros) {
        return macros.macros().stream()
                .filter(MacroAligner::isTaskReferencing)
                .filter(m -> ZERO_COMPARISON.matcher(m.body()).find())
                .map(MacroDefinition::name)
                .findFirst();
    }

    /**
     * The task of the first task-referencing macro, else the model's first task.
     */
    static Optional<String> firstTask(VerificationModel model, MacroBlock macros) {
        Optional<String> fromMacros = macros.macros().stream()
                .map(MacroAligner::referencedTask)
                .flatMap(Optional::stream)
                .findFirst();
        if (fromMacros.isPresent()) {
            return fromMacros;
        }
        List<String> tasks = model.catalog().taskNames();
        return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
    }

    private static MacroBlock withSynthesizedInitialState(String firstTask, MacroBlock macros) {
        var definitions = new ArrayList<>(macros.macros());
        definitions.add(0, new MacroDefinition(SYNTHESIZED_INITIAL_MACRO, firstTask + ".action.actionType == 0"));
        log.debug("No initial-state macro found, synthesized one for task {}", firstTask);
        return new MacroBlock(definitions);
    }

    /**
     * Spin's {@code -t} reads {@code <model>.trail} beside the model, so the trail moves there
     * before the replay. If the move fails the replay names the trail with {@code -k}.
     */
    private static Path moveNextToModel(Path trail, Path modelPath) {
        Path target = modelPath.resolveSibling(trail.getFileName());
        try {
            return Files.move(trail, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Could not move trail {} next to model: {}", trail, e.getMessage());
            return trail;
        }
    }

    private VerificationResult replayViolation(Path modelPath, Path trail, ProcessOutcome search) {
        log.info("Spin produced a trail for {}, replaying counterexample", modelPath.getFileName());
        List<String> command = trail.equals(modelPath.resolveSibling(trail.getFileName()))
                ? List.of(spinBinary, "-t", modelPath.toString())
                : List.of(spinBinary, "-t", "-k", trail.toString(), modelPath.toString());
        String counterexample;
        try {
            ProcessOutcome replay = runner.run(command, workDirectory, timeout);
            counterexample = replay.output();
        } catch (CheckerProcessException e) {
            log.warn("Trail replay failed: {}", e.getMessage());
            counterexample = "";
        }
        if (counterexample == null || counterexample.isBlank()) {
            counterexample = search.output().isBlank() ? "Spin reported a property violation" : search.output();
        }
        return VerificationResult.violation(modelPath, counterexample);
    }

    private Path writeModel(String source) {
        try {
            Files.createDirectories(logDirectory);
            Path file = Files.createTempFile(logDirectory, "mission-", ".pml");
            Files.writeString(file, source, StandardCharsets.UTF_8);
            return file.toAbsolutePath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write model file to " + logDirectory, e);
        }
    }
}
