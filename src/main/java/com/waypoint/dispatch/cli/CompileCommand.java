package com.waypoint.dispatch.cli;

import com.waypoint.core.compiler.CompilationException;
import com.waypoint.core.compiler.ModelTemplate;
import com.waypoint.core.compiler.PlanCompiler;
import com.waypoint.core.compiler.PlanParseException;
import com.waypoint.core.compiler.TaskPlanParser;
import com.waypoint.core.consistency.ConsistencyChecker;
import com.waypoint.core.logic.AutomatonTranslationException;
import com.waypoint.core.logic.AutomatonTranslator;
import com.waypoint.core.logic.LogicParseException;
import com.waypoint.core.logic.LogicSpecificationParser;
import com.waypoint.core.logic.MacroAligner;
import com.waypoint.core.model.TaskPlan;
import com.waypoint.core.model.VerificationModel;
import com.waypoint.core.model.VerificationResult;
import com.waypoint.core.verification.VerificationDriver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: waypoint compile &lt;plan.xml&gt; [--logic mission.ltl]
 * <p>
 * Compiles a plan file to Promela without any generator involved. With {@code --logic} it also
 * runs the consistency check and Spin against the given specification.
 */
@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compile a plan to Promela, optionally verifying it against a logic file")
@Component
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Plan XML file")
    private Path planFile;

    @Option(names = {"--logic", "-l"}, description = "Logic specification (macros + formula) to verify against")
    private Path logicFile;

    @Option(names = {"--output", "-o"}, description = "Write the Promela model here instead of stdout")
    private Path output;

    private final TaskPlanParser planParser;
    private final PlanCompiler compiler;
    private final ModelTemplate template;
    private final LogicSpecificationParser logicParser;
    private final AutomatonTranslator translator;
    private final ConsistencyChecker checker;
    private final MacroAligner aligner;
    private final VerificationDriver driver;

    public CompileCommand(TaskPlanParser planParser, PlanCompiler compiler, ModelTemplate template,
                          LogicSpecificationParser logicParser, AutomatonTranslator translator,
                          ConsistencyChecker checker, MacroAligner aligner, VerificationDriver driver) {
        this.planParser = planParser;
        this.compiler = compiler;
        this.template = template;
        this.logicParser = logicParser;
        this.translator = translator;
        this.checker = checker;
        this.aligner = aligner;
        this.driver = driver;
    }

    @Override
    public Integer call() throws IOException {
        TaskPlan plan;
        VerificationModel model;
        try {
            plan = planParser.parse(Files.readString(planFile));
            model = compiler.compile(plan, template.text());
        } catch (PlanParseException | CompilationException e) {
            ConsoleOutput.error("Cannot compile " + planFile + ": " + e.getMessage());
            return 1;
        }

        if (output != null) {
            Files.writeString(output, model.source());
            ConsoleOutput.success("Model written to " + output);
        } else if (logicFile == null) {
            System.out.println(model.source());
        }
        ConsoleOutput.info("Tasks: " + String.join(", ", model.catalog().taskNames()));
        ConsoleOutput.info("Globals: " + String.join(", ", model.catalog().globals()));

        if (logicFile == null) {
            return 0;
        }
        return verify(plan, model);
    }

    private int verify(TaskPlan plan, VerificationModel model) throws IOException {
        try {
            var specification = logicParser.parse(Files.readString(logicFile));
            var report = checker.check(plan, translator.translate(specification));
            if (!report.consistent()) {
                ConsoleOutput.error(report.correctiveMessage());
                return 1;
            }
            ConsoleOutput.success("Consistent: " + report.planTaskCount() + " task(s)");

            var aligned = aligner.align(model.catalog(), specification.macros());
            VerificationResult result = driver.verify(model, aligned, specification.formula());
            switch (result.outcome()) {
                case PASSED -> ConsoleOutput.success("Spin: property holds (" + result.modelPath() + ")");
                case VIOLATION -> {
                    ConsoleOutput.error("Spin: property violated (" + result.modelPath() + ")");
                    System.out.println(result.counterexampleText());
                }
                case SETUP_FAILURE -> {
                    ConsoleOutput.error("Spin could not check the model");
                    System.out.println(result.counterexampleText());
                }
            }
            return result.passed() ? 0 : 1;
        } catch (LogicParseException | AutomatonTranslationException e) {
            ConsoleOutput.error("Cannot use " + logicFile + ": " + e.getMessage());
            return 1;
        }
    }
}
