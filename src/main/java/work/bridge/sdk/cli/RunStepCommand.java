package work.bridge.sdk.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.bridge.sdk.pipeline.PipelineRegistry;
import work.bridge.sdk.pipeline.StepDiscovery;
import work.bridge.sdk.runtime.InvocationEngine;
import work.bridge.sdk.step.StepDescriptor;
import work.bridge.sdk.step.StepRegistry;

@CommandLine.Command(
    name = "run",
    description = "Run a single step against JSON input and cached upstream results.",
    mixinStandardHelpOptions = true
)
final class RunStepCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private UnitOptions unitOptions = new UnitOptions();

    @CommandLine.Option(names = "--step", required = true, description = "Name of the step to run.")
    private String stepName;

    @CommandLine.Option(names = "--input", required = true, description = "JSON object passed to the step.")
    private String input;

    @CommandLine.Option(
        names = "--results",
        description = "JSON object of cached step results, e.g. {\"Step1\": \"abc\"}.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String results;

    @CommandLine.Option(
        names = "--results-file",
        description = "Path to a JSON file holding cached step results.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path resultsFile;

    @CommandLine.Option(
        names = "--output-file",
        description = "Path to write the step result to.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputFile;

    @Override
    public Integer call() throws Exception {
        List<String> units = unitOptions.resolve();
        var steps = new StepRegistry();
        new StepDiscovery(steps, new PipelineRegistry()).discoverAll(units);

        StepDescriptor step = steps.get(stepName).orElseThrow(() -> new CommandLine.ExecutionException(
            spec.commandLine(),
            "Step '" + stepName + "' not found in units " + units
                + ". Available steps: " + String.join(", ", steps.snapshot().keySet())
        ));

        String upstream = loadResults();
        JsonNode cached = parseResults(upstream);
        var missing = new ArrayList<String>();
        for (String dependency : step.dependsOn()) {
            if (!cached.has(dependency)) {
                missing.add(dependency);
            }
        }
        if (!missing.isEmpty()) {
            throw new CommandLine.ExecutionException(
                spec.commandLine(),
                "Missing cached results for: " + String.join(", ", missing)
            );
        }

        String result = new InvocationEngine().invoke(step, input, upstream);
        PrintWriter out = spec.commandLine().getOut();
        out.println("Step '" + stepName + "' executed successfully");
        out.println("Result: " + result);
        if (outputFile != null) {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, result, StandardCharsets.UTF_8);
            out.println("Result written to " + outputFile);
        }
        return 0;
    }

    private String loadResults() {
        if (resultsFile != null) {
            try {
                return Files.readString(resultsFile);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(
                    spec.commandLine(),
                    "Unable to read results file " + resultsFile + ": " + ex.getMessage(),
                    ex
                );
            }
        }
        if (results != null) {
            return results;
        }
        throw new CommandLine.ParameterException(spec.commandLine(), "Either --results or --results-file must be provided");
    }

    private JsonNode parseResults(String text) {
        try {
            JsonNode node = JSON.readTree(text);
            if (node == null || !node.isObject()) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Cached results must be a JSON object");
            }
            return node;
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(
                spec.commandLine(),
                "Error parsing results JSON: " + ex.getMessage(),
                ex
            );
        }
    }
}
