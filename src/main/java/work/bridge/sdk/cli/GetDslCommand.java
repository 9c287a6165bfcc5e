package work.bridge.sdk.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.bridge.sdk.dsl.DslExporter;
import work.bridge.sdk.pipeline.PipelineRegistry;
import work.bridge.sdk.pipeline.StepDiscovery;
import work.bridge.sdk.step.StepRegistry;

@CommandLine.Command(
    name = "get-dsl",
    description = "Print the DSL of every discovered step and pipeline.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class GetDslCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private UnitOptions unitOptions = new UnitOptions();

    @CommandLine.Option(
        names = "--output-file",
        description = "Path to write the DSL JSON file.",
        defaultValue = "/tmp/config_get_dsl/dsl.json"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        var steps = new StepRegistry();
        var pipelines = new PipelineRegistry();
        new StepDiscovery(steps, pipelines).discoverAll(unitOptions.resolve());

        ObjectNode document = DslExporter.export(steps, pipelines);
        spec.commandLine().getOut().println(DslExporter.toJson(document));
        DslExporter.write(document, outputFile);
        return 0;
    }
}
