package work.bridge.sdk.dsl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.bridge.sdk.fixtures.LinearUnit;
import work.bridge.sdk.fixtures.StandaloneUnit;
import work.bridge.sdk.marker.FromStep;
import work.bridge.sdk.pipeline.PipelineRegistry;
import work.bridge.sdk.pipeline.StepDiscovery;
import work.bridge.sdk.step.StepDescriptor;
import work.bridge.sdk.step.StepOptions;
import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepRegistry;

class DslExporterTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @SuppressWarnings("unused")
    public static final class Steps {
        public int score(@FromStep("load") String text, int bonus) {
            return text.length() + bonus;
        }
    }

    private StepRegistry steps;
    private PipelineRegistry pipelines;

    @BeforeEach
    void setUp() {
        steps = new StepRegistry();
        pipelines = new PipelineRegistry();
    }

    private StepDescriptor scoreStep() {
        return new StepRegistrar(steps).step(
            new Steps(),
            "score",
            StepOptions.builder()
                .description("Scores text")
                .setupScript("setup.sh")
                .postExecutionScript("teardown.sh")
                .metadata(Map.of("owner", "search"))
                .sandboxId("env-7")
                .credentialBindings(Map.of("API_KEY", "cred-9"))
                .build()
        );
    }

    @Test
    void stepDumpUsesExternalFieldNames() {
        ObjectNode dump = DslExporter.dump(scoreStep());

        var fields = new ArrayList<String>();
        dump.fieldNames().forEachRemaining(fields::add);
        assertEquals(
            List.of(
                "name",
                "description",
                "setup_script",
                "post_execution_script",
                "metadata",
                "execution_environment_id",
                "depends_on",
                "file_path",
                "file_line_number",
                "params_json_schema",
                "return_json_schema",
                "params_from_step_results",
                "credential_bindings"
            ),
            fields
        );
        assertEquals("env-7", dump.get("execution_environment_id").asText());
        assertEquals("load", dump.get("depends_on").get(0).asText());
        assertEquals("load", dump.at("/params_from_step_results/text").asText());
        assertTrue(dump.get("file_line_number").isInt());
    }

    @Test
    void stepDumpRoundTrips() throws Exception {
        StepDescriptor step = scoreStep();
        String text = DslExporter.toJson(DslExporter.dump(step));

        assertEquals(StepDsl.of(step), DslExporter.readStep(JSON.readTree(text)));
    }

    @Test
    void dumpedSchemasAreUsableJsonSchema() {
        ObjectNode dump = DslExporter.dump(scoreStep());
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

        JsonSchema params = factory.getSchema(dump.get("params_json_schema"));
        assertTrue(params.validate(JSON.createObjectNode().put("text", "abc").put("bonus", 1)).isEmpty());
        assertEquals(1, params.validate(JSON.createObjectNode().put("text", "abc")).size());

        JsonSchema returns = factory.getSchema(dump.get("return_json_schema"));
        assertTrue(returns.validate(JSON.getNodeFactory().numberNode(4)).isEmpty());
    }

    @Test
    void unsetOptionsAreWrittenAsNull() {
        new StepDiscovery(steps, pipelines).discover(StandaloneUnit.class);

        ObjectNode greet = DslExporter.dump(steps.get("greet").orElseThrow());

        assertTrue(greet.get("description").isNull());
        assertTrue(greet.get("metadata").isNull());
        assertTrue(greet.get("credential_bindings").isNull());
        assertEquals(0, greet.get("depends_on").size());
    }

    @Test
    void exportsStepsAndPipelines() {
        new StepDiscovery(steps, pipelines).discover(LinearUnit.class);

        ObjectNode document = DslExporter.export(steps, pipelines);

        assertEquals(3, document.get("steps").size());
        JsonNode linear = document.at("/pipelines/linear");
        assertEquals(LinearUnit.class.getName(), linear.get("module_path").asText());
        assertEquals(3, linear.get("steps").size());
        assertEquals("extract", linear.at("/dag/enrich/0").asText());
        assertEquals("extract", linear.at("/root_steps/0").asText());
        assertEquals("publish", linear.at("/leaf_steps/0").asText());
        assertEquals("extract_args", linear.at("/input_json_schema/extract/title").asText());
        assertEquals("string", linear.at("/output_json_schema/publish/type").asText());

        PipelineDsl parsed = DslExporter.readPipeline(linear);
        assertEquals(List.of("extract", "enrich", "publish"), parsed.steps());
    }

    @Test
    void writesDocumentCreatingParentDirectories(@TempDir Path dir) throws Exception {
        new StepDiscovery(steps, pipelines).discover(StandaloneUnit.class);
        Path target = dir.resolve("nested/out/dsl.json");

        DslExporter.write(DslExporter.export(steps, pipelines), target);

        JsonNode written = JSON.readTree(Files.readString(target));
        assertTrue(written.at("/steps/add").isObject());
        assertTrue(written.get("pipelines").isEmpty());
    }
}
