package work.bridge.sdk.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.bridge.sdk.pipeline.PipelineDag;
import work.bridge.sdk.pipeline.PipelineRegistry;
import work.bridge.sdk.step.StepDescriptor;
import work.bridge.sdk.step.StepRegistry;

/**
 * Dumps registered steps and pipelines into the JSON document read by deployment tooling:
 * {@code {"steps": {name: step}, "pipelines": {name: pipeline}}}.
 */
public final class DslExporter {
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private DslExporter() {}

    public static ObjectNode dump(StepDescriptor step) {
        return JSON.valueToTree(StepDsl.of(step));
    }

    public static ObjectNode dump(PipelineDag dag) {
        return JSON.valueToTree(PipelineDsl.of(dag));
    }

    public static ObjectNode export(StepRegistry steps, PipelineRegistry pipelines) {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode stepNodes = root.putObject("steps");
        steps.snapshot().forEach((name, step) -> stepNodes.set(name, dump(step)));
        ObjectNode pipelineNodes = root.putObject("pipelines");
        pipelines.snapshot().forEach((name, pipeline) -> pipelineNodes.set(name, dump(PipelineDag.compute(pipeline, steps))));
        return root;
    }

    public static String toJson(JsonNode document) {
        try {
            return JSON.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render DSL document", ex);
        }
    }

    public static void write(JsonNode document, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write DSL to " + target, ex);
        }
    }

    public static StepDsl readStep(JsonNode node) {
        return JSON.convertValue(node, StepDsl.class);
    }

    public static PipelineDsl readPipeline(JsonNode node) {
        return JSON.convertValue(node, PipelineDsl.class);
    }
}
