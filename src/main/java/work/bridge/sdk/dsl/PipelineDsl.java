package work.bridge.sdk.dsl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import work.bridge.sdk.pipeline.PipelineDag;

/**
 * Serialized form of a computed pipeline graph. {@code module_path} holds the declaring unit's identifier.
 */
@JsonPropertyOrder({
    "name",
    "description",
    "module_path",
    "steps",
    "dag",
    "root_steps",
    "leaf_steps",
    "input_json_schema",
    "output_json_schema"
})
public record PipelineDsl(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("module_path") String modulePath,
    @JsonProperty("steps") List<String> steps,
    @JsonProperty("dag") Map<String, List<String>> dag,
    @JsonProperty("root_steps") List<String> rootSteps,
    @JsonProperty("leaf_steps") List<String> leafSteps,
    @JsonProperty("input_json_schema") Map<String, JsonNode> inputJsonSchema,
    @JsonProperty("output_json_schema") Map<String, JsonNode> outputJsonSchema
) {
    public static PipelineDsl of(PipelineDag dag) {
        return new PipelineDsl(
            dag.pipeline().name(),
            dag.pipeline().description(),
            dag.pipeline().unitId(),
            dag.pipeline().members(),
            dag.dag(),
            dag.rootSteps(),
            dag.leafSteps(),
            dag.inputSchema(),
            dag.outputSchema()
        );
    }
}
