package work.bridge.sdk.dsl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.bridge.sdk.step.StepDescriptor;

/**
 * Serialized form of a step descriptor. Field names are consumed by external tooling and must not change.
 */
@JsonPropertyOrder({
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
})
public record StepDsl(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("setup_script") String setupScript,
    @JsonProperty("post_execution_script") String postExecutionScript,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("execution_environment_id") String executionEnvironmentId,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("file_line_number") Integer fileLineNumber,
    @JsonProperty("params_json_schema") JsonNode paramsJsonSchema,
    @JsonProperty("return_json_schema") JsonNode returnJsonSchema,
    @JsonProperty("params_from_step_results") Map<String, String> paramsFromStepResults,
    @JsonProperty("credential_bindings") Map<String, String> credentialBindings
) {
    public static StepDsl of(StepDescriptor step) {
        var location = step.sourceLocation();
        return new StepDsl(
            step.name(),
            step.description(),
            step.setupScript(),
            step.postExecutionScript(),
            step.metadata(),
            step.sandboxId(),
            new ArrayList<>(step.dependsOn()),
            location.filePath(),
            location.lineNumber(),
            step.parameters().jsonSchema(),
            step.returnSchema().jsonSchema(),
            step.paramsFromStepResults(),
            step.credentialBindings()
        );
    }
}
