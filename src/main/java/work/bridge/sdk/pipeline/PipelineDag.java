package work.bridge.sdk.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.bridge.sdk.step.StepDescriptor;
import work.bridge.sdk.step.StepRegistry;

/**
 * Execution-order graph of one pipeline, derived from the live registry each time it is computed.
 *
 * @param pipeline     the pipeline it was computed for
 * @param dag          member name to the names of the steps it depends on
 * @param rootSteps    members with no dependencies
 * @param leafSteps    members no other member depends on
 * @param inputSchema  parameter schema of each root step, keyed by step name
 * @param outputSchema return schema of each leaf step, keyed by step name
 */
public record PipelineDag(
    PipelineDescriptor pipeline,
    Map<String, List<String>> dag,
    List<String> rootSteps,
    List<String> leafSteps,
    Map<String, JsonNode> inputSchema,
    Map<String, JsonNode> outputSchema
) {
    public PipelineDag {
        dag = Collections.unmodifiableMap(new LinkedHashMap<>(dag));
        rootSteps = List.copyOf(rootSteps);
        leafSteps = List.copyOf(leafSteps);
        inputSchema = Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
        outputSchema = Collections.unmodifiableMap(new LinkedHashMap<>(outputSchema));
    }

    /**
     * Builds the graph over the pipeline's members. Dependencies on steps outside the member set stay as
     * edges but are not expanded. Members missing from the registry are skipped.
     */
    public static PipelineDag compute(PipelineDescriptor pipeline, StepRegistry registry) {
        Map<String, StepDescriptor> snapshot = registry.snapshot();
        var dag = new LinkedHashMap<String, List<String>>();
        var members = new LinkedHashMap<String, StepDescriptor>();
        for (String member : pipeline.members()) {
            StepDescriptor step = snapshot.get(member);
            if (step != null) {
                members.put(member, step);
                dag.put(member, List.copyOf(step.dependsOn()));
            }
        }

        var rootSteps = new ArrayList<String>();
        Set<String> referenced = new HashSet<>();
        dag.forEach((name, deps) -> {
            if (deps.isEmpty()) {
                rootSteps.add(name);
            }
            for (String dep : deps) {
                if (!dep.equals(name)) {
                    referenced.add(dep);
                }
            }
        });
        var leafSteps = new ArrayList<String>();
        for (String name : dag.keySet()) {
            if (!referenced.contains(name)) {
                leafSteps.add(name);
            }
        }

        var inputSchema = new LinkedHashMap<String, JsonNode>();
        for (String root : rootSteps) {
            inputSchema.put(root, members.get(root).parameters().jsonSchema());
        }
        var outputSchema = new LinkedHashMap<String, JsonNode>();
        for (String leaf : leafSteps) {
            outputSchema.put(leaf, members.get(leaf).returnSchema().jsonSchema());
        }
        return new PipelineDag(pipeline, dag, rootSteps, leafSteps, inputSchema, outputSchema);
    }

    public Optional<List<String>> dependenciesOf(String step) {
        return Optional.ofNullable(dag.get(step));
    }
}
