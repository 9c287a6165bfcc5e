package work.bridge.sdk.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.bridge.sdk.marker.StepReference;
import work.bridge.sdk.schema.ParameterSet;
import work.bridge.sdk.schema.ReturnSchema;

/**
 * Immutable description of one registered step: identity, options, schemas, data-flow inputs and the
 * callable that executes it. {@link #dependsOn()} is always the de-duplicated value set of
 * {@link #paramsFromStepResults()}.
 */
public final class StepDescriptor implements StepReference {
    private final String name;
    private final String description;
    private final String setupScript;
    private final String postExecutionScript;
    private final Map<String, Object> metadata;
    private final String sandboxId;
    private final Map<String, String> credentialBindings;
    private final ParameterSet parameters;
    private final ReturnSchema returnSchema;
    private final Map<String, String> paramsFromStepResults;
    private final Set<String> dependsOn;
    private final SourceLocation sourceLocation;
    private final StepCallable callable;

    StepDescriptor(
        String name,
        StepOptions options,
        ParameterSet parameters,
        ReturnSchema returnSchema,
        Map<String, String> paramsFromStepResults,
        SourceLocation sourceLocation,
        StepCallable callable
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = options.description();
        this.setupScript = options.setupScript();
        this.postExecutionScript = options.postExecutionScript();
        this.metadata = options.metadata();
        this.sandboxId = options.sandboxId();
        this.credentialBindings = options.credentialBindings();
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.returnSchema = Objects.requireNonNull(returnSchema, "returnSchema");
        this.paramsFromStepResults = Collections.unmodifiableMap(new LinkedHashMap<>(paramsFromStepResults));
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(paramsFromStepResults.values()));
        this.sourceLocation = sourceLocation == null ? SourceLocation.unknown() : sourceLocation;
        this.callable = Objects.requireNonNull(callable, "callable");
    }

    @Override
    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String setupScript() {
        return setupScript;
    }

    public String postExecutionScript() {
        return postExecutionScript;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public String sandboxId() {
        return sandboxId;
    }

    public Map<String, String> credentialBindings() {
        return credentialBindings;
    }

    public ParameterSet parameters() {
        return parameters;
    }

    public ReturnSchema returnSchema() {
        return returnSchema;
    }

    public Map<String, String> paramsFromStepResults() {
        return paramsFromStepResults;
    }

    public Set<String> dependsOn() {
        return dependsOn;
    }

    public List<DependencyEdge> dependencyEdges() {
        var edges = new ArrayList<DependencyEdge>(paramsFromStepResults.size());
        paramsFromStepResults.forEach((param, step) -> edges.add(new DependencyEdge(param, step)));
        return edges;
    }

    public SourceLocation sourceLocation() {
        return sourceLocation;
    }

    public StepCallable callable() {
        return callable;
    }

    @Override
    public String toString() {
        return "StepDescriptor(name=" + name + ", dependsOn=" + dependsOn + ")";
    }
}
