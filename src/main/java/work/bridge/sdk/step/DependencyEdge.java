package work.bridge.sdk.step;

import java.util.Objects;

/**
 * Data-flow edge: {@code parameterName} is fed by the result of {@code sourceStepName}.
 */
public record DependencyEdge(String parameterName, String sourceStepName) {
    public DependencyEdge {
        Objects.requireNonNull(parameterName, "parameterName");
        Objects.requireNonNull(sourceStepName, "sourceStepName");
    }
}
