package work.bridge.sdk.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * What loading one unit produced: the steps it newly registered and its pipeline, if it has one.
 */
public record DiscoveryResult(String unitId, List<String> steps, Optional<PipelineDescriptor> pipeline) {
    public DiscoveryResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
        pipeline = pipeline == null ? Optional.empty() : pipeline;
    }
}
