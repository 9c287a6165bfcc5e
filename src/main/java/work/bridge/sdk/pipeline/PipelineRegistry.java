package work.bridge.sdk.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores discovered pipelines by name. Like the step registry, the last registration of a name wins.
 */
public final class PipelineRegistry {
    private final Map<String, PipelineDescriptor> pipelines = new LinkedHashMap<>();

    public PipelineDescriptor register(PipelineDescriptor descriptor) {
        synchronized (pipelines) {
            pipelines.put(descriptor.name(), descriptor);
        }
        return descriptor;
    }

    public Optional<PipelineDescriptor> get(String name) {
        synchronized (pipelines) {
            return Optional.ofNullable(pipelines.get(name));
        }
    }

    public Map<String, PipelineDescriptor> snapshot() {
        synchronized (pipelines) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
        }
    }

    public void reset() {
        synchronized (pipelines) {
            pipelines.clear();
        }
    }
}
