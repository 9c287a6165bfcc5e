package work.bridge.sdk.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores step descriptors by name.
 * <p>
 * Registering a name that already exists replaces the previous descriptor (last write wins), which lets
 * units be reloaded and tests re-declare steps. Use {@link #reset()} to start from an empty store.
 * Only writes are guarded; step bodies never run under this lock.
 */
public final class StepRegistry {
    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, StepDescriptor> steps = new LinkedHashMap<>();

    public StepDescriptor register(StepDescriptor descriptor) {
        StepDescriptor previous;
        synchronized (steps) {
            previous = steps.put(descriptor.name(), descriptor);
        }
        if (previous != null) {
            log.debug("Step '{}' re-registered; previous declaration replaced", descriptor.name());
        }
        return descriptor;
    }

    public Optional<StepDescriptor> get(String name) {
        synchronized (steps) {
            return Optional.ofNullable(steps.get(name));
        }
    }

    public boolean contains(String name) {
        synchronized (steps) {
            return steps.containsKey(name);
        }
    }

    public void unregister(String name) {
        if (name == null) {
            return;
        }
        synchronized (steps) {
            steps.remove(name);
        }
    }

    public int size() {
        synchronized (steps) {
            return steps.size();
        }
    }

    /**
     * Point-in-time copy in registration order.
     */
    public Map<String, StepDescriptor> snapshot() {
        synchronized (steps) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        }
    }

    public void reset() {
        synchronized (steps) {
            steps.clear();
        }
    }
}
