package work.bridge.sdk.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.bridge.sdk.marker.StepReference;
import work.bridge.sdk.marker.StepResultMarker;

/**
 * Caller-supplied options applied when a step is registered.
 */
public final class StepOptions {
    private static final StepOptions DEFAULTS = builder().build();

    private final String name;
    private final String description;
    private final String setupScript;
    private final String postExecutionScript;
    private final Map<String, Object> metadata;
    private final String sandboxId;
    private final Map<String, String> credentialBindings;
    private final Map<String, List<StepResultMarker>> markers;

    private StepOptions(Builder builder) {
        this.name = blankToNull(builder.name);
        this.description = builder.description;
        this.setupScript = builder.setupScript;
        this.postExecutionScript = builder.postExecutionScript;
        this.metadata = builder.metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.sandboxId = builder.sandboxId;
        this.credentialBindings = builder.credentialBindings == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.credentialBindings));
        var copy = new LinkedHashMap<String, List<StepResultMarker>>();
        builder.markers.forEach((param, list) -> copy.put(param, List.copyOf(list)));
        this.markers = Collections.unmodifiableMap(copy);
    }

    public static StepOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

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

    /**
     * Programmatic produced-by-step markers per parameter, in the order they were added.
     */
    public Map<String, List<StepResultMarker>> markers() {
        return markers;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private String name;
        private String description;
        private String setupScript;
        private String postExecutionScript;
        private Map<String, Object> metadata;
        private String sandboxId;
        private Map<String, String> credentialBindings;
        private final Map<String, List<StepResultMarker>> markers = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder setupScript(String setupScript) {
            this.setupScript = setupScript;
            return this;
        }

        public Builder postExecutionScript(String postExecutionScript) {
            this.postExecutionScript = postExecutionScript;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder sandboxId(String sandboxId) {
            this.sandboxId = sandboxId;
            return this;
        }

        public Builder credentialBindings(Map<String, String> credentialBindings) {
            this.credentialBindings = credentialBindings;
            return this;
        }

        public Builder fromStep(String parameterName, String stepName) {
            return marker(parameterName, StepResultMarker.of(stepName));
        }

        public Builder fromStep(String parameterName, StepReference step) {
            return marker(parameterName, StepResultMarker.of(step));
        }

        private Builder marker(String parameterName, StepResultMarker marker) {
            Objects.requireNonNull(parameterName, "parameterName");
            markers.computeIfAbsent(parameterName, key -> new ArrayList<>()).add(marker);
            return this;
        }

        public StepOptions build() {
            return new StepOptions(this);
        }
    }
}
