package work.bridge.sdk.marker;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed produced-by-step marker. The referenced name is fixed when the marker is built, so a marker made
 * from a descriptor keeps that descriptor's effective name.
 */
public record StepResultMarker(String stepName) {
    public static final String PREFIX = "step:";

    public StepResultMarker {
        Objects.requireNonNull(stepName, "stepName");
        stepName = stepName.trim();
        if (stepName.isEmpty()) {
            throw new IllegalArgumentException("Step result marker requires a step name");
        }
    }

    public static StepResultMarker of(String stepName) {
        return new StepResultMarker(stepName);
    }

    public static StepResultMarker of(StepReference step) {
        Objects.requireNonNull(step, "step");
        return new StepResultMarker(step.name());
    }

    /**
     * Reads the {@code step:<name>} tag form; any other value is not a marker.
     */
    public static Optional<StepResultMarker> parse(Object tag) {
        if (tag instanceof String text && text.startsWith(PREFIX)) {
            String remainder = text.substring(PREFIX.length()).trim();
            if (!remainder.isEmpty()) {
                return Optional.of(new StepResultMarker(remainder));
            }
        }
        return Optional.empty();
    }

    public String toTag() {
        return PREFIX + stepName;
    }
}
