package work.bridge.sdk.marker;

import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Extracts per-parameter metadata tags and picks out the produced-by-step marker among them.
 * <p>
 * Tags are kept apart from the parameter type. Recognised tags are {@link FromStep} annotations,
 * {@link StepResultMarker}s and {@code step:<name>} strings. The first recognised tag wins; any later
 * marker on the same parameter is ignored.
 */
public final class StepResultMarkers {
    private StepResultMarkers() {}

    public static List<Object> extract(Parameter parameter) {
        if (parameter == null) {
            return List.of();
        }
        return new ArrayList<>(Arrays.asList(parameter.getAnnotationsByType(FromStep.class)));
    }

    public static Optional<String> match(List<?> tags) {
        if (tags == null) {
            return Optional.empty();
        }
        for (Object tag : tags) {
            Optional<String> name = nameOf(tag);
            if (name.isPresent()) {
                return name;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> nameOf(Object tag) {
        if (tag instanceof FromStep fromStep) {
            return Optional.of(StepResultMarker.of(fromStep.value()).stepName());
        }
        if (tag instanceof StepResultMarker marker) {
            return Optional.of(marker.stepName());
        }
        return StepResultMarker.parse(tag).map(StepResultMarker::stepName);
    }
}
