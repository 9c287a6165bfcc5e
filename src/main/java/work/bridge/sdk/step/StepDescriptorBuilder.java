package work.bridge.sdk.step;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.bridge.sdk.marker.StepResultMarkers;
import work.bridge.sdk.schema.DerivedSchema;
import work.bridge.sdk.schema.ParameterSpec;
import work.bridge.sdk.shared.ConfigurationException;

/**
 * Combines a derived schema, per-parameter tags and caller options into a {@link StepDescriptor}.
 */
public final class StepDescriptorBuilder {
    private StepDescriptorBuilder() {}

    /**
     * Reads the annotation tags of each method parameter, keyed by the derived parameter name.
     */
    public static Map<String, List<Object>> annotationTags(Method method, DerivedSchema schema) {
        Parameter[] parameters = method.getParameters();
        List<ParameterSpec> specs = schema.parameters().specs();
        var tags = new LinkedHashMap<String, List<Object>>();
        for (int i = 0; i < parameters.length && i < specs.size(); i++) {
            List<Object> found = StepResultMarkers.extract(parameters[i]);
            if (!found.isEmpty()) {
                tags.put(specs.get(i).name(), found);
            }
        }
        return tags;
    }

    public static StepDescriptor build(
        StepCallable callable,
        DerivedSchema schema,
        Map<String, List<Object>> parameterTags,
        StepOptions options,
        SourceLocation location
    ) {
        StepOptions effective = options == null ? StepOptions.defaults() : options;
        String name = effective.name() != null ? effective.name() : schema.callableName();
        if (name.isBlank()) {
            throw new ConfigurationException("Step name must not be blank");
        }
        for (String parameter : effective.markers().keySet()) {
            if (schema.parameters().get(parameter).isEmpty()) {
                throw new ConfigurationException("Step '" + name + "' has no parameter named '" + parameter + "'");
            }
        }

        var paramsFromStepResults = new LinkedHashMap<String, String>();
        for (ParameterSpec spec : schema.parameters()) {
            var tags = new ArrayList<Object>();
            if (parameterTags != null) {
                tags.addAll(parameterTags.getOrDefault(spec.name(), List.of()));
            }
            tags.addAll(effective.markers().getOrDefault(spec.name(), List.of()));
            Optional<String> source = StepResultMarkers.match(tags);
            source.ifPresent(step -> paramsFromStepResults.put(spec.name(), step));
        }

        return new StepDescriptor(
            name,
            effective,
            schema.parameters(),
            schema.returns(),
            paramsFromStepResults,
            location,
            callable
        );
    }
}
