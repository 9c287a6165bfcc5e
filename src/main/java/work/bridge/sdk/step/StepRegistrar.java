package work.bridge.sdk.step;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.bridge.sdk.schema.DerivedSchema;
import work.bridge.sdk.schema.SchemaDeriver;
import work.bridge.sdk.shared.ConfigurationException;

/**
 * Registration entry point handed to a {@link StepUnit}. Each call derives the step's schema, builds its
 * descriptor, stores it in the {@link StepRegistry} and returns it.
 * <p>
 * A registrar also tracks what its unit declared so discovery can work out pipeline membership: the
 * steps in declaration order, which of them went through {@link Pipeline#step}, and the unit's single
 * {@link Pipeline} grouping, if any.
 */
public final class StepRegistrar {
    private final StepRegistry registry;
    private final String unitId;
    private final Set<String> declared = new LinkedHashSet<>();
    private final Set<String> standalone = new LinkedHashSet<>();
    private final Set<String> routed = new LinkedHashSet<>();
    private Pipeline pipeline;

    public StepRegistrar(StepRegistry registry) {
        this(registry, null);
    }

    public StepRegistrar(StepRegistry registry, String unitId) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.unitId = unitId;
    }

    public StepDescriptor step(Object target, String methodName) {
        return step(target, methodName, StepOptions.defaults());
    }

    public StepDescriptor step(Object target, String methodName, StepOptions options) {
        Objects.requireNonNull(target, "target");
        return register(findMethod(target.getClass(), methodName), target, options, null);
    }

    /**
     * Registers a static method of {@code type}.
     */
    public StepDescriptor step(Class<?> type, String methodName) {
        return step(type, methodName, StepOptions.defaults());
    }

    public StepDescriptor step(Class<?> type, String methodName, StepOptions options) {
        Objects.requireNonNull(type, "type");
        return register(findMethod(type, methodName), null, options, null);
    }

    public StepDescriptor step(Method method, Object target) {
        return step(method, target, StepOptions.defaults());
    }

    public StepDescriptor step(Method method, Object target, StepOptions options) {
        return register(method, target, options, null);
    }

    /**
     * Registers a callable that has no reflective signature. Its schema is supplied by the caller and its
     * source location is recorded as unknown.
     */
    public StepDescriptor step(DerivedSchema schema, StepCallable callable, StepOptions options) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(callable, "callable");
        StepDescriptor descriptor = StepDescriptorBuilder.build(callable, schema, Map.of(), options, SourceLocation.unknown());
        return record(descriptor, null);
    }

    public Pipeline pipeline(String name) {
        return pipeline(name, null);
    }

    /**
     * Declares the unit's pipeline grouping. A unit may declare at most one.
     */
    public Pipeline pipeline(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Pipeline name must not be blank");
        }
        if (pipeline != null) {
            throw new ConfigurationException(
                "Unit '" + displayUnit() + "' declares multiple pipelines: " + pipeline.name() + ", " + name
                    + ". Each unit can only define one pipeline."
            );
        }
        pipeline = new Pipeline(name.trim(), description, this);
        return pipeline;
    }

    public String unitId() {
        return unitId;
    }

    public List<String> declaredSteps() {
        return List.copyOf(declared);
    }

    public List<String> standaloneSteps() {
        return List.copyOf(standalone);
    }

    public List<String> pipelineSteps() {
        return List.copyOf(routed);
    }

    public Optional<Pipeline> pipelineGroup() {
        return Optional.ofNullable(pipeline);
    }

    StepDescriptor register(Method method, Object target, StepOptions options, Pipeline via) {
        Objects.requireNonNull(method, "method");
        SourceLocation location = SourceLocations.callSite();
        if (target == null && !Modifier.isStatic(method.getModifiers())) {
            throw new ConfigurationException("Instance method " + method.getName() + " needs a target object");
        }
        DerivedSchema schema = SchemaDeriver.derive(method);
        StepDescriptor descriptor = StepDescriptorBuilder.build(
            new MethodCallable(method, target),
            schema,
            StepDescriptorBuilder.annotationTags(method, schema),
            options,
            location
        );
        return record(descriptor, via);
    }

    private StepDescriptor record(StepDescriptor descriptor, Pipeline via) {
        registry.register(descriptor);
        declared.add(descriptor.name());
        if (via != null) {
            routed.add(descriptor.name());
        } else {
            standalone.add(descriptor.name());
        }
        return descriptor;
    }

    private String displayUnit() {
        return unitId == null ? "<anonymous>" : unitId;
    }

    static Method findMethod(Class<?> type, String methodName) {
        Objects.requireNonNull(methodName, "methodName");
        var candidates = new ArrayList<Method>();
        var signatures = new LinkedHashSet<List<Class<?>>>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (!method.getName().equals(methodName) || method.isBridge() || method.isSynthetic()) {
                    continue;
                }
                if (signatures.add(Arrays.asList(method.getParameterTypes()))) {
                    candidates.add(method);
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new ConfigurationException("No method named '" + methodName + "' on " + type.getName());
        }
        if (candidates.size() > 1) {
            String overloads = candidates.stream()
                .map(m -> Arrays.stream(m.getParameterTypes()).map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")")))
                .collect(Collectors.joining(" "));
            throw new ConfigurationException(
                "Method name '" + methodName + "' on " + type.getName() + " is overloaded " + overloads
                    + "; register the java.lang.reflect.Method directly"
            );
        }
        return candidates.get(0);
    }
}
