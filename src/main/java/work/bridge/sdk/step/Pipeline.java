package work.bridge.sdk.step;

import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Grouping object for the steps of one unit. Obtain it from {@link StepRegistrar#pipeline(String, String)}.
 * <p>
 * Steps may join the pipeline implicitly (every step the unit declares) or explicitly (only steps
 * registered through {@link #step}). Once a unit registers one step here, every step in that unit must
 * be registered here too.
 */
public final class Pipeline {
    private final String name;
    private final String description;
    private final StepRegistrar registrar;

    Pipeline(String name, String description, StepRegistrar registrar) {
        this.name = name;
        this.description = description;
        this.registrar = registrar;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public StepDescriptor step(Object target, String methodName) {
        return step(target, methodName, StepOptions.defaults());
    }

    public StepDescriptor step(Object target, String methodName, StepOptions options) {
        Objects.requireNonNull(target, "target");
        return registrar.register(StepRegistrar.findMethod(target.getClass(), methodName), target, options, this);
    }

    public StepDescriptor step(Class<?> type, String methodName) {
        return step(type, methodName, StepOptions.defaults());
    }

    public StepDescriptor step(Class<?> type, String methodName, StepOptions options) {
        Objects.requireNonNull(type, "type");
        return registrar.register(StepRegistrar.findMethod(type, methodName), null, options, this);
    }

    public StepDescriptor step(Method method, Object target, StepOptions options) {
        return registrar.register(method, target, options, this);
    }

    @Override
    public String toString() {
        return "Pipeline(name=" + name + ", description=" + description + ")";
    }
}
