package work.bridge.sdk.pipeline;

import java.lang.reflect.InvocationTargetException;
import work.bridge.sdk.shared.ConfigurationException;
import work.bridge.sdk.step.StepUnit;

/**
 * Loads a {@link StepUnit} by class name through its public no-arg constructor.
 */
final class UnitLoader {
    private UnitLoader() {}

    static StepUnit load(String className, ClassLoader classLoader) {
        if (className == null || className.isBlank()) {
            throw new ConfigurationException("Unit class name must not be blank");
        }
        Class<?> type;
        try {
            type = Class.forName(className.trim(), true, classLoader);
        } catch (ClassNotFoundException | LinkageError ex) {
            throw new ConfigurationException("Error loading unit '" + className + "': " + ex.getMessage(), ex);
        }
        if (!StepUnit.class.isAssignableFrom(type)) {
            throw new ConfigurationException("Unit '" + className + "' does not implement " + StepUnit.class.getSimpleName());
        }
        return instantiate(type.asSubclass(StepUnit.class));
    }

    static StepUnit instantiate(Class<? extends StepUnit> type) {
        try {
            var constructor = type.getDeclaredConstructor();
            if (!constructor.canAccess(null)) {
                constructor.setAccessible(true);
            }
            return constructor.newInstance();
        } catch (NoSuchMethodException ex) {
            throw new ConfigurationException("Unit '" + type.getName() + "' needs a no-arg constructor", ex);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new ConfigurationException("Unit '" + type.getName() + "' failed to initialise: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException ex) {
            throw new ConfigurationException("Unable to instantiate unit '" + type.getName() + "': " + ex.getMessage(), ex);
        }
    }
}
