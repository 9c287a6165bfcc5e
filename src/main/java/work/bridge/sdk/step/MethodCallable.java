package work.bridge.sdk.step;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Reflective {@link StepCallable} over a method and its (optional) receiver.
 */
final class MethodCallable implements StepCallable {
    private final Method method;
    private final Object target;

    MethodCallable(Method method, Object target) {
        this.method = Objects.requireNonNull(method, "method");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new IllegalArgumentException("Instance method " + method.getName() + " needs a target");
        }
        this.target = isStatic ? null : target;
        if (!method.canAccess(this.target)) {
            method.setAccessible(true);
        }
    }

    @Override
    public Object call(Object[] arguments) throws Exception {
        try {
            return method.invoke(target, arguments);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getName() + "#" + method.getName();
    }
}
