package work.bridge.sdk.step;

/**
 * One independently loadable collection of step declarations. Implementations need a public no-arg
 * constructor so they can be loaded by class name.
 */
@FunctionalInterface
public interface StepUnit {
    void register(StepRegistrar registrar);
}
