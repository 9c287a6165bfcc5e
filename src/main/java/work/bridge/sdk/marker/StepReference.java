package work.bridge.sdk.marker;

/**
 * Anything that can be pointed at by a produced-by-step marker.
 */
@FunctionalInterface
public interface StepReference {
    /**
     * Effective (override-aware) step name.
     */
    String name();
}
