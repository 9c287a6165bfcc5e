package work.bridge.sdk.step;

/**
 * The executable body of a step. Arguments arrive bound and ordered like the step's parameter set.
 * A result that is a {@link java.util.concurrent.CompletionStage} marks an asynchronous call.
 */
@FunctionalInterface
public interface StepCallable {
    Object call(Object[] arguments) throws Exception;
}
