package work.bridge.sdk.runtime;

import java.util.List;

/**
 * Resolved arguments do not satisfy the step's parameter set. {@link #fields()} names every offending
 * parameter and {@link #missingSteps()} the upstream steps whose results were needed but absent.
 */
public final class ValidationException extends StepInvocationException {
    private final List<String> fields;
    private final List<String> missingSteps;

    public ValidationException(String stepName, List<String> fields, List<String> missingSteps, List<String> problems) {
        super("validation_error", stepName, "Invalid input for step " + stepName + ": " + String.join("; ", problems), null);
        this.fields = List.copyOf(fields);
        this.missingSteps = List.copyOf(missingSteps);
    }

    public List<String> fields() {
        return fields;
    }

    public List<String> missingSteps() {
        return missingSteps;
    }
}
