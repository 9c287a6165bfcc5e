package work.bridge.sdk.schema;

import java.util.Objects;

/**
 * Output of {@link SchemaDeriver}: the parameter set and return schema of one callable.
 */
public record DerivedSchema(String callableName, ParameterSet parameters, ReturnSchema returns) {
    public DerivedSchema {
        Objects.requireNonNull(callableName, "callableName");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(returns, "returns");
    }
}
