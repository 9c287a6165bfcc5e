package work.bridge.sdk.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * One declared parameter of a step callable.
 *
 * @param name         name used in JSON input
 * @param declaredType readable declared type ({@code any} when unconstrained)
 * @param javaType     reflective type used to bind JSON values
 * @param required     whether the value must be supplied
 * @param defaultValue JSON default, {@code null} when there is none
 * @param variadicKind how the parameter collects surplus arguments
 * @param jsonSchema   property schema; may reference the owning set's {@code $defs}
 */
public record ParameterSpec(
    String name,
    String declaredType,
    Type javaType,
    boolean required,
    JsonNode defaultValue,
    VariadicKind variadicKind,
    ObjectNode jsonSchema
) {
    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(variadicKind, "variadicKind");
        Objects.requireNonNull(jsonSchema, "jsonSchema");
        if (required && variadicKind != VariadicKind.NONE) {
            throw new IllegalArgumentException("Variadic parameter '" + name + "' cannot be required");
        }
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public ObjectNode jsonSchema() {
        return jsonSchema.deepCopy();
    }
}
