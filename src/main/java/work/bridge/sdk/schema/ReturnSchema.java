package work.bridge.sdk.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Declared result type of a step. Untyped results are encoded as JSON strings.
 */
public record ReturnSchema(String declaredType, Type javaType, ObjectNode jsonSchema) {
    public static final String ANY = "any";

    public ReturnSchema {
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(jsonSchema, "jsonSchema");
    }

    public boolean isUntyped() {
        return ANY.equals(declaredType);
    }

    @Override
    public ObjectNode jsonSchema() {
        return jsonSchema.deepCopy();
    }
}
