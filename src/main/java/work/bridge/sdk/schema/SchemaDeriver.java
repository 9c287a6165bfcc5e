package work.bridge.sdk.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Derives the {@link ParameterSet} and {@link ReturnSchema} of a step method from its reflective signature.
 * <p>
 * Parameters are read in declaration order. The receiver of an instance method is never part of
 * {@link Method#getParameters()}, so N declared parameters always yield N specs. Any type that cannot be
 * expressed as a schema aborts derivation with a {@link SchemaDerivationException}.
 */
public final class SchemaDeriver {
    private static final ObjectMapper JSON = new ObjectMapper();

    private SchemaDeriver() {}

    public static DerivedSchema derive(Method method) {
        if (method == null) {
            throw new SchemaDerivationException("Cannot derive a schema without a method");
        }
        String callableName = method.getName();
        try {
            ParameterSet parameters = deriveParameters(method);
            ReturnSchema returns = deriveReturn(method);
            return new DerivedSchema(callableName, parameters, returns);
        } catch (SchemaDerivationException ex) {
            throw new SchemaDerivationException("Cannot derive schema for " + describe(method) + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Unwraps {@code CompletionStage<T>} (and its subtypes) to {@code T}; other types are returned unchanged.
     */
    public static Type resultType(Type declared) {
        Class<?> raw = rawClass(declared);
        if (raw == null || !CompletionStage.class.isAssignableFrom(raw)) {
            return declared;
        }
        if (declared instanceof ParameterizedType parameterized) {
            return parameterized.getActualTypeArguments()[0];
        }
        return Object.class;
    }

    private static ParameterSet deriveParameters(Method method) {
        var mapper = new JsonSchemaMapper();
        List<ParameterSpec> specs = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            specs.add(deriveParameter(parameter, mapper));
        }
        try {
            return new ParameterSet(method.getName() + "_args", specs, mapper.definitions());
        } catch (IllegalArgumentException ex) {
            throw new SchemaDerivationException(ex.getMessage(), ex);
        }
    }

    private static ParameterSpec deriveParameter(Parameter parameter, JsonSchemaMapper mapper) {
        Param declaration = parameter.getAnnotation(Param.class);
        String name = parameterName(parameter, declaration);
        Type type = parameter.getParameterizedType();
        ObjectNode schema = mapper.schemaFor(type);

        VariadicKind kind = VariadicKind.NONE;
        boolean required = true;
        JsonNode defaultValue = null;

        if (parameter.isVarArgs()) {
            kind = VariadicKind.POSITIONAL_REST;
            required = false;
            defaultValue = JSON.createArrayNode();
        } else if (parameter.isAnnotationPresent(KeywordArgs.class)) {
            if (!Map.class.isAssignableFrom(parameter.getType())) {
                throw new SchemaDerivationException("@KeywordArgs parameter '" + name + "' must be a Map");
            }
            kind = VariadicKind.KEYWORD_REST;
            required = false;
            defaultValue = JSON.createObjectNode();
        } else if (parameter.getType() == Optional.class) {
            required = false;
            defaultValue = JSON.nullNode();
        }

        if (declaration != null && !Param.UNSET.equals(declaration.defaultValue())) {
            if (kind != VariadicKind.NONE) {
                throw new SchemaDerivationException("Variadic parameter '" + name + "' cannot declare a default");
            }
            defaultValue = parseDefault(name, type, declaration.defaultValue());
            required = false;
        }
        if (declaration != null) {
            mergeConstraints(schema, declaration);
        }

        schema.put("title", JsonSchemaMapper.titleOf(name));
        if (defaultValue != null) {
            schema.set("default", defaultValue);
        }
        return new ParameterSpec(name, typeName(type), type, required, defaultValue, kind, schema);
    }

    private static String parameterName(Parameter parameter, Param declaration) {
        if (declaration != null && !declaration.name().isBlank()) {
            return declaration.name().trim();
        }
        if (!parameter.isNamePresent()) {
            throw new SchemaDerivationException(
                "Parameter names are unavailable (compile with -parameters or declare @Param(name = ...))"
            );
        }
        return parameter.getName();
    }

    private static JsonNode parseDefault(String name, Type type, String raw) {
        Class<?> rawClass = rawClass(type);
        JsonNode value;
        if (rawClass == String.class || rawClass == char.class || rawClass == Character.class) {
            value = JSON.getNodeFactory().textNode(raw);
        } else {
            try {
                value = JSON.readTree(raw);
            } catch (JsonProcessingException ex) {
                throw new SchemaDerivationException("Default for '" + name + "' is not valid JSON: " + raw, ex);
            }
        }
        if (rawClass != Optional.class) {
            try {
                JSON.convertValue(value, JSON.getTypeFactory().constructType(type));
            } catch (IllegalArgumentException ex) {
                throw new SchemaDerivationException("Default for '" + name + "' does not match " + typeName(type), ex);
            }
        }
        return value;
    }

    private static void mergeConstraints(ObjectNode schema, Param declaration) {
        if (!declaration.description().isBlank()) {
            schema.put("description", declaration.description());
        }
        if (!Double.isNaN(declaration.minimum())) {
            putNumber(schema, "minimum", declaration.minimum());
        }
        if (!Double.isNaN(declaration.maximum())) {
            putNumber(schema, "maximum", declaration.maximum());
        }
        if (declaration.minLength() >= 0) {
            schema.put("minLength", declaration.minLength());
        }
        if (declaration.maxLength() >= 0) {
            schema.put("maxLength", declaration.maxLength());
        }
        if (!declaration.pattern().isEmpty()) {
            try {
                Pattern.compile(declaration.pattern());
            } catch (PatternSyntaxException ex) {
                throw new SchemaDerivationException("Invalid pattern '" + declaration.pattern() + "': " + ex.getDescription(), ex);
            }
            schema.put("pattern", declaration.pattern());
        }
    }

    private static void putNumber(ObjectNode schema, String key, double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            schema.put(key, (long) value);
        } else {
            schema.put(key, value);
        }
    }

    private static ReturnSchema deriveReturn(Method method) {
        Type declared = resultType(method.getGenericReturnType());
        if (declared == void.class || declared == Void.class) {
            return new ReturnSchema("null", declared, JSON.createObjectNode().put("type", "null"));
        }
        if (JsonSchemaMapper.isAny(declared)) {
            return new ReturnSchema(ReturnSchema.ANY, declared, JSON.createObjectNode());
        }
        var mapper = new JsonSchemaMapper();
        ObjectNode schema = mapper.schemaFor(declared);
        if (!mapper.definitions().isEmpty()) {
            schema.set("$defs", mapper.definitions());
        }
        return new ReturnSchema(typeName(declared), declared, schema);
    }

    private static String typeName(Type type) {
        return JsonSchemaMapper.isAny(type) ? ReturnSchema.ANY : type.getTypeName();
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> cls) {
            return cls;
        }
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() instanceof Class<?> cls) {
            return cls;
        }
        return null;
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
