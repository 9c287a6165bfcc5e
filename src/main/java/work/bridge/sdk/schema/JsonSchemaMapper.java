package work.bridge.sdk.schema;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Maps Java types to JSON Schema fragments. Enums, records and beans are emitted once under
 * {@code $defs} and referenced with {@code $ref}; one mapper instance owns one {@code $defs} table.
 */
final class JsonSchemaMapper {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Set<Class<?>> INTEGRAL = Set.of(
        byte.class, Byte.class, short.class, Short.class, int.class, Integer.class,
        long.class, Long.class, BigInteger.class
    );
    private static final Set<Class<?>> FLOATING = Set.of(
        float.class, Float.class, double.class, Double.class, BigDecimal.class, Number.class
    );

    private final ObjectNode definitions = JSON.createObjectNode();
    private final Map<String, Class<?>> definitionOwners = new HashMap<>();
    private final Set<Class<?>> inProgress = new HashSet<>();

    ObjectNode definitions() {
        return definitions;
    }

    ObjectNode schemaFor(Type type) {
        ensureResolvable(type, type);
        return schemaFor(JSON.getTypeFactory().constructType(type));
    }

    static boolean isAny(Type type) {
        if (!(type instanceof Class<?> cls)) {
            return false;
        }
        return cls == Object.class || JsonNode.class.isAssignableFrom(cls);
    }

    static String titleOf(String name) {
        var words = new ArrayList<String>();
        var current = new StringBuilder();
        for (char ch : name.toCharArray()) {
            if (ch == '_' || ch == '-' || ch == ' ') {
                flushWord(words, current);
            } else if (Character.isUpperCase(ch) && current.length() > 0
                && !Character.isUpperCase(current.charAt(current.length() - 1))) {
                flushWord(words, current);
                current.append(ch);
            } else {
                current.append(ch);
            }
        }
        flushWord(words, current);
        return String.join(" ", words);
    }

    private static void flushWord(List<String> words, StringBuilder current) {
        if (current.length() == 0) {
            return;
        }
        String word = current.toString();
        words.add(word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1));
        current.setLength(0);
    }

    private ObjectNode schemaFor(JavaType type) {
        Class<?> raw = type.getRawClass();
        if (isAnyType(type)) {
            return JSON.createObjectNode();
        }
        if (raw == boolean.class || raw == Boolean.class) {
            return typed("boolean");
        }
        if (raw == String.class || raw == char.class || raw == Character.class) {
            return typed("string");
        }
        if (raw == UUID.class) {
            return typed("string").put("format", "uuid");
        }
        if (INTEGRAL.contains(raw)) {
            return typed("integer");
        }
        if (FLOATING.contains(raw)) {
            return typed("number");
        }
        if (raw == byte[].class) {
            return typed("string").put("contentEncoding", "base64");
        }
        if (raw == Optional.class) {
            ObjectNode schema = JSON.createObjectNode();
            ArrayNode anyOf = schema.putArray("anyOf");
            anyOf.add(schemaFor(type.containedTypeOrUnknown(0)));
            anyOf.add(typed("null"));
            return schema;
        }
        if (CompletionStage.class.isAssignableFrom(raw) || Future.class.isAssignableFrom(raw)) {
            throw new SchemaDerivationException("Asynchronous type " + type.toCanonical() + " is only allowed as a return type");
        }
        if (type.isEnumType()) {
            return reference(raw, () -> enumSchema(raw));
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            ObjectNode schema = typed("array");
            schema.set("items", schemaFor(type.getContentType()));
            if (Set.class.isAssignableFrom(raw)) {
                schema.put("uniqueItems", true);
            }
            return schema;
        }
        if (type.isMapLikeType()) {
            Class<?> key = type.getKeyType().getRawClass();
            if (!(key == String.class || key.isEnum() || INTEGRAL.contains(key) || key == UUID.class)) {
                throw new SchemaDerivationException("Map keys must be strings, enums or integers: " + type.toCanonical());
            }
            ObjectNode schema = typed("object");
            JavaType value = type.getContentType();
            schema.set("additionalProperties", isAnyType(value) ? JSON.getNodeFactory().booleanNode(true) : schemaFor(value));
            return schema;
        }
        if (raw.isPrimitive() || raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
            throw new SchemaDerivationException("Cannot derive a schema for " + type.toCanonical());
        }
        return reference(raw, () -> beanSchema(type));
    }

    private static boolean isAnyType(JavaType type) {
        Class<?> raw = type.getRawClass();
        return raw == Object.class || JsonNode.class.isAssignableFrom(raw);
    }

    private ObjectNode reference(Class<?> raw, Supplier<ObjectNode> body) {
        String key = definitionKey(raw);
        if (!definitions.has(key) && inProgress.add(raw)) {
            try {
                definitionOwners.put(key, raw);
                definitions.set(key, body.get());
            } finally {
                inProgress.remove(raw);
            }
        }
        return JSON.createObjectNode().put("$ref", "#/$defs/" + key);
    }

    private String definitionKey(Class<?> raw) {
        String simple = raw.getSimpleName();
        Class<?> owner = definitionOwners.get(simple);
        if (owner == null || owner == raw) {
            return simple;
        }
        return raw.getName().replace('.', '_').replace('$', '_');
    }

    private ObjectNode enumSchema(Class<?> raw) {
        ObjectNode schema = JSON.createObjectNode();
        ArrayNode values = schema.putArray("enum");
        for (Object constant : raw.getEnumConstants()) {
            values.add(((Enum<?>) constant).name());
        }
        schema.put("title", raw.getSimpleName());
        schema.put("type", "string");
        return schema;
    }

    private ObjectNode beanSchema(JavaType type) {
        BeanDescription description = JSON.getSerializationConfig().introspect(type);
        List<BeanPropertyDefinition> properties = description.findProperties();
        if (properties.isEmpty()) {
            throw new SchemaDerivationException("Type " + type.toCanonical() + " exposes no serializable properties");
        }
        boolean record = type.getRawClass().isRecord();
        ObjectNode schema = JSON.createObjectNode();
        ObjectNode props = schema.putObject("properties");
        ArrayNode required = JSON.createArrayNode();
        for (BeanPropertyDefinition property : properties) {
            JavaType propertyType = property.getPrimaryType();
            ObjectNode propertySchema = schemaFor(propertyType);
            propertySchema.put("title", titleOf(property.getName()));
            props.set(property.getName(), propertySchema);
            boolean optional = propertyType.getRawClass() == Optional.class;
            if (property.isRequired() || (record && !optional) || propertyType.isPrimitive()) {
                required.add(property.getName());
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        schema.put("title", type.getRawClass().getSimpleName());
        schema.put("type", "object");
        return schema;
    }

    private static ObjectNode typed(String name) {
        return JSON.createObjectNode().put("type", name);
    }

    private static void ensureResolvable(Type type, Type root) {
        if (type instanceof Class<?>) {
            return;
        }
        if (type instanceof ParameterizedType parameterized) {
            for (Type argument : parameterized.getActualTypeArguments()) {
                ensureResolvable(argument, root);
            }
            return;
        }
        if (type instanceof GenericArrayType array) {
            ensureResolvable(array.getGenericComponentType(), root);
            return;
        }
        if (type instanceof TypeVariable<?> variable) {
            throw new SchemaDerivationException("Unresolved type variable " + variable.getName() + " in " + root.getTypeName());
        }
        if (type instanceof WildcardType) {
            throw new SchemaDerivationException("Wildcard types cannot be exposed: " + root.getTypeName());
        }
        throw new SchemaDerivationException("Unsupported type reference: " + root.getTypeName());
    }
}
