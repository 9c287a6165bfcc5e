package work.bridge.sdk.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class SchemaDeriverTest {
    enum Status { OPEN, CLOSED }

    public record Line(String sku, int quantity) {}

    public record Order(String id, Status status, Optional<String> note, List<Line> lines) {}

    @SuppressWarnings("unused")
    static final class Steps {
        int add(int a, int b) {
            return a + b;
        }

        String greet() {
            return "hello";
        }

        void note(String message) {}

        Object untyped(String value) {
            return value;
        }

        CompletableFuture<Integer> later(int seconds) {
            return CompletableFuture.completedFuture(seconds);
        }

        String join(String separator, String... parts) {
            return String.join(separator, parts);
        }

        Map<String, Object> collect(String prefix, @KeywordArgs Map<String, Integer> extras) {
            return Map.of();
        }

        String pad(
            @Param(defaultValue = "x") String fill,
            @Param(defaultValue = "3", minimum = 1, maximum = 10, description = "Total width") int width,
            Optional<String> suffix
        ) {
            return fill;
        }

        String named(@Param(name = "first_name", minLength = 1, pattern = "^[A-Z]") String firstName) {
            return firstName;
        }

        String place(Order order) {
            return order.id();
        }

        Set<String> tags(Map<String, List<String>> groups) {
            return Set.of();
        }

        <T> T echo(T value) {
            return value;
        }

        int count(List<?> values) {
            return values.size();
        }

        int wrongDefault(@Param(defaultValue = "abc") int n) {
            return n;
        }

        int awaitInput(CompletableFuture<Integer> value) {
            return 0;
        }

        int keyed(Map<Line, String> byLine) {
            return 0;
        }

        int loose(@KeywordArgs String notAMap) {
            return 0;
        }

        String unclosed(@Param(pattern = "(") String text) {
            return text;
        }
    }

    private static Method method(String name) {
        for (Method method : Steps.class.getDeclaredMethods()) {
            if (method.getName().equals(name)) {
                return method;
            }
        }
        throw new IllegalArgumentException(name);
    }

    @Test
    void derivesOneSpecPerDeclaredParameter() {
        DerivedSchema schema = SchemaDeriver.derive(method("add"));

        assertEquals("add", schema.callableName());
        assertEquals(2, schema.parameters().size());
        assertEquals(List.of("a", "b"), schema.parameters().names());
        ObjectNode json = schema.parameters().jsonSchema();
        assertEquals("add_args", json.get("title").asText());
        assertEquals("object", json.get("type").asText());
        assertEquals("integer", json.at("/properties/a/type").asText());
        assertEquals("A", json.at("/properties/a/title").asText());
        assertEquals(2, json.get("required").size());
        assertEquals("integer", schema.returns().jsonSchema().get("type").asText());
    }

    @Test
    void noParametersYieldsEmptyObjectSchema() {
        DerivedSchema schema = SchemaDeriver.derive(method("greet"));

        assertEquals(0, schema.parameters().size());
        ObjectNode json = schema.parameters().jsonSchema();
        assertTrue(json.get("properties").isEmpty());
        assertFalse(json.has("required"));
        assertEquals("string", schema.returns().jsonSchema().get("type").asText());
    }

    @Test
    void mapsReturnTypes() {
        assertEquals("null", SchemaDeriver.derive(method("note")).returns().jsonSchema().get("type").asText());

        ReturnSchema untyped = SchemaDeriver.derive(method("untyped")).returns();
        assertTrue(untyped.isUntyped());
        assertEquals(ReturnSchema.ANY, untyped.declaredType());
        assertTrue(untyped.jsonSchema().isEmpty());

        ReturnSchema later = SchemaDeriver.derive(method("later")).returns();
        assertEquals("integer", later.jsonSchema().get("type").asText());
        assertEquals(Integer.class, later.javaType());
    }

    @Test
    void varargsBecomeOptionalPositionalRest() {
        ParameterSpec parts = SchemaDeriver.derive(method("join")).parameters().get("parts").orElseThrow();

        assertEquals(VariadicKind.POSITIONAL_REST, parts.variadicKind());
        assertFalse(parts.required());
        assertTrue(parts.defaultValue().isArray());
        assertEquals("array", parts.jsonSchema().get("type").asText());
        assertEquals("string", parts.jsonSchema().at("/items/type").asText());
    }

    @Test
    void keywordArgsBecomeOpenObject() {
        ParameterSet parameters = SchemaDeriver.derive(method("collect")).parameters();
        ParameterSpec extras = parameters.get("extras").orElseThrow();

        assertEquals(VariadicKind.KEYWORD_REST, extras.variadicKind());
        assertFalse(extras.required());
        assertTrue(extras.defaultValue().isObject());
        assertEquals("integer", extras.jsonSchema().at("/additionalProperties/type").asText());
        assertEquals(List.of("prefix"), requiredNames(parameters.jsonSchema()));
    }

    @Test
    void defaultsAndConstraintsMergeIntoPropertySchema() {
        ParameterSet parameters = SchemaDeriver.derive(method("pad")).parameters();

        ParameterSpec fill = parameters.get("fill").orElseThrow();
        assertFalse(fill.required());
        assertEquals("x", fill.defaultValue().asText());

        ObjectNode width = parameters.get("width").orElseThrow().jsonSchema();
        assertEquals(3, width.get("default").asInt());
        assertEquals(1, width.get("minimum").asInt());
        assertEquals(10, width.get("maximum").asInt());
        assertEquals("Total width", width.get("description").asText());

        ParameterSpec suffix = parameters.get("suffix").orElseThrow();
        assertFalse(suffix.required());
        assertTrue(suffix.defaultValue().isNull());
        assertEquals(2, suffix.jsonSchema().get("anyOf").size());

        assertTrue(requiredNames(parameters.jsonSchema()).isEmpty());
    }

    @Test
    void paramNameOverrideDrivesTitle() {
        ObjectNode schema = SchemaDeriver.derive(method("named")).parameters().propertySchema("first_name");

        assertEquals("First Name", schema.get("title").asText());
        assertEquals(1, schema.get("minLength").asInt());
        assertEquals("^[A-Z]", schema.get("pattern").asText());
    }

    @Test
    void recordsAndEnumsGoToDefinitions() {
        ObjectNode json = SchemaDeriver.derive(method("place")).parameters().jsonSchema();

        assertEquals("#/$defs/Order", json.at("/properties/order/$ref").asText());
        JsonNode order = json.at("/$defs/Order");
        assertEquals("object", order.get("type").asText());
        List<String> required = requiredNames(order);
        assertTrue(required.containsAll(List.of("id", "status", "lines")));
        assertFalse(required.contains("note"));
        assertEquals("#/$defs/Line", order.at("/properties/lines/items/$ref").asText());
        assertEquals(2, json.at("/$defs/Status/enum").size());
        assertTrue(json.at("/$defs/Line").has("properties"));
    }

    @Test
    void collectionsAndMaps() {
        DerivedSchema schema = SchemaDeriver.derive(method("tags"));

        ObjectNode groups = schema.parameters().propertySchema("groups");
        assertEquals("object", groups.get("type").asText());
        assertEquals("array", groups.at("/additionalProperties/type").asText());
        assertTrue(schema.returns().jsonSchema().get("uniqueItems").asBoolean());
    }

    @Test
    void unresolvableTypesAbortDerivation() {
        var typeVariable = assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("echo")));
        assertTrue(typeVariable.getMessage().contains("Steps.echo"));
        assertEquals("schema_derivation_error", typeVariable.code());

        assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("count")));
        assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("awaitInput")));
        assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("keyed")));
    }

    @Test
    void invalidDeclarationsAbortDerivation() {
        assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("wrongDefault")));
        assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("loose")));
        var badPattern = assertThrows(SchemaDerivationException.class, () -> SchemaDeriver.derive(method("unclosed")));
        assertTrue(badPattern.getMessage().contains("Invalid pattern '('"));
    }

    private static List<String> requiredNames(JsonNode schema) {
        var names = new ArrayList<String>();
        JsonNode required = schema.get("required");
        if (required != null) {
            required.forEach(node -> names.add(node.asText()));
        }
        return names;
    }
}
