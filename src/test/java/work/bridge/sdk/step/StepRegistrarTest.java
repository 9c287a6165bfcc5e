package work.bridge.sdk.step;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.bridge.sdk.marker.FromStep;
import work.bridge.sdk.schema.DerivedSchema;
import work.bridge.sdk.schema.ParameterSet;
import work.bridge.sdk.schema.ReturnSchema;
import work.bridge.sdk.shared.ConfigurationException;

class StepRegistrarTest {
    @SuppressWarnings("unused")
    public static final class Steps {
        public String fetch(String url) {
            return url;
        }

        public String transform(@FromStep("fetch") String raw, int limit) {
            return raw;
        }

        public String store(String data) {
            return data;
        }

        public String overloaded(String value) {
            return value;
        }

        public String overloaded(int value) {
            return String.valueOf(value);
        }

        public static int twice(int value) {
            return value * 2;
        }
    }

    private StepRegistry registry;
    private StepRegistrar registrar;
    private final Steps steps = new Steps();

    @BeforeEach
    void setUp() {
        registry = new StepRegistry();
        registrar = new StepRegistrar(registry, "tests");
    }

    @Test
    void registersUnderMethodNameByDefault() {
        StepDescriptor fetch = registrar.step(steps, "fetch");

        assertEquals("fetch", fetch.name());
        assertEquals(fetch, registry.get("fetch").orElseThrow());
        assertEquals(1, fetch.parameters().size());
        assertTrue(fetch.dependsOn().isEmpty());
        assertEquals(List.of("fetch"), registrar.declaredSteps());
    }

    @Test
    void nameOverrideReplacesMethodName() {
        registrar.step(steps, "fetch", StepOptions.builder().name("Loader").build());

        assertTrue(registry.contains("Loader"));
        assertFalse(registry.contains("fetch"));
    }

    @Test
    void blankNameOverrideFallsBackToMethodName() {
        assertEquals("fetch", registrar.step(steps, "fetch", StepOptions.builder().name("  ").build()).name());
    }

    @Test
    void annotatedParameterDependsOnNamedStep() {
        StepDescriptor transform = registrar.step(steps, "transform");

        assertEquals(Set.of("fetch"), transform.dependsOn());
        assertEquals(Map.of("raw", "fetch"), transform.paramsFromStepResults());
        assertEquals(List.of(new DependencyEdge("raw", "fetch")), transform.dependencyEdges());
    }

    @Test
    void descriptorReferenceUsesEffectiveName() {
        StepDescriptor loader = registrar.step(steps, "fetch", StepOptions.builder().name("Loader").build());
        StepDescriptor store = registrar.step(steps, "store", StepOptions.builder().fromStep("data", loader).build());

        assertEquals(Set.of("Loader"), store.dependsOn());
    }

    @Test
    void annotationMarkerTakesPrecedenceOverProgrammaticMarker() {
        StepDescriptor transform = registrar.step(
            steps,
            "transform",
            StepOptions.builder().fromStep("raw", "other").fromStep("limit", "sizer").build()
        );

        assertEquals(Map.of("raw", "fetch", "limit", "sizer"), transform.paramsFromStepResults());
        assertEquals(List.of("fetch", "sizer"), List.copyOf(transform.dependsOn()));
    }

    @Test
    void markerForUnknownParameterIsRejected() {
        var options = StepOptions.builder().fromStep("missing", "fetch").build();

        assertThrows(ConfigurationException.class, () -> registrar.step(steps, "store", options));
    }

    @Test
    void lastRegistrationWins() {
        registrar.step(steps, "fetch", StepOptions.builder().description("first").build());
        registrar.step(steps, "fetch", StepOptions.builder().description("second").build());

        assertEquals(1, registry.size());
        assertEquals("second", registry.get("fetch").orElseThrow().description());
    }

    @Test
    void resetEmptiesTheRegistry() {
        registrar.step(steps, "fetch");
        registry.reset();

        assertEquals(0, registry.size());
    }

    @Test
    void carriesOptionsOntoDescriptor() {
        StepDescriptor step = registrar.step(
            steps,
            "store",
            StepOptions.builder()
                .description("Persists data")
                .setupScript("pip install x")
                .postExecutionScript("cleanup.sh")
                .metadata(Map.of("team", "data"))
                .sandboxId("sandbox-1")
                .credentialBindings(Map.of("DB", "cred-1"))
                .build()
        );

        assertEquals("Persists data", step.description());
        assertEquals("pip install x", step.setupScript());
        assertEquals("cleanup.sh", step.postExecutionScript());
        assertEquals(Map.of("team", "data"), step.metadata());
        assertEquals("sandbox-1", step.sandboxId());
        assertEquals(Map.of("DB", "cred-1"), step.credentialBindings());
    }

    @Test
    void recordsRegistrationCallSite() {
        StepDescriptor step = registrar.step(steps, "fetch");

        SourceLocation location = step.sourceLocation();
        assertTrue(location.isKnown());
        assertTrue(location.filePath().endsWith("work/bridge/sdk/step/StepRegistrarTest.java"), location.filePath());
        assertTrue(location.lineNumber() > 0);
    }

    @Test
    void synthesizedCallableHasUnknownLocation() {
        var schema = new DerivedSchema(
            "constant",
            ParameterSet.empty("constant_args"),
            new ReturnSchema(ReturnSchema.ANY, Object.class, new ObjectMapper().createObjectNode())
        );
        StepDescriptor step = registrar.step(schema, arguments -> "value", StepOptions.defaults());

        assertEquals("constant", step.name());
        assertFalse(step.sourceLocation().isKnown());
        assertNull(step.sourceLocation().lineNumber());
    }

    @Test
    void registersStaticMethods() throws Exception {
        StepDescriptor twice = registrar.step(Steps.class, "twice");

        assertEquals(4, twice.callable().call(new Object[] { 2 }));
    }

    @Test
    void rejectsAmbiguousOrMissingMethods() {
        assertThrows(ConfigurationException.class, () -> registrar.step(steps, "overloaded"));
        assertThrows(ConfigurationException.class, () -> registrar.step(steps, "absent"));
        assertThrows(ConfigurationException.class, () -> registrar.step(Steps.class, "fetch"));
    }

    @Test
    void registersOverloadThroughMethod() throws Exception {
        var method = Steps.class.getMethod("overloaded", int.class);

        StepDescriptor step = registrar.step(method, steps, StepOptions.builder().name("overloaded_int").build());

        assertEquals("integer", step.parameters().propertySchema("value").get("type").asText());
        assertEquals("7", step.callable().call(new Object[] { 7 }));
    }

    @Test
    void allowsOnlyOnePipelinePerUnit() {
        Pipeline pipeline = registrar.pipeline("etl", "Extract and load");
        pipeline.step(steps, "fetch");

        assertEquals(List.of("fetch"), registrar.pipelineSteps());
        assertTrue(registrar.standaloneSteps().isEmpty());
        var error = assertThrows(ConfigurationException.class, () -> registrar.pipeline("other"));
        assertEquals("configuration_error", error.code());
    }
}
