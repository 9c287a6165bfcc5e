package work.bridge.sdk.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bridge.sdk.schema.ParameterSpec;
import work.bridge.sdk.schema.ReturnSchema;
import work.bridge.sdk.step.StepDescriptor;

/**
 * Runs one step against JSON inputs and returns its JSON-encoded result.
 * <p>
 * Each call goes through the same stages: parse the explicit input and upstream results, copy upstream
 * values into parameters fed by step results (explicit input wins), validate and bind every parameter,
 * call the step (awaiting it when it returns a {@link CompletionStage}) and encode the result. Every
 * failure surfaces as a {@link StepInvocationException}; nothing is retained between calls.
 */
public final class InvocationEngine {
    private static final Logger log = LoggerFactory.getLogger(InvocationEngine.class);
    private static final ObjectMapper JSON = new ObjectMapper().registerModule(new Jdk8Module());
    private static final JsonSchemaFactory SCHEMAS = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    public String invoke(StepDescriptor step, String input, String upstreamResults) {
        CompletableFuture<String> future = invokeAsync(step, input, upstreamResults);
        try {
            return future.get();
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.name(), "Interrupted while waiting for step " + step.name(), ex);
        } catch (CancellationException ex) {
            throw new StepExecutionException(step.name(), "Step " + step.name() + " was cancelled", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof StepInvocationException failure) {
                throw failure;
            }
            throw new StepExecutionException(step.name(), "Step " + step.name() + " failed: " + cause, cause);
        }
    }

    /**
     * Starts the step and returns its pending encoded result. Input problems complete the future
     * exceptionally rather than throwing. Cancelling the returned future cancels an asynchronous step.
     */
    public CompletableFuture<String> invokeAsync(StepDescriptor step, String input, String upstreamResults) {
        Object result;
        try {
            ObjectNode arguments = resolve(step, input, upstreamResults);
            result = call(step, bind(step, arguments));
        } catch (StepInvocationException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (result instanceof CompletionStage<?> stage) {
            return awaitStage(step, stage);
        }
        try {
            return CompletableFuture.completedFuture(encode(step, result));
        } catch (StepInvocationException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Parses both documents and merges upstream results into the explicit input. A parameter fed by a step
     * result takes that step's result only when the explicit input does not already carry it.
     */
    public ObjectNode resolve(StepDescriptor step, String input, String upstreamResults) {
        ObjectNode explicit = parseObject(input, "input", (message, cause) -> new InvalidInputException(step.name(), message, cause));
        ObjectNode upstream = parseObject(
            upstreamResults,
            "upstream results",
            (message, cause) -> new InvalidUpstreamException(step.name(), message, cause)
        );
        ObjectNode merged = explicit.deepCopy();
        for (Map.Entry<String, String> entry : step.paramsFromStepResults().entrySet()) {
            String parameter = entry.getKey();
            String source = entry.getValue();
            if (merged.has(parameter)) {
                continue;
            }
            JsonNode value = upstream.get(source);
            if (value != null) {
                merged.set(parameter, value.deepCopy());
            }
        }
        return merged;
    }

    /**
     * Validates the resolved arguments against each parameter schema and converts them to the Java
     * argument array. Fields not declared by the step are ignored.
     */
    public Object[] bind(StepDescriptor step, ObjectNode arguments) {
        List<ParameterSpec> specs = step.parameters().specs();
        Object[] values = new Object[specs.size()];
        var fields = new ArrayList<String>();
        var missingSteps = new ArrayList<String>();
        var problems = new ArrayList<String>();

        for (int i = 0; i < specs.size(); i++) {
            ParameterSpec spec = specs.get(i);
            JsonNode value = arguments.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    fields.add(spec.name());
                    String source = step.paramsFromStepResults().get(spec.name());
                    if (source == null) {
                        problems.add("missing required parameter '" + spec.name() + "'");
                    } else {
                        missingSteps.add(source);
                        problems.add("missing required parameter '" + spec.name() + "' (no result from step '" + source + "')");
                    }
                    continue;
                }
                value = spec.defaultValue();
            } else {
                List<String> violations = validate(step, spec, value);
                if (!violations.isEmpty()) {
                    fields.add(spec.name());
                    problems.addAll(violations);
                    continue;
                }
            }
            try {
                values[i] = convert(spec, value);
            } catch (IllegalArgumentException ex) {
                fields.add(spec.name());
                problems.add(spec.name() + ": " + ex.getMessage());
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(step.name(), fields, missingSteps, problems);
        }
        return values;
    }

    private static List<String> validate(StepDescriptor step, ParameterSpec spec, JsonNode value) {
        JsonSchema schema = SCHEMAS.getSchema(step.parameters().propertySchema(spec.name()));
        Set<ValidationMessage> messages = schema.validate(value);
        var violations = new ArrayList<String>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage().replaceFirst("^\\$", spec.name()));
        }
        return violations;
    }

    private static Object convert(ParameterSpec spec, JsonNode value) {
        JavaType type = JSON.getTypeFactory().constructType(spec.javaType());
        if (value == null || value.isNull()) {
            if (type.getRawClass() == Optional.class) {
                return Optional.empty();
            }
            if (value == null) {
                return null;
            }
        }
        return JSON.convertValue(value, type);
    }

    private static Object call(StepDescriptor step, Object[] arguments) {
        log.debug("Invoking step {}", step.name());
        try {
            return step.callable().call(arguments);
        } catch (StepInvocationException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new StepExecutionException(step.name(), "Step " + step.name() + " failed: " + describe(ex), ex);
        }
    }

    private CompletableFuture<String> awaitStage(StepDescriptor step, CompletionStage<?> stage) {
        var encoded = new CompletableFuture<String>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                try {
                    encoded.complete(encode(step, value));
                } catch (Throwable ex) {
                    encoded.completeExceptionally(ex);
                }
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                encoded.cancel(false);
            } else {
                encoded.completeExceptionally(
                    new StepExecutionException(step.name(), "Step " + step.name() + " failed: " + describe(cause), cause)
                );
            }
        });
        encoded.whenComplete((value, error) -> {
            if (encoded.isCancelled() && stage instanceof Future<?> source) {
                source.cancel(true);
            }
        });
        return encoded;
    }

    private static String encode(StepDescriptor step, Object result) {
        ReturnSchema returns = step.returnSchema();
        try {
            if (returns.isUntyped()) {
                return JSON.writeValueAsString(result == null ? null : String.valueOf(result));
            }
            if ("null".equals(returns.declaredType())) {
                return "null";
            }
            JavaType type = JSON.getTypeFactory().constructType(returns.javaType());
            return JSON.writerFor(type).writeValueAsString(result);
        } catch (JsonProcessingException | RuntimeException ex) {
            throw new SerializationException(
                step.name(),
                "Cannot encode result of step " + step.name() + " as " + returns.declaredType() + ": " + ex.getMessage(),
                ex
            );
        }
    }

    private static ObjectNode parseObject(String text, String what, BiFunction<String, Throwable, StepInvocationException> failure) {
        if (text == null || text.isBlank()) {
            return JSON.createObjectNode();
        }
        JsonNode node;
        try {
            node = JSON.readTree(text);
        } catch (JsonProcessingException ex) {
            throw failure.apply("Cannot parse " + what + " as JSON: " + ex.getOriginalMessage(), ex);
        }
        if (!(node instanceof ObjectNode object)) {
            throw failure.apply("Expected " + what + " to be a JSON object but got " + node.getNodeType(), null);
        }
        return object;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + message;
    }
}
