package work.bridge.sdk.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable sequence of {@link ParameterSpec}s plus the shared {@code $defs} their schemas reference.
 */
public final class ParameterSet implements Iterable<ParameterSpec> {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final String title;
    private final List<ParameterSpec> specs;
    private final Map<String, ParameterSpec> byName;
    private final ObjectNode definitions;

    public ParameterSet(String title, List<ParameterSpec> specs, ObjectNode definitions) {
        this.title = title;
        this.specs = specs == null ? List.of() : List.copyOf(specs);
        var index = new LinkedHashMap<String, ParameterSpec>();
        for (ParameterSpec spec : this.specs) {
            if (index.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate parameter name: " + spec.name());
            }
        }
        this.byName = Collections.unmodifiableMap(index);
        this.definitions = definitions == null ? JSON.createObjectNode() : definitions.deepCopy();
    }

    public static ParameterSet empty(String title) {
        return new ParameterSet(title, List.of(), null);
    }

    public String title() {
        return title;
    }

    public List<ParameterSpec> specs() {
        return specs;
    }

    public int size() {
        return specs.size();
    }

    public Optional<ParameterSpec> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    public ObjectNode definitions() {
        return definitions.deepCopy();
    }

    /**
     * Object schema over every parameter, in the shape step consumers expect
     * ({@code properties}, {@code required}, {@code title}, {@code type}, optional {@code $defs}).
     */
    public ObjectNode jsonSchema() {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode properties = root.putObject("properties");
        List<String> required = new ArrayList<>();
        for (ParameterSpec spec : specs) {
            properties.set(spec.name(), spec.jsonSchema());
            if (spec.required()) {
                required.add(spec.name());
            }
        }
        if (!required.isEmpty()) {
            ArrayNode requiredNode = root.putArray("required");
            required.forEach(requiredNode::add);
        }
        if (title != null) {
            root.put("title", title);
        }
        root.put("type", "object");
        if (!definitions.isEmpty()) {
            root.set("$defs", definitions.deepCopy());
        }
        return root;
    }

    /**
     * Standalone schema for a single parameter, carrying the {@code $defs} its references need.
     */
    public ObjectNode propertySchema(String name) {
        ParameterSpec spec = byName.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown parameter: " + name);
        }
        ObjectNode schema = spec.jsonSchema();
        if (!definitions.isEmpty()) {
            schema.set("$defs", definitions.deepCopy());
        }
        return schema;
    }

    @Override
    public Iterator<ParameterSpec> iterator() {
        return specs.iterator();
    }
}
