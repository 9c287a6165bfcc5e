package work.bridge.sdk.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * A named pipeline and its member steps, as declared by one discovery unit.
 *
 * @param name        pipeline name
 * @param description optional description
 * @param unitId      identifier of the unit that declared it
 * @param members     member step names in declaration order
 */
public record PipelineDescriptor(String name, String description, String unitId, List<String> members) {
    public PipelineDescriptor {
        Objects.requireNonNull(name, "name");
        members = members == null ? List.of() : List.copyOf(members);
    }
}
