package work.bridge.sdk.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.bridge.sdk.shared.ConfigurationException;
import work.bridge.sdk.step.Pipeline;
import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepRegistry;
import work.bridge.sdk.step.StepUnit;

/**
 * Loads discovery units, runs their registrations against the shared registries and records the steps
 * and pipeline each unit introduced.
 * <p>
 * Discovery mutates shared state and is not safe to run for the same unit from several threads at once;
 * callers serialise it.
 */
public final class StepDiscovery {
    private static final Logger log = LoggerFactory.getLogger(StepDiscovery.class);

    private final StepRegistry steps;
    private final PipelineRegistry pipelines;
    private final ClassLoader classLoader;

    public StepDiscovery(StepRegistry steps, PipelineRegistry pipelines) {
        this(steps, pipelines, Thread.currentThread().getContextClassLoader());
    }

    public StepDiscovery(StepRegistry steps, PipelineRegistry pipelines, ClassLoader classLoader) {
        this.steps = Objects.requireNonNull(steps, "steps");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines");
        this.classLoader = classLoader == null ? StepDiscovery.class.getClassLoader() : classLoader;
    }

    public StepRegistry steps() {
        return steps;
    }

    public PipelineRegistry pipelines() {
        return pipelines;
    }

    public List<DiscoveryResult> discoverAll(List<String> unitClassNames) {
        var results = new ArrayList<DiscoveryResult>();
        for (String className : unitClassNames) {
            results.add(discover(className));
        }
        return results;
    }

    public DiscoveryResult discover(String unitClassName) {
        StepUnit unit = UnitLoader.load(unitClassName, classLoader);
        return discover(unitClassName.trim(), unit);
    }

    public DiscoveryResult discover(Class<? extends StepUnit> unitType) {
        return discover(unitType.getName(), UnitLoader.instantiate(unitType));
    }

    public DiscoveryResult discover(String unitId, StepUnit unit) {
        Objects.requireNonNull(unit, "unit");
        Set<String> known = Set.copyOf(steps.snapshot().keySet());
        var registrar = new StepRegistrar(steps, unitId);
        unit.register(registrar);

        List<String> declared = introduced(registrar.declaredSteps(), known);
        Optional<PipelineDescriptor> pipeline = registrar.pipelineGroup()
            .map(group -> describe(group, registrar, declared));
        pipeline.ifPresent(pipelines::register);

        log.info(
            "Discovered {} step(s) in unit '{}'{}",
            declared.size(),
            unitId,
            pipeline.map(p -> " (pipeline '" + p.name() + "')").orElse("")
        );
        return new DiscoveryResult(unitId, declared, pipeline);
    }

    /**
     * Names the unit added to the registry. A name an earlier unit already registered is not new.
     */
    private static List<String> introduced(List<String> names, Set<String> known) {
        return names.stream().filter(name -> !known.contains(name)).collect(Collectors.toList());
    }

    private static PipelineDescriptor describe(Pipeline group, StepRegistrar registrar, List<String> declared) {
        List<String> routed = registrar.pipelineSteps();
        List<String> standalone = registrar.standaloneSteps();
        if (!routed.isEmpty() && !standalone.isEmpty()) {
            throw new ConfigurationException(
                "Unit '" + registrar.unitId() + "' registers steps through pipeline '" + group.name()
                    + "' but also declares standalone steps " + standalone
                    + "; register every step of the unit through the pipeline"
            );
        }
        List<String> members = routed.isEmpty() ? declared : routed;
        return new PipelineDescriptor(group.name(), group.description(), registrar.unitId(), members);
    }
}
