package work.bridge.sdk.fixtures;

import work.bridge.sdk.step.Pipeline;
import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepUnit;

/**
 * Invalid: one step goes through the pipeline, another does not.
 */
public final class MixedStyleUnit implements StepUnit {
    @Override
    public void register(StepRegistrar registrar) {
        Pipeline pipeline = registrar.pipeline("mixed");
        pipeline.step(this, "inside");
        registrar.step(this, "outside");
    }

    public String inside() {
        return "in";
    }

    public String outside() {
        return "out";
    }
}
