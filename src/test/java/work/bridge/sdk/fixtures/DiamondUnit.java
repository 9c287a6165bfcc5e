package work.bridge.sdk.fixtures;

import work.bridge.sdk.marker.FromStep;
import work.bridge.sdk.step.Pipeline;
import work.bridge.sdk.step.StepDescriptor;
import work.bridge.sdk.step.StepOptions;
import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepUnit;

/**
 * top -> (west, east) -> bottom. The east edge is declared through a descriptor reference.
 */
public final class DiamondUnit implements StepUnit {
    @Override
    public void register(StepRegistrar registrar) {
        Pipeline pipeline = registrar.pipeline("diamond", "Split and join");
        StepDescriptor top = pipeline.step(this, "top");
        pipeline.step(this, "west");
        pipeline.step(this, "east", StepOptions.builder().fromStep("value", top).build());
        pipeline.step(this, "bottom");
    }

    public int top(int seed) {
        return seed;
    }

    public int west(@FromStep("top") int value) {
        return value * 2;
    }

    public int east(int value) {
        return value * 3;
    }

    public int bottom(@FromStep("west") int w, @FromStep("east") int e) {
        return w + e;
    }
}
