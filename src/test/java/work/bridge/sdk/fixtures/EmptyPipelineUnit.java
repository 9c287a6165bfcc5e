package work.bridge.sdk.fixtures;

import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepUnit;

public final class EmptyPipelineUnit implements StepUnit {
    @Override
    public void register(StepRegistrar registrar) {
        registrar.pipeline("empty");
    }
}
