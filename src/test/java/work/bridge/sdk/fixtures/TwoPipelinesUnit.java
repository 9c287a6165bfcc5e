package work.bridge.sdk.fixtures;

import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepUnit;

/**
 * Invalid: declares two pipeline groupings.
 */
public final class TwoPipelinesUnit implements StepUnit {
    @Override
    public void register(StepRegistrar registrar) {
        registrar.pipeline("first");
        registrar.pipeline("second");
    }
}
