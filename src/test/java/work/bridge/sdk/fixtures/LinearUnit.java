package work.bridge.sdk.fixtures;

import work.bridge.sdk.marker.FromStep;
import work.bridge.sdk.step.StepRegistrar;
import work.bridge.sdk.step.StepUnit;

/**
 * Implicit pipeline: every step of the unit is a member. extract -> enrich -> publish.
 */
public final class LinearUnit implements StepUnit {
    @Override
    public void register(StepRegistrar registrar) {
        registrar.pipeline("linear", "Extract, enrich and publish");
        registrar.step(this, "extract");
        registrar.step(this, "enrich");
        registrar.step(this, "publish");
    }

    public String extract(String source) {
        return "raw:" + source;
    }

    public String enrich(@FromStep("extract") String raw) {
        return raw + "+meta";
    }

    public String publish(@FromStep("enrich") String document) {
        return "published " + document;
    }
}
