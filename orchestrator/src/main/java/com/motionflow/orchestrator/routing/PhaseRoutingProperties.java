package com.motionflow.orchestrator.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Routing knobs bound from {@code motionflow.routing.*}.
 *
 * <pre>
 * motionflow:
 *   routing:
 *     models:
 *       sonnet: claude-sonnet-4-20250514
 *       opus:   claude-opus-4-5-20251101
 *     model-overrides:
 *       "[VII.1.C]": claude-opus-4-5-20251101
 * </pre>
 *
 * Override keys are {@code PHASE.TIER}; they need the bracket form in YAML
 * because the phase code itself may contain a dot.
 */
@ConfigurationProperties(prefix = "motionflow.routing")
public record PhaseRoutingProperties(Models models, Map<String, String> modelOverrides) {

    public static final String DEFAULT_SONNET = "claude-sonnet-4-20250514";
    public static final String DEFAULT_OPUS   = "claude-opus-4-5-20251101";

    public PhaseRoutingProperties {
        if (models == null) models = new Models(null, null);
        modelOverrides = modelOverrides == null ? Map.of() : Map.copyOf(modelOverrides);
    }

    public static PhaseRoutingProperties defaults() {
        return new PhaseRoutingProperties(null, null);
    }

    public record Models(String sonnet, String opus) {
        public Models {
            if (sonnet == null || sonnet.isBlank()) sonnet = DEFAULT_SONNET;
            if (opus == null || opus.isBlank())     opus   = DEFAULT_OPUS;
        }
    }
}
