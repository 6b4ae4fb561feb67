package com.motionflow.orchestrator.routing;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.PhaseCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The one place that knows which model, reasoning budget, token cap and
 * citation batch size each phase runs with at each tier.
 *
 * The table is built once in the constructor and never changes afterwards.
 * Anything else that needs a model id asks this class.
 *
 * Routing summary:
 *
 *   phase  | A                | B                | C
 *   -------+------------------+------------------+------------------
 *   III    | sonnet           | sonnet           | sonnet  / 10000
 *   IV     | sonnet           | opus             | opus
 *   V      | sonnet           | sonnet           | sonnet  / 10000
 *   VI     | sonnet           | opus / 8000      | opus    / 8000
 *   VII    | opus / 5000      | opus / 5000      | opus    / 10000
 *   VII.1  | sonnet / 5000    | sonnet / 5000    | sonnet  / 10000
 *   VIII   | sonnet           | opus / 8000      | opus    / 8000
 *   others | sonnet           | sonnet           | sonnet
 */
@Component
public class PhaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseRegistry.class);

    static final int STANDARD_MAX_TOKENS  = 64_000;
    static final int REASONING_MAX_TOKENS = 128_000;

    private static final Set<PhaseCode> CITATION_CHECK_PHASES = Set.of(PhaseCode.V_1, PhaseCode.VII_1);
    private static final int CITATION_CHECK_BATCH = 2;

    private static final List<PhaseDefinition> DEFINITIONS = List.of(
            new PhaseDefinition(PhaseCode.I,      "Intake & Document Processing",  1,  "PHASE_I"),
            new PhaseDefinition(PhaseCode.II,     "Legal Standards / Motion Deconstruction", 2, "PHASE_II"),
            new PhaseDefinition(PhaseCode.III,    "Evidence Strategy / Issue Identification", 3, "PHASE_III"),
            new PhaseDefinition(PhaseCode.IV,     "Authority Research",            4,  "PHASE_IV"),
            new PhaseDefinition(PhaseCode.V,      "Drafting",                      5,  "PHASE_V"),
            new PhaseDefinition(PhaseCode.V_1,    "Citation Accuracy Check",       6,  "PHASE_V1"),
            new PhaseDefinition(PhaseCode.VI,     "Opposition Anticipation",       7,  "PHASE_VI"),
            new PhaseDefinition(PhaseCode.VII,    "Judge Simulation",              8,  "PHASE_VII"),
            new PhaseDefinition(PhaseCode.VII_1,  "Post-Revision Citation Check",  9,  "PHASE_VII1"),
            new PhaseDefinition(PhaseCode.VIII,   "Revisions",                     10, "PHASE_VIII"),
            new PhaseDefinition(PhaseCode.VIII_5, "Caption Validation",            11, "PHASE_VIII5"),
            new PhaseDefinition(PhaseCode.IX,     "Supporting Documents",          12, "PHASE_IX"),
            new PhaseDefinition(PhaseCode.IX_1,   "Separate Statement Check",      13, "PHASE_IX1"),
            new PhaseDefinition(PhaseCode.X,      "Final Assembly",                14, "PHASE_X")
    );

    private final Map<PhaseCode, Map<ExecutionTier, PhaseRoute>> routes;
    private final Map<PhaseCode, PhaseDefinition> definitions;

    public PhaseRegistry(PhaseRoutingProperties properties) {
        Map<String, String> overrides = parseOverrides(properties.modelOverrides());

        Map<PhaseCode, Map<ExecutionTier, PhaseRoute>> table = new EnumMap<>(PhaseCode.class);
        for (PhaseCode phase : PhaseCode.values()) {
            Map<ExecutionTier, PhaseRoute> row = new EnumMap<>(ExecutionTier.class);
            for (ExecutionTier tier : ExecutionTier.values()) {
                String model = overrides.getOrDefault(overrideKey(phase, tier),
                        usesOpus(phase, tier) ? properties.models().opus() : properties.models().sonnet());
                Integer budget = reasoningBudget(phase, tier);
                row.put(tier, new PhaseRoute(model, budget, maxTokensFor(budget), batchSize(phase, tier)));
            }
            table.put(phase, Collections.unmodifiableMap(row));
        }
        this.routes = Collections.unmodifiableMap(table);
        this.definitions = DEFINITIONS.stream()
                .collect(Collectors.toUnmodifiableMap(PhaseDefinition::code, d -> d));

        if (!overrides.isEmpty()) {
            log.info("Phase routing overrides applied: {}", overrides);
        }
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    public PhaseRoute lookup(PhaseCode phase, ExecutionTier tier) {
        if (phase == null || tier == null) {
            throw new LookupException("No route for phase=" + phase + ", tier=" + tier);
        }
        return routes.get(phase).get(tier);
    }

    /** Untyped lookup for callers holding raw strings (API input, stored rows). */
    public PhaseRoute lookup(String phase, String tier) {
        PhaseCode p = PhaseCode.fromCode(phase)
                .orElseThrow(() -> new LookupException("Unknown phase: " + phase));
        ExecutionTier t = ExecutionTier.fromCode(tier)
                .orElseThrow(() -> new LookupException("Unknown tier: " + tier));
        return lookup(p, t);
    }

    public PhaseDefinition definition(PhaseCode phase) {
        PhaseDefinition def = definitions.get(phase);
        if (def == null) throw new LookupException("Unknown phase: " + phase);
        return def;
    }

    public List<PhaseDefinition> definitions() {
        return DEFINITIONS;
    }

    // ------------------------------------------------------------------
    // Table rules
    // ------------------------------------------------------------------

    /** Token cap follows the reasoning budget; this is the only place that coupling lives. */
    static int maxTokensFor(Integer reasoningBudget) {
        return reasoningBudget != null ? REASONING_MAX_TOKENS : STANDARD_MAX_TOKENS;
    }

    private static boolean usesOpus(PhaseCode phase, ExecutionTier tier) {
        return switch (phase) {
            case VII -> true;
            case IV, VI, VIII -> tier != ExecutionTier.A;
            default -> false;
        };
    }

    private static Integer reasoningBudget(PhaseCode phase, ExecutionTier tier) {
        return switch (phase) {
            case III, V -> tier == ExecutionTier.C ? 10_000 : null;
            case VI, VIII -> tier == ExecutionTier.A ? null : 8_000;
            case VII, VII_1 -> tier == ExecutionTier.C ? 10_000 : 5_000;
            default -> null;
        };
    }

    private static int batchSize(PhaseCode phase, ExecutionTier tier) {
        if (CITATION_CHECK_PHASES.contains(phase)) return CITATION_CHECK_BATCH;
        return switch (tier) {
            case A -> 5;
            case B -> 4;
            case C -> 3;
        };
    }

    private static String overrideKey(PhaseCode phase, ExecutionTier tier) {
        return phase.code() + "." + tier.name();
    }

    /**
     * Validate override keys eagerly so a typo fails startup instead of
     * silently routing to the default model.
     */
    private static Map<String, String> parseOverrides(Map<String, String> raw) {
        Map<String, String> parsed = new HashMap<>();
        raw.forEach((key, model) -> {
            int split = key.lastIndexOf('.');
            if (split <= 0) throw new LookupException("Malformed routing override key: " + key);
            PhaseCode phase = PhaseCode.fromCode(key.substring(0, split))
                    .orElseThrow(() -> new LookupException("Unknown phase in routing override: " + key));
            ExecutionTier tier = ExecutionTier.fromCode(key.substring(split + 1))
                    .orElseThrow(() -> new LookupException("Unknown tier in routing override: " + key));
            if (model == null || model.isBlank()) {
                throw new LookupException("Empty model in routing override: " + key);
            }
            parsed.put(overrideKey(phase, tier), model.trim());
        });
        return Map.copyOf(parsed);
    }
}
