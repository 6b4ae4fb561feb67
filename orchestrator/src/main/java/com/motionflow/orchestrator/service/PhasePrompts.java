package com.motionflow.orchestrator.service;

import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.PhaseCode;
import com.motionflow.orchestrator.routing.PhaseDefinition;
import com.motionflow.orchestrator.routing.PhaseRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * System and user prompts for each phase.
 *
 * Every phase answers inside <result>...</result>. The judge simulation must
 * also emit a JSON grade so {@link ResponseParser#extractQualityScore} can
 * read it.
 */
@Component
public class PhasePrompts {

    private static final String COMMON = """
            You are part of a legal motion drafting pipeline. Work only from the case
            materials and prior phase outputs you are given. Never invent authorities.
            Put your complete deliverable for this phase inside <result>...</result>.
            """;

    private final PhaseRegistry registry;

    public PhasePrompts(PhaseRegistry registry) {
        this.registry = registry;
    }

    public String system(PhaseCode phase) {
        PhaseDefinition def = registry.definition(phase);
        return "Phase " + def.code().code() + " - " + def.displayName() + "\n\n" + COMMON + "\n" + task(phase);
    }

    /** User message: order facts, then prior phase outputs in pipeline order. */
    public String user(PhaseCode phase, MotionOrder order, Map<PhaseCode, String> priorOutputs) {
        StringBuilder sb = new StringBuilder();
        sb.append("Order ").append(order.getOrderNumber())
          .append(" | motion type: ").append(order.getMotionType())
          .append(" | tier: ").append(order.getTier())
          .append(" | revision cycle: ").append(order.getRevisionCount())
          .append("\n\n");

        if (!priorOutputs.isEmpty()) {
            sb.append("=== PRIOR PHASE OUTPUTS ===\n");
            priorOutputs.forEach((p, out) ->
                    sb.append("[ Phase ").append(p.code()).append(" ]\n").append(out).append("\n\n"));
            sb.append("=== END PRIOR OUTPUTS ===\n\n");
        }
        sb.append("Begin phase ").append(phase.code()).append('.');
        return sb.toString();
    }

    private static String task(PhaseCode phase) {
        return switch (phase) {
            case I -> "Summarise the intake: parties, court, deadlines and every uploaded document.";
            case II -> "State the legal standard governing this motion and break it into required elements.";
            case III -> "Map the available evidence to each element and list the contested issues.";
            case IV -> "Research binding and persuasive authority for each issue. Give full reporter citations.";
            case V -> "Draft the complete motion with a citation for every legal proposition.";
            case V_1 -> "Check every citation in the draft against the research record and flag mismatches.";
            case VI -> "Anticipate the opposition's strongest arguments and how the draft answers them.";
            case VII -> """
                    Evaluate the motion as the assigned judge would. Include in your result a JSON
                    object {"grade": "<letter A+..F>", "score": <0..1>, "deficiencies": [...]}.""";
            case VII_1 -> "Re-check every citation changed or added during revision.";
            case VIII -> "Revise the motion to cure every deficiency the judge simulation identified.";
            case VIII_5 -> "Validate the caption, court name, case number and party designations.";
            case IX -> "Prepare supporting documents: proposed order, declarations, proof of service.";
            case IX_1 -> "Check the separate statement of undisputed facts against the motion and evidence.";
            case X -> "Assemble the final filing package and list every document it contains.";
        };
    }
}
