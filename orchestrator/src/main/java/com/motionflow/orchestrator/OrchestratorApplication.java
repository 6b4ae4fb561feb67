package com.motionflow.orchestrator;

import com.motionflow.orchestrator.cost.PricingProperties;
import com.motionflow.orchestrator.routing.PhaseRoutingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Order-to-delivery engine for AI-drafted legal motions.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@EnableConfigurationProperties({PhaseRoutingProperties.class, PricingProperties.class})
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
