package com.health.misinfo.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI misinfoContextGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Misinformation Context Guard API")
                        .version("1.0.0")
                        .description(
                                "Context graph and risk scoring engine for health misinformation tracking.\n\n" +
                                "**Graph Pipeline:**\n" +
                                "1. Ingest interaction edges via `POST /graph/edges` (self-loops and weights < 1 are rejected)\n" +
                                "2. Edges are merged per unordered account pair by summing weights\n" +
                                "3. Rank super-spreaders by weighted degree, then degree, then account id\n" +
                                "4. Filter by minimum connections and compute density / average degree\n" +
                                "5. Lay out nodes: `force-directed`, `circular`, `random`, `stress-majorization`\n\n" +
                                "**Post Scoring:**\n" +
                                "- Score (0-100) = status severity points + log-scaled engagement points\n" +
                                "- Tiers: **LOW** (<40), **MEDIUM** (40-70), **HIGH** (>=70)\n\n" +
                                "**Live updates:** poll `GET /graph/updates?after={sequence}` for snapshot diffs.")
                        .contact(new Contact().name("Context Guard Team")));
    }
}
