package com.autotrader.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the operator surface.
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI autoTraderOpenAPI() {
        return new OpenAPI()
                .info(buildApiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:8080")
                        .description("Local Development Server")))
                .tags(buildApiTags());
    }

    private Info buildApiInfo() {
        return new Info()
                .title("Position Auto-Trader API")
                .description("""
                        Operator API for the automated position manager.

                        Key Features:
                        • Stop loss, take profit and trailing stop exits
                        • Partial profit taking ladders
                        • Max hold time liquidation
                        • Scale-in buys on planned drawdowns
                        • Strategy budgets and concurrency caps
                        • Simulation mode for risk-free testing
                        """)
                .version("1.0.0")
                .license(new License()
                        .name("Apache 2.0")
                        .url("https://www.apache.org/licenses/LICENSE-2.0.html"));
    }

    private List<Tag> buildApiTags() {
        return List.of(
                new Tag().name("Positions")
                        .description("Position inspection, creation and manual close"),
                new Tag().name("Strategies")
                        .description("Strategy templates, budgets and performance"),
                new Tag().name("Position Monitoring")
                        .description("Monitoring loop status and control")
        );
    }
}
