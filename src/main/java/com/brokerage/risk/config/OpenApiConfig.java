package com.brokerage.risk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI riskAlertEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Brokerage Risk Alert Engine API")
                        .version("1.0.0")
                        .description(
                                "Continuous risk monitoring for brokerage transactions.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Poll new transactions from the feed since the committed marker\n" +
                                "2. Update per-client and per-symbol exposure, client velocity and symbol value statistics\n" +
                                "3. Evaluate the four rule families in order\n" +
                                "4. Deduplicate within the cooldown (escalations pass through)\n" +
                                "5. Persist the alert, then notify Slack / email / SMS\n\n" +
                                "**Alert Types:**\n" +
                                "- `HIGH_CLIENT_EXPOSURE` - client moved into HIGH or CRITICAL\n" +
                                "- `HIGH_SYMBOL_EXPOSURE` - symbol moved into HIGH or CRITICAL\n" +
                                "- `HIGH_TRANSACTION_VELOCITY` - too many transactions from one client in the window\n" +
                                "- `ANOMALY_DETECTED` - transaction value far from the symbol's recent distribution\n\n" +
                                "**Risk Levels:** LOW (<50%), MEDIUM (50-80%), HIGH (80-100%), CRITICAL (>=100%) of threshold")
                        .contact(new Contact().name("Risk Engineering")));
    }
}
