package com.vortex.firewall.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI adsFirewallOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Vortex Ads Firewall API")
                        .version("1.0.0")
                        .description(
                                "Operator API for the Meta ads firewall.\n\n" +
                                "**Scan Cycle:**\n" +
                                "1. Fetch the ad account's campaigns\n" +
                                "2. Fetch each campaign's insights for yesterday through today\n" +
                                "3. Compare against the stored per-campaign baseline\n" +
                                "4. Record findings and, for critical spend spikes, pause the campaign (if enabled)\n" +
                                "5. Overwrite the baseline with the current observation\n\n" +
                                "**Finding Types:**\n" +
                                "- `SPENDING_SPIKE` - spend / baseline above `spend-spike` (HIGH above 3x)\n" +
                                "- `CTR_ANOMALY` - ctr / baseline below `ctr-drop`\n" +
                                "- `HIGH_CLICK_VOLUME` - clicks above `suspicious-clicks`\n" +
                                "- `BUDGET_BREACH` - spend / daily budget above `budget-breach`")
                        .contact(new Contact().name("Vortex Consultants")));
    }
}
