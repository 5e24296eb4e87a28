package com.vortex.firewall.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "meta-api")
public class MetaApiConfig {

    private String accessToken;
    private String adAccountId;
    private String baseUrl = "https://graph.facebook.com";
    private String apiVersion = "v17.0";

    // Connect and read timeout for every Graph API call
    private int timeoutSeconds = 30;

    private int pageLimit = 1000;
    private int maxPages = 10;

    private List<String> effectiveStatuses = List.of("ACTIVE");

    private List<String> insightFields = List.of("spend", "impressions", "clicks", "ctr", "actions");

    // Graph API budgets are expressed in minor currency units (cents)
    private double budgetUnitDivisor = 100.0;

    private boolean verifyOnStartup = true;

    @PostConstruct
    public void validate() {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalStateException("meta-api.access-token is required");
        }
        if (adAccountId == null || adAccountId.isBlank()) {
            throw new IllegalStateException("meta-api.ad-account-id is required");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("meta-api.timeout-seconds must be > 0");
        }
        if (budgetUnitDivisor <= 0) {
            throw new IllegalStateException("meta-api.budget-unit-divisor must be > 0");
        }
    }

    public String versionedBaseUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/" + apiVersion;
    }
}
