package com.vortex.firewall.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vortex.firewall.config.MetaApiConfig;
import com.vortex.firewall.model.Campaign;
import com.vortex.firewall.model.CampaignStatus;
import com.vortex.firewall.model.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Meta Graph API client covering the calls the firewall needs: campaign listing,
 * campaign insights and campaign pause. Every call is bounded by
 * {@code meta-api.timeout-seconds}; a timeout surfaces as a {@link MetaApiException}.
 */
@Component
public class MetaGraphApiClient implements MetricsSource, CampaignActuator {

    private static final Logger log = LoggerFactory.getLogger(MetaGraphApiClient.class);

    private static final String CAMPAIGN_FIELDS = "id,name,status,daily_budget,lifetime_budget,objective";

    private final MetaApiConfig config;
    private final RestClient restClient;

    public MetaGraphApiClient(MetaApiConfig config) {
        this.config = config;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        requestFactory.setReadTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));

        this.restClient = RestClient.builder()
                .baseUrl(config.versionedBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getAccessToken())
                .build();
        log.info("Meta Graph API client configured: baseUrl={}, timeoutSeconds={}",
                config.versionedBaseUrl(), config.getTimeoutSeconds());
    }

    @Override
    public List<Campaign> listActiveCampaigns(String accountId) {
        List<Campaign> campaigns = new ArrayList<>();
        JsonNode page = get("/{account}/campaigns?fields={fields}&effective_status={statuses}&limit={limit}",
                Map.of("account", accountId,
                        "fields", CAMPAIGN_FIELDS,
                        "statuses", toJsonArray(config.getEffectiveStatuses()),
                        "limit", config.getPageLimit()));

        int pages = 1;
        while (page != null) {
            for (JsonNode node : page.path("data")) {
                campaigns.add(mapCampaign(node));
            }
            String next = page.path("paging").path("next").asText(null);
            if (next == null || next.isBlank()) {
                break;
            }
            if (pages >= config.getMaxPages()) {
                log.warn("Stopped following campaign pages for {} after {} pages", accountId, pages);
                break;
            }
            page = getAbsolute(next);
            pages++;
        }

        log.debug("Fetched {} campaigns for account {}", campaigns.size(), accountId);
        return campaigns;
    }

    @Override
    public Optional<MetricSnapshot> getInsights(String campaignId, List<String> fields,
                                                LocalDate windowStart, LocalDate windowEnd) {
        String timeRange = "{\"since\":\"" + windowStart + "\",\"until\":\"" + windowEnd + "\"}";
        JsonNode response = get("/{campaign}/insights?fields={fields}&time_range={range}",
                Map.of("campaign", campaignId,
                        "fields", String.join(",", fields),
                        "range", timeRange));

        JsonNode data = response == null ? null : response.path("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }

        JsonNode row = data.get(0);
        return Optional.of(MetricSnapshot.builder()
                .campaignId(campaignId)
                .spend(parseDouble(row, "spend"))
                .impressions(parseLong(row, "impressions"))
                .clicks(parseLong(row, "clicks"))
                .ctr(parseDouble(row, "ctr"))
                .actions(parseActions(row.path("actions")))
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .build());
    }

    @Override
    public boolean pause(String campaignId) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("status", "PAUSED");

        try {
            JsonNode response = restClient.post()
                    .uri("/{campaign}", campaignId)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
            boolean success = response != null && response.path("success").asBoolean(false);
            if (!success) {
                log.error("Meta API did not confirm pause of campaign {}: {}", campaignId, response);
            }
            return success;
        } catch (RestClientException e) {
            log.error("Failed to pause campaign {}: {}", campaignId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Cheap authenticated call used to validate credentials before the first scan.
     */
    public boolean testConnection() {
        try {
            JsonNode response = get("/{account}/campaigns?fields=id&limit=1",
                    Map.of("account", config.getAdAccountId()));
            return response != null && response.has("data");
        } catch (MetaApiException e) {
            log.error("Meta API connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode get(String uriTemplate, Map<String, ?> uriVariables) {
        try {
            return restClient.get()
                    .uri(uriTemplate, uriVariables)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new MetaApiException("Meta API request failed: " + uriTemplate, e);
        }
    }

    private JsonNode getAbsolute(String url) {
        try {
            return restClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new MetaApiException("Meta API paging request failed", e);
        }
    }

    private Campaign mapCampaign(JsonNode node) {
        return Campaign.builder()
                .id(node.path("id").asText())
                .name(node.path("name").asText(null))
                .status(CampaignStatus.fromApiValue(node.path("status").asText(null)))
                .dailyBudget(toMajorUnits(parseDouble(node, "daily_budget")))
                .lifetimeBudget(toMajorUnits(parseDouble(node, "lifetime_budget")))
                .objective(node.path("objective").asText(null))
                .build();
    }

    private Double toMajorUnits(Double minorUnits) {
        return minorUnits == null ? null : minorUnits / config.getBudgetUnitDivisor();
    }

    private Map<String, Double> parseActions(JsonNode actions) {
        Map<String, Double> result = new HashMap<>();
        if (!actions.isArray()) return result;
        for (JsonNode action : actions) {
            String type = action.path("action_type").asText(null);
            Double value = parseDouble(action, "value");
            if (type != null && value != null) {
                result.merge(type, value, Double::sum);
            }
        }
        return result;
    }

    // The Graph API returns numeric fields as strings
    private static Double parseDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.doubleValue();
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {} value '{}'", field, value.asText());
            return null;
        }
    }

    private static Long parseLong(JsonNode node, String field) {
        Double value = parseDouble(node, field);
        return value == null ? null : value.longValue();
    }

    private static String toJsonArray(List<String> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append('"').append(values.get(i)).append('"');
        }
        return sb.append(']').toString();
    }
}
