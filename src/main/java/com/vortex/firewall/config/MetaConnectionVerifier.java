package com.vortex.firewall.config;

import com.vortex.firewall.client.MetaGraphApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Refuses to start the firewall when the Graph API rejects the configured
 * credentials. Scans never begin with a known-bad token.
 */
@Component
public class MetaConnectionVerifier implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MetaConnectionVerifier.class);

    private final MetaApiConfig config;
    private final MetaGraphApiClient client;

    public MetaConnectionVerifier(MetaApiConfig config, MetaGraphApiClient client) {
        this.config = config;
        this.client = client;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!config.isVerifyOnStartup()) {
            log.info("Meta API connection check skipped (meta-api.verify-on-startup=false)");
            return;
        }
        if (!client.testConnection()) {
            throw new IllegalStateException(
                    "Meta API connection test failed for account " + config.getAdAccountId()
                            + ". Check meta-api.access-token and meta-api.ad-account-id.");
        }
        log.info("Meta API connection verified for account {}", config.getAdAccountId());
    }
}
