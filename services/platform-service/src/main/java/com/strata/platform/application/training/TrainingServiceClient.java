package com.strata.platform.application.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.strata.platform.config.RestTemplateConfig;
import com.strata.platform.error.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client of the external training service.
 *
 * <p>A non-2xx answer becomes a client error carrying the remote text; transport failures are
 * internal errors.
 */
@Component
public class TrainingServiceClient {

    private static final Logger log = LoggerFactory.getLogger(TrainingServiceClient.class);

    static final String TRAIN_PATH = "/train";
    static final String HEALTH_PATH = "/health";

    private final RestTemplate restTemplate;

    public TrainingServiceClient(@Qualifier(RestTemplateConfig.TRAINING_REST_TEMPLATE) RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Submits the job and returns the service's answer unchanged.
     */
    public JsonNode train(TrainingRequest request) {
        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(TRAIN_PATH, request.toPayload(), JsonNode.class);
            log.info("Training job submitted for schema {} ({})", request.schemaId(), response.getStatusCode());
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            String remote = e.getResponseBodyAsString();
            log.warn("Training service answered {}: {}", e.getStatusCode(), remote);
            throw PlatformException.badRequest(
                    "Training service error: " + (remote.isBlank() ? e.getStatusText() : remote));
        } catch (RestClientException e) {
            throw PlatformException.internal("Training service unreachable", e);
        }
    }

    /**
     * @return true if {@code GET /health} answers 2xx
     */
    public boolean isAvailable() {
        try {
            return restTemplate.getForEntity(HEALTH_PATH, String.class).getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.debug("Training service health probe failed: {}", e.getMessage());
            return false;
        }
    }
}
