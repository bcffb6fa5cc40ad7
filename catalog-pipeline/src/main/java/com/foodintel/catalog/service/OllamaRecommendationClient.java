package com.foodintel.catalog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.foodintel.catalog.config.CatalogPipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Asks a local Ollama server for data quality recommendations.
 *
 * Errors propagate; the report writer replaces them with a fixed message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OllamaRecommendationClient implements RecommendationService {

    static final String SYSTEM_PROMPT =
            "You are a data quality expert. Give three short, concrete recommendations.";

    private final RestTemplate restTemplate;
    private final CatalogPipelineProperties properties;

    @Override
    public String generate(String summary) {
        CatalogPipelineProperties.Recommendations config = properties.getRecommendations();
        String url = config.getBaseUrl() + "/api/generate";

        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "system", SYSTEM_PROMPT,
                "prompt", summary + "\n\nWhat are your priority recommendations?",
                "stream", false);

        log.debug("Requesting recommendations from {} ({})", url, config.getModel());
        JsonNode response = restTemplate.postForObject(url, body, JsonNode.class);

        if (response == null || !response.hasNonNull("response")) {
            throw new IllegalStateException("Ollama returned no response text");
        }
        return response.get("response").asText().trim();
    }
}
