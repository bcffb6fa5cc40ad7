package com.foodintel.catalog.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodintel.catalog.config.CatalogPipelineProperties;
import com.foodintel.catalog.model.GeocodingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Resolves a store or place name with the free Base Adresse Nationale API
 * (api-adresse.data.gouv.fr). No API key required.
 *
 * Example: "Carrefour Market Lyon" → {label: "Lyon", lat: 45.758, lng: 4.835, score: 0.62}
 *
 * Failures never propagate: any HTTP or parsing problem yields an invalid result.
 */
@Service
@Slf4j
public class AdresseGeocodingClient implements GeocodingService {

    private final ObjectMapper objectMapper;
    private final CatalogPipelineProperties properties;
    private final HttpClient httpClient;

    public AdresseGeocodingClient(ObjectMapper objectMapper, CatalogPipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getGeocoding().getTimeoutSeconds()))
                .build();
    }

    @Override
    public GeocodingResult resolve(String address) {
        if (address == null || address.isBlank()) {
            return GeocodingResult.invalid(address);
        }

        CatalogPipelineProperties.Geocoding geocoding = properties.getGeocoding();
        String url = geocoding.getBaseUrl() + "/search/?limit=1&q="
                + URLEncoder.encode(address.trim(), StandardCharsets.UTF_8);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(geocoding.getTimeoutSeconds()))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("Geocoder returned HTTP {} for '{}'", response.statusCode(), address);
                return GeocodingResult.invalid(address);
            }

            GeocodingResult result = parse(address, response.body());
            log.debug("Geocoded '{}' → {} (score {})", address, result.getLabel(), result.getScore());
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Geocoding interrupted for '{}'", address);
            return GeocodingResult.invalid(address);
        } catch (Exception e) {
            log.warn("Geocoding failed for '{}': {}", address, e.getMessage());
            return GeocodingResult.invalid(address);
        }
    }

    GeocodingResult parse(String address, String body) throws java.io.IOException {
        JsonNode features = objectMapper.readTree(body).path("features");
        if (!features.isArray() || features.isEmpty()) {
            return GeocodingResult.invalid(address);
        }

        JsonNode feature = features.get(0);
        JsonNode props = feature.path("properties");
        JsonNode coordinates = feature.path("geometry").path("coordinates");

        // GeoJSON order is [longitude, latitude]
        Double lng = coordinates.size() >= 2 ? coordinates.get(0).asDouble() : null;
        Double lat = coordinates.size() >= 2 ? coordinates.get(1).asDouble() : null;
        double score = props.path("score").asDouble(0.0);

        return GeocodingResult.builder()
                .originalAddress(address)
                .label(textOrNull(props, "label"))
                .latitude(lat)
                .longitude(lng)
                .city(textOrNull(props, "city"))
                .postalCode(textOrNull(props, "postcode"))
                .score(score)
                .valid(lat != null && lng != null && score >= properties.getGeocoding().getMinScore())
                .build();
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
