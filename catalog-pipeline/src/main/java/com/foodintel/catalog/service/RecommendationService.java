package com.foodintel.catalog.service;

/**
 * Turns a quality summary into short improvement recommendations.
 * Implementations may fail; callers fall back to a fixed message.
 */
public interface RecommendationService {

    String generate(String summary);
}
