package com.quick.codebattles.codebattles;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Display-only constraint attached to a card (time limit, complexity, line limit).
 * Grading never enforces it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Challenge(String type, Object value) {
}
