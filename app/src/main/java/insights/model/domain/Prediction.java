package insights.model.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** Artifact emitted by a completed stage; the payload is stored as JSON text. */
public record Prediction(String module, String predictionType, JsonNode payload, Instant timestamp) {}
