package insights.model.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What a stage hands back on success: summary metrics and typed payloads. */
public record StageResult(Map<String, Object> metrics, List<Payload> payloads) {

    public record Payload(String predictionType, JsonNode body) {}

    public StageResult {
        metrics = metrics == null ? Map.of() : new LinkedHashMap<>(metrics);
        payloads = payloads == null ? List.of() : List.copyOf(payloads);
    }

    public static StageResult of(Map<String, Object> metrics, String predictionType, JsonNode body) {
        return new StageResult(metrics, List.of(new Payload(predictionType, body)));
    }

    public static StageResult metricsOnly(Map<String, Object> metrics) {
        return new StageResult(metrics, List.of());
    }
}
