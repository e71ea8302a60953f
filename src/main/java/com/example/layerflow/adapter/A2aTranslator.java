package com.example.layerflow.adapter;

import com.example.layerflow.layer.AdapterTranslationException;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.util.PayloadUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent-to-agent wire format: every role is a separate agent with its own task name and
 * response shape.
 */
public class A2aTranslator implements AgentTranslator {

    @Override
    public JsonNode toRequest(LayerRole role, Map<String, Object> payload) {
        ObjectNode req = PayloadUtils.mapper().createObjectNode();
        switch (role) {
            case LEADING -> {
                req.put("task", "audit");
                req.put("question", text(payload, "question"));
                req.put("answer", text(payload, "answer"));
                req.put("context", text(payload, "context"));
            }
            case INTERMEDIATE -> {
                req.put("task", "fact_check");
                req.put("question", text(payload, "question"));
                req.put("answer", text(payload, "answer"));
                req.set("claims", PayloadUtils.mapper().valueToTree(payload.getOrDefault("claims", List.of())));
            }
            case TERMINAL -> {
                req.put("task", "revise");
                req.put("original_answer", text(payload, "answer"));
                ObjectNode results = req.putObject("verification_results");
                ArrayNode claims = results.putArray("claims");
                for (Map<?, ?> v : maps(payload.get("verifications"))) {
                    ObjectNode c = claims.addObject();
                    Object claim = v.get("claim");
                    c.put("text", claim instanceof Map<?, ?> m && m.get("text") != null ? String.valueOf(m.get("text")) : "");
                    c.put("verdict", String.valueOf(v.get("verdict")));
                    c.put("confidence", v.get("confidence") instanceof Number n ? n.doubleValue() : 0.0);
                    c.put("justification", v.get("justification") == null ? "" : String.valueOf(v.get("justification")));
                }
                results.put("overall_assessment", text(payload, "overall_assessment"));
                results.put("confidence", payload.get("confidence_score") instanceof Number n ? n.doubleValue() : 0.0);
            }
        }
        return req;
    }

    @Override
    public Map<String, Object> fromResponse(LayerRole role, Map<String, Object> request, JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new AdapterTranslationException(role, "A2A response is not a JSON object");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        switch (role) {
            case LEADING -> {
                JsonNode claims = required(role, response, "claims");
                List<Map<String, Object>> list = new ArrayList<>();
                claims.forEach(c -> {
                    Map<String, Object> claim = new LinkedHashMap<>();
                    claim.put("text", c.isTextual() ? c.asText() : c.path("text").asText(""));
                    claim.put("claim_type", c.path("claim_type").asText("factual"));
                    claim.put("importance", c.path("importance").asDouble(0.5));
                    list.add(claim);
                });
                out.put("question", text(request, "question"));
                out.put("answer", text(request, "answer"));
                out.put("claims", list);
                out.put("claim_count", list.size());
            }
            case INTERMEDIATE -> {
                JsonNode claims = required(role, response, "claims");
                List<Map<String, Object>> verifications = new ArrayList<>();
                boolean verified = true;
                for (JsonNode c : claims) {
                    Map<String, Object> v = new LinkedHashMap<>();
                    v.put("claim", Map.of("text", c.path("text").asText("")));
                    v.put("verdict", c.path("verdict").asText("unsupported"));
                    v.put("confidence", c.path("confidence").asDouble(0.0));
                    v.put("justification", c.path("justification").asText(""));
                    if (c.hasNonNull("correction")) {
                        v.put("correction", c.get("correction").asText());
                    }
                    v.put("sources", PayloadUtils.mapper().convertValue(c.path("sources").isArray()
                            ? c.get("sources") : PayloadUtils.mapper().createArrayNode(), List.class));
                    verified &= !"inaccurate".equals(v.get("verdict"));
                    verifications.add(v);
                }
                double confidence = required(role, response, "confidence").asDouble();
                out.put("question", text(request, "question"));
                out.put("answer", text(request, "answer"));
                out.put("claim_count", verifications.size());
                out.put("verifications", verifications);
                out.put("overall_assessment", response.path("overall_verdict").asText(""));
                out.put("confidence_score", confidence);
                out.put("quality", confidence);
                out.put("verified", verified);
            }
            case TERMINAL -> {
                out.put("final_output", required(role, response, "revised_answer").asText());
                out.put("original_answer", text(request, "answer"));
                out.put("changes_made", PayloadUtils.mapper().convertValue(
                        response.path("changes").isArray() ? response.get("changes")
                                : PayloadUtils.mapper().createArrayNode(), List.class));
                out.put("revision_reasoning", response.path("reasoning").asText(""));
                out.put("quality_score", required(role, response, "quality_score").asDouble());
            }
        }
        return out;
    }

    private static JsonNode required(LayerRole role, JsonNode response, String field) {
        JsonNode node = response.get(field);
        if (node == null || node.isNull()) {
            throw new AdapterTranslationException(role, "A2A response lacks '" + field + "'");
        }
        return node;
    }

    private static String text(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    private static List<Map<?, ?>> maps(Object value) {
        List<Map<?, ?>> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    result.add(map);
                }
            }
        }
        return result;
    }
}
