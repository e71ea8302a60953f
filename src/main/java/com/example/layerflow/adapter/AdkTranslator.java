package com.example.layerflow.adapter;

import com.example.layerflow.layer.AdapterTranslationException;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.util.PayloadUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent development kit gateway format: one endpoint, the agent is named in the request and
 * its output is returned under {@code output} in the layer's own field names.
 */
public class AdkTranslator implements AgentTranslator {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<LayerRole, String> agentNames;

    public AdkTranslator(Map<LayerRole, String> agentNames) {
        this.agentNames = new EnumMap<>(agentNames);
    }

    @Override
    public JsonNode toRequest(LayerRole role, Map<String, Object> payload) {
        String agent = agentName(role);
        if (agent == null) {
            throw new IllegalArgumentException("No ADK agent configured for role " + role);
        }
        ObjectNode req = PayloadUtils.mapper().createObjectNode();
        req.put("agent", agent);
        req.set("input", PayloadUtils.mapper().valueToTree(payload));
        return req;
    }

    @Override
    public Map<String, Object> fromResponse(LayerRole role, Map<String, Object> request, JsonNode response) {
        JsonNode output = response == null ? null : response.get("output");
        if (output == null || !output.isObject()) {
            throw new AdapterTranslationException(role, "ADK response has no 'output' object");
        }
        return PayloadUtils.mapper().convertValue(output, MAP_TYPE);
    }

    public String agentName(LayerRole role) {
        return agentNames.get(role);
    }
}
