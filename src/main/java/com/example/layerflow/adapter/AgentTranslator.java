package com.example.layerflow.adapter;

import com.example.layerflow.layer.AdapterTranslationException;
import com.example.layerflow.model.LayerRole;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Maps between a layer's payload and the wire format of one remote agent ecosystem.
 * Implementations throw {@link AdapterTranslationException} when a response cannot be mapped.
 */
public interface AgentTranslator {

    JsonNode toRequest(LayerRole role, Map<String, Object> payload);

    /**
     * @param request the payload that produced the call, for fields the remote agent does not echo
     */
    Map<String, Object> fromResponse(LayerRole role, Map<String, Object> request, JsonNode response);
}
