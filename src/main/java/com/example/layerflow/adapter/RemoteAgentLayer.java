package com.example.layerflow.adapter;

import com.example.layerflow.buffer.DirectionBuffer;
import com.example.layerflow.layer.AbstractLayer;
import com.example.layerflow.layer.AdapterTranslationException;
import com.example.layerflow.layer.StageFailureException;
import com.example.layerflow.layer.StageFailureReason;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.model.ValidationRecord;
import com.example.layerflow.validation.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * A layer whose work is done by a remote agent over HTTP. The role is a constructor argument,
 * so one class covers all three positions; role-specific behaviour (request checking for the
 * leading role, no emission for the terminal role) is applied accordingly.
 */
@Slf4j
public class RemoteAgentLayer extends AbstractLayer {

    private final WebClient webClient;
    private final String endpoint;
    private final AgentTranslator translator;
    private final Set<String> capabilities;

    public RemoteAgentLayer(String name,
                            LayerExpectation expectation,
                            WebClient webClient,
                            String endpoint,
                            AgentTranslator translator,
                            Set<String> capabilities) {
        super(name, expectation);
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.capabilities = Set.copyOf(capabilities);
    }

    public String endpoint() {
        return endpoint;
    }

    @Override
    protected Set<String> capabilities() {
        return capabilities;
    }

    @Override
    protected boolean requiresBoundInput() {
        return role() != LayerRole.LEADING;
    }

    @Override
    protected Map<String, Object> beforeProcess(Map<String, Object> input) {
        return role() == LayerRole.LEADING ? checkRequest(input) : input;
    }

    @Override
    protected Mono<Map<String, Object>> doProcess(Map<String, Object> input) {
        JsonNode request = translator.toRequest(role(), input);
        log.debug("[{}] POST {}", name(), endpoint);
        return webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientResponseException.class, ex -> new StageFailureException(role(),
                        StageFailureReason.REMOTE_UNREACHABLE,
                        name() + " agent at " + endpoint + " answered " + ex.getStatusCode().value(), ex))
                .onErrorMap(WebClientRequestException.class, ex -> new StageFailureException(role(),
                        StageFailureReason.REMOTE_UNREACHABLE,
                        name() + " agent at " + endpoint + " is unreachable: " + ex.getMessage(), ex))
                .onErrorMap(DecodingException.class, ex -> new AdapterTranslationException(role(),
                        name() + " agent returned a body that is not JSON", ex))
                .switchIfEmpty(Mono.error(() -> new AdapterTranslationException(role(),
                        name() + " agent returned an empty body")))
                .map(response -> translate(input, response));
    }

    private Map<String, Object> translate(Map<String, Object> input, JsonNode response) {
        Map<String, Object> output = translator.fromResponse(role(), input, response);
        ValidationRecord check = SchemaValidator.checkOutput(expectation().getOutputSchema(), output);
        if (!check.isPassed()) {
            throw new AdapterTranslationException(role(),
                    name() + " response does not fit the output schema: " + check.getDetail());
        }
        return output;
    }

    @Override
    public DirectionBuffer emitOutput(LayerRole targetRole, Map<String, Object> data) {
        if (role() == LayerRole.TERMINAL) {
            throw new IllegalStateException("terminal layer " + name() + " has no successor to emit to");
        }
        return super.emitOutput(targetRole, data);
    }
}
