package com.example.layerflow.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.layerflow.factcheck.FactCheckContracts;
import com.example.layerflow.layer.AdapterTranslationException;
import com.example.layerflow.layer.ContractViolationException;
import com.example.layerflow.layer.StageFailureException;
import com.example.layerflow.layer.StageFailureReason;
import com.example.layerflow.model.LayerRole;
import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

class RemoteAgentLayerTest {

    private static final String ENDPOINT = "http://agents.local/auditor";
    private static final Map<String, Object> REQUEST = Map.of("question", "Capital of France?", "answer", "Paris.");

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> {
            ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            return Mono.just(body == null ? response.build() : response.body(body).build());
        };
    }

    private static RemoteAgentLayer auditor(ExchangeFunction exchange, AgentTranslator translator) {
        return new RemoteAgentLayer("remote-auditor", FactCheckContracts.auditor(30),
                WebClient.builder().exchangeFunction(exchange).build(), ENDPOINT, translator,
                Set.of("claim_extraction"));
    }

    @Test
    void translatesSuccessfulResponse() {
        AtomicReference<URI> called = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            called.set(request.url());
            return respond(HttpStatus.OK, "{\"claims\": [{\"text\": \"Paris is the capital.\"}]}").exchange(request);
        };

        Map<String, Object> out = auditor(exchange, new A2aTranslator()).process(REQUEST).block();

        assertThat(called.get()).isEqualTo(URI.create(ENDPOINT));
        assertThat(out).containsEntry("claim_count", 1).containsEntry("answer", "Paris.");
        assertThat((List<?>) out.get("claims")).hasSize(1);
    }

    @Test
    void connectionFailureIsRemoteUnreachable() {
        ExchangeFunction refused = request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST, request.url(), new HttpHeaders()));

        assertThatThrownBy(() -> auditor(refused, new A2aTranslator()).process(REQUEST).block())
                .isInstanceOf(StageFailureException.class)
                .satisfies(ex -> assertThat(((StageFailureException) ex).getFailureReason())
                        .isEqualTo(StageFailureReason.REMOTE_UNREACHABLE));
    }

    @Test
    void errorStatusIsRemoteUnreachable() {
        assertThatThrownBy(() -> auditor(respond(HttpStatus.SERVICE_UNAVAILABLE, "{}"), new A2aTranslator())
                .process(REQUEST).block())
                .isInstanceOf(StageFailureException.class)
                .hasMessageContaining("503")
                .satisfies(ex -> assertThat(((StageFailureException) ex).reason()).isEqualTo("remote_unreachable"));
    }

    @Test
    void emptyBodyIsTranslationFailure() {
        assertThatThrownBy(() -> auditor(respond(HttpStatus.OK, null), new A2aTranslator()).process(REQUEST).block())
                .isInstanceOf(AdapterTranslationException.class)
                .satisfies(ex -> assertThat(((StageFailureException) ex).reason()).isEqualTo("translation_failed"));
    }

    @Test
    void malformedBodyIsTranslationFailure() {
        assertThatThrownBy(() -> auditor(respond(HttpStatus.OK, "not json at all"), new A2aTranslator())
                .process(REQUEST).block())
                .isInstanceOf(AdapterTranslationException.class);
    }

    @Test
    void responseOutsideOutputSchemaIsTranslationFailure() {
        AdkTranslator adk = new AdkTranslator(Map.of(LayerRole.LEADING, "fact_check_auditor"));

        assertThatThrownBy(() -> auditor(respond(HttpStatus.OK, "{\"output\": {\"claims\": []}}"), adk)
                .process(REQUEST).block())
                .isInstanceOf(AdapterTranslationException.class)
                .hasMessageContaining("output schema");
    }

    @Test
    void leadingRemoteLayerChecksTheRawRequest() {
        RemoteAgentLayer layer = auditor(respond(HttpStatus.OK, "{\"claims\": []}"), new A2aTranslator());

        assertThatThrownBy(() -> layer.process(Map.of("question", "q", "answer", "")).block())
                .isInstanceOf(ContractViolationException.class);
    }

    @Test
    void terminalRemoteLayerCannotEmit() {
        RemoteAgentLayer reviser = new RemoteAgentLayer("remote-reviser", FactCheckContracts.reviser(30),
                WebClient.builder().exchangeFunction(respond(HttpStatus.OK, "{}")).build(),
                "http://agents.local/reviser", new A2aTranslator(), Set.of("text_revision"));

        assertThatThrownBy(() -> reviser.emitOutput(LayerRole.TERMINAL, Map.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
