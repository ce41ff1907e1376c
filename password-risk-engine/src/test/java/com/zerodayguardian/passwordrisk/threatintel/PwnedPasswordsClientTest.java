package com.zerodayguardian.passwordrisk.threatintel;

import com.zerodayguardian.passwordrisk.config.PasswordAnalyzerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PwnedPasswordsClientTest {

    @Test
    void shouldRequestRangeByPrefix() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .baseUrl("https://range.example.test")
                .defaultHeader(HttpHeaders.USER_AGENT, "test-agent")
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                            .body("0018A45C4D1DEF81644B54AB7F969B88D65:1\r\n")
                            .build());
                })
                .build();

        String body = new PwnedPasswordsClient(webClient).fetchRange("5BAA6").block();

        assertEquals("0018A45C4D1DEF81644B54AB7F969B88D65:1\r\n", body);
        assertEquals(HttpMethod.GET, captured.get().method());
        assertEquals("/range/5BAA6", captured.get().url().getPath());
        assertNull(captured.get().url().getQuery());
        assertEquals("test-agent", captured.get().headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void nonSuccessStatusShouldSignalError() {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://range.example.test")
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build()))
                .build();

        StepVerifier.create(new PwnedPasswordsClient(webClient).fetchRange("5BAA6"))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    @Test
    void configuredClientShouldSendPaddingAndUserAgentHeaders() {
        PasswordAnalyzerConfig config = new PasswordAnalyzerConfig();
        config.getOnline().setBaseUrl("https://range.example.test");

        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = PwnedPasswordsClient.buildWebClient(config.getOnline()).mutate()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK).body("A:1").build());
                })
                .build();

        new PwnedPasswordsClient(webClient).fetchRange("ABCDE").block();

        assertEquals("range.example.test", captured.get().url().getHost());
        assertEquals("true", captured.get().headers().getFirst("Add-Padding"));
        assertEquals(config.getOnline().getUserAgent(), captured.get().headers().getFirst(HttpHeaders.USER_AGENT));
    }
}
