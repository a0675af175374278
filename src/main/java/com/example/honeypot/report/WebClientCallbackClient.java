package com.example.honeypot.report;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Component
public class WebClientCallbackClient implements CallbackClient {

    private final WebClient webClient;

    @Value("${honeypot.reporting.callback-url}")
    private String callbackUrl;

    @Value("${honeypot.reporting.timeout-ms:10000}")
    private long timeoutMs;

    public WebClientCallbackClient(@Qualifier("callbackWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public int post(ReportPayload payload) {
        Integer status;
        try {
            status = webClient.post()
                    .uri(callbackUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .exchangeToMono(response -> response.releaseBody()
                            .thenReturn(response.statusCode().value()))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .block();
        } catch (RuntimeException e) {
            throw new CallbackTransportException("Callback request failed: " + e.getMessage(), e);
        }
        if (status == null) {
            throw new CallbackTransportException("Callback endpoint returned no response");
        }
        return status;
    }
}
