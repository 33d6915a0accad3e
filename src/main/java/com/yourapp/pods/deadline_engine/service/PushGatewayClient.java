package com.yourapp.pods.deadline_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands a single message for a single device to the external push gateway.
 * Delivery, retries and provider credentials belong to the gateway.
 */
@Service
public class PushGatewayClient {
    private static final Logger logger = LoggerFactory.getLogger(PushGatewayClient.class);

    private final String gatewayUrl;
    private final String apiKey;
    private final RestTemplate rest;

    public PushGatewayClient(@Value("${push.gateway-url:}") String gatewayUrl,
                             @Value("${push.api-key:}") String apiKey,
                             RestTemplate pushRestTemplate) {
        this.gatewayUrl = gatewayUrl;
        this.apiKey = apiKey;
        this.rest = pushRestTemplate;
    }

    public boolean isConfigured() {
        return gatewayUrl != null && !gatewayUrl.isBlank();
    }

    /**
     * @throws org.springframework.web.client.RestClientException when the gateway rejects or cannot be reached
     */
    public void send(String deviceToken, PushMessage message) {
        if (!isConfigured()) {
            logger.info("[push] gateway not configured, to={} title='{}' body='{}' data={}",
                abbreviate(deviceToken), message.getTitle(), message.getBody(), message.getData());
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("token", deviceToken);
        payload.put("title", message.getTitle());
        payload.put("body", message.getBody());
        payload.put("data", message.getData());

        rest.postForEntity(gatewayUrl, new HttpEntity<>(payload, headers), String.class);
        logger.debug("[push] sent '{}' to {}", message.getTitle(), abbreviate(deviceToken));
    }

    private static String abbreviate(String token) {
        if (token == null || token.length() <= 12) {
            return token;
        }
        return token.substring(0, 12) + "...";
    }
}
