package com.memberly.backend.subscription.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST {base-url}/v1/payments/verify
 * request : {"memberId":1,"amount":499.99}
 * response: {"authorized":true}
 */
@Slf4j
public class HttpPaymentVerifier implements PaymentVerifier {

    static final String VERIFY_PATH = "/v1/payments/verify";

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    private final RestClient http;
    private final ObjectMapper om;

    public HttpPaymentVerifier(RestClient http, ObjectMapper om) {
        this.http = http;
        this.om = om;
    }

    @Override
    public boolean verify(Long memberId, BigDecimal amount) {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("memberId", memberId);
        req.put("amount", amount);

        String body = http.post()
                .uri(VERIFY_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                // ✅ 4xx/5xx 一律往上丟，不可以默默變成「拒絕付款」
                .onStatus(HttpStatusCode::isError, (request, res) -> {
                    int status = res.getStatusCode().value();
                    throw new PaymentGatewayException(
                            status,
                            "PAYMENT_GATEWAY_HTTP_" + status,
                            readBodySnippetQuietly(res, MAX_ERROR_SNIPPET_BYTES)
                    );
                })
                .body(String.class);

        if (body == null || body.isBlank()) {
            throw new PaymentGatewayException(
                    "PAYMENT_GATEWAY_EMPTY_BODY",
                    null,
                    null
            );
        }

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            throw new PaymentGatewayException("PAYMENT_GATEWAY_JSON_PARSE_FAILED", shrink(body, 300), e);
        }

        JsonNode authorized = root.get("authorized");
        if (authorized == null || !authorized.isBoolean()) {
            throw new PaymentGatewayException("PAYMENT_GATEWAY_MISSING_AUTHORIZED", shrink(body, 300), null);
        }

        log.debug("payment verify. memberId={} amount={} authorized={}", memberId, amount, authorized.booleanValue());
        return authorized.booleanValue();
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res, int maxBytes) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(Math.max(0, maxBytes));
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.debug("payment gateway error body unreadable", e);
            return null;
        }
    }

    private static String shrink(String s, int maxChars) {
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= maxChars) return t;
        return t.substring(0, maxChars) + "...";
    }
}
