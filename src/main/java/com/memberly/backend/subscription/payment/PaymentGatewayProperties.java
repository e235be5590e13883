package com.memberly.backend.subscription.payment;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.payment.gateway")
public class PaymentGatewayProperties {

    /** false 時改用 fallback verifier（全部拒絕） */
    private boolean enabled = false;

    private String baseUrl;

    /** 送在 X-Api-Key header */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(5);
}
