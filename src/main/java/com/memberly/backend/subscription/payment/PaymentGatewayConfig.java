package com.memberly.backend.subscription.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@ConditionalOnProperty(prefix = "app.payment.gateway", name = "enabled", havingValue = "true")
public class PaymentGatewayConfig {

    @Bean("paymentRestClient")
    public RestClient paymentRestClient(PaymentGatewayProperties props) {
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
            throw new IllegalStateException("app.payment.gateway.base-url is required when the gateway is enabled");
        }

        HttpClient hc = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        RestClient.Builder b = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf);

        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            b = b.defaultHeader("X-Api-Key", props.getApiKey());
        }
        return b.build();
    }

    @Bean
    public PaymentVerifier httpPaymentVerifier(@Qualifier("paymentRestClient") RestClient http, ObjectMapper om) {
        return new HttpPaymentVerifier(http, om);
    }
}
