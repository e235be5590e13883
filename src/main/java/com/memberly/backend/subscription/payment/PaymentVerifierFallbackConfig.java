package com.memberly.backend.subscription.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(PaymentGatewayProperties.class)
public class PaymentVerifierFallbackConfig {

    /**
     * gateway 沒開時的預設：全部拒絕（renew 一律回 false，不會誤開通）。
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.payment.gateway", name = "enabled", havingValue = "false", matchIfMissing = true)
    public PaymentVerifier declineAllPaymentVerifier() {
        log.warn("payment gateway disabled (app.payment.gateway.enabled=false). every renewal will be declined.");
        return (memberId, amount) -> false;
    }
}
