package com.memberly.backend.subscription;

import com.memberly.backend.subscription.payment.HttpPaymentVerifier;
import com.memberly.backend.subscription.payment.PaymentVerifier;
import com.memberly.backend.subscription.service.SubscriptionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.payment.gateway.enabled=true",
        "app.payment.gateway.base-url=http://localhost:9"
})
@ActiveProfiles("test")
class PaymentGatewayWiringGuardTest {

    @Autowired PaymentVerifier paymentVerifier;
    @Autowired SubscriptionService subscriptionService;

    @Test
    void gateway_enabled_should_wire_http_verifier_into_subscription_service() {
        assertThat(paymentVerifier).isInstanceOf(HttpPaymentVerifier.class);
        assertThat(subscriptionService).isNotNull();
    }
}
