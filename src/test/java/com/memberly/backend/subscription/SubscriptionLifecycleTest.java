package com.memberly.backend.subscription;

import com.memberly.backend.member.entity.Member;
import com.memberly.backend.member.repo.MemberRepository;
import com.memberly.backend.member.service.MemberService;
import com.memberly.backend.subscription.notify.MemberNotifier;
import com.memberly.backend.subscription.payment.PaymentVerifier;
import com.memberly.backend.subscription.service.SubscriptionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * renew → sweep 走真的 JPA store（H2），只 mock 外部付款與通知。
 */
@SpringBootTest
@ActiveProfiles("test")
class SubscriptionLifecycleTest {

    static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired SubscriptionService subscriptionService;
    @Autowired MemberService memberService;
    @Autowired MemberRepository repo;

    @MockitoBean PaymentVerifier paymentVerifier;
    @MockitoBean MemberNotifier notifier;

    @AfterEach
    void cleanUp() {
        repo.deleteAll();
    }

    @Test
    void renew_thenRead_persistsActiveAndEnd() {
        repo.saveAndFlush(new Member(1L, "Anna"));
        when(paymentVerifier.verify(eq(1L), any())).thenReturn(true);

        boolean ok = subscriptionService.renew(1L, new BigDecimal("499.99"), 30);

        assertThat(ok).isTrue();
        Member reloaded = memberService.getMember(1L).orElseThrow();
        assertThat(reloaded.isActive()).isTrue();
        assertThat(reloaded.getSubscriptionEnd()).contains(NOW.plus(30, ChronoUnit.DAYS));
        assertThat(memberService.isActive(1L)).isTrue();
        verify(notifier, times(1)).send(SubscriptionService.RENEWED_MESSAGE, 1L);
    }

    @Test
    void declinedPayment_leavesStoredMemberUntouched() {
        repo.saveAndFlush(new Member(2L, "Bo"));
        when(paymentVerifier.verify(eq(2L), any())).thenReturn(false);

        assertThat(subscriptionService.renew(2L, new BigDecimal("100"), 30)).isFalse();

        Member reloaded = repo.findById(2L).orElseThrow();
        assertThat(reloaded.isActive()).isFalse();
        assertThat(reloaded.getSubscriptionEnd()).isEmpty();
        verifyNoInteractions(notifier);
    }

    @Test
    void sweep_deactivatesOnlyLapsedMembers() {
        Member lapsed = new Member(10L, "lapsed");
        lapsed.setActive(true);
        lapsed.setSubscriptionEnd(NOW.minus(1, ChronoUnit.DAYS));

        Member current = new Member(11L, "current");
        current.setActive(true);
        current.setSubscriptionEnd(NOW.plus(10, ChronoUnit.DAYS));

        Member noEnd = new Member(12L, "noEnd");
        noEnd.setActive(true);

        repo.saveAndFlush(lapsed);
        repo.saveAndFlush(current);
        repo.saveAndFlush(noEnd);

        subscriptionService.deactivateExpired();

        assertThat(repo.findById(10L).orElseThrow().isActive()).isFalse();
        assertThat(repo.findById(11L).orElseThrow().isActive()).isTrue();
        assertThat(repo.findById(12L).orElseThrow().isActive()).isTrue();
        verify(notifier, times(1)).send(SubscriptionService.EXPIRED_MESSAGE, 10L);
        verifyNoMoreInteractions(notifier);
    }
}
