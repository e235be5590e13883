package com.memberly.backend.member;

import com.memberly.backend.member.entity.Member;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemberTest {

    @Test
    void id_hasNoSetter() {
        assertThatThrownBy(() -> Member.class.getMethod("setId", Long.class))
                .isInstanceOf(NoSuchMethodException.class);
    }

    @Test
    void subscriptionEnd_nullReadsAsEmpty_andSetterRoundTrips() {
        Member m = new Member(1L, "Anna");
        assertThat(m.getSubscriptionEnd()).isEmpty();

        Instant end = Instant.parse("2026-04-01T00:00:00Z");
        m.setSubscriptionEnd(end);
        assertThat(m.getSubscriptionEnd()).contains(end);

        m.setSubscriptionEnd(null);
        assertThat(m.getSubscriptionEnd()).isEmpty();
    }
}
