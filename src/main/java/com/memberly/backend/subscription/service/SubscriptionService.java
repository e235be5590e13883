package com.memberly.backend.subscription.service;

import com.memberly.backend.member.entity.Member;
import com.memberly.backend.member.exception.MemberNotFoundException;
import com.memberly.backend.member.store.MemberStore;
import com.memberly.backend.subscription.notify.MemberNotifier;
import com.memberly.backend.subscription.payment.PaymentVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 訂閱生命週期：renew（付款驗證 → 開通 → 延長到期日 → 寫入 → 通知）
 * 與 expiry sweep（掃全部 member，把過期且仍 active 的關掉）。
 *
 * <p>本身不持有可變狀態；沒有包 @Transactional，
 * 每次 {@link MemberStore#update} 自己 commit，通知一定在 commit 之後。
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class SubscriptionService {

    public static final String RENEWED_MESSAGE = "Subscription renewed!";
    public static final String EXPIRED_MESSAGE = "Membership expired";

    private final MemberStore store;
    private final PaymentVerifier paymentVerifier;
    private final MemberNotifier notifier;
    private final Clock clock;

    /**
     * @return true = 已續約；false = 付款未通過（沒有任何副作用）
     * @throws MemberNotFoundException member 不存在（在任何副作用之前）
     */
    public boolean renew(Long memberId, BigDecimal amount, int durationDays) {
        Member member = store.findById(memberId)
                .orElseThrow(() -> new MemberNotFoundException(memberId));

        if (!paymentVerifier.verify(memberId, amount)) {
            log.info("renew declined. memberId={} amount={}", memberId, amount);
            return false;
        }

        // now 只讀一次；一律從今天起算，不疊加剩餘天數
        Instant now = Instant.now(clock);
        Instant newEnd = now.plus(Duration.ofDays(durationDays));

        boolean prevActive = member.isActive();
        Instant prevEnd = member.getSubscriptionEnd().orElse(null);

        member.setActive(true);
        member.setSubscriptionEnd(newEnd);

        try {
            store.update(member);
        } catch (RuntimeException e) {
            // 寫入失敗：還原記憶體中的值，不留半套狀態
            member.setActive(prevActive);
            member.setSubscriptionEnd(prevEnd);
            throw e;
        }

        notifier.send(RENEWED_MESSAGE, memberId);

        log.info("renew done. memberId={} amount={} days={} subscriptionEnd={}", memberId, amount, durationDays, newEnd);
        return true;
    }

    /**
     * best-effort：單一 member 失敗不影響其他人；全部跑完後若有失敗才丟 {@link ExpirySweepException}。
     */
    public void deactivateExpired() {
        Instant now = Instant.now(clock);
        List<Member> members = store.findAll();

        int deactivated = 0;
        List<Long> failedIds = new ArrayList<>();
        List<RuntimeException> causes = new ArrayList<>();

        for (Member m : members) {
            if (!shouldDeactivate(m, now)) continue;

            try {
                deactivateOne(m);
                deactivated++;
            } catch (RuntimeException e) {
                log.warn("expiry sweep failed for member. memberId={}", m.getId(), e);
                failedIds.add(m.getId());
                causes.add(e);
            }
        }

        if (deactivated > 0 || !failedIds.isEmpty()) {
            log.info("expiry sweep done. scanned={} deactivated={} failed={}", members.size(), deactivated, failedIds.size());
        }

        if (!failedIds.isEmpty()) {
            throw new ExpirySweepException(failedIds, causes);
        }
    }

    private void deactivateOne(Member m) {
        m.setActive(false);
        try {
            store.update(m);
        } catch (RuntimeException e) {
            m.setActive(true);
            throw e;
        }
        notifier.send(EXPIRED_MESSAGE, m.getId());
    }

    /** 沒有到期日 → 永不過期；已經 inactive → 不重複寫/通知；end == now 算過期 */
    private static boolean shouldDeactivate(Member m, Instant now) {
        if (!m.isActive()) return false;
        return m.getSubscriptionEnd()
                .map(end -> !end.isAfter(now))
                .orElse(false);
    }
}
