package com.memberly.backend.subscription.worker;

import com.memberly.backend.subscription.config.MembershipExpiryProperties;
import com.memberly.backend.subscription.service.ExpirySweepException;
import com.memberly.backend.subscription.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.membership.expiry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MembershipExpiryWorker {

    private final MembershipExpiryProperties props;
    private final SubscriptionService subscriptionService;

    @Scheduled(cron = "${app.membership.expiry.cron:0 0 * * * *}")
    public void runOnce() {
        if (!props.isEnabled()) return;

        try {
            subscriptionService.deactivateExpired();
        } catch (ExpirySweepException e) {
            // 失敗的 member 仍是 active，下一輪會再撿到
            log.warn("membership expiry sweep finished with failures. memberIds={}", e.getFailedMemberIds(), e);
        }
    }
}
