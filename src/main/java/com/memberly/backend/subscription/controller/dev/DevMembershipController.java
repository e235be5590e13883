package com.memberly.backend.subscription.controller.dev;

import com.memberly.backend.subscription.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Profile({"dev", "local"})
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/dev/memberships")
public class DevMembershipController {

    private final SubscriptionService subscriptionService;

    /** 手動觸發一次 expiry sweep（不用等 cron） */
    @PostMapping("/expire-sweep")
    public Map<String, Object> expireSweep() {
        subscriptionService.deactivateExpired();
        return Map.of("ok", true);
    }
}
