package com.memberly.backend.subscription.controller;

import com.memberly.backend.member.entity.Member;
import com.memberly.backend.member.service.MemberService;
import com.memberly.backend.subscription.dto.RenewRequest;
import com.memberly.backend.subscription.dto.RenewResponse;
import com.memberly.backend.subscription.service.SubscriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/members/{memberId}/subscription")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final MemberService memberService;

    /**
     * 付款未通過仍回 200（renewed=false）；member 不存在由 advice 轉 404。
     */
    @PostMapping("/renew")
    public RenewResponse renew(@PathVariable Long memberId, @Valid @RequestBody RenewRequest req) {
        boolean renewed = subscriptionService.renew(memberId, req.amount(), req.days());

        Member after = memberService.getMember(memberId).orElse(null);
        if (after == null) {
            return new RenewResponse(memberId, renewed, false, null);
        }
        return new RenewResponse(
                memberId,
                renewed,
                after.isActive(),
                after.getSubscriptionEnd().orElse(null)
        );
    }
}
