package com.memberly.backend.subscription.dto;

import java.time.Instant;

public record RenewResponse(
        Long memberId,
        boolean renewed,
        boolean active,
        Instant subscriptionEnd
) {}
