package com.memberly.backend.subscription.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/** 金額與天數只檢查「有帶」，值本身交給 payment gateway 判斷 */
public record RenewRequest(
        @NotNull BigDecimal amount,
        @NotNull Integer days
) {}
