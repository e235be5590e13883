package com.memberly.backend.subscription.payment;

import lombok.Getter;

@Getter
public class PaymentGatewayException extends RuntimeException {

    /** HTTP status；非 HTTP 錯誤（空 body / parse fail）時為 null */
    private final Integer status;
    private final String bodySnippet;

    public PaymentGatewayException(Integer status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public PaymentGatewayException(String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.status = null;
        this.bodySnippet = bodySnippet;
    }
}
