package com.memberly.backend.subscription.payment;

import java.math.BigDecimal;

public interface PaymentVerifier {

    /**
     * 這筆金額是否已經為這個 member 授權。
     * - 不得修改 member
     * - gateway 本身出錯要丟例外，不可以當成 false
     */
    boolean verify(Long memberId, BigDecimal amount);
}
