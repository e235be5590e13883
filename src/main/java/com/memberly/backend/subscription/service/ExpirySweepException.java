package com.memberly.backend.subscription.service;

import lombok.Getter;

import java.util.List;

/**
 * sweep 全部跑完後，若有 member 處理失敗才丟；各別原因放在 suppressed。
 */
@Getter
public class ExpirySweepException extends RuntimeException {

    private final List<Long> failedMemberIds;

    public ExpirySweepException(List<Long> failedMemberIds, List<? extends Exception> causes) {
        super("EXPIRY_SWEEP_PARTIAL_FAILURE failed=" + failedMemberIds.size() + " memberIds=" + failedMemberIds);
        this.failedMemberIds = List.copyOf(failedMemberIds);
        for (Exception c : causes) {
            addSuppressed(c);
        }
    }
}
