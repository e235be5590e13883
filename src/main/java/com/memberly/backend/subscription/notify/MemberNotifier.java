package com.memberly.backend.subscription.notify;

public interface MemberNotifier {

    /** fire-and-forget：送出或排入佇列即可，不保證送達 */
    void send(String message, Long memberId);
}
