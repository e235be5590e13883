package com.memberly.backend.subscription.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingMemberNotifier implements MemberNotifier {

    @Override
    public void send(String message, Long memberId) {
        log.info("member notification. memberId={} message={}", memberId, message);
    }
}
