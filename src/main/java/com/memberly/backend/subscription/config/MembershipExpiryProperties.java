package com.memberly.backend.subscription.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.membership.expiry")
public class MembershipExpiryProperties {

    private boolean enabled = true;

    /** 預設每小時整點跑一次 */
    private String cron = "0 0 * * * *";
}
