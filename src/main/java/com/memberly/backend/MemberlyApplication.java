package com.memberly.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class MemberlyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemberlyApplication.class, args);
    }

    /**
     * ✅ 測試環境不要啟動排程
     * 避免 expiry sweep 在測試資料還沒準備好時就先跑
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
    }
}
