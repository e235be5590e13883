package com.memberly.backend.subscription.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MembershipExpiryProperties.class)
public class MembershipExpiryConfig {}
