package com.scoutim.domain.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ConversationProperties.class, ReminderProperties.class})
public class DomainConfig {
}
