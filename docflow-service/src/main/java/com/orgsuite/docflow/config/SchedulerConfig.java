package com.orgsuite.docflow.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Scheduled methods (InvitationExpiryScheduler).
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
