package com.flagship.pawn_ledger.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables @Retryable on settle and reverse.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
