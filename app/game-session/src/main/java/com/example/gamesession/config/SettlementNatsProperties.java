package com.example.gamesession.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "settlement.nats")
public record SettlementNatsProperties(String subject, String stream, Duration duplicateWindow) {}
