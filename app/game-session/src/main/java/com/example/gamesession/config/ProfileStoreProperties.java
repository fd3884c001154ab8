package com.example.gamesession.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile")
public record ProfileStoreProperties(
    boolean remoteEnabled,
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String balancePath,
    String refundPath,
    String historyPath,
    Duration readTimeout) {

  public ProfileStoreProperties {
    baseUrl = baseUrl == null ? "http://profile:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    balancePath =
        balancePath == null || balancePath.isBlank()
            ? "/accounts/{account}/balance-check"
            : balancePath;
    refundPath =
        refundPath == null || refundPath.isBlank() ? "/accounts/{account}/refunds" : refundPath;
    historyPath = historyPath == null || historyPath.isBlank() ? "/match-history" : historyPath;
    readTimeout = readTimeout == null ? Duration.ofSeconds(2) : readTimeout;
  }
}
