/*
 * どこで: Game Session NATS 初期化
 * 何を: 清算イベント用 JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.example.gamesession.settlement;

import com.example.gamesession.config.SettlementNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SettlementJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(SettlementJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final SettlementNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.subject())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "settlement stream ensured stream={} subject={} duplicateWindow={}",
          properties.stream(),
          properties.subject(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure settlement stream", ex);
    }
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private void ensureSettings() {
    if (properties.subject() == null || properties.subject().isBlank()) {
      throw new IllegalStateException("settlement.nats.subject must be set");
    }
    if (properties.stream() == null || properties.stream().isBlank()) {
      throw new IllegalStateException("settlement.nats.stream must be set");
    }
    if (properties.duplicateWindow() == null
        || properties.duplicateWindow().isZero()
        || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("settlement.nats.duplicate-window must be positive");
    }
  }
}
