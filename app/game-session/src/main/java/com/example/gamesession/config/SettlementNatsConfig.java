/*
 * どこで: Game Session の清算用 NATS 接続
 * 何を: 清算 publish と stream 初期化が共有する Connection / JetStream を組み立てる
 * なぜ: 接続断を清算失敗の手前で観測できるよう、接続イベントをログと依存エラー指標へ流すため
 */
package com.example.gamesession.config;

import com.example.gamesession.service.GameSessionMetrics;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class SettlementNatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(SettlementNatsConfig.class);
  private static final Duration RECONNECT_WAIT = Duration.ofSeconds(1);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(
      NatsProperties properties,
      GameSessionMetrics metrics,
      @Value("${spring.application.name:game-session}") String applicationName)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName(applicationName + "-settlement")
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .maxReconnects(-1)
            .reconnectWait(RECONNECT_WAIT)
            .connectionListener(settlementConnectionListener(metrics))
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) throws IOException {
    return natsConnection.jetStream();
  }

  static ConnectionListener settlementConnectionListener(GameSessionMetrics metrics) {
    return (connection, event) -> {
      switch (event) {
        case DISCONNECTED -> {
          logger.warn("settlement nats disconnected, settlements fail until reconnected");
          metrics.recordDependencyError("nats_disconnected");
        }
        case RECONNECTED -> logger.info("settlement nats reconnected");
        case CLOSED -> logger.info("settlement nats connection closed");
        default -> logger.debug("settlement nats connection event={}", event);
      }
    };
  }
}
