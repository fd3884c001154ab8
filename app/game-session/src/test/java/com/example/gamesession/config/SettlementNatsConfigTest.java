package com.example.gamesession.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.gamesession.service.GameSessionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ConnectionListener.Events;
import org.junit.jupiter.api.Test;

class SettlementNatsConfigTest {

  @Test
  void disconnectIsCountedAsDependencyError() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ConnectionListener listener =
        SettlementNatsConfig.settlementConnectionListener(new GameSessionMetrics(registry));
    final Connection connection = mock(Connection.class);

    listener.connectionEvent(connection, Events.DISCONNECTED);
    listener.connectionEvent(connection, Events.RECONNECTED);
    listener.connectionEvent(connection, Events.DISCONNECTED);

    assertThat(
            registry
                .get("game.dependency.error.total")
                .tag("type", "nats_disconnected")
                .counter()
                .count())
        .isEqualTo(2.0);
  }

  @Test
  void otherEventsAreOnlyLogged() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ConnectionListener listener =
        SettlementNatsConfig.settlementConnectionListener(new GameSessionMetrics(registry));

    listener.connectionEvent(mock(Connection.class), Events.CONNECTED);
    listener.connectionEvent(mock(Connection.class), Events.CLOSED);

    assertThat(registry.find("game.dependency.error.total").counters()).isEmpty();
  }
}
