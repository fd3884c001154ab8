package com.example.gamesession.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.gamesession.config.SettlementNatsProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class NatsSettlementNotifierTest {

  private static final SettlementNatsProperties PROPERTIES =
      new SettlementNatsProperties("game.match.settled", "GAME_SETTLEMENT", Duration.ofMinutes(2));

  private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
  private JetStream jetStream;
  private NatsSettlementNotifier notifier;

  @BeforeEach
  void setUp() {
    jetStream = Mockito.mock(JetStream.class);
    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    notifier = new NatsSettlementNotifier(jetStream, PROPERTIES, objectMapper, clock);
  }

  @Test
  void publishesSettlementWithMatchIdAsMessageId() throws Exception {
    final PublishAck ack = Mockito.mock(PublishAck.class);
    when(jetStream.publish(eq("game.match.settled"), any(Headers.class), any(byte[].class)))
        .thenReturn(ack);

    final boolean accepted =
        notifier.notifyMatchSettled("match-1", "acct-w", "acct-l", new BigDecimal("0.05"));

    assertThat(accepted).isTrue();
    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("game.match.settled"), headers.capture(), payload.capture());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo("match-1");
    final JsonNode json = objectMapper.readTree(payload.getValue());
    assertThat(json.get("event_type").asText()).isEqualTo("MATCH_SETTLED");
    assertThat(json.get("match_id").asText()).isEqualTo("match-1");
    assertThat(json.get("winner_account").asText()).isEqualTo("acct-w");
    assertThat(json.get("loser_account").asText()).isEqualTo("acct-l");
    assertThat(json.get("occurred_at").asText()).isEqualTo("2026-03-01T12:00:00Z");
    assertThat(json.get("trace_id").asText()).isNotBlank();
  }

  @Test
  void duplicateAckIsStillAccepted() throws Exception {
    final PublishAck ack = Mockito.mock(PublishAck.class);
    when(ack.isDuplicate()).thenReturn(true);
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(ack);

    assertThat(notifier.notifyMatchSettled("match-1", "acct-w", "acct-l", BigDecimal.ONE))
        .isTrue();
  }

  @Test
  void missingAckIsRejected() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(null);

    assertThat(notifier.notifyMatchSettled("match-1", "acct-w", "acct-l", BigDecimal.ONE))
        .isFalse();
  }

  @Test
  void throwsWhenMatchIdMissing() {
    assertThatThrownBy(() -> notifier.notifyMatchSettled(" ", "acct-w", "acct-l", BigDecimal.ONE))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(jetStream);
  }

  @Test
  void wrapsIOException() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("boom"));

    assertThatThrownBy(
            () -> notifier.notifyMatchSettled("match-1", "acct-w", "acct-l", BigDecimal.ONE))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed to publish");
  }

  @Test
  void loggingNotifierAcceptsEverything() {
    final LoggingSettlementNotifier logging = new LoggingSettlementNotifier();

    assertThat(logging.notifyMatchSettled("match-1", "acct-w", "acct-l", BigDecimal.ONE)).isTrue();
  }
}
