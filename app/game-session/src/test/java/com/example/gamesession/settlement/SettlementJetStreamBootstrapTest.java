/*
 * どこで: 清算 JetStream 初期化テスト
 * 何を: stream 未作成時に追加され、設定不足では起動を止めることを確認する
 * なぜ: 清算イベントの重複排除ウィンドウを確実に有効化するため
 */
package com.example.gamesession.settlement;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.gamesession.config.SettlementNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SettlementJetStreamBootstrapTest {

  private static final SettlementNatsProperties PROPERTIES =
      new SettlementNatsProperties("game.match.settled", "GAME_SETTLEMENT", Duration.ofMinutes(2));

  @Mock private Connection connection;

  @Mock private JetStreamManagement jetStreamManagement;

  @Test
  void startCreatesMissingStream() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());

    new SettlementJetStreamBootstrap(connection, PROPERTIES).start();

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(jetStreamManagement).addStream(any(StreamConfiguration.class));
  }

  @Test
  void startUpdatesExistingStream() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);

    new SettlementJetStreamBootstrap(connection, PROPERTIES).start();

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(jetStreamManagement, never()).addStream(any(StreamConfiguration.class));
  }

  @Test
  void startRejectsMissingDuplicateWindow() {
    final SettlementNatsProperties invalid =
        new SettlementNatsProperties("game.match.settled", "GAME_SETTLEMENT", Duration.ZERO);

    assertThatThrownBy(() -> new SettlementJetStreamBootstrap(connection, invalid).start())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate-window");
    verifyNoInteractions(connection);
  }

  private static final class StreamNotFoundException extends JetStreamApiException {

    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
