/*
 * どこで: Game Session の受信口設定
 * 何を: WebSocket エンドポイントの登録と、参照 API への MDC インターセプタ適用をまとめて行う
 * なぜ: ゲーム操作は WebSocket、状態参照は /v1 の REST と入口が二つあり、どちらの設定もここで見渡せるようにするため
 */
package com.example.gamesession.config;

import com.example.gamesession.ws.GameWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer, WebSocketConfigurer {

  static final String REST_PATH_PATTERN = "/v1/**";

  private final GameWebSocketHandler gameWebSocketHandler;
  private final WebSocketProperties webSocketProperties;
  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(gameWebSocketHandler, webSocketProperties.path())
        .setAllowedOriginPatterns(webSocketProperties.allowedOrigins().toArray(String[]::new));
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // WebSocket の MDC はメッセージ単位でハンドラが設定する
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(REST_PATH_PATTERN);
  }
}
