package com.example.gamesession.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.websocket")
public record WebSocketProperties(String path, List<String> allowedOrigins) {

  public WebSocketProperties {
    path = path == null || path.isBlank() ? "/ws/game" : path;
    allowedOrigins =
        allowedOrigins == null || allowedOrigins.isEmpty()
            ? List.of("*")
            : List.copyOf(allowedOrigins);
  }
}
