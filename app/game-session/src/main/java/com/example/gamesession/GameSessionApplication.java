/*
 * どこで: Game Session アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: WebSocket + 参照 API + 掃除 Worker + 外部接続設定を単一アプリとして起動するため
 */
package com.example.gamesession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class GameSessionApplication {

  public static void main(String[] args) {
    SpringApplication.run(GameSessionApplication.class, args);
  }
}
