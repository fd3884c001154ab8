package com.example.gamesession.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "profile.remote-enabled", havingValue = "true")
public class ProfileClientConfig {

  @Bean
  RestClient profileRestClient(RestClient.Builder builder, ProfileStoreProperties properties) {
    // profile service 呼び出し専用 RestClient。タイムアウトはロック外の呼び出し元を長く止めない値にする。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.readTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
