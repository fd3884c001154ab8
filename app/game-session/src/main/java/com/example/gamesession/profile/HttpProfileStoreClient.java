/*
 * どこで: Game Session の外部連携
 * 何を: プロフィールサービスへ残高確認/返金/対戦履歴を HTTP で依頼する
 * なぜ: 残高と履歴の永続化を別サービスへ委ね、エンジンはポート越しに扱うため
 */
package com.example.gamesession.profile;

import com.example.gamesession.config.ProfileStoreProperties;
import com.example.gamesession.model.MatchSummary;
import com.example.gamesession.profile.dto.BalanceCheckResponse;
import com.example.gamesession.profile.dto.RefundRequest;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "profile.remote-enabled", havingValue = "true")
@RequiredArgsConstructor
public class HttpProfileStoreClient implements ProfileStore {

  private final RestClient profileRestClient;
  private final ProfileStoreProperties properties;

  @Override
  public boolean hasSufficientBalance(String account, BigDecimal amount) {
    validateAccount(account);
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("amount must not be negative");
    }
    final BalanceCheckResponse response =
        call(
            () ->
                profileRestClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path(properties.balancePath())
                                .queryParam("amount", amount.toPlainString())
                                .build(account))
                    .header(properties.internalApiHeaderName(), properties.internalApiToken())
                    .retrieve()
                    .body(BalanceCheckResponse.class));
    if (response == null || response.sufficient() == null) {
      throw new ProfileStoreException(
          ProfileStoreException.Reason.INVALID_RESPONSE, "balance response is invalid");
    }
    return response.sufficient();
  }

  @Override
  public void refund(String account, BigDecimal amount, String matchId) {
    validateAccount(account);
    call(
        () ->
            profileRestClient
                .post()
                .uri(properties.refundPath(), account)
                .header(properties.internalApiHeaderName(), properties.internalApiToken())
                .body(new RefundRequest(matchId, amount, "match_abandoned"))
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public void recordHistory(MatchSummary summary) {
    if (summary == null || summary.matchId() == null || summary.matchId().isBlank()) {
      throw new IllegalArgumentException("matchId is required");
    }
    call(
        () ->
            profileRestClient
                .post()
                .uri(properties.historyPath())
                .header(properties.internalApiHeaderName(), properties.internalApiToken())
                .body(summary)
                .retrieve()
                .toBodilessEntity());
  }

  private <T> T call(Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (ProfileStoreException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new ProfileStoreException(
          ProfileStoreException.Reason.INVALID_RESPONSE, "profile response parse failed", ex);
    }
  }

  private void validateAccount(String account) {
    if (account == null || account.isBlank()) {
      throw new IllegalArgumentException("account is required");
    }
  }

  private ProfileStoreException mapResponseException(RestClientResponseException ex) {
    if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403) {
      return new ProfileStoreException(
          ProfileStoreException.Reason.UNAUTHORIZED, "profile rejected internal auth", ex);
    }
    if (ex.getStatusCode().value() == 404) {
      return new ProfileStoreException(
          ProfileStoreException.Reason.NOT_FOUND, "profile account not found", ex);
    }
    return new ProfileStoreException(
        ProfileStoreException.Reason.BAD_GATEWAY, "profile request failed", ex);
  }

  private ProfileStoreException mapResourceException(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return new ProfileStoreException(
            ProfileStoreException.Reason.TIMEOUT, "profile request timeout", ex);
      }
      current = current.getCause();
    }
    return new ProfileStoreException(
        ProfileStoreException.Reason.BAD_GATEWAY, "profile connection failed", ex);
  }
}
