package com.example.gamesession.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.StakeRequest;
import com.example.gamesession.profile.ProfileStore;
import com.example.gamesession.profile.ProfileStoreException;
import com.example.gamesession.service.GameSessionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BalanceCurrencyFallbackPolicyTest {

  private static final BigDecimal POINTS_STAKE = BigDecimal.valueOf(100);
  private static final BigDecimal FALLBACK_STAKE = new BigDecimal("0.01");

  private ProfileStore profileStore;
  private SimpleMeterRegistry meterRegistry;
  private BalanceGuard balanceGuard;

  @BeforeEach
  void setUp() {
    profileStore = mock(ProfileStore.class);
    meterRegistry = new SimpleMeterRegistry();
    balanceGuard = new BalanceGuard(profileStore, new GameSessionMetrics(meterRegistry));
  }

  @Test
  void keepsPointsWhenBalanceIsSufficient() {
    when(profileStore.hasSufficientBalance(eq("acct-1"), any())).thenReturn(true);
    final BalanceCurrencyFallbackPolicy policy = policy(true);

    final StakeRequest resolved =
        policy.resolve(new StakeRequest(Currency.POINTS, BigDecimal.TEN), "acct-1");

    assertThat(resolved.currency()).isEqualTo(Currency.POINTS);
    assertThat(resolved.stake()).isEqualByComparingTo(POINTS_STAKE);
  }

  @Test
  void fallsBackToSolWhenPointsAreShort() {
    when(profileStore.hasSufficientBalance(eq("acct-1"), any())).thenReturn(false);

    final StakeRequest resolved =
        policy(true).resolve(new StakeRequest(Currency.POINTS, POINTS_STAKE), "acct-1");

    assertThat(resolved.currency()).isEqualTo(Currency.SOL);
    assertThat(resolved.stake()).isEqualByComparingTo(FALLBACK_STAKE);
  }

  @Test
  void treatsProfileFailureAsInsufficientAndCountsIt() {
    when(profileStore.hasSufficientBalance(eq("acct-1"), any()))
        .thenThrow(
            new ProfileStoreException(ProfileStoreException.Reason.TIMEOUT, "timeout", null));

    final StakeRequest resolved =
        policy(true).resolve(new StakeRequest(Currency.POINTS, POINTS_STAKE), "acct-1");

    assertThat(resolved.currency()).isEqualTo(Currency.SOL);
    assertThat(
            meterRegistry
                .get("game.dependency.error.total")
                .tag("type", "balance_check")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void rejectsWhenFallbackDisabled() {
    when(profileStore.hasSufficientBalance(eq("acct-1"), any())).thenReturn(false);

    assertThatThrownBy(
            () -> policy(false).resolve(new StakeRequest(Currency.POINTS, POINTS_STAKE), "acct-1"))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.INSUFFICIENT_BALANCE);
  }

  @Test
  void skipsBalanceCheckForSolAndAnonymousPlayers() {
    final StakeRequest sol = new StakeRequest(Currency.SOL, new BigDecimal("0.5"));

    assertThat(policy(true).resolve(sol, "acct-1")).isSameAs(sol);

    final StakeRequest anonymous =
        policy(true).resolve(new StakeRequest(Currency.POINTS, POINTS_STAKE), null);

    assertThat(anonymous.currency()).isEqualTo(Currency.POINTS);
    verifyNoInteractions(profileStore);
  }

  private BalanceCurrencyFallbackPolicy policy(boolean fallbackEnabled) {
    return new BalanceCurrencyFallbackPolicy(
        balanceGuard, POINTS_STAKE, FALLBACK_STAKE, fallbackEnabled);
  }
}
