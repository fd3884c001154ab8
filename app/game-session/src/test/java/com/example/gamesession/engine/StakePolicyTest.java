package com.example.gamesession.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.gamesession.model.Currency;
import com.example.gamesession.model.StakeTerms;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class StakePolicyTest {

  private final StakePolicy policy = new StakePolicy(BigDecimal.valueOf(100));

  @Test
  void pointsStakeMustMatchFixedAmount() {
    policy.requireValid(Currency.POINTS, new BigDecimal("100.00"));

    assertThatThrownBy(() -> policy.requireValid(Currency.POINTS, BigDecimal.valueOf(50)))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.INVALID_STAKE);
  }

  @Test
  void solStakeMustBePositive() {
    assertThatThrownBy(() -> policy.requireValid(Currency.SOL, BigDecimal.ZERO))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.INVALID_STAKE);
    assertThatThrownBy(() -> policy.requireValid(null, BigDecimal.ONE))
        .isInstanceOf(GameSessionException.class)
        .extracting("code")
        .isEqualTo(GameErrorCode.INVALID_STAKE);
  }

  @Test
  void pointsTermsHaveNoFee() {
    final StakeTerms terms = policy.terms(Currency.POINTS, BigDecimal.valueOf(100));

    assertThat(terms.totalPot()).isEqualByComparingTo("200");
    assertThat(terms.platformFee()).isEqualByComparingTo("0");
    assertThat(terms.winnerPayout()).isEqualByComparingTo("200");
  }

  @Test
  void solFeeRateDependsOnStakeTier() {
    assertThat(policy.terms(Currency.SOL, new BigDecimal("0.01")).platformFee())
        .isEqualByComparingTo("0.001");
    assertThat(policy.terms(Currency.SOL, new BigDecimal("0.05")).platformFee())
        .isEqualByComparingTo("0.003");
    final StakeTerms large = policy.terms(Currency.SOL, new BigDecimal("1"));
    assertThat(large.platformFee()).isEqualByComparingTo("0.04");
    assertThat(large.winnerPayout()).isEqualByComparingTo("1.96");
  }

  @Test
  void resolveMatchIdGeneratesWhenBlank() {
    final String generated = policy.resolveMatchId("  ", Currency.POINTS);

    assertThat(generated).hasSize(36);
  }

  @Test
  void resolveMatchIdKeepsGeneratedSolIdsWithinLimit() {
    final String generated = policy.resolveMatchId(null, Currency.SOL);

    assertThat(generated)
        .hasSizeLessThanOrEqualTo(StakePolicy.SOL_MATCH_ID_MAX_LENGTH)
        .doesNotContain("-");
  }

  @Test
  void resolveMatchIdCompactsLongSolIds() {
    final String requested = "123e4567-e89b-12d3-a456-426614174000-extra";

    final String resolved = policy.resolveMatchId(requested, Currency.SOL);

    assertThat(resolved).hasSize(StakePolicy.SOL_MATCH_ID_MAX_LENGTH).doesNotContain("-");
    assertThat(policy.resolveMatchId(requested, Currency.POINTS)).isEqualTo(requested);
    assertThat(policy.resolveMatchId("room-7", Currency.SOL)).isEqualTo("room-7");
  }
}
