package io.b2mash.ledgerbooks.invitation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InvitationStatsTest {

  @Test
  void acceptanceRateIsRoundedPercentage() {
    assertThat(InvitationStats.of(3, 2, 1, 0).acceptanceRate()).isEqualTo(67);
    assertThat(InvitationStats.of(8, 1, 5, 2).acceptanceRate()).isEqualTo(13);
  }

  @Test
  void acceptanceRateIsZeroWithoutInvitations() {
    assertThat(InvitationStats.of(0, 0, 0, 0).acceptanceRate()).isZero();
  }
}
