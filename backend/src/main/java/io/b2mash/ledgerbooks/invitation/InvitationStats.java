package io.b2mash.ledgerbooks.invitation;

/**
 * Invitation counts derived from timestamps.
 *
 * @param acceptanceRate accepted as a rounded percentage of total, 0 when there are none
 */
public record InvitationStats(
    long total, long accepted, long pending, long expired, int acceptanceRate) {

  public static InvitationStats of(long total, long accepted, long pending, long expired) {
    int rate = total == 0 ? 0 : (int) Math.round(accepted * 100.0 / total);
    return new InvitationStats(total, accepted, pending, expired, rate);
  }
}
