package io.radbill.billing.usage;

import java.util.Collection;
import java.util.Objects;

/**
 * Read-only accounting figures for one user: connected seconds and octets in each direction,
 * either for a single RADIUS session or summed over a billing period.
 *
 * @param userId the RADIUS username the usage belongs to
 * @param sessionSeconds connected time in seconds (acctsessiontime)
 * @param inputOctets octets received from the user (acctinputoctets)
 * @param outputOctets octets sent to the user (acctoutputoctets)
 * @param sessionCount number of sessions the figures cover
 */
public record UsageData(
    String userId, long sessionSeconds, long inputOctets, long outputOctets, int sessionCount) {

  public UsageData {
    Objects.requireNonNull(userId, "userId must not be null");
  }

  public static UsageData ofSession(String userId, long sessionSeconds, long totalBytes) {
    return new UsageData(userId, sessionSeconds, totalBytes, 0L, 1);
  }

  public static UsageData none(String userId) {
    return new UsageData(userId, 0L, 0L, 0L, 0);
  }

  /** Sums session figures for one user into period totals. */
  public static UsageData combine(String userId, Collection<UsageData> sessions) {
    long seconds = 0L;
    long input = 0L;
    long output = 0L;
    int count = 0;
    for (UsageData session : sessions) {
      seconds = Math.addExact(seconds, session.sessionSeconds());
      input = Math.addExact(input, session.inputOctets());
      output = Math.addExact(output, session.outputOctets());
      count += session.sessionCount();
    }
    return new UsageData(userId, seconds, input, output, count);
  }

  public long totalBytes() {
    return Math.addExact(inputOctets, outputOctets);
  }

  public boolean hasNegativeFigures() {
    return sessionSeconds < 0 || inputOctets < 0 || outputOctets < 0;
  }
}
