package io.radbill.billing.usage;

import io.radbill.billing.invoice.BillingPeriod;
import java.sql.Date;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Reads usage from the RADIUS accounting table ({@code radacct}). A session belongs to the period
 * in which it started. Open sessions report the figures accounted so far.
 */
@Repository
public class RadacctUsageDataProvider implements UsageDataProvider {

  private final JdbcClient jdbc;

  public RadacctUsageDataProvider(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public List<UsageData> findUsage(String userId, BillingPeriod period) {
    return jdbc.sql(
            """
            SELECT username,
                   COALESCE(acctsessiontime, 0) AS session_seconds,
                   COALESCE(acctinputoctets, 0) AS input_octets,
                   COALESCE(acctoutputoctets, 0) AS output_octets
            FROM radacct
            WHERE username = ?
              AND acctstarttime >= ?
              AND acctstarttime < ?
            ORDER BY acctstarttime
            """)
        .params(userId, Date.valueOf(period.start()), Date.valueOf(period.end().plusDays(1)))
        .query(
            (rs, rowNum) ->
                new UsageData(
                    rs.getString("username"),
                    rs.getLong("session_seconds"),
                    rs.getLong("input_octets"),
                    rs.getLong("output_octets"),
                    1))
        .list();
  }
}
