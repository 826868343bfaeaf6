package io.radbill.billing.invoice;

import io.radbill.billing.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/** An inclusive date range an invoice charges for. */
@Embeddable
public record BillingPeriod(
    @Column(name = "period_start", nullable = false) LocalDate start,
    @Column(name = "period_end", nullable = false) LocalDate end) {

  public BillingPeriod {
    Objects.requireNonNull(start, "start must not be null");
    Objects.requireNonNull(end, "end must not be null");
    if (end.isBefore(start)) {
      throw new ValidationException(
          "Invalid billing period", "Period end " + end + " is before start " + start);
    }
  }

  public static BillingPeriod ofMonth(YearMonth month) {
    return new BillingPeriod(month.atDay(1), month.atEndOfMonth());
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
