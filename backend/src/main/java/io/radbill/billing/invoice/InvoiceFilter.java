package io.radbill.billing.invoice;

import java.time.LocalDate;

/**
 * Optional criteria for listing a user's invoices. A null field matches everything.
 *
 * @param status only invoices in this status
 * @param periodFrom only invoices whose period ends on or after this date
 * @param periodTo only invoices whose period starts on or before this date
 */
public record InvoiceFilter(InvoiceStatus status, LocalDate periodFrom, LocalDate periodTo) {

  public static InvoiceFilter none() {
    return new InvoiceFilter(null, null, null);
  }

  public static InvoiceFilter byStatus(InvoiceStatus status) {
    return new InvoiceFilter(status, null, null);
  }

  public boolean matches(Invoice invoice) {
    if (status != null && invoice.getStatus() != status) {
      return false;
    }
    if (periodFrom != null && invoice.getPeriod().end().isBefore(periodFrom)) {
      return false;
    }
    return periodTo == null || !invoice.getPeriod().start().isAfter(periodTo);
  }
}
