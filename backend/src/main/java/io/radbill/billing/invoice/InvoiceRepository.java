package io.radbill.billing.invoice;

import io.radbill.billing.money.Money;
import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  /** Statuses whose totals the user owes or has settled. */
  Collection<InvoiceStatus> BILLED_STATUSES =
      EnumSet.of(InvoiceStatus.SENT, InvoiceStatus.PARTIALLY_PAID, InvoiceStatus.PAID);

  /** Loads the invoice with a row lock, serializing concurrent mutators of the same invoice. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT i FROM Invoice i WHERE i.id = :id")
  Optional<Invoice> findByIdForUpdate(@Param("id") UUID id);

  List<Invoice> findByUserIdOrderByPeriodStartDesc(String userId);

  /** Filters are optional; see {@link InvoiceFilter}. */
  default List<Invoice> findByUser(String userId, InvoiceFilter filter) {
    return findByUserIdOrderByPeriodStartDesc(userId).stream().filter(filter::matches).toList();
  }

  /** True if the user already has an invoice for the period that has not been voided. */
  boolean existsByUserIdAndPeriodStartAndPeriodEndAndStatusNot(
      String userId, LocalDate periodStart, LocalDate periodEnd, InvoiceStatus status);

  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.status IN :statuses AND i.dueDate < :today
      ORDER BY i.dueDate ASC
      """)
  List<Invoice> findDueBefore(
      @Param("statuses") Collection<InvoiceStatus> statuses, @Param("today") LocalDate today);

  @Query(
      """
      SELECT new io.radbill.billing.invoice.CurrencyAmount(i.currency, SUM(i.totalAmount))
      FROM Invoice i
      WHERE i.userId = :userId AND i.status IN :statuses
      GROUP BY i.currency
      """)
  List<CurrencyAmount> sumTotalsByCurrency(
      @Param("userId") String userId, @Param("statuses") Collection<InvoiceStatus> statuses);

  @Query(
      """
      SELECT new io.radbill.billing.invoice.CurrencyAmount(
          p.currency, SUM(p.amount - p.refundedAmount))
      FROM Invoice i JOIN i.payments p
      WHERE i.userId = :userId
        AND i.status IN :statuses
        AND p.status = io.radbill.billing.invoice.PaymentStatus.COMPLETED
      GROUP BY p.currency
      """)
  List<CurrencyAmount> sumCompletedPaymentsByCurrency(
      @Param("userId") String userId, @Param("statuses") Collection<InvoiceStatus> statuses);

  /**
   * Outstanding balance of a user per currency: billed totals minus completed payments net of
   * refunds. Drafts and void invoices are not owed.
   */
  default Map<String, Money> calculateUserBalance(String userId) {
    Map<String, Money> balance = new TreeMap<>();
    for (CurrencyAmount total : sumTotalsByCurrency(userId, BILLED_STATUSES)) {
      balance.merge(total.currency(), Money.of(total.amount(), total.currency()), Money::add);
    }
    for (CurrencyAmount paid : sumCompletedPaymentsByCurrency(userId, BILLED_STATUSES)) {
      balance.merge(
          paid.currency(), Money.of(paid.amount().negate(), paid.currency()), Money::add);
    }
    return balance;
  }
}
