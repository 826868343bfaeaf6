package io.radbill.billing.invoice;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates document numbers.
 *
 * <ul>
 *   <li>Invoice numbers are sequential and gap-free ("INV-0001", "INV-0002", ...), drawn from a
 *       counter row that is lazily created. The counter update joins the caller's transaction, so
 *       a rollback also reverts the number.
 *   <li>Payment and refund numbers combine a timestamp with a random suffix
 *       ("PAY-20240131120000-3FA9", "REF-20240131120000-77C2").
 *   <li>Voided invoices keep their number permanently.
 * </ul>
 */
@Service
public class InvoiceNumberService {

  private static final String INVOICE_COUNTER = "invoice";
  private static final DateTimeFormatter DOCUMENT_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

  @PersistenceContext private EntityManager entityManager;

  private final Clock clock;

  public InvoiceNumberService(Clock clock) {
    this.clock = clock;
  }

  /**
   * Assigns the next sequential invoice number.
   *
   * <p>Uses an atomic INSERT ... ON CONFLICT DO UPDATE ... RETURNING; two concurrent calls
   * serialize on the counter row.
   */
  @Transactional
  public String assignNumber() {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO invoice_counters (id, counter_name, next_number)"
                    + " VALUES (gen_random_uuid(), :counterName, 2)"
                    + " ON CONFLICT (counter_name)"
                    + " DO UPDATE SET next_number = invoice_counters.next_number + 1"
                    + " RETURNING next_number - 1")
            .setParameter("counterName", INVOICE_COUNTER)
            .getSingleResult();

    int number = ((Number) result).intValue();
    return String.format("INV-%04d", number);
  }

  public String newPaymentNumber() {
    return timestampedNumber("PAY");
  }

  public String newRefundNumber() {
    return timestampedNumber("REF");
  }

  private String timestampedNumber(String prefix) {
    String timestamp = LocalDateTime.now(clock).format(DOCUMENT_TIMESTAMP);
    String suffix = UUID.randomUUID().toString().substring(0, 4).toUpperCase(Locale.ROOT);
    return prefix + "-" + timestamp + "-" + suffix;
  }
}
