package io.radbill.billing.exception;

import java.util.UUID;

/** Thrown when items or tax are changed on an invoice that has left DRAFT. */
public class InvoiceNotEditableException extends InvalidStateException {

  public InvoiceNotEditableException(UUID invoiceId, Object status) {
    super(
        "Invoice not editable",
        "Invoice " + invoiceId + " is " + status + "; only DRAFT invoices can be edited");
  }
}
