package io.radbill.billing.exception;

import java.util.UUID;

public class EmptyInvoiceException extends InvalidStateException {

  public EmptyInvoiceException(UUID invoiceId) {
    super("Empty invoice", "Invoice " + invoiceId + " has no items and cannot be sent");
  }
}
