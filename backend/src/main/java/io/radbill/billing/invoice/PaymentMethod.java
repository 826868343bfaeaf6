package io.radbill.billing.invoice;

public enum PaymentMethod {
  CASH,
  CREDIT_CARD,
  DEBIT_CARD,
  BANK_TRANSFER,
  PAYPAL,
  STRIPE,
  OTHER
}
