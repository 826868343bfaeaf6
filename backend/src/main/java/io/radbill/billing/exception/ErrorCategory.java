package io.radbill.billing.exception;

/** Coarse classification of billing failures. */
public enum ErrorCategory {

  /** Malformed input, e.g. a negative payment amount. */
  VALIDATION,

  /** Illegal state transition, e.g. editing a sent invoice. */
  STATE,

  /** A financial invariant would be broken, e.g. overpayment or currency mixing. */
  CONSISTENCY,

  /** A referenced plan, rate or invoice does not exist. */
  NOT_FOUND,

  /** A collaborator outside the engine failed or timed out. */
  EXTERNAL
}
