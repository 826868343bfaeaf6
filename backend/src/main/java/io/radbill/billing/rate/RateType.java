package io.radbill.billing.rate;

/** The pricing unit a {@link Rate} expresses. Each billing strategy consumes exactly one type. */
public enum RateType {

  /** Price per connected hour, billed by the started minute. */
  HOURLY,

  /** Price per started block of {@code unitSize} bytes. */
  PER_UNIT,

  /** Ordered usage brackets, each with its own price per unit. */
  TIERED,

  /** Fixed fee per billing period. */
  FLAT
}
