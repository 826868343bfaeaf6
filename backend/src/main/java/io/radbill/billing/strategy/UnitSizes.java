package io.radbill.billing.strategy;

/** Labels byte block sizes for invoice descriptions. */
final class UnitSizes {

  static final long KIB = 1024L;
  static final long MIB = KIB * 1024L;
  static final long GIB = MIB * 1024L;

  private UnitSizes() {}

  static String describe(long unitSize) {
    if (unitSize == GIB) {
      return "GiB";
    }
    if (unitSize == MIB) {
      return "MiB";
    }
    if (unitSize == KIB) {
      return "KiB";
    }
    return unitSize + " B";
  }
}
