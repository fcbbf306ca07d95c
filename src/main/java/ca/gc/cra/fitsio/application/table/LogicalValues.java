package ca.gc.cra.fitsio.application.table;

/**
 * Marshalling of logical values: cfitsio exchanges {@code TLOGICAL} data as one {@code char} per
 * element, {@code 1} for true and {@code 0} for false.
 */
final class LogicalValues {
  private LogicalValues() {
    // Utility
  }

  static byte[] toNative(boolean[] values) {
    byte[] bytes = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      bytes[i] = values[i] ? (byte) 1 : (byte) 0;
    }
    return bytes;
  }

  static boolean[] fromNative(byte[] bytes) {
    boolean[] values = new boolean[bytes.length];
    for (int i = 0; i < bytes.length; i++) {
      values[i] = bytes[i] != 0;
    }
    return values;
  }
}
