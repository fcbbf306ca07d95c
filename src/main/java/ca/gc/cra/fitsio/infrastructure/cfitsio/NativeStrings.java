package ca.gc.cra.fitsio.infrastructure.cfitsio;

import java.nio.charset.StandardCharsets;
import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;

/**
 * A {@code char*[]} whose entries point into one backing allocation.
 *
 * <p>The pointer table only stores raw addresses, so the backing block is held here. Callers keep the
 * instance reachable until cfitsio has returned and any output has been read back.</p>
 */
final class NativeStrings {
  private final Pointer table;
  private final Pointer data;
  private final long[] offsets;

  private NativeStrings(Pointer table, Pointer data, long[] offsets) {
    this.table = table;
    this.data = data;
    this.offsets = offsets;
  }

  /**
   * Copies NUL-terminated ASCII strings into native memory.
   *
   * @throws IllegalArgumentException when an element is {@code null}
   */
  static NativeStrings of(Runtime rt, String[] values) {
    byte[][] encoded = new byte[values.length][];
    long total = 0;
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        throw new IllegalArgumentException("string element " + i + " is null");
      }
      encoded[i] = values[i].getBytes(StandardCharsets.US_ASCII);
      total += encoded[i].length + 1L;
    }
    Pointer data = allocate(rt, total);
    long[] offsets = new long[values.length];
    long offset = 0;
    for (int i = 0; i < values.length; i++) {
      offsets[i] = offset;
      data.put(offset, encoded[i], 0, encoded[i].length);
      data.putByte(offset + encoded[i].length, (byte) 0);
      offset += encoded[i].length + 1L;
    }
    return link(rt, data, offsets);
  }

  /** Allocates {@code count} zeroed writable slots of {@code slotSize} bytes each. */
  static NativeStrings slots(Runtime rt, int count, int slotSize) {
    if (slotSize < 1) {
      throw new IllegalArgumentException("slot size must be >= 1");
    }
    Pointer data = allocate(rt, (long) count * slotSize);
    data.setMemory(0, Math.max(1L, (long) count * slotSize), (byte) 0);
    long[] offsets = new long[count];
    for (int i = 0; i < count; i++) {
      offsets[i] = (long) i * slotSize;
    }
    return link(rt, data, offsets);
  }

  private static NativeStrings link(Runtime rt, Pointer data, long[] offsets) {
    int addressSize = rt.addressSize();
    Pointer table = allocate(rt, (long) offsets.length * addressSize);
    for (int i = 0; i < offsets.length; i++) {
      table.putAddress((long) i * addressSize, data.address() + offsets[i]);
    }
    return new NativeStrings(table, data, offsets);
  }

  /** The {@code char**} to hand to cfitsio. */
  Pointer pointer() {
    return table;
  }

  int size() {
    return offsets.length;
  }

  /** Reads entry {@code index} up to its terminating NUL. */
  String get(int index) {
    return data.getString(offsets[index]);
  }

  /** Reads the first {@code length} entries into {@code target}. */
  void copyTo(String[] target, int length) {
    for (int i = 0; i < length; i++) {
      target[i] = get(i);
    }
  }

  private static Pointer allocate(Runtime rt, long bytes) {
    return Memory.allocateDirect(rt, Math.toIntExact(Math.max(1, bytes)));
  }
}
