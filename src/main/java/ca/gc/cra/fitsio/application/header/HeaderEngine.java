package ca.gc.cra.fitsio.application.header;

import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.status.FitsOperation;
import ca.gc.cra.fitsio.domain.header.HeaderValue;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed access to header keywords of the current HDU.
 *
 * <p>Reads use {@code ffgkys}, {@code ffgkyjj}, {@code ffgkyd} and {@code ffgkyl}; writes update the
 * keyword in place or append it. A {@code null} comment on write keeps the existing comment.</p>
 *
 * @since 0.1.0
 */
public final class HeaderEngine {
  /** Significant digits for double keywords; negative selects cfitsio's G format. */
  static final int DOUBLE_DECIMALS = -15;

  private final NativeHandle handle;

  public HeaderEngine(NativeHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /**
   * Reads a keyword that must exist.
   *
   * @param keyword keyword name
   * @param type expected value type
   * @param <T> value type
   * @return value
   * @throws FitsException {@code FitsStatusException} when the keyword is missing or has another type
   */
  public <T> T read(String keyword, KeyType<T> type) throws FitsException {
    return readWithComment(keyword, type).value();
  }

  public <T> HeaderValue<T> readWithComment(String keyword, KeyType<T> type) throws FitsException {
    String key = Strings.requireKeyword(keyword);
    RawKey raw = fetch(key, type);
    handle.translator().check(raw.status(), FitsOperation.HEADER_READ, key);
    return new HeaderValue<>(type.cast(raw.value()), raw.comment());
  }

  /**
   * Reads a keyword that may be absent.
   *
   * @param keyword keyword name
   * @param type expected value type
   * @param <T> value type
   * @return value, empty when the keyword does not exist
   * @throws FitsException for failures other than absence
   */
  public <T> Optional<T> readOptional(String keyword, KeyType<T> type) throws FitsException {
    String key = Strings.requireKeyword(keyword);
    RawKey raw = fetch(key, type);
    if (!handle.translator().checkPresent(raw.status(), FitsOperation.HEADER_READ, key)) {
      return Optional.empty();
    }
    return Optional.of(type.cast(raw.value()));
  }

  /**
   * Updates or appends a keyword.
   *
   * @param keyword keyword name
   * @param type value type
   * @param value new value
   * @param comment comment, or {@code null} to keep the existing one
   * @param <T> value type
   * @throws FitsException when the handle is read-only or cfitsio rejects the write
   */
  public <T> void write(String keyword, KeyType<T> type, T value, String comment)
      throws FitsException {
    String key = Strings.requireKeyword(keyword);
    Objects.requireNonNull(value, "value");
    handle.requireWritable("keyword " + key);
    FitsioNative lib = handle.nativeLib();
    long fptr = handle.pointer();
    int status = switch (type.kind()) {
      case STRING -> lib.updateKeyString(fptr, key, (String) value, comment);
      case LONG -> lib.updateKeyLong(fptr, key, (Long) value, comment);
      case DOUBLE -> lib.updateKeyDouble(fptr, key, (Double) value, DOUBLE_DECIMALS, comment);
      case LOGICAL -> lib.updateKeyLogical(fptr, key, (Boolean) value, comment);
    };
    handle.translator().check(status, FitsOperation.HEADER_WRITE, key);
  }

  private RawKey fetch(String key, KeyType<?> type) {
    FitsioNative lib = handle.nativeLib();
    long fptr = handle.pointer();
    String[] comment = new String[1];
    return switch (type.kind()) {
      case STRING -> {
        String[] out = new String[1];
        int status = lib.readKeyString(fptr, key, out, comment);
        yield new RawKey(status, out[0], comment[0]);
      }
      case LONG -> {
        long[] out = new long[1];
        int status = lib.readKeyLong(fptr, key, out, comment);
        yield new RawKey(status, out[0], comment[0]);
      }
      case DOUBLE -> {
        double[] out = new double[1];
        int status = lib.readKeyDouble(fptr, key, out, comment);
        yield new RawKey(status, out[0], comment[0]);
      }
      case LOGICAL -> {
        int[] out = new int[1];
        int status = lib.readKeyLogical(fptr, key, out, comment);
        yield new RawKey(status, out[0] != 0, comment[0]);
      }
    };
  }

  private record RawKey(int status, Object value, String comment) {}
}
