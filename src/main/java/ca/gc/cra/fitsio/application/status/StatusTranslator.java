package ca.gc.cra.fitsio.application.status;

import static ca.gc.cra.fitsio.application.port.FitsioConstants.BAD_DIMEN;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.BAD_ELEM_NUM;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.BAD_PIX_NUM;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.BAD_ROW_NUM;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.COL_NOT_FOUND;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.KEY_NO_EXIST;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.OK;
import static ca.gc.cra.fitsio.application.port.FitsioConstants.READONLY_FILE;

import ca.gc.cra.fitsio.application.port.FitsioNative;
import ca.gc.cra.fitsio.application.port.MetricsPort;
import ca.gc.cra.fitsio.error.BoundsException;
import ca.gc.cra.fitsio.error.ColumnNotFoundException;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsCreateException;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.FitsOpenException;
import ca.gc.cra.fitsio.error.FitsStatusException;
import ca.gc.cra.fitsio.error.TypeMismatchException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns cfitsio status codes into typed {@link FitsException}s.
 * <p><strong>Why:</strong> The only place in the code base that interprets status values; every other
 * call site hands the status of a native call to {@link #check(int, FitsOperation, String)}.</p>
 * <p><strong>Role:</strong> Application service shared by the file handle and the engines.</p>
 * <p><strong>Behavior:</strong> On failure the translator reads the {@code ffgerr} text for the code and
 * drains the {@code ffgmsg} stack so the next failure does not report stale messages. The exception type
 * comes from the operation first (open, create, close) and then from the status family: conversion
 * failures (309-312, 401-412) become {@link TypeMismatchException}, row/element/pixel failures become
 * {@link BoundsException}, a missing column becomes {@link ColumnNotFoundException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected ports; the message stack is
 * per-thread in a reentrant cfitsio build.</p>
 * <p><strong>Observability:</strong> Increments {@code fitsio.status.errors} and logs at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class StatusTranslator {
  private static final Logger log = LoggerFactory.getLogger(StatusTranslator.class);
  static final String ERROR_COUNTER = "fitsio.status.errors";

  private final FitsioNative nativeLib;
  private final MetricsPort metrics;

  public StatusTranslator(FitsioNative nativeLib, MetricsPort metrics) {
    this.nativeLib = Objects.requireNonNull(nativeLib, "nativeLib");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns normally for status {@code 0}; otherwise throws the translated exception.
   *
   * @param status status returned by a native call
   * @param operation operation context
   * @param target what the operation acted on (path, HDU, column name)
   * @throws FitsException translated failure
   */
  public void check(int status, FitsOperation operation, String target) throws FitsException {
    if (status == OK) {
      return;
    }
    throw translate(status, operation, target);
  }

  /**
   * Returns the translated failure instead of throwing it, for callers that must undo work first.
   *
   * @param status status returned by a native call
   * @param operation operation context
   * @param target what the operation acted on
   * @return translated failure, empty for status {@code 0}
   */
  public Optional<FitsException> failure(int status, FitsOperation operation, String target) {
    return status == OK ? Optional.empty() : Optional.of(translate(status, operation, target));
  }

  /**
   * Checks the status of {@code ffclos}.
   *
   * @param status close status
   * @param target file description
   * @throws FitsCloseException when the close failed
   */
  public void checkClose(int status, String target) throws FitsCloseException {
    if (status != OK) {
      throw (FitsCloseException) translate(status, FitsOperation.CLOSE, target);
    }
  }

  /**
   * Like {@link #check(int, FitsOperation, String)} but treats a missing keyword as absence.
   *
   * @param status status returned by a keyword read
   * @param operation operation context
   * @param target keyword name
   * @return {@code true} when the keyword was read, {@code false} when it does not exist
   * @throws FitsException for any other failure
   */
  public boolean checkPresent(int status, FitsOperation operation, String target)
      throws FitsException {
    if (status == KEY_NO_EXIST) {
      nativeLib.clearMessages();
      return false;
    }
    check(status, operation, target);
    return true;
  }

  /**
   * Builds the exception for a non-zero status.
   *
   * @param status non-zero status
   * @param operation operation context
   * @param target what the operation acted on
   * @return translated exception, never {@code null}
   */
  public FitsException translate(int status, FitsOperation operation, String target) {
    if (status == OK) {
      throw new IllegalArgumentException("status 0 is not a failure");
    }
    String text = nativeLib.errorText(status);
    List<String> messages = nativeLib.drainMessages();
    metrics.increment(ERROR_COUNTER);
    String message = operation.label() + " failed for " + target + ": " + text + " (status " + status
        + ")";
    log.debug("{}; library messages {}", message, messages);
    return switch (operation) {
      case OPEN -> new FitsOpenException(message, status, messages);
      case CREATE -> new FitsCreateException(message, status, messages);
      case CLOSE -> new FitsCloseException(message, status, messages);
      default -> byStatus(status, target, message, messages);
    };
  }

  /**
   * Failure for a write attempted on a read-only handle, raised before any native call.
   *
   * @param target what the write would have modified
   * @return exception carrying status {@code READONLY_FILE}
   */
  public FitsStatusException readOnly(String target) {
    metrics.increment(ERROR_COUNTER);
    return new FitsStatusException(
        "cannot modify " + target + ": file is open read-only", READONLY_FILE, List.of());
  }

  private static FitsException byStatus(
      int status, String target, String message, List<String> messages) {
    if (status == COL_NOT_FOUND) {
      return new ColumnNotFoundException(target, status, messages);
    }
    if (isConversionFailure(status)) {
      return new TypeMismatchException(message, status, messages);
    }
    if (isRangeFailure(status)) {
      return new BoundsException(message, status, messages);
    }
    return new FitsStatusException(message, status, messages);
  }

  static boolean isConversionFailure(int status) {
    return (status >= 309 && status <= 312) || (status >= 401 && status <= 412);
  }

  static boolean isRangeFailure(int status) {
    return status == BAD_ROW_NUM
        || status == BAD_ELEM_NUM
        || status == BAD_DIMEN
        || status == BAD_PIX_NUM;
  }
}
