package ca.gc.cra.fitsio.application.status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fitsio.application.port.FitsioConstants;
import ca.gc.cra.fitsio.error.BoundsException;
import ca.gc.cra.fitsio.error.ColumnNotFoundException;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsCreateException;
import ca.gc.cra.fitsio.error.FitsErrorKind;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.FitsOpenException;
import ca.gc.cra.fitsio.error.FitsStatusException;
import ca.gc.cra.fitsio.error.TypeMismatchException;
import ca.gc.cra.fitsio.testutil.InMemoryFitsioNative;
import ca.gc.cra.fitsio.testutil.RecordingMetricsPort;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusTranslatorTest {
  private InMemoryFitsioNative nativeLib;
  private RecordingMetricsPort metrics;
  private StatusTranslator translator;

  @BeforeEach
  void setUp() {
    nativeLib = new InMemoryFitsioNative();
    metrics = new RecordingMetricsPort();
    translator = new StatusTranslator(nativeLib, metrics);
  }

  @Test
  void openFailureCarriesStatusTextAndDrainedMessages() {
    nativeLib.queueMessage("failed to find or open the following file: (ffopen) x.fits");
    nativeLib.queueMessage("ffopen: giving up");

    FitsException ex = translator.translate(
        FitsioConstants.FILE_NOT_OPENED, FitsOperation.OPEN, "x.fits");

    FitsOpenException open = assertInstanceOf(FitsOpenException.class, ex);
    assertEquals(FitsErrorKind.OPEN, open.kind());
    assertEquals(104, open.status());
    assertEquals(
        "open file failed for x.fits: could not open the named file (status 104)",
        open.getMessage());
    assertEquals(
        List.of("failed to find or open the following file: (ffopen) x.fits", "ffopen: giving up"),
        open.libraryMessages());
    assertEquals(0, nativeLib.pendingMessages());
    assertEquals(1, metrics.count(StatusTranslator.ERROR_COUNTER));
  }

  @Test
  void operationSelectsFileLevelExceptions() {
    assertInstanceOf(FitsCreateException.class,
        translator.translate(FitsioConstants.FILE_NOT_CREATED, FitsOperation.CREATE, "new.fits"));
    assertInstanceOf(FitsCloseException.class,
        translator.translate(FitsioConstants.BAD_FILEPTR, FitsOperation.CLOSE, "new.fits"));
  }

  @Test
  void statusSelectsDataExceptions() {
    ColumnNotFoundException missing = assertInstanceOf(ColumnNotFoundException.class,
        translator.translate(FitsioConstants.COL_NOT_FOUND, FitsOperation.COLUMN_LOOKUP, "FLUX"));
    assertEquals("FLUX", missing.column());

    assertInstanceOf(TypeMismatchException.class,
        translator.translate(FitsioConstants.BAD_BTABLE_FORMAT, FitsOperation.COLUMN_READ, "c"));
    assertInstanceOf(TypeMismatchException.class,
        translator.translate(FitsioConstants.NUM_OVERFLOW, FitsOperation.IMAGE_WRITE, "image"));
    assertInstanceOf(BoundsException.class,
        translator.translate(FitsioConstants.BAD_ROW_NUM, FitsOperation.COLUMN_READ, "c"));
    assertInstanceOf(BoundsException.class,
        translator.translate(FitsioConstants.BAD_PIX_NUM, FitsOperation.IMAGE_READ, "region"));
    assertInstanceOf(FitsStatusException.class,
        translator.translate(FitsioConstants.KEY_NO_EXIST, FitsOperation.HEADER_READ, "OBJECT"));
    assertEquals(6, metrics.count(StatusTranslator.ERROR_COUNTER));
  }

  @Test
  void unknownStatusStillTranslates() {
    FitsException ex = translator.translate(9999, FitsOperation.QUERY, "thing");

    assertInstanceOf(FitsStatusException.class, ex);
    assertEquals(9999, ex.status());
    assertTrue(ex.getMessage().contains("unknown error status"));
  }

  @Test
  void successIsNotAFailure() throws FitsException {
    translator.check(FitsioConstants.OK, FitsOperation.QUERY, "anything");

    assertTrue(translator.failure(FitsioConstants.OK, FitsOperation.QUERY, "x").isEmpty());
    assertThrows(IllegalArgumentException.class,
        () -> translator.translate(FitsioConstants.OK, FitsOperation.QUERY, "x"));
    assertEquals(0, nativeLib.callCount("errorText"));
    assertEquals(0, metrics.count(StatusTranslator.ERROR_COUNTER));
  }

  @Test
  void checkThrowsTranslatedException() {
    BoundsException ex = assertThrows(BoundsException.class,
        () -> translator.check(FitsioConstants.BAD_ELEM_NUM, FitsOperation.COLUMN_READ, "c"));
    assertEquals(FitsioConstants.BAD_ELEM_NUM, ex.status());
  }

  @Test
  void checkPresentTreatsMissingKeywordAsAbsent() throws FitsException {
    nativeLib.queueMessage("keyword not found in header: OBJECT");

    assertFalse(translator.checkPresent(
        FitsioConstants.KEY_NO_EXIST, FitsOperation.HEADER_READ, "OBJECT"));
    assertTrue(translator.checkPresent(FitsioConstants.OK, FitsOperation.HEADER_READ, "OBJECT"));
    assertEquals(0, nativeLib.pendingMessages());
    assertEquals(0, metrics.count(StatusTranslator.ERROR_COUNTER));
  }

  @Test
  void checkPresentStillFailsOnOtherStatuses() {
    assertThrows(TypeMismatchException.class, () -> translator.checkPresent(
        FitsioConstants.BAD_LOGICALKEY, FitsOperation.HEADER_READ, "SIMPLE"));
  }

  @Test
  void readOnlyFailureNeedsNoNativeCall() {
    FitsStatusException ex = translator.readOnly("column FLUX");

    assertEquals(FitsioConstants.READONLY_FILE, ex.status());
    assertTrue(ex.getMessage().contains("column FLUX"));
    assertTrue(nativeLib.calls().isEmpty());
    assertEquals(1, metrics.count(StatusTranslator.ERROR_COUNTER));
  }
}
