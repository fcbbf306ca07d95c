package ca.gc.cra.fitsio.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fitsio.application.file.NativeHandle;
import ca.gc.cra.fitsio.application.port.FitsioConstants;
import ca.gc.cra.fitsio.domain.FileOpenMode;
import ca.gc.cra.fitsio.domain.HduType;
import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.image.ImageDescription;
import ca.gc.cra.fitsio.domain.image.ImageType;
import ca.gc.cra.fitsio.domain.table.RowRange;
import ca.gc.cra.fitsio.error.BoundsException;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsCreateException;
import ca.gc.cra.fitsio.error.FitsErrorKind;
import ca.gc.cra.fitsio.error.FitsException;
import ca.gc.cra.fitsio.error.FitsOpenException;
import ca.gc.cra.fitsio.error.FitsStatusException;
import ca.gc.cra.fitsio.testutil.InMemoryFitsioNative;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class FitsFileTest {
  @TempDir
  Path dir;

  private InMemoryFitsioNative nativeLib;
  private Fitsio fitsio;

  @BeforeEach
  void setUp() {
    nativeLib = new InMemoryFitsioNative();
    fitsio = Fitsio.using(nativeLib);
  }

  @Test
  void openingMissingPathFailsBeforeNativeCall() {
    FitsOpenException ex = assertThrows(FitsOpenException.class,
        () -> fitsio.open(dir.resolve("missing.fits")));

    assertEquals(FitsErrorKind.OPEN, ex.kind());
    assertFalse(ex.hasStatus());
    assertEquals(0, nativeLib.callCount("openFile"));
  }

  @Test
  void openingNonFitsFileReportsLibraryStatus() throws Exception {
    Path notes = Files.writeString(dir.resolve("notes.txt"), "not a FITS file");

    FitsOpenException ex = assertThrows(FitsOpenException.class, () -> fitsio.open(notes));

    assertEquals(FitsioConstants.FILE_NOT_OPENED, ex.status());
    assertEquals(1, ex.libraryMessages().size());
    assertTrue(ex.libraryMessages().get(0).contains(notes.toString()));
  }

  @Test
  void fooScenarioReadsBackWrittenColumn() throws FitsException {
    Path path = FitsFixtures.fooFile(fitsio, dir);

    try (FitsFile file = fitsio.open(path)) {
      FitsHdu foo = file.hdu("FOO");
      int[] values = foo.readColumnValues("B", ValueType.INT, RowRange.of(0, 20));

      assertEquals(1, foo.index());
      assertEquals(HduType.BINARY_TABLE, foo.type());
      assertArrayEquals(FitsFixtures.sequence(20), values);
    }
  }

  @Test
  void twoHandlesOnOneFileCloseIndependently() throws FitsException {
    Path path = FitsFixtures.fooFile(fitsio, dir);
    FitsFile first = fitsio.open(path);
    FitsFile second = fitsio.open(path);

    assertNotEquals(first.rawPointerUnsafe(), second.rawPointerUnsafe());
    first.close();

    assertTrue(first.isClosed());
    assertFalse(second.isClosed());
    assertEquals(2, second.numHdus());
    second.close();

    assertEquals(0, nativeLib.openHandleCount());
    try (FitsFile again = fitsio.open(path)) {
      assertEquals(2, again.numHdus());
    }
  }

  @Test
  void closeIsIdempotent() throws FitsException {
    FitsFile file = fitsio.create(dir.resolve("a.fits"), false);

    file.close();
    file.close();

    assertEquals(1, nativeLib.callCount("closeFile"));
  }

  @Test
  void closedFileRejectsFurtherUse() throws FitsException {
    FitsFile file = fitsio.create(dir.resolve("a.fits"), false);
    file.close();

    assertThrows(IllegalStateException.class, file::numHdus);
    assertThrows(IllegalStateException.class, file::rawPointerUnsafe);
  }

  @Test
  void closeFailureIsReportedOnce() throws FitsException {
    FitsFile file = fitsio.create(dir.resolve("a.fits"), false);
    nativeLib.failNext("closeFile", FitsioConstants.BAD_FILEPTR);

    FitsCloseException ex = assertThrows(FitsCloseException.class, file::close);

    assertEquals(FitsioConstants.BAD_FILEPTR, ex.status());
    assertTrue(file.isClosed());
    file.close();
    assertEquals(1, nativeLib.callCount("closeFile"));
  }

  @Test
  void createRefusesExistingFileWithoutOverwrite() throws Exception {
    Path path = Files.writeString(dir.resolve("old.fits"), "keep me");

    FitsCreateException ex = assertThrows(FitsCreateException.class,
        () -> fitsio.create(path, false));

    assertEquals(FitsioConstants.FILE_NOT_CREATED, ex.status());
    assertEquals("keep me", Files.readString(path));
    assertEquals(0, nativeLib.openHandleCount());
  }

  @Test
  void createWithOverwriteReplacesExistingFile() throws Exception {
    Path path = Files.writeString(dir.resolve("old.fits"), "replace me");

    try (FitsFile file = fitsio.create(path, true)) {
      assertEquals(1, file.numHdus());
      assertEquals(HduType.IMAGE, file.primaryHdu().type());
    }

    assertTrue(nativeLib.hasFile(path));
    assertNotEquals("replace me", Files.readString(path));
  }

  @Test
  void failedPrimaryCreationClosesTheNewHandle() {
    nativeLib.failNext("createImage", FitsioConstants.BAD_NAXIS);

    FitsStatusException ex = assertThrows(FitsStatusException.class,
        () -> fitsio.create(dir.resolve("broken.fits")).open());

    assertEquals(FitsioConstants.BAD_NAXIS, ex.status());
    assertEquals(0, nativeLib.openHandleCount());
    assertEquals(1, nativeLib.callCount("closeFile"));
  }

  @Test
  void primaryImageDescriptionShapesPrimaryHdu() throws FitsException {
    try (FitsFile file = fitsio.create(dir.resolve("img.fits"))
        .withPrimaryImage(ImageDescription.of(ImageType.FLOAT, 20, 100))
        .open()) {
      FitsHdu primary = file.primaryHdu();

      assertEquals(List.of(20L, 100L), primary.dimensions());
      assertEquals(ImageType.FLOAT, primary.pixelType());
    }
  }

  @Test
  void rawPointerIsAdoptedAndClosedByWrapper() throws FitsException {
    Path path = FitsFixtures.fooFile(fitsio, dir);
    long[] fptr = new long[1];
    assertEquals(FitsioConstants.OK,
        nativeLib.openFile(fptr, path.toString(), FitsioConstants.READONLY));

    FitsFile raw = fitsio.fromRaw(fptr[0], FileOpenMode.READ_ONLY);

    assertEquals(Optional.empty(), raw.path());
    assertEquals(fptr[0], raw.rawPointerUnsafe());
    assertEquals(2, raw.numHdus());
    raw.close();
    assertTrue(nativeLib.isClosed(fptr[0]));
    assertThrows(IllegalArgumentException.class,
        () -> fitsio.fromRaw(0L, FileOpenMode.READ_ONLY));
  }

  @Test
  void reportsFileNameAndMode() throws FitsException {
    Path path = FitsFixtures.fooFile(fitsio, dir);

    try (FitsFile edit = fitsio.edit(path); FitsFile read = fitsio.open(path)) {
      assertEquals(FileOpenMode.READ_WRITE, edit.openMode());
      assertEquals(FileOpenMode.READ_ONLY, read.openMode());
      assertEquals(path.toString(), read.filename());
      assertEquals(Optional.of(path), read.path());
      assertEquals(4.04f, read.libraryVersion());
    }
  }

  @Test
  void hduIndexIsBoundsChecked() throws FitsException {
    try (FitsFile file = fitsio.create(dir.resolve("a.fits"), false)) {
      BoundsException past = assertThrows(BoundsException.class, () -> file.hdu(1));
      BoundsException negative = assertThrows(BoundsException.class, () -> file.hdu(-1));

      assertEquals(BoundsException.Bound.END, past.bound());
      assertEquals(1, past.limit());
      assertEquals(BoundsException.Bound.START, negative.bound());
      assertEquals(0, nativeLib.callCount("moveAbsolute"));
    }
  }

  @Test
  void prettyPrintListsEveryHdu() throws Exception {
    Path path = FitsFixtures.fooFile(fitsio, dir);
    StringBuilder out = new StringBuilder();

    try (FitsFile file = fitsio.open(path)) {
      file.prettyPrint(out);
    }

    assertEquals(
        "file: " + path + " (2 HDUs)\n"
            + "  0 IMAGE - SHORT [100, 100]\n"
            + "  1 BINARY_TABLE FOO 20 rows [B:1J]\n",
        out.toString());
  }

  @Test
  void openAndCloseAreLoggedAtInfo() throws FitsException {
    Path path = FitsFixtures.fooFile(fitsio, dir);
    Logger logger = (Logger) LoggerFactory.getLogger(NativeHandle.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      fitsio.open(path).close();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(2, events.size());
    assertEquals(Level.INFO, events.get(0).getLevel());
    assertEquals("Opened FITS file " + path + " (READ_ONLY)", events.get(0).getFormattedMessage());
    assertEquals("Closed FITS file " + path, events.get(1).getFormattedMessage());
  }
}
