package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.domain.ValueType;
import ca.gc.cra.fitsio.domain.header.KeyType;
import ca.gc.cra.fitsio.domain.image.AxisRange;
import ca.gc.cra.fitsio.domain.table.ColumnData;
import ca.gc.cra.fitsio.domain.table.RowRange;
import ca.gc.cra.fitsio.error.FitsCloseException;
import ca.gc.cra.fitsio.error.FitsException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> A {@link FitsFile} shared between threads.
 * <p><strong>Why:</strong> A file's current HDU is shared state, so a move and the read that follows it
 * must not interleave with another thread's calls.</p>
 * <p><strong>Thread-safety:</strong> Every call holds one {@link ReentrantLock} for its whole duration,
 * so at most one operation on the file is in flight. This does not make a non-reentrant cfitsio safe
 * for concurrent use of different files.</p>
 * <p>Obtain the single instance per file from {@link FitsFile#threadsafe()}.</p>
 *
 * @since 0.1.0
 */
public final class ThreadsafeFitsFile implements AutoCloseable {
  private final FitsFile file;
  private final ReentrantLock lock = new ReentrantLock();

  ThreadsafeFitsFile(FitsFile file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  /**
   * Runs {@code work} with exclusive access to the file.
   *
   * @param work callback; must not let the file escape to other threads
   * @param <T> result type
   * @return the callback's result
   * @throws FitsException whatever the callback throws
   */
  public <T> T execute(FitsFunction<T> work) throws FitsException {
    Objects.requireNonNull(work, "work");
    lock.lock();
    try {
      return work.apply(file);
    } finally {
      lock.unlock();
    }
  }

  public void run(FitsAction work) throws FitsException {
    Objects.requireNonNull(work, "work");
    execute(f -> {
      work.run(f);
      return null;
    });
  }

  public int numHdus() throws FitsException {
    return execute(FitsFile::numHdus);
  }

  public <A> ColumnData<A> readColumn(int hduIndex, String name, ValueType<A> type, RowRange rows)
      throws FitsException {
    return execute(f -> f.hdu(hduIndex).readColumn(name, type, rows));
  }

  public <A> A readColumnValues(int hduIndex, String name, ValueType<A> type, RowRange rows)
      throws FitsException {
    return execute(f -> f.hdu(hduIndex).readColumnValues(name, type, rows));
  }

  public <A> A readImage(int hduIndex, ValueType<A> type) throws FitsException {
    return execute(f -> f.hdu(hduIndex).readImage(type));
  }

  public <A> A readRegion(int hduIndex, ValueType<A> type, List<AxisRange> ranges)
      throws FitsException {
    return execute(f -> f.hdu(hduIndex).readRegion(type, ranges));
  }

  public <T> T readKey(int hduIndex, String keyword, KeyType<T> type) throws FitsException {
    return execute(f -> f.hdu(hduIndex).readKey(keyword, type));
  }

  @Override
  public void close() throws FitsCloseException {
    lock.lock();
    try {
      file.close();
    } finally {
      lock.unlock();
    }
  }
}
