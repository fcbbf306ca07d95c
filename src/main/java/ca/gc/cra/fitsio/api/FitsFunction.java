package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.error.FitsException;

/**
 * Work run against a file while {@link ThreadsafeFitsFile} holds its lock.
 *
 * @param <T> result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface FitsFunction<T> {
  T apply(FitsFile file) throws FitsException;
}
