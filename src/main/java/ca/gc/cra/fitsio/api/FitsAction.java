package ca.gc.cra.fitsio.api;

import ca.gc.cra.fitsio.error.FitsException;

/**
 * Result-less variant of {@link FitsFunction}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FitsAction {
  void run(FitsFile file) throws FitsException;
}
