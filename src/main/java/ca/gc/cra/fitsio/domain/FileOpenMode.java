package ca.gc.cra.fitsio.domain;

/** Access mode of an open FITS file. Created files are always {@link #READ_WRITE}. */
public enum FileOpenMode {
  READ_ONLY,
  READ_WRITE;

  public boolean isWritable() {
    return this == READ_WRITE;
  }
}
