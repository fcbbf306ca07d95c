package ca.gc.cra.fitsio.infrastructure.cfitsio;

import java.nio.file.Path;
import jnr.ffi.LibraryLoader;
import jnr.ffi.Pointer;
import jnr.ffi.annotations.LongLong;
import jnr.ffi.byref.IntByReference;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;

/**
 * JNR-FFI bindings for the subset of cfitsio used by the access layer.
 *
 * <p>Methods map directly to the exported {@code ff*} symbols behind cfitsio's {@code fits_*} macros.
 * {@code LONGLONG} arguments are annotated {@link LongLong}; C {@code long*} corner arrays are passed as
 * raw memory sized with the runtime's native long. Every status argument is in/out and must start at
 * zero. Not thread-safe unless cfitsio was built reentrant.</p>
 *
 * @since 0.1.0
 */
public interface LibCfitsio {

  /**
   * Loads the shared library.
   *
   * @param libraryName library name without prefix or suffix, e.g. {@code cfitsio}
   * @param searchPath optional extra directory to search; may be {@code null}
   * @return bound library
   * @throws UnsatisfiedLinkError when the library cannot be found
   */
  static LibCfitsio load(String libraryName, Path searchPath) {
    LibraryLoader<LibCfitsio> loader = LibraryLoader.create(LibCfitsio.class);
    if (searchPath != null) {
      loader.search(searchPath.toString());
    }
    return loader.failImmediately().load(libraryName);
  }

  int ffopen(PointerByReference fptr, String filename, int iomode, IntByReference status);

  int ffinit(PointerByReference fptr, String filename, IntByReference status);

  int ffclos(Pointer fptr, IntByReference status);

  int ffflmd(Pointer fptr, IntByReference filemode, IntByReference status);

  int ffflnm(Pointer fptr, Pointer filename, IntByReference status);

  int ffthdu(Pointer fptr, IntByReference nhdu, IntByReference status);

  /** Returns the current HDU number; no status argument. */
  int ffghdn(Pointer fptr, IntByReference chdunum);

  int ffmahd(Pointer fptr, int hdunum, IntByReference exttype, IntByReference status);

  int ffmrhd(Pointer fptr, int hdumov, IntByReference exttype, IntByReference status);

  int ffmnhd(Pointer fptr, int exttype, String hduname, int hduvers, IntByReference status);

  int ffghdt(Pointer fptr, IntByReference exttype, IntByReference status);

  int ffdhdu(Pointer fptr, IntByReference hdutype, IntByReference status);

  int ffcopy(Pointer infptr, Pointer outfptr, int morekeys, IntByReference status);

  int ffgiet(Pointer fptr, IntByReference imgtype, IntByReference status);

  int ffgidm(Pointer fptr, IntByReference naxis, IntByReference status);

  /** {@code naxes} is a {@code LONGLONG[nlen]} buffer. */
  int ffgiszll(Pointer fptr, int nlen, Pointer naxes, IntByReference status);

  int ffcrimll(Pointer fptr, int bitpix, int naxis, Pointer naxes, IntByReference status);

  int ffrsimll(Pointer fptr, int bitpix, int naxis, Pointer naxes, IntByReference status);

  int ffgpv(
      Pointer fptr,
      int datatype,
      @LongLong long firstelem,
      @LongLong long nelem,
      Pointer nulval,
      Pointer array,
      IntByReference anynul,
      IntByReference status);

  /** {@code blc}, {@code trc} and {@code inc} are C {@code long[naxis]} buffers. */
  int ffgsv(
      Pointer fptr,
      int datatype,
      Pointer blc,
      Pointer trc,
      Pointer inc,
      Pointer nulval,
      Pointer array,
      IntByReference anynul,
      IntByReference status);

  int ffppr(
      Pointer fptr,
      int datatype,
      @LongLong long firstelem,
      @LongLong long nelem,
      Pointer array,
      IntByReference status);

  int ffpss(
      Pointer fptr, int datatype, Pointer fpixel, Pointer lpixel, Pointer array,
      IntByReference status);

  /** {@code ttype}, {@code tform} and {@code tunit} are {@code char*[tfields]} buffers. */
  int ffcrtb(
      Pointer fptr,
      int tbltype,
      @LongLong long naxis2,
      int tfields,
      Pointer ttype,
      Pointer tform,
      Pointer tunit,
      String extname,
      IntByReference status);

  int ffgnrwll(Pointer fptr, LongLongByReference nrows, IntByReference status);

  int ffgncl(Pointer fptr, IntByReference ncols, IntByReference status);

  int ffgcno(
      Pointer fptr, int casesen, String templt, IntByReference colnum, IntByReference status);

  int ffgtclll(
      Pointer fptr,
      int colnum,
      IntByReference typecode,
      LongLongByReference repeat,
      LongLongByReference width,
      IntByReference status);

  int ffgcdw(Pointer fptr, int colnum, IntByReference width, IntByReference status);

  int ffgcf(
      Pointer fptr,
      int datatype,
      int colnum,
      @LongLong long firstrow,
      @LongLong long firstelem,
      @LongLong long nelem,
      Pointer array,
      Pointer nullarray,
      IntByReference anynul,
      IntByReference status);

  int ffpcl(
      Pointer fptr,
      int datatype,
      int colnum,
      @LongLong long firstrow,
      @LongLong long firstelem,
      @LongLong long nelem,
      Pointer array,
      IntByReference status);

  int ffpclu(
      Pointer fptr,
      int colnum,
      @LongLong long firstrow,
      @LongLong long firstelem,
      @LongLong long nelem,
      IntByReference status);

  int fficol(Pointer fptr, int numcol, String ttype, String tform, IntByReference status);

  int ffdcol(Pointer fptr, int numcol, IntByReference status);

  int ffirow(Pointer fptr, @LongLong long firstrow, @LongLong long nrows, IntByReference status);

  int ffdrow(Pointer fptr, @LongLong long firstrow, @LongLong long nrows, IntByReference status);

  int ffgkys(Pointer fptr, String keyname, Pointer value, Pointer comm, IntByReference status);

  int ffgkyjj(
      Pointer fptr, String keyname, LongLongByReference value, Pointer comm, IntByReference status);

  int ffgkyd(Pointer fptr, String keyname, Pointer value, Pointer comm, IntByReference status);

  int ffgkyl(
      Pointer fptr, String keyname, IntByReference value, Pointer comm, IntByReference status);

  int ffukys(Pointer fptr, String keyname, String value, String comm, IntByReference status);

  int ffukyjj(
      Pointer fptr, String keyname, @LongLong long value, String comm, IntByReference status);

  int ffukyd(
      Pointer fptr, String keyname, double value, int decim, String comm, IntByReference status);

  int ffukyl(Pointer fptr, String keyname, int value, String comm, IntByReference status);

  void ffgerr(int status, Pointer errtext);

  /** Pops the oldest message into {@code errmsg}; returns 0 when the stack is empty. */
  int ffgmsg(Pointer errmsg);

  void ffcmsg();

  float ffvers(Pointer version);

  int fits_is_reentrant();
}
