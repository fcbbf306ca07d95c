/**
 * Value objects shared by every layer: HDU descriptions, open modes and the typed value tokens used
 * to exchange data with cfitsio.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fitsio.domain;
