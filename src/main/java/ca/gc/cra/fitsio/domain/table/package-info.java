/**
 * Table value objects: column descriptions, row ranges in both conventions and null-aware column
 * data.
 */
package ca.gc.cra.fitsio.domain.table;
