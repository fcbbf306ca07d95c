/** Image value objects: pixel types, creation descriptions, axis ranges and dense arrays. */
package ca.gc.cra.fitsio.domain.image;
