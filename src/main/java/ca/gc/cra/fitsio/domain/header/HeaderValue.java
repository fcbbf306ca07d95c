package ca.gc.cra.fitsio.domain.header;

import java.util.Objects;

/**
 * Keyword value together with its comment.
 *
 * @param value typed value
 * @param comment comment text, empty when the card has none
 * @param <T> value type
 */
public record HeaderValue<T>(T value, String comment) {

  public HeaderValue {
    Objects.requireNonNull(value, "value");
    comment = comment == null ? "" : comment;
  }
}
