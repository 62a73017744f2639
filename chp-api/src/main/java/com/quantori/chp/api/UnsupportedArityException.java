package com.quantori.chp.api;

import lombok.Getter;

/**
 * Thrown when a term has a number of indices that no term type is defined for.
 */
@Getter
public class UnsupportedArityException extends HamiltonianConversionException {

  private final int arity;

  public UnsupportedArityException(int arity) {
    super(String.format("Unsupported number of indices: %d, expected 2 or 4", arity));
    this.arity = arity;
  }
}
