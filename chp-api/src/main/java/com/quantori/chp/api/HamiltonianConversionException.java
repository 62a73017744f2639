package com.quantori.chp.api;

/**
 * A generic error thrown when a Hamiltonian cannot be converted from one representation into another.
 * <p>
 * Conversion errors are never recovered locally: a partially converted Hamiltonian silently carries
 * wrong coefficients, so the whole conversion is aborted instead.
 */
public class HamiltonianConversionException extends RuntimeException {
  /**
   * Constructs a {@code HamiltonianConversionException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public HamiltonianConversionException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code HamiltonianConversionException} as a wrapper of original error.
   *
   * @param t original error
   */
  public HamiltonianConversionException(Throwable t) {
    super(t);
  }

  /**
   * Constructs a {@code HamiltonianConversionException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public HamiltonianConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
