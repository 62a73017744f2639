package com.quantori.chp.api.model;

import com.quantori.chp.api.UnsupportedArityException;
import java.util.Arrays;
import java.util.Objects;
import lombok.Getter;

/**
 * One- or two-electron integral over spatial orbitals.
 * <p>
 * Immutable. Equality is defined on the orbital indices only: the coefficient of an integral stored
 * in an {@link com.quantori.chp.api.hamiltonian.OrbitalIntegralHamiltonian} is owned by the
 * Hamiltonian, so two integrals with the same indices describe the same term.
 */
public final class OrbitalIntegral implements HamiltonianTerm<OrbitalIntegralTermType> {

  private final int[] orbitalIndices;

  @Getter
  private final double coefficient;

  /**
   * Creates an orbital integral.
   *
   * @param orbitalIndices non-negative orbital indices, copied
   * @param coefficient    value of the integral
   */
  public OrbitalIntegral(int[] orbitalIndices, double coefficient) {
    Objects.requireNonNull(orbitalIndices);
    for (int index : orbitalIndices) {
      if (index < 0) {
        throw new IllegalArgumentException("Orbital indices must be non-negative: " + Arrays.toString(orbitalIndices));
      }
    }
    this.orbitalIndices = orbitalIndices.clone();
    this.coefficient = coefficient;
  }

  public static OrbitalIntegral of(double coefficient, int... orbitalIndices) {
    return new OrbitalIntegral(orbitalIndices, coefficient);
  }

  /**
   * Returns a copy of this integral carrying another coefficient.
   *
   * @param newCoefficient the coefficient of the copy
   * @return an integral over the same orbitals
   */
  public OrbitalIntegral withCoefficient(double newCoefficient) {
    return new OrbitalIntegral(orbitalIndices, newCoefficient);
  }

  public int[] getOrbitalIndices() {
    return orbitalIndices.clone();
  }

  public int getArity() {
    return orbitalIndices.length;
  }

  /**
   * Classifies this integral by its number of indices.
   *
   * @return {@link OrbitalIntegralTermType#ONE_BODY} for two indices, {@link OrbitalIntegralTermType#TWO_BODY} for four
   * @throws UnsupportedArityException for any other number of indices
   */
  @Override
  public OrbitalIntegralTermType getTermType() {
    return switch (orbitalIndices.length) {
      case 2 -> OrbitalIntegralTermType.ONE_BODY;
      case 4 -> OrbitalIntegralTermType.TWO_BODY;
      default -> throw new UnsupportedArityException(orbitalIndices.length);
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OrbitalIntegral that)) {
      return false;
    }
    return Arrays.equals(orbitalIndices, that.orbitalIndices);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(orbitalIndices);
  }

  @Override
  public String toString() {
    return "OrbitalIntegral(" + Arrays.toString(orbitalIndices) + ", " + coefficient + ")";
  }
}
