package com.quantori.chp.api.model;

import java.util.Objects;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;

/**
 * A spatial orbital paired with a spin label.
 */
public record SpinOrbital(@PositiveOrZero int orbital, @NotNull Spin spin) {

  public SpinOrbital {
    Objects.requireNonNull(spin);
    if (orbital < 0) {
      throw new IllegalArgumentException("Orbital index must be non-negative: " + orbital);
    }
  }

  /**
   * Maps this spin-orbital to an integer with the given convention.
   *
   * @param convention index convention
   * @param nOrbitals  total number of spatial orbitals
   * @return spin-orbital index
   */
  public int toInt(IndexConvention convention, int nOrbitals) {
    return convention.toInt(this, nOrbitals);
  }

  @Override
  public String toString() {
    return "(" + orbital + ", " + spin + ")";
  }
}
