package com.quantori.chp.api;

import lombok.Getter;

/**
 * Thrown when an orbital or spin-orbital index does not fit the number of orbitals of a system.
 */
@Getter
public class OrbitalIndexOutOfRangeException extends HamiltonianConversionException {

  private final int index;
  private final int nOrbitals;

  public OrbitalIndexOutOfRangeException(String message, int index, int nOrbitals) {
    super(String.format("%s: index %d, number of orbitals %d", message, index, nOrbitals));
    this.index = index;
    this.nOrbitals = nOrbitals;
  }
}
