package com.quantori.chp.api.model;

/**
 * Policy mapping spin-orbitals to a flat integer index space.
 * <p>
 * For a fixed number of orbitals an implementation must be injective and produce values in
 * {@code [0, 2 * nOrbitals)}. Range checks on the orbital index are done by the caller.
 */
public interface IndexConvention {

  /**
   * Maps a spin-orbital to its integer index.
   *
   * @param spinOrbital spin-orbital with {@code orbital < nOrbitals}
   * @param nOrbitals   total number of spatial orbitals
   * @return index in {@code [0, 2 * nOrbitals)}
   */
  int toInt(SpinOrbital spinOrbital, int nOrbitals);

  /**
   * Inverse of {@link #toInt(SpinOrbital, int)}.
   *
   * @param index     index in {@code [0, 2 * nOrbitals)}
   * @param nOrbitals total number of spatial orbitals
   * @return the spin-orbital mapped to {@code index}
   */
  SpinOrbital toSpinOrbital(int index, int nOrbitals);
}
