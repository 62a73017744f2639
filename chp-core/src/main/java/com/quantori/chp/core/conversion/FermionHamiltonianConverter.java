package com.quantori.chp.core.conversion;

import com.quantori.chp.api.hamiltonian.FermionHamiltonian;
import com.quantori.chp.api.hamiltonian.OrbitalIntegralHamiltonian;

/**
 * Converts an orbital integral Hamiltonian into a Hermitian fermion Hamiltonian.
 * <p>
 * Implementations never modify the source. Any malformed integral aborts the conversion with a
 * {@link com.quantori.chp.api.HamiltonianConversionException}, and no partially converted result
 * is returned.
 */
public interface FermionHamiltonianConverter {

  /**
   * Converts every integral of the source.
   *
   * @param source orbital integral Hamiltonian
   * @return a new fermion Hamiltonian whose system indices span {@code [0, 2 * nOrbitals)}
   */
  FermionHamiltonian toFermionHamiltonian(OrbitalIntegralHamiltonian source);
}
