package com.quantori.chp.api.hamiltonian;

import com.quantori.chp.api.model.OrbitalIntegral;
import com.quantori.chp.api.model.OrbitalIntegralTermType;
import lombok.EqualsAndHashCode;

/**
 * Hamiltonian expressed as orbital integrals. System indices are the spatial orbital indices, so the
 * number of orbitals in play is {@code max(systemIndices) + 1}.
 */
@EqualsAndHashCode(callSuper = true)
public class OrbitalIntegralHamiltonian extends Hamiltonian<OrbitalIntegralTermType, OrbitalIntegral> {

  public OrbitalIntegralHamiltonian() {
    super(OrbitalIntegralTermType.class);
  }

  /**
   * Adds an orbital integral with its own coefficient.
   *
   * @param orbitalIntegral integral to add
   */
  public void addTerm(OrbitalIntegral orbitalIntegral) {
    addTerm(orbitalIntegral, orbitalIntegral.getCoefficient());
  }

  public void addIntegrals(Iterable<OrbitalIntegral> orbitalIntegrals) {
    for (OrbitalIntegral orbitalIntegral : orbitalIntegrals) {
      addTerm(orbitalIntegral);
    }
  }

  @Override
  protected void addToSystemIndices(OrbitalIntegral term) {
    for (int index : term.getOrbitalIndices()) {
      systemIndices.add(index);
    }
  }
}
