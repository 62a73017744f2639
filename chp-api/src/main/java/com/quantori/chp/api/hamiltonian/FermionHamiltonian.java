package com.quantori.chp.api.hamiltonian;

import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.FermionTermType;
import java.util.Collection;
import java.util.Objects;
import lombok.EqualsAndHashCode;

/**
 * Hamiltonian expressed as Hermitian fermion terms over spin-orbitals.
 */
@EqualsAndHashCode(callSuper = true)
public class FermionHamiltonian extends Hamiltonian<FermionTermType, FermionTermHermitian> {

  public FermionHamiltonian() {
    super(FermionTermType.class);
  }

  /**
   * Adds a term, folding the sign picked up by its canonical reordering into the coefficient.
   */
  @Override
  public void addTerm(FermionTermHermitian term, double coefficient) {
    Objects.requireNonNull(term);
    super.addTerm(term.withUnitSign(), term.getSign() * coefficient);
  }

  /**
   * Replaces the system indices, e.g. with every spin-orbital of the system whether or not it
   * appears in a term.
   *
   * @param indices spin-orbital indices
   */
  public void setSystemIndices(Collection<Integer> indices) {
    Objects.requireNonNull(indices);
    systemIndices.clear();
    systemIndices.addAll(indices);
  }

  @Override
  protected void addToSystemIndices(FermionTermHermitian term) {
    for (int index : term.getIndices()) {
      systemIndices.add(index);
    }
  }
}
