package com.quantori.chp.core.serialization;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a fermion Hamiltonian: term type label to its terms.
 */
public record FermionHamiltonianDocument(List<Integer> systemIndices, Map<String, List<TermDocument>> terms) {

  /**
   * One canonical term: raising indices followed by lowering indices.
   */
  public record TermDocument(List<Integer> indices, double coefficient) {
  }
}
