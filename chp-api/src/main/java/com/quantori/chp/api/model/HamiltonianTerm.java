package com.quantori.chp.api.model;

/**
 * A term that can be stored in a Hamiltonian. Each term classifies itself.
 *
 * @param <T> term type classification
 */
public interface HamiltonianTerm<T extends Enum<T>> {

  T getTermType();
}
