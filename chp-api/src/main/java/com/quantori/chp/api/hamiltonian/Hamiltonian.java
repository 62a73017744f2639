package com.quantori.chp.api.hamiltonian;

import com.quantori.chp.api.model.HamiltonianTerm;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import lombok.EqualsAndHashCode;

/**
 * Generic Hamiltonian: a mapping from term type to the terms of that type and their coefficients.
 * <p>
 * Keys already encode a canonical form, so adding a term that is present sums the coefficients.
 * Iteration follows insertion order within a term type, which keeps output reproducible.
 * The set of system indices is derived from the stored terms and updated whenever a term is added.
 *
 * @param <T> term type classification
 * @param <K> term class
 */
@EqualsAndHashCode
public abstract class Hamiltonian<T extends Enum<T>, K extends HamiltonianTerm<T>> {

  private final Map<T, Map<K, Double>> terms;

  protected final Set<Integer> systemIndices = new TreeSet<>();

  protected Hamiltonian(Class<T> termTypeClass) {
    this.terms = new EnumMap<>(termTypeClass);
  }

  /**
   * Adds a term to the Hamiltonian, summing its coefficient with the one already stored.
   *
   * @param term        the term
   * @param coefficient its coefficient
   */
  public void addTerm(K term, double coefficient) {
    Objects.requireNonNull(term);
    terms.computeIfAbsent(term.getTermType(), type -> new LinkedHashMap<>())
        .merge(term, coefficient, Double::sum);
    addToSystemIndices(term);
  }

  /**
   * Adds every term of a sequence, see {@link #addTerm(HamiltonianTerm, double)}.
   *
   * @param weightedTerms terms with their coefficients
   */
  public void addTerms(Iterable<WeightedTerm<K>> weightedTerms) {
    for (WeightedTerm<K> weightedTerm : weightedTerms) {
      addTerm(weightedTerm.term(), weightedTerm.coefficient());
    }
  }

  /**
   * Merges all terms of another Hamiltonian into this one and unions the system indices.
   *
   * @param other Hamiltonian to merge, not modified
   */
  public void addHamiltonian(Hamiltonian<T, K> other) {
    Objects.requireNonNull(other);
    other.terms.forEach((type, typedTerms) -> typedTerms.forEach(this::addTerm));
    systemIndices.addAll(other.systemIndices);
  }

  /**
   * Collects the system indices referenced by a term.
   *
   * @param term the term just added
   */
  protected abstract void addToSystemIndices(K term);

  public Map<T, Map<K, Double>> getTerms() {
    return Collections.unmodifiableMap(terms);
  }

  public Map<K, Double> getTerms(T termType) {
    return Collections.unmodifiableMap(terms.getOrDefault(termType, Map.of()));
  }

  public Set<Integer> getSystemIndices() {
    return Collections.unmodifiableSet(systemIndices);
  }

  public int countTerms() {
    return terms.values().stream().mapToInt(Map::size).sum();
  }

  public boolean isEmpty() {
    return countTerms() == 0;
  }

  /**
   * Computes the p-norm of all coefficients.
   *
   * @param power p, positive
   * @return {@code (sum |c|^p)^(1/p)}
   */
  public double norm(double power) {
    if (power <= 0) {
      throw new IllegalArgumentException("Norm power must be positive: " + power);
    }
    double sum = terms.values().stream()
        .flatMap(typedTerms -> typedTerms.values().stream())
        .mapToDouble(coefficient -> Math.pow(Math.abs(coefficient), power))
        .sum();
    return Math.pow(sum, 1.0 / power);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(System.lineSeparator());
    terms.forEach((type, typedTerms) -> {
      sb.append(type).append(':').append(System.lineSeparator());
      typedTerms.forEach((term, coefficient) ->
          sb.append("  ").append(term).append(" = ").append(coefficient).append(System.lineSeparator()));
    });
    return sb.toString();
  }
}
