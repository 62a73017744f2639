package com.quantori.chp.core.canonical;

import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.Optional;

/**
 * Index pattern of a one-body spin-orbital tuple {@code (p, q)}.
 */
public enum OneBodyPattern {
  /**
   * {@code p == q}, self-symmetric.
   */
  DIAGONAL {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, double coefficient) {
      return Optional.of(new WeightedTerm<>(FermionTermHermitian.of(p, q), coefficient));
    }
  },
  /**
   * {@code p < q}, carries the weight of {@code (q, p)} as well.
   */
  UPPER {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, double coefficient) {
      return Optional.of(new WeightedTerm<>(FermionTermHermitian.of(p, q), 2.0 * coefficient));
    }
  },
  /**
   * {@code p > q}, covered by {@link #UPPER}.
   */
  LOWER {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, double coefficient) {
      return Optional.empty();
    }
  };

  public static OneBodyPattern classify(int p, int q) {
    if (p == q) {
      return DIAGONAL;
    }
    return p < q ? UPPER : LOWER;
  }

  /**
   * Emits the canonical term of a tuple of this pattern.
   *
   * @param p           creation index
   * @param q           annihilation index
   * @param coefficient integral coefficient
   * @return the canonical term with its scaled coefficient, empty if the tuple is not a representative
   */
  public abstract Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, double coefficient);
}
