package com.quantori.chp.core.canonical;

import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.Optional;

/**
 * Index-equality pattern of a two-body spin-orbital tuple {@code (p, q, r, s)}, standing for the
 * product {@code a+(p) a+(q) a(r) a(s)}.
 * <p>
 * Only the lower-triangular representative of each symmetry orbit is emitted. Factors of 2 account
 * for the mirrored tuples that are suppressed; every exchange of two operators flips the sign.
 */
public enum TwoBodyPattern {
  /**
   * {@code p == s, q == r, p < q}.
   */
  PQQP {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      return term(coefficient, p, q, r, s);
    }
  },
  /**
   * {@code p == r, q == s, p < q}.
   */
  PQPQ {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      return term(-coefficient, p, q, s, r);
    }
  },
  /**
   * {@code q == r} with {@code p < s}: PQQR ~ RQQP ~ QPRQ ~ QRPQ, one of them is recorded.
   */
  PQQR {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      if (r < s) {
        return p < q ? term(-2.0 * coefficient, p, q, s, r) : term(2.0 * coefficient, q, p, s, r);
      }
      return p < q ? term(2.0 * coefficient, p, q, r, s) : term(-2.0 * coefficient, q, p, r, s);
    }
  },
  /**
   * {@code q == s} with {@code p < r}: PQRQ ~ QRQP ~ QPQR ~ RQPQ, one of them is recorded.
   */
  PQRQ {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      if (p < q) {
        return r > q ? term(2.0 * coefficient, p, q, r, s) : term(-2.0 * coefficient, p, q, s, r);
      }
      return term(-2.0 * coefficient, q, p, r, s);
    }
  },
  /**
   * Four distinct indices with {@code p} the least.
   */
  PQRS {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      return r < s ? term(-2.0 * coefficient, p, q, s, r) : term(2.0 * coefficient, p, q, r, s);
    }
  },
  /**
   * Not a representative of its orbit, or a vanishing product.
   */
  NOT_CANONICAL {
    @Override
    public Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient) {
      return Optional.empty();
    }
  };

  /**
   * Classifies a tuple. The checks are ordered: the first matching pattern wins.
   *
   * @return the pattern of {@code (p, q, r, s)}
   */
  public static TwoBodyPattern classify(int p, int q, int r, int s) {
    if (p == s && q == r && p < q) {
      return PQQP;
    }
    if (p == r && q == s && p < q) {
      return PQPQ;
    }
    if (q == r && p < s && r != s && p != q) {
      return PQQR;
    }
    if (q == s && p < r && r != s && p != s) {
      return PQRQ;
    }
    if (p < q && p < r && p < s && q != r && q != s && r != s) {
      return PQRS;
    }
    return NOT_CANONICAL;
  }

  /**
   * Emits the canonical term of a tuple of this pattern.
   *
   * @return the canonical term with its signed and scaled coefficient, empty if the tuple is not a
   *     representative
   */
  public abstract Optional<WeightedTerm<FermionTermHermitian>> emit(int p, int q, int r, int s, double coefficient);

  private static Optional<WeightedTerm<FermionTermHermitian>> term(double coefficient, int... indices) {
    return Optional.of(new WeightedTerm<>(FermionTermHermitian.of(indices), coefficient));
  }
}
