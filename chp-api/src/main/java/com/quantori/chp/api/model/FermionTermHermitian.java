package com.quantori.chp.api.model;

import com.quantori.chp.api.UnsupportedArityException;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Canonical representative of a fermion term plus its Hermitian conjugate.
 * <p>
 * The sequence is kept in canonical order (raising indices ascending, lowering indices descending)
 * and, of the term and its conjugate, the one with the lexicographically smaller index sequence is
 * kept. Reordering may flip the sign of the term: it is reported by {@link #getSign()} and is not
 * part of equality.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class FermionTermHermitian implements HamiltonianTerm<FermionTermType>, Comparable<FermionTermHermitian> {

  @Getter
  @EqualsAndHashCode.Include
  private final LadderSequence sequence;

  @Getter
  private final int sign;

  /**
   * Creates the canonical Hermitian representative of a normal-ordered sequence.
   *
   * @param sequence even-length, normal-ordered ladder sequence
   */
  public FermionTermHermitian(LadderSequence sequence) {
    Objects.requireNonNull(sequence);
    if (sequence.size() % 2 != 0) {
      throw new IllegalArgumentException("Hermitian fermion terms must have an even number of operators: " + sequence);
    }
    if (!sequence.isInNormalOrder()) {
      throw new IllegalArgumentException("Fermion term is not normal-ordered: " + sequence);
    }
    LadderSequence.Signed ordered = sequence.toCanonicalOrder();
    LadderSequence.Signed conjugate = ordered.sequence().hermitianConjugate().toCanonicalOrder();
    if (conjugate.sequence().compareTo(ordered.sequence()) < 0) {
      this.sequence = conjugate.sequence();
      this.sign = ordered.sign() * conjugate.sign();
    } else {
      this.sequence = ordered.sequence();
      this.sign = ordered.sign();
    }
  }

  private FermionTermHermitian(LadderSequence canonical, int sign) {
    this.sequence = canonical;
    this.sign = sign;
  }

  /**
   * Creates a term whose first half of indices are raising and second half lowering operators.
   *
   * @param indices spin-orbital indices
   * @return canonical Hermitian term
   */
  public static FermionTermHermitian of(int... indices) {
    return new FermionTermHermitian(LadderSequence.fromIndices(indices));
  }

  /**
   * Returns the same canonical term with a positive sign.
   *
   * @return the term with {@code sign == 1}
   */
  public FermionTermHermitian withUnitSign() {
    return sign == 1 ? this : new FermionTermHermitian(sequence, 1);
  }

  public int[] getIndices() {
    return sequence.getIndices();
  }

  @Override
  public FermionTermType getTermType() {
    return switch (sequence.size()) {
      case 2 -> FermionTermType.ONE_BODY;
      case 4 -> FermionTermType.TWO_BODY;
      default -> throw new UnsupportedArityException(sequence.size());
    };
  }

  @Override
  public int compareTo(FermionTermHermitian other) {
    return sequence.compareTo(other.sequence);
  }

  @Override
  public String toString() {
    return (sign < 0 ? "-" : "") + sequence;
  }
}
