package com.quantori.chp.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.validation.constraints.NotNull;

/**
 * Immutable product of ladder operators, applied right to left.
 */
public final class LadderSequence implements Comparable<LadderSequence> {

  private final List<LadderOperator> operators;

  public LadderSequence(@NotNull List<LadderOperator> operators) {
    Objects.requireNonNull(operators);
    this.operators = List.copyOf(operators);
  }

  /**
   * Creates a sequence whose first half are raising operators and second half lowering operators.
   *
   * @param indices spin-orbital indices, even number of them
   * @return the ladder sequence
   */
  public static LadderSequence fromIndices(int... indices) {
    if (indices.length % 2 != 0) {
      throw new IllegalArgumentException("Expected an even number of indices: " + Arrays.toString(indices));
    }
    List<LadderOperator> operators = new ArrayList<>(indices.length);
    for (int i = 0; i < indices.length; i++) {
      LadderType type = i < indices.length / 2 ? LadderType.RAISING : LadderType.LOWERING;
      operators.add(new LadderOperator(type, indices[i]));
    }
    return new LadderSequence(operators);
  }

  public List<LadderOperator> getOperators() {
    return operators;
  }

  public int size() {
    return operators.size();
  }

  public int[] getIndices() {
    return operators.stream().mapToInt(LadderOperator::index).toArray();
  }

  /**
   * Checks that every raising operator is to the left of every lowering operator.
   *
   * @return true if the sequence is normal-ordered
   */
  public boolean isInNormalOrder() {
    boolean lowering = false;
    for (LadderOperator operator : operators) {
      if (operator.type() == LadderType.LOWERING) {
        lowering = true;
      } else if (lowering) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reorders a normal-ordered sequence to raising indices ascending followed by lowering indices
   * descending. Every exchange of two neighbouring operators flips the sign.
   *
   * @return the reordered sequence and the sign of the permutation
   * @throws IllegalStateException if the sequence is not normal-ordered
   */
  public Signed toCanonicalOrder() {
    if (!isInNormalOrder()) {
      throw new IllegalStateException("Sequence is not normal-ordered: " + this);
    }
    List<LadderOperator> sorted = new ArrayList<>(operators);
    int sign = 1;
    for (int end = sorted.size() - 1; end > 0; end--) {
      for (int i = 0; i < end; i++) {
        if (outOfCanonicalOrder(sorted.get(i), sorted.get(i + 1))) {
          Collections.swap(sorted, i, i + 1);
          sign = -sign;
        }
      }
    }
    return new Signed(new LadderSequence(sorted), sign);
  }

  private static boolean outOfCanonicalOrder(LadderOperator left, LadderOperator right) {
    if (left.type() != right.type()) {
      return false;
    }
    return left.type() == LadderType.RAISING ? left.index() > right.index() : left.index() < right.index();
  }

  /**
   * Returns the Hermitian conjugate: the reversed product with every operator adjoint.
   *
   * @return the conjugate sequence
   */
  public LadderSequence hermitianConjugate() {
    List<LadderOperator> conjugate = new ArrayList<>(operators.size());
    for (int i = operators.size() - 1; i >= 0; i--) {
      conjugate.add(operators.get(i).adjoint());
    }
    return new LadderSequence(conjugate);
  }

  /**
   * Lexicographic order on the index sequence, shorter sequences first.
   */
  @Override
  public int compareTo(LadderSequence other) {
    if (size() != other.size()) {
      return Integer.compare(size(), other.size());
    }
    return Arrays.compare(getIndices(), other.getIndices());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LadderSequence that)) {
      return false;
    }
    return operators.equals(that.operators);
  }

  @Override
  public int hashCode() {
    return operators.hashCode();
  }

  @Override
  public String toString() {
    return operators.stream().map(LadderOperator::toString).collect(Collectors.joining(" ", "[", "]"));
  }

  /**
   * A sequence with the sign picked up while reordering it.
   */
  public record Signed(LadderSequence sequence, int sign) {
  }
}
