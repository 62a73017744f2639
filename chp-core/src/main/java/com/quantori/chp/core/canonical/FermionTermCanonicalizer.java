package com.quantori.chp.core.canonical;

import com.quantori.chp.api.UnsupportedArityException;
import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Reduces an enumerated spin-orbital index tuple to at most one canonical Hermitian fermion term.
 * <p>
 * The symmetry enumeration visits every equivalent tuple of an integral. Exactly one tuple per
 * equivalence class is recognized as its representative; the others are suppressed, and the
 * representative's coefficient is scaled by the number of tuples it stands for.
 */
@UtilityClass
public final class FermionTermCanonicalizer {

  /**
   * Canonicalizes a one- or two-body spin-orbital index tuple.
   *
   * @param indices     spin-orbital indices, 2 or 4 of them
   * @param coefficient coefficient of the originating integral
   * @return the canonical term with its coefficient, or empty if the tuple is redundant
   * @throws UnsupportedArityException if the tuple has neither 2 nor 4 indices
   */
  public static Optional<WeightedTerm<FermionTermHermitian>> canonicalize(int[] indices, double coefficient) {
    return switch (indices.length) {
      case 2 -> OneBodyPattern.classify(indices[0], indices[1])
          .emit(indices[0], indices[1], coefficient);
      case 4 -> TwoBodyPattern.classify(indices[0], indices[1], indices[2], indices[3])
          .emit(indices[0], indices[1], indices[2], indices[3], coefficient);
      default -> throw new UnsupportedArityException(indices.length);
    };
  }
}
