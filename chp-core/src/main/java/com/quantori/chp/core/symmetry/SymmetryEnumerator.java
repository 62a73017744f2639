package com.quantori.chp.core.symmetry;

import com.quantori.chp.api.model.OrbitalIntegral;
import com.quantori.chp.api.model.Spin;
import com.quantori.chp.api.model.SpinOrbital;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Enumerates the index tuples equivalent to an orbital integral under its permutation symmetry, and
 * their expansion over spin assignments.
 * <p>
 * All methods are pure: enumerating the same integral twice yields the same tuples in the same order.
 */
@UtilityClass
public final class SymmetryEnumerator {

  /**
   * {@code ij = ji}.
   */
  private static final int[][] ONE_BODY_PERMUTATIONS = {
      {0, 1}, {1, 0}
  };

  /**
   * {@code ijkl = lkji = jilk = klij = ikjl = ljki = kilj = jlik}.
   */
  private static final int[][] TWO_BODY_PERMUTATIONS = {
      {0, 1, 2, 3}, {3, 2, 1, 0}, {1, 0, 3, 2}, {2, 3, 0, 1},
      {0, 2, 1, 3}, {3, 1, 2, 0}, {2, 0, 3, 1}, {1, 3, 0, 2}
  };

  private static final Spin[][] ONE_BODY_SPINS = {
      {Spin.UP, Spin.UP},
      {Spin.DOWN, Spin.DOWN}
  };

  /**
   * Creation and annihilation operators pair up as (1, 4) and (2, 3), each pair sharing a spin.
   */
  private static final Spin[][] TWO_BODY_SPINS = {
      {Spin.UP, Spin.UP, Spin.UP, Spin.UP},
      {Spin.UP, Spin.DOWN, Spin.DOWN, Spin.UP},
      {Spin.DOWN, Spin.UP, Spin.UP, Spin.DOWN},
      {Spin.DOWN, Spin.DOWN, Spin.DOWN, Spin.DOWN}
  };

  /**
   * Lists the distinct orbital index tuples equivalent to the integral, in first occurrence order.
   *
   * @param orbitalIntegral one- or two-body integral
   * @return distinct index tuples, the integral's own tuple first
   * @throws com.quantori.chp.api.UnsupportedArityException if the integral is neither one- nor two-body
   */
  public static List<int[]> orbitalSymmetries(OrbitalIntegral orbitalIntegral) {
    int[] indices = orbitalIntegral.getOrbitalIndices();
    int[][] permutations = switch (orbitalIntegral.getTermType()) {
      case ONE_BODY -> ONE_BODY_PERMUTATIONS;
      case TWO_BODY -> TWO_BODY_PERMUTATIONS;
    };
    List<int[]> symmetries = new ArrayList<>(permutations.length);
    for (int[] permutation : permutations) {
      int[] permuted = new int[permutation.length];
      for (int i = 0; i < permutation.length; i++) {
        permuted[i] = indices[permutation[i]];
      }
      if (symmetries.stream().noneMatch(seen -> Arrays.equals(seen, permuted))) {
        symmetries.add(permuted);
      }
    }
    return symmetries;
  }

  /**
   * Expands every symmetry-equivalent orbital tuple over the spin assignments allowed for the
   * integral's term type.
   *
   * @param orbitalIntegral one- or two-body integral
   * @return spin-orbital tuples, grouped by orbital tuple
   */
  public static List<List<SpinOrbital>> spinOrbitals(OrbitalIntegral orbitalIntegral) {
    Spin[][] spinPatterns = switch (orbitalIntegral.getTermType()) {
      case ONE_BODY -> ONE_BODY_SPINS;
      case TWO_BODY -> TWO_BODY_SPINS;
    };
    List<List<SpinOrbital>> spinOrbitals = new ArrayList<>();
    for (int[] orbitals : orbitalSymmetries(orbitalIntegral)) {
      for (Spin[] spins : spinPatterns) {
        List<SpinOrbital> tuple = new ArrayList<>(orbitals.length);
        for (int i = 0; i < orbitals.length; i++) {
          tuple.add(new SpinOrbital(orbitals[i], spins[i]));
        }
        spinOrbitals.add(List.copyOf(tuple));
      }
    }
    return spinOrbitals;
  }

  /**
   * Re-expresses an integral with its lexicographically smallest equivalent index tuple.
   *
   * @param orbitalIntegral one- or two-body integral
   * @return an equivalent integral with the same coefficient
   */
  public static OrbitalIntegral canonicalForm(OrbitalIntegral orbitalIntegral) {
    int[] smallest = orbitalSymmetries(orbitalIntegral).stream()
        .min(Arrays::compare)
        .orElseThrow();
    return new OrbitalIntegral(smallest, orbitalIntegral.getCoefficient());
  }
}
