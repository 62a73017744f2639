package com.quantori.chp.core.canonical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.chp.api.UnsupportedArityException;
import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class FermionTermCanonicalizerTest {

  static Stream<Arguments> canonicalTuples() {
    return Stream.of(
        Arguments.of(new int[] {0, 0}, 3.0, TwoBodyOrOneBody.one(OneBodyPattern.DIAGONAL), new int[] {0, 0}, 3.0),
        Arguments.of(new int[] {0, 1}, 2.0, TwoBodyOrOneBody.one(OneBodyPattern.UPPER), new int[] {0, 1}, 4.0),
        Arguments.of(new int[] {0, 1, 1, 0}, 1.5, TwoBodyOrOneBody.two(TwoBodyPattern.PQQP), new int[] {0, 1, 1, 0}, 1.5),
        Arguments.of(new int[] {0, 1, 0, 1}, 1.5, TwoBodyOrOneBody.two(TwoBodyPattern.PQPQ), new int[] {0, 1, 1, 0}, -1.5),
        Arguments.of(new int[] {0, 1, 1, 2}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQQR), new int[] {0, 1, 2, 1}, -2.0),
        Arguments.of(new int[] {1, 0, 0, 2}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQQR), new int[] {0, 1, 2, 0}, 2.0),
        Arguments.of(new int[] {0, 2, 2, 1}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQQR), new int[] {0, 2, 2, 1}, 2.0),
        Arguments.of(new int[] {0, 1, 2, 1}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQRQ), new int[] {0, 1, 2, 1}, 2.0),
        Arguments.of(new int[] {0, 2, 1, 2}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQRQ), new int[] {0, 2, 2, 1}, -2.0),
        Arguments.of(new int[] {1, 0, 2, 0}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQRQ), new int[] {0, 1, 2, 0}, -2.0),
        Arguments.of(new int[] {0, 1, 2, 3}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQRS), new int[] {0, 1, 3, 2}, -2.0),
        Arguments.of(new int[] {0, 1, 3, 2}, 1.0, TwoBodyOrOneBody.two(TwoBodyPattern.PQRS), new int[] {0, 1, 3, 2}, 2.0)
    );
  }

  @ParameterizedTest
  @MethodSource("canonicalTuples")
  void testCanonicalize(int[] indices, double coefficient, TwoBodyOrOneBody pattern, int[] expectedIndices,
                        double expectedCoefficient) {
    assertEquals(pattern, TwoBodyOrOneBody.classify(indices));

    Optional<WeightedTerm<FermionTermHermitian>> term = FermionTermCanonicalizer.canonicalize(indices, coefficient);

    assertTrue(term.isPresent());
    assertThat(term.get().term().getIndices()).containsExactly(expectedIndices);
    assertThat(term.get().term().getSign()).isEqualTo(1);
    assertEquals(expectedCoefficient, term.get().coefficient());
  }

  static Stream<int[]> redundantTuples() {
    return Stream.of(
        new int[] {1, 0},
        new int[] {1, 0, 2, 3},
        new int[] {0, 0, 0, 0},
        new int[] {0, 0, 1, 1},
        new int[] {1, 0, 0, 1},
        new int[] {2, 1, 1, 0},
        new int[] {3, 2, 1, 0}
    );
  }

  @ParameterizedTest
  @MethodSource("redundantTuples")
  void testRedundantTupleEmitsNothing(int[] indices) {
    assertTrue(FermionTermCanonicalizer.canonicalize(indices, 1.0).isEmpty());
  }

  @Test
  void testUnsupportedArity() {
    UnsupportedArityException exception =
        assertThrows(UnsupportedArityException.class, () -> FermionTermCanonicalizer.canonicalize(new int[3], 1.0));
    assertEquals(3, exception.getArity());
  }

  @Test
  void testOnlyOneRepresentativePerSymmetryOrbit() {
    int[][] orbit = {
        {0, 1, 2, 3}, {3, 2, 1, 0}, {1, 0, 3, 2}, {2, 3, 0, 1},
        {0, 2, 1, 3}, {3, 1, 2, 0}, {2, 0, 3, 1}, {1, 3, 0, 2}
    };
    List<WeightedTerm<FermionTermHermitian>> emitted = new ArrayList<>();
    for (int[] tuple : orbit) {
      FermionTermCanonicalizer.canonicalize(tuple, 1.0).ifPresent(emitted::add);
    }

    assertThat(emitted).extracting(WeightedTerm::term)
        .containsExactly(FermionTermHermitian.of(0, 1, 3, 2), FermionTermHermitian.of(0, 2, 3, 1));
    assertThat(emitted).extracting(WeightedTerm::coefficient).containsExactly(-2.0, -2.0);
  }

  /**
   * Pattern of a tuple of either arity, so one table can drive both.
   */
  record TwoBodyOrOneBody(OneBodyPattern oneBody, TwoBodyPattern twoBody) {

    static TwoBodyOrOneBody one(OneBodyPattern pattern) {
      return new TwoBodyOrOneBody(pattern, null);
    }

    static TwoBodyOrOneBody two(TwoBodyPattern pattern) {
      return new TwoBodyOrOneBody(null, pattern);
    }

    static TwoBodyOrOneBody classify(int[] indices) {
      return indices.length == 2
          ? one(OneBodyPattern.classify(indices[0], indices[1]))
          : two(TwoBodyPattern.classify(indices[0], indices[1], indices[2], indices[3]));
    }
  }
}
