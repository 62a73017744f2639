package com.quantori.chp.core.conversion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import com.quantori.chp.api.UnsupportedArityException;
import com.quantori.chp.api.hamiltonian.FermionHamiltonian;
import com.quantori.chp.api.hamiltonian.OrbitalIntegralHamiltonian;
import com.quantori.chp.api.model.FermionTermType;
import com.quantori.chp.api.model.OrbitalIntegral;
import com.quantori.chp.api.model.OrbitalIntegralTermType;
import com.quantori.chp.api.model.SpinOrbitalIndexConvention;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ParallelOrbitalIntegralConverterTest {

  private static final int N_ORBITALS = 4;

  @Mock
  private OrbitalIntegralHamiltonian mockedSource;

  @ParameterizedTest
  @EnumSource(SpinOrbitalIndexConvention.class)
  void testSameResultAsSequentialConversion(SpinOrbitalIndexConvention convention) {
    OrbitalIntegralHamiltonian source = randomSource(new Random(42), 60);
    ConversionProperties properties = ConversionProperties.builder()
        .indexConvention(convention)
        .parallelism(4)
        .partitionSize(3)
        .build();

    FermionHamiltonian sequential = new OrbitalIntegralConverter(properties).toFermionHamiltonian(source);
    FermionHamiltonian parallel = new ParallelOrbitalIntegralConverter(properties).toFermionHamiltonian(source);

    assertEquals(sequential.getSystemIndices(), parallel.getSystemIndices());
    for (FermionTermType type : FermionTermType.values()) {
      Map<?, Double> expected = sequential.getTerms(type);
      Map<?, Double> actual = parallel.getTerms(type);
      assertEquals(expected.keySet(), actual.keySet());
      expected.forEach((term, coefficient) -> assertThat(actual.get(term)).isCloseTo(coefficient, within(1e-12)));
    }
  }

  @Test
  void testSinglePartition() {
    OrbitalIntegralHamiltonian source = new OrbitalIntegralHamiltonian();
    source.addTerm(OrbitalIntegral.of(0.5, 0, 1));
    source.addTerm(OrbitalIntegral.of(0.25, 0, 1, 1, 0));

    FermionHamiltonian hamiltonian = new ParallelOrbitalIntegralConverter(
        ConversionProperties.builder().parallelism(8).build()).toFermionHamiltonian(source);

    assertEquals(new OrbitalIntegralConverter(SpinOrbitalIndexConvention.HALF_UP).toFermionHamiltonian(source),
        hamiltonian);
  }

  @Test
  void testEmptySource() {
    FermionHamiltonian hamiltonian = new ParallelOrbitalIntegralConverter(ConversionProperties.defaults())
        .toFermionHamiltonian(new OrbitalIntegralHamiltonian());

    assertTrue(hamiltonian.isEmpty());
    assertTrue(hamiltonian.getSystemIndices().isEmpty());
  }

  @Test
  void testInvalidProperties() {
    assertThrows(IllegalArgumentException.class, () -> new ParallelOrbitalIntegralConverter(
        ConversionProperties.builder().parallelism(0).build()));
    assertThrows(IllegalArgumentException.class, () -> new ParallelOrbitalIntegralConverter(
        ConversionProperties.builder().partitionSize(-1).build()));
  }

  @Test
  void testFailingPartitionAbortsConversion() {
    Map<OrbitalIntegral, Double> integrals = new LinkedHashMap<>();
    integrals.put(OrbitalIntegral.of(1.0, 0, 1), 1.0);
    integrals.put(OrbitalIntegral.of(1.0, 1, 2), 1.0);
    integrals.put(OrbitalIntegral.of(1.0, 0, 1, 2), 1.0);
    when(mockedSource.getSystemIndices()).thenReturn(Set.of(0, 1, 2));
    when(mockedSource.getTerms()).thenReturn(Map.of(OrbitalIntegralTermType.ONE_BODY, integrals));
    ParallelOrbitalIntegralConverter converter = new ParallelOrbitalIntegralConverter(
        ConversionProperties.builder().parallelism(2).partitionSize(1).build());

    assertThatThrownBy(() -> converter.toFermionHamiltonian(mockedSource))
        .isInstanceOf(UnsupportedArityException.class)
        .hasMessageContaining("Unsupported number of indices: 3");
  }

  private static OrbitalIntegralHamiltonian randomSource(Random random, int size) {
    OrbitalIntegralHamiltonian source = new OrbitalIntegralHamiltonian();
    source.addTerm(OrbitalIntegral.of(0.1, 0, N_ORBITALS - 1));
    for (int i = 0; i < size; i++) {
      int arity = random.nextBoolean() ? 2 : 4;
      int[] indices = random.ints(arity, 0, N_ORBITALS).toArray();
      source.addTerm(new OrbitalIntegral(indices, random.nextDouble() * 2.0 - 1.0));
    }
    return source;
  }
}
