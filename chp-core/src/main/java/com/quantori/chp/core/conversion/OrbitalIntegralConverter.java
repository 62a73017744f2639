package com.quantori.chp.core.conversion;

import com.quantori.chp.api.hamiltonian.FermionHamiltonian;
import com.quantori.chp.api.hamiltonian.OrbitalIntegralHamiltonian;
import com.quantori.chp.api.model.FermionTermHermitian;
import com.quantori.chp.api.model.IndexConvention;
import com.quantori.chp.api.model.OrbitalIntegral;
import com.quantori.chp.api.model.SpinOrbital;
import com.quantori.chp.api.model.WeightedTerm;
import com.quantori.chp.core.canonical.FermionTermCanonicalizer;
import com.quantori.chp.core.indexing.SpinOrbitalIndexer;
import com.quantori.chp.core.symmetry.SymmetryEnumerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Sequential conversion of orbital integrals into Hermitian fermion terms.
 */
@Slf4j
public class OrbitalIntegralConverter implements FermionHamiltonianConverter {

  @Getter
  private final IndexConvention indexConvention;

  public OrbitalIntegralConverter(IndexConvention indexConvention) {
    this.indexConvention = Objects.requireNonNull(indexConvention);
  }

  public OrbitalIntegralConverter(ConversionProperties properties) {
    this(properties.getIndexConvention());
  }

  /**
   * Creates all canonical fermion terms generated by the symmetries of one orbital integral.
   *
   * @param orbitalIntegral one- or two-body integral
   * @param nOrbitals       total number of distinct orbitals
   * @return canonical terms with their coefficients, no term twice
   * @throws com.quantori.chp.api.UnsupportedArityException        if the integral is neither one- nor two-body
   * @throws com.quantori.chp.api.OrbitalIndexOutOfRangeException if an orbital index is not less than {@code nOrbitals}
   */
  public List<WeightedTerm<FermionTermHermitian>> toHermitianFermionTerms(OrbitalIntegral orbitalIntegral,
                                                                          int nOrbitals) {
    SpinOrbitalIndexer indexer = new SpinOrbitalIndexer(indexConvention, nOrbitals);
    List<WeightedTerm<FermionTermHermitian>> fermionTerms = new ArrayList<>();
    for (List<SpinOrbital> spinOrbitals : SymmetryEnumerator.spinOrbitals(orbitalIntegral)) {
      FermionTermCanonicalizer.canonicalize(indexer.index(spinOrbitals), orbitalIntegral.getCoefficient())
          .ifPresent(fermionTerms::add);
    }
    log.debug("{} -> {} fermion terms", orbitalIntegral, fermionTerms.size());
    return fermionTerms;
  }

  @Override
  public FermionHamiltonian toFermionHamiltonian(OrbitalIntegralHamiltonian source) {
    FermionHamiltonian hamiltonian = new FermionHamiltonian();
    appendTo(source, hamiltonian);
    return hamiltonian;
  }

  /**
   * Converts the source and merges the result into an existing fermion Hamiltonian. All integrals
   * are converted before the destination is touched, so a failing conversion leaves it unchanged.
   *
   * @param source      orbital integral Hamiltonian
   * @param destination fermion Hamiltonian to merge into
   */
  public void appendTo(OrbitalIntegralHamiltonian source, FermionHamiltonian destination) {
    Objects.requireNonNull(destination);
    int nOrbitals = numberOfOrbitals(source);
    List<WeightedTerm<OrbitalIntegral>> integrals = integrals(source);
    List<WeightedTerm<FermionTermHermitian>> staged = convert(integrals, nOrbitals);

    destination.addTerms(staged);
    destination.setSystemIndices(withSpinOrbitalRange(destination.getSystemIndices(), nOrbitals));
    log.info("Converted {} orbital integrals over {} orbitals into {} fermion terms",
        integrals.size(), nOrbitals, staged.size());
  }

  List<WeightedTerm<FermionTermHermitian>> convert(List<WeightedTerm<OrbitalIntegral>> integrals, int nOrbitals) {
    List<WeightedTerm<FermionTermHermitian>> fermionTerms = new ArrayList<>();
    for (WeightedTerm<OrbitalIntegral> integral : integrals) {
      fermionTerms.addAll(toHermitianFermionTerms(integral.term().withCoefficient(integral.coefficient()), nOrbitals));
    }
    return fermionTerms;
  }

  /**
   * The coefficient stored in the Hamiltonian takes precedence over the integral's own.
   */
  static List<WeightedTerm<OrbitalIntegral>> integrals(OrbitalIntegralHamiltonian source) {
    List<WeightedTerm<OrbitalIntegral>> integrals = new ArrayList<>();
    source.getTerms().values().forEach(typedTerms ->
        typedTerms.forEach((integral, coefficient) -> integrals.add(new WeightedTerm<>(integral, coefficient))));
    return integrals;
  }

  static int numberOfOrbitals(OrbitalIntegralHamiltonian source) {
    return source.getSystemIndices().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
  }

  // Every spin-orbital of the system is in play once any orbital is.
  static Set<Integer> withSpinOrbitalRange(Set<Integer> indices, int nOrbitals) {
    Set<Integer> all = new TreeSet<>(indices);
    IntStream.range(0, 2 * nOrbitals).forEach(all::add);
    return all;
  }
}
