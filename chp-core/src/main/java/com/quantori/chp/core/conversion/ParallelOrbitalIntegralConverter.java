package com.quantori.chp.core.conversion;

import com.quantori.chp.api.HamiltonianConversionException;
import com.quantori.chp.api.hamiltonian.FermionHamiltonian;
import com.quantori.chp.api.hamiltonian.OrbitalIntegralHamiltonian;
import com.quantori.chp.api.model.OrbitalIntegral;
import com.quantori.chp.api.model.WeightedTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts partitions of the source integrals concurrently.
 * <p>
 * Each worker accumulates its partition into a private {@link FermionHamiltonian}; the partial
 * Hamiltonians are then merged sequentially in partition order, so the result does not depend on
 * thread scheduling.
 */
@Slf4j
public class ParallelOrbitalIntegralConverter implements FermionHamiltonianConverter {

  private final OrbitalIntegralConverter converter;
  private final int parallelism;
  private final int partitionSize;

  public ParallelOrbitalIntegralConverter(ConversionProperties properties) {
    Objects.requireNonNull(properties);
    if (properties.getParallelism() <= 0) {
      throw new IllegalArgumentException("Parallelism must be positive: " + properties.getParallelism());
    }
    if (properties.getPartitionSize() <= 0) {
      throw new IllegalArgumentException("Partition size must be positive: " + properties.getPartitionSize());
    }
    this.converter = new OrbitalIntegralConverter(properties);
    this.parallelism = properties.getParallelism();
    this.partitionSize = properties.getPartitionSize();
  }

  @Override
  public FermionHamiltonian toFermionHamiltonian(OrbitalIntegralHamiltonian source) {
    int nOrbitals = OrbitalIntegralConverter.numberOfOrbitals(source);
    List<List<WeightedTerm<OrbitalIntegral>>> partitions = partition(OrbitalIntegralConverter.integrals(source));
    log.debug("Converting {} partitions over {} orbitals with {} workers", partitions.size(), nOrbitals, parallelism);

    FermionHamiltonian hamiltonian = new FermionHamiltonian();
    if (!partitions.isEmpty()) {
      convertPartitions(partitions, nOrbitals).forEach(hamiltonian::addHamiltonian);
    }
    hamiltonian.setSystemIndices(OrbitalIntegralConverter.withSpinOrbitalRange(hamiltonian.getSystemIndices(), nOrbitals));
    log.info("Converted {} orbital integral partitions over {} orbitals into {} fermion terms",
        partitions.size(), nOrbitals, hamiltonian.countTerms());
    return hamiltonian;
  }

  private List<FermionHamiltonian> convertPartitions(List<List<WeightedTerm<OrbitalIntegral>>> partitions,
                                                      int nOrbitals) {
    ExecutorService executorService = Executors.newFixedThreadPool(Math.min(parallelism, partitions.size()));
    try {
      List<Future<FermionHamiltonian>> futures = new ArrayList<>(partitions.size());
      for (List<WeightedTerm<OrbitalIntegral>> partition : partitions) {
        futures.add(executorService.submit(() -> convertPartition(partition, nOrbitals)));
      }
      List<FermionHamiltonian> partials = new ArrayList<>(futures.size());
      for (int i = 0; i < futures.size(); i++) {
        partials.add(await(futures.get(i), i));
      }
      return partials;
    } finally {
      executorService.shutdownNow();
    }
  }

  private FermionHamiltonian convertPartition(List<WeightedTerm<OrbitalIntegral>> partition, int nOrbitals) {
    FermionHamiltonian partial = new FermionHamiltonian();
    partial.addTerms(converter.convert(partition, nOrbitals));
    return partial;
  }

  private List<List<WeightedTerm<OrbitalIntegral>>> partition(List<WeightedTerm<OrbitalIntegral>> integrals) {
    List<List<WeightedTerm<OrbitalIntegral>>> partitions = new ArrayList<>();
    for (int from = 0; from < integrals.size(); from += partitionSize) {
      partitions.add(integrals.subList(from, Math.min(from + partitionSize, integrals.size())));
    }
    return partitions;
  }

  private static FermionHamiltonian await(Future<FermionHamiltonian> future, int partition) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HamiltonianConversionException("Interrupted while converting partition " + partition, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      log.warn("Conversion of partition {} failed", partition, cause);
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new HamiltonianConversionException("Conversion of partition " + partition + " failed", cause);
    }
  }
}
