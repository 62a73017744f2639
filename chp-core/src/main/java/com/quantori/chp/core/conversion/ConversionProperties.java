package com.quantori.chp.core.conversion;

import com.quantori.chp.api.model.IndexConvention;
import com.quantori.chp.api.model.SpinOrbitalIndexConvention;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;

/**
 * Settings of an orbital integral to fermion Hamiltonian conversion.
 */
@Builder
@Data
public class ConversionProperties {

  /**
   * Mapping of spin-orbitals to integer indices. Defaults to {@link SpinOrbitalIndexConvention#HALF_UP}.
   */
  @NotNull
  @Builder.Default
  private IndexConvention indexConvention = SpinOrbitalIndexConvention.HALF_UP;

  /**
   * Number of worker threads of a parallel conversion.
   */
  @Positive
  @Builder.Default
  private int parallelism = 1;

  /**
   * Number of orbital integrals converted by one worker task.
   */
  @Positive
  @Builder.Default
  private int partitionSize = 256;

  public static ConversionProperties defaults() {
    return ConversionProperties.builder().build();
  }
}
