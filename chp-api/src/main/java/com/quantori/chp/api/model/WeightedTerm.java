package com.quantori.chp.api.model;

import java.util.Objects;
import javax.validation.constraints.NotNull;

/**
 * A term together with its real coefficient.
 */
public record WeightedTerm<K>(@NotNull K term, double coefficient) {

  public WeightedTerm {
    Objects.requireNonNull(term);
  }
}
