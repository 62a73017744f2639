package com.quantori.chp.api.model;

import java.util.Objects;
import javax.validation.constraints.NotNull;

/**
 * Creation or annihilation operator acting on one spin-orbital.
 */
public record LadderOperator(@NotNull LadderType type, int index) {

  public LadderOperator {
    Objects.requireNonNull(type);
  }

  public LadderOperator adjoint() {
    return new LadderOperator(type.adjoint(), index);
  }

  @Override
  public String toString() {
    return index + type.getSymbol();
  }
}
