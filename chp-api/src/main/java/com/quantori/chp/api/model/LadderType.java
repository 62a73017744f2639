package com.quantori.chp.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of a fermionic ladder operator.
 */
@Getter
@RequiredArgsConstructor
public enum LadderType {
  /**
   * Creation operator.
   */
  RAISING("+"),
  /**
   * Annihilation operator.
   */
  LOWERING("-");

  private final String symbol;

  public LadderType adjoint() {
    return this == RAISING ? LOWERING : RAISING;
  }
}
