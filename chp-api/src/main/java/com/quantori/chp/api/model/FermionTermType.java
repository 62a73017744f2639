package com.quantori.chp.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of fermion terms by their number of ladder operators.
 */
@Getter
@RequiredArgsConstructor
public enum FermionTermType {
  ONE_BODY("OneBody"),
  TWO_BODY("TwoBody");

  @JsonValue private final String label;
}
