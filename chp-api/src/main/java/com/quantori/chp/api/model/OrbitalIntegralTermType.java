package com.quantori.chp.api.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of orbital integrals by their number of orbital indices.
 */
@Getter
@RequiredArgsConstructor
public enum OrbitalIntegralTermType {
  ONE_BODY("OneBody"),
  TWO_BODY("TwoBody");

  @JsonValue private final String label;
}
