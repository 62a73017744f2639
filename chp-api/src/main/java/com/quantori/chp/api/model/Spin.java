package com.quantori.chp.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Spin label of a spin-orbital.
 */
@Getter
@RequiredArgsConstructor
public enum Spin {
  UP(0),
  DOWN(1);

  /**
   * Numeric spin index used by index conventions.
   */
  private final int index;

  /**
   * Returns the spin with the given numeric index.
   *
   * @param index 0 for {@link #UP}, 1 for {@link #DOWN}
   * @return the spin label
   */
  public static Spin fromIndex(int index) {
    return switch (index) {
      case 0 -> UP;
      case 1 -> DOWN;
      default -> throw new IllegalArgumentException("Unknown spin index: " + index);
    };
  }
}
