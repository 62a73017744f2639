package com.quantori.chp.api.model;

/**
 * Index conventions in common use.
 */
public enum SpinOrbitalIndexConvention implements IndexConvention {
  /**
   * All spin-up orbitals first, then all spin-down orbitals: {@code orbital + nOrbitals * spin}.
   */
  HALF_UP {
    @Override
    public int toInt(SpinOrbital spinOrbital, int nOrbitals) {
      return spinOrbital.orbital() + nOrbitals * spinOrbital.spin().getIndex();
    }

    @Override
    public SpinOrbital toSpinOrbital(int index, int nOrbitals) {
      return new SpinOrbital(index % nOrbitals, Spin.fromIndex(index / nOrbitals));
    }
  },
  /**
   * Up and down spin-orbitals of one orbital are adjacent: {@code 2 * orbital + spin}.
   */
  UP_DOWN {
    @Override
    public int toInt(SpinOrbital spinOrbital, int nOrbitals) {
      return 2 * spinOrbital.orbital() + spinOrbital.spin().getIndex();
    }

    @Override
    public SpinOrbital toSpinOrbital(int index, int nOrbitals) {
      return new SpinOrbital(index / 2, Spin.fromIndex(index % 2));
    }
  }
}
