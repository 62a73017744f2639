package com.quantori.chp.core.indexing;

import com.quantori.chp.api.OrbitalIndexOutOfRangeException;
import com.quantori.chp.api.model.IndexConvention;
import com.quantori.chp.api.model.Spin;
import com.quantori.chp.api.model.SpinOrbital;
import java.util.List;
import java.util.Objects;
import lombok.Getter;

/**
 * Maps spin-orbitals of a system with a fixed number of orbitals to integer indices.
 * <p>
 * The mapping itself is delegated to an {@link IndexConvention}; this class only guards the
 * range of its inputs. A system without orbitals has no valid index, so every lookup fails.
 */
@Getter
public class SpinOrbitalIndexer {

  private final IndexConvention convention;
  private final int nOrbitals;

  public SpinOrbitalIndexer(IndexConvention convention, int nOrbitals) {
    this.convention = Objects.requireNonNull(convention);
    this.nOrbitals = nOrbitals;
  }

  public int index(int orbital, Spin spin) {
    return index(new SpinOrbital(orbital, spin));
  }

  /**
   * Returns the integer index of a spin-orbital.
   *
   * @param spinOrbital spin-orbital to map
   * @return index in {@code [0, 2 * nOrbitals)}
   * @throws OrbitalIndexOutOfRangeException if the orbital is not less than the number of orbitals
   */
  public int index(SpinOrbital spinOrbital) {
    if (spinOrbital.orbital() >= nOrbitals) {
      throw new OrbitalIndexOutOfRangeException("Orbital index out of range", spinOrbital.orbital(), nOrbitals);
    }
    return spinOrbital.toInt(convention, nOrbitals);
  }

  public int[] index(List<SpinOrbital> spinOrbitals) {
    int[] indices = new int[spinOrbitals.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = index(spinOrbitals.get(i));
    }
    return indices;
  }

  /**
   * Inverse of {@link #index(SpinOrbital)}.
   *
   * @param index spin-orbital index
   * @return the spin-orbital
   * @throws OrbitalIndexOutOfRangeException if the index is outside {@code [0, 2 * nOrbitals)}
   */
  public SpinOrbital spinOrbital(int index) {
    if (index < 0 || index >= 2 * nOrbitals) {
      throw new OrbitalIndexOutOfRangeException("Spin-orbital index out of range", index, nOrbitals);
    }
    return convention.toSpinOrbital(index, nOrbitals);
  }
}
