// ******************************************************************************
//
// Title:       SpinDry.
// Description: SpinDry - Rigid-Body Host-Guest Conformer Search.
// Copyright:   Copyright (c) SpinDry developers 2021.
//
// This file is part of SpinDry.
//
// SpinDry is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// SpinDry is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// SpinDry; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package spd.potential.nonbonded;

import static java.lang.String.format;

import java.util.Arrays;
import java.util.List;
import spd.potential.Molecule;
import spd.potential.bonded.Atom;

/**
 * The default SpinDry potential: a 12-6 form with covalent radii as sigma (combined by arithmetic
 * mean) and a single well depth shared by all atom pairs.
 *
 * <p>Subclasses may override {@link #getRadii(int, Molecule)}, for example to scale the radii of the
 * guest only.
 *
 * @since 1.0
 */
public class SpdPotential extends NonbondedPotential {

  /** Default well depth. */
  public static final double DEFAULT_NONBOND_EPSILON = 5.0;

  private final double nonbondEpsilon;

  /** Constructor using the default well depth. */
  public SpdPotential() {
    this(DEFAULT_NONBOND_EPSILON);
  }

  /**
   * Constructor for SpdPotential.
   *
   * @param nonbondEpsilon The well depth used for every atom pair.
   */
  public SpdPotential(double nonbondEpsilon) {
    super(MixingRule.ARITHMETIC, MixingRule.ARITHMETIC);
    this.nonbondEpsilon = nonbondEpsilon;
  }

  /**
   * Radii used as sigma for the atoms of a component.
   *
   * @param index Index of the component within its SupraMolecule.
   * @param component The component.
   * @return One radius per atom in stored order.
   */
  protected double[] getRadii(int index, Molecule component) {
    List<Atom> atoms = component.getAtoms();
    double[] radii = new double[atoms.size()];
    for (int i = 0; i < radii.length; i++) {
      radii[i] = atoms.get(i).getRadius();
    }
    return radii;
  }

  @Override
  protected final double[] getSigmas(int index, Molecule component) {
    return getRadii(index, component);
  }

  @Override
  protected double[] getEpsilons(int index, Molecule component) {
    double[] epsilons = new double[component.getNumAtoms()];
    Arrays.fill(epsilons, nonbondEpsilon);
    return epsilons;
  }

  public double getNonbondEpsilon() {
    return nonbondEpsilon;
  }

  @Override
  public String toString() {
    return format("SpdPotential (epsilon %6.3f)", nonbondEpsilon);
  }
}
