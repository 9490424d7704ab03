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

import java.util.List;
import spd.potential.Molecule;
import spd.potential.bonded.Atom;

/**
 * A 12-6 potential using per-element sigma and epsilon, combined by arithmetic and geometric mean
 * respectively.
 *
 * @since 1.0
 */
public class VaryingEpsilonPotential extends NonbondedPotential {

  public VaryingEpsilonPotential() {
    super(MixingRule.ARITHMETIC, MixingRule.GEOMETRIC);
  }

  @Override
  protected double[] getSigmas(int index, Molecule component) {
    List<Atom> atoms = component.getAtoms();
    double[] sigmas = new double[atoms.size()];
    for (int i = 0; i < sigmas.length; i++) {
      sigmas[i] = atoms.get(i).getSigma();
    }
    return sigmas;
  }

  @Override
  protected double[] getEpsilons(int index, Molecule component) {
    List<Atom> atoms = component.getAtoms();
    double[] epsilons = new double[atoms.size()];
    for (int i = 0; i < epsilons.length; i++) {
      epsilons[i] = atoms.get(i).getEpsilon();
    }
    return epsilons;
  }
}
