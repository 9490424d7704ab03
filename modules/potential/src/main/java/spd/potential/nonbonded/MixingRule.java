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

import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Combining rules for per-atom nonbonded parameters.
 *
 * @since 1.0
 */
public enum MixingRule {
  /** Arithmetic mean (Lorentz). */
  ARITHMETIC,
  /** Geometric mean (Berthelot). */
  GEOMETRIC;

  /**
   * Combine the parameters of two atoms.
   *
   * @param a The parameter of the first atom.
   * @param b The parameter of the second atom.
   * @return The pair parameter.
   */
  public double combine(double a, double b) {
    switch (this) {
      case GEOMETRIC -> {
        return sqrt(a * b);
      }
      default -> {
        return 0.5 * (a + b);
      }
    }
  }
}
