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
package spd.potential.utils;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.min;
import static spd.numerics.math.VectorMath.dist;

import java.util.List;
import spd.potential.Molecule;
import spd.potential.SupraMolecule;

/**
 * Geometric measures of SupraMolecules.
 *
 * @since 1.0
 */
public final class SupraMoleculeUtils {

  private SupraMoleculeUtils() {
  }

  /**
   * Distance between two rows of a position matrix.
   *
   * @param positions The position matrix.
   * @param row1 The first row.
   * @param row2 The second row.
   * @return The distance.
   */
  public static double getAtomDistance(double[][] positions, int row1, int row2) {
    return dist(positions[row1], positions[row2]);
  }

  /**
   * Distance between two atoms of a molecule.
   *
   * @param molecule The molecule.
   * @param atom1 Id of the first atom.
   * @param atom2 Id of the second atom.
   * @return The distance.
   */
  public static double getAtomDistance(Molecule molecule, int atom1, int atom2) {
    return dist(molecule.getPosition(atom1), molecule.getPosition(atom2));
  }

  /**
   * Distance between the centroids of the two components of a SupraMolecule.
   *
   * @param supraMolecule A SupraMolecule with exactly two components.
   * @return The centroid separation.
   * @throws IllegalArgumentException If there are not exactly two components.
   */
  public static double calculateCentroidDistance(SupraMolecule supraMolecule) {
    List<Molecule> components = supraMolecule.getComponents();
    if (components.size() != 2) {
      throw new IllegalArgumentException(
          format(" Centroid distance needs exactly 2 components, found %d.", components.size()));
    }
    return dist(components.get(0).getCentroid(), components.get(1).getCentroid());
  }

  /**
   * Shortest distance between two atoms in different components.
   *
   * @param supraMolecule The SupraMolecule.
   * @return The shortest separation, or positive infinity with fewer than two components.
   */
  public static double calculateMinAtomDistance(SupraMolecule supraMolecule) {
    List<Molecule> components = supraMolecule.getComponents();
    double minDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < components.size() - 1; i++) {
      double[][] xi = components.get(i).getPositionMatrix();
      for (int j = i + 1; j < components.size(); j++) {
        double[][] xj = components.get(j).getPositionMatrix();
        for (double[] a : xi) {
          for (double[] b : xj) {
            minDistance = min(minDistance, dist(a, b));
          }
        }
      }
    }
    return minDistance;
  }
}
