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
package spd.algorithms.mc;

import static java.lang.String.format;
import static spd.numerics.math.VectorMath.norm;
import static spd.numerics.math.VectorMath.scalar;

import org.apache.commons.math3.random.RandomGenerator;
import spd.potential.Molecule;

/**
 * Translate a component along a random direction by up to the step size.
 *
 * <p>Each move draws three uniform values for the direction, which is normalized, and then a
 * scalar in [-1, 1) that sets the signed length of the step.
 *
 * @since 1.0
 */
public class RigidTranslationMove implements MCMove {

  private final RandomGenerator random;
  private final double stepSize;
  private final double[] lastDisplacement = new double[3];

  /**
   * Constructor for RigidTranslationMove.
   *
   * @param random Source of random draws.
   * @param stepSize Largest translation (Angstroms).
   */
  public RigidTranslationMove(RandomGenerator random, double stepSize) {
    this.random = random;
    this.stepSize = stepSize;
  }

  /** {@inheritDoc} */
  @Override
  public Molecule move(Molecule component) {
    double[] direction = {random.nextDouble(), random.nextDouble(), random.nextDouble()};
    norm(direction, direction);
    double length = stepSize * (random.nextDouble() - 0.5) * 2.0;
    scalar(direction, length, lastDisplacement);
    return component.withDisplacement(lastDisplacement);
  }

  public double getStepSize() {
    return stepSize;
  }

  /**
   * The displacement applied by the last move.
   *
   * @return A copy of the displacement vector.
   */
  public double[] getLastDisplacement() {
    return lastDisplacement.clone();
  }

  @Override
  public String toString() {
    return format(" Rigid translation with step size %8.4f", stepSize);
  }
}
