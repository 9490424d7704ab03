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

import org.apache.commons.math3.random.RandomGenerator;
import spd.potential.Molecule;

/**
 * Rotate a component about a random axis through its centroid.
 *
 * <p>Each move draws three uniform values for the axis and a scalar in [-1, 1); the angle is the
 * rotation step size (radians) times the scalar.
 *
 * @since 1.0
 */
public class RigidRotationMove implements MCMove {

  private final RandomGenerator random;
  private final double rotationStepSize;
  private double lastAngle = 0.0;

  /**
   * Constructor for RigidRotationMove.
   *
   * @param random Source of random draws.
   * @param rotationStepSize Largest rotation angle (radians).
   */
  public RigidRotationMove(RandomGenerator random, double rotationStepSize) {
    this.random = random;
    this.rotationStepSize = rotationStepSize;
  }

  /** {@inheritDoc} */
  @Override
  public Molecule move(Molecule component) {
    double[] axis = {random.nextDouble(), random.nextDouble(), random.nextDouble()};
    lastAngle = rotationStepSize * (random.nextDouble() - 0.5) * 2.0;
    return component.withRotation(lastAngle, axis, component.getCentroid());
  }

  public double getRotationStepSize() {
    return rotationStepSize;
  }

  public double getLastAngle() {
    return lastAngle;
  }

  @Override
  public String toString() {
    return format(" Rigid rotation with step size %8.4f radians", rotationStepSize);
  }
}
