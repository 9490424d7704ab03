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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static spd.numerics.math.VectorMath.diff;
import static spd.numerics.math.VectorMath.r;

import java.util.Arrays;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;
import spd.potential.Molecule;
import spd.potential.bonded.Atom;
import spd.potential.bonded.Bond;
import spd.potential.utils.SupraMoleculeUtils;
import spd.utilities.SpdTest;

/**
 * Test the rigid translation and rotation moves.
 */
public class RigidMoveTest extends SpdTest {

  private static final double TOL = 1.0e-10;

  private static Molecule triangle() {
    return new Molecule(Arrays.asList(new Atom(0, "O"), new Atom(1, "H"), new Atom(2, "H")),
        Arrays.asList(new Bond(0, 0, 1), new Bond(1, 0, 2)),
        new double[][] {{1, 2, 3}, {1.96, 2, 3}, {0.76, 2.93, 3}});
  }

  private static void assertRigid(Molecule before, Molecule after) {
    for (int i = 0; i < 3; i++) {
      for (int j = i + 1; j < 3; j++) {
        assertEquals(SupraMoleculeUtils.getAtomDistance(before, i, j),
            SupraMoleculeUtils.getAtomDistance(after, i, j), TOL);
      }
    }
  }

  @Test
  public void testTranslation() {
    RandomGenerator random = new MersenneTwister(1000);
    RigidTranslationMove move = new RigidTranslationMove(random, 0.5);
    Molecule start = triangle();
    for (int k = 0; k < 100; k++) {
      Molecule moved = move.move(start);
      double[] shift = diff(moved.getCentroid(), start.getCentroid());
      assertArrayEquals(move.getLastDisplacement(), shift, TOL);
      assertTrue(r(shift) <= 0.5 + TOL);
      assertRigid(start, moved);
    }
  }

  @Test
  public void testTranslationConsumesFourDraws() {
    RandomGenerator random = new MersenneTwister(3);
    RandomGenerator reference = new MersenneTwister(3);
    new RigidTranslationMove(random, 1.0).move(triangle());
    for (int i = 0; i < 4; i++) {
      reference.nextDouble();
    }
    assertEquals(reference.nextDouble(), random.nextDouble(), 0.0);
  }

  @Test
  public void testRotation() {
    RandomGenerator random = new MersenneTwister(1000);
    RigidRotationMove move = new RigidRotationMove(random, 5.0);
    Molecule start = triangle();
    for (int k = 0; k < 100; k++) {
      Molecule moved = move.move(start);
      assertArrayEquals(start.getCentroid(), moved.getCentroid(), TOL);
      assertTrue(Math.abs(move.getLastAngle()) <= 5.0);
      assertRigid(start, moved);
    }
  }

  @Test
  public void testRotationConsumesFourDraws() {
    RandomGenerator random = new MersenneTwister(5);
    RandomGenerator reference = new MersenneTwister(5);
    new RigidRotationMove(random, 1.0).move(triangle());
    for (int i = 0; i < 4; i++) {
      reference.nextDouble();
    }
    assertEquals(reference.nextDouble(), random.nextDouble(), 0.0);
  }

  @Test
  public void testZeroStepSizes() {
    Molecule start = triangle();
    Molecule moved = new RigidRotationMove(new MersenneTwister(2), 0.0)
        .move(new RigidTranslationMove(new MersenneTwister(2), 0.0).move(start));
    for (int i = 0; i < 3; i++) {
      assertArrayEquals(start.getPosition(i), moved.getPosition(i), TOL);
    }
  }
}
