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

import static org.apache.commons.math3.util.FastMath.log;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;
import spd.potential.Molecule;
import spd.potential.bonded.Atom;
import spd.utilities.SpdTest;

/**
 * Test the Metropolis acceptance test and the Monte Carlo step.
 */
public class BoltzmannMCTest extends SpdTest {

  /** A single atom whose energy is its x coordinate. */
  private static class AtomMC extends BoltzmannMC {

    private final Molecule current;
    private Molecule trial;

    AtomMC(RandomGenerator random, double beta) {
      super(random, beta);
      current = new Molecule(Collections.singletonList(new Atom(0, "Ar")),
          Collections.emptyList(), new double[][] {{0, 0, 0}});
    }

    @Override
    protected double currentEnergy() {
      return trial.getPosition(0)[0];
    }

    @Override
    protected void storeState() {
      trial = current;
    }

    @Override
    protected void applyMove(MCMove move) {
      trial = move.move(trial);
    }

    @Override
    public void revertStep() {
      trial = current;
    }
  }

  private static MCMove shiftX(double dx) {
    return component -> component.withDisplacement(new double[] {dx, 0, 0});
  }

  @Test
  public void testDownhillDoesNotDraw() {
    RandomGenerator random = new MersenneTwister(7);
    RandomGenerator reference = new MersenneTwister(7);
    AtomMC mc = new AtomMC(random, 2.0);
    assertTrue(mc.evaluateMove(1.0, 0.5));
    assertEquals(reference.nextDouble(), random.nextDouble(), 0.0);
  }

  @Test
  public void testUphillDraws() {
    RandomGenerator random = new MersenneTwister(7);
    RandomGenerator reference = new MersenneTwister(7);
    AtomMC mc = new AtomMC(random, 2.0);
    mc.evaluateMove(0.0, 0.1);
    reference.nextDouble();
    assertEquals(reference.nextDouble(), random.nextDouble(), 0.0);
  }

  @Test
  public void testEqualEnergiesAreAccepted() {
    AtomMC mc = new AtomMC(new MersenneTwister(1), 2.0);
    for (int i = 0; i < 100; i++) {
      assertTrue(mc.evaluateMove(-3.0, -3.0));
    }
  }

  @Test
  public void testNonFiniteEnergiesAreRejected() {
    AtomMC mc = new AtomMC(new MersenneTwister(1), 2.0);
    assertFalse(mc.evaluateMove(0.0, Double.POSITIVE_INFINITY));
    assertFalse(mc.evaluateMove(0.0, Double.NaN));
    assertFalse(mc.evaluateMove(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
    assertTrue(mc.evaluateMove(Double.POSITIVE_INFINITY, 1.0));
  }

  @Test
  public void testAcceptanceRate() {
    double beta = 2.0;
    AtomMC mc = new AtomMC(new MersenneTwister(1000), beta);
    assertEquals(beta, mc.getBeta(), 0.0);
    // exp(-beta * dE) = 1/2
    double dE = log(2.0) / beta;
    int n = 20000;
    int accepted = 0;
    for (int i = 0; i < n; i++) {
      if (mc.evaluateMove(0.0, dE)) {
        accepted++;
      }
    }
    assertEquals(0.5, (double) accepted / n, 0.02);
  }

  @Test
  public void testStep() {
    AtomMC mc = new AtomMC(new MersenneTwister(1), 1.0e6);
    mc.setPrint(false);

    assertTrue(mc.mcStep(shiftX(-1.0), 0.0));
    assertTrue(mc.getAccept());
    assertEquals(0.0, mc.getE1(), 0.0);
    assertEquals(-1.0, mc.getE2(), 0.0);
    assertEquals(-1.0, mc.lastEnergy(), 0.0);

    assertFalse(mc.mcStep(Arrays.asList(shiftX(0.5), shiftX(0.5)), 0.0));
    assertFalse(mc.getAccept());
    assertEquals(1.0, mc.getE2(), 1.0e-12);
    assertEquals(0.0, mc.lastEnergy(), 0.0);
  }
}
