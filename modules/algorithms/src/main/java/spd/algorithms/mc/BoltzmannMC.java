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
import static org.apache.commons.math3.util.FastMath.exp;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * The BoltzmannMC abstract class is a skeleton for Boltzmann-weighted Metropolis Monte Carlo
 * simulations.
 *
 * <p>Downhill moves are always accepted. An uphill move is accepted when <code>exp(-beta *
 * (e2 - e1))</code> exceeds a uniform draw from [0, 1); the draw is consumed only for uphill moves.
 *
 * @since 1.0
 */
public abstract class BoltzmannMC implements MetropolisMC {

  private static final Logger logger = Logger.getLogger(BoltzmannMC.class.getName());

  /** Source of acceptance draws. */
  private final RandomGenerator random;
  /** Inverse temperature. */
  private double beta;
  private boolean print = true;
  private double e1 = 0.0;
  private double e2 = 0.0;
  private double lastE = 0.0;
  private boolean accepted = false;

  /**
   * Constructor for BoltzmannMC.
   *
   * @param random Source of acceptance draws.
   * @param beta The inverse temperature.
   */
  protected BoltzmannMC(RandomGenerator random, double beta) {
    this.random = random;
    this.beta = beta;
  }

  /** {@inheritDoc} */
  @Override
  public boolean evaluateMove(double e1, double e2) {
    if (e2 < e1) {
      return true;
    }
    // p(X) = exp(-beta * dE); a NaN energy is never accepted.
    double prob = exp(-beta * (e2 - e1));
    double trial = random.nextDouble();
    return prob > trial;
  }

  /** {@inheritDoc} */
  @Override
  public void setBeta(double beta) {
    this.beta = beta;
  }

  /** {@inheritDoc} */
  @Override
  public double getBeta() {
    return beta;
  }

  /** {@inheritDoc} */
  @Override
  public void setPrint(boolean print) {
    this.print = print;
  }

  /** {@inheritDoc} */
  @Override
  public double getE1() {
    return e1;
  }

  /** {@inheritDoc} */
  @Override
  public double getE2() {
    return e2;
  }

  /** {@inheritDoc} */
  @Override
  public double lastEnergy() {
    return lastE;
  }

  /** {@inheritDoc} */
  @Override
  public boolean getAccept() {
    return accepted;
  }

  /** {@inheritDoc} */
  @Override
  public boolean mcStep(MCMove move, double en1) {
    return mcStep(Collections.singletonList(move), en1);
  }

  /** {@inheritDoc} */
  @Override
  public boolean mcStep(List<MCMove> moves, double en1) {
    storeState();
    e1 = en1;
    for (MCMove move : moves) {
      applyMove(move);
    }

    lastE = currentEnergy(); // Is reset to e1 if the move is rejected.
    e2 = lastE;
    accepted = evaluateMove(e1, e2);
    if (accepted) {
      if (print && logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Monte Carlo step accepted with e2 %12.6f and e1 %12.6f", e2, e1));
      }
    } else {
      revertStep();
      lastE = e1;
      if (print && logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Monte Carlo step rejected with e2 %12.6f and e1 %12.6f", e2, e1));
      }
    }
    return accepted;
  }

  /**
   * Returns the random generator shared by moves and acceptance draws.
   *
   * @return The RandomGenerator.
   */
  protected RandomGenerator getRandom() {
    return random;
  }

  /**
   * Energy of the state produced by the moves of the current step.
   *
   * @return The energy.
   */
  protected abstract double currentEnergy();

  /** Record the state before the moves of a step are applied. */
  protected abstract void storeState();

  /**
   * Apply one move to the stored state.
   *
   * @param move The move.
   */
  protected abstract void applyMove(MCMove move);
}
