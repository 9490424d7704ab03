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

import java.util.List;

/**
 * The MetropolisMC interface defines the basic functionality of a Metropolis Monte Carlo
 * application.
 *
 * @since 1.0
 */
public interface MetropolisMC {

  /**
   * Metropolis criterion for a move from energy e1 to energy e2.
   *
   * @param e1 Energy before the move.
   * @param e2 Energy after the move.
   * @return True if the move is accepted.
   */
  boolean evaluateMove(double e1, double e2);

  /**
   * Set the inverse temperature used by the acceptance test.
   *
   * @param beta The inverse temperature (1/kT, in inverse energy units).
   */
  void setBeta(double beta);

  double getBeta();

  /**
   * Log the outcome of every step.
   *
   * @param print True to log each step at FINE.
   */
  void setPrint(boolean print);

  double getE1();

  double getE2();

  /**
   * Energy of the state after the last step (e1 if the step was rejected).
   *
   * @return The last energy.
   */
  double lastEnergy();

  /** Discard the proposal of the last step. */
  void revertStep();

  /**
   * Take a Monte Carlo step with a single move.
   *
   * @param move The move to apply.
   * @param en1 Energy of the current state.
   * @return True if the step was accepted.
   */
  boolean mcStep(MCMove move, double en1);

  /**
   * Take a Monte Carlo step applying several moves in sequence.
   *
   * @param moves The moves to apply.
   * @param en1 Energy of the current state.
   * @return True if the step was accepted.
   */
  boolean mcStep(List<MCMove> moves, double en1);

  /**
   * Returns the result of the last step.
   *
   * @return True if the last step was accepted.
   */
  boolean getAccept();
}
