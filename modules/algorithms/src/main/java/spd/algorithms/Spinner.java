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
package spd.algorithms;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import spd.algorithms.mc.BoltzmannMC;
import spd.algorithms.mc.MCMove;
import spd.algorithms.mc.RigidRotationMove;
import spd.algorithms.mc.RigidTranslationMove;
import spd.potential.Molecule;
import spd.potential.Potential;
import spd.potential.SupraMolecule;
import spd.potential.nonbonded.SpdPotential;

/**
 * The Spinner class generates conformers of a SupraMolecule by rigid-body Metropolis Monte Carlo.
 *
 * <p>Each step picks one movable component, translates it and rotates it about its centroid, and
 * tests the new potential with the Metropolis criterion. The starting structure is returned first
 * as conformer 0, followed by each accepted conformer. A chain ends after the requested number of
 * accepted conformers or after the maximum number of attempts.
 *
 * <p>All random draws come from one generator owned by the Spinner. Per step the draws are: the
 * component, the translation direction and scalar, the rotation axis and scalar, and (for uphill
 * moves only) the acceptance draw.
 *
 * @since 1.0
 */
public class Spinner {

  private static final Logger logger = Logger.getLogger(Spinner.class.getName());

  /** Default maximum number of attempted steps. */
  public static final int DEFAULT_MAX_ATTEMPTS = 1000;
  /** Default inverse temperature. */
  public static final double DEFAULT_BETA = 2.0;
  /** Default random seed. */
  public static final long DEFAULT_SEED = 1000L;

  private final double stepSize;
  private final double rotationStepSize;
  private final int numConformers;
  private final int maxAttempts;
  private final double beta;
  private final Potential potential;
  private final RandomGenerator random;

  /**
   * Spinner constructor using the default attempt limit, beta, potential and seed.
   *
   * @param stepSize Largest translation per step (Angstroms).
   * @param rotationStepSize Largest rotation per step (radians).
   * @param numConformers Number of accepted conformers to generate.
   */
  public Spinner(double stepSize, double rotationStepSize, int numConformers) {
    this(stepSize, rotationStepSize, numConformers, DEFAULT_MAX_ATTEMPTS, DEFAULT_BETA,
        new SpdPotential(), DEFAULT_SEED);
  }

  /**
   * Spinner constructor.
   *
   * @param stepSize Largest translation per step (Angstroms).
   * @param rotationStepSize Largest rotation per step (radians).
   * @param numConformers Number of accepted conformers to generate.
   * @param maxAttempts Maximum number of steps, counting the starting structure.
   * @param beta Inverse temperature of the acceptance test.
   * @param potential The potential used to score conformers.
   * @param seed Random seed, or null for a non-reproducible seed.
   * @throws IllegalArgumentException If numConformers or maxAttempts is not positive.
   */
  public Spinner(double stepSize, double rotationStepSize, int numConformers, int maxAttempts,
      double beta, Potential potential, Long seed) {
    if (numConformers <= 0) {
      throw new IllegalArgumentException(
          format(" The number of conformers must be positive (%d).", numConformers));
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          format(" The maximum number of attempts must be positive (%d).", maxAttempts));
    }
    if (potential == null) {
      throw new IllegalArgumentException(" A potential is required.");
    }
    this.stepSize = stepSize;
    this.rotationStepSize = rotationStepSize;
    this.numConformers = numConformers;
    this.maxAttempts = maxAttempts;
    this.beta = beta;
    this.potential = potential;
    this.random = (seed == null) ? new MersenneTwister() : new MersenneTwister(seed);
  }

  /**
   * Score a SupraMolecule with this Spinner's potential.
   *
   * @param supraMolecule The SupraMolecule.
   * @return The potential.
   */
  public double computePotential(SupraMolecule supraMolecule) {
    return potential.computePotential(supraMolecule);
  }

  /**
   * Generate conformers, keeping the largest component(s) fixed when component sizes differ.
   *
   * @param supraMolecule The starting structure.
   * @return The conformers; each iteration starts a new chain.
   */
  public Iterable<SupraMolecule> getConformers(SupraMolecule supraMolecule) {
    return getConformers(supraMolecule, null);
  }

  /**
   * Generate conformers.
   *
   * <p>The chain runs lazily as the iterator is consumed and continues from the current state of
   * the random generator, so iterating twice gives two different chains.
   *
   * @param supraMolecule The starting structure.
   * @param movableComponents Indices of the components that may move, or null to keep the largest
   *     component(s) fixed when component sizes differ.
   * @return The conformers.
   * @throws IllegalArgumentException If the movable set is empty or names a missing component.
   */
  public Iterable<SupraMolecule> getConformers(SupraMolecule supraMolecule,
      List<Integer> movableComponents) {
    int[] movable = resolveMovable(supraMolecule, movableComponents);
    return () -> new Chain(supraMolecule, movable);
  }

  /**
   * Run a chain to completion and return its last conformer.
   *
   * @param supraMolecule The starting structure.
   * @return The last conformer.
   */
  public SupraMolecule getFinalConformer(SupraMolecule supraMolecule) {
    return getFinalConformer(supraMolecule, null);
  }

  /**
   * Run a chain to completion and return its last conformer.
   *
   * @param supraMolecule The starting structure.
   * @param movableComponents Indices of the components that may move, or null.
   * @return The last conformer.
   */
  public SupraMolecule getFinalConformer(SupraMolecule supraMolecule,
      List<Integer> movableComponents) {
    SupraMolecule last = null;
    for (SupraMolecule conformer : getConformers(supraMolecule, movableComponents)) {
      last = conformer;
    }
    return last;
  }

  /**
   * Determine which components may move.
   *
   * @param supraMolecule The SupraMolecule.
   * @param movableComponents Explicit indices, or null.
   * @return The movable component indices.
   */
  static int[] resolveMovable(SupraMolecule supraMolecule, List<Integer> movableComponents) {
    int nComponents = supraMolecule.getNumComponents();
    if (movableComponents != null) {
      if (movableComponents.isEmpty()) {
        throw new IllegalArgumentException(" At least one component must be movable.");
      }
      int[] movable = new int[movableComponents.size()];
      for (int i = 0; i < movable.length; i++) {
        Integer index = movableComponents.get(i);
        if (index == null || index < 0 || index >= nComponents) {
          throw new IllegalArgumentException(
              format(" Movable component %s is out of range [0, %d).", index, nComponents));
        }
        movable[i] = index;
      }
      return movable;
    }

    int[] sizes = new int[nComponents];
    int largest = 0;
    for (int i = 0; i < nComponents; i++) {
      sizes[i] = supraMolecule.getComponent(i).getNumAtoms();
      largest = Math.max(largest, sizes[i]);
    }
    List<Integer> movable = new ArrayList<>();
    for (int i = 0; i < nComponents; i++) {
      if (sizes[i] != largest) {
        movable.add(i);
      }
    }
    // Equal sizes: everything moves.
    if (movable.isEmpty()) {
      for (int i = 0; i < nComponents; i++) {
        movable.add(i);
      }
    }
    return movable.stream().mapToInt(Integer::intValue).toArray();
  }

  public double getStepSize() {
    return stepSize;
  }

  public double getRotationStepSize() {
    return rotationStepSize;
  }

  public int getNumConformers() {
    return numConformers;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public double getBeta() {
    return beta;
  }

  public Potential getPotential() {
    return potential;
  }

  @Override
  public String toString() {
    return format(" Spinner: step size %6.3f, rotation step size %6.3f, %d conformers,"
            + " %d attempts, beta %6.3f, %s", stepSize, rotationStepSize, numConformers,
        maxAttempts, beta, potential);
  }

  /** One Markov chain, consumed as an Iterator. */
  private class Chain extends BoltzmannMC implements Iterator<SupraMolecule> {

    private final int[] movable;
    private final List<MCMove> moves;
    private SupraMolecule current;
    private double currentPotential;
    private int cid = 0;
    private int attempts = 0;
    private boolean started = false;
    private boolean done = false;
    private SupraMolecule next = null;

    private int componentIndex;
    private Molecule trialComponent;
    private SupraMolecule trial;
    private double trialPotential;

    Chain(SupraMolecule start, int[] movable) {
      super(Spinner.this.random, Spinner.this.beta);
      this.current = start;
      this.movable = movable;
      this.moves = Collections.unmodifiableList(Arrays.asList(
          new RigidTranslationMove(Spinner.this.random, stepSize),
          new RigidRotationMove(Spinner.this.random, rotationStepSize)));
    }

    @Override
    public boolean hasNext() {
      if (next == null && !done) {
        next = advance();
      }
      return next != null;
    }

    @Override
    public SupraMolecule next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      SupraMolecule conformer = next;
      next = null;
      return conformer;
    }

    /**
     * Run the chain until the next conformer.
     *
     * @return The next conformer, or null once the chain has ended.
     */
    private SupraMolecule advance() {
      if (!started) {
        started = true;
        currentPotential = computePotential(current);
        current = SupraMolecule.initFromComponents(current.getComponents(), cid,
            currentPotential);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine(format(" Starting potential %16.8f", currentPotential));
        }
        return current;
      }
      while (cid < numConformers && attempts < maxAttempts - 1) {
        attempts++;
        componentIndex = movable[getRandom().nextInt(movable.length)];
        if (mcStep(moves, currentPotential)) {
          cid++;
          currentPotential = trialPotential;
          current = trial.withConformerData(cid, currentPotential);
          return current;
        }
      }
      done = true;
      logger.info(format(" %d conformers generated in %d steps.", cid, attempts));
      return null;
    }

    @Override
    protected void storeState() {
      trialComponent = current.getComponent(componentIndex);
      trial = null;
    }

    @Override
    protected void applyMove(MCMove move) {
      trialComponent = move.move(trialComponent);
      trial = null;
    }

    @Override
    protected double currentEnergy() {
      if (trial == null) {
        trial = current.withComponent(componentIndex, trialComponent);
        trialPotential = computePotential(trial);
      }
      return trialPotential;
    }

    @Override
    public void revertStep() {
      trialComponent = null;
      trial = null;
    }
  }
}
