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
package spd.algorithms.cli;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Option;
import spd.algorithms.Spinner;
import spd.potential.Potential;
import spd.potential.nonbonded.SpdPotential;
import spd.potential.nonbonded.VaryingEpsilonPotential;

/**
 * Represents command line options for commands that run a Spinner.
 *
 * <p>An option given on the command line wins; otherwise the value is read from the properties
 * (for example <code>step-size</code> in host.properties) and finally from the built-in default.
 *
 * @since 1.0
 */
public class SpinnerOptions {

  public static final String STEP_SIZE = "step-size";
  public static final String ROTATION_STEP_SIZE = "rotation-step-size";
  public static final String NUM_CONFORMERS = "num-conformers";
  public static final String MAX_ATTEMPTS = "max-attempts";
  public static final String BETA = "beta";
  public static final String RANDOM_SEED = "random-seed";
  public static final String NONBOND_EPSILON = "nonbond-epsilon";
  public static final String POTENTIAL = "potential";

  /** Seed value that asks for a non-reproducible generator. */
  public static final String NO_SEED = "none";

  public static final double DEFAULT_STEP_SIZE = 0.5;
  public static final double DEFAULT_ROTATION_STEP_SIZE = 5.0;
  public static final int DEFAULT_NUM_CONFORMERS = 10;

  /** The ArgGroup keeps the SpinnerOptions together when printing help. */
  @ArgGroup(heading = "%n Spinner Options%n", validate = false)
  public SpinnerOptionGroup group = new SpinnerOptionGroup();

  public double getStepSize(CompositeConfiguration properties) {
    return (group.stepSize != null) ? group.stepSize
        : properties.getDouble(STEP_SIZE, DEFAULT_STEP_SIZE);
  }

  public double getRotationStepSize(CompositeConfiguration properties) {
    return (group.rotationStepSize != null) ? group.rotationStepSize
        : properties.getDouble(ROTATION_STEP_SIZE, DEFAULT_ROTATION_STEP_SIZE);
  }

  public int getNumConformers(CompositeConfiguration properties) {
    return (group.numConformers != null) ? group.numConformers
        : properties.getInt(NUM_CONFORMERS, DEFAULT_NUM_CONFORMERS);
  }

  public int getMaxAttempts(CompositeConfiguration properties) {
    return (group.maxAttempts != null) ? group.maxAttempts
        : properties.getInt(MAX_ATTEMPTS, Spinner.DEFAULT_MAX_ATTEMPTS);
  }

  public double getBeta(CompositeConfiguration properties) {
    return (group.beta != null) ? group.beta : properties.getDouble(BETA, Spinner.DEFAULT_BETA);
  }

  /**
   * The random seed.
   *
   * @param properties Properties consulted if the option was not given.
   * @return The seed, or null when the seed is "none".
   * @throws IllegalArgumentException If the seed is neither an integer nor "none".
   */
  public Long getSeed(CompositeConfiguration properties) {
    String seed = (group.seed != null) ? group.seed
        : properties.getString(RANDOM_SEED, Long.toString(Spinner.DEFAULT_SEED));
    seed = seed.trim();
    if (seed.equalsIgnoreCase(NO_SEED)) {
      return null;
    }
    try {
      return Long.parseLong(seed);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          format(" Random seed %s is neither an integer nor \"%s\".", seed, NO_SEED), e);
    }
  }

  public double getNonbondEpsilon(CompositeConfiguration properties) {
    return (group.nonbondEpsilon != null) ? group.nonbondEpsilon
        : properties.getDouble(NONBOND_EPSILON, SpdPotential.DEFAULT_NONBOND_EPSILON);
  }

  /**
   * The potential used to score conformers.
   *
   * @param properties Properties consulted if the option was not given.
   * @return The potential type.
   * @throws IllegalArgumentException If the name is not a known potential.
   */
  public PotentialType getPotentialType(CompositeConfiguration properties) {
    String name = (group.potential != null) ? group.potential
        : properties.getString(POTENTIAL, PotentialType.SPD.name());
    try {
      return PotentialType.valueOf(name.trim().toUpperCase().replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          format(" Unknown potential %s (expected SPD or VARYING_EPSILON).", name), e);
    }
  }

  /**
   * Build the potential selected by the options.
   *
   * @param properties Properties consulted for options not given on the command line.
   * @return The potential.
   */
  public Potential buildPotential(CompositeConfiguration properties) {
    switch (getPotentialType(properties)) {
      case VARYING_EPSILON:
        return new VaryingEpsilonPotential();
      case SPD:
      default:
        return new SpdPotential(getNonbondEpsilon(properties));
    }
  }

  /**
   * Indices of the components allowed to move.
   *
   * @return The indices, or null to keep the largest component(s) fixed.
   */
  public List<Integer> getMovable() {
    return (group.movable == null) ? null : new ArrayList<>(group.movable);
  }

  /**
   * Build a Spinner from the options.
   *
   * @param properties Properties consulted for options not given on the command line.
   * @return The Spinner.
   */
  public Spinner buildSpinner(CompositeConfiguration properties) {
    return new Spinner(getStepSize(properties), getRotationStepSize(properties),
        getNumConformers(properties), getMaxAttempts(properties), getBeta(properties),
        buildPotential(properties), getSeed(properties));
  }

  /** Collection of Spinner options. */
  private static class SpinnerOptionGroup {

    @Option(
        names = {"-s", "--stepSize"},
        paramLabel = "0.5",
        description = "Largest translation of a component per step (Angstroms).")
    private Double stepSize;

    @Option(
        names = {"-r", "--rotationStepSize"},
        paramLabel = "5.0",
        description = "Largest rotation of a component per step (radians).")
    private Double rotationStepSize;

    @Option(
        names = {"-n", "--numConformers"},
        paramLabel = "10",
        description = "Number of accepted conformers to generate.")
    private Integer numConformers;

    @Option(
        names = {"-m", "--maxAttempts"},
        paramLabel = "1000",
        description = "Maximum number of Monte Carlo steps.")
    private Integer maxAttempts;

    @Option(
        names = {"-b", "--beta"},
        paramLabel = "2.0",
        description = "Inverse temperature of the Metropolis test.")
    private Double beta;

    @Option(
        names = {"--seed"},
        paramLabel = "1000",
        description = "Seed of the random number generator, or \"none\" for a random seed.")
    private String seed;

    @Option(
        names = {"-e", "--nonbondEpsilon"},
        paramLabel = "5.0",
        description = "Well depth of the nonbonded potential.")
    private Double nonbondEpsilon;

    @Option(
        names = {"-p", "--potential"},
        paramLabel = "SPD",
        description = "Potential: SPD (constant epsilon) or VARYING_EPSILON (per-atom epsilon).")
    private String potential;

    @Option(
        names = {"--movable"},
        paramLabel = "1,2",
        split = ",",
        description = "Indices of the components that may move (default: all but the largest).")
    private List<Integer> movable;
  }

  /** Potentials that can score conformers. */
  public enum PotentialType {
    /** Constant well depth with arithmetic radii. */
    SPD,
    /** Per-atom well depths mixed geometrically. */
    VARYING_EPSILON
  }
}
