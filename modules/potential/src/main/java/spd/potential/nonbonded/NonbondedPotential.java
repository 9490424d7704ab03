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

import static java.lang.String.format;
import static spd.numerics.math.VectorMath.dist;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import spd.potential.Molecule;
import spd.potential.Potential;
import spd.potential.SupraMolecule;

/**
 * Base class for 12-6 nonbonded potentials summed over every pair of atoms that belong to
 * different components.
 *
 * <p>Subclasses supply per-atom sigma and epsilon values for each component; the pair values are
 * formed with a {@link MixingRule}.
 *
 * @since 1.0
 */
public abstract class NonbondedPotential implements Potential {

  private static final Logger logger = Logger.getLogger(NonbondedPotential.class.getName());

  private final MixingRule sigmaRule;
  private final MixingRule epsilonRule;

  /**
   * Constructor for NonbondedPotential.
   *
   * @param sigmaRule Rule used to combine sigma values.
   * @param epsilonRule Rule used to combine epsilon values.
   */
  protected NonbondedPotential(MixingRule sigmaRule, MixingRule epsilonRule) {
    this.sigmaRule = sigmaRule;
    this.epsilonRule = epsilonRule;
  }

  /**
   * The 12-6 pair functional <code>epsilon * ((sigma/d)^12 - (sigma/d)^6)</code>.
   *
   * <p>It is zero at <code>d == sigma</code> and reaches its minimum of <code>-epsilon/4</code> at
   * <code>d = 2^(1/6) sigma</code>. A zero distance is not guarded.
   *
   * @param distance The separation.
   * @param sigma The pair sigma.
   * @param epsilon The pair epsilon.
   * @return The pair energy.
   */
  public static double nonbondPotential(double distance, double sigma, double epsilon) {
    double ratio = sigma / distance;
    double ratio2 = ratio * ratio;
    double ratio6 = ratio2 * ratio2 * ratio2;
    return epsilon * (ratio6 * ratio6 - ratio6);
  }

  /**
   * Per-atom sigma values of a component.
   *
   * @param index Index of the component within its SupraMolecule.
   * @param component The component.
   * @return One value per atom in stored order.
   */
  protected abstract double[] getSigmas(int index, Molecule component);

  /**
   * Per-atom epsilon values of a component.
   *
   * @param index Index of the component within its SupraMolecule.
   * @param component The component.
   * @return One value per atom in stored order.
   */
  protected abstract double[] getEpsilons(int index, Molecule component);

  /** {@inheritDoc} */
  @Override
  public double computePotential(SupraMolecule supraMolecule) {
    List<Molecule> components = supraMolecule.getComponents();
    int n = components.size();
    double[][][] positions = new double[n][][];
    double[][] sigmas = new double[n][];
    double[][] epsilons = new double[n][];
    for (int i = 0; i < n; i++) {
      Molecule component = components.get(i);
      positions[i] = component.getPositionMatrix();
      sigmas[i] = getSigmas(i, component);
      epsilons[i] = getEpsilons(i, component);
    }
    double potential = 0.0;
    for (int i = 0; i < n - 1; i++) {
      for (int j = i + 1; j < n; j++) {
        potential += pairPotential(positions[i], sigmas[i], epsilons[i],
            positions[j], sigmas[j], epsilons[j]);
      }
    }
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" %d components, potential %16.8f", n, potential));
    }
    return potential;
  }

  /**
   * Interaction between two molecules, parameterized as components 0 and 1.
   *
   * @param a The first molecule.
   * @param b The second molecule.
   * @return The pair potential.
   */
  public double computePairPotential(Molecule a, Molecule b) {
    return pairPotential(a.getPositionMatrix(), getSigmas(0, a), getEpsilons(0, a),
        b.getPositionMatrix(), getSigmas(1, b), getEpsilons(1, b));
  }

  private double pairPotential(double[][] xa, double[] sa, double[] ea,
      double[][] xb, double[] sb, double[] eb) {
    double potential = 0.0;
    for (int i = 0; i < xa.length; i++) {
      for (int j = 0; j < xb.length; j++) {
        double sigma = sigmaRule.combine(sa[i], sb[j]);
        double epsilon = epsilonRule.combine(ea[i], eb[j]);
        potential += nonbondPotential(dist(xa[i], xb[j]), sigma, epsilon);
      }
    }
    return potential;
  }

  public MixingRule getSigmaRule() {
    return sigmaRule;
  }

  public MixingRule getEpsilonRule() {
    return epsilonRule;
  }
}
