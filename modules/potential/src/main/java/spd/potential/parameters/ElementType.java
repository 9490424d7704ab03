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
package spd.potential.parameters;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.pow;

import java.util.HashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Element parameters used to size atoms in nonbonded potentials.
 *
 * <p>The radius is the single-bond covalent radius (Angstroms). The van der Waals distance and well
 * depth are the UFF homonuclear values (Angstroms and kcal/mol); sigma is the Lennard-Jones length
 * that places the minimum of a homonuclear 12-6 pair at the van der Waals distance.
 *
 * @since 1.0
 */
public enum ElementType {
  H("H", 0.31, 2.886, 0.044),
  HE("He", 0.28, 2.362, 0.056),
  LI("Li", 1.28, 2.451, 0.025),
  BE("Be", 0.96, 2.745, 0.085),
  B("B", 0.84, 4.083, 0.180),
  C("C", 0.76, 3.851, 0.105),
  N("N", 0.71, 3.660, 0.069),
  O("O", 0.66, 3.500, 0.060),
  F("F", 0.57, 3.364, 0.050),
  NE("Ne", 0.58, 3.243, 0.042),
  NA("Na", 1.66, 2.983, 0.030),
  MG("Mg", 1.41, 3.021, 0.111),
  AL("Al", 1.21, 4.499, 0.505),
  SI("Si", 1.11, 4.295, 0.402),
  P("P", 1.07, 4.147, 0.305),
  S("S", 1.05, 4.035, 0.274),
  CL("Cl", 1.02, 3.947, 0.227),
  AR("Ar", 1.06, 3.868, 0.185),
  K("K", 2.03, 3.812, 0.035),
  CA("Ca", 1.76, 3.399, 0.238),
  SC("Sc", 1.70, 3.295, 0.019),
  TI("Ti", 1.60, 3.175, 0.017),
  V("V", 1.53, 3.144, 0.016),
  CR("Cr", 1.39, 3.023, 0.015),
  MN("Mn", 1.39, 2.961, 0.013),
  FE("Fe", 1.32, 2.912, 0.013),
  CO("Co", 1.26, 2.872, 0.014),
  NI("Ni", 1.24, 2.834, 0.015),
  CU("Cu", 1.32, 3.495, 0.005),
  ZN("Zn", 1.22, 2.763, 0.124),
  GA("Ga", 1.22, 4.383, 0.415),
  GE("Ge", 1.20, 4.280, 0.379),
  AS("As", 1.19, 4.230, 0.309),
  SE("Se", 1.20, 4.205, 0.291),
  BR("Br", 1.20, 4.189, 0.251),
  KR("Kr", 1.16, 4.141, 0.220),
  RU("Ru", 1.46, 2.963, 0.056),
  RH("Rh", 1.42, 2.929, 0.053),
  PD("Pd", 1.39, 2.899, 0.048),
  AG("Ag", 1.45, 3.148, 0.036),
  CD("Cd", 1.44, 2.848, 0.228),
  SN("Sn", 1.39, 4.392, 0.567),
  I("I", 1.39, 4.500, 0.339),
  XE("Xe", 1.40, 4.404, 0.332),
  IR("Ir", 1.41, 2.530, 0.073),
  PT("Pt", 1.36, 2.454, 0.080),
  AU("Au", 1.36, 2.934, 0.039),
  HG("Hg", 1.32, 2.705, 0.385),
  PB("Pb", 1.46, 4.297, 0.663);

  /** Ratio of the Lennard-Jones minimum to sigma, 2^(1/6). */
  public static final double LJ_MINIMUM_RATIO = pow(2.0, 1.0 / 6.0);

  private static final Map<String, ElementType> symbolMap = new HashMap<>();

  static {
    for (ElementType elementType : values()) {
      symbolMap.put(elementType.symbol, elementType);
    }
  }

  /** The element symbol in title case. */
  public final String symbol;

  /** Covalent radius in Angstroms. */
  public final double radius;

  /** UFF van der Waals distance in Angstroms. */
  public final double vdwDistance;

  /** UFF well depth in kcal/mol. */
  public final double wellDepth;

  ElementType(String symbol, double radius, double vdwDistance, double wellDepth) {
    this.symbol = symbol;
    this.radius = radius;
    this.vdwDistance = vdwDistance;
    this.wellDepth = wellDepth;
  }

  /**
   * Normalize an element symbol to title case (e.g. "CL" and "cl" become "Cl").
   *
   * @param symbol The element symbol.
   * @return The title case symbol.
   */
  public static String titleCase(String symbol) {
    return StringUtils.capitalize(StringUtils.lowerCase(StringUtils.trim(symbol)));
  }

  /**
   * Look up an element by symbol, ignoring case.
   *
   * @param symbol The element symbol.
   * @return The matching ElementType.
   * @throws IllegalArgumentException If the symbol is not a known element.
   */
  public static ElementType of(String symbol) {
    ElementType elementType = (symbol == null) ? null : symbolMap.get(titleCase(symbol));
    if (elementType == null) {
      throw new IllegalArgumentException(format(" No parameters are defined for element %s.", symbol));
    }
    return elementType;
  }

  /**
   * Lennard-Jones sigma for this element.
   *
   * @return sigma in Angstroms.
   */
  public double getSigma() {
    return vdwDistance / LJ_MINIMUM_RATIO;
  }

  /**
   * Lennard-Jones epsilon for this element.
   *
   * @return epsilon in kcal/mol.
   */
  public double getEpsilon() {
    return wellDepth;
  }
}
