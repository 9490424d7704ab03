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
package spd.potential.bonded;

import static java.lang.String.format;

import java.util.Objects;
import spd.potential.parameters.ElementType;

/**
 * The Atom class represents a single atom and its nonbonded parameters.
 *
 * <p>Atoms are immutable and compare equal when their id and element match. The id is unique
 * within the molecule that owns the atom; an atom moved into a new molecule is copied with a fresh
 * id using {@link #withId(int)}.
 *
 * @since 1.0
 */
public final class Atom {

  /** Unique id within the owning molecule. */
  private final int id;
  /** Element symbol in title case. */
  private final String element;
  /** Covalent radius (Angstroms). */
  private final double radius;
  /** Lennard-Jones sigma (Angstroms). */
  private final double sigma;
  /** Lennard-Jones epsilon (kcal/mol). */
  private final double epsilon;

  /**
   * Create an Atom whose parameters are looked up from the element table.
   *
   * @param id The atom id.
   * @param element The element symbol (any case).
   * @throws IllegalArgumentException If the element has no parameters.
   */
  public Atom(int id, String element) {
    this(id, ElementType.of(element));
  }

  /**
   * Create an Atom of the given element type.
   *
   * @param id The atom id.
   * @param elementType The element type.
   */
  public Atom(int id, ElementType elementType) {
    this(id, elementType.symbol, elementType.radius, elementType.getSigma(),
        elementType.getEpsilon());
  }

  /**
   * Create an Atom with explicit parameters.
   *
   * @param id The atom id.
   * @param element The element symbol.
   * @param radius The covalent radius.
   * @param sigma The Lennard-Jones sigma.
   * @param epsilon The Lennard-Jones epsilon.
   */
  public Atom(int id, String element, double radius, double sigma, double epsilon) {
    this.id = id;
    this.element = ElementType.titleCase(element);
    this.radius = radius;
    this.sigma = sigma;
    this.epsilon = epsilon;
  }

  /**
   * Copy this atom with a new id, keeping its element and parameters.
   *
   * @param newId The new id.
   * @return A new Atom.
   */
  public Atom withId(int newId) {
    return new Atom(newId, element, radius, sigma, epsilon);
  }

  public int getId() {
    return id;
  }

  public String getElement() {
    return element;
  }

  public double getRadius() {
    return radius;
  }

  public double getSigma() {
    return sigma;
  }

  public double getEpsilon() {
    return epsilon;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Atom atom = (Atom) o;
    return id == atom.id && element.equals(atom.element);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(id, element);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%d-%s", id, element);
  }
}
