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
package spd.potential;

import static java.lang.String.format;
import static spd.numerics.math.VectorMath.diff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import spd.potential.bonded.Atom;
import spd.potential.bonded.Bond;

/**
 * A SupraMolecule is a Molecule made of one or more covalently disconnected components, for
 * example a host and its guests.
 *
 * <p>The components are found once, from the bond graph, when the SupraMolecule is built from atoms
 * and bonds. Coordinate updates keep the known components as they are; call {@link
 * #withRecomputedComponents()} to derive them again from the current positions.
 *
 * <p>A SupraMolecule produced by a conformer search also carries the conformer id and the potential
 * of that conformer.
 *
 * @since 1.0
 */
public class SupraMolecule extends Molecule {

  /** Covalently disconnected components. */
  private final List<Molecule> components;
  /** Conformer id (may be null). */
  private final Integer cid;
  /** Potential of this conformer (may be null). */
  private final Double potential;

  /**
   * Build a SupraMolecule and find its components.
   *
   * @param atoms The atoms.
   * @param bonds The bonds.
   * @param positionMatrix One position per atom.
   */
  public SupraMolecule(List<Atom> atoms, List<Bond> bonds, double[][] positionMatrix) {
    this(atoms, bonds, positionMatrix, null, null);
  }

  /**
   * Build a SupraMolecule carrying conformer data and find its components.
   *
   * @param atoms The atoms.
   * @param bonds The bonds.
   * @param positionMatrix One position per atom.
   * @param cid The conformer id (may be null).
   * @param potential The potential (may be null).
   */
  public SupraMolecule(List<Atom> atoms, List<Bond> bonds, double[][] positionMatrix, Integer cid,
      Double potential) {
    super(atoms, bonds, positionMatrix);
    this.cid = cid;
    this.potential = potential;
    this.components = defineComponents();
  }

  /** Assemble from known components without searching the bond graph. */
  private SupraMolecule(List<Atom> atoms, List<Bond> bonds, double[][] positionMatrix,
      List<Molecule> components, Integer cid, Double potential) {
    super(atoms, bonds, positionMatrix);
    this.cid = cid;
    this.potential = potential;
    this.components = Collections.unmodifiableList(new ArrayList<>(components));
  }

  /** Clone with new positions, components and conformer data. */
  private SupraMolecule(SupraMolecule template, double[][] positions, List<Molecule> components,
      Integer cid, Double potential) {
    super(template, positions);
    this.cid = cid;
    this.potential = potential;
    this.components = components;
  }

  /**
   * Concatenate molecules into a single SupraMolecule.
   *
   * <p>Atoms and bonds are renumbered contiguously from 0 in the order given, bond endpoints are
   * mapped to the new atom ids and atom parameters are kept. The supplied molecules become the
   * components as they are.
   *
   * @param components The molecules to combine.
   * @param cid The conformer id (may be null).
   * @param potential The potential (may be null).
   * @return The combined SupraMolecule.
   * @throws IllegalArgumentException If no components are given.
   */
  public static SupraMolecule initFromComponents(List<? extends Molecule> components, Integer cid,
      Double potential) {
    if (components == null || components.isEmpty()) {
      throw new IllegalArgumentException(" At least one component is required.");
    }
    List<Atom> atoms = new ArrayList<>();
    List<Bond> bonds = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    int atomCount = 0;
    int bondCount = 0;
    for (Molecule component : components) {
      Map<Integer, Integer> idMap = new HashMap<>();
      for (Atom atom : component.getAtoms()) {
        idMap.put(atom.getId(), atomCount);
        atoms.add(atom.withId(atomCount++));
      }
      for (Bond bond : component.getBonds()) {
        bonds.add(bond.withIds(bondCount++, idMap.get(bond.getAtom1()),
            idMap.get(bond.getAtom2())));
      }
      rows.addAll(Arrays.asList(component.positions));
    }
    return new SupraMolecule(atoms, bonds, rows.toArray(new double[0][]),
        new ArrayList<>(components), cid, potential);
  }

  /**
   * Partition the atoms by the connected components of the bond graph. Each search is seeded by
   * the first unassigned atom in stored order.
   *
   * @return The components.
   */
  private List<Molecule> defineComponents() {
    int nAtoms = atoms.size();
    List<List<Integer>> neighbors = new ArrayList<>(nAtoms);
    for (int i = 0; i < nAtoms; i++) {
      neighbors.add(new ArrayList<>());
    }
    for (Bond bond : bonds) {
      int row1 = getRow(bond.getAtom1());
      int row2 = getRow(bond.getAtom2());
      neighbors.get(row1).add(row2);
      neighbors.get(row2).add(row1);
    }

    int[] label = new int[nAtoms];
    Arrays.fill(label, -1);
    int nComponents = 0;
    Deque<Integer> stack = new ArrayDeque<>();
    for (int seed = 0; seed < nAtoms; seed++) {
      if (label[seed] >= 0) {
        continue;
      }
      label[seed] = nComponents;
      stack.push(seed);
      while (!stack.isEmpty()) {
        int row = stack.pop();
        for (int next : neighbors.get(row)) {
          if (label[next] < 0) {
            label[next] = nComponents;
            stack.push(next);
          }
        }
      }
      nComponents++;
    }

    List<List<Atom>> componentAtoms = new ArrayList<>(nComponents);
    List<List<Bond>> componentBonds = new ArrayList<>(nComponents);
    List<List<double[]>> componentRows = new ArrayList<>(nComponents);
    for (int c = 0; c < nComponents; c++) {
      componentAtoms.add(new ArrayList<>());
      componentBonds.add(new ArrayList<>());
      componentRows.add(new ArrayList<>());
    }
    for (int i = 0; i < nAtoms; i++) {
      componentAtoms.get(label[i]).add(atoms.get(i));
      componentRows.get(label[i]).add(positions[i]);
    }
    // Both endpoints of a bond always share a label.
    for (Bond bond : bonds) {
      componentBonds.get(label[getRow(bond.getAtom1())]).add(bond);
    }

    List<Molecule> found = new ArrayList<>(nComponents);
    for (int c = 0; c < nComponents; c++) {
      found.add(new Molecule(componentAtoms.get(c), componentBonds.get(c),
          componentRows.get(c).toArray(new double[0][])));
    }
    return Collections.unmodifiableList(found);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The components are kept as they were; they are not resliced from the new positions.
   */
  @Override
  public SupraMolecule withPositionMatrix(double[][] positionMatrix) {
    return new SupraMolecule(this, copyPositions(positionMatrix, atoms.size()), components, cid,
        potential);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Each component is displaced by the same vector.
   */
  @Override
  public SupraMolecule withDisplacement(double[] displacement) {
    List<Molecule> moved = new ArrayList<>(components.size());
    for (Molecule component : components) {
      moved.add(component.withDisplacement(displacement));
    }
    return new SupraMolecule(this, displace(positions, displacement),
        Collections.unmodifiableList(moved), cid, potential);
  }

  /** {@inheritDoc} */
  @Override
  public SupraMolecule withCentroid(double[] centroid) {
    return withDisplacement(diff(centroid, getCentroid()));
  }

  /**
   * {@inheritDoc}
   *
   * <p>Each component is rotated by the same operation.
   */
  @Override
  public SupraMolecule withRotation(double angle, double[] axis, double[] origin) {
    List<Molecule> moved = new ArrayList<>(components.size());
    for (Molecule component : components) {
      moved.add(component.withRotation(angle, axis, origin));
    }
    return new SupraMolecule(this, rotate(positions, angle, axis, origin),
        Collections.unmodifiableList(moved), cid, potential);
  }

  /**
   * Derive the components again from the current atoms, bonds and positions.
   *
   * @return A new SupraMolecule with fresh components and the same conformer data.
   */
  public SupraMolecule withRecomputedComponents() {
    return new SupraMolecule(atoms, bonds, positions, cid, potential);
  }

  /**
   * Replace one component and reassemble the SupraMolecule.
   *
   * @param index Index of the component to replace.
   * @param replacement The new component.
   * @return A new SupraMolecule without conformer data.
   * @throws IllegalArgumentException If the index is out of range.
   */
  public SupraMolecule withComponent(int index, Molecule replacement) {
    if (index < 0 || index >= components.size()) {
      throw new IllegalArgumentException(
          format(" Component %d is out of range [0, %d).", index, components.size()));
    }
    List<Molecule> updated = new ArrayList<>(components);
    updated.set(index, replacement);
    return initFromComponents(updated, null, null);
  }

  /**
   * Clone this SupraMolecule with new conformer data.
   *
   * @param newCid The conformer id.
   * @param newPotential The potential.
   * @return A new SupraMolecule.
   */
  public SupraMolecule withConformerData(Integer newCid, Double newPotential) {
    return new SupraMolecule(this, positions, components, newCid, newPotential);
  }

  /**
   * Returns the components.
   *
   * @return An unmodifiable list, the same on every call.
   */
  public List<Molecule> getComponents() {
    return components;
  }

  public Molecule getComponent(int index) {
    return components.get(index);
  }

  public int getNumComponents() {
    return components.size();
  }

  public Integer getCid() {
    return cid;
  }

  public Double getPotential() {
    return potential;
  }

  /** {@inheritDoc} */
  @Override
  public String getXYZComment() {
    if (cid == null && potential == null) {
      return "";
    }
    return format("cid:%s, pot:%s", cid, potential);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s with %d components", super.toString(), components.size());
  }
}
