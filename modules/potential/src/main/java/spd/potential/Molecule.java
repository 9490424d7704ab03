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
import static spd.numerics.math.VectorMath.mat3Vec3;
import static spd.numerics.math.VectorMath.rotationMatrix;
import static spd.numerics.math.VectorMath.sum;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import spd.potential.bonded.Atom;
import spd.potential.bonded.Bond;
import spd.potential.parsers.XYZFilter;

/**
 * The Molecule class holds a set of atoms, the bonds between them and one Cartesian position per
 * atom.
 *
 * <p>Row <code>i</code> of the position matrix belongs to the <code>i</code>-th atom in stored
 * order. Ids are usually 0..n-1, but molecules carved out of a larger structure keep the ids of
 * their parent, so lookups by id go through an id to row index.
 *
 * <p>Molecules are immutable. Every transform returns a new instance that shares the atom and bond
 * lists and owns a new position matrix.
 *
 * @since 1.0
 */
public class Molecule {

  /** Atoms in stored order. */
  protected final List<Atom> atoms;
  /** Bonds between atoms of this molecule. */
  protected final List<Bond> bonds;
  /** Positions, one row per atom. */
  protected final double[][] positions;
  /** Atom id to row. */
  private final Map<Integer, Integer> rowIndex;

  /**
   * Molecule constructor.
   *
   * @param atoms The atoms.
   * @param bonds The bonds; both endpoints must be atoms of this molecule.
   * @param positionMatrix One position per atom.
   * @throws IllegalArgumentException If ids repeat, a bond references an unknown atom, or the
   *     position matrix shape does not match the atoms.
   */
  public Molecule(List<Atom> atoms, List<Bond> bonds, double[][] positionMatrix) {
    this.atoms = Collections.unmodifiableList(new ArrayList<>(atoms));
    this.bonds = Collections.unmodifiableList(new ArrayList<>(bonds));
    this.rowIndex = buildRowIndex(this.atoms);
    for (Bond bond : this.bonds) {
      if (!rowIndex.containsKey(bond.getAtom1()) || !rowIndex.containsKey(bond.getAtom2())) {
        throw new IllegalArgumentException(
            format(" Bond %s references an atom that is not in the molecule.", bond));
      }
    }
    this.positions = copyPositions(positionMatrix, this.atoms.size());
  }

  /**
   * Clone a molecule with new positions. The caller hands over ownership of the positions array,
   * which must already have the right shape.
   *
   * @param template The molecule whose atoms and bonds are shared.
   * @param positions The new positions.
   */
  protected Molecule(Molecule template, double[][] positions) {
    this.atoms = template.atoms;
    this.bonds = template.bonds;
    this.rowIndex = template.rowIndex;
    this.positions = positions;
  }

  /**
   * Copy a position matrix after checking that it has one row of three coordinates per atom.
   *
   * @param positionMatrix The matrix to copy.
   * @param nAtoms The expected number of rows.
   * @return A deep copy.
   */
  protected static double[][] copyPositions(double[][] positionMatrix, int nAtoms) {
    if (positionMatrix == null || positionMatrix.length != nAtoms) {
      throw new IllegalArgumentException(format(" Expected a position matrix with %d rows, found %s.",
          nAtoms, positionMatrix == null ? "null" : Integer.toString(positionMatrix.length)));
    }
    double[][] copy = new double[nAtoms][];
    for (int i = 0; i < nAtoms; i++) {
      if (positionMatrix[i] == null || positionMatrix[i].length != 3) {
        throw new IllegalArgumentException(
            format(" Row %d of the position matrix does not hold 3 coordinates.", i));
      }
      copy[i] = positionMatrix[i].clone();
    }
    return copy;
  }

  private static Map<Integer, Integer> buildRowIndex(List<Atom> atoms) {
    Map<Integer, Integer> index = new HashMap<>();
    for (int i = 0; i < atoms.size(); i++) {
      int id = atoms.get(i).getId();
      if (index.put(id, i) != null) {
        throw new IllegalArgumentException(format(" Atom id %d is used more than once.", id));
      }
    }
    return index;
  }

  /**
   * The row of the position matrix that belongs to an atom.
   *
   * @param atomId The atom id.
   * @return The row index.
   * @throws IllegalArgumentException If the atom is not part of this molecule.
   */
  protected int getRow(int atomId) {
    Integer row = rowIndex.get(atomId);
    if (row == null) {
      throw new IllegalArgumentException(format(" Atom %d is not part of this molecule.", atomId));
    }
    return row;
  }

  /**
   * Returns a deep copy of the position matrix.
   *
   * @return One row per atom in stored order.
   */
  public double[][] getPositionMatrix() {
    double[][] copy = new double[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      copy[i] = positions[i].clone();
    }
    return copy;
  }

  /**
   * Position of a single atom.
   *
   * @param atomId The atom id.
   * @return A copy of the atom's position.
   */
  public double[] getPosition(int atomId) {
    return positions[getRow(atomId)].clone();
  }

  /**
   * Clone this molecule with a new position matrix.
   *
   * @param positionMatrix One row of three coordinates per atom.
   * @return A new Molecule.
   * @throws IllegalArgumentException If the matrix shape does not match the atoms.
   */
  public Molecule withPositionMatrix(double[][] positionMatrix) {
    return new Molecule(this, copyPositions(positionMatrix, atoms.size()));
  }

  /**
   * Clone this molecule with every atom shifted by the same vector.
   *
   * @param displacement The displacement vector.
   * @return A new Molecule.
   */
  public Molecule withDisplacement(double[] displacement) {
    return new Molecule(this, displace(positions, displacement));
  }

  /**
   * Clone this molecule translated so that its centroid sits at the given position.
   *
   * @param centroid The new centroid.
   * @return A new Molecule.
   */
  public Molecule withCentroid(double[] centroid) {
    return withDisplacement(diff(centroid, getCentroid()));
  }

  /**
   * Clone this molecule rigidly rotated about an axis through an origin.
   *
   * @param angle Rotation angle in radians.
   * @param axis Rotation axis (need not be normalized).
   * @param origin A point on the axis.
   * @return A new Molecule.
   */
  public Molecule withRotation(double angle, double[] axis, double[] origin) {
    return new Molecule(this, rotate(positions, angle, axis, origin));
  }

  /**
   * Shift every row of a matrix by a vector.
   *
   * @param matrix The positions.
   * @param displacement The shift.
   * @return A new matrix.
   */
  protected static double[][] displace(double[][] matrix, double[] displacement) {
    if (displacement == null || displacement.length != 3) {
      throw new IllegalArgumentException(" A displacement must have 3 components.");
    }
    double[][] moved = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      moved[i] = sum(matrix[i], displacement);
    }
    return moved;
  }

  /**
   * Rotate every row of a matrix about an axis through an origin.
   *
   * @param matrix The positions.
   * @param angle Rotation angle in radians.
   * @param axis Rotation axis.
   * @param origin A point on the axis.
   * @return A new matrix.
   */
  protected static double[][] rotate(double[][] matrix, double angle, double[] axis,
      double[] origin) {
    double[][] rot = rotationMatrix(axis, angle);
    double[][] moved = new double[matrix.length][];
    double[] work = new double[3];
    for (int i = 0; i < matrix.length; i++) {
      diff(matrix[i], origin, work);
      moved[i] = sum(mat3Vec3(rot, work), origin);
    }
    return moved;
  }

  /**
   * Centroid of all atoms.
   *
   * @return The mean position.
   * @throws IllegalArgumentException If the molecule has no atoms.
   */
  public double[] getCentroid() {
    if (positions.length == 0) {
      throw new IllegalArgumentException(" The centroid of an empty molecule is undefined.");
    }
    double[] centroid = new double[3];
    for (double[] position : positions) {
      sum(centroid, position, centroid);
    }
    for (int i = 0; i < 3; i++) {
      centroid[i] /= positions.length;
    }
    return centroid;
  }

  /**
   * Centroid of a subset of atoms. Repeated ids count once.
   *
   * @param atomIds Ids of the atoms to average over.
   * @return The mean position.
   * @throws IllegalArgumentException If the subset is empty or names an unknown atom.
   */
  public double[] getCentroid(Collection<Integer> atomIds) {
    if (atomIds == null || atomIds.isEmpty()) {
      throw new IllegalArgumentException(" The centroid of an empty atom subset is undefined.");
    }
    Set<Integer> subset = new LinkedHashSet<>(atomIds);
    double[] centroid = new double[3];
    for (int id : subset) {
      sum(centroid, positions[getRow(id)], centroid);
    }
    for (int i = 0; i < 3; i++) {
      centroid[i] /= subset.size();
    }
    return centroid;
  }

  /**
   * Returns the atoms in stored order.
   *
   * @return An unmodifiable list.
   */
  public List<Atom> getAtoms() {
    return atoms;
  }

  /**
   * Returns the bonds.
   *
   * @return An unmodifiable list.
   */
  public List<Bond> getBonds() {
    return bonds;
  }

  public int getNumAtoms() {
    return atoms.size();
  }

  public int getNumBonds() {
    return bonds.size();
  }

  /**
   * The comment line used when this molecule is written in XYZ format.
   *
   * @return The comment (blank for a plain molecule).
   */
  public String getXYZComment() {
    return "";
  }

  /**
   * Serialize this molecule in XYZ format.
   *
   * @return The XYZ text.
   */
  public String getXYZContent() {
    return XYZFilter.toXYZString(this);
  }

  /**
   * Write this molecule to an XYZ file, replacing any existing content.
   *
   * @param file The destination.
   * @throws IOException If the file cannot be written.
   */
  public void writeXYZFile(File file) throws IOException {
    new XYZFilter(file).writeFile(this, false);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s with %d atoms and %d bonds", getClass().getSimpleName(), atoms.size(),
        bonds.size());
  }
}
