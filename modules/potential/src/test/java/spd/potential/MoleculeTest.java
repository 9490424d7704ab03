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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import spd.potential.bonded.Atom;
import spd.potential.bonded.Bond;
import spd.utilities.SpdTest;

/**
 * Test Molecule geometry and coordinate transforms.
 */
public class MoleculeTest extends SpdTest {

  private static final double TOL = 1.0e-12;

  /** Two carbon triples, one at y = 1 and one at y = 10. */
  private static Molecule twoTriples() {
    List<Atom> atoms = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      atoms.add(new Atom(i, "C"));
    }
    List<Bond> bonds = Arrays.asList(new Bond(0, 0, 1), new Bond(1, 0, 2), new Bond(2, 3, 4),
        new Bond(3, 3, 5));
    double[][] positions = {
        {0, 1, 0}, {1, 1, 0}, {-1, 1, 0}, {0, 10, 0}, {1, 10, 0}, {-1, 10, 0}};
    return new Molecule(atoms, bonds, positions);
  }

  private static void assertMatrixEquals(double[][] expected, double[][] actual) {
    assertEquals(expected.length, actual.length);
    for (int i = 0; i < expected.length; i++) {
      assertArrayEquals(expected[i], actual[i], TOL);
    }
  }

  @Test
  public void testCentroid() {
    Molecule molecule = twoTriples();
    assertArrayEquals(new double[] {0, 5.5, 0}, molecule.getCentroid(), TOL);
    assertArrayEquals(new double[] {0, 1, 0}, molecule.getCentroid(Arrays.asList(0, 1, 2)), TOL);
    assertArrayEquals(new double[] {-1, 10, 0}, molecule.getPosition(5), 0.0);
  }

  @Test
  public void testCentroidIgnoresRepeatedIds() {
    Molecule molecule = twoTriples();
    // Atoms 1 and 3 average to (0.5, 5.5, 0) however often they are listed.
    assertArrayEquals(new double[] {0.5, 5.5, 0},
        molecule.getCentroid(Arrays.asList(1, 3, 3, 3)), TOL);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCentroidOfEmptySubset() {
    twoTriples().getCentroid(Collections.emptyList());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCentroidOfUnknownAtom() {
    twoTriples().getCentroid(Arrays.asList(0, 42));
  }

  @Test
  public void testPositionMatrixRoundTrip() {
    Molecule molecule = twoTriples();
    double[][] matrix = molecule.getPositionMatrix();
    matrix[2][1] = -7.0;
    Molecule moved = molecule.withPositionMatrix(matrix);
    assertMatrixEquals(matrix, moved.getPositionMatrix());
    // The original is untouched and the atom list is shared.
    assertEquals(1.0, molecule.getPosition(2)[1], 0.0);
    assertSame(molecule.getAtoms(), moved.getAtoms());
    assertSame(molecule.getBonds(), moved.getBonds());

    // The caller's array is copied.
    matrix[0][0] = 99.0;
    assertEquals(0.0, moved.getPosition(0)[0], 0.0);
    assertNotSame(moved.getPositionMatrix(), moved.getPositionMatrix());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPositionMatrixWithWrongRowCount() {
    twoTriples().withPositionMatrix(new double[5][3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPositionMatrixWithWrongColumnCount() {
    twoTriples().withPositionMatrix(new double[6][2]);
  }

  @Test
  public void testDisplacement() {
    Molecule molecule = twoTriples();
    double[] v = {0.5, -2.0, 3.25};
    double[][] expected = molecule.getPositionMatrix();
    for (double[] row : expected) {
      for (int k = 0; k < 3; k++) {
        row[k] += v[k];
      }
    }
    assertMatrixEquals(expected, molecule.withDisplacement(v).getPositionMatrix());
  }

  @Test
  public void testWithCentroid() {
    Molecule moved = twoTriples().withCentroid(new double[] {1, 2, 3});
    assertArrayEquals(new double[] {1, 2, 3}, moved.getCentroid(), TOL);
    assertArrayEquals(new double[] {1, -2.5, 3}, moved.getPosition(0), TOL);
  }

  @Test
  public void testRotationAboutCentroid() {
    Molecule molecule = twoTriples();
    double[] centroid = molecule.getCentroid();
    Molecule rotated = molecule.withRotation(PI / 2, new double[] {0, 0, 1}, centroid);
    assertArrayEquals(centroid, rotated.getCentroid(), TOL);
    // (0, 1, 0) is 4.5 below the centroid; a quarter turn about z moves it to +x.
    assertArrayEquals(new double[] {4.5, 5.5, 0}, rotated.getPosition(0), TOL);
  }

  @Test
  public void testCounts() {
    Molecule molecule = twoTriples();
    assertEquals(6, molecule.getNumAtoms());
    assertEquals(4, molecule.getNumBonds());
    assertEquals("", molecule.getXYZComment());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testAtomsAreUnmodifiable() {
    twoTriples().getAtoms().add(new Atom(6, "H"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateAtomIds() {
    new Molecule(Arrays.asList(new Atom(0, "H"), new Atom(0, "H")), Collections.emptyList(),
        new double[2][3]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBondToUnknownAtom() {
    new Molecule(Arrays.asList(new Atom(0, "H"), new Atom(1, "H")),
        Collections.singletonList(new Bond(0, 0, 2)), new double[2][3]);
  }
}
