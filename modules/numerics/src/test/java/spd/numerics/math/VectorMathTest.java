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
package spd.numerics.math;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static spd.numerics.math.VectorMath.dist;
import static spd.numerics.math.VectorMath.dot;
import static spd.numerics.math.VectorMath.mat3Vec3;
import static spd.numerics.math.VectorMath.norm;
import static spd.numerics.math.VectorMath.r;
import static spd.numerics.math.VectorMath.rotationMatrix;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import spd.utilities.SpdTest;

/**
 * Test the arbitrary-axis rotation matrix against known rotations.
 */
@RunWith(Parameterized.class)
public class VectorMathTest extends SpdTest {

  private static final double TOL = 1.0e-12;

  private final String info;
  private final double[] axis;
  private final double angle;
  private final double[] vector;
  private final double[] expected;

  public VectorMathTest(String info, double[] axis, double angle, double[] vector,
      double[] expected) {
    this.info = info;
    this.axis = axis;
    this.angle = angle;
    this.vector = vector;
    this.expected = expected;
  }

  @Parameterized.Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"Quarter turn about z", new double[] {0, 0, 1}, PI / 2,
                new double[] {1, 0, 0}, new double[] {0, 1, 0}},
            {"Half turn about x", new double[] {1, 0, 0}, PI,
                new double[] {0, 1, 0}, new double[] {0, -1, 0}},
            {"Unnormalized axis", new double[] {0, 5, 0}, PI / 2,
                new double[] {0, 0, 1}, new double[] {1, 0, 0}},
            {"Third turn about body diagonal", new double[] {1, 1, 1}, 2 * PI / 3,
                new double[] {1, 0, 0}, new double[] {0, 1, 0}},
            {"Vector on axis", new double[] {2, 2, 0}, 1.234,
                new double[] {1, 1, 0}, new double[] {1, 1, 0}},
            {"Zero angle", new double[] {0.3, 0.1, 0.7}, 0.0,
                new double[] {-2, 4, 1}, new double[] {-2, 4, 1}}
        });
  }

  @Test
  public void testRotation() {
    double[] rotated = mat3Vec3(rotationMatrix(axis, angle), vector);
    assertArrayEquals(info, expected, rotated, TOL);
  }

  @Test
  public void testRotationIsRigid() {
    double[][] m = rotationMatrix(axis, angle);
    double[] a = {1.5, -0.25, 3.0};
    double[] b = {-0.5, 2.0, 0.125};
    assertEquals(info, dist(a, b), dist(mat3Vec3(m, a), mat3Vec3(m, b)), TOL);
    // Columns of a rotation matrix are orthonormal.
    for (int i = 0; i < 3; i++) {
      double[] ci = {m[0][i], m[1][i], m[2][i]};
      assertEquals(info, 1.0, r(ci), TOL);
      for (int j = i + 1; j < 3; j++) {
        double[] cj = {m[0][j], m[1][j], m[2][j]};
        assertEquals(info, 0.0, dot(ci, cj), TOL);
      }
    }
    assertEquals(info, 1.0, r(norm(axis)), TOL);
  }
}
