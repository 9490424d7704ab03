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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The VectorMath class is a simple math library that operates on 3-coordinate double arrays and
 * 3x3 matrices.
 * <p>
 * All methods are thread-safe.
 *
 * @since 1.0
 */
public final class VectorMath {

  private VectorMath() {
  }

  /**
   * Finds the difference between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the difference a - b.
   */
  public static double[] diff(double[] a, double[] b) {
    return diff(a, b, new double[3]);
  }

  /**
   * Finds the difference between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @param ret Return the difference a - b.
   * @return Returns the difference ret.
   */
  public static double[] diff(double[] a, double[] b, double[] ret) {
    ret[0] = a[0] - b[0];
    ret[1] = a[1] - b[1];
    ret[2] = a[2] - b[2];
    return ret;
  }

  /**
   * Finds the distance between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the distance between vectors a and b.
   */
  public static double dist(double[] a, double[] b) {
    return sqrt(dist2(a, b));
  }

  /**
   * Finds the squared distance between two vectors
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the squared distance between vectors a and b.
   */
  public static double dist2(double[] a, double[] b) {
    var dx = a[0] - b[0];
    var dy = a[1] - b[1];
    var dz = a[2] - b[2];
    return dx * dx + dy * dy + dz * dz;
  }

  /**
   * Finds the dot product between two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the dot product of a and b.
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * Multiply a 3x3 matrix by a column vector.
   *
   * @param m input matrix.
   * @param v input vector.
   * @return Returns the vector product m v.
   */
  public static double[] mat3Vec3(double[][] m, double[] v) {
    return mat3Vec3(m, v, new double[3]);
  }

  /**
   * Multiply a 3x3 matrix by a column vector.
   *
   * @param m input matrix.
   * @param v input vector.
   * @param res the vector product m v.
   * @return Returns the vector res.
   */
  public static double[] mat3Vec3(double[][] m, double[] v, double[] res) {
    res[0] = m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2];
    res[1] = m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2];
    res[2] = m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2];
    return res;
  }

  /**
   * Normalizes a vector.
   *
   * @param n A vector to be normalized.
   * @return Returns the normalized vector.
   */
  public static double[] norm(double[] n) {
    return scalar(n, 1.0 / r(n), new double[3]);
  }

  /**
   * Normalizes a vector.
   *
   * @param n A vector to be normalized.
   * @param ret The normalized vector.
   * @return Returns the normalized vector.
   */
  public static double[] norm(double[] n, double[] ret) {
    return scalar(n, 1.0 / r(n), ret);
  }

  /**
   * Finds the length of a vector.
   *
   * @param d A vector to find the length of.
   * @return Length of vector d.
   */
  public static double r(double[] d) {
    return sqrt(d[0] * d[0] + d[1] * d[1] + d[2] * d[2]);
  }

  /**
   * Build the matrix for a right-handed rotation of <code>angle</code> radians about an arbitrary
   * axis through the origin (Rodrigues' rotation formula). The axis is normalized internally, so
   * only its direction matters.
   *
   * @param axis The rotation axis (need not be of unit length, must be non-zero).
   * @param angle The rotation angle in radians.
   * @return Returns the 3x3 rotation matrix.
   */
  public static double[][] rotationMatrix(double[] axis, double angle) {
    double[] u = norm(axis);
    double ux = u[0];
    double uy = u[1];
    double uz = u[2];
    double c = cos(angle);
    double s = sin(angle);
    double t = 1.0 - c;
    return new double[][] {
        {t * ux * ux + c, t * ux * uy - s * uz, t * ux * uz + s * uy},
        {t * ux * uy + s * uz, t * uy * uy + c, t * uy * uz - s * ux},
        {t * ux * uz - s * uy, t * uy * uz + s * ux, t * uz * uz + c}
    };
  }

  /**
   * Scales a vector.
   *
   * @param n A vector to be scaled.
   * @param a A scalar value.
   * @return Returns the scaled vector.
   */
  public static double[] scalar(double[] n, double a) {
    return scalar(n, a, new double[3]);
  }

  /**
   * Scales a vector.
   *
   * @param n A vector to be scaled.
   * @param a A scalar value.
   * @param ret The scaled vector.
   * @return Returns the array ret.
   */
  public static double[] scalar(double[] n, double a, double[] ret) {
    ret[0] = n[0] * a;
    ret[1] = n[1] * a;
    ret[2] = n[2] * a;
    return ret;
  }

  /**
   * Adds two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @return Returns the sum vector.
   */
  public static double[] sum(double[] a, double[] b) {
    return sum(a, b, new double[3]);
  }

  /**
   * Adds two vectors.
   *
   * @param a First vector.
   * @param b Second vector.
   * @param ret The sum vector.
   * @return Returns the array ret.
   */
  public static double[] sum(double[] a, double[] b, double[] ret) {
    ret[0] = a[0] + b[0];
    ret[1] = a[1] + b[1];
    ret[2] = a[2] + b[2];
    return ret;
  }
}
