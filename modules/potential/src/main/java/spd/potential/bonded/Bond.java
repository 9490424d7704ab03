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

/**
 * The Bond class connects two atoms by id.
 *
 * @since 1.0
 */
public final class Bond {

  private final int id;
  private final int atom1;
  private final int atom2;

  /**
   * Bond constructor.
   *
   * @param id The bond id.
   * @param atom1 Id of the first atom.
   * @param atom2 Id of the second atom.
   */
  public Bond(int id, int atom1, int atom2) {
    this.id = id;
    this.atom1 = atom1;
    this.atom2 = atom2;
  }

  /**
   * Copy this bond with new ids.
   *
   * @param newId The new bond id.
   * @param newAtom1 The new id of the first atom.
   * @param newAtom2 The new id of the second atom.
   * @return A new Bond.
   */
  public Bond withIds(int newId, int newAtom1, int newAtom2) {
    return new Bond(newId, newAtom1, newAtom2);
  }

  public int getId() {
    return id;
  }

  public int getAtom1() {
    return atom1;
  }

  public int getAtom2() {
    return atom2;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Bond bond = (Bond) o;
    return id == bond.id && atom1 == bond.atom1 && atom2 == bond.atom2;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, atom1, atom2);
  }

  @Override
  public String toString() {
    return format("%d(%d-%d)", id, atom1, atom2);
  }
}
