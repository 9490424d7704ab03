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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;
import spd.potential.bonded.Atom;
import spd.utilities.SpdTest;

/**
 * Test element lookup and the parameters derived from it.
 */
public class ElementTypeTest extends SpdTest {

  @Test
  public void testLookupIgnoresCase() {
    assertSame(ElementType.CL, ElementType.of("CL"));
    assertSame(ElementType.CL, ElementType.of("cl"));
    assertSame(ElementType.CL, ElementType.of(" Cl "));
    assertEquals("Cl", ElementType.titleCase("cL"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownElement() {
    ElementType.of("Qq");
  }

  @Test
  public void testSigmaPlacesMinimumAtVdwDistance() {
    ElementType carbon = ElementType.C;
    assertEquals(carbon.vdwDistance, carbon.getSigma() * ElementType.LJ_MINIMUM_RATIO, 1.0e-12);
    assertEquals(0.105, carbon.getEpsilon(), 0.0);
  }

  @Test
  public void testAtomParameters() {
    Atom atom = new Atom(3, "o");
    assertEquals("O", atom.getElement());
    assertEquals(ElementType.O.radius, atom.getRadius(), 0.0);
    assertEquals(ElementType.O.getSigma(), atom.getSigma(), 0.0);
    assertEquals(ElementType.O.getEpsilon(), atom.getEpsilon(), 0.0);

    Atom renumbered = new Atom(3, "X", 1.0, 2.0, 3.0).withId(8);
    assertEquals(8, renumbered.getId());
    assertEquals(1.0, renumbered.getRadius(), 0.0);
    assertEquals(2.0, renumbered.getSigma(), 0.0);
    assertEquals(3.0, renumbered.getEpsilon(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAtomWithUnknownElement() {
    new Atom(0, "Zz");
  }
}
