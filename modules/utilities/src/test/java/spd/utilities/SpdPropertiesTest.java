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
package spd.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test the precedence of the layered SpinDry configuration.
 */
public class SpdPropertiesTest extends SpdTest {

  @Test
  public void testStructurePropertiesAreRead() throws IOException {
    Path dir = registerTemporaryDirectory();
    File structure = dir.resolve("host.xyz").toFile();
    File propertyFile = dir.resolve("host.properties").toFile();
    FileUtils.writeLines(propertyFile, StandardCharsets.UTF_8.name(),
        Arrays.asList("step-size = 0.25", "num-conformers = 3"));

    CompositeConfiguration properties = SpdProperties.loadProperties(structure);
    assertEquals(0.25, properties.getDouble("step-size", 0.5), 0.0);
    assertEquals(3, properties.getInt("num-conformers", 50));
    assertTrue(properties.containsKey("propertyFile"));
  }

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    Path dir = registerTemporaryDirectory();
    File structure = dir.resolve("guest.xyz").toFile();
    File propertyFile = dir.resolve("guest.properties").toFile();
    FileUtils.writeLines(propertyFile, StandardCharsets.UTF_8.name(),
        Arrays.asList("num-conformers = 3"));

    System.setProperty("num-conformers", "7");
    CompositeConfiguration properties = SpdProperties.loadProperties(structure);
    assertEquals(7, properties.getInt("num-conformers", 50));
  }

  @Test
  public void testDefaultsWithoutStructureFile() {
    CompositeConfiguration properties = SpdProperties.loadProperties(null);
    assertFalse(properties.containsKey("propertyFile"));
    assertEquals(2.0, properties.getDouble("spd.undefined.beta", 2.0), 0.0);
  }
}
