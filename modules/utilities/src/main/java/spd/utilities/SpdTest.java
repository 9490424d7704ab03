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

import static java.lang.String.format;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * Base class for SpinDry tests.
 *
 * <p>While a test class runs, the "spd" loggers use the level named by the
 * <code>spd.test.log</code> system property (WARNING if unset). System properties changed by a
 * test are put back before the next one, and a test may ask for a scratch directory that is
 * removed when it finishes.
 */
public abstract class SpdTest {

  protected static final Logger logger = Logger.getLogger(SpdTest.class.getName());

  /** Level in effect outside of tests, from spd.log. */
  private static final Level runLevel = levelOf("spd.log", Level.INFO);
  /** Level used while tests run, from spd.test.log. */
  private static final Level testLevel = levelOf("spd.test.log", Level.WARNING);

  private Properties savedProperties;
  private Path scratch = null;

  /**
   * Read a logging level from a system property.
   *
   * @param key The property name.
   * @param fallback Level used when the property is unset or not a level name.
   * @return The level.
   */
  private static Level levelOf(String key, Level fallback) {
    String value = System.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Level.parse(value.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Ignoring %s=%s: %s", key, value, e.getMessage()));
      return fallback;
    }
  }

  @BeforeClass
  public static void setTestLogLevel() {
    Logger.getLogger("spd").setLevel(testLevel);
    logger.setLevel(testLevel);
  }

  @AfterClass
  public static void restoreLogLevel() {
    Logger.getLogger("spd").setLevel(runLevel);
    logger.setLevel(runLevel);
  }

  @Before
  public void saveSystemProperties() {
    savedProperties = new Properties();
    savedProperties.putAll(System.getProperties());
  }

  @After
  public void restoreSystemProperties() {
    System.setProperties(savedProperties);
    removeScratch();
  }

  /**
   * Create a scratch directory for the current test. A previous one is removed first.
   *
   * @return The new directory.
   */
  public Path registerTemporaryDirectory() {
    removeScratch();
    try {
      scratch = Files.createTempDirectory("spd-test");
    } catch (IOException e) {
      fail(format(" No scratch directory: %s", e.getMessage()));
    }
    return scratch;
  }

  private void removeScratch() {
    if (scratch == null) {
      return;
    }
    try {
      FileUtils.deleteDirectory(scratch.toFile());
    } catch (IOException e) {
      fail(format(" Could not remove %s: %s", scratch, e.getMessage()));
    }
    scratch = null;
  }
}
