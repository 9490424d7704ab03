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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * The SpdProperties class assembles the layered configuration used by SpinDry commands.
 *
 * @since 1.0
 */
public final class SpdProperties {

  private static final Logger logger = Logger.getLogger(SpdProperties.class.getName());

  /** Environment variable naming a system wide property file. */
  public static final String SPD_PROPERTIES = "SPD_PROPERTIES";

  private SpdProperties() {
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Structure specific properties (for example host.properties)
   * <p>
   * 3.) User specific properties (~/.spd/spd.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable SPD_PROPERTIES)
   *
   * @param file The structure file whose basename locates structure specific properties (may be
   *     null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties are read first.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Structure specific options are 2nd.
    if (file != null) {
      String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
      String propertyFilename =
          (new File(structureBasename + ".properties").exists()) ? structureBasename + ".properties"
              : (new File(structureBasename + ".prop").exists()) ? structureBasename + ".prop"
                  : null;
      if (propertyFilename != null) {
        File structurePropFile = new File(propertyFilename);
        PropertiesConfiguration structureConfiguration =
            readPropertyFile(structurePropFile, "Structure properties from (" + propertyFilename + ").");
        if (structureConfiguration != null) {
          properties.addConfiguration(structureConfiguration);
          try {
            properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Error resolving {0}.", propertyFilename);
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".spd" + File.separator
        + "spd.properties";
    PropertiesConfiguration userConfiguration =
        readPropertyFile(new File(filename), "SpinDry user property file (" + filename + ").");
    if (userConfiguration != null) {
      properties.addConfiguration(userConfiguration);
    }

    // System wide options are last.
    filename = System.getenv(SPD_PROPERTIES);
    if (filename != null) {
      PropertiesConfiguration envConfiguration = readPropertyFile(new File(filename),
          "Environment variable " + SPD_PROPERTIES + " (" + filename + ").");
      if (envConfiguration != null) {
        properties.addConfiguration(envConfiguration);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read a single property file.
   *
   * @param propertyFile The file to read.
   * @param header The header recorded with the configuration.
   * @return The configuration, or null if the file is absent or could not be parsed.
   */
  private static PropertiesConfiguration readPropertyFile(File propertyFile, String header) {
    if (!propertyFile.exists() || !propertyFile.canRead()) {
      return null;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      return configuration;
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propertyFile.getAbsolutePath());
      return null;
    }
  }
}
