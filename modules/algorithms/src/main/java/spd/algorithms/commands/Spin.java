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
package spd.algorithms.commands;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FilenameUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import spd.algorithms.Spinner;
import spd.algorithms.cli.SpinnerOptions;
import spd.potential.Molecule;
import spd.potential.SupraMolecule;
import spd.potential.parsers.XYZFilter;
import spd.utilities.SpdCommand;
import spd.utilities.SpdProperties;

/**
 * The Spin command generates host-guest conformers by rigid-body Monte Carlo.
 *
 * <br>
 * Usage:
 * <br>
 * spd Spin [options] &lt;host.xyz&gt; &lt;guest.xyz&gt; [guest.xyz ...]
 */
@Command(description = " Generate host-guest conformers by rigid-body Monte Carlo.", name = "Spin")
public class Spin extends SpdCommand {

  @Mixin
  private SpinnerOptions spinnerOptions = new SpinnerOptions();

  /** -c or --conformers Write every conformer to a multi-frame XYZ file. */
  @Option(
      names = {"-c", "--conformers"},
      defaultValue = "false",
      description = "Write every conformer to <host>_conformers.xyz.")
  private boolean writeConformers;

  /** The host XYZ file followed by one or more guest XYZ files. */
  @Parameters(
      arity = "2..*",
      paramLabel = "files",
      description = "The host XYZ file followed by one or more guest XYZ files.")
  private List<String> filenames = null;

  private SupraMolecule finalConformer = null;
  private int numConformers = 0;
  private File spunFile = null;
  private File conformerFile = null;

  /**
   * Spin constructor.
   *
   * @param args The command line arguments.
   */
  public Spin(String[] args) {
    super(args);
  }

  /** {@inheritDoc} */
  @Override
  public Spin run() {
    if (!init()) {
      return this;
    }

    File hostFile = new File(filenames.get(0));
    CompositeConfiguration properties = SpdProperties.loadProperties(hostFile);

    // Each file is one rigid component.
    List<Molecule> components = new ArrayList<>();
    for (String filename : filenames) {
      try {
        components.add(new XYZFilter(new File(filename)).readFile());
      } catch (IOException | IllegalArgumentException e) {
        logger.warning(format(" Could not read %s:\n %s", filename, e.getMessage()));
        return this;
      }
    }
    SupraMolecule supraMolecule = SupraMolecule.initFromComponents(components, null, null);

    List<SupraMolecule> conformers = new ArrayList<>();
    try {
      Spinner spinner = spinnerOptions.buildSpinner(properties);
      logger.info(spinner.toString());
      for (SupraMolecule conformer : spinner.getConformers(supraMolecule,
          spinnerOptions.getMovable())) {
        if (writeConformers) {
          conformers.add(conformer);
        }
        finalConformer = conformer;
        numConformers++;
      }
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Spin could not run:\n %s", e.getMessage()));
      finalConformer = null;
      return this;
    }

    logger.info(format(" Final conformer %d with potential %16.8f", finalConformer.getCid(),
        finalConformer.getPotential()));

    String baseName = FilenameUtils.removeExtension(hostFile.getAbsolutePath());
    spunFile = new File(baseName + "_spun.xyz");
    try {
      logger.info(format(" Saving final conformer to %s", spunFile.getName()));
      finalConformer.writeXYZFile(spunFile);
      if (writeConformers) {
        conformerFile = new File(baseName + "_conformers.xyz");
        logger.info(format(" Saving %d conformers to %s", conformers.size(),
            conformerFile.getName()));
        new XYZFilter(conformerFile).writeFrames(conformers, false);
      }
    } catch (IOException e) {
      logger.severe(format(" Could not write conformers:\n %s", e.getMessage()));
    }
    return this;
  }

  /**
   * The last conformer of the chain.
   *
   * @return The final conformer, or null if the command did not run.
   */
  public SupraMolecule getFinalConformer() {
    return finalConformer;
  }

  /**
   * Number of conformers returned by the chain, including the starting structure.
   *
   * @return The conformer count.
   */
  public int getNumConformers() {
    return numConformers;
  }

  public File getSpunFile() {
    return spunFile;
  }

  public File getConformerFile() {
    return conformerFile;
  }
}
