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
package spd.potential.parsers;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import spd.potential.Molecule;
import spd.potential.bonded.Atom;

/**
 * The XYZFilter class parses and writes XYZ coordinate files.
 *
 * <p>An XYZ frame is an atom count line, a free-form comment line and one <code>element x y
 * z</code> line per atom. Atoms read from a file are numbered from 0 and have no bonds.
 *
 * @since 1.0
 */
public class XYZFilter {

  private static final Logger logger = Logger.getLogger(XYZFilter.class.getName());

  private final File file;

  /**
   * Constructor for XYZFilter.
   *
   * @param file The XYZ file to read or write.
   */
  public XYZFilter(File file) {
    this.file = file;
  }

  /**
   * Read a single frame from the file.
   *
   * @return The Molecule.
   * @throws IOException If the file cannot be read.
   * @throws XYZFormatException If the file is not valid XYZ.
   */
  public Molecule readFile() throws IOException {
    logger.info(format(" Opening %s", file.getName()));
    List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    return parse(lines, file.getName());
  }

  /**
   * Write a molecule as one XYZ frame.
   *
   * @param molecule The molecule to write.
   * @param append If true, the frame is appended to the existing content.
   * @throws IOException If the file cannot be written.
   */
  public void writeFile(Molecule molecule, boolean append) throws IOException {
    FileUtils.writeStringToFile(file, toXYZString(molecule), StandardCharsets.UTF_8, append);
  }

  /**
   * Write several molecules back to back as a multi-frame XYZ file.
   *
   * @param molecules The frames.
   * @param append If true, the frames are appended to the existing content.
   * @throws IOException If the file cannot be written.
   */
  public void writeFrames(Iterable<? extends Molecule> molecules, boolean append)
      throws IOException {
    StringBuilder sb = new StringBuilder();
    for (Molecule molecule : molecules) {
      sb.append(toXYZString(molecule));
    }
    FileUtils.writeStringToFile(file, sb.toString(), StandardCharsets.UTF_8, append);
  }

  public File getFile() {
    return file;
  }

  /**
   * Serialize a molecule as one XYZ frame.
   *
   * @param molecule The molecule.
   * @return The XYZ text, ending with a newline.
   */
  public static String toXYZString(Molecule molecule) {
    StringBuilder sb = new StringBuilder();
    sb.append(molecule.getNumAtoms()).append('\n');
    sb.append(molecule.getXYZComment()).append('\n');
    List<Atom> atoms = molecule.getAtoms();
    double[][] positions = molecule.getPositionMatrix();
    for (int i = 0; i < positions.length; i++) {
      double[] x = positions[i];
      sb.append(format(Locale.US, "%s %f %f %f\n", atoms.get(i).getElement(), x[0], x[1], x[2]));
    }
    return sb.toString();
  }

  /**
   * Parse the lines of a single XYZ frame. Trailing blank lines are ignored.
   *
   * @param lines The lines of the frame.
   * @param source A name for the input used in error messages.
   * @return The Molecule.
   * @throws XYZFormatException If the input is not a valid XYZ frame.
   * @throws IllegalArgumentException If an element has no parameters.
   */
  public static Molecule parse(List<String> lines, String source) throws XYZFormatException {
    List<String> content = new ArrayList<>(lines);
    while (!content.isEmpty() && content.get(content.size() - 1).trim().isEmpty()) {
      content.remove(content.size() - 1);
    }
    if (content.isEmpty()) {
      throw new XYZFormatException(format(" %s is empty.", source));
    }

    int nAtoms;
    try {
      nAtoms = Integer.parseInt(content.get(0).trim());
    } catch (NumberFormatException e) {
      throw new XYZFormatException(
          format(" The first line of %s is not an atom count: %s", source, content.get(0)), e);
    }
    int found = Math.max(content.size() - 2, 0);
    if (nAtoms < 0 || found != nAtoms) {
      throw new XYZFormatException(
          format(" %s declares %d atoms but contains %d coordinate lines.", source, nAtoms, found));
    }

    List<Atom> atoms = new ArrayList<>(nAtoms);
    double[][] positions = new double[nAtoms][3];
    for (int i = 0; i < nAtoms; i++) {
      String line = content.get(i + 2);
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length < 4) {
        throw new XYZFormatException(format(" Malformed coordinate line in %s: %s", source, line));
      }
      try {
        for (int j = 0; j < 3; j++) {
          positions[i][j] = Double.parseDouble(tokens[j + 1]);
        }
      } catch (NumberFormatException e) {
        throw new XYZFormatException(
            format(" Malformed coordinate line in %s: %s", source, line), e);
      }
      atoms.add(new Atom(i, tokens[0]));
    }
    return new Molecule(atoms, Collections.emptyList(), positions);
  }
}
