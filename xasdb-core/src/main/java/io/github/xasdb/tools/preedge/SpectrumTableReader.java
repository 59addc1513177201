/*
 * Copyright (c) 2025 The xasdb Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.xasdb.tools.preedge;

import io.github.xasdb.datamodel.EnergyUnit;
import io.github.xasdb.datamodel.XafsSpectrum;
import io.github.xasdb.util.exceptions.MalformedInputException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;

/**
 * Reads a spectrum from delimited text. Lines starting with '#' are comments, the first other line
 * is the header. Needs an energy column and either a mu column or i0 and itrans columns. Tab, comma,
 * semicolon and whitespace separators are detected from the header. Cells that do not parse are
 * read as NaN and removed later by the sanitizer.
 */
public class SpectrumTableReader {

  private SpectrumTableReader() {
  }

  public static @NotNull XafsSpectrum read(@NotNull Path file, @NotNull EnergyUnit unit)
      throws IOException {
    final List<String[]> rows = new ArrayList<>();
    String separator = null;
    try (BufferedReader br = Files.newBufferedReader(file)) {
      String line;
      while ((line = br.readLine()) != null) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        if (separator == null) {
          separator = guessSeparator(trimmed);
        }
        rows.add(trimmed.split(separator));
      }
    }
    if (rows.size() < 2) {
      throw new IOException("No data rows in " + file);
    }

    final String[] header = rows.get(0);
    final int eIdx = guessIndex(header, "energy", "e", "ev", "kev");
    if (eIdx < 0) {
      throw new IOException("No energy column in " + file);
    }
    final int muIdx = guessIndex(header, "mu", "xmu", "absorption", "mutrans");
    final int i0Idx = guessIndex(header, "i0");
    final int itIdx = guessIndex(header, "itrans", "it", "i1");
    if (muIdx < 0 && (i0Idx < 0 || itIdx < 0)) {
      throw new IOException("Need a mu column or i0 and itrans columns in " + file);
    }

    final int n = rows.size() - 1;
    final double[] energy = new double[n];
    final double[] mu = new double[n];
    final double[] i0 = new double[n];
    final double[] itrans = new double[n];
    for (int r = 0; r < n; r++) {
      final String[] row = rows.get(r + 1);
      energy[r] = cell(row, eIdx);
      if (muIdx >= 0) {
        mu[r] = cell(row, muIdx);
      } else {
        i0[r] = cell(row, i0Idx);
        itrans[r] = cell(row, itIdx);
      }
    }

    try {
      if (muIdx >= 0) {
        return XafsSpectrum.of(energy, mu, unit);
      }
      final XafsSpectrum transmission = XafsSpectrum.fromTransmission(energy, i0, itrans);
      return XafsSpectrum.of(energy, transmission.mu(), unit);
    } catch (MalformedInputException e) {
      throw new IOException("Malformed spectrum in " + file + ": " + e.getMessage(), e);
    }
  }

  private static String guessSeparator(String header) {
    if (header.contains("\t")) {
      return "\t";
    }
    if (header.contains(",")) {
      return ",";
    }
    if (header.contains(";")) {
      return ";";
    }
    return "\\s+";
  }

  private static int guessIndex(String[] header, String... names) {
    for (String name : names) {
      for (int i = 0; i < header.length; i++) {
        final String h = header[i].trim().toLowerCase(Locale.ROOT);
        if (h.equals(name) || h.startsWith(name + " ") || h.startsWith(name + "(")) {
          return i;
        }
      }
    }
    return -1;
  }

  private static double cell(String[] row, int index) {
    if (index >= row.length) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(row[index].trim());
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }
}
