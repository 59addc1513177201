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
import io.github.xasdb.datamodel.edges.EdgeEnergyTable;
import io.github.xasdb.datamodel.edges.JsonEdgeEnergyTable;
import io.github.xasdb.modules.dataprocessing.xafs_preedge.PreEdgeNormalizer;
import io.github.xasdb.modules.dataprocessing.xafs_preedge.PreEdgeParameters;
import io.github.xasdb.modules.dataprocessing.xafs_preedge.PreEdgeResult;
import io.github.xasdb.modules.dataprocessing.xafs_preedge.XanesRegion;
import io.github.xasdb.modules.dataprocessing.xafs_preedge.XanesRegionExtractor;
import io.github.xasdb.util.exceptions.MalformedInputException;
import io.github.xasdb.util.exceptions.XafsProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Standalone runner that normalizes all spectra of a directory. Each spectrum file gets a
 * "*_norm.tsv" with the background curves and normalized mu and a "*_xanes.tsv" with the
 * near-edge region; "preedge_summary.tsv" lists E0 and edge step per spectrum.
 *
 * Usage:
 *   -DinputDir=/absolute/path -DoutDir=/absolute/output/path -Dnorm1=150 -Dnnorm=2
 * Or call main with args: inputDir [outDir]
 * <p>
 * Processing parameters use the keys of {@link PreEdgeParameters#PROPERTY_KEYS}. Further options:
 * -DenergyUnit=eV|keV, -Delement=Fe -Dedge=K to center the XANES region on the tabulated edge.
 */
public class PreEdgeRunner {

  public static final String SUMMARY_FILE = "preedge_summary.tsv";

  private static final Logger logger = Logger.getLogger(PreEdgeRunner.class.getName());

  private static final List<String> EXTENSIONS = List.of(".tsv", ".csv", ".txt", ".dat", ".xmu");

  private final @NotNull PreEdgeNormalizer normalizer;
  private final @NotNull EnergyUnit energyUnit;
  private final @Nullable Double referenceE0;

  /**
   * @param referenceE0 tabulated edge energy to center the XANES region on, null for the derived
   *                    E0 of each spectrum
   */
  public PreEdgeRunner(@NotNull PreEdgeNormalizer normalizer, @NotNull EnergyUnit energyUnit,
      @Nullable Double referenceE0) {
    this.normalizer = normalizer;
    this.energyUnit = energyUnit;
    this.referenceE0 = referenceE0;
  }

  public static void main(String[] args) throws IOException {
    try (InputStream in = PreEdgeRunner.class.getClassLoader()
        .getResourceAsStream("logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    }

    final String inputDirArg = (args != null && args.length > 0 && !args[0].isBlank()) ? args[0]
        : System.getProperty("inputDir", "");
    if (inputDirArg.isBlank()) {
      System.err.println("Please provide input directory via -DinputDir or first CLI arg.");
      return;
    }
    final Path inputDir = Paths.get(inputDirArg).toAbsolutePath().normalize();
    final String outDirArg = (args != null && args.length > 1 && !args[1].isBlank()) ? args[1]
        : System.getProperty("outDir", inputDir.resolve("preedge").toString());
    final Path outDir = Paths.get(outDirArg).toAbsolutePath().normalize();

    final List<String> errors = new ArrayList<>();
    final PreEdgeParameters parameters = loadParameters(System.getProperties(), errors);
    final EnergyUnit unit = parseEnergyUnit(System.getProperty("energyUnit", "eV"), errors);
    if (parameters == null || unit == null) {
      System.err.println("Invalid parameters: " + String.join("; ", errors));
      return;
    }
    final Double referenceE0 = lookupReferenceE0(JsonEdgeEnergyTable.loadDefault(),
        System.getProperty("element", ""), System.getProperty("edge", ""));

    System.out.printf(Locale.US, "Input: %s%nOutput: %s%nParameters: %s%n", inputDir, outDir,
        parameters);
    final PreEdgeRunner runner = new PreEdgeRunner(PreEdgeNormalizer.fromParameters(parameters),
        unit, referenceE0);
    final List<SpectrumOutcome> outcomes = runner.run(inputDir, outDir);
    final long ok = outcomes.stream().filter(SpectrumOutcome::success).count();
    System.out.printf(Locale.US, "Normalized %d of %d spectra, summary: %s%n", ok,
        outcomes.size(), outDir.resolve(SUMMARY_FILE));
  }

  /**
   * Reads the processing parameters from properties keyed by
   * {@link PreEdgeParameters#PROPERTY_KEYS}.
   *
   * @return the parameters or null if a value does not parse or is invalid, the reasons are added
   * to errors
   */
  static @Nullable PreEdgeParameters loadParameters(@NotNull Properties properties,
      @NotNull List<String> errors) {
    final PreEdgeParameters parameters = new PreEdgeParameters();
    try {
      parameters.loadValuesFromProperties(properties, "", PreEdgeParameters.PROPERTY_KEYS);
    } catch (IllegalArgumentException e) {
      errors.add(e.getMessage());
      return null;
    }
    return parameters.checkParameterValues(errors) ? parameters : null;
  }

  /**
   * @return the unit or null if the label is not an energy unit, the reason is added to errors
   */
  static @Nullable EnergyUnit parseEnergyUnit(@NotNull String label,
      @NotNull List<String> errors) {
    try {
      return EnergyUnit.parse(label);
    } catch (MalformedInputException e) {
      errors.add(e.getMessage());
      return null;
    }
  }

  /**
   * @return the tabulated edge energy or null if element or edge are blank or not tabulated
   */
  static @Nullable Double lookupReferenceE0(@NotNull EdgeEnergyTable table,
      @NotNull String element, @NotNull String edge) {
    if (element.isBlank()) {
      return null;
    }
    final String edgeLabel = edge.isBlank() ? "K" : edge;
    final Double e0 = table.edgeEnergy(element, edgeLabel);
    if (e0 == null) {
      logger.warning("No tabulated %s edge for element %s".formatted(edgeLabel, element));
    }
    return e0;
  }

  /**
   * Processes every spectrum file directly inside the input directory.
   *
   * @return one outcome per file, in file name order
   */
  public @NotNull List<SpectrumOutcome> run(@NotNull Path inputDir, @NotNull Path outDir)
      throws IOException {
    Files.createDirectories(outDir);
    final List<Path> files;
    try (Stream<Path> s = Files.list(inputDir)) {
      files = s.filter(Files::isRegularFile).filter(PreEdgeRunner::isSpectrumFile).sorted()
          .toList();
    }
    if (files.isEmpty()) {
      logger.warning("No spectrum files found in " + inputDir);
    }

    final List<SpectrumOutcome> outcomes = new ArrayList<>();
    for (Path file : files) {
      outcomes.add(processFile(file, outDir));
    }
    writeSummary(outDir.resolve(SUMMARY_FILE), outcomes);
    return outcomes;
  }

  /**
   * Normalizes one spectrum. Read and processing failures are reported in the outcome, output
   * failures propagate.
   */
  public @NotNull SpectrumOutcome processFile(@NotNull Path file, @NotNull Path outDir)
      throws IOException {
    final String stem = stem(file);
    final XafsSpectrum spectrum;
    try {
      spectrum = SpectrumTableReader.read(file, energyUnit);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not read spectrum " + file, e);
      return SpectrumOutcome.failed(stem, "could not read file: " + e.getMessage());
    }

    final PreEdgeResult result;
    try {
      result = normalizer.process(spectrum);
    } catch (XafsProcessingException e) {
      logger.log(Level.WARNING, "Could not extract data from spectrum %s: %s".formatted(stem,
          e.getMessage()), e);
      return SpectrumOutcome.failed(stem, "could not extract data: " + e.getMessage());
    }

    writeNormalized(outDir.resolve(stem + "_norm.tsv"), result);
    final XanesRegion xanes = XanesRegionExtractor.extract(result,
        referenceE0 != null ? referenceE0 : result.e0(), XanesRegionExtractor.DEFAULT_BELOW,
        XanesRegionExtractor.DEFAULT_ABOVE);
    writeXanes(outDir.resolve(stem + "_xanes.tsv"), xanes);
    return SpectrumOutcome.succeeded(stem, result);
  }

  private static boolean isSpectrumFile(Path p) {
    final String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.equals(SUMMARY_FILE) || name.endsWith("_norm.tsv") || name.endsWith("_xanes.tsv")) {
      return false;
    }
    return EXTENSIONS.stream().anyMatch(name::endsWith);
  }

  private static String stem(Path file) {
    final String name = file.getFileName().toString();
    final int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void writeNormalized(Path out, PreEdgeResult result) throws IOException {
    final StringBuilder sb = new StringBuilder("energy\tmu\tpre_edge\tpost_edge\tnorm\n");
    for (int i = 0; i < result.getNumberOfValues(); i++) {
      sb.append(format(result.energy()[i])).append('\t').append(format(result.mu()[i]))
          .append('\t').append(format(result.preEdge()[i])).append('\t')
          .append(format(result.postEdge()[i])).append('\t').append(format(result.norm()[i]))
          .append('\n');
    }
    Files.writeString(out, sb.toString());
  }

  private static void writeXanes(Path out, XanesRegion xanes) throws IOException {
    final StringBuilder sb = new StringBuilder("energy_minus_e0\tnorm\n");
    for (int i = 0; i < xanes.getNumberOfValues(); i++) {
      sb.append(format(xanes.relativeEnergy()[i])).append('\t').append(format(xanes.norm()[i]))
          .append('\n');
    }
    Files.writeString(out, sb.toString());
  }

  private static void writeSummary(Path out, List<SpectrumOutcome> outcomes) throws IOException {
    final StringBuilder sb = new StringBuilder(
        "spectrum\tpoints\te0\tedge_step\tnnorm\tpre1\tpre2\tnorm1\tnorm2\tstatus\n");
    for (SpectrumOutcome o : outcomes) {
      sb.append(o.name()).append('\t');
      final PreEdgeResult r = o.result();
      if (r != null) {
        sb.append(r.getNumberOfValues()).append('\t').append(format(r.e0())).append('\t')
            .append(format(r.edgeStep())).append('\t').append(r.nnorm()).append('\t')
            .append(format(r.regions().preEdge().lower())).append('\t')
            .append(format(r.regions().preEdge().upper())).append('\t')
            .append(format(r.regions().postEdge().lower())).append('\t')
            .append(format(r.regions().postEdge().upper())).append('\t').append("ok");
      } else {
        sb.append("\t\t\t\t\t\t\t\t").append(o.message());
      }
      sb.append('\n');
    }
    Files.writeString(out, sb.toString());
  }

  private static String format(double value) {
    return String.format(Locale.US, "%.6g", value);
  }

  /**
   * @param result  null if the spectrum failed
   * @param message status text, "ok" on success
   */
  public record SpectrumOutcome(@NotNull String name, @Nullable PreEdgeResult result,
                                @NotNull String message) {

    static SpectrumOutcome succeeded(String name, PreEdgeResult result) {
      return new SpectrumOutcome(name, result, "ok");
    }

    static SpectrumOutcome failed(String name, String message) {
      return new SpectrumOutcome(name, null, message);
    }

    public boolean success() {
      return result != null;
    }
  }
}
