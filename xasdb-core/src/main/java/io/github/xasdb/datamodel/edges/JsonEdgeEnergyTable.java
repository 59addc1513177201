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

package io.github.xasdb.datamodel.edges;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Edge energy table read from JSON of the form
 * <pre>{"edges": [{"z": 26, "symbol": "Fe", "energies": {"K": 7112.0, "L3": 706.8}}]}</pre>
 * The bundled table covers H to Cf. Immutable once loaded.
 */
public class JsonEdgeEnergyTable implements EdgeEnergyTable {

  public static final String DEFAULT_RESOURCE = "edge_energies.json";

  private static final Logger logger = Logger.getLogger(JsonEdgeEnergyTable.class.getName());

  private final Map<Integer, String> symbols;
  private final Map<String, Integer> atomicNumbers;
  private final Map<Integer, Map<String, Double>> energies;

  private JsonEdgeEnergyTable(@NotNull JSONObject json) {
    final Map<Integer, String> sym = new HashMap<>();
    final Map<String, Integer> z = new HashMap<>();
    final Map<Integer, Map<String, Double>> en = new HashMap<>();

    final JSONArray edges = json.getJSONArray("edges");
    for (int i = 0; i < edges.length(); i++) {
      final JSONObject element = edges.getJSONObject(i);
      final int atomicNumber = element.getInt("z");
      final String symbol = element.getString("symbol");
      sym.put(atomicNumber, symbol);
      z.put(symbol.toLowerCase(Locale.ROOT), atomicNumber);

      final JSONObject energyObj = element.getJSONObject("energies");
      // sorted labels: K, L1.. M1.. for stable listings
      final Map<String, Double> labels = new TreeMap<>();
      for (Iterator<String> it = energyObj.keys(); it.hasNext(); ) {
        final String label = it.next();
        labels.put(label.toUpperCase(Locale.ROOT), energyObj.getDouble(label));
      }
      en.put(atomicNumber, Collections.unmodifiableMap(labels));
    }
    this.symbols = Collections.unmodifiableMap(sym);
    this.atomicNumbers = Collections.unmodifiableMap(z);
    this.energies = Collections.unmodifiableMap(en);
  }

  /**
   * Loads the table bundled with this library.
   *
   * @throws IOException if the resource is missing or not valid JSON
   */
  public static @NotNull JsonEdgeEnergyTable loadDefault() throws IOException {
    try (InputStream in = JsonEdgeEnergyTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new IOException("Missing edge energy resource " + DEFAULT_RESOURCE);
      }
      return load(in);
    }
  }

  /**
   * @throws IOException if reading fails or the content is not a valid edge table
   */
  public static @NotNull JsonEdgeEnergyTable load(@NotNull InputStream in) throws IOException {
    final String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    try {
      final JsonEdgeEnergyTable table = new JsonEdgeEnergyTable(new JSONObject(text));
      logger.fine(() -> "Loaded edge energies of %d elements".formatted(table.symbols.size()));
      return table;
    } catch (JSONException e) {
      throw new IOException("Invalid edge energy table: " + e.getMessage(), e);
    }
  }

  @Override
  public @Nullable Double edgeEnergy(int atomicNumber, @NotNull String edgeLabel) {
    final Map<String, Double> labels = energies.get(atomicNumber);
    if (labels == null) {
      return null;
    }
    return labels.get(edgeLabel.trim().toUpperCase(Locale.ROOT));
  }

  @Override
  public @Nullable String symbol(int atomicNumber) {
    return symbols.get(atomicNumber);
  }

  @Override
  public @Nullable Integer atomicNumber(@NotNull String symbol) {
    return atomicNumbers.get(symbol.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public @NotNull Set<String> edgeLabels(int atomicNumber) {
    final Map<String, Double> labels = energies.get(atomicNumber);
    return labels == null ? Set.of() : labels.keySet();
  }

  public int getNumberOfElements() {
    return symbols.size();
  }
}
