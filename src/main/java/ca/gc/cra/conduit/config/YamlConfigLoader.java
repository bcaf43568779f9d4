package ca.gc.cra.conduit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads pipeline configuration from a YAML document and flattens sections into dotted key/value maps.
 * <p>The document holds an optional {@code common} section and one section per pipeline; the pipeline section wins
 * over {@code common}. When the merged map has no {@code pipeline.name}, the section name is used.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code pipeline} section.
   *
   * @param path location of the YAML configuration
   * @param pipeline pipeline section name
   * @return flat map containing merged configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String pipeline) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(pipeline, "pipeline");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = normalize(pipeline);
    Map<String, Object> root = readRoot(path);

    Map<String, String> flattened = new LinkedHashMap<>();
    Object commonSection = findSection(root, COMMON);
    if (commonSection != null) {
      flatten(asMap(commonSection, COMMON), "", flattened);
    }
    Object pipelineSection = findSection(root, section);
    if (pipelineSection instanceof Map<?, ?> pipelineMap) {
      flatten(asMap(pipelineMap, section), "", flattened);
    }
    flattened.putIfAbsent("pipeline.name", pipeline.trim());
    return Optional.of(Map.copyOf(flattened));
  }

  /**
   * Lists the pipeline sections of a YAML document, skipping {@code common}.
   *
   * @param path location of the YAML configuration
   * @return section names in document order; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static List<String> pipelineNames(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    for (Map.Entry<String, Object> entry : readRoot(path).entrySet()) {
      if (!normalize(entry.getKey()).equals(COMMON) && entry.getValue() instanceof Map<?, ?>) {
        names.add(entry.getKey().trim());
      }
    }
    return List.copyOf(names);
  }

  private static Map<String, Object> readRoot(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Map.of();
      }
      return asMap(document, "root");
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null && normalize(entry.getKey()).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String normalize(String value) {
    return value.trim().toLowerCase(Locale.ROOT);
  }
}
