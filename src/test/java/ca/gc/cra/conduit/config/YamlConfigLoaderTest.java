package ca.gc.cra.conduit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndPipelineSections() throws IOException {
    Path yaml = tempDir.resolve("conduit.yaml");
    Files.writeString(yaml, """
        common:
          compression: gzip
          flusher:
            concurrency: 2
        agent:
          flusher:
            concurrency: 8
          destination:
            routes: ca-central-1/agent/app-logs
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "agent").orElseThrow();

    assertEquals("gzip", map.get("compression"));
    assertEquals("8", map.get("flusher.concurrency"));
    assertEquals("ca-central-1/agent/app-logs", map.get("destination.routes"));
    assertEquals("agent", map.get("pipeline.name"));

    PipelineConfig config = PipelineConfig.fromMap(map);
    assertEquals(8, config.flusher().concurrency());
    assertEquals(1, config.destination().routes().size());
  }

  @Test
  void explicitPipelineNameWins() throws IOException {
    Path yaml = tempDir.resolve("named.yaml");
    Files.writeString(yaml, """
        agent:
          pipeline:
            name: agent-v2
        """);

    assertEquals("agent-v2", YamlConfigLoader.load(yaml, "agent").orElseThrow().get("pipeline.name"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "agent");

    assertFalse(result.isPresent());
    assertTrue(YamlConfigLoader.pipelineNames(tempDir.resolve("missing.yaml")).isEmpty());
  }

  @Test
  void pipelineNamesSkipsCommonSection() throws IOException {
    Path yaml = tempDir.resolve("multi.yaml");
    Files.writeString(yaml, """
        common:
          compression: none
        agent:
          batch:
            maxEvents: 10
        audit:
          batch:
            maxEvents: 20
        """);

    assertEquals(List.of("agent", "audit"), YamlConfigLoader.pipelineNames(yaml));
  }

  @Test
  void invalidStructuresThrow() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - agent:
            compression: gzip
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "agent"));

    Path array = tempDir.resolve("array.yaml");
    Files.writeString(array, """
        agent:
          destination:
            routes:
              - a/b/c
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(array, "agent"));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "agent: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "agent"));
  }
}
