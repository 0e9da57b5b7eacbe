package hwelab.util;

import hwelab.core.Element;
import hwelab.core.Elements;
import hwelab.core.NumOps;
import hwelab.core.When;
import hwelab.elab.Builder;
import hwelab.ir.Circuit;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

class CircuitYamlTest {

  private static Circuit sample() {
    return Builder.elaborate("sample", builder -> {
      Element a = builder.input("a", Elements.uint(4));
      Element en = builder.input("en", Elements.bool());
      Element out = builder.output("out", Elements.uint(5));
      builder.connect(out, Elements.uintLit(0, 5));
      When.when(en, () -> builder.connect(out, NumOps.addGrow(a, Elements.uintLit(1, 4))));
    });
  }

  @Test
  @SuppressWarnings("unchecked")
  void testDumpStructure() {
    Map<String, Object> loaded = new Yaml().load(CircuitYaml.dump(sample()));
    Assertions.assertEquals("sample", loaded.get("circuit"));

    List<Map<String, Object>> ports = (List<Map<String, Object>>)loaded.get("ports");
    Assertions.assertEquals(List.of("a", "en", "out"), ports.stream().map(port -> port.get("name")).collect(Collectors.toList()));
    Assertions.assertEquals("input", ports.get(0).get("direction"));
    Assertions.assertEquals("UInt<4>", ports.get(0).get("type"));
    Assertions.assertEquals("Bool", ports.get(1).get("type"));

    List<Map<String, Object>> commands = (List<Map<String, Object>>)loaded.get("commands");
    Assertions.assertEquals(List.of("connect", "when", "prim", "connect", "end"),
                            commands.stream().map(command -> command.get("kind")).collect(Collectors.toList()));
    Map<String, Object> when = commands.get(1);
    Assertions.assertEquals("en", when.get("pred"));
    Assertions.assertEquals(0, when.get("depth"));
    Map<String, Object> prim = commands.get(2);
    Assertions.assertEquals("add", prim.get("op"));
    Assertions.assertEquals("UInt<5>", prim.get("type"));
    Assertions.assertEquals(List.of("a", "UInt<4>(1)"), prim.get("args"));
    Assertions.assertEquals(prim.get("result"), commands.get(3).get("source"));
    Assertions.assertEquals("out", commands.get(3).get("sink"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testDirectionIndependentOfLocale() {
    Locale saved = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      Map<String, Object> loaded = new Yaml().load(CircuitYaml.dump(sample()));
      List<Map<String, Object>> ports = (List<Map<String, Object>>)loaded.get("ports");
      Assertions.assertEquals("input", ports.get(0).get("direction"));
      Assertions.assertEquals("output", ports.get(2).get("direction"));
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  void testWrite(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("sample.yaml");
    CircuitYaml.write(sample(), file);
    try (Reader reader = Files.newBufferedReader(file)) {
      Map<String, Object> loaded = new Yaml().load(reader);
      Assertions.assertEquals("sample", loaded.get("circuit"));
    }
  }
}
