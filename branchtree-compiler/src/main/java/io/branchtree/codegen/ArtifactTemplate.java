package io.branchtree.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skeleton of one artifact file with {@code {{KEY}}} placeholders for the parts that vary.
 *
 * <p>The template is split into literal text and placeholders once, when it is loaded. Rendering
 * fills each placeholder in a single pass, so values are copied verbatim: a tree file named
 * {@code {{MEMBERS}}.tree} or a kept body that mentions a placeholder is never expanded again.
 * Every placeholder must get a value and every value must have a placeholder.
 */
final class ArtifactTemplate {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z][A-Z_]*)}}");

  private final String name;
  // literals.size() == keys.size() + 1
  private final List<String> literals;
  private final List<String> keys;

  private ArtifactTemplate(String name, List<String> literals, List<String> keys) {
    this.name = name;
    this.literals = List.copyOf(literals);
    this.keys = List.copyOf(keys);
  }

  /**
   * Loads a template shipped on the classpath.
   *
   * @param resourcePath e.g. {@code templates/junit-test.tmpl}
   * @throws UncheckedIOException if the resource is missing; templates ship with the jar, so this
   *     is a packaging error
   */
  static ArtifactTemplate load(String resourcePath) {
    try (InputStream in = ArtifactTemplate.class.getClassLoader().getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IOException("Template not found: " + resourcePath);
      }
      return parse(resourcePath, new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Template from text; line endings become {@code \n} and the text always ends with one. */
  static ArtifactTemplate parse(String name, String text) {
    String content = text.replace("\r\n", "\n");
    if (!content.endsWith("\n")) content += "\n";
    List<String> literals = new ArrayList<>();
    List<String> keys = new ArrayList<>();
    Matcher m = PLACEHOLDER.matcher(content);
    int from = 0;
    while (m.find()) {
      literals.add(content.substring(from, m.start()));
      keys.add(m.group(1));
      from = m.end();
    }
    literals.add(content.substring(from));
    return new ArtifactTemplate(name, literals, keys);
  }

  /** Placeholder names in order of first appearance. */
  Set<String> placeholders() {
    return new LinkedHashSet<>(keys);
  }

  /**
   * Fills every placeholder.
   *
   * @throws IllegalArgumentException if a value has no placeholder, or a placeholder has no value
   */
  String render(Map<String, String> values) {
    for (String key : values.keySet()) {
      if (!keys.contains(key)) {
        throw new IllegalArgumentException(name + " has no placeholder {{" + key + "}}");
      }
    }
    StringBuilder sb = new StringBuilder(literals.get(0));
    for (int i = 0; i < keys.size(); i++) {
      String value = values.get(keys.get(i));
      if (value == null) {
        throw new IllegalArgumentException("no value for {{" + keys.get(i) + "}} in " + name);
      }
      sb.append(value).append(literals.get(i + 1));
    }
    return sb.toString();
  }

  Values values() {
    return new Values(this);
  }

  /** Values collected for one rendering. */
  static final class Values {
    private final ArtifactTemplate template;
    private final Map<String, String> values = new HashMap<>();

    private Values(ArtifactTemplate template) {
      this.template = template;
    }

    Values set(String key, String value) {
      values.put(key, value);
      return this;
    }

    String render() {
      return template.render(values);
    }
  }
}
