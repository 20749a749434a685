/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.retry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.params.provider.Arguments;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Loads named test vectors from YAML resources on the test classpath.
 */
public final class YamlFixtures {
  private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  private YamlFixtures() {
  }

  /**
   * Load a resource holding a map of case name to case, keeping the order of
   * the file.
   */
  public static <T> Map<String, T> load(String resource, Class<T> caseType) {
    var type = MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, caseType);
    try (var stream = Objects.requireNonNull(YamlFixtures.class.getResourceAsStream(resource),
        () -> "Missing test resource " + resource)) {
      return MAPPER.readValue(stream, type);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + resource, e);
    }
  }

  /**
   * The cases in a resource as (name, case) arguments for a parameterized test.
   */
  public static <T> Stream<Arguments> arguments(String resource, Class<T> caseType) {
    return load(resource, caseType).entrySet().stream().map(e -> Arguments.of(e.getKey(), e.getValue()));
  }
}
