/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.chronos.jobs.config;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.io.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A utility class to read JSON-formatted system configuration.
 */
public final class ChronosConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ChronosConfigLoader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ChronosConfigLoader() {
    // Utility class.
  }

  /**
   * Reads the Chronos API configuration from a file.
   *
   * @param path JSON file holding {@code url}, {@code user} and {@code password}.
   * @return The configuration.
   * @throws ChronosNotConfiguredException If the file cannot be read or parsed.
   */
  public static ChronosConfig load(File path) throws ChronosNotConfiguredException {
    String contents;
    try {
      contents = Files.asCharSource(path, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw new ChronosNotConfiguredException(
          String.format("Could not load chronos config file %s: %s", path, e.getMessage()), e);
    }
    return parse(contents, path.getPath());
  }

  @VisibleForTesting
  static ChronosConfig parse(String contents, String path) throws ChronosNotConfiguredException {
    try {
      Map<String, Object> config =
          MAPPER.readValue(contents, new TypeReference<Map<String, Object>>() { });
      return new ChronosConfig(config, path);
    } catch (IOException e) {
      throw new ChronosNotConfiguredException(
          String.format("Could not parse chronos config file %s: %s", path, e.getMessage()), e);
    }
  }

  /**
   * Reads the system configuration from a JSON file.
   *
   * @param path JSON file holding the cluster, docker registry and volumes.
   * @return The system configuration.
   */
  public static SystemConfig loadSystemConfig(File path) {
    try {
      return parseSystemConfig(Files.asCharSource(path, StandardCharsets.UTF_8).read());
    } catch (IOException e) {
      LOG.error("Error loading system configuration file {}.", path);
      throw new RuntimeException(e);
    }
  }

  @VisibleForTesting
  static SystemConfig parseSystemConfig(String contents) {
    checkArgument(!Strings.isNullOrEmpty(contents), "configuration cannot be empty");
    try {
      return MAPPER.readValue(contents, SystemConfig.class);
    } catch (IOException e) {
      LOG.error("Error parsing system configuration.");
      throw new RuntimeException(e);
    }
  }

  /**
   * Derives the settings a Chronos client connects with. The first configured URL is used.
   *
   * @param config Chronos configuration.
   * @return Client settings.
   * @throws ChronosNotConfiguredException If the configuration is incomplete or the URL is
   *     malformed.
   */
  public static ChronosClientSettings clientSettings(ChronosConfig config)
      throws ChronosNotConfiguredException {

    String url = config.getUrls().get(0);
    String hostname;
    try {
      hostname = URI.create(url).getRawAuthority();
    } catch (IllegalArgumentException e) {
      throw new ChronosNotConfiguredException(
          String.format(
              "Invalid chronos url %s in system chronos config: %s", url, config.getPath()),
          e);
    }
    if (Strings.isNullOrEmpty(hostname)) {
      throw new ChronosNotConfiguredException(String.format(
          "No host in chronos url %s in system chronos config: %s", url, config.getPath()));
    }

    LOG.info("Connecting to Chronos server at: {}", url);
    return new ChronosClientSettings(hostname, config.getUsername(), config.getPassword());
  }
}
