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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static java.util.Objects.requireNonNull;

/**
 * System configuration for reaching the Chronos API.
 */
public final class ChronosConfig {
  static final String URL = "url";
  static final String USER = "user";
  static final String PASSWORD = "password";

  private final Map<String, Object> config;
  private final String path;

  /**
   * Creates a configuration.
   *
   * @param config Configuration values.
   * @param path Where the values were read from, for error reporting.
   */
  public ChronosConfig(Map<String, ?> config, String path) {
    this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
    this.path = requireNonNull(path);
  }

  public String getPath() {
    return path;
  }

  /**
   * Gets the Chronos API endpoints.
   *
   * @return Endpoint URLs, in order of preference.
   * @throws ChronosNotConfiguredException If no endpoint is configured.
   */
  public List<String> getUrls() throws ChronosNotConfiguredException {
    Object urls = config.get(URL);
    if (urls instanceof String) {
      return ImmutableList.of((String) urls);
    }
    if (!(urls instanceof List) || ((List<?>) urls).isEmpty()) {
      throw notConfigured(URL);
    }
    return ((List<?>) urls).stream()
        .map(Object::toString)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Gets the Chronos API username.
   *
   * @throws ChronosNotConfiguredException If no username is configured.
   */
  public String getUsername() throws ChronosNotConfiguredException {
    return getString(USER);
  }

  /**
   * Gets the Chronos API password.
   *
   * @throws ChronosNotConfiguredException If no password is configured.
   */
  public String getPassword() throws ChronosNotConfiguredException {
    return getString(PASSWORD);
  }

  private String getString(String key) throws ChronosNotConfiguredException {
    Object value = config.get(key);
    if (value == null) {
      throw notConfigured(key);
    }
    return value.toString();
  }

  private ChronosNotConfiguredException notConfigured(String key) {
    return new ChronosNotConfiguredException(
        String.format("Could not find chronos %s in system chronos config: %s", key, path));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("path", path)
        .add("keys", config.keySet())
        .toString();
  }
}
