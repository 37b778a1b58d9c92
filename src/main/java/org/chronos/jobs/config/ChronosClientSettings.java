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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Connection settings for a Chronos API client.
 */
public final class ChronosClientSettings {
  private final String hostname;
  private final String username;
  private final String password;

  public ChronosClientSettings(String hostname, String username, String password) {
    this.hostname = requireNonNull(hostname);
    this.username = requireNonNull(username);
    this.password = requireNonNull(password);
  }

  /**
   * Gets the network location of the API, e.g. {@code chronos.example.com:4400}.
   */
  public String getHostname() {
    return hostname;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ChronosClientSettings)) {
      return false;
    }

    ChronosClientSettings other = (ChronosClientSettings) o;
    return Objects.equals(hostname, other.hostname)
        && Objects.equals(username, other.username)
        && Objects.equals(password, other.password);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hostname, username, password);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("hostname", hostname)
        .add("username", username)
        .toString();
  }
}
