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
package org.chronos.jobs.configuration;

import java.util.Map;
import java.util.Set;

/**
 * Source of authored service configuration.
 */
public interface JobConfigSource {

  /**
   * Lists every service that has configuration.
   *
   * @return Service names.
   */
  Set<String> listServices();

  /**
   * Reads one of a service's configuration files, e.g. {@code chronos-norcal}.
   *
   * @param service Service name.
   * @param fileName Configuration file name, without extension.
   * @return Job name to authored job configuration. Empty if the file does not exist.
   */
  Map<String, Map<String, Object>> readServiceConfig(String service, String fileName);
}
