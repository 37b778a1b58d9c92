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
import java.util.Optional;

/**
 * Resolves the address that owns a service's jobs in Chronos.
 */
public interface OwnerLookup {

  /**
   * Gets the email address of the team owning a service.
   *
   * @param service Service name.
   * @param monitoring Monitoring overrides from the job configuration.
   * @return The owning team's address, if known.
   */
  Optional<String> getTeamEmailAddress(String service, Map<String, Object> monitoring);

  /**
   * Resolves owners from the {@code notification_email} monitoring override only.
   */
  class FromMonitoringOverrides implements OwnerLookup {
    static final String NOTIFICATION_EMAIL = "notification_email";

    @Override
    public Optional<String> getTeamEmailAddress(String service, Map<String, Object> monitoring) {
      Object email = monitoring.get(NOTIFICATION_EMAIL);
      return email instanceof String ? Optional.of((String) email) : Optional.empty();
    }
  }
}
