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
package org.chronos.jobs.payload;

import java.util.List;

import javax.inject.Inject;

import org.chronos.jobs.configuration.ChronosJobConfig;
import org.chronos.jobs.configuration.InvalidChronosConfigException;
import org.chronos.jobs.configuration.OwnerLookup;
import org.chronos.jobs.configuration.SanitizedChronosJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Translates a job configuration into the payload submitted to Chronos.
 */
public class PayloadBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(PayloadBuilder.class);

  private final OwnerLookup ownerLookup;

  @Inject
  public PayloadBuilder(OwnerLookup ownerLookup) {
    this.ownerLookup = requireNonNull(ownerLookup);
  }

  /**
   * Validates a job configuration and builds its payload. The payload is named after the job;
   * callers assign the revision-specific name.
   *
   * @param config Job configuration.
   * @param dockerUrl Full reference of the image to run.
   * @param volumes Volumes to mount into the container.
   * @return The payload.
   * @throws InvalidChronosConfigException If the configuration is invalid.
   */
  public ChronosJobPayload build(ChronosJobConfig config, String dockerUrl, List<Volume> volumes)
      throws InvalidChronosConfigException {

    requireNonNull(dockerUrl);
    requireNonNull(volumes);

    SanitizedChronosJob job = SanitizedChronosJob.fromUnsanitized(config);

    ChronosJobPayload payload = ChronosJobPayload.builder()
        .setName(job.getJobKey().getJob())
        .setContainer(new ChronosJobPayload.Container(dockerUrl, volumes))
        .setEnvironmentVariables(job.getEnv())
        .setMem(job.getMem())
        .setCpus(job.getCpus())
        .setConstraints(job.getConstraints().orElse(null))
        .setCommand(job.getCmd().orElse(null))
        .setArguments(job.getArgs().orElse(null))
        .setEpsilon(job.getEpsilon())
        .setRetries(job.getRetries())
        .setDisabled(job.isDisabled())
        .setOwner(getOwner(job))
        .setSchedule(job.getSchedule())
        .setScheduleTimeZone(job.getScheduleTimeZone().orElse(null))
        .build();

    LOG.info("Complete configuration for instance is: {}", payload);
    return payload;
  }

  private String getOwner(SanitizedChronosJob job) {
    if (job.getOwner().isPresent()) {
      return job.getOwner().get();
    }
    return ownerLookup.getTeamEmailAddress(job.getJobKey().getService(), job.getMonitoring())
        .orElse(null);
  }
}
