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

import java.util.Optional;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import org.chronos.jobs.base.JobIds;
import org.chronos.jobs.base.JobKey;
import org.chronos.jobs.config.SystemConfig;
import org.chronos.jobs.configuration.ChronosJobConfig;
import org.chronos.jobs.configuration.ChronosJobConfigLoader;
import org.chronos.jobs.configuration.DesiredState;
import org.chronos.jobs.configuration.InvalidChronosConfigException;

import static java.util.Objects.requireNonNull;

/**
 * Produces the complete, revision-named payload to submit to Chronos for a job on the local
 * cluster.
 */
public class CompleteConfigFactory {
  private final ChronosJobConfigLoader loader;
  private final PayloadBuilder payloadBuilder;
  private final IdentitySource identitySource;
  private final SystemConfig systemConfig;

  @Inject
  public CompleteConfigFactory(
      ChronosJobConfigLoader loader,
      PayloadBuilder payloadBuilder,
      IdentitySource identitySource,
      SystemConfig systemConfig) {

    this.loader = requireNonNull(loader);
    this.payloadBuilder = requireNonNull(payloadBuilder);
    this.identitySource = requireNonNull(identitySource);
    this.systemConfig = requireNonNull(systemConfig);
  }

  /**
   * Generates the payload to POST to Chronos to create a job.
   *
   * @param service Service name.
   * @param job Job name.
   * @return The payload, named {@code service job codeSha configHash}.
   * @throws InvalidChronosConfigException If the job is not defined, has never been deployed, or
   *     its configuration is invalid.
   */
  public ChronosJobPayload create(String service, String job)
      throws InvalidChronosConfigException {

    ChronosJobConfig config = loader.load(service, job, systemConfig.getCluster());
    if (Strings.isNullOrEmpty(config.getDockerImage())) {
      throw new InvalidChronosConfigException(String.format(
          "No docker image is deployed for branch %s of service %s",
          loader.defaultBranch(systemConfig.getCluster(), job),
          service));
    }

    String dockerUrl = getDockerUrl(systemConfig.getDockerRegistry(), config.getDockerImage());
    ChronosJobPayload payload = payloadBuilder.build(config, dockerUrl, systemConfig.getVolumes());

    String tag = JobIds.revisionTag(
        identitySource.getCodeSha(dockerUrl),
        identitySource.getConfigHash(payload));
    payload = payload.withName(JobIds.jobId(JobKey.from(service, job), tag));

    return applyDesiredState(payload, config.getDesiredState());
  }

  @VisibleForTesting
  static String getDockerUrl(String registry, String image) {
    return registry + "/" + image;
  }

  /**
   * Overrides the payload's disabled flag with the deployment's desired state, so that a job
   * stopped through deployment stays stopped across revisions.
   *
   * @param payload Payload to update.
   * @param desiredState Desired state, if known.
   * @return The updated payload, or {@code payload} if the desired state is unknown.
   */
  @VisibleForTesting
  static ChronosJobPayload applyDesiredState(
      ChronosJobPayload payload,
      Optional<DesiredState> desiredState) {

    return desiredState
        .map(state -> payload.withDisabled(state.isDisabled()))
        .orElse(payload);
  }
}
