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
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * Deployment metadata resolved for a job's branch: the docker image that should run, and the
 * state the job should be in.
 */
public final class BranchRecord {
  public static final String DOCKER_IMAGE = "docker_image";
  public static final String DESIRED_STATE = "desired_state";

  private static final String DEFAULT_DESIRED_STATE = "start";

  private final String dockerImage;
  private final String desiredState;

  public BranchRecord(@Nullable String dockerImage, @Nullable String desiredState) {
    this.dockerImage = Strings.nullToEmpty(dockerImage);
    this.desiredState = desiredState == null ? DEFAULT_DESIRED_STATE : desiredState;
  }

  /**
   * Creates a record for a branch that has no deployment yet.
   */
  public static BranchRecord empty() {
    return new BranchRecord(null, null);
  }

  /**
   * Reads a record from its deployment mapping, e.g.
   * {@code {"docker_image": "services-foo:jenkins-abc123", "desired_state": "start"}}.
   *
   * @param branch Deployment mapping for the branch.
   * @return The branch record.
   */
  public static BranchRecord fromMap(Map<String, ?> branch) {
    return new BranchRecord(
        asString(branch.get(DOCKER_IMAGE)),
        asString(branch.get(DESIRED_STATE)));
  }

  @Nullable
  private static String asString(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  /**
   * Gets the deployed docker image, empty if nothing has been deployed.
   */
  public String getDockerImage() {
    return dockerImage;
  }

  public String getRawDesiredState() {
    return desiredState;
  }

  /**
   * Gets the desired state, if it is one this system understands.
   */
  public Optional<DesiredState> getDesiredState() {
    return DesiredState.parse(desiredState);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BranchRecord)) {
      return false;
    }

    BranchRecord other = (BranchRecord) o;
    return Objects.equals(dockerImage, other.dockerImage)
        && Objects.equals(desiredState, other.desiredState);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dockerImage, desiredState);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("dockerImage", dockerImage)
        .add("desiredState", desiredState)
        .toString();
  }
}
