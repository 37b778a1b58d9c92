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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A host path mounted into a job's container.
 */
public final class Volume {

  /**
   * Access mode of a mounted volume.
   */
  public enum Mode {
    RO,
    RW
  }

  private final String containerPath;
  private final String hostPath;
  private final Mode mode;

  @JsonCreator
  public Volume(
      @JsonProperty("containerPath") String containerPath,
      @JsonProperty("hostPath") String hostPath,
      @JsonProperty("mode") Mode mode) {

    this.containerPath = requireNonNull(containerPath);
    this.hostPath = requireNonNull(hostPath);
    this.mode = requireNonNull(mode);
  }

  @JsonProperty("containerPath")
  public String getContainerPath() {
    return containerPath;
  }

  @JsonProperty("hostPath")
  public String getHostPath() {
    return hostPath;
  }

  @JsonProperty("mode")
  public Mode getMode() {
    return mode;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Volume)) {
      return false;
    }

    Volume other = (Volume) o;
    return Objects.equals(containerPath, other.containerPath)
        && Objects.equals(hostPath, other.hostPath)
        && mode == other.mode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(containerPath, hostPath, mode);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("containerPath", containerPath)
        .add("hostPath", hostPath)
        .add("mode", mode)
        .toString();
  }
}
