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
package org.chronos.jobs.client;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A job as reported by Chronos in a job listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReportedJob {
  private final String name;
  private final boolean disabled;

  @JsonCreator
  public ReportedJob(
      @JsonProperty("name") String name,
      @JsonProperty("disabled") boolean disabled) {

    this.name = requireNonNull(name);
    this.disabled = disabled;
  }

  public String getName() {
    return name;
  }

  public boolean isDisabled() {
    return disabled;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ReportedJob)) {
      return false;
    }

    ReportedJob other = (ReportedJob) o;
    return Objects.equals(name, other.name)
        && disabled == other.disabled;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, disabled);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("disabled", disabled)
        .toString();
  }
}
