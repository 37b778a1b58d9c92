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
package org.chronos.jobs.base;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Utility class for composing the names that jobs are registered under in Chronos.
 *
 * <p>Chronos discards the run history of a job whenever a job of the same name is updated in
 * place. Each content revision of a job is therefore submitted under its own name, composed of
 * the job key and a revision tag, so that history of earlier revisions survives and old
 * revisions can be cleaned up independently.
 */
public final class JobIds {
  /**
   * Separator between components of a Chronos job name. Chronos does not allow periods in job
   * names, and suggests a space as the natural separator.
   */
  public static final String SPACER = " ";

  /**
   * Separator used for names internal to this system, e.g. deployment branches. This is the
   * inverse of the convention in Marathon, which shares the service/job namespace.
   */
  public static final String INTERNAL_SPACER = ".";

  private static final Joiner JOINER = Joiner.on(SPACER);

  private JobIds() {
    // Utility class.
  }

  /**
   * Composes the untagged Chronos name of a job.
   *
   * @param key Job key.
   * @return {@code service + SPACER + job}.
   */
  public static String jobId(JobKey key) {
    return jobId(key, null);
  }

  /**
   * Composes the Chronos name of a job, optionally suffixed with a revision tag.
   *
   * @param key Job key.
   * @param tag Revision tag, as produced by {@link #revisionTag(String, String)}.
   * @return {@code service + SPACER + job [+ SPACER + tag]}.
   */
  public static String jobId(JobKey key, @Nullable String tag) {
    if (Strings.isNullOrEmpty(tag)) {
      return JOINER.join(key.getService(), key.getJob());
    }
    return JOINER.join(key.getService(), key.getJob(), tag);
  }

  /**
   * Derives the revision tag for a combination of code and configuration. Identical inputs always
   * yield the same tag, and a change to either input yields a different tag.
   *
   * @param codeSha Identifier of the code, derived from the docker image.
   * @param configHash Hash of the job configuration.
   * @return The revision tag.
   */
  public static String revisionTag(String codeSha, String configHash) {
    checkTagComponent("code sha", codeSha);
    checkTagComponent("config hash", configHash);
    return JOINER.join(codeSha, configHash);
  }

  private static void checkTagComponent(String label, String value) {
    checkArgument(!Strings.isNullOrEmpty(value), "A %s is required.", label);
    // A spacer inside a component would let two different pairs render to the same tag.
    checkArgument(!value.contains(SPACER), "Invalid %s: '%s'", label, value);
  }
}
