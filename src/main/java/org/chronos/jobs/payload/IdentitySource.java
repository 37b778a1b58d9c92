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

/**
 * Derives the content identifiers that make up a job's revision tag.
 */
public interface IdentitySource {

  /**
   * Derives an identifier of the code in a docker image, e.g. {@code git1a2b3c4d}.
   *
   * @param dockerUrl Full image reference.
   * @return Code identifier, without spaces.
   */
  String getCodeSha(String dockerUrl);

  /**
   * Hashes a job payload, e.g. {@code configa1b2c3d4}.
   *
   * @param payload Payload to hash, named after the job only.
   * @return Configuration hash, without spaces.
   */
  String getConfigHash(ChronosJobPayload payload);
}
