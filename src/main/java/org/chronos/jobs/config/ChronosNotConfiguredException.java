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

/**
 * Thrown when the configuration needed to reach Chronos is missing. Nothing can be submitted or
 * queried until this is fixed, regardless of job content.
 */
public class ChronosNotConfiguredException extends Exception {
  public ChronosNotConfiguredException(String msg) {
    super(msg);
  }

  public ChronosNotConfiguredException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
