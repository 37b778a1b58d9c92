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

/**
 * Source of deployment state for service branches.
 */
public interface DeploymentSource {

  /**
   * Resolves the deployment of a service branch.
   *
   * @param service Service name.
   * @param branch Branch name.
   * @return The branch record, {@link BranchRecord#empty()} if the branch was never deployed.
   */
  BranchRecord getBranchRecord(String service, String branch);
}
