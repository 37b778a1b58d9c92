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

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class BranchRecordTest {

  @Test
  public void testFromMap() {
    BranchRecord record = BranchRecord.fromMap(ImmutableMap.of(
        "docker_image", "services-foo:jenkins-abc123",
        "desired_state", "stop",
        "force_bounce", "20160101T000000"));
    assertEquals("services-foo:jenkins-abc123", record.getDockerImage());
    assertEquals(Optional.of(DesiredState.STOP), record.getDesiredState());
  }

  @Test
  public void testEmpty() {
    BranchRecord record = BranchRecord.fromMap(ImmutableMap.of());
    assertEquals(BranchRecord.empty(), record);
    assertEquals("", record.getDockerImage());
    assertEquals("start", record.getRawDesiredState());
    assertEquals(Optional.of(DesiredState.START), record.getDesiredState());
  }

  @Test
  public void testUnknownDesiredState() {
    BranchRecord record = BranchRecord.fromMap(ImmutableMap.of("desired_state", "paused"));
    assertEquals("paused", record.getRawDesiredState());
    assertEquals(Optional.empty(), record.getDesiredState());
  }
}
