/*
 * Copyright 2024 Roman Khlebnov
 *
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

package io.github.admission.supervision.repository;

import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;

/**
 * Thrown when a group is saved while another unit of work already stored a newer version of it.
 * The caller is expected to reload the group and retry.
 */
public class SupervisionGroupConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3021558416703394011L;

  private final transient SupervisionGroupIdentity groupId;
  private final long expectedVersion;

  /**
   * @param groupId of the group being saved
   * @param expectedVersion the group was loaded with
   */
  public SupervisionGroupConflictException(
      final SupervisionGroupIdentity groupId, final long expectedVersion) {
    super(
        "Supervision group '%s' was modified concurrently, expected version %d"
            .formatted(groupId == null ? null : groupId.uuid(), expectedVersion));
    this.groupId = groupId;
    this.expectedVersion = expectedVersion;
  }

  public SupervisionGroupIdentity getGroupId() {
    return groupId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
