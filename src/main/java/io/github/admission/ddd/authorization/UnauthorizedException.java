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

package io.github.admission.ddd.authorization;

import java.io.Serial;

/**
 * Thrown by a bounded context before any state is read or written, when the {@link DomainClient}
 * of a message is not allowed to use the handler registered for it.
 */
public class UnauthorizedException extends RuntimeException {
  @Serial private static final long serialVersionUID = -5310937728164020915L;

  /** Creates the exception without a detail message. */
  public UnauthorizedException() {
    super();
  }

  /**
   * @param message naming the client role and the refused message
   */
  public UnauthorizedException(String message) {
    super(message);
  }

  /**
   * @param message naming the client role and the refused message
   * @param cause of the refusal, {@code null} when unknown
   */
  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @param cause of the refusal, {@code null} when unknown
   */
  public UnauthorizedException(Throwable cause) {
    super(cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 403;
  }
}
