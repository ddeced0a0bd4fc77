/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.ceva.common.exceptions;

import exm.ceva.common.lang.SourceSpan;

/**
 * Thrown inside the formula encoder when a contract uses a construct
 * that has no solver encoding.  Never escapes the encoder: it becomes an
 * Unsupported outcome for that one contract.
 */
public class UnsupportedConstructException extends Exception {
  private final SourceSpan span;

  public UnsupportedConstructException(SourceSpan span, String message) {
    super(message);
    this.span = span;
  }

  public SourceSpan getSpan() {
    return span;
  }

  private static final long serialVersionUID = 1L;
}
