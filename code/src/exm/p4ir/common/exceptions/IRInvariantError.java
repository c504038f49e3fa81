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
package exm.p4ir.common.exceptions;

/**
 * An internal invariant of the IR was violated: the tree is malformed.
 * These always indicate a bug in whichever pass built the tree, never a
 * problem with the user's program, so they are not meant to be caught.
 */
public class IRInvariantError extends RuntimeException {
  public IRInvariantError(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
