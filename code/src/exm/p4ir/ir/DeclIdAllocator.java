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
package exm.p4ir.ir;

/**
 * Hands out declaration ids for one compilation.  Ids are sequential and
 * never reused, so two declarations with the same name can always be told
 * apart.  One allocator is shared by both declaration hierarchies.
 */
public class DeclIdAllocator {
  private int next = 0;

  public int nextId() {
    return next++;
  }

  /**
   * @return number of ids handed out so far
   */
  public int allocated() {
    return next;
  }

  @Override
  public String toString() {
    return "DeclIdAllocator(next=" + next + ")";
  }
}
