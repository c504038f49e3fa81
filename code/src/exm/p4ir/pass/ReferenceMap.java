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
package exm.p4ir.pass;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Path;
import exm.p4ir.ir.Capabilities.Declared;

/**
 * Result of name resolution: the declaration each path refers to.  Paths
 * are keyed by identity, since two paths spelling the same name in
 * different scopes may mean different things.
 */
public class ReferenceMap {
  private final Map<Path, Declared> pathToDecl =
                                new IdentityHashMap<Path, Declared>();

  /** Ids of declarations referred to at least once */
  private final Set<Integer> used = new HashSet<Integer>();

  /**
   * Record decl for path, replacing any earlier entry for the same path
   * object
   */
  public void setDeclaration(Path path, Declared decl) {
    pathToDecl.put(path, decl);
    used.add(decl.getDeclId());
  }

  /**
   * @return declaration, or null if path wasn't resolved
   */
  public Declared getDeclaration(Path path) {
    return pathToDecl.get(path);
  }

  /**
   * @param notNull if true, a missing entry is an error
   */
  public Declared getDeclaration(Path path, boolean notNull) {
    Declared decl = pathToDecl.get(path);
    if (decl == null && notNull) {
      throw new IRInvariantError("No declaration recorded for " + path +
                                 " at " + path.getSourceInfo());
    }
    return decl;
  }

  public boolean isUsed(Declared decl) {
    return used.contains(decl.getDeclId());
  }

  public int size() {
    return pathToDecl.size();
  }

  public void clear() {
    pathToDecl.clear();
    used.clear();
  }

  @Override
  public String toString() {
    return "ReferenceMap(" + pathToDecl.size() + " paths)";
  }
}
