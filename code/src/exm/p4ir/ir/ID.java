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

import exm.p4ir.common.exceptions.IRInvariantError;

/**
 * An identifier token.  Carries the name it currently has inside the
 * compiler, which renaming passes may change, and the name as the user
 * wrote it, which is what gets shown in messages.
 */
public class ID {
  /** The placeholder name that can't be referred to */
  public static final String DONT_CARE = "_";

  public final SourceInfo srcInfo;
  public final String name;
  public final String originalName;

  public ID(String name) {
    this(SourceInfo.INVALID, name, name);
  }

  public ID(SourceInfo srcInfo, String name) {
    this(srcInfo, name, name);
  }

  public ID(SourceInfo srcInfo, String name, String originalName) {
    if (name == null || name.isEmpty()) {
      throw new IRInvariantError("Identifier with no name at " + srcInfo);
    }
    this.srcInfo = srcInfo == null ? SourceInfo.INVALID : srcInfo;
    this.name = name;
    this.originalName = originalName == null ? name : originalName;
  }

  /**
   * @param newName new internal name
   * @return identifier with same original name and location
   */
  public ID rename(String newName) {
    return new ID(srcInfo, newName, originalName);
  }

  public boolean isDontCare() {
    return DONT_CARE.equals(name);
  }

  @Override
  public String toString() {
    return originalName;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ID)) {
      return false;
    }
    return name.equals(((ID) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}
