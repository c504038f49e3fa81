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
import exm.p4ir.visitor.Visitor;

/**
 * A reference to something by name.  An absolute path starts from the
 * top-level namespace and is written with a leading dot.
 */
public class Path extends Node {
  public static final String ABSOLUTE_PREFIX = ".";

  private ID name;
  private final boolean absolute;

  public Path(ID name) {
    this(SourceInfo.INVALID, name, false);
  }

  public Path(ID name, boolean absolute) {
    this(SourceInfo.INVALID, name, absolute);
  }

  public Path(SourceInfo srcInfo, ID name, boolean absolute) {
    super(orElse(srcInfo, name == null ? null : name.srcInfo));
    this.name = name;
    this.absolute = absolute;
    validate();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PATH;
  }

  public ID getName() {
    return name;
  }

  public boolean isAbsolute() {
    return absolute;
  }

  public boolean isDontCare() {
    return !absolute && name.isDontCare();
  }

  @Override
  public void validate() {
    if (name == null || name.name.isEmpty()) {
      throw new IRInvariantError("Path with empty name at " + srcInfo);
    }
  }

  /**
   * @return copy referring to newName, e.g. after the target was renamed
   */
  public Path withName(ID newName) {
    Path copy = (Path) clone();
    copy.name = newName;
    copy.validate();
    return copy;
  }

  @Override
  public Node visitChildren(Visitor v) {
    // ID is not a node
    return this;
  }

  /**
   * @return path as the user wrote it
   */
  @Override
  public String toString() {
    return absolute ? ABSOLUTE_PREFIX + name.originalName : name.originalName;
  }

  /**
   * @return path with the current internal name
   */
  public String asString() {
    return absolute ? ABSOLUTE_PREFIX + name.name : name.name;
  }

  @Override
  public String dbprint() {
    return kind().typeName() + " " + asString();
  }
}
