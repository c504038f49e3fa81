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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.visitor.Visitor;

/**
 * Root of every IR entity.
 *
 * Nodes are treated as immutable once constructed: concrete constructors
 * finish by calling {@link #validate()}, and any "modification" is done on
 * a fresh {@link #clone()} that is validated before anyone else can see it.
 * Because of this, subtrees are freely shared between trees, and between
 * several parents within one tree.
 */
public abstract class Node implements Cloneable {

  /**
   * Where the node came from.  Not final only so that copy-on-write
   * helpers can set it on a fresh clone.
   */
  protected SourceInfo srcInfo;

  protected Node(SourceInfo srcInfo) {
    this.srcInfo = srcInfo == null ? SourceInfo.INVALID : srcInfo;
  }

  public SourceInfo getSourceInfo() {
    return srcInfo;
  }

  public abstract NodeKind kind();

  /**
   * Check structural invariants of this node.
   * @throws IRInvariantError if the node is malformed
   */
  public void validate() {
    // Nothing by default
  }

  /**
   * Pass each traversable field through the visitor.
   * @param v
   * @return this if no child was replaced, otherwise a validated copy
   *         of this node holding the replacement children
   */
  public abstract Node visitChildren(Visitor v);

  public Node apply(Visitor v) {
    return v.apply(this);
  }

  public boolean is(NodeKind kind) {
    return kind() == kind;
  }

  /**
   * Checked downcast
   * @throws IRInvariantError if node isn't of the expected class
   */
  public <T> T to(Class<T> cls) {
    if (!cls.isInstance(this)) {
      throw new IRInvariantError("Expected " + cls.getSimpleName() +
          " but got " + kind().typeName() + " " + this);
    }
    return cls.cast(this);
  }

  /**
   * @return node as cls, or null if it isn't one
   */
  public <T> T as(Class<T> cls) {
    if (cls.isInstance(this)) {
      return cls.cast(this);
    }
    return null;
  }

  /**
   * Developer-facing representation; unlike toString() this may show
   * internal details such as declaration ids.
   */
  public String dbprint() {
    return kind().typeName() + " " + toString();
  }

  @Override
  public String toString() {
    return kind().typeName();
  }

  /**
   * Shallow copy: children are shared with the original.  Only for use
   * by copy-on-write operations, which must validate the copy.
   */
  @Override
  public Node clone() {
    try {
      return (Node) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new IRInvariantError("Could not clone " + kind().typeName());
    }
  }

  /**
   * @return a copy of this node at a different location
   */
  public Node withSourceInfo(SourceInfo newSrcInfo) {
    Node copy = clone();
    copy.srcInfo = newSrcInfo == null ? SourceInfo.INVALID : newSrcInfo;
    copy.validate();
    return copy;
  }

  /**
   * Location to use when a constructor wasn't given one
   */
  protected static SourceInfo orElse(SourceInfo given, SourceInfo fallback) {
    if (given != null && given.isValid()) {
      return given;
    }
    return fallback == null ? SourceInfo.INVALID : fallback;
  }

  /**
   * Immutable copy of a list of children, checked before copying
   * @return null if list is null
   * @throws IRInvariantError if an element is null
   */
  protected static <T> List<T> copyChildren(List<? extends T> list,
                                     String fieldName, Node owner) {
    if (list == null) {
      return null;
    }
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == null) {
        throw new IRInvariantError(owner.kind().typeName() + ": element " +
                                   i + " of " + fieldName + " is null");
      }
    }
    return ImmutableList.<T>copyOf(list);
  }

  protected static void checkNotNull(Object field, String fieldName,
                                     Node owner) {
    if (field == null) {
      throw new IRInvariantError(owner.kind().typeName() + ": " + fieldName +
                                 " may not be null");
    }
  }
}
