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

import java.util.ArrayList;
import java.util.List;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.GeneralNamespace;
import exm.p4ir.visitor.Visitor;

/**
 * Root of a compilation's tree: the top-level declarations in source
 * order.  Top-level names may be overloaded, so this is a general
 * namespace.
 */
public class Program extends Node implements GeneralNamespace {
  private List<Node> objects;

  public Program(SourceInfo srcInfo, List<? extends Node> objects) {
    super(srcInfo);
    this.objects = copyChildren(objects, "objects", this);
    validate();
  }

  public Program(List<? extends Node> objects) {
    this(SourceInfo.INVALID, objects);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PROGRAM;
  }

  /**
   * @return top-level nodes, each a type declaration or a declaration
   */
  public List<Node> getObjects() {
    return objects;
  }

  @Override
  public Iterable<Declared> getDeclarations() {
    List<Declared> res = new ArrayList<Declared>(objects.size());
    for (Node n: objects) {
      res.add((Declared) n);
    }
    return res;
  }

  @Override
  public Iterable<Declared> getDeclsByName(String name) {
    return Namespaces.declsByName(getDeclarations(), name);
  }

  @Override
  public void validate() {
    checkNotNull(objects, "objects", this);
    for (Node n: objects) {
      checkNotNull(n, "object", this);
      if (!(n instanceof Declared)) {
        throw new IRInvariantError("Top-level " + n.kind().typeName() +
                                   " at " + n.getSourceInfo() +
                                   " is not a declaration");
      }
    }
  }

  @Override
  public Node visitChildren(Visitor v) {
    List<Node> newObjects = v.visitList(objects, Node.class, "objects");
    if (newObjects == objects) {
      return this;
    }
    Program copy = (Program) clone();
    copy.objects = newObjects;
    copy.validate();
    return copy;
  }

  @Override
  public String toString() {
    return kind().typeName() + "(" + objects.size() + " declarations)";
  }
}
