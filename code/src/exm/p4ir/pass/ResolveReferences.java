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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.ir.Namespaces;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.Path;
import exm.p4ir.ir.Program;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.Functional;
import exm.p4ir.ir.Capabilities.MayBeGeneric;
import exm.p4ir.ir.Capabilities.Namespace;
import exm.p4ir.visitor.Inspector;

/**
 * Find the declaration of every path in a tree and record it in a
 * ReferenceMap.  Scopes are the enclosing nodes, innermost first: every
 * enclosing namespace, plus the type parameters of generic nodes and the
 * parameters of nodes that take them.  Absolute paths are looked up in
 * the program only.
 */
public class ResolveReferences extends Inspector implements Pass {

  private final ReferenceMap refMap;
  private Diagnostics diags;
  private int unresolved = 0;

  public ResolveReferences(ReferenceMap refMap) {
    this.refMap = refMap;
  }

  @Override
  public String getPassName() {
    return "Resolve references";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  public ReferenceMap getReferenceMap() {
    return refMap;
  }

  @Override
  public Node apply(Logger logger, Node root, Diagnostics diags) {
    this.diags = diags;
    apply(root);
    logger.debug(getPassName() + ": " + refMap.size() + " paths resolved, "
                 + unresolved + " unresolved");
    return root;
  }

  @Override
  protected void init(Node root) {
    if (diags == null) {
      diags = new Diagnostics(logger);
    }
    unresolved = 0;
    refMap.clear();
  }

  /**
   * A shared path is looked up again at every place it occurs, so each
   * occurrence is checked.  The reference map has one entry per path
   * object, so it keeps the lookup from the occurrence visited last.
   */
  @Override
  protected boolean visitDagOnce() {
    return false;
  }

  @Override
  public boolean preorder(Path path) {
    if (path.isDontCare()) {
      return false;
    }
    List<Namespace> scopes;
    if (path.isAbsolute()) {
      scopes = new ArrayList<Namespace>();
      Program program = findContext(Program.class);
      if (program != null) {
        scopes.add(program);
      }
    } else {
      scopes = enclosingScopes();
    }

    Declared decl = Namespaces.lookup(scopes, path.getName().name);
    if (decl == null) {
      unresolved++;
      diags.error(path.getSourceInfo(), "Undeclared name: " + path);
    } else {
      if (logger.isTraceEnabled()) {
        logger.trace(path.dbprint() + " -> " + decl.getNode().dbprint());
      }
      refMap.setDeclaration(path, decl);
    }
    return false;
  }

  private List<Namespace> enclosingScopes() {
    List<Namespace> scopes = new ArrayList<Namespace>();
    for (Node n: getAncestors()) {
      if (n instanceof Namespace) {
        scopes.add((Namespace) n);
      }
      if (n instanceof MayBeGeneric) {
        scopes.add(((MayBeGeneric) n).getTypeParameters());
      }
      if (n instanceof Functional) {
        scopes.add(((Functional) n).getParameters());
      }
    }
    return scopes;
  }
}
