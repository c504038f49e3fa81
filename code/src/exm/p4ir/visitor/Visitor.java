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
package exm.p4ir.visitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.p4ir.common.Logging;
import exm.p4ir.common.Settings;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Node;

/**
 * Drives a depth-first traversal of a tree.  Nodes call back into the
 * visitor from visitChildren() through visitChild, visitOptionalChild and
 * visitList; subclasses decide what happens at each node by implementing
 * visit().
 *
 * Trees may share subtrees.  By default a shared subtree is visited once
 * per traversal and every reference to it gets the same result, so a
 * rewrite keeps it shared.
 */
public abstract class Visitor {

  protected final Logger logger;

  /** Ancestors of the node being visited, innermost first */
  private final Deque<Node> context = new ArrayDeque<Node>();

  /** Results of nodes visited in this traversal, by identity */
  private Map<Node, Node> visited = null;

  private boolean dagOnce = true;

  protected Visitor() {
    this(Logging.getIRLogger());
  }

  protected Visitor(Logger logger) {
    this.logger = logger;
  }

  /**
   * Traverse the tree rooted at root.
   * @return the root of the resulting tree: root itself if nothing was
   *         replaced.  Null if the root itself was removed.
   */
  public Node apply(Node root) {
    if (root == null) {
      throw new IRInvariantError("Applying " + getName() + " to null tree");
    }
    dagOnce = visitDagOnce();
    visited = new IdentityHashMap<Node, Node>();
    context.clear();
    init(root);
    Node result = visitNode(root, "root");
    end(result);
    visited = null;
    return result;
  }

  /**
   * Called before the traversal starts
   */
  protected void init(Node root) {
    // Nothing by default
  }

  /**
   * Called after the traversal with the resulting tree
   */
  protected void end(Node result) {
    // Nothing by default
  }

  /**
   * Handle one node: visit its children if appropriate and return what
   * should replace it.
   */
  protected abstract Node visit(Node node);

  /**
   * Whether expressions' inferred types are traversed as children.
   * Types are shared widely, so only visitors that work on types ask for
   * this.
   */
  public boolean visitExpressionTypes() {
    return false;
  }

  /**
   * Whether shared subtrees are visited once per traversal.  Visitors
   * that depend on the path from the root override this to return false.
   */
  protected boolean visitDagOnce() {
    return Settings.getBooleanInternal(Settings.VISIT_DAG_ONCE);
  }

  public String getName() {
    return getClass().getSimpleName();
  }

  /**
   * Visit a required child.
   * @return replacement, or child itself if unchanged
   * @throws IRInvariantError if child is null, was removed, or was
   *         replaced by a node of the wrong class
   */
  public <T extends Node> T visitChild(T child, Class<T> cls, String field) {
    if (child == null) {
      throw new IRInvariantError("Null " + field + " under " + parentName());
    }
    Node result = visitNode(child, field);
    if (result == null) {
      throw new IRInvariantError(getName() + " removed required " + field +
                                 " of " + parentName());
    }
    return checkClass(result, cls, field);
  }

  /**
   * Same as visitChild, but child may be null.
   */
  public <T extends Node> T visitOptionalChild(T child, Class<T> cls,
                                               String field) {
    if (child == null) {
      return null;
    }
    return visitChild(child, cls, field);
  }

  /**
   * Visit the elements of a list.  Elements replaced by null are dropped.
   * @return list itself if no element changed, otherwise a new immutable
   *         list
   */
  public <T extends Node> List<T> visitList(List<T> list, Class<T> cls,
                                            String field) {
    List<T> result = null;
    for (int i = 0; i < list.size(); i++) {
      T elem = list.get(i);
      Node newElem = visitNode(elem, field);
      if (result == null && newElem != elem) {
        result = new ArrayList<T>(list.subList(0, i));
      }
      if (result != null && newElem != null) {
        result.add(checkClass(newElem, cls, field));
      }
    }
    if (result == null) {
      return list;
    }
    return ImmutableList.copyOf(result);
  }

  private Node visitNode(Node node, String field) {
    if (dagOnce && visited.containsKey(node)) {
      if (logger.isTraceEnabled()) {
        logger.trace(getName() + ": already visited " + field + " " +
                     node.dbprint());
      }
      return visited.get(node);
    }
    if (logger.isTraceEnabled()) {
      logger.trace(getName() + ": visit " + field + " " + node.dbprint());
    }
    Node result = visit(node);
    if (dagOnce) {
      visited.put(node, result);
    }
    return result;
  }

  private <T extends Node> T checkClass(Node node, Class<T> cls,
                                        String field) {
    if (!cls.isInstance(node)) {
      throw new IRInvariantError(getName() + " put " +
          node.kind().typeName() + " in " + field + " of " + parentName() +
          ", expected " + cls.getSimpleName());
    }
    return cls.cast(node);
  }

  private String parentName() {
    Node parent = context.peek();
    return parent == null ? "root" : parent.kind().typeName();
  }

  /**
   * Called by subclasses around visiting the children of node
   */
  protected void enterNode(Node node) {
    context.push(node);
  }

  protected void exitNode() {
    context.pop();
  }

  /**
   * @return parent of the node being visited, or null at the root
   */
  public Node getContext() {
    return context.peek();
  }

  /**
   * @return innermost ancestor of class cls, or null if none
   */
  public <T> T findContext(Class<T> cls) {
    for (Node n: context) {
      if (cls.isInstance(n)) {
        return cls.cast(n);
      }
    }
    return null;
  }

  /**
   * @return ancestors of the node being visited, innermost first
   */
  public List<Node> getAncestors() {
    return new ArrayList<Node>(context);
  }

  /**
   * @return depth of the node being visited, 0 for the root
   */
  public int getDepth() {
    return context.size();
  }
}
