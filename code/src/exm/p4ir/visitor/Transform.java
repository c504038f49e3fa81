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

import org.apache.log4j.Logger;

import exm.p4ir.ir.Annotation;
import exm.p4ir.ir.Annotations;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.Path;
import exm.p4ir.ir.Declarations.Declaration;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.ir.Statements.Statement;
import exm.p4ir.ir.Types.Type;

/**
 * Rewriting traversal.  preorder and postorder return the node that
 * replaces the one visited: the node itself to keep it, a new node to
 * replace it, or null to remove it from a list.  Nodes are never changed
 * in place; ancestors of a replaced node are copied on the way back up,
 * and untouched subtrees are returned as they were.
 */
public abstract class Transform extends Visitor {

  private boolean pruned = false;

  /** Node the current replacement was derived from */
  private Node original = null;

  protected Transform() {
    super();
  }

  protected Transform(Logger logger) {
    super(logger);
  }

  @Override
  protected final Node visit(Node node) {
    Node savedOriginal = original;
    original = node;
    pruned = false;
    Node current = preorder(node);
    boolean skipChildren = pruned;
    pruned = false;
    if (current != null && !skipChildren) {
      enterNode(current);
      current = current.visitChildren(this);
      exitNode();
    }
    if (current != null) {
      original = node;
      current = postorder(current);
    }
    original = savedOriginal;
    return current;
  }

  /**
   * Don't visit the children of the node whose preorder is running
   */
  protected void prune() {
    pruned = true;
  }

  /**
   * @return the node as it was before this traversal started rewriting it
   */
  protected Node getOriginal() {
    return original;
  }

  public Node preorder(Node node) {
    switch (node.kind().category()) {
      case TYPE:
        return preorder(node.to(Type.class));
      case DECLARATION:
        return preorder(node.to(Declaration.class));
      case EXPRESSION:
        return preorder(node.to(Expression.class));
      case STATEMENT:
        return preorder(node.to(Statement.class));
      case PATH:
        return preorder(node.to(Path.class));
      case ANNOTATION:
        if (node instanceof Annotations) {
          return preorder((Annotations) node);
        }
        return preorder(node.to(Annotation.class));
      default:
        return preorderOther(node);
    }
  }

  public Node postorder(Node node) {
    switch (node.kind().category()) {
      case TYPE:
        return postorder(node.to(Type.class));
      case DECLARATION:
        return postorder(node.to(Declaration.class));
      case EXPRESSION:
        return postorder(node.to(Expression.class));
      case STATEMENT:
        return postorder(node.to(Statement.class));
      case PATH:
        return postorder(node.to(Path.class));
      case ANNOTATION:
        if (node instanceof Annotations) {
          return postorder((Annotations) node);
        }
        return postorder(node.to(Annotation.class));
      default:
        return postorderOther(node);
    }
  }

  public Node preorder(Type type) {
    return type;
  }

  public Node preorder(Declaration decl) {
    return decl;
  }

  public Node preorder(Expression expr) {
    return expr;
  }

  public Node preorder(Statement stmt) {
    return stmt;
  }

  public Node preorder(Path path) {
    return path;
  }

  public Node preorder(Annotation annotation) {
    return annotation;
  }

  public Node preorder(Annotations annotations) {
    return annotations;
  }

  public Node preorderOther(Node node) {
    return node;
  }

  public Node postorder(Type type) {
    return type;
  }

  public Node postorder(Declaration decl) {
    return decl;
  }

  public Node postorder(Expression expr) {
    return expr;
  }

  public Node postorder(Statement stmt) {
    return stmt;
  }

  public Node postorder(Path path) {
    return path;
  }

  public Node postorder(Annotation annotation) {
    return annotation;
  }

  public Node postorder(Annotations annotations) {
    return annotations;
  }

  public Node postorderOther(Node node) {
    return node;
  }
}
