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
 * Read-only traversal.  Subclasses override the preorder/postorder
 * overloads for the categories of node they are interested in.  The tree
 * is returned unchanged.
 */
public abstract class Inspector extends Visitor {

  protected Inspector() {
    super();
  }

  protected Inspector(Logger logger) {
    super(logger);
  }

  @Override
  protected final Node visit(Node node) {
    if (preorder(node)) {
      enterNode(node);
      node.visitChildren(this);
      exitNode();
    }
    postorder(node);
    return node;
  }

  /**
   * @return true to visit node's children
   */
  public boolean preorder(Node node) {
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

  public void postorder(Node node) {
    switch (node.kind().category()) {
      case TYPE:
        postorder(node.to(Type.class));
        break;
      case DECLARATION:
        postorder(node.to(Declaration.class));
        break;
      case EXPRESSION:
        postorder(node.to(Expression.class));
        break;
      case STATEMENT:
        postorder(node.to(Statement.class));
        break;
      case PATH:
        postorder(node.to(Path.class));
        break;
      case ANNOTATION:
        if (node instanceof Annotations) {
          postorder((Annotations) node);
        } else {
          postorder(node.to(Annotation.class));
        }
        break;
      default:
        postorderOther(node);
        break;
    }
  }

  public boolean preorder(Type type) {
    return true;
  }

  public boolean preorder(Declaration decl) {
    return true;
  }

  public boolean preorder(Expression expr) {
    return true;
  }

  public boolean preorder(Statement stmt) {
    return true;
  }

  public boolean preorder(Path path) {
    return true;
  }

  public boolean preorder(Annotation annotation) {
    return true;
  }

  public boolean preorder(Annotations annotations) {
    return true;
  }

  /**
   * Lists, type parameters and the program root
   */
  public boolean preorderOther(Node node) {
    return true;
  }

  public void postorder(Type type) {
  }

  public void postorder(Declaration decl) {
  }

  public void postorder(Expression expr) {
  }

  public void postorder(Statement stmt) {
  }

  public void postorder(Path path) {
  }

  public void postorder(Annotation annotation) {
  }

  public void postorder(Annotations annotations) {
  }

  public void postorderOther(Node node) {
  }
}
