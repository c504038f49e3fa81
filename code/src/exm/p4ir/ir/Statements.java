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
import java.util.Map;

import exm.p4ir.ir.Capabilities.Annotated;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.SimpleNamespace;
import exm.p4ir.ir.Declarations.Declaration;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.ir.Expressions.MethodCallExpression;
import exm.p4ir.visitor.Visitor;

public class Statements {

  /**
   * Anything that can appear in a block: a statement or a local
   * declaration
   */
  public static abstract class StatOrDecl extends Node {
    protected StatOrDecl(SourceInfo srcInfo) {
      super(srcInfo);
    }
  }

  public static abstract class Statement extends StatOrDecl {
    protected Statement(SourceInfo srcInfo) {
      super(srcInfo);
    }
  }

  public static class AssignmentStatement extends Statement {
    private Expression left;
    private Expression right;

    public AssignmentStatement(SourceInfo srcInfo, Expression left,
                               Expression right) {
      super(orElse(srcInfo, left == null || right == null ? null :
                   left.getSourceInfo().merge(right.getSourceInfo())));
      this.left = left;
      this.right = right;
      validate();
    }

    public AssignmentStatement(Expression left, Expression right) {
      this(SourceInfo.INVALID, left, right);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGNMENT_STATEMENT;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public void validate() {
      checkNotNull(left, "left", this);
      checkNotNull(right, "right", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Expression newLeft = v.visitChild(left, Expression.class, "left");
      Expression newRight = v.visitChild(right, Expression.class, "right");
      if (newLeft == left && newRight == right) {
        return this;
      }
      AssignmentStatement copy = (AssignmentStatement) clone();
      copy.left = newLeft;
      copy.right = newRight;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return left + " = " + right;
    }
  }

  public static class MethodCallStatement extends Statement {
    private MethodCallExpression call;

    public MethodCallStatement(SourceInfo srcInfo, MethodCallExpression call) {
      super(orElse(srcInfo, call == null ? null : call.getSourceInfo()));
      this.call = call;
      validate();
    }

    public MethodCallStatement(MethodCallExpression call) {
      this(SourceInfo.INVALID, call);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.METHOD_CALL_STATEMENT;
    }

    public MethodCallExpression getCall() {
      return call;
    }

    @Override
    public void validate() {
      checkNotNull(call, "call", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      MethodCallExpression newCall = v.visitChild(call,
                              MethodCallExpression.class, "call");
      if (newCall == call) {
        return this;
      }
      MethodCallStatement copy = (MethodCallStatement) clone();
      copy.call = newCall;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return call.toString();
    }
  }

  public static class EmptyStatement extends Statement {
    public EmptyStatement(SourceInfo srcInfo) {
      super(srcInfo);
    }

    public EmptyStatement() {
      this(SourceInfo.INVALID);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EMPTY_STATEMENT;
    }

    @Override
    public Node visitChildren(Visitor v) {
      return this;
    }

    @Override
    public String toString() {
      return ";";
    }
  }

  /**
   * Sequence of statements and local declarations.  Local names are
   * unique within a block.
   */
  public static class BlockStatement extends Statement
                           implements Annotated, SimpleNamespace {
    private Annotations annotations;
    private List<StatOrDecl> components;
    private Map<String, Declared> index;

    public BlockStatement(SourceInfo srcInfo, Annotations annotations,
                          List<? extends StatOrDecl> components) {
      super(srcInfo);
      this.annotations = annotations == null ? Annotations.EMPTY
                                             : annotations.freeze();
      this.components = copyChildren(components, "components", this);
      validate();
    }

    public BlockStatement(List<? extends StatOrDecl> components) {
      this(SourceInfo.INVALID, Annotations.EMPTY, components);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BLOCK_STATEMENT;
    }

    public List<StatOrDecl> getComponents() {
      return components;
    }

    @Override
    public Annotations getAnnotations() {
      return annotations;
    }

    @Override
    public Annotation getAnnotation(String name) {
      return annotations.getSingle(name);
    }

    @Override
    public Iterable<Declaration> getDeclarations() {
      List<Declaration> decls = new ArrayList<Declaration>();
      for (StatOrDecl c: components) {
        if (c instanceof Declaration) {
          decls.add((Declaration) c);
        }
      }
      return decls;
    }

    @Override
    public Declared getDeclByName(String name) {
      return index.get(name);
    }

    @Override
    public void validate() {
      checkNotNull(annotations, "annotations", this);
      checkNotNull(components, "components", this);
      for (StatOrDecl c: components) {
        checkNotNull(c, "component", this);
      }
      index = Namespaces.buildIndex(getDeclarations(), this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = v.visitChild(annotations, Annotations.class,
                                          "annotations");
      List<StatOrDecl> newComps = v.visitList(components, StatOrDecl.class,
                                              "components");
      if (newAnnos == annotations && newComps == components) {
        return this;
      }
      BlockStatement copy = (BlockStatement) clone();
      copy.annotations = newAnnos.freeze();
      copy.components = newComps;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return "{ " + components.size() + " components }";
    }
  }
}
