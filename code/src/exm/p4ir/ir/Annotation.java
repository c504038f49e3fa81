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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.ir.Expressions.StringLiteral;
import exm.p4ir.visitor.Visitor;

/**
 * A named tag carrying an ordered list of expressions, e.g.
 * <code>@name("ingress.t")</code>.
 */
public class Annotation extends Node {

  // Names the compiler gives meaning to.  Other stages match on these
  // literal strings.
  /** Control-plane name */
  public static final String NAME = "name";
  /** Action may only be used in a table's action list */
  public static final String TABLE_ONLY = "tableonly";
  /** Action may only be used as a table's default action */
  public static final String DEFAULT_ONLY = "defaultonly";
  public static final String ATOMIC = "atomic";
  /** Hide from the control plane */
  public static final String HIDDEN = "hidden";
  /** Legacy varbit length hint */
  public static final String LENGTH = "length";

  public static final ImmutableSet<String> PREDEFINED = ImmutableSet.of(
      NAME, TABLE_ONLY, DEFAULT_ONLY, ATOMIC, HIDDEN, LENGTH);

  private ID name;
  private List<Expression> expr;

  public Annotation(ID name, List<? extends Expression> expr) {
    this(SourceInfo.INVALID, name, expr);
  }

  public Annotation(SourceInfo srcInfo, ID name,
                    List<? extends Expression> expr) {
    super(orElse(srcInfo, name == null ? null : name.srcInfo));
    this.name = name;
    this.expr = expr == null ? ImmutableList.<Expression>of()
                             : copyChildren(expr, "expr", this);
    validate();
  }

  public Annotation(String name, Expression... expr) {
    this(new ID(name), Arrays.asList(expr));
  }

  public static boolean isPredefined(String name) {
    return PREDEFINED.contains(name);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ANNOTATION;
  }

  public ID getName() {
    return name;
  }

  public List<Expression> getExpr() {
    return expr;
  }

  public boolean isPredefined() {
    return isPredefined(name.name);
  }

  /**
   * @return the argument if it is a single string literal, else null
   */
  public String getSingleString() {
    if (expr.size() != 1) {
      return null;
    }
    StringLiteral lit = expr.get(0).as(StringLiteral.class);
    return lit == null ? null : lit.getValue();
  }

  @Override
  public void validate() {
    if (name == null || StringUtils.isEmpty(name.name)) {
      throw new IRInvariantError("Annotation with empty name at " + srcInfo);
    }
    for (Expression e: expr) {
      if (e == null) {
        throw new IRInvariantError("Null expression in annotation @" +
                                   name.name);
      }
    }
  }

  @Override
  public Node visitChildren(Visitor v) {
    List<Expression> newExpr = v.visitList(expr, Expression.class, "expr");
    if (newExpr == expr) {
      return this;
    }
    Annotation copy = (Annotation) clone();
    copy.expr = newExpr;
    copy.validate();
    return copy;
  }

  @Override
  public String toString() {
    return "@" + name;
  }

  @Override
  public String dbprint() {
    List<String> args = new ArrayList<String>(expr.size());
    for (Expression e: expr) {
      args.add(e.toString());
    }
    if (args.isEmpty()) {
      return toString();
    }
    return toString() + "(" + StringUtils.join(args, ", ") + ")";
  }

  static List<Expression> single(Expression e) {
    if (e == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(e);
  }
}
