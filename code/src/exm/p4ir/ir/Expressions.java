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

import java.math.BigInteger;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.CompileTimeValue;
import exm.p4ir.ir.Types.BoolType;
import exm.p4ir.ir.Types.InfIntType;
import exm.p4ir.ir.Types.StringType;
import exm.p4ir.ir.Types.Type;
import exm.p4ir.ir.Types.UnknownType;
import exm.p4ir.visitor.Visitor;

public class Expressions {

  /**
   * Every expression carries its inferred type, Unknown until inference
   * has run.  The type is a back-link into the type hierarchy rather than a
   * real child, so it is only traversed by visitors that ask for it.
   */
  public static abstract class Expression extends Node {
    protected Type type;

    protected Expression(SourceInfo srcInfo, Type type) {
      super(srcInfo);
      this.type = type == null ? UnknownType.get() : type;
    }

    public Type getType() {
      return type;
    }

    public Expression withType(Type newType) {
      if (newType == type) {
        return this;
      }
      Expression copy = (Expression) clone();
      copy.type = newType == null ? UnknownType.get() : newType;
      copy.validate();
      return copy;
    }

    protected Type visitType(Visitor v) {
      if (!v.visitExpressionTypes()) {
        return type;
      }
      return v.visitChild(type, Type.class, "type");
    }
  }

  public static class PathExpression extends Expression {
    private Path path;

    public PathExpression(SourceInfo srcInfo, Type type, Path path) {
      super(orElse(srcInfo, path == null ? null : path.getSourceInfo()), type);
      this.path = path;
      validate();
    }

    public PathExpression(Path path) {
      this(SourceInfo.INVALID, null, path);
    }

    public PathExpression(ID name) {
      this(new Path(name));
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PATH_EXPRESSION;
    }

    public Path getPath() {
      return path;
    }

    @Override
    public void validate() {
      checkNotNull(path, "path", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      Path newPath = v.visitChild(path, Path.class, "path");
      if (newType == type && newPath == path) {
        return this;
      }
      PathExpression copy = (PathExpression) clone();
      copy.type = newType;
      copy.path = newPath;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return path.toString();
    }
  }

  /**
   * Integer literal.  Without a width it has the arbitrary-precision
   * integer type.
   */
  public static class Constant extends Expression
                               implements CompileTimeValue {
    private final BigInteger value;
    /** Base the literal was written in, for printing */
    private final int base;

    public Constant(SourceInfo srcInfo, Type type, BigInteger value,
                    int base) {
      super(srcInfo, type == null ? InfIntType.get() : type);
      this.value = value;
      this.base = base;
      validate();
    }

    public Constant(long value) {
      this(SourceInfo.INVALID, null, BigInteger.valueOf(value), 10);
    }

    public Constant(Type type, long value) {
      this(SourceInfo.INVALID, type, BigInteger.valueOf(value), 10);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONSTANT;
    }

    public BigInteger getValue() {
      return value;
    }

    public int getBase() {
      return base;
    }

    public long asLong() {
      return value.longValue();
    }

    @Override
    public void validate() {
      checkNotNull(value, "value", this);
      if (base != 2 && base != 8 && base != 10 && base != 16) {
        throw new IRInvariantError("Bad base " + base + " for constant at " +
                                   srcInfo);
      }
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      if (newType == type) {
        return this;
      }
      Constant copy = (Constant) clone();
      copy.type = newType;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      String digits = value.abs().toString(base);
      String prefix;
      switch (base) {
        case 2:
          prefix = "0b";
          break;
        case 8:
          prefix = "0o";
          break;
        case 16:
          prefix = "0x";
          break;
        default:
          prefix = "";
          break;
      }
      return (value.signum() < 0 ? "-" : "") + prefix + digits;
    }
  }

  public static class BoolLiteral extends Expression
                                  implements CompileTimeValue {
    private final boolean value;

    public BoolLiteral(SourceInfo srcInfo, boolean value) {
      super(srcInfo, BoolType.get());
      this.value = value;
    }

    public BoolLiteral(boolean value) {
      this(SourceInfo.INVALID, value);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BOOL_LITERAL;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      if (newType == type) {
        return this;
      }
      BoolLiteral copy = (BoolLiteral) clone();
      copy.type = newType;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class StringLiteral extends Expression
                                    implements CompileTimeValue {
    private final String value;

    public StringLiteral(SourceInfo srcInfo, String value) {
      super(srcInfo, StringType.get());
      this.value = value;
      validate();
    }

    public StringLiteral(String value) {
      this(SourceInfo.INVALID, value);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRING_LITERAL;
    }

    public String getValue() {
      return value;
    }

    @Override
    public void validate() {
      checkNotNull(value, "value", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      if (newType == type) {
        return this;
      }
      StringLiteral copy = (StringLiteral) clone();
      copy.type = newType;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
  }

  /**
   * Field or method selection, expr.member
   */
  public static class Member extends Expression {
    private Expression expr;
    private final ID member;

    public Member(SourceInfo srcInfo, Type type, Expression expr, ID member) {
      super(orElse(srcInfo, spanOf(expr, member)), type);
      this.expr = expr;
      this.member = member;
      validate();
    }

    public Member(Expression expr, ID member) {
      this(SourceInfo.INVALID, null, expr, member);
    }

    private static SourceInfo spanOf(Expression expr, ID member) {
      SourceInfo res = expr == null ? SourceInfo.INVALID
                                    : expr.getSourceInfo();
      return member == null ? res : res.merge(member.srcInfo);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.MEMBER;
    }

    public Expression getExpr() {
      return expr;
    }

    public ID getMember() {
      return member;
    }

    @Override
    public void validate() {
      checkNotNull(expr, "expr", this);
      checkNotNull(member, "member", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      Expression newExpr = v.visitChild(expr, Expression.class, "expr");
      if (newType == type && newExpr == expr) {
        return this;
      }
      Member copy = (Member) clone();
      copy.type = newType;
      copy.expr = newExpr;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return expr + "." + member;
    }
  }

  public static enum UnaryOp {
    NEG("-"),
    CMPL("~"),
    LNOT("!"),
    ;

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  public static class UnaryOperation extends Expression {
    private final UnaryOp op;
    private Expression expr;

    public UnaryOperation(SourceInfo srcInfo, Type type, UnaryOp op,
                          Expression expr) {
      super(orElse(srcInfo, expr == null ? null : expr.getSourceInfo()),
            type);
      this.op = op;
      this.expr = expr;
      validate();
    }

    public UnaryOperation(UnaryOp op, Expression expr) {
      this(SourceInfo.INVALID, null, op, expr);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNARY_OPERATION;
    }

    public UnaryOp getOp() {
      return op;
    }

    public Expression getExpr() {
      return expr;
    }

    @Override
    public void validate() {
      checkNotNull(op, "op", this);
      checkNotNull(expr, "expr", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      Expression newExpr = v.visitChild(expr, Expression.class, "expr");
      if (newType == type && newExpr == expr) {
        return this;
      }
      UnaryOperation copy = (UnaryOperation) clone();
      copy.type = newType;
      copy.expr = newExpr;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      return op.getSymbol();
    }

    @Override
    public String dbprint() {
      return kind().typeName() + " " + op.getSymbol() + "(" + expr + ")";
    }
  }

  public static enum BinaryOp {
    MUL("*"),
    DIV("/"),
    MOD("%"),
    ADD("+"),
    SUB("-"),
    SHL("<<"),
    SHR(">>"),
    EQU("=="),
    NEQ("!="),
    LSS("<"),
    LEQ("<="),
    GRT(">"),
    GEQ(">="),
    BAND("&"),
    BOR("|"),
    BXOR("^"),
    LAND("&&"),
    LOR("||"),
    CONCAT("++"),
    ;

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    public boolean isComparison() {
      switch (this) {
        case EQU:
        case NEQ:
        case LSS:
        case LEQ:
        case GRT:
        case GEQ:
          return true;
        default:
          return false;
      }
    }
  }

  /**
   * Binary operation.  Unless given one explicitly its location spans both
   * operands.
   */
  public static class BinaryOperation extends Expression {
    private final BinaryOp op;
    private Expression left;
    private Expression right;

    public BinaryOperation(SourceInfo srcInfo, Type type, BinaryOp op,
                           Expression left, Expression right) {
      super(orElse(srcInfo, spanOf(left, right)), type);
      this.op = op;
      this.left = left;
      this.right = right;
      validate();
    }

    public BinaryOperation(BinaryOp op, Expression left, Expression right) {
      this(SourceInfo.INVALID, null, op, left, right);
    }

    private static SourceInfo spanOf(Expression left, Expression right) {
      if (left == null || right == null) {
        return SourceInfo.INVALID;
      }
      return left.getSourceInfo().merge(right.getSourceInfo());
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BINARY_OPERATION;
    }

    public BinaryOp getOp() {
      return op;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public void validate() {
      checkNotNull(op, "op", this);
      checkNotNull(left, "left", this);
      checkNotNull(right, "right", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      Expression newLeft = v.visitChild(left, Expression.class, "left");
      Expression newRight = v.visitChild(right, Expression.class, "right");
      if (newType == type && newLeft == left && newRight == right) {
        return this;
      }
      BinaryOperation copy = (BinaryOperation) clone();
      copy.type = newType;
      copy.left = newLeft;
      copy.right = newRight;
      copy.validate();
      return copy;
    }

    /**
     * Operations print as their operator symbol
     */
    @Override
    public String toString() {
      return op.getSymbol();
    }

    @Override
    public String dbprint() {
      return kind().typeName() + " (" + left + " " + op.getSymbol() + " " +
             right + ")";
    }
  }

  public static class MethodCallExpression extends Expression {
    private Expression method;
    private List<Type> typeArguments;
    private List<Expression> arguments;

    public MethodCallExpression(SourceInfo srcInfo, Type type,
        Expression method, List<Type> typeArguments,
        List<Expression> arguments) {
      super(orElse(srcInfo, method == null ? null : method.getSourceInfo()),
            type);
      this.method = method;
      this.typeArguments = typeArguments == null ? ImmutableList.<Type>of()
                  : copyChildren(typeArguments, "typeArguments", this);
      this.arguments = arguments == null ? ImmutableList.<Expression>of()
                  : copyChildren(arguments, "arguments", this);
      validate();
    }

    public MethodCallExpression(Expression method,
                                List<Expression> arguments) {
      this(SourceInfo.INVALID, null, method, null, arguments);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.METHOD_CALL_EXPRESSION;
    }

    public Expression getMethod() {
      return method;
    }

    public List<Type> getTypeArguments() {
      return typeArguments;
    }

    public List<Expression> getArguments() {
      return arguments;
    }

    @Override
    public void validate() {
      checkNotNull(method, "method", this);
      for (Expression arg: arguments) {
        checkNotNull(arg, "argument", this);
      }
    }

    @Override
    public Node visitChildren(Visitor v) {
      Type newType = visitType(v);
      Expression newMethod = v.visitChild(method, Expression.class, "method");
      List<Type> newTypeArgs = v.visitList(typeArguments, Type.class,
                                           "typeArguments");
      List<Expression> newArgs = v.visitList(arguments, Expression.class,
                                             "arguments");
      if (newType == type && newMethod == method &&
          newTypeArgs == typeArguments && newArgs == arguments) {
        return this;
      }
      MethodCallExpression copy = (MethodCallExpression) clone();
      copy.type = newType;
      copy.method = newMethod;
      copy.typeArguments = newTypeArgs;
      copy.arguments = newArgs;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      String targs = typeArguments.isEmpty() ? "" :
                        "<" + StringUtils.join(typeArguments, ", ") + ">";
      return method + targs + "(" + StringUtils.join(arguments, ", ") + ")";
    }
  }
}
