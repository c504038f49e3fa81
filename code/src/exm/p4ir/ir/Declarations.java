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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.p4ir.common.Logging;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.Annotated;
import exm.p4ir.ir.Capabilities.Container;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.Functional;
import exm.p4ir.ir.Capabilities.HasApply;
import exm.p4ir.ir.Capabilities.Instance;
import exm.p4ir.ir.Capabilities.MayBeGeneric;
import exm.p4ir.ir.Capabilities.Namespace;
import exm.p4ir.ir.Capabilities.NestedNamespace;
import exm.p4ir.ir.Capabilities.SimpleNamespace;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.ir.Statements.BlockStatement;
import exm.p4ir.ir.Statements.StatOrDecl;
import exm.p4ir.ir.Types.ArchBlockType;
import exm.p4ir.ir.Types.ControlType;
import exm.p4ir.ir.Types.MethodType;
import exm.p4ir.ir.Types.ParserType;
import exm.p4ir.ir.Types.TableType;
import exm.p4ir.ir.Types.Type;
import exm.p4ir.ir.Types.TypeVar;
import exm.p4ir.visitor.Visitor;

/**
 * Statement-level declarations, and the parameter lists that many of them
 * contain.
 */
public class Declarations {

  /**
   * Name seen by the control plane for a declaration
   */
  static String externalName(ID name, Annotations annotations) {
    Annotation anno = annotations.getSingle(Annotation.NAME);
    if (anno == null) {
      return name.toString();
    }
    String external = anno.getSingleString();
    if (external == null) {
      Logging.uniqueWarn(anno.getSourceInfo() + ": @" + Annotation.NAME +
          " on " + name + " should have a single string argument");
      return name.toString();
    }
    return external;
  }

  /**
   * A declaration of anything other than a type.  Each gets a fresh id
   * from the compilation's allocator; copies made by copy-on-write
   * operations keep the id, since they stand for the same declaration.
   */
  public static abstract class Declaration extends StatOrDecl
                                           implements Declared {
    private ID name;
    private final int declId;

    protected Declaration(SourceInfo srcInfo, ID name, DeclIdAllocator ids) {
      super(orElse(srcInfo, name == null ? null : name.srcInfo));
      if (ids == null) {
        throw new IRInvariantError("Declaration of " + name +
                                   " without id allocator");
      }
      this.name = name;
      this.declId = ids.nextId();
    }

    @Override
    public ID getName() {
      return name;
    }

    @Override
    public int getDeclId() {
      return declId;
    }

    @Override
    public String externalName() {
      if (this instanceof Annotated) {
        return Declarations.externalName(name,
                            ((Annotated) this).getAnnotations());
      }
      return name.toString();
    }

    @Override
    public Node getNode() {
      return this;
    }

    @Override
    public void validate() {
      if (name == null || name.name.isEmpty()) {
        throw new IRInvariantError(kind().typeName() +
                                   " with empty name at " + srcInfo);
      }
    }

    public Declaration withName(ID newName) {
      Declaration copy = (Declaration) clone();
      copy.name = newName;
      copy.validate();
      return copy;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Declaration)) {
        return false;
      }
      return declId == ((Declaration) obj).declId;
    }

    @Override
    public int hashCode() {
      return declId;
    }

    @Override
    public String toString() {
      return name.toString();
    }

    @Override
    public String dbprint() {
      return kind().typeName() + " " + name.name + "/" + declId;
    }
  }

  public static abstract class AnnotatedDeclaration extends Declaration
                                                    implements Annotated {
    protected Annotations annotations;

    protected AnnotatedDeclaration(SourceInfo srcInfo, ID name,
                           Annotations annotations, DeclIdAllocator ids) {
      super(srcInfo, name, ids);
      this.annotations = annotations == null ? Annotations.EMPTY
                                             : annotations.freeze();
    }

    @Override
    public Annotations getAnnotations() {
      return annotations;
    }

    @Override
    public Annotation getAnnotation(String annoName) {
      return annotations.getSingle(annoName);
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(annotations, "annotations", this);
    }

    public AnnotatedDeclaration withAnnotations(Annotations newAnnos) {
      if (newAnnos == annotations) {
        return this;
      }
      AnnotatedDeclaration copy = (AnnotatedDeclaration) clone();
      copy.annotations = newAnnos.freeze();
      copy.validate();
      return copy;
    }

    protected Annotations visitAnnotations(Visitor v) {
      return v.visitChild(annotations, Annotations.class, "annotations");
    }
  }

  public static enum Direction {
    NONE(""),
    IN("in"),
    OUT("out"),
    INOUT("inout"),
    ;

    private final String keyword;

    private Direction(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  public static class Parameter extends AnnotatedDeclaration
                                implements Instance {
    private final Direction direction;
    private Type type;
    private Expression defaultValue;

    public Parameter(SourceInfo srcInfo, ID name, Annotations annotations,
                     Direction direction, Type type, Expression defaultValue,
                     DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.direction = direction;
      this.type = type;
      this.defaultValue = defaultValue;
      validate();
    }

    public Parameter(ID name, Direction direction, Type type,
                     DeclIdAllocator ids) {
      this(SourceInfo.INVALID, name, Annotations.EMPTY, direction, type,
           null, ids);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PARAMETER;
    }

    public Direction getDirection() {
      return direction;
    }

    @Override
    public Type getType() {
      return type;
    }

    /**
     * @return default value, or null if none
     */
    public Expression getDefaultValue() {
      return defaultValue;
    }

    public boolean hasDefaultValue() {
      return defaultValue != null;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(direction, "direction", this);
      checkNotNull(type, "type", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Type newType = v.visitChild(type, Type.class, "type");
      Expression newDefault = v.visitOptionalChild(defaultValue,
                                     Expression.class, "defaultValue");
      if (newAnnos == annotations && newType == type &&
          newDefault == defaultValue) {
        return this;
      }
      Parameter copy = (Parameter) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.defaultValue = newDefault;
      copy.validate();
      return copy;
    }

    /**
     * @return the parameter as written in a signature
     */
    public String toSignatureString() {
      String res = type + " " + getName();
      if (direction != Direction.NONE) {
        res = direction + " " + res;
      }
      return res;
    }
  }

  /**
   * Parameters of a method, constructor or apply.  Names must be unique.
   */
  public static class ParameterList extends Node implements SimpleNamespace {
    public static final ParameterList EMPTY =
        new ParameterList(SourceInfo.INVALID, ImmutableList.<Parameter>of());

    private List<Parameter> parameters;
    private Map<String, Declared> index;

    public ParameterList(SourceInfo srcInfo, List<Parameter> parameters) {
      super(srcInfo);
      this.parameters = copyChildren(parameters, "parameters", this);
      validate();
    }

    public ParameterList(List<Parameter> parameters) {
      this(SourceInfo.INVALID, parameters);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PARAMETER_LIST;
    }

    public List<Parameter> getParameters() {
      return parameters;
    }

    public Parameter getParameter(int i) {
      return parameters.get(i);
    }

    public Parameter getParameter(String name) {
      return (Parameter) index.get(name);
    }

    public int size() {
      return parameters.size();
    }

    public boolean isEmpty() {
      return parameters.isEmpty();
    }

    @Override
    public Iterable<Parameter> getDeclarations() {
      return parameters;
    }

    @Override
    public Declared getDeclByName(String name) {
      return index.get(name);
    }

    @Override
    public void validate() {
      checkNotNull(parameters, "parameters", this);
      index = Namespaces.buildIndex(parameters, this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      List<Parameter> newParams = v.visitList(parameters, Parameter.class,
                                              "parameters");
      if (newParams == parameters) {
        return this;
      }
      ParameterList copy = (ParameterList) clone();
      copy.parameters = newParams;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      List<String> strs = new ArrayList<String>(parameters.size());
      for (Parameter p: parameters) {
        strs.add(p.toSignatureString());
      }
      return "(" + StringUtils.join(strs, ", ") + ")";
    }
  }

  /**
   * Type parameters of a generic declaration.  Empty if not generic.
   */
  public static class TypeParameters extends Node implements SimpleNamespace {
    public static final TypeParameters EMPTY =
        new TypeParameters(SourceInfo.INVALID, ImmutableList.<TypeVar>of());

    private List<TypeVar> parameters;
    private Map<String, Declared> index;

    public TypeParameters(SourceInfo srcInfo, List<TypeVar> parameters) {
      super(srcInfo);
      this.parameters = copyChildren(parameters, "parameters", this);
      validate();
    }

    public TypeParameters(List<TypeVar> parameters) {
      this(SourceInfo.INVALID, parameters);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TYPE_PARAMETERS;
    }

    public List<TypeVar> getParameters() {
      return parameters;
    }

    public int size() {
      return parameters.size();
    }

    public boolean isEmpty() {
      return parameters.isEmpty();
    }

    @Override
    public Iterable<TypeVar> getDeclarations() {
      return parameters;
    }

    @Override
    public Declared getDeclByName(String name) {
      return index.get(name);
    }

    @Override
    public void validate() {
      checkNotNull(parameters, "parameters", this);
      index = Namespaces.buildIndex(parameters, this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      List<TypeVar> newParams = v.visitList(parameters, TypeVar.class,
                                            "parameters");
      if (newParams == parameters) {
        return this;
      }
      TypeParameters copy = (TypeParameters) clone();
      copy.parameters = newParams;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      if (parameters.isEmpty()) {
        return "";
      }
      return "<" + StringUtils.join(parameters, ", ") + ">";
    }
  }

  public static class StructField extends AnnotatedDeclaration
                                  implements Instance {
    private Type type;

    public StructField(SourceInfo srcInfo, ID name, Annotations annotations,
                       Type type, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      validate();
    }

    public StructField(ID name, Type type, DeclIdAllocator ids) {
      this(SourceInfo.INVALID, name, Annotations.EMPTY, type, ids);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRUCT_FIELD;
    }

    @Override
    public Type getType() {
      return type;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Type newType = v.visitChild(type, Type.class, "type");
      if (newAnnos == annotations && newType == type) {
        return this;
      }
      StructField copy = (StructField) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.validate();
      return copy;
    }
  }

  public static class DeclarationVariable extends AnnotatedDeclaration
                                          implements Instance {
    private Type type;
    private Expression initializer;

    public DeclarationVariable(SourceInfo srcInfo, ID name,
        Annotations annotations, Type type, Expression initializer,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      this.initializer = initializer;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DECLARATION_VARIABLE;
    }

    @Override
    public Type getType() {
      return type;
    }

    /**
     * @return initializer or null if uninitialized
     */
    public Expression getInitializer() {
      return initializer;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Type newType = v.visitChild(type, Type.class, "type");
      Expression newInit = v.visitOptionalChild(initializer,
                                     Expression.class, "initializer");
      if (newAnnos == annotations && newType == type &&
          newInit == initializer) {
        return this;
      }
      DeclarationVariable copy = (DeclarationVariable) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.initializer = newInit;
      copy.validate();
      return copy;
    }
  }

  public static class DeclarationConstant extends AnnotatedDeclaration
                                          implements Instance {
    private Type type;
    private Expression initializer;

    public DeclarationConstant(SourceInfo srcInfo, ID name,
        Annotations annotations, Type type, Expression initializer,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      this.initializer = initializer;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DECLARATION_CONSTANT;
    }

    @Override
    public Type getType() {
      return type;
    }

    public Expression getInitializer() {
      return initializer;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
      checkNotNull(initializer, "initializer", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Type newType = v.visitChild(type, Type.class, "type");
      Expression newInit = v.visitChild(initializer, Expression.class,
                                        "initializer");
      if (newAnnos == annotations && newType == type &&
          newInit == initializer) {
        return this;
      }
      DeclarationConstant copy = (DeclarationConstant) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.initializer = newInit;
      copy.validate();
      return copy;
    }
  }

  /**
   * Instantiation of an extern, parser, control or package
   */
  public static class DeclarationInstance extends AnnotatedDeclaration
                                          implements Instance {
    private Type type;
    private List<Expression> arguments;

    public DeclarationInstance(SourceInfo srcInfo, ID name,
        Annotations annotations, Type type, List<Expression> arguments,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      this.arguments = arguments == null ? ImmutableList.<Expression>of()
                             : copyChildren(arguments, "arguments", this);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DECLARATION_INSTANCE;
    }

    @Override
    public Type getType() {
      return type;
    }

    public List<Expression> getArguments() {
      return arguments;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Type newType = v.visitChild(type, Type.class, "type");
      List<Expression> newArgs = v.visitList(arguments, Expression.class,
                                             "arguments");
      if (newAnnos == annotations && newType == type &&
          newArgs == arguments) {
        return this;
      }
      DeclarationInstance copy = (DeclarationInstance) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.arguments = newArgs;
      copy.validate();
      return copy;
    }
  }

  /**
   * Method of an extern, or a constructor if named like the extern
   */
  public static class Method extends AnnotatedDeclaration
                     implements Functional, MayBeGeneric {
    private MethodType type;
    private final boolean isAbstract;

    public Method(SourceInfo srcInfo, ID name, Annotations annotations,
                  MethodType type, boolean isAbstract, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      this.isAbstract = isAbstract;
      validate();
    }

    public Method(ID name, MethodType type, DeclIdAllocator ids) {
      this(SourceInfo.INVALID, name, Annotations.EMPTY, type, false, ids);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.METHOD;
    }

    public MethodType getType() {
      return type;
    }

    public boolean isAbstract() {
      return isAbstract;
    }

    @Override
    public ParameterList getParameters() {
      return type.getParameters();
    }

    @Override
    public TypeParameters getTypeParameters() {
      return type.getTypeParameters();
    }

    /**
     * @return true if a call with argCount arguments could bind to this
     */
    public boolean acceptsArgs(int argCount) {
      List<Parameter> params = getParameters().getParameters();
      if (argCount > params.size()) {
        return false;
      }
      for (int i = argCount; i < params.size(); i++) {
        if (!params.get(i).hasDefaultValue()) {
          return false;
        }
      }
      return true;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      MethodType newType = v.visitChild(type, MethodType.class, "type");
      if (newAnnos == annotations && newType == type) {
        return this;
      }
      Method copy = (Method) clone();
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.validate();
      return copy;
    }

    @Override
    public String dbprint() {
      return super.dbprint() + " " + type;
    }
  }

  public static class ActionDeclaration extends AnnotatedDeclaration
                                        implements Functional {
    private ParameterList parameters;
    private BlockStatement body;

    public ActionDeclaration(SourceInfo srcInfo, ID name,
        Annotations annotations, ParameterList parameters,
        BlockStatement body, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.parameters = parameters;
      this.body = body;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ACTION;
    }

    @Override
    public ParameterList getParameters() {
      return parameters;
    }

    public BlockStatement getBody() {
      return body;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(parameters, "parameters", this);
      checkNotNull(body, "body", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      ParameterList newParams = v.visitChild(parameters, ParameterList.class,
                                             "parameters");
      BlockStatement newBody = v.visitChild(body, BlockStatement.class,
                                            "body");
      if (newAnnos == annotations && newParams == parameters &&
          newBody == body) {
        return this;
      }
      ActionDeclaration copy = (ActionDeclaration) clone();
      copy.annotations = newAnnos.freeze();
      copy.parameters = newParams;
      copy.body = newBody;
      copy.validate();
      return copy;
    }
  }

  /**
   * Table property, e.g. "size = 1024"
   */
  public static class Property extends AnnotatedDeclaration {
    private Expression value;
    private final boolean isConstant;

    public Property(SourceInfo srcInfo, ID name, Annotations annotations,
                    Expression value, boolean isConstant,
                    DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.value = value;
      this.isConstant = isConstant;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PROPERTY;
    }

    public Expression getValue() {
      return value;
    }

    public boolean isConstant() {
      return isConstant;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(value, "value", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      Expression newValue = v.visitChild(value, Expression.class, "value");
      if (newAnnos == annotations && newValue == value) {
        return this;
      }
      Property copy = (Property) clone();
      copy.annotations = newAnnos.freeze();
      copy.value = newValue;
      copy.validate();
      return copy;
    }
  }

  public static class TableDeclaration extends AnnotatedDeclaration
                              implements HasApply, SimpleNamespace {
    private List<Property> properties;
    private Map<String, Declared> index;

    public TableDeclaration(SourceInfo srcInfo, ID name,
        Annotations annotations, List<Property> properties,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.properties = copyChildren(properties, "properties", this);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TABLE;
    }

    public List<Property> getProperties() {
      return properties;
    }

    public Property getProperty(String propName) {
      return (Property) index.get(propName);
    }

    @Override
    public Iterable<Property> getDeclarations() {
      return properties;
    }

    @Override
    public Declared getDeclByName(String declName) {
      return index.get(declName);
    }

    /**
     * Tables are applied with no arguments and return their result type
     */
    @Override
    public MethodType getApplyMethodType() {
      return new MethodType(srcInfo, TypeParameters.EMPTY,
                            new TableType(this), ParameterList.EMPTY);
    }

    @Override
    public ParameterList getApplyParameters() {
      return ParameterList.EMPTY;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(properties, "properties", this);
      index = Namespaces.buildIndex(properties, this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      List<Property> newProps = v.visitList(properties, Property.class,
                                            "properties");
      if (newAnnos == annotations && newProps == properties) {
        return this;
      }
      TableDeclaration copy = (TableDeclaration) clone();
      copy.annotations = newAnnos.freeze();
      copy.properties = newProps;
      copy.validate();
      return copy;
    }
  }

  /**
   * Parser or control declaration.  These are containers: instantiated
   * with constructor arguments, possibly generic through their type, and
   * applied like a method.  Their locals form a strict namespace; the
   * type parameters, apply parameters and constructor parameters are
   * nested namespaces.
   */
  public static abstract class ContainerDeclaration extends
      AnnotatedDeclaration implements Container, HasApply, SimpleNamespace,
                                      NestedNamespace {
    protected ArchBlockType type;
    protected ParameterList constructorParams;
    protected List<Declaration> locals;
    private Map<String, Declared> localIndex;

    protected ContainerDeclaration(SourceInfo srcInfo, ID name,
        Annotations annotations, ArchBlockType type,
        ParameterList constructorParams, List<Declaration> locals,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.type = type;
      this.constructorParams = constructorParams == null ?
                                 ParameterList.EMPTY : constructorParams;
      this.locals = locals == null ? ImmutableList.<Declaration>of()
                                   : copyChildren(locals, "locals", this);
    }

    public ArchBlockType getType() {
      return type;
    }

    public List<Declaration> getLocals() {
      return locals;
    }

    @Override
    public TypeParameters getTypeParameters() {
      return type.getTypeParameters();
    }

    @Override
    public ParameterList getConstructorParameters() {
      return constructorParams;
    }

    @Override
    public MethodType getConstructorMethodType() {
      return new MethodType(srcInfo, getTypeParameters(), type,
                            constructorParams);
    }

    @Override
    public MethodType getApplyMethodType() {
      return type.getApplyMethodType();
    }

    @Override
    public ParameterList getApplyParameters() {
      return type.getApplyParameters();
    }

    @Override
    public Iterable<Declaration> getDeclarations() {
      return locals;
    }

    @Override
    public Declared getDeclByName(String declName) {
      return localIndex.get(declName);
    }

    @Override
    public List<Namespace> getNestedNamespaces() {
      List<Namespace> res = new ArrayList<Namespace>(3);
      res.add(getTypeParameters());
      res.add(getApplyParameters());
      res.add(constructorParams);
      return res;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(type, "type", this);
      checkNotNull(locals, "locals", this);
      localIndex = Namespaces.buildIndex(locals, this);
    }

    /**
     * Visit fields shared by all containers into copy.
     * @return true if any changed
     */
    protected boolean visitContainerFields(Visitor v,
                                           ContainerDeclaration copy) {
      Annotations newAnnos = visitAnnotations(v);
      ArchBlockType newType = v.visitChild(type, ArchBlockType.class, "type");
      ParameterList newCtorParams = v.visitChild(constructorParams,
                              ParameterList.class, "constructorParams");
      List<Declaration> newLocals = v.visitList(locals, Declaration.class,
                                                "locals");
      copy.annotations = newAnnos.freeze();
      copy.type = newType;
      copy.constructorParams = newCtorParams;
      copy.locals = newLocals;
      return newAnnos != annotations || newType != type ||
             newCtorParams != constructorParams || newLocals != locals;
    }
  }

  public static class ParserDeclaration extends ContainerDeclaration {
    public ParserDeclaration(SourceInfo srcInfo, ID name,
        Annotations annotations, ParserType type,
        ParameterList constructorParams, List<Declaration> locals,
        DeclIdAllocator ids) {
      super(srcInfo, name, annotations, type, constructorParams, locals, ids);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PARSER;
    }

    @Override
    public void validate() {
      super.validate();
      if (!type.is(NodeKind.PARSER_TYPE)) {
        throw new IRInvariantError("Parser " + getName() + " has type " +
                                   type.kind().typeName());
      }
    }

    @Override
    public Node visitChildren(Visitor v) {
      ParserDeclaration copy = (ParserDeclaration) clone();
      if (!visitContainerFields(v, copy)) {
        return this;
      }
      copy.validate();
      return copy;
    }
  }

  public static class ControlDeclaration extends ContainerDeclaration {
    private BlockStatement body;

    public ControlDeclaration(SourceInfo srcInfo, ID name,
        Annotations annotations, ControlType type,
        ParameterList constructorParams, List<Declaration> locals,
        BlockStatement body, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, type, constructorParams, locals, ids);
      this.body = body;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONTROL;
    }

    public BlockStatement getBody() {
      return body;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(body, "body", this);
      if (!type.is(NodeKind.CONTROL_TYPE)) {
        throw new IRInvariantError("Control " + getName() + " has type " +
                                   type.kind().typeName());
      }
    }

    @Override
    public Node visitChildren(Visitor v) {
      ControlDeclaration copy = (ControlDeclaration) clone();
      boolean changed = visitContainerFields(v, copy);
      BlockStatement newBody = v.visitChild(body, BlockStatement.class,
                                            "body");
      if (!changed && newBody == body) {
        return this;
      }
      copy.body = newBody;
      copy.validate();
      return copy;
    }
  }
}
