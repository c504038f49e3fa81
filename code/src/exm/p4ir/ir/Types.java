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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.Annotated;
import exm.p4ir.ir.Capabilities.Container;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.Functional;
import exm.p4ir.ir.Capabilities.GeneralNamespace;
import exm.p4ir.ir.Capabilities.HasApply;
import exm.p4ir.ir.Capabilities.MayBeGeneric;
import exm.p4ir.ir.Capabilities.SimpleNamespace;
import exm.p4ir.ir.Capabilities.TypeVarLike;
import exm.p4ir.ir.Declarations.Method;
import exm.p4ir.ir.Declarations.Parameter;
import exm.p4ir.ir.Declarations.ParameterList;
import exm.p4ir.ir.Declarations.StructField;
import exm.p4ir.ir.Declarations.TableDeclaration;
import exm.p4ir.ir.Declarations.TypeParameters;
import exm.p4ir.visitor.Visitor;

/**
 * This module provides the type nodes of the IR.
 *
 * The base class for all types is Type.  Types that are declared with a
 * name in the program derive from TypeDeclaration, which carries the same
 * name and id pattern as statement-level declarations.  The two hierarchies
 * are kept apart; code that doesn't care which one a declaration comes
 * from uses the Declared interface.
 */
public class Types {

  public static abstract class Type extends Node {
    protected Type(SourceInfo srcInfo) {
      super(srcInfo);
    }

    /**
     * @return number of bits, or 0 if the type has no static width
     */
    public int widthBits() {
      return 0;
    }

    /**
     * @return a form of this type that can be written in source.  For
     *   declared types this is a reference by name, so that re-emitting
     *   the type doesn't expand its whole structure.
     */
    public abstract Type getP4Type();
  }

  /**
   * Built-in types.  These are already representable in source.
   */
  public static abstract class BaseType extends Type {
    protected BaseType(SourceInfo srcInfo) {
      super(srcInfo);
    }

    @Override
    public Type getP4Type() {
      return this;
    }

    @Override
    public Node visitChildren(Visitor v) {
      return this;
    }
  }

  /**
   * Placeholder type of expressions before type inference has run.
   * All of them share the single instance.
   */
  public static class UnknownType extends BaseType {
    private static final UnknownType INSTANCE = new UnknownType();

    private UnknownType() {
      super(SourceInfo.INVALID);
    }

    public static UnknownType get() {
      return INSTANCE;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNKNOWN_TYPE;
    }

    @Override
    public String toString() {
      return "Unknown";
    }
  }

  public static class BoolType extends BaseType {
    private static final BoolType INSTANCE = new BoolType(SourceInfo.INVALID);

    public BoolType(SourceInfo srcInfo) {
      super(srcInfo);
    }

    public static BoolType get() {
      return INSTANCE;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BOOL_TYPE;
    }

    @Override
    public int widthBits() {
      return 1;
    }

    @Override
    public String toString() {
      return "bool";
    }
  }

  /**
   * Fixed-width bit string, signed or unsigned
   */
  public static class BitsType extends BaseType {
    private static final Map<Integer, BitsType> unsignedTypes =
                                    new HashMap<Integer, BitsType>();
    private static final Map<Integer, BitsType> signedTypes =
                                    new HashMap<Integer, BitsType>();

    private final int size;
    private final boolean signed;

    public BitsType(SourceInfo srcInfo, int size, boolean signed) {
      super(srcInfo);
      this.size = size;
      this.signed = signed;
      validate();
    }

    /**
     * @return canonical location-less instance
     */
    public static BitsType get(int size, boolean signed) {
      Map<Integer, BitsType> cache = signed ? signedTypes : unsignedTypes;
      BitsType t = cache.get(size);
      if (t == null) {
        t = new BitsType(SourceInfo.INVALID, size, signed);
        cache.put(size, t);
      }
      return t;
    }

    public static BitsType get(int size) {
      return get(size, false);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BITS_TYPE;
    }

    public int getSize() {
      return size;
    }

    public boolean isSigned() {
      return signed;
    }

    @Override
    public int widthBits() {
      return size;
    }

    @Override
    public void validate() {
      if (size <= 0) {
        throw new IRInvariantError("Bit width must be positive, was " + size
                                   + " at " + srcInfo);
      }
    }

    @Override
    public String toString() {
      return (signed ? "int<" : "bit<") + size + ">";
    }
  }

  /**
   * Variable-length bit string with a maximum width.  It has no static
   * width.
   */
  public static class VarbitType extends BaseType {
    private final int maxWidth;

    public VarbitType(SourceInfo srcInfo, int maxWidth) {
      super(srcInfo);
      this.maxWidth = maxWidth;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARBIT_TYPE;
    }

    public int getMaxWidth() {
      return maxWidth;
    }

    @Override
    public void validate() {
      if (maxWidth <= 0) {
        throw new IRInvariantError("Varbit width must be positive, was " +
                                   maxWidth + " at " + srcInfo);
      }
    }

    @Override
    public String toString() {
      return "varbit<" + maxWidth + ">";
    }
  }

  /**
   * Arbitrary-precision integer, the type of unsized constants
   */
  public static class InfIntType extends BaseType {
    private static final InfIntType INSTANCE =
                                        new InfIntType(SourceInfo.INVALID);

    public InfIntType(SourceInfo srcInfo) {
      super(srcInfo);
    }

    public static InfIntType get() {
      return INSTANCE;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.INFINT_TYPE;
    }

    @Override
    public String toString() {
      return "int";
    }
  }

  public static class StringType extends BaseType {
    private static final StringType INSTANCE =
                                        new StringType(SourceInfo.INVALID);

    public StringType(SourceInfo srcInfo) {
      super(srcInfo);
    }

    public static StringType get() {
      return INSTANCE;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRING_TYPE;
    }

    @Override
    public String toString() {
      return "string";
    }
  }

  public static class VoidType extends BaseType {
    private static final VoidType INSTANCE = new VoidType(SourceInfo.INVALID);

    public VoidType(SourceInfo srcInfo) {
      super(srcInfo);
    }

    public static VoidType get() {
      return INSTANCE;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VOID_TYPE;
    }

    @Override
    public String toString() {
      return "void";
    }
  }

  /**
   * Reference to a declared type by name
   */
  public static class TypeName extends Type {
    private Path path;

    public TypeName(Path path) {
      this(SourceInfo.INVALID, path);
    }

    public TypeName(SourceInfo srcInfo, Path path) {
      super(orElse(srcInfo, path == null ? null : path.getSourceInfo()));
      this.path = path;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TYPE_NAME;
    }

    public Path getPath() {
      return path;
    }

    @Override
    public Type getP4Type() {
      return this;
    }

    @Override
    public void validate() {
      checkNotNull(path, "path", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Path newPath = v.visitChild(path, Path.class, "path");
      if (newPath == path) {
        return this;
      }
      TypeName copy = (TypeName) clone();
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
   * A type introduced by a declaration.  Carries a name and a declaration
   * id; two type declarations are equal only if they have the same id.
   */
  public static abstract class TypeDeclaration extends Type
                              implements Declared, Annotated {
    private ID name;
    private final int declId;
    protected Annotations annotations;

    protected TypeDeclaration(SourceInfo srcInfo, ID name,
                   Annotations annotations, DeclIdAllocator ids) {
      super(orElse(srcInfo, name == null ? null : name.srcInfo));
      if (ids == null) {
        throw new IRInvariantError("Declaration of " + name +
                                   " without id allocator");
      }
      this.name = name;
      this.declId = ids.nextId();
      this.annotations = annotations == null ? Annotations.EMPTY
                                             : annotations.freeze();
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
      return Declarations.externalName(name, annotations);
    }

    @Override
    public Node getNode() {
      return this;
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
    public Type getP4Type() {
      return new TypeName(name.srcInfo,
                          new Path(name.srcInfo, name, false));
    }

    @Override
    public void validate() {
      if (name == null || name.name.isEmpty()) {
        throw new IRInvariantError(kind().typeName() +
                                   " with empty name at " + srcInfo);
      }
      checkNotNull(annotations, "annotations", this);
    }

    /**
     * Copy with a different name.  The id is kept: it is still the same
     * declaration.
     */
    public TypeDeclaration withName(ID newName) {
      TypeDeclaration copy = (TypeDeclaration) clone();
      copy.name = newName;
      copy.validate();
      return copy;
    }

    public TypeDeclaration withAnnotations(Annotations newAnnos) {
      if (newAnnos == annotations) {
        return this;
      }
      TypeDeclaration copy = (TypeDeclaration) clone();
      copy.annotations = newAnnos.freeze();
      copy.validate();
      return copy;
    }

    protected Annotations visitAnnotations(Visitor v) {
      return v.visitChild(annotations, Annotations.class, "annotations");
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof TypeDeclaration)) {
        return false;
      }
      return declId == ((TypeDeclaration) obj).declId;
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

  /**
   * Type variable, e.g. T in extern E<T>
   */
  public static class TypeVar extends TypeDeclaration implements TypeVarLike {

    public TypeVar(SourceInfo srcInfo, ID name, DeclIdAllocator ids) {
      super(srcInfo, name, Annotations.EMPTY, ids);
      validate();
    }

    public TypeVar(ID name, DeclIdAllocator ids) {
      this(SourceInfo.INVALID, name, ids);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TYPE_VAR;
    }

    @Override
    public String getVarName() {
      return getName().name;
    }

    @Override
    public Type asType() {
      return this;
    }

    /**
     * A type variable is written as its own name
     */
    @Override
    public Type getP4Type() {
      return this;
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      return withAnnotations(newAnnos);
    }
  }

  public static class StructType extends TypeDeclaration
                                 implements SimpleNamespace {
    private List<StructField> fields;
    private Map<String, Declared> fieldIndex;

    public StructType(SourceInfo srcInfo, ID name, Annotations annotations,
                      List<StructField> fields, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.fields = copyChildren(fields, "fields", this);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRUCT_TYPE;
    }

    public List<StructField> getFields() {
      return fields;
    }

    public StructField getField(String fieldName) {
      return (StructField) fieldIndex.get(fieldName);
    }

    @Override
    public Iterable<StructField> getDeclarations() {
      return fields;
    }

    @Override
    public Declared getDeclByName(String declName) {
      return fieldIndex.get(declName);
    }

    @Override
    public int widthBits() {
      int width = 0;
      for (StructField f: fields) {
        width += f.getType().widthBits();
      }
      return width;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(fields, "fields", this);
      fieldIndex = Namespaces.buildIndex(fields, this);
    }

    public StructType withFields(List<StructField> newFields) {
      StructType copy = (StructType) clone();
      copy.fields = copyChildren(newFields, "fields", this);
      copy.validate();
      return copy;
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      List<StructField> newFields = v.visitList(fields, StructField.class,
                                                "fields");
      if (newAnnos == annotations && newFields == fields) {
        return this;
      }
      StructType copy = (StructType) clone();
      copy.annotations = newAnnos.freeze();
      copy.fields = newFields;
      copy.validate();
      return copy;
    }
  }

  /**
   * Extern object type.  Its methods may be overloaded, so they form a
   * general namespace; constructors are the methods named like the extern.
   */
  public static class ExternType extends TypeDeclaration
                       implements GeneralNamespace, MayBeGeneric {
    private TypeParameters typeParameters;
    private List<Method> methods;

    public ExternType(SourceInfo srcInfo, ID name, Annotations annotations,
                      TypeParameters typeParameters, List<Method> methods,
                      DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.typeParameters = typeParameters == null ? TypeParameters.EMPTY
                                                   : typeParameters;
      this.methods = copyChildren(methods, "methods", this);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EXTERN_TYPE;
    }

    @Override
    public TypeParameters getTypeParameters() {
      return typeParameters;
    }

    public List<Method> getMethods() {
      return methods;
    }

    @Override
    public Iterable<Method> getDeclarations() {
      return methods;
    }

    @Override
    public Iterable<Declared> getDeclsByName(String declName) {
      return Namespaces.declsByName(methods, declName);
    }

    public List<Method> getConstructors() {
      List<Method> res = new ArrayList<Method>();
      for (Method m: methods) {
        if (m.getName().equals(getName())) {
          res.add(m);
        }
      }
      return res;
    }

    /**
     * Find the methods that could be called with argCount arguments:
     * those with at least that many parameters, where the parameters
     * that would be left over all have default values.
     * @return candidates in declaration order, empty if none
     */
    public List<Method> lookupMethods(String methodName, int argCount) {
      List<Method> res = new ArrayList<Method>();
      for (Method m: methods) {
        if (m.getName().name.equals(methodName) && m.acceptsArgs(argCount)) {
          res.add(m);
        }
      }
      return res;
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(methods, "methods", this);
      for (Method m: methods) {
        checkNotNull(m, "method", this);
      }
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      TypeParameters newTps = v.visitChild(typeParameters,
                              TypeParameters.class, "typeParameters");
      List<Method> newMethods = v.visitList(methods, Method.class, "methods");
      if (newAnnos == annotations && newTps == typeParameters &&
          newMethods == methods) {
        return this;
      }
      ExternType copy = (ExternType) clone();
      copy.annotations = newAnnos.freeze();
      copy.typeParameters = newTps;
      copy.methods = newMethods;
      copy.validate();
      return copy;
    }

    @Override
    public String dbprint() {
      return super.dbprint() + typeParameters;
    }
  }

  /**
   * Common part of parser and control types: type parameters and the
   * parameters of apply.
   */
  public static abstract class ArchBlockType extends TypeDeclaration
                                  implements MayBeGeneric, HasApply {
    private TypeParameters typeParameters;
    private ParameterList applyParams;

    protected ArchBlockType(SourceInfo srcInfo, ID name,
          Annotations annotations, TypeParameters typeParameters,
          ParameterList applyParams, DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.typeParameters = typeParameters == null ? TypeParameters.EMPTY
                                                   : typeParameters;
      this.applyParams = applyParams;
    }

    @Override
    public TypeParameters getTypeParameters() {
      return typeParameters;
    }

    @Override
    public ParameterList getApplyParameters() {
      return applyParams;
    }

    @Override
    public MethodType getApplyMethodType() {
      return new MethodType(srcInfo, TypeParameters.EMPTY, VoidType.get(),
                            applyParams);
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(applyParams, "applyParams", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      TypeParameters newTps = v.visitChild(typeParameters,
                                 TypeParameters.class, "typeParameters");
      ParameterList newParams = v.visitChild(applyParams,
                                 ParameterList.class, "applyParams");
      if (newAnnos == annotations && newTps == typeParameters &&
          newParams == applyParams) {
        return this;
      }
      ArchBlockType copy = (ArchBlockType) clone();
      copy.annotations = newAnnos.freeze();
      copy.typeParameters = newTps;
      copy.applyParams = newParams;
      copy.validate();
      return copy;
    }

    @Override
    public String dbprint() {
      return super.dbprint() + typeParameters + applyParams;
    }
  }

  public static class ParserType extends ArchBlockType {
    public ParserType(SourceInfo srcInfo, ID name, Annotations annotations,
          TypeParameters typeParameters, ParameterList applyParams,
          DeclIdAllocator ids) {
      super(srcInfo, name, annotations, typeParameters, applyParams, ids);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PARSER_TYPE;
    }
  }

  public static class ControlType extends ArchBlockType {
    public ControlType(SourceInfo srcInfo, ID name, Annotations annotations,
          TypeParameters typeParameters, ParameterList applyParams,
          DeclIdAllocator ids) {
      super(srcInfo, name, annotations, typeParameters, applyParams, ids);
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONTROL_TYPE;
    }
  }

  /**
   * Package type: a generic container instantiated with constructor
   * arguments, with no apply method.
   */
  public static class PackageType extends TypeDeclaration
                                  implements Container {
    private TypeParameters typeParameters;
    private ParameterList constructorParams;

    public PackageType(SourceInfo srcInfo, ID name, Annotations annotations,
          TypeParameters typeParameters, ParameterList constructorParams,
          DeclIdAllocator ids) {
      super(srcInfo, name, annotations, ids);
      this.typeParameters = typeParameters == null ? TypeParameters.EMPTY
                                                   : typeParameters;
      this.constructorParams = constructorParams;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PACKAGE_TYPE;
    }

    @Override
    public TypeParameters getTypeParameters() {
      return typeParameters;
    }

    @Override
    public ParameterList getConstructorParameters() {
      return constructorParams;
    }

    @Override
    public MethodType getConstructorMethodType() {
      return new MethodType(srcInfo, typeParameters, this, constructorParams);
    }

    @Override
    public void validate() {
      super.validate();
      checkNotNull(constructorParams, "constructorParams", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      Annotations newAnnos = visitAnnotations(v);
      TypeParameters newTps = v.visitChild(typeParameters,
                                 TypeParameters.class, "typeParameters");
      ParameterList newParams = v.visitChild(constructorParams,
                                 ParameterList.class, "constructorParams");
      if (newAnnos == annotations && newTps == typeParameters &&
          newParams == constructorParams) {
        return this;
      }
      PackageType copy = (PackageType) clone();
      copy.annotations = newAnnos.freeze();
      copy.typeParameters = newTps;
      copy.constructorParams = newParams;
      copy.validate();
      return copy;
    }
  }

  /**
   * Signature of a method, function, constructor or apply.
   * Return type is null for constructors.
   */
  public static class MethodType extends Type
                      implements MayBeGeneric, Functional {
    private TypeParameters typeParameters;
    private Type returnType;
    private ParameterList parameters;

    public MethodType(SourceInfo srcInfo, TypeParameters typeParameters,
                      Type returnType, ParameterList parameters) {
      super(srcInfo);
      this.typeParameters = typeParameters == null ? TypeParameters.EMPTY
                                                   : typeParameters;
      this.returnType = returnType;
      this.parameters = parameters;
      validate();
    }

    public MethodType(Type returnType, ParameterList parameters) {
      this(SourceInfo.INVALID, TypeParameters.EMPTY, returnType, parameters);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.METHOD_TYPE;
    }

    @Override
    public TypeParameters getTypeParameters() {
      return typeParameters;
    }

    public Type getReturnType() {
      return returnType;
    }

    @Override
    public ParameterList getParameters() {
      return parameters;
    }

    @Override
    public Type getP4Type() {
      return this;
    }

    @Override
    public void validate() {
      checkNotNull(parameters, "parameters", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      TypeParameters newTps = v.visitChild(typeParameters,
                                 TypeParameters.class, "typeParameters");
      Type newRet = v.visitOptionalChild(returnType, Type.class, "returnType");
      ParameterList newParams = v.visitChild(parameters, ParameterList.class,
                                             "parameters");
      if (newTps == typeParameters && newRet == returnType &&
          newParams == parameters) {
        return this;
      }
      MethodType copy = (MethodType) clone();
      copy.typeParameters = newTps;
      copy.returnType = newRet;
      copy.parameters = newParams;
      copy.validate();
      return copy;
    }

    @Override
    public String toString() {
      List<String> params = new ArrayList<String>();
      for (Parameter p: parameters.getParameters()) {
        params.add(p.getType().toString());
      }
      String res = typeParameters + "(" + StringUtils.join(params, ", ") + ")";
      if (returnType != null) {
        res += " -> " + returnType;
      }
      return res;
    }
  }

  /**
   * Internal type of the result of applying a table.  Never written in
   * source; it refers back to its table without visiting it.
   */
  public static class TableType extends Type {
    private final TableDeclaration table;

    public TableType(TableDeclaration table) {
      super(table == null ? null : table.getSourceInfo());
      this.table = table;
      validate();
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TABLE_TYPE;
    }

    public TableDeclaration getTable() {
      return table;
    }

    @Override
    public Type getP4Type() {
      return this;
    }

    @Override
    public void validate() {
      checkNotNull(table, "table", this);
    }

    @Override
    public Node visitChildren(Visitor v) {
      return this;
    }

    @Override
    public String toString() {
      return "table " + table.getName();
    }
  }
}
