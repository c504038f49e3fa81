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

import java.util.List;

import exm.p4ir.ir.Declarations.ParameterList;
import exm.p4ir.ir.Declarations.TypeParameters;
import exm.p4ir.ir.Types.MethodType;
import exm.p4ir.ir.Types.Type;

/**
 * Behaviours that node kinds can take on independently of where they sit
 * in the Type and Declaration hierarchies.  A node kind implements as many
 * of these as apply to it.
 */
public class Capabilities {

  /**
   * Something that introduces a name.  Implemented by both the statement
   * Declaration hierarchy and the TypeDeclaration hierarchy.
   */
  public static interface Declared {
    public ID getName();

    /**
     * @return id that is unique among all declarations of a compilation
     */
    public int getDeclId();

    /**
     * @return the name used by the control plane: the argument of an
     *         @name annotation if there is one, otherwise the name
     */
    public String externalName();

    public Node getNode();
  }

  public static interface Annotated {
    public Annotations getAnnotations();

    /**
     * @return the annotation called name, or null if none
     */
    public Annotation getAnnotation(String name);
  }

  /**
   * Marks nodes whose value is known at compile time
   */
  public static interface CompileTimeValue {
  }

  public static interface MayBeGeneric {
    /**
     * @return type parameters, empty if not generic.  Never null
     */
    public TypeParameters getTypeParameters();
  }

  /**
   * Something that takes parameters
   */
  public static interface Functional {
    public ParameterList getParameters();
  }

  /**
   * Something with the well-known "apply" entry point: parsers, controls
   * and tables.
   */
  public static interface HasApply {
    public MethodType getApplyMethodType();
    public ParameterList getApplyParameters();
  }

  public static interface Namespace {
    public Iterable<? extends Declared> getDeclarations();
  }

  /**
   * Namespace where each name is declared at most once
   */
  public static interface SimpleNamespace extends Namespace {
    /**
     * @return the declaration, or null if name isn't declared here
     */
    public Declared getDeclByName(String name);
  }

  /**
   * Namespace where several declarations may share a name, for example
   * overloaded methods
   */
  public static interface GeneralNamespace extends Namespace {
    /**
     * @return all declarations called name, computed lazily
     */
    public Iterable<? extends Declared> getDeclsByName(String name);
  }

  /**
   * Namespace with inner namespaces.  The node's own declarations are
   * searched first, then the nested namespaces in order.
   */
  public static interface NestedNamespace extends Namespace {
    public List<Namespace> getNestedNamespaces();
  }

  public static interface TypeVarLike {
    public String getVarName();
    public int getDeclId();
    public Type asType();
  }

  /**
   * A declaration that is instantiated with constructor arguments:
   * parsers, controls, packages
   */
  public static interface Container extends MayBeGeneric, Declared {
    public MethodType getConstructorMethodType();
    public ParameterList getConstructorParameters();
  }

  /**
   * A named, typed entity
   */
  public static interface Instance {
    public ID getName();
    public Type getType();
  }
}
