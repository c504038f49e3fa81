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

/**
 * Closed set of node kinds.  Every concrete node class has exactly one
 * kind, so visitors can dispatch with a switch rather than instanceof
 * chains.
 */
public enum NodeKind {
  // Types
  UNKNOWN_TYPE(Category.TYPE, "Type_Unknown"),
  BOOL_TYPE(Category.TYPE, "Type_Boolean"),
  BITS_TYPE(Category.TYPE, "Type_Bits"),
  VARBIT_TYPE(Category.TYPE, "Type_Varbit"),
  INFINT_TYPE(Category.TYPE, "Type_InfInt"),
  STRING_TYPE(Category.TYPE, "Type_String"),
  VOID_TYPE(Category.TYPE, "Type_Void"),
  TYPE_NAME(Category.TYPE, "Type_Name"),
  TYPE_VAR(Category.TYPE, "Type_Var"),
  STRUCT_TYPE(Category.TYPE, "Type_Struct"),
  EXTERN_TYPE(Category.TYPE, "Type_Extern"),
  PARSER_TYPE(Category.TYPE, "Type_Parser"),
  CONTROL_TYPE(Category.TYPE, "Type_Control"),
  PACKAGE_TYPE(Category.TYPE, "Type_Package"),
  METHOD_TYPE(Category.TYPE, "Type_Method"),
  TABLE_TYPE(Category.TYPE, "Type_Table"),

  // Declarations
  PARAMETER(Category.DECLARATION, "Parameter"),
  STRUCT_FIELD(Category.DECLARATION, "StructField"),
  DECLARATION_VARIABLE(Category.DECLARATION, "Declaration_Variable"),
  DECLARATION_CONSTANT(Category.DECLARATION, "Declaration_Constant"),
  DECLARATION_INSTANCE(Category.DECLARATION, "Declaration_Instance"),
  METHOD(Category.DECLARATION, "Method"),
  ACTION(Category.DECLARATION, "P4Action"),
  PROPERTY(Category.DECLARATION, "Property"),
  TABLE(Category.DECLARATION, "P4Table"),
  PARSER(Category.DECLARATION, "P4Parser"),
  CONTROL(Category.DECLARATION, "P4Control"),

  // Expressions
  PATH_EXPRESSION(Category.EXPRESSION, "PathExpression"),
  CONSTANT(Category.EXPRESSION, "Constant"),
  BOOL_LITERAL(Category.EXPRESSION, "BoolLiteral"),
  STRING_LITERAL(Category.EXPRESSION, "StringLiteral"),
  MEMBER(Category.EXPRESSION, "Member"),
  UNARY_OPERATION(Category.EXPRESSION, "Operation_Unary"),
  BINARY_OPERATION(Category.EXPRESSION, "Operation_Binary"),
  METHOD_CALL_EXPRESSION(Category.EXPRESSION, "MethodCallExpression"),

  // Statements
  ASSIGNMENT_STATEMENT(Category.STATEMENT, "AssignmentStatement"),
  METHOD_CALL_STATEMENT(Category.STATEMENT, "MethodCallStatement"),
  EMPTY_STATEMENT(Category.STATEMENT, "EmptyStatement"),
  BLOCK_STATEMENT(Category.STATEMENT, "BlockStatement"),

  PATH(Category.PATH, "Path"),

  ANNOTATION(Category.ANNOTATION, "Annotation"),
  ANNOTATIONS(Category.ANNOTATION, "Annotations"),

  PARAMETER_LIST(Category.OTHER, "ParameterList"),
  TYPE_PARAMETERS(Category.OTHER, "TypeParameters"),
  PROGRAM(Category.OTHER, "P4Program"),
  ;

  public static enum Category {
    TYPE,
    DECLARATION,
    EXPRESSION,
    STATEMENT,
    PATH,
    ANNOTATION,
    OTHER,
  }

  private final Category category;
  private final String typeName;

  private NodeKind(Category category, String typeName) {
    this.category = category;
    this.typeName = typeName;
  }

  public Category category() {
    return category;
  }

  /**
   * @return node type name, as shown in debug dumps
   */
  public String typeName() {
    return typeName;
  }
}
