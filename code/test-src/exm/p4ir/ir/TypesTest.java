package exm.p4ir.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Declarations.Direction;
import exm.p4ir.ir.Declarations.Method;
import exm.p4ir.ir.Declarations.Parameter;
import exm.p4ir.ir.Declarations.ParameterList;
import exm.p4ir.ir.Declarations.StructField;
import exm.p4ir.ir.Declarations.TableDeclaration;
import exm.p4ir.ir.Declarations.TypeParameters;
import exm.p4ir.ir.Expressions.Constant;
import exm.p4ir.ir.Types.BitsType;
import exm.p4ir.ir.Types.BoolType;
import exm.p4ir.ir.Types.ControlType;
import exm.p4ir.ir.Types.ExternType;
import exm.p4ir.ir.Types.InfIntType;
import exm.p4ir.ir.Types.MethodType;
import exm.p4ir.ir.Types.PackageType;
import exm.p4ir.ir.Types.StructType;
import exm.p4ir.ir.Types.TableType;
import exm.p4ir.ir.Types.Type;
import exm.p4ir.ir.Types.TypeName;
import exm.p4ir.ir.Types.TypeVar;
import exm.p4ir.ir.Types.UnknownType;
import exm.p4ir.ir.Types.VarbitType;
import exm.p4ir.ir.Types.VoidType;

public class TypesTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final DeclIdAllocator ids = new DeclIdAllocator();

  private StructType header() {
    List<StructField> fields = Arrays.asList(
        new StructField(new ID("dst"), BitsType.get(48), ids),
        new StructField(new ID("src"), BitsType.get(48), ids),
        new StructField(new ID("etherType"), BitsType.get(16), ids));
    return new StructType(SourceInfo.at("eth.p4", 1, 1), new ID("eth_t"),
                          Annotations.EMPTY, fields, ids);
  }

  @Test
  public void testBaseTypesAreOwnSourceForm() {
    Type[] types = new Type[] {BoolType.get(), BitsType.get(8),
        BitsType.get(8, true), new VarbitType(SourceInfo.INVALID, 32),
        InfIntType.get(), VoidType.get(), UnknownType.get()};
    for (Type t: types) {
      assertSame(t.toString(), t, t.getP4Type());
    }
  }

  @Test
  public void testDeclaredTypeSourceForm() {
    StructType s = header();
    Type p4 = s.getP4Type();
    assertTrue(p4 instanceof TypeName);
    assertEquals("eth_t", p4.toString());
    assertEquals("eth_t", ((TypeName) p4).getPath().getName().name);
    assertSame(p4, p4.getP4Type());
  }

  @Test
  public void testRenamedDeclaredTypeSourceForm() {
    StructType s = (StructType) header().withName(
                                   new ID("eth_t").rename("eth_t_0"));
    TypeName p4 = (TypeName) s.getP4Type();
    assertEquals("Shows original name", "eth_t", p4.toString());
    assertEquals("eth_t_0", p4.getPath().asString());
  }

  @Test
  public void testWidths() {
    assertEquals(1, BoolType.get().widthBits());
    assertEquals(12, BitsType.get(12).widthBits());
    assertEquals("No static width", 0,
                 new VarbitType(SourceInfo.INVALID, 64).widthBits());
    assertEquals(0, InfIntType.get().widthBits());
    assertEquals(112, header().widthBits());
  }

  @Test
  public void testBitsTypes() {
    assertSame(BitsType.get(32), BitsType.get(32, false));
    assertNotSame(BitsType.get(32), BitsType.get(32, true));
    assertEquals("bit<32>", BitsType.get(32).toString());
    assertEquals("int<8>", BitsType.get(8, true).toString());
    assertEquals("varbit<16>",
                 new VarbitType(SourceInfo.INVALID, 16).toString());
  }

  @Test
  public void testZeroWidthRejected() {
    exception.expect(IRInvariantError.class);
    new BitsType(SourceInfo.INVALID, 0, false);
  }

  @Test
  public void testStructFields() {
    StructType s = header();
    assertEquals(BitsType.get(16), s.getField("etherType").getType());
    assertEquals(null, s.getField("ttl"));
    assertSame(s.getField("dst"), s.getDeclByName("dst"));
  }

  @Test
  public void testStructDuplicateField() {
    List<StructField> fields = Arrays.asList(
        new StructField(new ID("f"), BitsType.get(8), ids),
        new StructField(new ID("f"), BitsType.get(16), ids));
    exception.expect(IRInvariantError.class);
    new StructType(SourceInfo.INVALID, new ID("S"), null, fields, ids);
  }

  private Parameter param(String name, Type t, boolean withDefault) {
    return new Parameter(SourceInfo.INVALID, new ID(name), null,
        Direction.IN, t, withDefault ? new Constant(0) : null, ids);
  }

  private Method method(String name, Parameter... params) {
    return new Method(new ID(name), new MethodType(VoidType.get(),
                      new ParameterList(Arrays.asList(params))), ids);
  }

  @Test
  public void testExternLookupMethods() {
    Method count1 = method("count", param("index", BitsType.get(32), false));
    Method count2 = method("count", param("index", BitsType.get(32), false),
                           param("n", BitsType.get(32), true));
    Method ctor = method("Counter", param("size", BitsType.get(32), false));
    ExternType ext = new ExternType(SourceInfo.INVALID, new ID("Counter"),
        null, null, Arrays.asList(count1, count2, ctor), ids);

    assertEquals(Arrays.asList(count1, count2), ext.lookupMethods("count", 1));
    assertEquals(Arrays.asList(count2), ext.lookupMethods("count", 2));
    assertTrue(ext.lookupMethods("count", 3).isEmpty());
    assertTrue(ext.lookupMethods("count", 0).isEmpty());
    assertEquals(Arrays.asList(ctor), ext.getConstructors());

    int n = 0;
    for (Object o: ext.getDeclsByName("count")) {
      assertTrue(o instanceof Method);
      n++;
    }
    assertEquals(2, n);
  }

  @Test
  public void testMethodTypeToString() {
    TypeVar t = new TypeVar(new ID("T"), ids);
    MethodType mt = new MethodType(SourceInfo.INVALID,
        new TypeParameters(Arrays.asList(t)), BoolType.get(),
        new ParameterList(Arrays.asList(param("x", t, false),
                                        param("y", BitsType.get(4), false))));
    assertEquals("<T>(T, bit<4>) -> bool", mt.toString());
    assertSame(mt, mt.getP4Type());
    assertSame("Type variable is its own source form", t, t.getP4Type());
  }

  @Test
  public void testControlApply() {
    ParameterList applyParams = new ParameterList(Arrays.asList(
        param("hdr", header(), false)));
    ControlType ct = new ControlType(SourceInfo.INVALID, new ID("Ingress"),
        null, TypeParameters.EMPTY, applyParams, ids);
    MethodType apply = ct.getApplyMethodType();
    assertSame(applyParams, apply.getParameters());
    assertSame(VoidType.get(), apply.getReturnType());
  }

  @Test
  public void testPackageConstructor() {
    ParameterList ctorParams = new ParameterList(Arrays.asList(
        param("ig", BitsType.get(1), false)));
    PackageType pkg = new PackageType(SourceInfo.INVALID, new ID("Switch"),
        null, null, ctorParams, ids);
    MethodType ctor = pkg.getConstructorMethodType();
    assertSame(pkg, ctor.getReturnType());
    assertSame(ctorParams, pkg.getConstructorParameters());
    assertTrue(pkg.getTypeParameters().isEmpty());
  }

  @Test
  public void testTableType() {
    TableDeclaration table = new TableDeclaration(SourceInfo.INVALID,
        new ID("t"), null, Collections.<Declarations.Property>emptyList(),
        ids);
    MethodType apply = table.getApplyMethodType();
    assertTrue(apply.getParameters().isEmpty());
    TableType tt = (TableType) apply.getReturnType();
    assertSame(table, tt.getTable());
    assertEquals("table t", tt.toString());
  }

  @Test
  public void testTypeDeclarationEquality() {
    StructType s = header();
    StructType renamed = (StructType) s.withName(new ID("other"));
    assertEquals("Same declaration", s, renamed);
    assertEquals(s.getDeclId(), renamed.getDeclId());
    assertFalse("Different declaration", s.equals(header()));
  }

  @Test
  public void testTypeDeclarationNeedsAllocator() {
    exception.expect(IRInvariantError.class);
    new TypeVar(new ID("T"), null);
  }

  @Test
  public void testNullFieldRejected() {
    exception.expect(IRInvariantError.class);
    exception.expectMessage("fields");
    new StructType(SourceInfo.INVALID, new ID("S"), null,
        Arrays.asList(new StructField(new ID("f"), BitsType.get(8), ids),
                      null), ids);
  }

  @Test
  public void testNullMethodRejected() {
    exception.expect(IRInvariantError.class);
    new ExternType(SourceInfo.INVALID, new ID("E"), null, null,
                   Arrays.<Method>asList((Method) null), ids);
  }
}
