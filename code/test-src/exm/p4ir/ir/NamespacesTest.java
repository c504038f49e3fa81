package exm.p4ir.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.Iterables;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.Logging;
import exm.p4ir.common.Diagnostics.Diagnostic;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.Namespace;
import exm.p4ir.ir.Declarations.Direction;
import exm.p4ir.ir.Declarations.Method;
import exm.p4ir.ir.Declarations.Parameter;
import exm.p4ir.ir.Declarations.ParameterList;
import exm.p4ir.ir.Declarations.StructField;
import exm.p4ir.ir.Types.BitsType;
import exm.p4ir.ir.Types.BoolType;
import exm.p4ir.ir.Types.ExternType;
import exm.p4ir.ir.Types.MethodType;
import exm.p4ir.ir.Types.StructType;
import exm.p4ir.ir.Types.Type;
import exm.p4ir.ir.Types.VoidType;

public class NamespacesTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private final DeclIdAllocator ids = new DeclIdAllocator();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/NamespacesTest.p4ir.log", true);
  }

  private StructType struct(String name, int line) {
    return new StructType(SourceInfo.at("ns.p4", line, 1), new ID(name),
        null, Collections.<StructField>emptyList(), ids);
  }

  private Method method(String name, int line, Type... paramTypes) {
    Parameter[] params = new Parameter[paramTypes.length];
    for (int i = 0; i < paramTypes.length; i++) {
      params[i] = new Parameter(new ID("p" + i), Direction.IN, paramTypes[i],
                                ids);
    }
    return new Method(SourceInfo.at("ns.p4", line, 3), new ID(name), null,
        new MethodType(VoidType.get(), new ParameterList(Arrays.asList(params))),
        false, ids);
  }

  @Test
  public void testDuplicateInGeneralNamespace() {
    Program p = new Program(Arrays.asList(struct("S", 1), struct("T", 2),
                                          struct("S", 3)));
    Diagnostics diags = new Diagnostics();
    assertEquals(1, Namespaces.checkDuplicateDeclarations(p, diags));
    assertEquals("Exactly one diagnostic", 1, diags.getDiagnostics().size());
    Diagnostic d = diags.getDiagnostics().get(0);
    assertEquals(Diagnostics.Kind.ERROR, d.kind);
    assertEquals("Reported at the second declaration",
                 SourceInfo.at("ns.p4", 3, 1), d.srcInfo);
    assertTrue(d.message.contains("ns.p4:1:1"));
  }

  @Test
  public void testEachRepeatReportedOnce() {
    Program p = new Program(Arrays.asList(struct("S", 1), struct("S", 2),
                                          struct("S", 3)));
    Diagnostics diags = new Diagnostics();
    assertEquals(2, Namespaces.checkDuplicateDeclarations(p, diags));
    assertEquals(2, diags.getErrorCount());
  }

  @Test
  public void testDuplicateInStrictNamespace() {
    exception.expect(IRInvariantError.class);
    new ParameterList(Arrays.asList(
        new Parameter(new ID("x"), Direction.IN, BoolType.get(), ids),
        new Parameter(new ID("x"), Direction.OUT, BoolType.get(), ids)));
  }

  @Test
  public void testOverloadsAllowed() {
    ExternType ext = new ExternType(SourceInfo.INVALID, new ID("E"), null,
        null, Arrays.asList(method("f", 1, BitsType.get(8)),
                            method("f", 2, BitsType.get(16)),
                            method("f", 3),
                            method("g", 4, BitsType.get(8))), ids);
    Diagnostics diags = new Diagnostics();
    assertEquals(0, Namespaces.checkDuplicateDeclarations(ext, diags));
    assertEquals(0, diags.getErrorCount());
    assertEquals(3, Iterables.size(ext.getDeclsByName("f")));
  }

  @Test
  public void testSameSignatureReported() {
    ExternType ext = new ExternType(SourceInfo.INVALID, new ID("E"), null,
        null, Arrays.asList(method("f", 1, BitsType.get(8)),
                            method("f", 2, BitsType.get(8))), ids);
    Diagnostics diags = new Diagnostics();
    assertEquals(1, Namespaces.checkDuplicateDeclarations(ext, diags));
    assertEquals(SourceInfo.at("ns.p4", 2, 3),
                 diags.getDiagnostics().get(0).srcInfo);
  }

  @Test
  public void testSignature() {
    assertEquals("f(bit<8>, bool)", Namespaces.signature(
        method("f", 1, BitsType.get(8), BoolType.get())));
    assertEquals("S", Namespaces.signature(struct("S", 1)));
  }

  @Test
  public void testDeclsByNameIsLazy() {
    List<StructType> decls = new ArrayList<StructType>();
    decls.add(struct("A", 1));
    Iterable<?> view = Namespaces.declsByName(decls, "B");
    assertEquals(0, Iterables.size(view));
    decls.add(struct("B", 2));
    assertEquals("View sees later additions", 1, Iterables.size(view));
  }

  @Test
  public void testLookupInnermostFirst() {
    StructType outerX = struct("x", 1);
    Program outer = new Program(Arrays.asList(outerX, struct("y", 2)));
    Parameter innerX = new Parameter(new ID("x"), Direction.IN,
                                     BoolType.get(), ids);
    ParameterList inner = new ParameterList(Arrays.asList(innerX));
    List<Namespace> scopes = Arrays.<Namespace>asList(inner, outer);

    assertSame(innerX, Namespaces.lookup(scopes, "x"));
    assertEquals("y", Namespaces.lookup(scopes, "y").getName().name);
    assertNull(Namespaces.lookup(scopes, "z"));
  }
}
