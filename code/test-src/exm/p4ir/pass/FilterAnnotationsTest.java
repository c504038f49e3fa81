package exm.p4ir.pass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.base.Predicate;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.Logging;
import exm.p4ir.ir.Annotation;
import exm.p4ir.ir.Annotations;
import exm.p4ir.ir.DeclIdAllocator;
import exm.p4ir.ir.ID;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.Program;
import exm.p4ir.ir.SourceInfo;
import exm.p4ir.ir.Declarations.StructField;
import exm.p4ir.ir.Expressions.StringLiteral;
import exm.p4ir.ir.Types.BitsType;
import exm.p4ir.ir.Types.StructType;

public class FilterAnnotationsTest {

  private final DeclIdAllocator ids = new DeclIdAllocator();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/FilterAnnotationsTest.p4ir.log", true);
  }

  private StructType struct(String name, Annotation... annos) {
    return new StructType(SourceInfo.INVALID, new ID(name),
        new Annotations(Arrays.asList(annos)),
        Arrays.asList(new StructField(new ID("f"), BitsType.get(8), ids)),
        ids);
  }

  @Test
  public void testRemoving() {
    StructType hidden = struct("A", new Annotation(Annotation.HIDDEN),
        new Annotation(Annotation.NAME, new StringLiteral("a")));
    StructType plain = struct("B",
        new Annotation(Annotation.NAME, new StringLiteral("b")));
    Program p = new Program(Arrays.asList(hidden, plain));

    Program result = (Program) FilterAnnotations.removing(Annotation.HIDDEN)
        .apply(Logging.getIRLogger(), p, new Diagnostics());

    assertNotSame(p, result);
    StructType newHidden = (StructType) result.getObjects().get(0);
    assertNotSame(hidden, newHidden);
    assertNull(newHidden.getAnnotation(Annotation.HIDDEN));
    assertEquals("a", newHidden.getAnnotation(Annotation.NAME)
                               .getSingleString());
    assertEquals("Still the same declaration", hidden.getDeclId(),
                 newHidden.getDeclId());
    assertSame("Fields untouched", hidden.getFields(), newHidden.getFields());
    assertTrue(newHidden.getAnnotations().isFrozen());

    assertSame("No annotation removed, node shared", plain,
               result.getObjects().get(1));
    assertEquals("Original untouched", 2, hidden.getAnnotations().size());
  }

  @Test
  public void testNothingToRemove() {
    Program p = new Program(Arrays.asList(struct("A"),
        struct("B", new Annotation(Annotation.ATOMIC))));
    Node result = FilterAnnotations.removing(Annotation.HIDDEN).apply(p);
    assertSame(p, result);
  }

  @Test
  public void testPredicate() {
    Program p = new Program(Arrays.asList(
        struct("A", new Annotation("custom"),
               new Annotation(Annotation.ATOMIC)),
        struct("B", new Annotation("other"))));
    FilterAnnotations onlyPredefined = new FilterAnnotations(
        new Predicate<Annotation>() {
          @Override
          public boolean apply(Annotation a) {
            return a.isPredefined();
          }
        });
    Program result = (Program) onlyPredefined.apply(p);
    StructType a = (StructType) result.getObjects().get(0);
    StructType b = (StructType) result.getObjects().get(1);
    assertEquals(1, a.getAnnotations().size());
    assertEquals(Annotation.ATOMIC,
                 a.getAnnotations().getAnnotations().get(0).getName().name);
    assertTrue(b.getAnnotations().isEmpty());
    assertEquals(Collections.<Annotation>emptyList(),
                 b.getAnnotations().getAnnotations());
  }
}
