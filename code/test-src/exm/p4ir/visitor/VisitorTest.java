package exm.p4ir.visitor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.p4ir.common.Logging;
import exm.p4ir.common.Settings;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.ID;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.NodeKind;
import exm.p4ir.ir.Path;
import exm.p4ir.ir.Expressions.BinaryOp;
import exm.p4ir.ir.Expressions.BinaryOperation;
import exm.p4ir.ir.Expressions.Constant;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.ir.Expressions.PathExpression;
import exm.p4ir.ir.Statements.AssignmentStatement;
import exm.p4ir.ir.Statements.BlockStatement;
import exm.p4ir.ir.Statements.EmptyStatement;
import exm.p4ir.ir.Statements.Statement;
import exm.p4ir.ir.Statements.StatOrDecl;
import exm.p4ir.ir.Types.BitsType;
import exm.p4ir.ir.Types.Type;

public class VisitorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/VisitorTest.p4ir.log", true);
  }

  @After
  public void resetSettings() {
    Settings.clear(Settings.VISIT_DAG_ONCE);
  }

  private static PathExpression ref(String name) {
    return new PathExpression(new ID(name));
  }

  /**
   * Counts nodes by kind
   */
  private static class Counter extends Inspector {
    final List<NodeKind> pre = new ArrayList<NodeKind>();
    final List<NodeKind> post = new ArrayList<NodeKind>();
    int types = 0;

    @Override
    public boolean preorder(Node node) {
      pre.add(node.kind());
      return super.preorder(node);
    }

    @Override
    public void postorder(Node node) {
      post.add(node.kind());
      super.postorder(node);
    }

    @Override
    public boolean preorder(Type type) {
      types++;
      return true;
    }

    int count(NodeKind kind) {
      int n = 0;
      for (NodeKind k: pre) {
        if (k == kind) {
          n++;
        }
      }
      return n;
    }
  }

  /**
   * Replaces the constant 1 with 2
   */
  private static class BumpOnes extends Transform {
    @Override
    public Node postorder(Expression expr) {
      Constant c = expr.as(Constant.class);
      if (c != null && c.asLong() == 1) {
        return new Constant(c.getSourceInfo(), c.getType(),
                            c.getValue().add(c.getValue()), c.getBase());
      }
      return expr;
    }
  }

  @Test
  public void testInspectorOrder() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, ref("a"),
                                            new Constant(1));
    Counter c = new Counter();
    assertSame(e, c.apply(e));
    assertEquals(Arrays.asList(NodeKind.BINARY_OPERATION,
        NodeKind.PATH_EXPRESSION, NodeKind.PATH, NodeKind.CONSTANT), c.pre);
    assertEquals(Arrays.asList(NodeKind.PATH, NodeKind.PATH_EXPRESSION,
        NodeKind.CONSTANT, NodeKind.BINARY_OPERATION), c.post);
  }

  @Test
  public void testPreorderFalseSkipsChildren() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, ref("a"),
                                            new Constant(1));
    Counter c = new Counter() {
      @Override
      public boolean preorder(Expression expr) {
        return !(expr instanceof PathExpression);
      }
    };
    c.apply(e);
    assertEquals(0, c.count(NodeKind.PATH));
    assertEquals(1, c.count(NodeKind.PATH_EXPRESSION));
  }

  @Test
  public void testIdentityTransformSharesEverything() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, ref("a"),
                                            new Constant(3));
    assertSame(e, new Transform() { }.apply(e));
    assertSame(e, new BumpOnes().apply(e));
  }

  @Test
  public void testTransformCopiesPathToChange() {
    PathExpression a = ref("a");
    BinaryOperation inner = new BinaryOperation(BinaryOp.MUL, a,
                                                new Constant(1));
    PathExpression b = ref("b");
    AssignmentStatement stmt = new AssignmentStatement(b, inner);

    AssignmentStatement result = (AssignmentStatement)
                                        new BumpOnes().apply(stmt);
    assertNotSame(stmt, result);
    assertSame("Untouched sibling shared", b, result.getLeft());
    BinaryOperation newInner = (BinaryOperation) result.getRight();
    assertNotSame(inner, newInner);
    assertSame(a, newInner.getLeft());
    assertEquals(2, ((Constant) newInner.getRight()).asLong());
    assertEquals("Original untouched", 1,
                 ((Constant) inner.getRight()).asLong());
  }

  @Test
  public void testSharedSubtreeVisitedOnce() {
    PathExpression shared = ref("x");
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, shared, shared);
    Counter c = new Counter();
    c.apply(e);
    assertEquals(1, c.count(NodeKind.PATH_EXPRESSION));
  }

  @Test
  public void testSharedSubtreeVisitedTwiceWithoutMemo() {
    Settings.set(Settings.VISIT_DAG_ONCE, "false");
    PathExpression shared = ref("x");
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, shared, shared);
    Counter c = new Counter();
    c.apply(e);
    assertEquals(2, c.count(NodeKind.PATH_EXPRESSION));
  }

  @Test
  public void testSharingPreservedByRewrite() {
    Constant one = new Constant(1);
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, one, one);
    BinaryOperation result = (BinaryOperation) new BumpOnes().apply(e);
    assertNotSame(one, result.getLeft());
    assertSame("Still one shared node", result.getLeft(), result.getRight());
  }

  @Test
  public void testExpressionTypesNotVisitedByDefault() {
    Constant c8 = new Constant(BitsType.get(8), 5);
    Counter c = new Counter();
    c.apply(c8);
    assertEquals(0, c.types);

    Counter withTypes = new Counter() {
      @Override
      public boolean visitExpressionTypes() {
        return true;
      }
    };
    withTypes.apply(c8);
    assertEquals(1, withTypes.types);
  }

  @Test
  public void testTypeRewriteOptIn() {
    final Constant c8 = new Constant(BitsType.get(8), 5);
    Transform widen = new Transform() {
      @Override
      public boolean visitExpressionTypes() {
        return true;
      }

      @Override
      public Node postorder(Type type) {
        return BitsType.get(16);
      }
    };
    Constant result = (Constant) widen.apply(c8);
    assertSame(BitsType.get(16), result.getType());
    assertSame(BitsType.get(8), c8.getType());
  }

  @Test
  public void testRemoveFromList() {
    AssignmentStatement assign = new AssignmentStatement(ref("a"),
                                                         new Constant(4));
    BlockStatement block = new BlockStatement(Arrays.<StatOrDecl>asList(
        new EmptyStatement(), assign, new EmptyStatement()));
    Transform dropEmpty = new Transform() {
      @Override
      public Node preorder(Statement stmt) {
        return stmt.is(NodeKind.EMPTY_STATEMENT) ? null : stmt;
      }
    };
    BlockStatement result = (BlockStatement) dropEmpty.apply(block);
    assertEquals(1, result.getComponents().size());
    assertSame(assign, result.getComponents().get(0));
    assertEquals(3, block.getComponents().size());
  }

  @Test
  public void testRootRemoved() {
    Transform dropAll = new Transform() {
      @Override
      public Node preorder(Node node) {
        return null;
      }
    };
    assertNull(dropAll.apply(new EmptyStatement()));
  }

  @Test
  public void testRequiredChildRemoved() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, ref("a"),
                                            new Constant(1));
    Transform dropConstants = new Transform() {
      @Override
      public Node postorder(Expression expr) {
        return expr.is(NodeKind.CONSTANT) ? null : expr;
      }
    };
    exception.expect(IRInvariantError.class);
    dropConstants.apply(e);
  }

  @Test
  public void testWrongReplacementClass() {
    PathExpression e = ref("a");
    Transform bad = new Transform() {
      @Override
      public Node postorder(Path path) {
        return new Constant(0);
      }
    };
    exception.expect(IRInvariantError.class);
    bad.apply(e);
  }

  @Test
  public void testPrune() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, new Constant(1),
                                            new Constant(1));
    BumpOnes pruning = new BumpOnes() {
      @Override
      public Node preorder(Expression expr) {
        if (expr.is(NodeKind.BINARY_OPERATION)) {
          prune();
        }
        return expr;
      }
    };
    assertSame("Children not visited", e, pruning.apply(e));
  }

  @Test
  public void testContext() {
    final PathExpression a = ref("a");
    final BinaryOperation e = new BinaryOperation(BinaryOp.ADD, a,
                                                  new Constant(1));
    final List<Node> seen = new ArrayList<Node>();
    Inspector ctx = new Inspector() {
      @Override
      public boolean preorder(Path path) {
        seen.add(getContext());
        seen.add(findContext(BinaryOperation.class));
        seen.add(findContext(BlockStatement.class));
        assertEquals(2, getDepth());
        return true;
      }
    };
    ctx.apply(e);
    assertSame(a, seen.get(0));
    assertSame(e, seen.get(1));
    assertNull(seen.get(2));
  }

  @Test
  public void testApplyFromNode() {
    BinaryOperation e = new BinaryOperation(BinaryOp.ADD, ref("a"),
                                            new Constant(1));
    Node result = e.apply(new BumpOnes());
    assertEquals(2, ((Constant) ((BinaryOperation) result).getRight())
                                                          .asLong());
  }
}
