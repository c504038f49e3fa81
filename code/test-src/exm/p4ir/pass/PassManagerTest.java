package exm.p4ir.pass;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.Logging;
import exm.p4ir.common.Settings;
import exm.p4ir.common.exceptions.UserException;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.SourceInfo;
import exm.p4ir.ir.Expressions.Constant;

public class PassManagerTest {

  private static final String ENABLED_KEY = "p4ir.test.pass-enabled";

  private final List<String> ran = new ArrayList<String>();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/PassManagerTest.p4ir.log", true);
  }

  @After
  public void resetSettings() {
    Settings.clear(Settings.PASS_STOP_ON_ERROR);
    Settings.clear(Settings.PASS_DUMP_AFTER);
    Settings.clear(ENABLED_KEY);
  }

  /**
   * Records that it ran, optionally reporting an error or replacing the
   * tree
   */
  private class TestPass implements Pass {
    private final String name;
    private final boolean reportError;
    private final Node replacement;
    private final String enabledKey;

    TestPass(String name, boolean reportError, Node replacement,
             String enabledKey) {
      this.name = name;
      this.reportError = reportError;
      this.replacement = replacement;
      this.enabledKey = enabledKey;
    }

    TestPass(String name) {
      this(name, false, null, null);
    }

    @Override
    public String getPassName() {
      return name;
    }

    @Override
    public String getConfigEnabledKey() {
      return enabledKey;
    }

    @Override
    public Node apply(Logger logger, Node root, Diagnostics diags) {
      ran.add(name);
      if (reportError) {
        diags.error(SourceInfo.at("p.p4", 1, 1), name + " failed");
      }
      return replacement == null ? root : replacement;
    }
  }

  @Test
  public void testRunsInOrder() throws UserException {
    Constant root = new Constant(1);
    Constant replaced = new Constant(2);
    PassManager pm = new PassManager()
        .addPass(new TestPass("a"))
        .addPass(new TestPass("b", false, replaced, null))
        .addPass(new TestPass("c"));
    Node result = pm.run(Logging.getIRLogger(), root, new Diagnostics());
    assertEquals(Arrays.asList("a", "b", "c"), ran);
    assertSame(replaced, result);
  }

  @Test
  public void testStopOnError() throws UserException {
    PassManager pm = new PassManager()
        .addPass(new TestPass("a", true, null, null))
        .addPass(new TestPass("b"));
    Diagnostics diags = new Diagnostics();
    try {
      pm.run(Logging.getIRLogger(), new Constant(1), diags);
      fail("Expected UserException");
    } catch (UserException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("after pass a"));
    }
    assertEquals(Arrays.asList("a"), ran);
    assertEquals(1, diags.getErrorCount());
  }

  @Test
  public void testContinueOnError() throws UserException {
    Settings.set(Settings.PASS_STOP_ON_ERROR, "false");
    PassManager pm = new PassManager()
        .addPass(new TestPass("a", true, null, null))
        .addPass(new TestPass("b", true, null, null));
    Diagnostics diags = new Diagnostics();
    pm.run(Logging.getIRLogger(), new Constant(1), diags);
    assertEquals(Arrays.asList("a", "b"), ran);
    assertEquals(2, diags.getErrorCount());
  }

  @Test
  public void testDisabledPass() throws UserException {
    Settings.set(ENABLED_KEY, "false");
    PassManager pm = new PassManager()
        .addPass(new TestPass("off", false, null, ENABLED_KEY))
        .addPass(new TestPass("on"));
    pm.run(Logging.getIRLogger(), new Constant(1), new Diagnostics());
    assertEquals(Arrays.asList("on"), ran);
  }

  @Test
  public void testDumpAfter() throws UserException {
    Settings.set(Settings.PASS_DUMP_AFTER, "true");
    Logger logger = Logger.getLogger("exm.p4ir.test.dump");
    logger.setLevel(Level.DEBUG);
    StringWriter out = new StringWriter();
    WriterAppender appender = new WriterAppender(new PatternLayout("%m%n"),
                                                 out);
    logger.addAppender(appender);
    try {
      new PassManager().addPass(new TestPass("a"))
          .run(logger, new Constant(7), new Diagnostics());
    } finally {
      logger.removeAppender(appender);
    }
    assertTrue(out.toString(), out.toString().contains("Tree after a"));
    assertTrue(out.toString(), out.toString().contains("Constant 7"));
  }
}
