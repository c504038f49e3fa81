package exm.p4ir.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Test;

import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void reset() {
    System.clearProperty(Settings.PASS_DUMP_AFTER);
    Settings.clear(Settings.PASS_DUMP_AFTER);
    Settings.clear(Settings.VISIT_DAG_ONCE);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.VISIT_DAG_ONCE));
    assertTrue(Settings.getBoolean(Settings.PASS_STOP_ON_ERROR));
    assertFalse(Settings.getBoolean(Settings.UNIQUE_NAME_ANNOTATION));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testOverrideAndClear() throws InvalidOptionException {
    Settings.set(Settings.VISIT_DAG_ONCE, "FALSE");
    assertFalse(Settings.getBoolean(Settings.VISIT_DAG_ONCE));
    Settings.clear(Settings.VISIT_DAG_ONCE);
    assertTrue(Settings.getBoolean(Settings.VISIT_DAG_ONCE));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.VISIT_DAG_ONCE, "sometimes");
    Settings.getBoolean(Settings.VISIT_DAG_ONCE);
  }

  @Test
  public void testBadBooleanInternal() {
    Settings.set(Settings.VISIT_DAG_ONCE, "1");
    try {
      Settings.getBooleanInternal(Settings.VISIT_DAG_ONCE);
      fail("Expected IRInvariantError");
    } catch (IRInvariantError e) {
      assertTrue(e.getMessage(), e.getMessage().contains(
                                          Settings.VISIT_DAG_ONCE));
    }
  }

  @Test(expected=InvalidOptionException.class)
  public void testMissingKey() throws InvalidOptionException {
    Settings.getBoolean("p4ir.no-such-key");
  }

  @Test
  public void testSystemProperties() throws InvalidOptionException {
    System.setProperty(Settings.PASS_DUMP_AFTER, "true");
    Settings.initProperties();
    assertTrue(Settings.getBoolean(Settings.PASS_DUMP_AFTER));
  }

  @Test(expected=InvalidOptionException.class)
  public void testInvalidSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.PASS_DUMP_AFTER, "maybe");
    Settings.initProperties();
  }
}
