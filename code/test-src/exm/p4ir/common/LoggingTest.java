package exm.p4ir.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Logger;
import org.junit.Test;

public class LoggingTest {

  private static List<FileAppender> fileAppenders(Logger logger) {
    List<FileAppender> res = new ArrayList<FileAppender>();
    Enumeration<?> e = logger.getAllAppenders();
    while (e.hasMoreElements()) {
      Appender a = (Appender) e.nextElement();
      if (a instanceof FileAppender) {
        res.add((FileAppender) a);
      }
    }
    return res;
  }

  @Test
  public void testLogFileReplaced() {
    Logger logger = Logging.setupLogging("target/LoggingTest.1.p4ir.log",
                                         false);
    Logging.setupLogging("target/LoggingTest.2.p4ir.log", true);
    List<FileAppender> appenders = fileAppenders(logger);
    assertEquals(1, appenders.size());
    assertEquals("target/LoggingTest.2.p4ir.log", appenders.get(0).getFile());
  }

  @Test
  public void testEmptyFileKeepsAppender() {
    Logger logger = Logging.setupLogging("target/LoggingTest.3.p4ir.log",
                                         true);
    FileAppender before = fileAppenders(logger).get(0);
    Logging.setupLogging("", true);
    List<FileAppender> after = fileAppenders(logger);
    assertEquals(1, after.size());
    assertSame(before, after.get(0));
  }
}
