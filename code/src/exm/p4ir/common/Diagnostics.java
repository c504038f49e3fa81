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
package exm.p4ir.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.p4ir.ir.SourceInfo;

/**
 * Sink for errors and warnings about the user's program.  Diagnostics are
 * recorded in the order they are reported so that a single run can show
 * the user every problem found, rather than stopping at the first one.
 */
public class Diagnostics {

  public static enum Kind {
    ERROR,
    WARNING,
    ;

    public String humanReadable() {
      return name().toLowerCase();
    }
  }

  public static class Diagnostic {
    public final Kind kind;
    public final SourceInfo srcInfo;
    public final String message;

    public Diagnostic(Kind kind, SourceInfo srcInfo, String message) {
      this.kind = kind;
      this.srcInfo = srcInfo == null ? SourceInfo.INVALID : srcInfo;
      this.message = message;
    }

    @Override
    public String toString() {
      if (srcInfo.isValid()) {
        return srcInfo + ": " + kind.humanReadable() + ": " + message;
      } else {
        return kind.humanReadable() + ": " + message;
      }
    }
  }

  private final Logger logger;
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private int errorCount = 0;
  private int warningCount = 0;

  public Diagnostics() {
    this(Logging.getIRLogger());
  }

  public Diagnostics(Logger logger) {
    this.logger = logger;
  }

  public void error(SourceInfo srcInfo, String message) {
    report(new Diagnostic(Kind.ERROR, srcInfo, message));
  }

  public void warning(SourceInfo srcInfo, String message) {
    report(new Diagnostic(Kind.WARNING, srcInfo, message));
  }

  public void report(Diagnostic diag) {
    diagnostics.add(diag);
    if (diag.kind == Kind.ERROR) {
      errorCount++;
      logger.error(diag.toString());
    } else {
      warningCount++;
      logger.warn(diag.toString());
    }
  }

  public int getErrorCount() {
    return errorCount;
  }

  public int getWarningCount() {
    return warningCount;
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  @Override
  public String toString() {
    return errorCount + " errors, " + warningCount + " warnings";
  }
}
