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
package exm.p4ir.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.Settings;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.common.exceptions.InvalidOptionException;
import exm.p4ir.common.exceptions.UserException;
import exm.p4ir.ir.Node;

/**
 * Runs a sequence of passes, each on the tree produced by the one before.
 */
public class PassManager {

  private final List<Pass> passes = new ArrayList<Pass>();

  public PassManager addPass(Pass pass) {
    passes.add(pass);
    return this;
  }

  public List<Pass> getPasses() {
    return Collections.unmodifiableList(passes);
  }

  /**
   * @return the tree after the last pass
   * @throws UserException if stopping on errors and a pass reported any
   */
  public Node run(Logger logger, Node root, Diagnostics diags)
                                                  throws UserException {
    boolean stopOnError = Settings.getBooleanInternal(
                                          Settings.PASS_STOP_ON_ERROR);
    boolean dumpAfter = Settings.getBooleanInternal(Settings.PASS_DUMP_AFTER);

    Node current = root;
    for (Pass pass: passes) {
      if (!passEnabled(pass)) {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
        continue;
      }
      logger.debug("Pass: " + pass.getPassName());
      int errorsBefore = diags.getErrorCount();
      current = pass.apply(logger, current, diags);
      if (current == null) {
        throw new IRInvariantError("Pass " + pass.getPassName() +
                                   " removed the whole tree");
      }
      logger.debug("Pass " + pass.getPassName() + " done, " +
                   (diags.getErrorCount() - errorsBefore) + " new errors");

      if (dumpAfter && logger.isDebugEnabled()) {
        logger.debug("Tree after " + pass.getPassName() + ":\n" +
                     DumpTree.dump(current));
      }

      if (stopOnError && diags.hasErrors()) {
        throw new UserException(diags.getErrorCount() +
            " error(s) reported, stopping after pass " + pass.getPassName());
      }
    }
    return current;
  }

  public boolean passEnabled(Pass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new IRInvariantError("Expected config key " +
          pass.getConfigEnabledKey() + " to exist");
    }
  }
}
