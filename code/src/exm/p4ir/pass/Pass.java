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

import org.apache.log4j.Logger;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.exceptions.UserException;
import exm.p4ir.ir.Node;

public interface Pass {
  public String getPassName();

  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public String getConfigEnabledKey();

  /**
   * Run the pass over a tree.
   * @param logger
   * @param root
   * @param diags where problems with the user's program are reported
   * @return the resulting tree, root itself if the pass changed nothing
   * @throws UserException if the pass can't go on because of a user error
   */
  public Node apply(Logger logger, Node root, Diagnostics diags)
                                                    throws UserException;
}
