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
import exm.p4ir.ir.Namespaces;
import exm.p4ir.ir.Node;
import exm.p4ir.ir.Capabilities.GeneralNamespace;
import exm.p4ir.visitor.Inspector;

/**
 * Report duplicate declarations in every general namespace of a tree:
 * the program's top level and extern method lists.  Strict namespaces
 * reject duplicates when they are built, so they need no check here.
 */
public class CheckDuplicateDeclarations implements Pass {

  @Override
  public String getPassName() {
    return "Check duplicate declarations";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public Node apply(Logger logger, Node root, Diagnostics diags) {
    Finder finder = new Finder(logger, diags);
    finder.apply(root);
    logger.debug("Checked " + finder.checked + " namespaces, found " +
                 finder.duplicates + " duplicates");
    return root;
  }

  private static class Finder extends Inspector {
    private final Diagnostics diags;
    private int checked = 0;
    private int duplicates = 0;

    Finder(Logger logger, Diagnostics diags) {
      super(logger);
      this.diags = diags;
    }

    @Override
    public boolean preorder(Node node) {
      if (node instanceof GeneralNamespace) {
        checked++;
        duplicates += Namespaces.checkDuplicateDeclarations(
                                    (GeneralNamespace) node, diags);
      }
      return super.preorder(node);
    }
  }
}
