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

import org.apache.commons.lang3.StringUtils;

import exm.p4ir.ir.Node;
import exm.p4ir.visitor.Inspector;

/**
 * Renders a tree as one dbprint() line per node, indented by depth.
 * Shared subtrees are printed at each place they occur.
 */
public class DumpTree extends Inspector {
  private static final int INDENT = 2;

  private final StringBuilder sb = new StringBuilder();

  public static String dump(Node root) {
    DumpTree dumper = new DumpTree();
    dumper.apply(root);
    return dumper.sb.toString();
  }

  @Override
  protected boolean visitDagOnce() {
    return false;
  }

  @Override
  public boolean preorder(Node node) {
    sb.append(StringUtils.repeat(' ', getDepth() * INDENT));
    sb.append(node.dbprint());
    sb.append('\n');
    return true;
  }
}
