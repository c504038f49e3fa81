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

import com.google.common.base.Predicate;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.ir.Annotation;
import exm.p4ir.ir.Annotations;
import exm.p4ir.ir.Node;
import exm.p4ir.visitor.Transform;

/**
 * Drop the annotations that don't satisfy a predicate, everywhere in a
 * tree.  Nodes without any dropped annotation are kept as they are.
 */
public class FilterAnnotations extends Transform implements Pass {

  private final Predicate<Annotation> keep;
  private int changed = 0;

  public FilterAnnotations(Predicate<Annotation> keep) {
    this.keep = keep;
  }

  /**
   * @return a filter that removes every annotation called name
   */
  public static FilterAnnotations removing(final String name) {
    return new FilterAnnotations(new Predicate<Annotation>() {
      @Override
      public boolean apply(Annotation a) {
        return !a.getName().name.equals(name);
      }
    });
  }

  @Override
  public String getPassName() {
    return "Filter annotations";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public Node apply(Logger logger, Node root, Diagnostics diags) {
    Node result = apply(root);
    logger.debug(getPassName() + ": filtered " + changed +
                 " annotation lists");
    return result;
  }

  @Override
  protected void init(Node root) {
    changed = 0;
  }

  @Override
  public Node preorder(Annotations annotations) {
    // Annotation arguments are left alone
    prune();
    return annotations;
  }

  @Override
  public Node postorder(Annotations annotations) {
    Annotations result = annotations.where(keep);
    if (result != annotations) {
      changed++;
    }
    return result;
  }
}
