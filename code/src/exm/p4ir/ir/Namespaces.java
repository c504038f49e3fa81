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
package exm.p4ir.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Predicate;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;

import exm.p4ir.common.Diagnostics;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Capabilities.Declared;
import exm.p4ir.ir.Capabilities.Functional;
import exm.p4ir.ir.Capabilities.GeneralNamespace;
import exm.p4ir.ir.Capabilities.Namespace;
import exm.p4ir.ir.Capabilities.NestedNamespace;
import exm.p4ir.ir.Capabilities.SimpleNamespace;
import exm.p4ir.ir.Declarations.Parameter;

/**
 * Name resolution helpers shared by the namespace node kinds.
 *
 * A strict namespace refuses duplicate names outright: that can only
 * happen through a bug in whoever built the tree.  A general namespace
 * admits several declarations with one name, and duplicates there are
 * the user's fault, so they are reported as diagnostics.
 */
public class Namespaces {

  /**
   * Build the name index of a strict namespace.  "_" declares nothing.
   * @param decls
   * @param owner node being validated, for the error message
   * @return map from internal name to declaration, in declaration order
   * @throws IRInvariantError if two declarations share a name
   */
  public static Map<String, Declared> buildIndex(
                  Iterable<? extends Declared> decls, Node owner) {
    Map<String, Declared> index = new LinkedHashMap<String, Declared>();
    for (Declared d: decls) {
      if (d == null) {
        throw new IRInvariantError("Null declaration in " +
                                   owner.kind().typeName());
      }
      ID name = d.getName();
      if (name.isDontCare()) {
        continue;
      }
      Declared prev = index.put(name.name, d);
      if (prev != null) {
        throw new IRInvariantError("Duplicate declaration of " + name +
            " in " + owner.kind().typeName() + " at " +
            d.getNode().getSourceInfo() + ", previous at " +
            prev.getNode().getSourceInfo());
      }
    }
    return index;
  }

  /**
   * @return lazy view of the declarations called name
   */
  public static Iterable<Declared> declsByName(
          Iterable<? extends Declared> decls, final String name) {
    // Read-only view, so widening the element type is safe
    @SuppressWarnings("unchecked")
    Iterable<Declared> all = (Iterable<Declared>) decls;
    return Iterables.filter(all, new Predicate<Declared>() {
          @Override
          public boolean apply(Declared d) {
            return d.getName().name.equals(name);
          }
        });
  }

  /**
   * Identity of a declaration for duplicate checking.  Declarations
   * taking parameters may be overloaded, so their parameter types are part
   * of it.
   */
  public static String signature(Declared decl) {
    if (decl instanceof Functional) {
      List<String> paramTypes = new ArrayList<String>();
      for (Parameter p: ((Functional) decl).getParameters().getParameters()) {
        paramTypes.add(p.getType().toString());
      }
      return decl.getName().name + "(" + StringUtils.join(paramTypes, ", ")
             + ")";
    }
    return decl.getName().name;
  }

  /**
   * Report each declaration whose signature repeats an earlier one in
   * the namespace.  Each duplicate gets exactly one error.
   * @return number of duplicates found
   */
  public static int checkDuplicateDeclarations(GeneralNamespace ns,
                                               Diagnostics diags) {
    ListMultimap<String, Declared> bySig = ArrayListMultimap.create();
    int duplicates = 0;
    for (Declared d: ns.getDeclarations()) {
      if (d.getName().isDontCare()) {
        continue;
      }
      String sig = signature(d);
      List<Declared> prev = bySig.get(sig);
      if (!prev.isEmpty()) {
        diags.error(d.getNode().getSourceInfo(), "Duplicate declaration of "
            + d.getName() + ": previous declaration at " +
            prev.get(0).getNode().getSourceInfo());
        duplicates++;
      }
      bySig.put(sig, d);
    }
    return duplicates;
  }

  /**
   * Find declarations of name directly in ns, then in its nested
   * namespaces in order.
   * @return matches, empty if none
   */
  public static List<Declared> lookupLocal(Namespace ns, String name) {
    List<Declared> res = new ArrayList<Declared>();
    if (ns instanceof SimpleNamespace) {
      Declared d = ((SimpleNamespace) ns).getDeclByName(name);
      if (d != null) {
        res.add(d);
      }
    } else if (ns instanceof GeneralNamespace) {
      Iterables.addAll(res, ((GeneralNamespace) ns).getDeclsByName(name));
    } else {
      Iterables.addAll(res, declsByName(ns.getDeclarations(), name));
    }

    if (res.isEmpty() && ns instanceof NestedNamespace) {
      for (Namespace nested: ((NestedNamespace) ns).getNestedNamespaces()) {
        res.addAll(lookupLocal(nested, name));
        if (!res.isEmpty()) {
          break;
        }
      }
    }
    return res;
  }

  /**
   * Resolve name through a stack of scopes.
   * @param scopes innermost first
   * @return first declaration found, or null if none
   */
  public static Declared lookup(List<? extends Namespace> scopes,
                                String name) {
    for (Namespace ns: scopes) {
      List<Declared> found = lookupLocal(ns, name);
      if (!found.isEmpty()) {
        return found.get(0);
      }
    }
    return null;
  }
}
