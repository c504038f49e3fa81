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
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Predicate;

import exm.p4ir.common.Settings;
import exm.p4ir.common.exceptions.IRInvariantError;
import exm.p4ir.ir.Expressions.Expression;
import exm.p4ir.visitor.Visitor;

/**
 * Ordered collection of annotations.  Order matters when printing, not
 * when looking annotations up.
 *
 * All the add/replace/filter operations are copy-on-write and return a
 * new collection, or the receiver itself if nothing would change.  The
 * only in-place operations are addInPlace and addAnnotationInPlace,
 * which are for building the collection up before it is attached to a
 * node; attaching freezes it.
 */
public class Annotations extends Node {

  /** Shared empty collection */
  public static final Annotations EMPTY = new Annotations().freeze();

  private ArrayList<Annotation> annotations;
  private boolean frozen = false;

  public Annotations() {
    this(SourceInfo.INVALID, Collections.<Annotation>emptyList());
  }

  public Annotations(List<Annotation> annotations) {
    this(SourceInfo.INVALID, annotations);
  }

  public Annotations(SourceInfo srcInfo, List<Annotation> annotations) {
    super(srcInfo);
    this.annotations = new ArrayList<Annotation>(annotations);
    for (Annotation a: this.annotations) {
      if (a != null) {
        this.srcInfo = this.srcInfo.merge(a.getSourceInfo());
      }
    }
    validate();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ANNOTATIONS;
  }

  /**
   * Called when attached to a node; afterwards the collection may be
   * shared and can only be changed by copying.
   * @return this
   */
  public Annotations freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public List<Annotation> getAnnotations() {
    return Collections.unmodifiableList(annotations);
  }

  public int size() {
    return annotations.size();
  }

  public boolean isEmpty() {
    return annotations.isEmpty();
  }

  /**
   * @return the single annotation with name, or null.  If there are several
   *        the first is returned.
   */
  public Annotation getSingle(String name) {
    for (Annotation a: annotations) {
      if (a.getName().name.equals(name)) {
        return a;
      }
    }
    return null;
  }

  public List<Annotation> getAll(String name) {
    List<Annotation> res = new ArrayList<Annotation>();
    for (Annotation a: annotations) {
      if (a.getName().name.equals(name)) {
        res.add(a);
      }
    }
    return res;
  }

  public Annotations add(Annotation annot) {
    Annotations copy = clone();
    copy.append(annot);
    copy.validate();
    return copy;
  }

  public Annotations addAnnotation(String name, Expression expr) {
    return add(new Annotation(new ID(name), Annotation.single(expr)));
  }

  /**
   * @return receiver, unchanged, if an annotation with name exists,
   *         otherwise same as addAnnotation
   */
  public Annotations addAnnotationIfNew(String name, Expression expr) {
    if (getSingle(name) != null) {
      return this;
    }
    return addAnnotation(name, expr);
  }

  /**
   * Drop all annotations with name then append a new one.  Always copies.
   */
  public Annotations addOrReplace(String name, Expression expr) {
    Annotations copy = clone();
    for (int i = copy.annotations.size() - 1; i >= 0; i--) {
      if (copy.annotations.get(i).getName().name.equals(name)) {
        copy.annotations.remove(i);
      }
    }
    copy.recomputeSpan();
    copy.append(new Annotation(new ID(name), Annotation.single(expr)));
    copy.validate();
    return copy;
  }

  /**
   * @param pred annotations to keep
   * @return receiver if all are kept, otherwise a copy with the kept ones
   *         in their original order
   */
  public Annotations where(Predicate<Annotation> pred) {
    ArrayList<Annotation> kept = new ArrayList<Annotation>(annotations.size());
    for (Annotation a: annotations) {
      if (pred.apply(a)) {
        kept.add(a);
      }
    }
    if (kept.size() == annotations.size()) {
      return this;
    }
    Annotations copy = clone();
    copy.annotations = kept;
    copy.recomputeSpan();
    copy.validate();
    return copy;
  }

  public Annotations addInPlace(Annotation annot) {
    if (frozen) {
      throw new IRInvariantError("In-place change to annotations " +
                                 "already attached to a node");
    }
    append(annot);
    validate();
    return this;
  }

  public Annotations addAnnotationInPlace(String name, Expression expr) {
    return addInPlace(new Annotation(new ID(name), Annotation.single(expr)));
  }

  private void append(Annotation annot) {
    if (annot == null) {
      throw new IRInvariantError("Adding null annotation");
    }
    srcInfo = srcInfo.merge(annot.getSourceInfo());
    annotations.add(annot);
  }

  /**
   * Span covers the annotations that are left, after some were dropped
   */
  private void recomputeSpan() {
    srcInfo = SourceInfo.INVALID;
    for (Annotation a: annotations) {
      if (a != null) {
        srcInfo = srcInfo.merge(a.getSourceInfo());
      }
    }
  }

  @Override
  public void validate() {
    int names = 0;
    for (Annotation a: annotations) {
      if (a == null) {
        throw new IRInvariantError("Null entry in annotations at " + srcInfo);
      }
      if (a.getName().name.equals(Annotation.NAME)) {
        names++;
      }
    }
    if (names > 1 &&
        Settings.getBooleanInternal(Settings.UNIQUE_NAME_ANNOTATION)) {
      throw new IRInvariantError(names + " @" + Annotation.NAME +
          " annotations at " + srcInfo + ", at most one allowed");
    }
  }

  @Override
  public Node visitChildren(Visitor v) {
    List<Annotation> newAnnos = v.visitList(annotations, Annotation.class,
                                            "annotations");
    if (newAnnos == annotations) {
      return this;
    }
    Annotations copy = clone();
    copy.annotations = new ArrayList<Annotation>(newAnnos);
    copy.recomputeSpan();
    copy.validate();
    return copy;
  }

  /**
   * Copies are unfrozen and own their list
   */
  @Override
  public Annotations clone() {
    Annotations copy = (Annotations) super.clone();
    copy.annotations = new ArrayList<Annotation>(annotations);
    copy.frozen = false;
    return copy;
  }

  @Override
  public String toString() {
    return StringUtils.join(annotations, " ");
  }

  @Override
  public String dbprint() {
    List<String> parts = new ArrayList<String>(annotations.size());
    for (Annotation a: annotations) {
      parts.add(a.dbprint());
    }
    return kind().typeName() + " [" + StringUtils.join(parts, ", ") + "]";
  }
}
