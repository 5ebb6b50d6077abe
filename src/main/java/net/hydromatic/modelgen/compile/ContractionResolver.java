/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.modelgen.compile;

import static java.lang.String.format;
import static net.hydromatic.modelgen.util.Static.fromEnd;
import static net.hydromatic.modelgen.util.Static.last;
import static net.hydromatic.modelgen.util.Static.skipLast;
import static net.hydromatic.modelgen.util.Static.union;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.ast.Domains;

/**
 * Chooses the indices of a contraction between two expressions.
 *
 * <p>The shape of the contraction depends on the number of free indices of
 * each operand, as for matrix multiplication in NumPy: two vectors give a
 * dot product, two matrices a matrix product, and operands with more than
 * two indices are batches of matrices.
 *
 * <p>The indices returned are distinct from each other and from every index
 * that is bound by a reduction inside either operand. Where an operand's own
 * index would clash, an alias of it is used instead.
 */
public class ContractionResolver {
  private final AliasGenerator aliases;

  /** Creates a ContractionResolver. */
  public ContractionResolver(AliasGenerator aliases) {
    this.aliases = aliases;
  }

  /**
   * Chooses the indices of the contraction of two expressions.
   *
   * @throws ValidationException if either operand is a scalar, or the
   *   dimensions to be contracted are not over the same set
   */
  public Contraction resolve(Ast.Exp left, Ast.Exp right) {
    final List<Ast.SetIndex> l = left.domain();
    final List<Ast.SetIndex> r = right.domain();
    if (l.isEmpty()) {
      throw new ValidationException("Matrix multiplication requires at least "
          + "1 domain, left side is a scalar");
    }
    if (r.isEmpty()) {
      throw new ValidationException("Matrix multiplication requires at least "
          + "1 domain, right side is a scalar");
    }
    final List<Ast.SetIndex> controlled =
        union(left.controlledDomain(), right.controlledDomain());

    final Contraction contraction;
    if (l.size() == 1 && r.size() == 1) {
      contraction = dot(l, r, controlled);
    } else if (l.size() == 1 && r.size() == 2) {
      contraction = vectorMatrix(l, r, controlled);
    } else if (l.size() == 2 && r.size() == 1) {
      contraction = matrixVector(l, r, controlled);
    } else if (l.size() == 1) {
      contraction = vectorBatch(l, r, controlled);
    } else if (r.size() == 1) {
      contraction = batchVector(l, r, controlled);
    } else {
      contraction = batch(l, r, controlled);
    }
    aliases.tracer.onContraction(contraction);
    return contraction;
  }

  /** Returns the first of an index and its successive aliases that is not
   * taken. */
  private Ast.SetIndex advance(Ast.SetIndex index,
      Predicate<Ast.SetIndex> taken) {
    while (taken.test(index)) {
      index = aliases.nextIndex(index);
    }
    return index;
  }

  private static void checkSameBase(List<Ast.SetIndex> l,
      List<Ast.SetIndex> r, Ast.SetIndex li, Ast.SetIndex ri) {
    if (!li.sameBase(ri)) {
      throw new ValidationException(
          format("Matrix multiplication dimensions do not match: "
                  + "left %s, right %s; cannot contract '%s' with '%s'",
              Domains.describe(l), Domains.describe(r), li, ri));
    }
  }

  /** Vector times vector, "(i) @ (i)". */
  private Contraction dot(List<Ast.SetIndex> l, List<Ast.SetIndex> r,
      List<Ast.SetIndex> controlled) {
    if (!l.get(0).sameBase(r.get(0))) {
      throw new ValidationException(
          format("Dot product requires same domain, but got '%s' and '%s'",
              l.get(0), r.get(0)));
    }
    final Ast.SetIndex sum = advance(l.get(0), controlled::contains);
    return new Contraction(ImmutableList.of(sum), ImmutableList.of(sum), sum);
  }

  /** Vector times matrix, "(k) @ (k,j)". */
  private Contraction vectorMatrix(List<Ast.SetIndex> l,
      List<Ast.SetIndex> r, List<Ast.SetIndex> controlled) {
    checkSameBase(l, r, l.get(0), r.get(0));
    final Ast.SetIndex ro = advance(r.get(1), controlled::contains);
    final Ast.SetIndex sum =
        advance(r.get(0), i -> i.equals(ro) || controlled.contains(i));
    return new Contraction(ImmutableList.of(sum), ImmutableList.of(sum, ro),
        sum);
  }

  /** Matrix times vector, "(i,k) @ (k)". */
  private Contraction matrixVector(List<Ast.SetIndex> l,
      List<Ast.SetIndex> r, List<Ast.SetIndex> controlled) {
    checkSameBase(l, r, l.get(1), r.get(0));
    final Ast.SetIndex lo = advance(l.get(0), controlled::contains);
    final Ast.SetIndex sum =
        advance(l.get(1), i -> i.equals(lo) || controlled.contains(i));
    return new Contraction(ImmutableList.of(lo, sum), ImmutableList.of(sum),
        sum);
  }

  /** Vector times batch of matrices, "(k) @ (b,k,j)"; the batch indices
   * pass through. */
  private Contraction vectorBatch(List<Ast.SetIndex> l,
      List<Ast.SetIndex> r, List<Ast.SetIndex> controlled) {
    checkSameBase(l, r, l.get(0), fromEnd(r, 2));
    final List<Ast.SetIndex> batch = skipLast(r, 2);
    final Ast.SetIndex ro = last(r);
    final Ast.SetIndex sum =
        advance(l.get(0), i ->
            batch.contains(i) || i.equals(ro) || controlled.contains(i));
    return new Contraction(ImmutableList.of(sum),
        ImmutableList.<Ast.SetIndex>builder()
            .addAll(batch).add(sum).add(ro).build(),
        sum);
  }

  /** Batch of matrices times vector, "(b,i,k) @ (k)"; the batch indices
   * pass through. */
  private Contraction batchVector(List<Ast.SetIndex> l,
      List<Ast.SetIndex> r, List<Ast.SetIndex> controlled) {
    checkSameBase(l, r, last(l), r.get(0));
    final List<Ast.SetIndex> rest = skipLast(l, 1);
    final Ast.SetIndex sum =
        advance(last(l), i -> rest.contains(i) || controlled.contains(i));
    return new Contraction(
        ImmutableList.<Ast.SetIndex>builder().addAll(rest).add(sum).build(),
        ImmutableList.of(sum), sum);
  }

  /** Matrix times matrix, "(i,k) @ (k,j)", or batch of matrices times batch
   * of matrices, "(b,i,k) @ (b,k,j)". If both operands have batch indices,
   * they must be the same. */
  private Contraction batch(List<Ast.SetIndex> l, List<Ast.SetIndex> r,
      List<Ast.SetIndex> controlled) {
    checkSameBase(l, r, last(l), fromEnd(r, 2));
    final List<Ast.SetIndex> leftBatch = skipLast(l, 2);
    final List<Ast.SetIndex> rightBatch = skipLast(r, 2);
    if (!leftBatch.isEmpty()
        && !rightBatch.isEmpty()
        && !leftBatch.equals(rightBatch)) {
      throw new ValidationException(
          format("Batch dimensions do not match: left %s, right %s",
              Domains.describe(leftBatch), Domains.describe(rightBatch)));
    }
    final Ast.SetIndex ro0 = last(r);
    final Ast.SetIndex lo =
        advance(fromEnd(l, 2), i ->
            i.equals(ro0) || rightBatch.contains(i) || controlled.contains(i));
    final Ast.SetIndex ro =
        advance(ro0, i ->
            i.equals(lo) || leftBatch.contains(i) || controlled.contains(i));
    final Ast.SetIndex sum =
        advance(last(l), i ->
            leftBatch.contains(i)
                || rightBatch.contains(i)
                || i.equals(lo)
                || i.equals(ro)
                || controlled.contains(i));
    return new Contraction(
        ImmutableList.<Ast.SetIndex>builder()
            .addAll(leftBatch).add(lo).add(sum).build(),
        ImmutableList.<Ast.SetIndex>builder()
            .addAll(rightBatch).add(sum).add(ro).build(),
        sum);
  }
}

// End ContractionResolver.java
