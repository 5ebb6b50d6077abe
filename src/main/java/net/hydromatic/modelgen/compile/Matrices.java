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
import static net.hydromatic.modelgen.ast.AstBuilder.alg;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.symbol.SetRef;

/** Matrix and tensor operations, expressed as reductions over indices. */
public abstract class Matrices {
  private Matrices() {}

  /**
   * Multiplies two expressions as matrices; returns
   * {@code sum(k, left(..,k) * right(k,..))}.
   *
   * @see ContractionResolver#resolve
   */
  public static Ast.Operation matmul(AliasGenerator aliases, Ast.Exp left,
      Ast.Exp right) {
    final Contraction c = new ContractionResolver(aliases).resolve(left, right);
    return alg.sum(c.index,
        alg.times(left.reindex(aliases, c.leftIndices),
            right.reindex(aliases, c.rightIndices)));
  }

  /**
   * Returns a set for each of the given sizes. A set of size {@code n} is
   * {@code DenseDim<n>_1}; if a size occurs more than once, later
   * occurrences are aliases, so that {@code dim(3, 3)} gives
   * {@code [DenseDim3_1, DenseDim3_2]}.
   */
  public static List<SetRef> dim(AliasGenerator aliases, int... sizes) {
    final List<SetRef> sets = new ArrayList<>();
    for (int size : sizes) {
      SetRef set = aliases.denseSet(size);
      while (sets.contains(set)) {
        set = aliases.nextAlias(set);
      }
      sets.add(set);
    }
    return ImmutableList.copyOf(sets);
  }

  /**
   * Returns the trace of an expression over two of its dimensions; for a
   * matrix {@code x(i,j)}, returns {@code sum(j, x(j,j))}.
   *
   * @throws ValidationException if the expression has fewer than 2
   *   dimensions, or the two dimensions are not over the same set
   */
  public static Ast.Operation trace(AliasGenerator aliases, Ast.Exp x,
      int axis1, int axis2) {
    final List<Ast.SetIndex> domain = x.domain();
    if (domain.size() < 2) {
      throw new ValidationException("Trace requires at least 2 dimensions");
    }
    checkAxis(domain, axis1);
    checkAxis(domain, axis2);
    if (axis1 == axis2) {
      throw new ValidationException("Trace requires two different axes");
    }
    if (!domain.get(axis1).sameBase(domain.get(axis2))) {
      throw new ValidationException(
          format("Matrix dimensions are not equal: '%s' and '%s'",
              domain.get(axis1), domain.get(axis2)));
    }
    final List<Ast.SetIndex> controlled = x.controlledDomain();
    Ast.SetIndex index = domain.get(axis2);
    while (controlled.contains(index)) {
      index = aliases.nextIndex(index);
    }
    final List<Ast.SetIndex> indices = new ArrayList<>(domain);
    indices.set(axis1, index);
    indices.set(axis2, index);
    return alg.sum(index, x.reindex(aliases, indices));
  }

  private static void checkAxis(List<Ast.SetIndex> domain, int axis) {
    if (axis < 0 || axis >= domain.size()) {
      throw new ValidationException(
          format("Axis %d is out of range for %d dimensions", axis,
              domain.size()));
    }
  }

  /**
   * Permutes the dimensions of a reference; position {@code k} of the
   * result's domain is position {@code dims[k]} of the reference's domain.
   *
   * <p>The reference is written as before; only its domain changes, so
   * {@code permute(x(i,j), 1, 0)} has domain {@code [j, i]} and is
   * written {@code x(i,j)}.
   *
   * @throws ValidationException if {@code dims} is not a permutation of
   *   {@code 0 .. n-1}
   */
  public static Ast.SymbolRef permute(Ast.SymbolRef ref, int... dims) {
    final int n = ref.domain().size();
    if (dims.length == 0
        || Ints.min(dims) != 0
        || Ints.max(dims) != dims.length - 1) {
      throw new ValidationException(
          "Permute requires the order of indices from 0 to n-1");
    }
    final Set<Integer> distinct = new HashSet<>(Ints.asList(dims));
    if (distinct.size() != dims.length) {
      throw new ValidationException("Permute dimensions must be unique");
    }
    if (dims.length != n) {
      throw new ValidationException(
          format("Permute of '%s' requires %d dimensions, but got %d",
              ref.symbol.name, n, dims.length));
    }
    final List<Integer> permutation = new ArrayList<>();
    for (int dim : dims) {
      permutation.add(ref.permutation == null
          ? dim
          : ref.permutation.get(dim));
    }
    return alg.permutedRef(ref, permutation);
  }

  /**
   * Returns the norm of a vector.
   *
   * <p>The 2-norm is {@code sqrt(sum(i, sqr(x(i))))}; the 1-norm is
   * {@code sum(i, abs(x(i)))}; other norms raise each element to the power
   * {@code ord}, taking its absolute value unless {@code ord} is an even
   * integer, and raise the sum to the power {@code 1/ord}.
   *
   * @param x Vector, matrix or tensor
   * @param ord Order of the norm
   * @param dims Dimensions to sum over; if empty, all dimensions
   *
   * @throws ValidationException if {@code ord} is 0 or infinite
   */
  public static Ast.Exp vectorNorm(Ast.Exp x, double ord, int... dims) {
    if (Double.isInfinite(ord)) {
      throw new ValidationException("Infinity norms are not supported");
    }
    if (Double.isNaN(ord)) {
      throw new ValidationException("Norm order must be a number");
    }
    if (ord == 0) {
      throw new ValidationException("0 norm is not supported");
    }
    final List<Ast.SetIndex> domain = x.domain();
    final List<Ast.Exp> sumDomain = new ArrayList<>();
    if (dims.length == 0) {
      sumDomain.addAll(domain);
    } else {
      for (int dim : dims) {
        checkAxis(domain, dim);
        sumDomain.add(domain.get(dim));
      }
    }
    final boolean integer = ord == Math.rint(ord);
    if (ord == 2) {
      return alg.sqrt(alg.sum(sumDomain, alg.sqr(x)));
    } else if (integer && ord % 2 == 0) {
      return pow(alg.sum(sumDomain, pow(x, ord)), 1 / ord);
    } else if (ord == 1) {
      return alg.sum(sumDomain, alg.abs(x));
    } else {
      return pow(alg.sum(sumDomain, pow(alg.abs(x), ord)), 1 / ord);
    }
  }

  /** Raises an expression to a power: "power(x,n)" for an integer,
   * "sqrt(x)" for one half, otherwise "rPower(x,y)". */
  static Ast.Exp pow(Ast.Exp x, double y) {
    if (y == Math.rint(y)) {
      return alg.power(x, (int) y);
    }
    if (y == 0.5) {
      return alg.sqrt(x);
    }
    return alg.rPower(x, alg.number(y));
  }
}

// End Matrices.java
