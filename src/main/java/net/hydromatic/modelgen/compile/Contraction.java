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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.ast.Domains;

/** Indices chosen for a contraction, such as a matrix product.
 *
 * <p>The left operand is to be indexed by {@link #leftIndices}, the right
 * operand by {@link #rightIndices}, and the product summed over
 * {@link #index}, which occurs in both. */
public class Contraction {
  public final ImmutableList<Ast.SetIndex> leftIndices;
  public final ImmutableList<Ast.SetIndex> rightIndices;
  public final Ast.SetIndex index;

  Contraction(List<Ast.SetIndex> leftIndices,
      List<Ast.SetIndex> rightIndices, Ast.SetIndex index) {
    this.leftIndices = ImmutableList.copyOf(leftIndices);
    this.rightIndices = ImmutableList.copyOf(rightIndices);
    this.index = requireNonNull(index);
  }

  /** Returns the indices of the left operand that are not summed over. */
  public List<Ast.SetIndex> leftFree() {
    return free(leftIndices);
  }

  /** Returns the indices of the right operand that are not summed over. */
  public List<Ast.SetIndex> rightFree() {
    return free(rightIndices);
  }

  private List<Ast.SetIndex> free(List<Ast.SetIndex> indices) {
    final ImmutableList.Builder<Ast.SetIndex> b = ImmutableList.builder();
    for (Ast.SetIndex i : indices) {
      if (!i.equals(index)) {
        b.add(i);
      }
    }
    return b.build();
  }

  @Override public String toString() {
    return "Contraction{left=" + Domains.describe(leftIndices)
        + ", right=" + Domains.describe(rightIndices)
        + ", index=" + index + "}";
  }
}

// End Contraction.java
