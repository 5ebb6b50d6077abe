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
package net.hydromatic.modelgen.ast;

import static java.lang.String.format;
import static net.hydromatic.modelgen.ast.AstBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.modelgen.compile.DomainException;
import net.hydromatic.modelgen.symbol.SetRef;

/** Utilities for lists of indices. */
public abstract class Domains {
  private Domains() {}

  /**
   * Flattens domain items into the indices they bind.
   *
   * <p>An index contributes itself; a tuple {@code (i,j)} contributes each of
   * its indices; a reference to a set {@code tt(t)} contributes its domain,
   * or the set itself if it is over the universe; a condition contributes
   * the indices of the item it filters.
   *
   * @throws DomainException if the result is empty, or an item cannot be
   *   used as an index
   */
  public static ImmutableList<Ast.SetIndex> toIndexList(
      List<? extends Ast.Exp> items) {
    final ImmutableList.Builder<Ast.SetIndex> b = ImmutableList.builder();
    for (Ast.Exp item : items) {
      addIndices(b, item);
    }
    final ImmutableList<Ast.SetIndex> list = b.build();
    if (list.isEmpty()) {
      throw new DomainException(
          format("domain %s has no indices", items));
    }
    return list;
  }

  private static void addIndices(ImmutableList.Builder<Ast.SetIndex> b,
      Ast.Exp item) {
    switch (item.op) {
      case SET_INDEX:
        b.add((Ast.SetIndex) item);
        return;
      case DOMAIN:
        b.addAll(((Ast.DomainTuple) item).indices);
        return;
      case ID:
        final Ast.SymbolRef ref = (Ast.SymbolRef) item;
        if (!ref.symbol.kind.isSetLike()) {
          throw new DomainException(
              format("'%s' is not a set, so cannot be used as an index",
                  ref.symbol.name));
        }
        if (ref.domain().isEmpty()) {
          b.add(alg.index((SetRef) ref.symbol));
        } else {
          b.addAll(ref.domain());
        }
        return;
      case CONDITION:
        addIndices(b, ((Ast.Binary) item).left());
        return;
      default:
        throw new DomainException(
            format("'%s' cannot be used as an index", item));
    }
  }

  /** Returns whether two indices range over the same base set. */
  public static boolean sameBase(Ast.SetIndex index0, Ast.SetIndex index1) {
    return index0.sameBase(index1);
  }

  /** Renders a list of indices: "i" if there is one, "(i,j)" if there are
   * several. */
  public static String describe(List<Ast.SetIndex> indices) {
    if (indices.size() == 1) {
      return indices.get(0).toString();
    }
    return new GamsWriter().list("(", indices, ")").toString();
  }
}

// End Domains.java
