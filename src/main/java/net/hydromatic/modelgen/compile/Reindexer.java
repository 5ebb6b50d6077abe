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

import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.ast.Shuttle;

/**
 * Shuttle that replaces free indices of an expression.
 *
 * <p>Indices bound by a reduction are not replaced inside that reduction.
 * If a replacement index is bound by a reduction, the reduction's index is
 * renamed to a fresh alias so that it does not capture the replacement.
 */
public class Reindexer extends Shuttle {
  private final AliasGenerator aliases;
  private final ImmutableMap<Ast.SetIndex, Ast.IndexRef> map;

  private Reindexer(AliasGenerator aliases,
      Map<Ast.SetIndex, Ast.IndexRef> map) {
    this.aliases = aliases;
    this.map = ImmutableMap.copyOf(map);
  }

  /** Replaces the free indices of an expression. All occurrences of each
   * key of {@code map} are replaced at the same time. */
  public static Ast.Exp reindex(AliasGenerator aliases, Ast.Exp exp,
      Map<Ast.SetIndex, Ast.IndexRef> map) {
    final Map<Ast.SetIndex, Ast.IndexRef> map2 = new LinkedHashMap<>();
    map.forEach((index, index2) -> {
      if (!index.equals(index2)) {
        map2.put(index, index2);
      }
    });
    if (map2.isEmpty()) {
      return exp;
    }
    return exp.accept(new Reindexer(aliases, map2));
  }

  @Override protected Ast.IndexRef visit(Ast.SetIndex setIndex) {
    final Ast.IndexRef index = map.get(setIndex);
    return index == null ? setIndex : index;
  }

  @Override protected Ast.Exp visit(Ast.Operation operation) {
    final Map<Ast.SetIndex, Ast.IndexRef> map2 = new LinkedHashMap<>(map);
    operation.indices.forEach(map2::remove);
    if (map2.isEmpty()) {
      return operation;
    }

    final Set<Ast.IndexRef> targets = new HashSet<>(map2.values());
    final Set<Ast.SetIndex> used = new HashSet<>(operation.indices);
    used.addAll(operation.controlledDomain());
    used.addAll(operation.domain());
    for (Ast.SetIndex index : operation.indices) {
      if (targets.contains(index)) {
        Ast.SetIndex fresh = index;
        while (targets.contains(fresh) || used.contains(fresh)) {
          fresh = aliases.nextIndex(fresh);
        }
        used.add(fresh);
        map2.put(index, fresh);
      }
    }

    // Each position of the body gets its new index; a position that the
    // operation reduces over gets the operation's index back, renamed if
    // it would capture.
    final List<Ast.SetIndex> bodyDomain = operation.body.domain();
    final Map<Ast.SetIndex, Ast.IndexRef> bodyMap = new LinkedHashMap<>();
    for (int i = 0; i < bodyDomain.size(); i++) {
      final Integer r = operation.reductionPositions.get(i);
      final Ast.IndexRef index =
          map2.get(r == null ? bodyDomain.get(i) : operation.indices.get(r));
      if (index != null) {
        bodyMap.put(bodyDomain.get(i), index);
      }
    }
    final Reindexer reindexer = new Reindexer(aliases, map2);
    return operation.copy(reindexer.visitList(operation.reductionDomain),
        reindex(aliases, operation.body, bodyMap));
  }
}

// End Reindexer.java
