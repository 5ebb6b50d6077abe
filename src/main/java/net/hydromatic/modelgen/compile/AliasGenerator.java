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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.IndexSet;
import net.hydromatic.modelgen.symbol.SetRef;
import net.hydromatic.modelgen.symbol.Symbol;
import net.hydromatic.modelgen.symbol.SymbolTable;

/**
 * Generates aliases of sets, and the dense sets that stand for the
 * dimensions of a matrix.
 *
 * <p>Names are derived from the set being aliased: the first alias of
 * {@code i} is {@code AliasOfi_2}, the alias of {@code AliasOfi_2} is
 * {@code AliasOfi_3}, and so on. If the alias already exists in the symbol
 * table it is reused, so the same request always returns the same alias,
 * and building the same trees against a fresh table gives the same names.
 */
public class AliasGenerator {
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final SymbolTable symbolTable;
  private final Map<Prop, Object> map;
  public final Tracer tracer;

  /** Creates an AliasGenerator. */
  public AliasGenerator(SymbolTable symbolTable, Map<Prop, Object> map,
      Tracer tracer) {
    this.symbolTable = symbolTable;
    this.map = ImmutableMap.copyOf(map);
    this.tracer = tracer;
  }

  /** Creates an AliasGenerator with default properties and no tracing. */
  public AliasGenerator(SymbolTable symbolTable) {
    this(symbolTable, ImmutableMap.of(), Tracers.empty());
  }

  /** Returns the name of the next alias after a given set or alias. */
  public String nextName(String name) {
    final String aliasPrefix = Prop.ALIAS_PREFIX.stringValue(map);
    final String densePrefix = Prop.DENSE_PREFIX.stringValue(map);
    if (name.startsWith(aliasPrefix) || name.startsWith(densePrefix)) {
      final int underscore = name.lastIndexOf('_');
      if (underscore > 0) {
        final String suffix = name.substring(underscore + 1);
        if (!suffix.isEmpty() && DIGITS.matchesAllOf(suffix)) {
          return name.substring(0, underscore) + "_"
              + (Integer.parseInt(suffix) + 1);
        }
      }
    }
    return aliasPrefix + name + "_2";
  }

  /**
   * Returns the next alias of a set or alias, creating it if it does not
   * exist.
   *
   * @throws ValidationException if the name of the alias is already used
   *   by a symbol that ranges over a different set
   */
  public synchronized SetRef nextAlias(SetRef set) {
    final String name = nextName(set.name);
    final Symbol existing = symbolTable.lookupOpt(name);
    if (existing != null) {
      if (!(existing instanceof SetRef)
          || !((SetRef) existing).sameBase(set)) {
        throw new ValidationException(
            format("cannot create alias '%s' of '%s': name is already used",
                name, set.name));
      }
      return (SetRef) existing;
    }
    final Alias alias = symbolTable.alias(name, set);
    tracer.onAlias(alias, set);
    return alias;
  }

  /** Returns an index over the next alias of an index's set. */
  public Ast.SetIndex nextIndex(Ast.SetIndex index) {
    return alg.index(nextAlias(index.set));
  }

  /** Returns the dense set of a given size, such as {@code DenseDim3_1}
   * with elements "0", "1", "2", creating it if it does not exist. */
  public synchronized IndexSet denseSet(int size) {
    if (size < 0) {
      throw new ValidationException(
          format("Dimension must not be negative, but was %d", size));
    }
    final String name = Prop.DENSE_PREFIX.stringValue(map) + size + "_1";
    final Symbol existing = symbolTable.lookupOpt(name);
    if (existing != null) {
      if (!(existing instanceof IndexSet)) {
        throw new ValidationException(
            format("cannot create dense set '%s': name is already used",
                name));
      }
      return (IndexSet) existing;
    }
    final List<String> records = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      records.add(Integer.toString(i));
    }
    return symbolTable.set(name, ImmutableList.of(), records);
  }
}

// End AliasGenerator.java
