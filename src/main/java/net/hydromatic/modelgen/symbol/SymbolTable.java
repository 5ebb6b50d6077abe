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
package net.hydromatic.modelgen.symbol;

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import net.hydromatic.modelgen.compile.ValidationException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * In-memory {@link SymbolRegistry}.
 *
 * <p>Symbols are stored in an arena; a symbol's {@link Symbol#id} is its
 * position in the arena, so comparing identities is comparing integers.
 * Symbols are never removed.
 */
public class SymbolTable implements SymbolRegistry {
  private final List<Symbol> symbols = new ArrayList<>();
  private final Map<String, Symbol> symbolsByName = new HashMap<>();

  /** Creates an empty SymbolTable. */
  public SymbolTable() {}

  @Override public synchronized Symbol resolve(String name) {
    final Symbol symbol = symbolsByName.get(name);
    if (symbol == null) {
      throw new ValidationException(format("symbol '%s' not found", name));
    }
    return symbol;
  }

  @Override public synchronized @Nullable Symbol lookupOpt(String name) {
    return symbolsByName.get(name);
  }

  @Override public synchronized Symbol get(int id) {
    return symbols.get(id);
  }

  /** Returns all symbols, in the order they were declared. */
  public synchronized List<Symbol> symbols() {
    return ImmutableList.copyOf(symbols);
  }

  /** Declares a one-dimensional set over the universe. */
  public IndexSet set(String name, String... records) {
    return set(name, ImmutableList.of(), Arrays.asList(records));
  }

  /** Declares a set whose elements are drawn from the given domain. */
  public IndexSet set(String name, List<? extends SetRef> domain,
      List<String> records) {
    return register(name, id -> new IndexSet(this, id, name, domain, records));
  }

  @Override public Alias alias(String name, SetRef aliasWith) {
    return register(name, id -> new Alias(this, id, name, aliasWith));
  }

  /** Declares a parameter. */
  public Parameter parameter(String name, SetRef... domain) {
    return register(name,
        id -> new Parameter(this, id, name, Arrays.asList(domain)));
  }

  /** Declares a parameter. */
  public Parameter parameter(String name, List<? extends SetRef> domain) {
    return register(name, id -> new Parameter(this, id, name, domain));
  }

  /** Declares a variable. */
  public Variable variable(String name, SetRef... domain) {
    return register(name,
        id -> new Variable(this, id, name, Arrays.asList(domain)));
  }

  /** Declares a variable. */
  public Variable variable(String name, List<? extends SetRef> domain) {
    return register(name, id -> new Variable(this, id, name, domain));
  }

  /** Declares an equation. */
  public Equation equation(String name, SetRef... domain) {
    return register(name,
        id -> new Equation(this, id, name, Arrays.asList(domain)));
  }

  private synchronized <S extends Symbol> S register(String name,
      IntFunction<S> factory) {
    if (symbolsByName.containsKey(name)) {
      throw new ValidationException(
          format("symbol '%s' is already declared", name));
    }
    final S symbol = factory.apply(symbols.size());
    symbols.add(symbol);
    symbolsByName.put(name, symbol);
    return symbol;
  }
}

// End SymbolTable.java
