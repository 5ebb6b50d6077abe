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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Named entity in a {@link SymbolTable}: a set, an alias, a parameter, a
 * variable or an equation.
 *
 * <p>A symbol's identity is its {@link #id}, an integer interned by the table
 * that created it. Two symbols are the same if and only if they belong to
 * the same table and their ids are equal; symbols of different tables are
 * never equal, even if they have the same id.
 */
public abstract class Symbol {
  /** Table that owns this symbol. */
  private final SymbolRegistry registry;
  /** Ordinal within the table that owns this symbol. */
  public final int id;
  public final String name;
  public final Kind kind;
  /** Declared domain; empty for a scalar. */
  public final ImmutableList<SetRef> domain;

  Symbol(SymbolRegistry registry, int id, String name, Kind kind,
      List<? extends SetRef> domain) {
    this.registry = requireNonNull(registry);
    this.id = id;
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.domain = ImmutableList.copyOf(domain);
  }

  /** Returns the number of dimensions of this symbol. */
  public int dimension() {
    return domain.size();
  }

  @Override public int hashCode() {
    return id;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
        && id == ((Symbol) o).id
        && registry == ((Symbol) o).registry;
  }

  @Override public String toString() {
    return name;
  }

  /** Kinds of symbol. */
  public enum Kind {
    SET,
    ALIAS,
    PARAMETER,
    VARIABLE,
    EQUATION;

    /** Whether a symbol of this kind can be used as an index. */
    public boolean isSetLike() {
      return this == SET || this == ALIAS;
    }
  }
}

// End Symbol.java
