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

import java.util.List;

/**
 * Symbol that can index another symbol: an {@link IndexSet} or an
 * {@link Alias} of one.
 */
public abstract class SetRef extends Symbol {
  SetRef(SymbolRegistry registry, int id, String name, Kind kind,
      List<? extends SetRef> domain) {
    super(registry, id, name, kind, domain);
  }

  /** Returns the set that this symbol ultimately refers to. A set is its own
   * base; an alias's base is the base of the symbol it aliases. */
  public abstract IndexSet base();

  /** Returns whether this and another set-like symbol have the same base
   * set. A set and any of its aliases have the same base. */
  public boolean sameBase(SetRef other) {
    return base().equals(other.base());
  }
}

// End SetRef.java
