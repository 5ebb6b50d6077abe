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

/**
 * Alias of a set.
 *
 * <p>An alias ranges over the same elements as the set it aliases, but is a
 * distinct index: {@code sum(j, x(i,j))} sums over {@code j} while {@code i}
 * stays free, even if {@code j} is an alias of {@code i}.
 */
public class Alias extends SetRef {
  /** The set or alias that this alias was declared with. */
  public final SetRef aliasWith;

  Alias(SymbolRegistry registry, int id, String name, SetRef aliasWith) {
    super(registry, id, name, Kind.ALIAS, aliasWith.domain);
    this.aliasWith = requireNonNull(aliasWith);
  }

  @Override public IndexSet base() {
    return aliasWith.base();
  }
}

// End Alias.java
