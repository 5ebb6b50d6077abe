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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Named index set.
 *
 * <p>A set with an empty domain is a set of labels drawn from the universe;
 * a set with a non-empty domain is a subset of the sets in its domain. */
public class IndexSet extends SetRef {
  /** Labels of the elements, if known; the engine never reads them. */
  public final ImmutableList<String> records;

  IndexSet(SymbolRegistry registry, int id, String name,
      List<? extends SetRef> domain, List<String> records) {
    super(registry, id, name, Kind.SET, domain);
    this.records = ImmutableList.copyOf(records);
  }

  @Override public IndexSet base() {
    return this;
  }
}

// End IndexSet.java
