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

/** Equation of an optimization model.
 *
 * <p>An equation is defined by a statement such as
 * {@code e(i) .. lhs(i) =e= rhs(i);}. */
public class Equation extends Symbol {
  Equation(SymbolRegistry registry, int id, String name,
      List<? extends SetRef> domain) {
    super(registry, id, name, Kind.EQUATION, domain);
  }
}

// End Equation.java
