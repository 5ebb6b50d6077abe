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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.ast.Visitor;
import net.hydromatic.modelgen.symbol.Symbol;

/** Finds the variables that an expression references. */
public class VariableFinder extends Visitor {
  private final Set<String> names = new LinkedHashSet<>();

  private VariableFinder() {}

  /** Returns the names of the variables referenced by an expression, in
   * the order in which they first occur, each once. */
  public static List<String> variables(Ast.Exp exp) {
    final VariableFinder finder = new VariableFinder();
    exp.accept(finder);
    return ImmutableList.copyOf(finder.names);
  }

  @Override protected void visit(Ast.SymbolRef symbolRef) {
    if (symbolRef.symbol.kind == Symbol.Kind.VARIABLE) {
      names.add(symbolRef.symbol.name);
    }
    super.visit(symbolRef);
  }
}

// End VariableFinder.java
