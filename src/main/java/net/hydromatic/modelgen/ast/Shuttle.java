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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.modelgen.compile.DomainException;

/** Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method returns the node unchanged if none of its
 * children changed. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.IndexRef visit(Ast.SetIndex setIndex) {
    return setIndex; // leaf
  }

  protected Ast.IndexRef visit(Ast.LabelIndex labelIndex) {
    return labelIndex; // leaf
  }

  protected Ast.Exp visit(Ast.DomainTuple domainTuple) {
    final List<Ast.SetIndex> indices = new ArrayList<>();
    for (Ast.SetIndex index : domainTuple.indices) {
      final Ast.IndexRef index2 = index.accept(this);
      if (!(index2 instanceof Ast.SetIndex)) {
        throw new DomainException("cannot replace index " + index
            + " of domain " + domainTuple + " by a label");
      }
      indices.add((Ast.SetIndex) index2);
    }
    return domainTuple.copy(indices);
  }

  protected Ast.Exp visit(Ast.SymbolRef symbolRef) {
    return symbolRef.copy(visitList(symbolRef.indices));
  }

  protected Ast.Exp visit(Ast.Binary binary) {
    return binary.copy(
        binary.left == null ? null : binary.left.accept(this),
        binary.right.accept(this));
  }

  protected Ast.Exp visit(Ast.Operation operation) {
    return operation.copy(visitList(operation.reductionDomain),
        operation.body.accept(this));
  }

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(visitList(call.args));
  }
}

// End Shuttle.java
