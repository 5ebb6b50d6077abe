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

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Op op;

  AstNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into GAMS text, using default properties.
   *
   * <p>Derived classes must not override; override {@link #unparse} instead.
   */
  @Override public final String toString() {
    return unparse(new GamsWriter());
  }

  /** Converts this node into GAMS text, with a given writer. */
  public final String unparse(GamsWriter w) {
    return unparse(w, true).toString();
  }

  /**
   * Writes this node to a writer.
   *
   * @param w Writer
   * @param top Whether this node is at the top of a rendering (or is the
   *   right-hand side of an equation definition), where a relation such as
   *   {@code =l=} is written in its equation spelling and is not
   *   parenthesized
   */
  abstract GamsWriter unparse(GamsWriter w, boolean top);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result.
   */
  public abstract AstNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
