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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}, and the tokens that spell them. */
public enum Op {
  // literals
  NUMBER_LITERAL(Kind.LEAF),
  /** Special value such as {@code inf} or {@code eps}. */
  SPECIAL_LITERAL(Kind.LEAF),
  STRING_LITERAL(Kind.LEAF),
  BOOL_LITERAL(Kind.LEAF),

  // indices
  SET_INDEX(Kind.LEAF),
  LABEL(Kind.LEAF),
  WILDCARD(Kind.LEAF),
  DOMAIN(Kind.LEAF),

  // references and calls
  ID(Kind.LEAF),
  CALL(Kind.LEAF),

  // reductions
  SUM(Kind.REDUCTION, "sum"),
  PROD(Kind.REDUCTION, "prod"),
  SMIN(Kind.REDUCTION, "smin"),
  SMAX(Kind.REDUCTION, "smax"),

  // prefix operators
  NEGATE(Kind.PREFIX, "-"),
  NOT(Kind.PREFIX, "not "),

  // infix operators
  PLUS(Kind.INFIX, "+"),
  MINUS(Kind.INFIX, "-"),
  TIMES(Kind.INFIX, "*"),
  DIVIDE(Kind.INFIX, "/"),
  POWER(Kind.INFIX, "**"),
  AND(Kind.INFIX, "and"),
  OR(Kind.INFIX, "or"),
  XOR(Kind.INFIX, "xor"),

  // relational operators; those with an equation token may head an equation
  LT(Kind.RELATION, "<"),
  GT(Kind.RELATION, ">"),
  NE(Kind.RELATION, "ne"),
  EQ(Kind.RELATION, "eq", "=e="),
  LE(Kind.RELATION, "<=", "=l="),
  GE(Kind.RELATION, ">=", "=g="),
  /** Nonbinding equation. */
  EQ_N(Kind.RELATION, null, "=n="),
  /** External equation. */
  EQ_X(Kind.RELATION, null, "=x="),
  /** Conic equation. */
  EQ_C(Kind.RELATION, null, "=c="),
  /** Boolean equation. */
  EQ_B(Kind.RELATION, null, "=b="),

  /** Filter, "x $ c". */
  CONDITION(Kind.CONDITION, "$"),

  // statements
  ASSIGN(Kind.STATEMENT, "="),
  DEFINE(Kind.STATEMENT, "..");

  public final Kind kind;
  /** Spelling inside an expression, or null if the operator may only occur
   * at the top of an equation. */
  public final @Nullable String token;
  /** Spelling at the top of an equation, or null if the operator is not an
   * equation relation. */
  public final @Nullable String equationToken;

  /** Map from equation token (e.g. "=l=") to operator. */
  public static final ImmutableMap<String, Op> BY_EQUATION_TOKEN;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.equationToken != null) {
        b.put(op.equationToken, op);
      }
    }
    BY_EQUATION_TOKEN = b.build();
  }

  Op(Kind kind) {
    this(kind, null, null);
  }

  Op(Kind kind, String token) {
    this(kind, token, null);
  }

  Op(Kind kind, @Nullable String token, @Nullable String equationToken) {
    this.kind = kind;
    this.token = token;
    this.equationToken = equationToken;
  }

  /** Whether this operator can head an equation, e.g. "=g=". */
  public boolean isEquationRelation() {
    return equationToken != null;
  }

  /** Whether this is an assignment or equation definition; such nodes are
   * terminated by ";". */
  public boolean isStatement() {
    return kind == Kind.STATEMENT;
  }

  /** Categories of operator. */
  public enum Kind {
    LEAF,
    REDUCTION,
    PREFIX,
    INFIX,
    RELATION,
    CONDITION,
    STATEMENT
  }
}

// End Op.java
