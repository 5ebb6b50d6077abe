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
package net.hydromatic.modelgen;

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.ast.GamsWriter;
import net.hydromatic.modelgen.compile.AliasGenerator;
import net.hydromatic.modelgen.compile.Matrices;
import net.hydromatic.modelgen.compile.Prop;
import net.hydromatic.modelgen.compile.Tracer;
import net.hydromatic.modelgen.compile.Tracers;
import net.hydromatic.modelgen.compile.ValidationException;
import net.hydromatic.modelgen.symbol.SymbolTable;

/** Modeling session.
 *
 * <p>Owns the symbol table, the generator of aliases, and the ordered log
 * of statements that have been rendered to GAMS text. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  public final SymbolTable symbolTable;
  public final AliasGenerator aliases;
  public final Tracer tracer;
  private final List<String> statements = new ArrayList<>();

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. The alias generator reads it once, when the session is
   * created.
   *
   * @param map Map that contains property values
   * @param tracer Tracer
   */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = map;
    this.tracer = tracer;
    this.symbolTable = new SymbolTable();
    this.aliases = new AliasGenerator(symbolTable, map, tracer);
  }

  /** Creates a Session with default properties and no tracing. */
  public Session() {
    this(new LinkedHashMap<>(), Tracers.empty());
  }

  /** Renders an expression to GAMS text, using this session's
   * properties. */
  public String unparse(Ast.Exp exp) {
    return exp.unparse(new GamsWriter(map));
  }

  /** Renders an assignment or equation definition, and appends it to the
   * log of statements.
   *
   * @return The text of the statement
   * @throws ValidationException if the node is not a statement
   */
  public String addStatement(Ast.Binary statement) {
    if (!statement.op.isStatement()) {
      throw new ValidationException(
          format("not a statement: '%s'", statement));
    }
    final String text = unparse(statement);
    synchronized (statements) {
      statements.add(text);
    }
    tracer.onStatement(text);
    return text;
  }

  /** Returns the statements added so far, in order. */
  public List<String> statements() {
    synchronized (statements) {
      return ImmutableList.copyOf(statements);
    }
  }

  /** Multiplies two expressions as matrices, generating aliases in this
   * session's symbol table. */
  public Ast.Operation matmul(Ast.Exp left, Ast.Exp right) {
    return Matrices.matmul(aliases, left, right);
  }
}

// End Session.java
