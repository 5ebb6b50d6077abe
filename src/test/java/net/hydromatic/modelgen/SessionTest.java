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

import static net.hydromatic.modelgen.ast.AstBuilder.alg;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.compile.Prop;
import net.hydromatic.modelgen.compile.Tracer;
import net.hydromatic.modelgen.compile.Tracers;
import net.hydromatic.modelgen.compile.ValidationException;
import net.hydromatic.modelgen.compile.VariableFinder;
import net.hydromatic.modelgen.symbol.Equation;
import net.hydromatic.modelgen.symbol.IndexSet;
import net.hydromatic.modelgen.symbol.Parameter;
import net.hydromatic.modelgen.symbol.Variable;
import org.junit.jupiter.api.Test;

/** Tests {@link Session}. */
public class SessionTest {
  private static class Fixture {
    final List<String> events = new ArrayList<>();
    final Map<Prop, Object> map = new LinkedHashMap<>();
    final Tracer tracer =
        Tracers.withOnStatement(
            Tracers.withOnAlias(Tracers.empty(),
                (alias, of) -> events.add("alias " + alias.name)),
            s -> events.add("statement " + s));
    final Session session = new Session(map, tracer);
    final IndexSet i = session.symbolTable.set("i", "i1", "i2");
    final IndexSet k = session.symbolTable.set("k", "k1", "k2");
    final Parameter a = session.symbolTable.parameter("a", i, k);
    final Parameter c = session.symbolTable.parameter("c", i);
    final Variable w = session.symbolTable.variable("w", k);
    final Variable z = session.symbolTable.variable("z", i);
    final Equation e = session.symbolTable.equation("e", i);
  }

  @Test void testDefineWithMatmul() {
    final Fixture f = new Fixture();
    final Ast.Binary define =
        alg.define(alg.ref(f.e),
            alg.le(f.session.matmul(alg.ref(f.a), alg.ref(f.w)),
                alg.ref(f.c)));
    assertThat(f.session.addStatement(define),
        is("e(i) .. sum(k,(a(i,k) * w(k))) =l= c(i);"));
    assertThat(f.session.statements(), hasSize(1));
    assertThat(f.events,
        hasToString("[statement e(i) .. sum(k,(a(i,k) * w(k))) =l= c(i);]"));
  }

  @Test void testStatements() {
    final Fixture f = new Fixture();
    f.session.addStatement(alg.assign(alg.ref(f.c), alg.number(1)));
    f.session.addStatement(
        alg.assign(alg.attribute(alg.ref(f.w), "up"),
            alg.sum(alg.index(f.i), alg.ref(f.a))));
    assertThat(f.session.statements(),
        hasToString("[c(i) = 1;, w.up(k) = sum(i,a(i,k));]"));

    final ValidationException e =
        assertThrows(ValidationException.class,
            () -> f.session.addStatement(
                alg.plus(alg.ref(f.c), alg.number(1))));
    assertThat(e.getMessage(), is("not a statement: '(c(i) + 1)'"));
    assertThat(f.session.statements(), hasSize(2));
  }

  /** An alias created while resolving a product is reported to the
   * tracer. */
  @Test void testAliasEvents() {
    final Fixture f = new Fixture();
    final Parameter sq =
        f.session.symbolTable.parameter("sq", f.i, f.i);
    final Ast.Operation product =
        f.session.matmul(alg.ref(sq), alg.ref(f.z));
    assertThat(product,
        hasToString("sum(AliasOfi_2,(sq(i,AliasOfi_2) * z(AliasOfi_2)))"));
    assertThat(f.events, hasToString("[alias AliasOfi_2]"));
  }

  @Test void testLineLength() {
    final Fixture f = new Fixture();
    final Ast.Binary plus = alg.plus(alg.ref(f.c), alg.ref(f.z));
    assertThat(f.session.unparse(plus), is("(c(i) + z(i))"));

    Prop.LINE_LENGTH.set(f.map, 20);
    Prop.LINE_LENGTH_OFFSET.set(f.map, 12);
    assertThat(f.session.unparse(plus), is("(c(i) +\n z(i))"));

    Prop.LINE_LENGTH.remove(f.map);
    Prop.LINE_LENGTH_OFFSET.remove(f.map);
    assertThat(f.session.unparse(plus), is("(c(i) + z(i))"));
  }

  @Test void testProp() {
    assertThat(Prop.lookup("lineLength"), is(Prop.LINE_LENGTH));
    assertThat(Prop.lookup("ALIAS_PREFIX"), is(Prop.ALIAS_PREFIX));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));

    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.LINE_LENGTH.intValue(map), is(80_000));
    assertThat(Prop.DENSE_PREFIX.stringValue(map), is("DenseDim"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LINE_LENGTH.set(map, "long"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.ALIAS_PREFIX.set(map, null));
    Prop.ALIAS_PREFIX.set(map, "Copy");
    assertThat(Prop.ALIAS_PREFIX.get(map), is("Copy"));

    final Session session = new Session(map, Tracers.empty());
    final IndexSet i = session.symbolTable.set("i");
    assertThat(session.aliases.nextAlias(i), hasToString("Copyi_2"));
  }

  @Test void testVariableFinder() {
    final Fixture f = new Fixture();
    final Ast.Exp exp =
        alg.plus(
            alg.sum(alg.index(f.k),
                alg.times(alg.ref(f.a), alg.attribute(alg.ref(f.w), "l"))),
            alg.times(alg.ref(f.z), alg.ref(f.z)));
    assertThat(VariableFinder.variables(exp), hasToString("[w, z]"));
    assertThat(VariableFinder.variables(alg.ref(f.c)).isEmpty(), is(true));
  }
}

// End SessionTest.java
