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

import static net.hydromatic.modelgen.ast.AstBuilder.alg;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.IndexSet;
import net.hydromatic.modelgen.symbol.Parameter;
import net.hydromatic.modelgen.symbol.SetRef;
import net.hydromatic.modelgen.symbol.SymbolTable;
import org.junit.jupiter.api.Test;

/** Tests {@link Matrices}. */
public class MatricesTest {
  private static class Fixture {
    final SymbolTable t = new SymbolTable();
    final AliasGenerator aliases = new AliasGenerator(t);
    final IndexSet i = t.set("i", "i1", "i2");
    final Alias j = t.alias("j", i);
    final IndexSet k = t.set("k", "k1", "k2");
    final Parameter v = t.parameter("v", i);
    final Parameter a = t.parameter("a", i, k);
    final Parameter x = t.parameter("x", i, j);
    final Parameter c = t.parameter("c", i, k, j);
  }

  @Test void testDim() {
    final Fixture f = new Fixture();
    final List<SetRef> sets = Matrices.dim(f.aliases, 3, 3, 2);
    assertThat(sets, hasToString("[DenseDim3_1, DenseDim3_2, DenseDim2_1]"));
    assertThat(sets.get(1).sameBase(sets.get(0)), is(true));
    assertThat(sets.get(0).base().records, hasToString("[0, 1, 2]"));

    // a second request reuses the sets
    assertThat(Matrices.dim(f.aliases, 3, 3), hasToString("[DenseDim3_1, "
        + "DenseDim3_2]"));
    assertThat(f.t.lookupOpt("DenseDim3_3"), nullValue());

    // a dense set can be used to declare a parameter
    final Parameter m = f.t.parameter("m", sets.subList(0, 2));
    assertThat(alg.ref(m), hasToString("m(DenseDim3_1,DenseDim3_2)"));
  }

  @Test void testTrace() {
    final Fixture f = new Fixture();
    final Ast.Operation trace = Matrices.trace(f.aliases, alg.ref(f.x), 0, 1);
    assertThat(trace, hasToString("sum(j,x(j,j))"));
    assertThat(trace.domain().isEmpty(), is(true));

    // trace over the first and last of three dimensions
    final Parameter c2 = f.t.parameter("c2", f.i, f.k, f.i);
    assertThat(Matrices.trace(f.aliases, alg.ref(c2), 0, 2),
        hasToString("sum(i,c2(i,k,i))"));

    // an index bound inside the expression is not reused
    final Ast.Exp inner =
        alg.plus(alg.ref(f.x),
            alg.sum(alg.index(f.j), alg.ref(f.x, f.j, f.j)));
    assertThat(Matrices.trace(f.aliases, inner, 0, 1),
        hasToString("sum(AliasOfj_2,(x(AliasOfj_2,AliasOfj_2) "
            + "+ sum(j,x(j,j))))"));
  }

  @Test void testTraceInvalid() {
    final Fixture f = new Fixture();
    ValidationException e =
        assertThrows(ValidationException.class,
            () -> Matrices.trace(f.aliases, alg.ref(f.v), 0, 1));
    assertThat(e.getMessage(), is("Trace requires at least 2 dimensions"));

    e = assertThrows(ValidationException.class,
        () -> Matrices.trace(f.aliases, alg.ref(f.a), 0, 1));
    assertThat(e.getMessage(),
        is("Matrix dimensions are not equal: 'i' and 'k'"));

    e = assertThrows(ValidationException.class,
        () -> Matrices.trace(f.aliases, alg.ref(f.x), 0, 2));
    assertThat(e.getMessage(), is("Axis 2 is out of range for 2 dimensions"));

    e = assertThrows(ValidationException.class,
        () -> Matrices.trace(f.aliases, alg.ref(f.x), 1, 1));
    assertThat(e.getMessage(), is("Trace requires two different axes"));
  }

  @Test void testPermute() {
    final Fixture f = new Fixture();
    final Ast.SymbolRef t = Matrices.permute(alg.ref(f.a), 1, 0);
    assertThat(t, hasToString("a(i,k)"));
    assertThat(t.domain(), hasToString("[k, i]"));
    assertThat(Matrices.permute(t, 1, 0).permutation, nullValue());
    assertThat(Matrices.permute(alg.ref(f.a), 0, 1).permutation,
        nullValue());

    final Ast.SymbolRef c = Matrices.permute(alg.ref(f.c), 2, 0, 1);
    assertThat(c.domain(), hasToString("[j, i, k]"));
    assertThat(Matrices.permute(c, 2, 0, 1).domain(),
        hasToString("[k, j, i]"));

    // the transpose of a(i,k) times v(i) contracts over i
    assertThat(Matrices.matmul(f.aliases, t, alg.ref(f.v)),
        hasToString("sum(i,(a(i,k) * v(i)))"));

    // replacing a permuted index by a label keeps the order of the others
    final Ast.SymbolRef c2 =
        c.reindex(f.aliases, Arrays.asList(alg.label("j1"),
            alg.index(f.i), alg.index(f.k)));
    assertThat(c2, hasToString("c(i,k,\"j1\")"));
    assertThat(c2.domain(), hasToString("[i, k]"));
  }

  @Test void testPermuteInvalid() {
    final Fixture f = new Fixture();
    ValidationException e =
        assertThrows(ValidationException.class,
            () -> Matrices.permute(alg.ref(f.a), 1, 2));
    assertThat(e.getMessage(),
        is("Permute requires the order of indices from 0 to n-1"));

    e = assertThrows(ValidationException.class,
        () -> Matrices.permute(alg.ref(f.c), 0, 2, 2));
    assertThat(e.getMessage(), is("Permute dimensions must be unique"));

    e = assertThrows(ValidationException.class,
        () -> Matrices.permute(alg.ref(f.a), 2, 0, 1));
    assertThat(e.getMessage(),
        is("Permute of 'a' requires 2 dimensions, but got 3"));
  }

  @Test void testVectorNorm() {
    final Fixture f = new Fixture();
    final Ast.SymbolRef v = alg.ref(f.v);
    assertThat(Matrices.vectorNorm(v, 2),
        hasToString("sqrt(sum(i,sqr(v(i))))"));
    assertThat(Matrices.vectorNorm(v, 1), hasToString("sum(i,abs(v(i)))"));
    assertThat(Matrices.vectorNorm(v, 4),
        hasToString("rPower(sum(i,power(v(i),4)),0.25)"));
    assertThat(Matrices.vectorNorm(v, 0.5),
        hasToString("power(sum(i,sqrt(abs(v(i)))),2)"));
    assertThat(Matrices.vectorNorm(alg.ref(f.a), 2, 1),
        hasToString("sqrt(sum(k,sqr(a(i,k))))"));
    assertThat(Matrices.vectorNorm(alg.ref(f.a), 1),
        hasToString("sum((i,k),abs(a(i,k)))"));
  }

  @Test void testVectorNormInvalid() {
    final Fixture f = new Fixture();
    final Ast.SymbolRef v = alg.ref(f.v);
    ValidationException e =
        assertThrows(ValidationException.class,
            () -> Matrices.vectorNorm(v, Double.POSITIVE_INFINITY));
    assertThat(e.getMessage(), is("Infinity norms are not supported"));
    e = assertThrows(ValidationException.class,
        () -> Matrices.vectorNorm(v, Double.NaN));
    assertThat(e.getMessage(), is("Norm order must be a number"));
    e = assertThrows(ValidationException.class,
        () -> Matrices.vectorNorm(v, 0));
    assertThat(e.getMessage(), is("0 norm is not supported"));
    e = assertThrows(ValidationException.class,
        () -> Matrices.vectorNorm(v, 2, 1));
    assertThat(e.getMessage(), is("Axis 1 is out of range for 1 dimensions"));
  }
}

// End MatricesTest.java
