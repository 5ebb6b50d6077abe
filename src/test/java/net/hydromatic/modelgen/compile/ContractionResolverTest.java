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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.modelgen.ast.Ast;
import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.IndexSet;
import net.hydromatic.modelgen.symbol.Parameter;
import net.hydromatic.modelgen.symbol.SymbolTable;
import org.junit.jupiter.api.Test;

/** Tests {@link ContractionResolver} and {@link Matrices#matmul}. */
public class ContractionResolverTest {
  private static class Fixture {
    final SymbolTable t = new SymbolTable();
    final List<Contraction> contractions = new ArrayList<>();
    final AliasGenerator aliases =
        new AliasGenerator(t, ImmutableMap.of(),
            Tracers.withOnContraction(Tracers.empty(), contractions::add));
    final ContractionResolver resolver = new ContractionResolver(aliases);
    final IndexSet i = t.set("i", "i1", "i2");
    final IndexSet j = t.set("j", "j1", "j2");
    final IndexSet k = t.set("k", "k1", "k2");
    final IndexSet b = t.set("b", "b1", "b2");
    final IndexSet m = t.set("m", "m1", "m2");
    final Parameter v = t.parameter("v", i);
    final Parameter w = t.parameter("w", k);
    final Parameter a = t.parameter("a", i, k);
    final Parameter bk = t.parameter("bk", k, j);
    final Parameter x = t.parameter("x", i, j);
    final Parameter y = t.parameter("y", j, i);
    final Parameter sq = t.parameter("sq", i, i);
    final Parameter c = t.parameter("c", b, i, k);
    final Parameter d = t.parameter("d", b, k, j);
    final Parameter c4 = t.parameter("c4", b, m, i, k);
    final Parameter e = t.parameter("e", m, k, j);

    Contraction resolve(Parameter left, Parameter right) {
      return resolver.resolve(alg.ref(left), alg.ref(right));
    }

    String matmul(Parameter left, Parameter right) {
      return Matrices.matmul(aliases, alg.ref(left), alg.ref(right))
          .toString();
    }
  }

  @Test void testDot() {
    final Fixture f = new Fixture();
    final int count = f.t.symbols().size();
    final Contraction c = f.resolve(f.v, f.v);
    assertThat(c, hasToString("Contraction{left=i, right=i, index=i}"));
    assertThat(c.leftFree().isEmpty(), is(true));
    assertThat(f.matmul(f.v, f.v), is("sum(i,(v(i) * v(i)))"));
    assertThat(f.t.symbols(), hasSize(count));

    final ValidationException e =
        assertThrows(ValidationException.class, () -> f.resolve(f.v, f.w));
    assertThat(e.getMessage(),
        is("Dot product requires same domain, but got 'i' and 'k'"));
  }

  @Test void testMatrixMatrix() {
    final Fixture f = new Fixture();
    final Contraction c = f.resolve(f.a, f.bk);
    assertThat(c,
        hasToString("Contraction{left=(i,k), right=(k,j), index=k}"));
    assertThat(c.leftFree(), hasToString("[i]"));
    assertThat(c.rightFree(), hasToString("[j]"));
    assertThat(f.matmul(f.a, f.bk), is("sum(k,(a(i,k) * bk(k,j)))"));

    final ValidationException e =
        assertThrows(ValidationException.class, () -> f.resolve(f.a, f.a));
    assertThat(e.getMessage(),
        is("Matrix multiplication dimensions do not match: left (i,k), "
            + "right (i,k); cannot contract 'k' with 'i'"));
  }

  /** The free index of the left operand is the same as the free index of
   * the right operand, so the left one is replaced by an alias. */
  @Test void testMatrixMatrixClash() {
    final Fixture f = new Fixture();
    assertThat(f.resolve(f.x, f.y),
        hasToString("Contraction{left=(AliasOfi_2,j), right=(j,i), "
            + "index=j}"));
    assertThat(f.matmul(f.x, f.y),
        is("sum(j,(x(AliasOfi_2,j) * y(j,i)))"));

    // a square matrix times itself needs two aliases
    assertThat(f.matmul(f.sq, f.sq),
        is("sum(AliasOfi_3,(sq(AliasOfi_2,AliasOfi_3) * sq(AliasOfi_3,i)))"));
  }

  @Test void testVector() {
    final Fixture f = new Fixture();
    assertThat(f.resolve(f.a, f.w),
        hasToString("Contraction{left=(i,k), right=k, index=k}"));
    assertThat(f.resolve(f.v, f.a),
        hasToString("Contraction{left=i, right=(i,k), index=i}"));
    assertThat(f.matmul(f.a, f.w), is("sum(k,(a(i,k) * w(k)))"));
    assertThat(f.matmul(f.v, f.a), is("sum(i,(v(i) * a(i,k)))"));
  }

  @Test void testBatch() {
    final Fixture f = new Fixture();
    assertThat(f.resolve(f.w, f.d),
        hasToString("Contraction{left=k, right=(b,k,j), index=k}"));
    assertThat(f.resolve(f.c, f.w),
        hasToString("Contraction{left=(b,i,k), right=k, index=k}"));
    assertThat(f.resolve(f.c, f.d),
        hasToString("Contraction{left=(b,i,k), right=(b,k,j), index=k}"));
    assertThat(f.resolve(f.a, f.d),
        hasToString("Contraction{left=(i,k), right=(b,k,j), index=k}"));
    assertThat(f.matmul(f.c, f.d), is("sum(k,(c(b,i,k) * d(b,k,j)))"));

    ValidationException e =
        assertThrows(ValidationException.class, () -> f.resolve(f.c, f.e));
    assertThat(e.getMessage(),
        is("Batch dimensions do not match: left b, right m"));

    // batches that share a prefix but differ in length
    e = assertThrows(ValidationException.class, () -> f.resolve(f.c4, f.d));
    assertThat(e.getMessage(),
        is("Batch dimensions do not match: left (b,m), right b"));
  }

  @Test void testScalar() {
    final Fixture f = new Fixture();
    ValidationException e =
        assertThrows(ValidationException.class,
            () -> f.resolver.resolve(alg.number(2), alg.ref(f.v)));
    assertThat(e.getMessage(),
        is("Matrix multiplication requires at least 1 domain, "
            + "left side is a scalar"));
    e = assertThrows(ValidationException.class,
        () -> f.resolver.resolve(alg.ref(f.v),
            alg.sum(alg.index(f.i), alg.ref(f.v))));
    assertThat(e.getMessage(),
        is("Matrix multiplication requires at least 1 domain, "
            + "right side is a scalar"));
  }

  /** The result of one product is an operand of another; the index it
   * sums over must not be reused for the outer contraction. */
  @Test void testControlledIndex() {
    final Fixture f = new Fixture();
    final Alias j2 = f.t.alias("j2", f.i);
    final Parameter x2 = f.t.parameter("x2", j2, f.i);
    final Ast.Operation inner =
        Matrices.matmul(f.aliases, alg.ref(x2), alg.ref(f.v));
    assertThat(inner, hasToString("sum(i,(x2(j2,i) * v(i)))"));
    assertThat(inner.domain(), hasToString("[j2]"));

    final Contraction c = f.resolver.resolve(alg.ref(f.v), inner);
    assertThat(c,
        hasToString("Contraction{left=AliasOfi_2, right=AliasOfi_2, "
            + "index=AliasOfi_2}"));
    assertThat(Matrices.matmul(f.aliases, alg.ref(f.v), inner),
        hasToString("sum(AliasOfi_2,(v(AliasOfi_2) * "
            + "sum(i,(x2(AliasOfi_2,i) * v(i)))))"));
  }

  /** Resolving the same operands twice gives the same result, and every
   * resolution is reported to the tracer. */
  @Test void testDeterministic() {
    final Fixture f = new Fixture();
    final String s1 = f.resolve(f.x, f.y).toString();
    final int count = f.t.symbols().size();
    final String s2 = f.resolve(f.x, f.y).toString();
    assertThat(s2, is(s1));
    assertThat(f.t.symbols(), hasSize(count));
    assertThat(f.contractions, hasSize(2));

    final Fixture f2 = new Fixture();
    assertThat(f2.resolve(f2.x, f2.y), hasToString(s1));
  }
}

// End ContractionResolverTest.java
