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
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.IndexSet;
import net.hydromatic.modelgen.symbol.SetRef;
import net.hydromatic.modelgen.symbol.SymbolTable;
import org.junit.jupiter.api.Test;

/** Tests {@link AliasGenerator}. */
public class AliasGeneratorTest {
  private static class Fixture {
    final SymbolTable t = new SymbolTable();
    final List<String> events = new ArrayList<>();
    final AliasGenerator aliases =
        new AliasGenerator(t, ImmutableMap.of(),
            Tracers.withOnAlias(Tracers.empty(),
                (alias, of) -> events.add(alias.name + " of " + of.name)));
    final IndexSet i = t.set("i", "i1", "i2");
    final IndexSet k = t.set("k", "k1", "k2");
  }

  @Test void testNextName() {
    final AliasGenerator aliases = new AliasGenerator(new SymbolTable());
    assertThat(aliases.nextName("i"), is("AliasOfi_2"));
    assertThat(aliases.nextName("AliasOfi_2"), is("AliasOfi_3"));
    assertThat(aliases.nextName("AliasOfi_9"), is("AliasOfi_10"));
    assertThat(aliases.nextName("DenseDim3_1"), is("DenseDim3_2"));
    // a prefixed name without a numeric suffix is aliased like any other
    assertThat(aliases.nextName("AliasOfx"), is("AliasOfAliasOfx_2"));
    assertThat(aliases.nextName("AliasOfi_a"), is("AliasOfAliasOfi_a_2"));
    assertThat(aliases.nextName("t_1"), is("AliasOft_1_2"));
  }

  @Test void testNextNameWithPrefix() {
    final Map<Prop, Object> map =
        ImmutableMap.<Prop, Object>of(Prop.ALIAS_PREFIX, "A",
            Prop.DENSE_PREFIX, "D");
    final AliasGenerator aliases =
        new AliasGenerator(new SymbolTable(), map, Tracers.empty());
    assertThat(aliases.nextName("i"), is("Ai_2"));
    assertThat(aliases.nextName("Ai_2"), is("Ai_3"));
    assertThat(aliases.nextName("D4_1"), is("D4_2"));
    assertThat(aliases.denseSet(2), hasToString("D2_1"));
  }

  @Test void testNextAlias() {
    final Fixture f = new Fixture();
    final SetRef a2 = f.aliases.nextAlias(f.i);
    assertThat(a2, instanceOf(Alias.class));
    assertThat(a2, hasToString("AliasOfi_2"));
    assertThat(((Alias) a2).aliasWith, sameInstance(f.i));
    assertThat(a2.sameBase(f.i), is(true));

    // the same request gives the same alias, and creates nothing
    assertThat(f.aliases.nextAlias(f.i), sameInstance(a2));
    assertThat(f.t.symbols(), hasSize(3));

    // aliases of aliases continue the sequence
    final SetRef a3 = f.aliases.nextAlias(a2);
    assertThat(a3, hasToString("AliasOfi_3"));
    assertThat(a3.base(), sameInstance(f.i));
    assertThat(f.aliases.nextIndex(alg.index(f.k)),
        hasToString("AliasOfk_2"));

    assertThat(f.events,
        hasToString("[AliasOfi_2 of i, AliasOfi_3 of AliasOfi_2, "
            + "AliasOfk_2 of k]"));
  }

  @Test void testNextAliasReusesDeclared() {
    final Fixture f = new Fixture();
    final Alias declared = f.t.alias("AliasOfi_2", f.i);
    assertThat(f.aliases.nextAlias(f.i), sameInstance(declared));
    assertThat(f.events.isEmpty(), is(true));
  }

  @Test void testNextAliasCollision() {
    final Fixture f = new Fixture();
    f.t.parameter("AliasOfi_2");
    ValidationException e =
        assertThrows(ValidationException.class,
            () -> f.aliases.nextAlias(f.i));
    assertThat(e.getMessage(),
        is("cannot create alias 'AliasOfi_2' of 'i': name is already used"));

    // a set of that name, but over a different base, is not reused
    f.t.alias("AliasOfk_2", f.i);
    e = assertThrows(ValidationException.class,
        () -> f.aliases.nextAlias(f.k));
    assertThat(e.getMessage(),
        is("cannot create alias 'AliasOfk_2' of 'k': name is already used"));
  }

  /** Two tables that are built the same way get the same names. */
  @Test void testDeterministic() {
    final Fixture f1 = new Fixture();
    final Fixture f2 = new Fixture();
    final SetRef a1 = f1.aliases.nextAlias(f1.aliases.nextAlias(f1.k));
    final SetRef a2 = f2.aliases.nextAlias(f2.aliases.nextAlias(f2.k));
    assertThat(a1.name, is(a2.name));
    assertThat(a1.id, is(a2.id));
    assertThat(f1.events, is(f2.events));
  }

  @Test void testDenseSet() {
    final Fixture f = new Fixture();
    final IndexSet d3 = f.aliases.denseSet(3);
    assertThat(d3, hasToString("DenseDim3_1"));
    assertThat(d3.records, hasToString("[0, 1, 2]"));
    assertThat(f.aliases.denseSet(3), sameInstance(d3));
    assertThat(f.aliases.denseSet(0).records.isEmpty(), is(true));

    ValidationException e =
        assertThrows(ValidationException.class,
            () -> f.aliases.denseSet(-1));
    assertThat(e.getMessage(),
        is("Dimension must not be negative, but was -1"));

    f.t.parameter("DenseDim2_1");
    e = assertThrows(ValidationException.class, () -> f.aliases.denseSet(2));
    assertThat(e.getMessage(),
        is("cannot create dense set 'DenseDim2_1': name is already used"));
  }
}

// End AliasGeneratorTest.java
