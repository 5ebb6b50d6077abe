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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.SetRef;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each new alias,
   * then calls the underlying tracer. */
  public static Tracer withOnAlias(Tracer tracer,
      BiConsumer<Alias, SetRef> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAlias(Alias alias, SetRef of) {
        consumer.accept(alias, of);
        super.onAlias(alias, of);
      }
    };
  }

  /** Returns a tracer that performs the given action on each contraction,
   * then calls the underlying tracer. */
  public static Tracer withOnContraction(Tracer tracer,
      Consumer<Contraction> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onContraction(Contraction contraction) {
        consumer.accept(contraction);
        super.onContraction(contraction);
      }
    };
  }

  public static Tracer withOnStatement(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStatement(String statement) {
        consumer.accept(statement);
        super.onStatement(statement);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onAlias(Alias alias, SetRef of) {
    }

    @Override public void onContraction(Contraction contraction) {
    }

    @Override public void onStatement(String statement) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onAlias(Alias alias, SetRef of) {
      tracer.onAlias(alias, of);
    }

    @Override public void onContraction(Contraction contraction) {
      tracer.onContraction(contraction);
    }

    @Override public void onStatement(String statement) {
      tracer.onStatement(statement);
    }
  }
}

// End Tracers.java
