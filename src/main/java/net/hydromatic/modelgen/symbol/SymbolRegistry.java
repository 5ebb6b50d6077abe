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
package net.hydromatic.modelgen.symbol;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Owner of named symbols.
 *
 * <p>The algebra reads identities and dimensions from a registry, and writes
 * to it only to register aliases that it generates.
 */
public interface SymbolRegistry {
  /** Looks up a symbol by name. Throws if not found; never returns null. */
  Symbol resolve(String name);

  /** Looks up a symbol by name, returning null if not found. */
  @Nullable Symbol lookupOpt(String name);

  /** Returns the symbol with a given id. */
  Symbol get(int id);

  /** Declares an alias. Throws if the name is already in use. */
  Alias alias(String name, SetRef aliasWith);
}

// End SymbolRegistry.java
