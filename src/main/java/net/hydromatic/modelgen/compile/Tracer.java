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

import net.hydromatic.modelgen.symbol.Alias;
import net.hydromatic.modelgen.symbol.SetRef;

/** Called on various events while a model is being built. */
public interface Tracer {
  /** Called when a new alias is declared.
   *
   * @param alias The new alias
   * @param of The set or alias that it was generated from
   */
  void onAlias(Alias alias, SetRef of);

  /** Called when the indices of a contraction have been chosen. */
  void onContraction(Contraction contraction);

  /** Called when a statement is added to a session. */
  void onStatement(String statement);
}

// End Tracer.java
