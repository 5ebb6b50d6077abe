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
package net.hydromatic.modelgen.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns the last element of a list.
   *
   * @throws java.lang.IndexOutOfBoundsException if the list is empty
   */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Returns the element {@code count} positions before the end of a list;
   * {@code fromEnd(list, 1)} is the last element. */
  public static <E> E fromEnd(List<E> list, int count) {
    return list.get(list.size() - count);
  }

  /** Returns every element of a list but its last {@code count} elements. */
  public static <E> List<E> skipLast(List<E> list, int count) {
    return list.subList(0, list.size() - count);
  }

  /**
   * Returns the distinct elements of two lists, in order of first
   * occurrence.
   *
   * @param <E> Element type
   */
  public static <E> ImmutableList<E> union(Iterable<? extends E> list0,
      Iterable<? extends E> list1) {
    return ImmutableSet.<E>builder()
        .addAll(list0)
        .addAll(list1)
        .build()
        .asList();
  }

  /** Returns the distinct elements of a list, in order of first
   * occurrence. */
  public static <E> ImmutableList<E> distinct(Iterable<? extends E> list) {
    return ImmutableSet.<E>copyOf(list).asList();
  }
}

// End Static.java
