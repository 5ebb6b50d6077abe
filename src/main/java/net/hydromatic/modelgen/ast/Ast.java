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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.modelgen.util.Static.distinct;
import static net.hydromatic.modelgen.util.Static.union;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.modelgen.compile.AliasGenerator;
import net.hydromatic.modelgen.compile.DomainException;
import net.hydromatic.modelgen.compile.Reindexer;
import net.hydromatic.modelgen.compile.ValidationException;
import net.hydromatic.modelgen.symbol.SetRef;
import net.hydromatic.modelgen.symbol.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  static void checkIndexCount(Exp exp, int expected, int actual) {
    if (expected != actual) {
      throw new DomainException(
          format("%s has %d free indices, but %d were given", exp,
              expected, actual));
    }
  }

  private static List<SetIndex> controlled(@Nullable Exp exp) {
    return exp == null ? ImmutableList.of() : exp.controlledDomain();
  }

  /** Base class for expressions.
   *
   * <p>Every operand of an arithmetic expression, reduction, condition or
   * statement is an {@code Exp}. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    /** Returns the free indices of this expression, in the order in which
     * they first occur. Indices bound by a reduction inside this expression,
     * and literal labels, are not free. */
    public abstract List<SetIndex> domain();

    /** Returns the indices bound by reductions anywhere inside this
     * expression. */
    public List<SetIndex> controlledDomain() {
      return ImmutableList.of();
    }

    /** Returns the number of free indices. */
    public final int dimension() {
      return domain().size();
    }

    @Override public abstract Exp accept(Shuttle shuttle);

    /**
     * Returns a copy of this expression whose free indices are replaced,
     * position by position, by the given indices.
     *
     * <p>Indices bound by a reduction inside this expression are renamed to
     * a fresh alias if they would otherwise capture one of the new indices.
     * This expression is not modified.
     *
     * @param aliases Source of fresh aliases
     * @param indices New indices, one for each element of {@link #domain()}
     *
     * @throws DomainException if the number of indices is wrong
     */
    public Exp reindex(AliasGenerator aliases,
        List<? extends IndexRef> indices) {
      final List<SetIndex> domain = domain();
      checkIndexCount(this, domain.size(), indices.size());
      final Map<SetIndex, IndexRef> map = new LinkedHashMap<>();
      for (int i = 0; i < domain.size(); i++) {
        map.put(domain.get(i), indices.get(i));
      }
      return Reindexer.reindex(aliases, this, map);
    }
  }

  /** Parse tree node of a literal (constant). */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    /** Value: a {@link BigDecimal}, a {@link String} or a {@link Boolean};
     * for a special value such as {@code inf}, its spelling. */
    public final Comparable value;

    Literal(Op op, Comparable value) {
      super(op);
      this.value = requireNonNull(value);
    }

    @Override public List<SetIndex> domain() {
      return ImmutableList.of();
    }

    /** Whether this is a negative number. A negative number is
     * parenthesized when it is the operand of another node. */
    public boolean isNegative() {
      switch (op) {
        case NUMBER_LITERAL:
          return ((BigDecimal) value).signum() < 0;
        case SPECIAL_LITERAL:
          return value.equals("-inf");
        default:
          return false;
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && op == ((Literal) o).op
          && value.equals(((Literal) o).value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return w.literal(this);
    }
  }

  /** Element of a symbol's index list: a set, an alias, or a literal
   * label. */
  public abstract static class IndexRef extends Exp {
    IndexRef(Op op) {
      super(op);
    }

    @Override public abstract IndexRef accept(Shuttle shuttle);
  }

  /** Use of a set or alias as an index, such as {@code i} in
   * {@code x(i)}.
   *
   * <p>Two set indices are equal if and only if they refer to the same
   * symbol; {@code i} and an alias {@code j} of {@code i} are different
   * indices that have the same base. */
  public static class SetIndex extends IndexRef {
    public final SetRef set;

    SetIndex(SetRef set) {
      super(Op.SET_INDEX);
      this.set = requireNonNull(set);
    }

    @Override public List<SetIndex> domain() {
      return ImmutableList.of(this);
    }

    /** Returns the name of the set or alias. */
    public String name() {
      return set.name;
    }

    /** Whether this index and another range over the same base set. */
    public boolean sameBase(SetIndex other) {
      return set.sameBase(other.set);
    }

    @Override public int hashCode() {
      return set.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SetIndex
          && set.equals(((SetIndex) o).set);
    }

    @Override public IndexRef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return w.append(set.name);
    }
  }

  /** Literal label, such as {@code 'seattle'}, or the wildcard {@code *},
   * used as an index. A label is never a free index. */
  public static class LabelIndex extends IndexRef {
    public final String label;

    LabelIndex(Op op, String label) {
      super(op);
      checkArgument(op == Op.LABEL || op == Op.WILDCARD);
      this.label = requireNonNull(label);
    }

    @Override public List<SetIndex> domain() {
      return ImmutableList.of();
    }

    @Override public int hashCode() {
      return Objects.hash(op, label);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof LabelIndex
          && op == ((LabelIndex) o).op
          && label.equals(((LabelIndex) o).label);
    }

    @Override public IndexRef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return op == Op.WILDCARD ? w.append("*") : w.quote(label);
    }
  }

  /** Tuple of two or more indices, such as {@code (i,j)}; reduces over
   * several indices at once, or is filtered by a condition. */
  public static class DomainTuple extends Exp {
    public final ImmutableList<SetIndex> indices;

    DomainTuple(List<SetIndex> indices) {
      super(Op.DOMAIN);
      this.indices = ImmutableList.copyOf(indices);
    }

    @Override public List<SetIndex> domain() {
      return indices;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return w.list("(", indices, ")");
    }

    public DomainTuple copy(List<SetIndex> indices) {
      return this.indices.equals(indices) ? this
          : AstBuilder.alg.domain(indices);
    }
  }

  /** Reference to a symbol, with its indices, such as {@code x(i,'a')} or
   * {@code x.l(i,j)}. */
  public static class SymbolRef extends Exp {
    public final Symbol symbol;
    /** Attribute, such as "l" for a variable's level, or null. */
    public final @Nullable String attribute;
    /** Indices, in the order in which they are written. */
    public final ImmutableList<IndexRef> indices;
    /** If not null, for each free index, its position among the set indices
     * of {@link #indices}. Set when a reference is permuted; the reference
     * is written in its original order but its domain is reordered. */
    public final @Nullable ImmutableList<Integer> permutation;
    private final ImmutableList<SetIndex> domain;

    SymbolRef(Symbol symbol, @Nullable String attribute,
        List<? extends IndexRef> indices,
        @Nullable List<Integer> permutation) {
      super(Op.ID);
      this.symbol = requireNonNull(symbol);
      this.attribute = attribute;
      this.indices = ImmutableList.copyOf(indices);
      this.permutation =
          permutation == null ? null : ImmutableList.copyOf(permutation);
      final List<SetIndex> setIndices = setIndices(this.indices);
      if (this.permutation == null) {
        this.domain = ImmutableList.copyOf(setIndices);
      } else {
        checkArgument(this.permutation.size() == setIndices.size());
        final ImmutableList.Builder<SetIndex> b = ImmutableList.builder();
        for (int p : this.permutation) {
          b.add(setIndices.get(p));
        }
        this.domain = b.build();
      }
    }

    private static List<SetIndex> setIndices(List<IndexRef> indices) {
      final List<SetIndex> list = new ArrayList<>();
      for (IndexRef index : indices) {
        if (index instanceof SetIndex) {
          list.add((SetIndex) index);
        }
      }
      return list;
    }

    /** {@inheritDoc}
     *
     * <p>The domain of a reference is positional: {@code x(i,i)} has domain
     * {@code [i, i]}. */
    @Override public List<SetIndex> domain() {
      return domain;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      w.append(symbol.name);
      if (attribute != null) {
        w.append(".").append(attribute);
      }
      if (!indices.isEmpty()) {
        w.list("(", indices, ")");
      }
      return w;
    }

    /** {@inheritDoc}
     *
     * <p>A reference has no bound indices, so each position of its domain
     * is replaced directly; {@code x(i,i)} reindexed to {@code [j,k]}
     * becomes {@code x(j,k)}. */
    @Override public SymbolRef reindex(AliasGenerator aliases,
        List<? extends IndexRef> newIndices) {
      checkIndexCount(this, domain.size(), newIndices.size());
      final List<Integer> slots = new ArrayList<>();
      for (int i = 0; i < indices.size(); i++) {
        if (indices.get(i) instanceof SetIndex) {
          slots.add(i);
        }
      }
      final List<IndexRef> list = new ArrayList<>(indices);
      for (int k = 0; k < newIndices.size(); k++) {
        final int p = permutation == null ? k : permutation.get(k);
        list.set(slots.get(p), newIndices.get(k));
      }
      return copy(list);
    }

    /** Returns a reference to the same symbol with different indices.
     * Position {@code n} of the new indices replaces position {@code n} of
     * {@link #indices}. */
    public SymbolRef copy(List<? extends IndexRef> indices) {
      if (this.indices.equals(indices)) {
        return this;
      }
      checkArgument(indices.size() == this.indices.size());
      return new SymbolRef(symbol, attribute, indices,
          permutationAfter(indices));
    }

    /** Returns the permutation that keeps this reference's logical order
     * after some of its indices are replaced, possibly by labels. */
    private @Nullable List<Integer> permutationAfter(
        List<? extends IndexRef> newIndices) {
      if (permutation == null) {
        return null;
      }
      final List<Integer> slots = new ArrayList<>();
      for (int i = 0; i < indices.size(); i++) {
        if (indices.get(i) instanceof SetIndex) {
          slots.add(i);
        }
      }
      // rendered slot of each logical position that is still a set index
      final List<Integer> order = new ArrayList<>();
      for (int p : permutation) {
        final int slot = slots.get(p);
        if (newIndices.get(slot) instanceof SetIndex) {
          order.add(slot);
        }
      }
      final List<Integer> sorted = new ArrayList<>(order);
      sorted.sort(null);
      final List<Integer> result = new ArrayList<>();
      boolean identity = true;
      for (int k = 0; k < order.size(); k++) {
        final int rank = sorted.indexOf(order.get(k));
        result.add(rank);
        identity &= rank == k;
      }
      return identity ? null : result;
    }
  }

  /** Call to a prefix, infix or relational operator, a condition, or a
   * statement.
   *
   * <p>The left operand is null for a prefix operator such as negation. */
  public static class Binary extends Exp {
    public final @Nullable Exp left;
    public final Exp right;
    private final ImmutableList<SetIndex> domain;
    private final ImmutableList<SetIndex> controlledDomain;

    Binary(Op op, @Nullable Exp left, Exp right) {
      super(op);
      this.left = left;
      this.right = requireNonNull(right);
      switch (op.kind) {
        case PREFIX:
          checkArgument(left == null);
          this.domain = ImmutableList.copyOf(right.domain());
          break;
        case STATEMENT:
          // a statement has the domain of its target
          this.domain = ImmutableList.copyOf(requireNonNull(left).domain());
          break;
        case CONDITION:
          // "p(i) $ (q(i,k))" is free in k as well as i
          this.domain = union(requireNonNull(left).domain(), right.domain());
          break;
        case INFIX:
        case RELATION:
          this.domain = union(requireNonNull(left).domain(), right.domain());
          break;
        default:
          throw new AssertionError("not a binary operator: " + op);
      }
      this.controlledDomain = union(controlled(left), right.controlledDomain());
    }

    /** Returns the left operand; throws if this is a prefix operator. */
    public Exp left() {
      return requireNonNull(left, "left");
    }

    @Override public List<SetIndex> domain() {
      return domain;
    }

    @Override public List<SetIndex> controlledDomain() {
      return controlledDomain;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      switch (op.kind) {
        case PREFIX:
          return w.prefix(op, right);
        case CONDITION:
          return w.condition(left(), right);
        case STATEMENT:
          return w.statement(op, left(), right);
        default:
          return w.binary(op, left(), right, top);
      }
    }

    public Binary copy(@Nullable Exp left, Exp right) {
      return Objects.equals(this.left, left) && this.right.equals(right)
          ? this
          : AstBuilder.alg.binary(op, left, right);
    }
  }

  /** Reduction, such as {@code sum(i, x(i,j))}; binds one or more indices
   * and combines the values of its body over them. */
  public static class Operation extends Exp {
    /** Items written in the reduction domain: indices, tuples, set
     * references, or conditions on any of those. */
    public final ImmutableList<Exp> reductionDomain;
    /** Indices bound by this operation, flattened from
     * {@link #reductionDomain}. */
    public final ImmutableList<SetIndex> indices;
    public final Exp body;
    /** Maps each position in the body's domain that is bound by this
     * operation to the position of its index in {@link #indices}. When the
     * operation is re-indexed, these positions of the body keep the
     * operation's own index. */
    public final ImmutableSortedMap<Integer, Integer> reductionPositions;
    private final ImmutableList<SetIndex> domain;
    private final ImmutableList<SetIndex> controlledDomain;

    Operation(Op op, List<? extends Exp> reductionDomain, Exp body) {
      super(op);
      checkArgument(op.kind == Op.Kind.REDUCTION);
      if (reductionDomain.isEmpty()) {
        throw new ValidationException("Operation requires at least one index");
      }
      this.reductionDomain = ImmutableList.copyOf(reductionDomain);
      this.indices = Domains.toIndexList(this.reductionDomain);
      if (distinct(indices).size() != indices.size()) {
        throw new DomainException(
            format("Operation binds index more than once: %s", indices));
      }
      this.body = requireNonNull(body);

      final ImmutableSortedMap.Builder<Integer, Integer> positions =
          ImmutableSortedMap.naturalOrder();
      final List<SetIndex> free = new ArrayList<>();
      final List<SetIndex> bodyDomain = body.domain();
      for (int i = 0; i < bodyDomain.size(); i++) {
        final int j = indices.indexOf(bodyDomain.get(i));
        if (j >= 0) {
          positions.put(i, j);
        } else {
          free.add(bodyDomain.get(i));
        }
      }
      this.reductionPositions = positions.build();
      // a condition in the reduction domain may use indices it does not bind
      List<SetIndex> controlled = union(indices, body.controlledDomain());
      for (Exp item : this.reductionDomain) {
        for (SetIndex index : item.domain()) {
          if (!indices.contains(index)) {
            free.add(index);
          }
        }
        controlled = union(controlled, item.controlledDomain());
      }
      this.domain = distinct(free);
      this.controlledDomain = ImmutableList.copyOf(controlled);
    }

    @Override public List<SetIndex> domain() {
      return domain;
    }

    @Override public List<SetIndex> controlledDomain() {
      return controlledDomain;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return w.operation(op, reductionDomain, body);
    }

    public Operation copy(List<? extends Exp> reductionDomain, Exp body) {
      return this.reductionDomain.equals(reductionDomain)
          && this.body.equals(body)
          ? this
          : AstBuilder.alg.operation(op, reductionDomain, body);
    }
  }

  /** Call to a built-in function, such as {@code sqr(x(i))} or
   * {@code ord(i)}. */
  public static class Call extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;
    private final ImmutableList<SetIndex> domain;
    private final ImmutableList<SetIndex> controlledDomain;

    Call(String name, List<? extends Exp> args) {
      super(Op.CALL);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
      List<SetIndex> domain = ImmutableList.of();
      List<SetIndex> controlledDomain = ImmutableList.of();
      for (Exp arg : this.args) {
        domain = union(domain, arg.domain());
        controlledDomain = union(controlledDomain, arg.controlledDomain());
      }
      // "card(i)" is a scalar; its argument is not iterated
      this.domain = name.equalsIgnoreCase("card")
          ? ImmutableList.of()
          : ImmutableList.copyOf(domain);
      this.controlledDomain = ImmutableList.copyOf(controlledDomain);
    }

    @Override public List<SetIndex> domain() {
      return domain;
    }

    @Override public List<SetIndex> controlledDomain() {
      return controlledDomain;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override GamsWriter unparse(GamsWriter w, boolean top) {
      return w.call(name, args);
    }

    public Call copy(List<? extends Exp> args) {
      return this.args.equals(args) ? this : AstBuilder.alg.call(name, args);
    }
  }
}

// End Ast.java
