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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import net.hydromatic.modelgen.compile.DomainException;
import net.hydromatic.modelgen.compile.ValidationException;
import net.hydromatic.modelgen.symbol.SetRef;
import net.hydromatic.modelgen.symbol.Symbol;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>Every node is validated as it is built; a tree that is built
 * successfully can always be rendered. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  alg;

  /** Special numeric values. */
  private static final ImmutableSet<String> SPECIALS =
      ImmutableSet.of("inf", "-inf", "na", "eps", "undf");

  /** Attributes of variables and equations. */
  private static final ImmutableSet<String> ATTRIBUTES =
      ImmutableSet.of("l", "m", "lo", "up", "fx", "scale", "prior", "stage");

  // literals

  /** Creates a number literal. */
  public Ast.Literal number(long value) {
    return number(BigDecimal.valueOf(value));
  }

  /** Creates a number literal; an infinite value becomes {@code inf} or
   * {@code -inf}, and NaN becomes {@code na}. */
  public Ast.Literal number(double value) {
    if (Double.isNaN(value)) {
      return special("na");
    }
    if (Double.isInfinite(value)) {
      return special(value > 0 ? "inf" : "-inf");
    }
    return number(BigDecimal.valueOf(value));
  }

  /** Creates a number literal. */
  public Ast.Literal number(BigDecimal value) {
    return new Ast.Literal(Op.NUMBER_LITERAL, value);
  }

  /** Creates a special value, such as {@code inf} or {@code eps}. */
  public Ast.Literal special(String name) {
    final String lowerName = name.toLowerCase(Locale.ROOT);
    checkArgument(SPECIALS.contains(lowerName), "not a special value: %s",
        name);
    return new Ast.Literal(Op.SPECIAL_LITERAL, lowerName);
  }

  /** Creates a boolean literal, written {@code yes} or {@code no}. */
  public Ast.Literal bool(boolean value) {
    return new Ast.Literal(Op.BOOL_LITERAL, value);
  }

  /** Creates a string literal.
   *
   * @throws ValidationException if the string contains both kinds of quote
   */
  public Ast.Literal string(String value) {
    return new Ast.Literal(Op.STRING_LITERAL, quotable("string", value));
  }

  /** Checks that a string can be written between quotes; GAMS has no
   * escape for a quote character. */
  private static String quotable(String kind, String s) {
    if (s.indexOf('"') >= 0 && s.indexOf('\'') >= 0) {
      throw new ValidationException(
          format("%s cannot contain both single and double quotes: %s",
              kind, s));
    }
    return s;
  }

  // indices

  /** Creates an index that ranges over a set or alias. */
  public Ast.SetIndex index(SetRef set) {
    return new Ast.SetIndex(set);
  }

  /** Creates a list of indices. */
  public ImmutableList<Ast.SetIndex> indices(SetRef... sets) {
    final ImmutableList.Builder<Ast.SetIndex> b = ImmutableList.builder();
    for (SetRef set : sets) {
      b.add(index(set));
    }
    return b.build();
  }

  /** Creates a literal label, such as {@code "seattle"}.
   *
   * @throws ValidationException if the label contains both kinds of quote,
   *   and so cannot be quoted
   */
  public Ast.LabelIndex label(String label) {
    return new Ast.LabelIndex(Op.LABEL, quotable("label", label));
  }

  /** Creates the wildcard index, {@code *}. */
  public Ast.LabelIndex wildcard() {
    return new Ast.LabelIndex(Op.WILDCARD, "*");
  }

  /** Creates a compound domain, such as {@code (i,j)}. */
  public Ast.DomainTuple domain(SetRef... sets) {
    return domain(indices(sets));
  }

  /** Creates a compound domain, such as {@code (i,j)}. */
  public Ast.DomainTuple domain(List<Ast.SetIndex> indices) {
    if (indices.size() < 2) {
      throw new DomainException("Domain requires at least 2 sets");
    }
    return new Ast.DomainTuple(indices);
  }

  // references

  /** Creates a reference to a symbol, indexed by its declared domain. */
  public Ast.SymbolRef ref(Symbol symbol) {
    return ref(symbol, indices(symbol.domain.toArray(new SetRef[0])));
  }

  /** Creates a reference to a symbol, indexed by sets or aliases. */
  public Ast.SymbolRef ref(Symbol symbol, SetRef... sets) {
    return ref(symbol, indices(sets));
  }

  /** Creates a reference to a symbol. */
  public Ast.SymbolRef ref(Symbol symbol, Ast.IndexRef... indices) {
    return ref(symbol, Arrays.asList(indices));
  }

  /** Creates a reference to a symbol.
   *
   * @throws DomainException if the number of indices is not the dimension
   *   of the symbol
   */
  public Ast.SymbolRef ref(Symbol symbol,
      List<? extends Ast.IndexRef> indices) {
    final int dimension = symbol.dimension();
    final boolean valid;
    if (symbol.kind.isSetLike() && dimension == 0) {
      // a set over the universe may be written "i" or "i(i)"
      valid = indices.size() <= 1;
    } else {
      valid = indices.size() == dimension;
    }
    if (!valid) {
      throw new DomainException(
          format("symbol '%s' has %d dimensions, but %d indices were given",
              symbol.name, dimension, indices.size()));
    }
    return new Ast.SymbolRef(symbol, null, indices, null);
  }

  /** Creates a reference to an attribute of a variable or equation, such as
   * {@code x.l(i)}. */
  public Ast.SymbolRef attribute(Ast.SymbolRef ref, String attribute) {
    switch (ref.symbol.kind) {
      case VARIABLE:
      case EQUATION:
        break;
      default:
        throw new ValidationException(
            format("attribute '%s' is only valid for a variable or equation, "
                + "and '%s' is not", attribute, ref.symbol.name));
    }
    if (!ATTRIBUTES.contains(attribute)) {
      throw new ValidationException(
          format("unknown attribute '%s'; expected one of %s", attribute,
              ATTRIBUTES));
    }
    return new Ast.SymbolRef(ref.symbol, attribute, ref.indices,
        ref.permutation);
  }

  /** Creates a reference that is written the same as a given reference but
   * whose domain is reordered; position {@code k} of the new domain is
   * position {@code permutation[k]} of the set indices as written. */
  public Ast.SymbolRef permutedRef(Ast.SymbolRef ref,
      List<Integer> permutation) {
    final List<Integer> identity = new ArrayList<>();
    for (int k = 0; k < permutation.size(); k++) {
      identity.add(k);
    }
    return new Ast.SymbolRef(ref.symbol, ref.attribute, ref.indices,
        permutation.equals(identity) ? null : permutation);
  }

  // operators

  public Ast.Binary plus(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.PLUS, a0, a1);
  }

  public Ast.Binary minus(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.MINUS, a0, a1);
  }

  public Ast.Binary times(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.TIMES, a0, a1);
  }

  public Ast.Binary divide(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.DIVIDE, a0, a1);
  }

  /** Creates "a0 ** a1". */
  public Ast.Binary power(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.POWER, a0, a1);
  }

  public Ast.Binary and(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.AND, a0, a1);
  }

  public Ast.Binary or(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.OR, a0, a1);
  }

  public Ast.Binary xor(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.XOR, a0, a1);
  }

  public Ast.Binary lt(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.LT, a0, a1);
  }

  public Ast.Binary le(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.LE, a0, a1);
  }

  public Ast.Binary gt(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.GT, a0, a1);
  }

  public Ast.Binary ge(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.GE, a0, a1);
  }

  public Ast.Binary eq(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.EQ, a0, a1);
  }

  public Ast.Binary ne(Ast.Exp a0, Ast.Exp a1) {
    return binary(Op.NE, a0, a1);
  }

  /** Creates a relation from its equation spelling, such as "=n=". */
  public Ast.Binary relation(String equationToken, Ast.Exp a0, Ast.Exp a1) {
    final Op op = Op.BY_EQUATION_TOKEN.get(equationToken);
    if (op == null) {
      throw new ValidationException(
          format("unknown equation relation '%s'", equationToken));
    }
    return binary(op, a0, a1);
  }

  /** Creates "-a". */
  public Ast.Binary negate(Ast.Exp a) {
    return binary(Op.NEGATE, null, a);
  }

  /** Creates "not a". */
  public Ast.Binary not(Ast.Exp a) {
    return binary(Op.NOT, null, a);
  }

  /** Attaches a condition to an expression, index or domain; creates
   * "exp $ (condition)". */
  public Ast.Binary where(Ast.Exp exp, Ast.Exp condition) {
    return binary(Op.CONDITION, exp, condition);
  }

  /** Creates a call to a prefix, infix or relational operator, a condition,
   * or a statement. */
  public Ast.Binary binary(Op op, Ast.@Nullable Exp left, Ast.Exp right) {
    switch (op.kind) {
      case STATEMENT:
        return op == Op.ASSIGN
            ? assign(requireNonNull(left), right)
            : define(requireNonNull(left), right);
      case PREFIX:
        checkArgument(left == null, "prefix operator has no left operand");
        checkOperand(op, right);
        break;
      case INFIX:
      case RELATION:
      case CONDITION:
        checkOperand(op, requireNonNull(left, "left"));
        checkOperand(op, right);
        break;
      default:
        throw new IllegalArgumentException("not a binary operator: " + op);
    }
    return new Ast.Binary(op, left, right);
  }

  /** Throws if an expression may not be the operand of an operator. */
  private static void checkOperand(Op op, Ast.Exp operand) {
    if (operand.op.isStatement()) {
      throw new ValidationException(
          format("statement '%s' cannot be an operand of '%s'", operand,
              op.name()));
    }
    if (operand.op.kind == Op.Kind.RELATION && operand.op.token == null) {
      throw new ValidationException(
          format("operator '%s' is only valid at the top of an equation",
              operand.op.equationToken));
    }
  }

  // reductions

  public Ast.Operation sum(Ast.Exp domain, Ast.Exp body) {
    return operation(Op.SUM, ImmutableList.of(domain), body);
  }

  public Ast.Operation sum(List<? extends Ast.Exp> domain, Ast.Exp body) {
    return operation(Op.SUM, domain, body);
  }

  public Ast.Operation prod(Ast.Exp domain, Ast.Exp body) {
    return operation(Op.PROD, ImmutableList.of(domain), body);
  }

  public Ast.Operation prod(List<? extends Ast.Exp> domain, Ast.Exp body) {
    return operation(Op.PROD, domain, body);
  }

  public Ast.Operation smin(Ast.Exp domain, Ast.Exp body) {
    return operation(Op.SMIN, ImmutableList.of(domain), body);
  }

  public Ast.Operation smin(List<? extends Ast.Exp> domain, Ast.Exp body) {
    return operation(Op.SMIN, domain, body);
  }

  public Ast.Operation smax(Ast.Exp domain, Ast.Exp body) {
    return operation(Op.SMAX, ImmutableList.of(domain), body);
  }

  public Ast.Operation smax(List<? extends Ast.Exp> domain, Ast.Exp body) {
    return operation(Op.SMAX, domain, body);
  }

  /** Creates a reduction.
   *
   * @param op Reduction operator, such as {@link Op#SUM}
   * @param domain Indices, tuples, set references or conditions on them
   * @param body Expression to reduce
   *
   * @throws ValidationException if the domain is empty or binds an index
   *   more than once
   */
  public Ast.Operation operation(Op op, List<? extends Ast.Exp> domain,
      Ast.Exp body) {
    checkArgument(op.kind == Op.Kind.REDUCTION, "not a reduction: %s", op);
    for (Ast.Exp item : domain) {
      checkOperand(op, item);
    }
    checkOperand(op, body);
    return new Ast.Operation(op, domain, body);
  }

  // calls

  /** Creates a call to a built-in function. */
  public Ast.Call call(String name, Ast.Exp... args) {
    return call(name, Arrays.asList(args));
  }

  /** Creates a call to a built-in function. */
  public Ast.Call call(String name, List<? extends Ast.Exp> args) {
    for (Ast.Exp arg : args) {
      checkOperand(Op.CALL, arg);
    }
    return new Ast.Call(name, args);
  }

  /** Creates "ord(i)", the position of the current element of a set. */
  public Ast.Call ord(Ast.SetIndex index) {
    return call("ord", index);
  }

  /** Creates "card(s)", the number of elements of a set. */
  public Ast.Call card(Ast.Exp set) {
    if (set.op != Op.SET_INDEX
        && !(set instanceof Ast.SymbolRef
            && ((Ast.SymbolRef) set).symbol.kind.isSetLike())) {
      throw new ValidationException(
          format("card requires a set, but got '%s'", set));
    }
    return call("card", set);
  }

  public Ast.Call sqr(Ast.Exp x) {
    return call("sqr", x);
  }

  public Ast.Call sqrt(Ast.Exp x) {
    return call("sqrt", x);
  }

  public Ast.Call abs(Ast.Exp x) {
    return call("abs", x);
  }

  public Ast.Call exp(Ast.Exp x) {
    return call("exp", x);
  }

  public Ast.Call log(Ast.Exp x) {
    return call("log", x);
  }

  /** Creates "power(x,n)", x raised to an integer power. */
  public Ast.Call power(Ast.Exp x, int n) {
    return call("power", x, number(n));
  }

  /** Creates "rPower(x,y)", x raised to a real power. */
  public Ast.Call rPower(Ast.Exp x, Ast.Exp y) {
    return call("rPower", x, y);
  }

  // statements

  /** Creates an assignment, "lhs = rhs;".
   *
   * <p>The left side is a reference to a set or parameter, or to an
   * attribute of a variable or equation, optionally with a condition.
   *
   * @throws ValidationException if the left side cannot be assigned, or if
   *   the right side has a free index that the left side does not
   */
  public Ast.Binary assign(Ast.Exp lhs, Ast.Exp rhs) {
    final Ast.SymbolRef ref = statementTarget(lhs, Op.ASSIGN);
    switch (ref.symbol.kind) {
      case SET:
      case ALIAS:
      case PARAMETER:
        break;
      default:
        if (ref.attribute == null) {
          throw new ValidationException(
              format("cannot assign to %s '%s' without an attribute",
                  ref.symbol.kind.name().toLowerCase(Locale.ROOT),
                  ref.symbol.name));
        }
    }
    checkOperand(Op.ASSIGN, rhs);
    return statement(Op.ASSIGN, lhs, rhs);
  }

  /** Creates an equation definition, "e(i) .. lhs =l= rhs;".
   *
   * @throws ValidationException if the left side is not a reference to an
   *   equation, or the right side is not a relation
   */
  public Ast.Binary define(Ast.Exp lhs, Ast.Exp rhs) {
    final Ast.SymbolRef ref = statementTarget(lhs, Op.DEFINE);
    if (ref.symbol.kind != Symbol.Kind.EQUATION || ref.attribute != null) {
      throw new ValidationException(
          format("left side of an equation definition must be an equation, "
              + "but was '%s'", lhs));
    }
    if (!rhs.op.isEquationRelation()) {
      throw new ValidationException(
          format("equation '%s' must be defined by a relation such as =e=, "
              + "but was '%s'", ref.symbol.name, rhs));
    }
    return statement(Op.DEFINE, lhs, rhs);
  }

  private Ast.Binary statement(Op op, Ast.Exp lhs, Ast.Exp rhs) {
    final List<Ast.SetIndex> domain = statementTarget(lhs, op).domain();
    for (Ast.SetIndex index : lhs.domain()) {
      if (!domain.contains(index)) {
        throw new DomainException(
            format("index '%s' is free in the condition of '%s' but is not "
                + "controlled by '%s'", index, op.token, lhs));
      }
    }
    for (Ast.SetIndex index : rhs.domain()) {
      if (!domain.contains(index)) {
        throw new DomainException(
            format("index '%s' is free on the right of '%s' but is not "
                + "controlled by '%s'", index, op.token, lhs));
      }
    }
    return new Ast.Binary(op, lhs, rhs);
  }

  /** Returns the symbol reference on the left of a statement, looking
   * through a condition. */
  private static Ast.SymbolRef statementTarget(Ast.Exp lhs, Op op) {
    final Ast.Exp target =
        lhs.op == Op.CONDITION ? ((Ast.Binary) lhs).left() : lhs;
    if (!(target instanceof Ast.SymbolRef)) {
      throw new ValidationException(
          format("left side of '%s' must be a symbol reference, but was '%s'",
              op.token, lhs));
    }
    return (Ast.SymbolRef) target;
  }
}

// End AstBuilder.java
