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

import static java.lang.String.format;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import net.hydromatic.modelgen.compile.Prop;
import net.hydromatic.modelgen.compile.ValidationException;

/** Context for writing an AST out as GAMS text.
 *
 * <p>Every operand is rendered to a string before its parent decides how to
 * combine and parenthesize it. */
public class GamsWriter {
  private final StringBuilder b = new StringBuilder();
  private final Map<Prop, Object> map;

  /** Creates a GamsWriter with default properties. */
  public GamsWriter() {
    this(ImmutableMap.of());
  }

  /** Creates a GamsWriter.
   *
   * @param map Properties; {@link Prop#LINE_LENGTH} and
   *   {@link Prop#LINE_LENGTH_OFFSET} control where long lines are broken
   */
  public GamsWriter(Map<Prop, Object> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  @CanIgnoreReturnValue
  public GamsWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  @CanIgnoreReturnValue
  public GamsWriter append(AstNode node, boolean top) {
    return node.unparse(this, top);
  }

  /** Renders a node to a string, using the same properties as this
   * writer. */
  String render(AstNode node, boolean top) {
    return node.unparse(new GamsWriter(map), top).toString();
  }

  /** Renders an operand. A negative number is parenthesized, because GAMS
   * does not accept {@code x * -1}. */
  String operand(Ast.Exp exp) {
    final String s = render(exp, false);
    if (exp instanceof Ast.Literal && ((Ast.Literal) exp).isNegative()) {
      return "(" + s + ")";
    }
    return s;
  }

  /** Appends a quoted string. Uses double quotes unless the string contains
   * a double quote. {@link AstBuilder} does not create a label or string
   * that contains both kinds of quote. */
  @CanIgnoreReturnValue
  public GamsWriter quote(String s) {
    final char q = s.indexOf('"') >= 0 ? '\'' : '"';
    b.append(q).append(s).append(q);
    return this;
  }

  /** Appends a list of nodes, separated by commas. */
  @CanIgnoreReturnValue
  public GamsWriter list(String start, List<? extends AstNode> nodes,
      String end) {
    append(start);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(",");
      }
      nodes.get(i).unparse(this, false);
    }
    return append(end);
  }

  GamsWriter literal(Ast.Literal literal) {
    switch (literal.op) {
      case NUMBER_LITERAL:
        return append(((BigDecimal) literal.value).toPlainString());
      case BOOL_LITERAL:
        return append((Boolean) literal.value ? "yes" : "no");
      case STRING_LITERAL:
        return quote((String) literal.value);
      case SPECIAL_LITERAL:
        return append((String) literal.value);
      default:
        throw new AssertionError("unknown literal " + literal.op);
    }
  }

  /** Appends "left token right", moving the right operand to a new line if
   * the text would be too long for GAMS. */
  private GamsWriter join(String left, String token, String right) {
    final int limit =
        Prop.LINE_LENGTH.intValue(map) - Prop.LINE_LENGTH_OFFSET.intValue(map);
    append(left).append(" ").append(token);
    if (left.length() + token.length() + right.length() >= limit) {
      append("\n ");
    } else {
      append(" ");
    }
    return append(right);
  }

  /** Appends a call to an infix or relational operator.
   *
   * <p>At the top of a rendering, a relation that can head an equation is
   * written in its equation spelling ({@code =l=}) without parentheses;
   * everywhere else, the node is parenthesized. */
  GamsWriter binary(Op op, Ast.Exp left, Ast.Exp right, boolean top) {
    final String l = operand(left);
    final String r = operand(right);
    if (top && op.equationToken != null) {
      return join(l, op.equationToken, r);
    }
    if (op.token == null) {
      throw new ValidationException(
          format("operator '%s' is only valid at the top of an equation",
              op.equationToken));
    }
    append("(");
    join(l, op.token, r);
    return append(")");
  }

  /** Appends a call to a prefix operator, such as "(-x)". */
  GamsWriter prefix(Op op, Ast.Exp right) {
    return append("(").append(op.token).append(operand(right)).append(")");
  }

  /** Appends a condition, such as "x(i) $ (c(i))".
   *
   * <p>The condition is parenthesized if it is not already. The whole is
   * parenthesized unless it filters an index or a tuple of indices. */
  GamsWriter condition(Ast.Exp left, Ast.Exp right) {
    final boolean wrap = !isIndex(left);
    if (wrap) {
      append("(");
    }
    conditionBody(left, right);
    if (wrap) {
      append(")");
    }
    return this;
  }

  private GamsWriter conditionBody(Ast.Exp left, Ast.Exp right) {
    String r = operand(right);
    if (!r.startsWith("(")) {
      r = "(" + r + ")";
    }
    return join(operand(left), Op.CONDITION.token, r);
  }

  private static boolean isIndex(Ast.Exp exp) {
    return exp.op == Op.SET_INDEX || exp.op == Op.DOMAIN;
  }

  /** Renders an item of a reduction domain, or the left side of a
   * statement; a condition is written without outer parentheses. */
  private String unwrapped(Ast.Exp exp) {
    if (exp.op == Op.CONDITION) {
      final Ast.Binary condition = (Ast.Binary) exp;
      return new GamsWriter(map)
          .conditionBody(condition.left(), condition.right)
          .toString();
    }
    return render(exp, false);
  }

  /** Appends an assignment "x(i) = e;" or an equation definition
   * "e(i) .. a =l= b;". */
  GamsWriter statement(Op op, Ast.Exp left, Ast.Exp right) {
    final String l = unwrapped(left);
    final String r =
        op == Op.DEFINE ? render(right, true) : operand(right);
    return join(l, op.token, r).append(";");
  }

  /** Appends a reduction, such as "sum(i,x(i))" or "sum((i,j),x(i,j))".
   *
   * <p>A single filtered index is not parenthesized twice:
   * "sum(i $ (c(i)),x(i))". */
  GamsWriter operation(Op op, List<Ast.Exp> domain, Ast.Exp body) {
    append(op.token).append("(");
    if (domain.size() == 1) {
      append(unwrapped(domain.get(0)));
    } else {
      append("(");
      for (int i = 0; i < domain.size(); i++) {
        if (i > 0) {
          append(",");
        }
        append(unwrapped(domain.get(i)));
      }
      append(")");
    }
    return append(",").append(operand(body)).append(")");
  }

  /** Appends a call to a built-in function, such as "power(x,2)". */
  GamsWriter call(String name, List<Ast.Exp> args) {
    append(name).append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(",");
      }
      append(operand(args.get(i)));
    }
    return append(")");
  }
}

// End GamsWriter.java
