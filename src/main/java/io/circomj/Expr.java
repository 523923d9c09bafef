/*
 * Copyright © 2022,2023 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.circomj;

import java.math.BigInteger;
import java.util.List;

/**
 * Expr classes for our AST.
 * Every expression records the span of source it was parsed from. Nodes created by
 * desugaring (e.g. the "x + 1" built for "x++") use the span of the construct that
 * was rewritten.
 */
public abstract class Expr {

  public enum Kind {
    VARIABLE, NUMBER, INFIX_OP, PREFIX_OP, INLINE_SWITCH, PARALLEL_OP, ARRAY_LITERAL,
    TUPLE_LITERAL, UNIFORM_ARRAY, CALL, BUS_CALL, ANONYMOUS_COMPONENT_CALL
  }

  public final SourceSpan span;

  Expr(SourceSpan span) {
    this.span = span;
  }

  public abstract Kind getKind();

  public abstract <T> T accept(Visitor<T> visitor);

  public boolean is(Kind kind) {
    return getKind() == kind;
  }

  /**
   * Variable reference with optional access chain: a, a[i].b[j]
   * The anonymous target "_" is a Variable whose name is "_".
   */
  public static class Variable extends Expr {
    public final String       name;
    public final List<Access> access;
    public Variable(SourceSpan span, String name, List<Access> access) {
      super(span);
      this.name   = name;
      this.access = List.copyOf(access);
    }
    @Override public Kind getKind() { return Kind.VARIABLE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitVariable(this); }
  }

  public static class Number extends Expr {
    public final BigInteger value;
    public Number(SourceSpan span, BigInteger value) {
      super(span);
      this.value = value;
    }
    @Override public Kind getKind() { return Kind.NUMBER; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitNumber(this); }
  }

  public static class InfixOp extends Expr {
    public final Expr                  lhe;
    public final ExpressionInfixOpcode op;
    public final Expr                  rhe;
    public InfixOp(SourceSpan span, Expr lhe, ExpressionInfixOpcode op, Expr rhe) {
      super(span);
      this.lhe = lhe;
      this.op  = op;
      this.rhe = rhe;
    }
    @Override public Kind getKind() { return Kind.INFIX_OP; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitInfixOp(this); }
  }

  public static class PrefixOp extends Expr {
    public final ExpressionPrefixOpcode op;
    public final Expr                   rhe;
    public PrefixOp(SourceSpan span, ExpressionPrefixOpcode op, Expr rhe) {
      super(span);
      this.op  = op;
      this.rhe = rhe;
    }
    @Override public Kind getKind() { return Kind.PREFIX_OP; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitPrefixOp(this); }
  }

  /**
   * Ternary expression:  cond ? ifTrue : ifFalse
   */
  public static class InlineSwitch extends Expr {
    public final Expr cond;
    public final Expr ifTrue;
    public final Expr ifFalse;
    public InlineSwitch(SourceSpan span, Expr cond, Expr ifTrue, Expr ifFalse) {
      super(span);
      this.cond    = cond;
      this.ifTrue  = ifTrue;
      this.ifFalse = ifFalse;
    }
    @Override public Kind getKind() { return Kind.INLINE_SWITCH; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitInlineSwitch(this); }
  }

  /**
   * "parallel expr" where expr is not an anonymous component call (for anonymous
   * component calls the flag is recorded on the call itself)
   */
  public static class ParallelOp extends Expr {
    public final Expr rhe;
    public ParallelOp(SourceSpan span, Expr rhe) {
      super(span);
      this.rhe = rhe;
    }
    @Override public Kind getKind() { return Kind.PARALLEL_OP; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitParallelOp(this); }
  }

  public static class ArrayLiteral extends Expr {
    public final List<Expr> values;
    public ArrayLiteral(SourceSpan span, List<Expr> values) {
      super(span);
      this.values = List.copyOf(values);
    }
    @Override public Kind getKind() { return Kind.ARRAY_LITERAL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitArrayLiteral(this); }
  }

  /**
   * Parenthesised list of two or more expressions. Also used as the target list of
   * a MultiSubstitution.
   */
  public static class TupleLiteral extends Expr {
    public final List<Expr> values;
    public TupleLiteral(SourceSpan span, List<Expr> values) {
      super(span);
      this.values = List.copyOf(values);
    }
    @Override public Kind getKind() { return Kind.TUPLE_LITERAL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitTupleLiteral(this); }
  }

  /**
   * Array of given dimension where every element has the same value. Only created
   * as the default value for uninitialised var arrays.
   */
  public static class UniformArray extends Expr {
    public final Expr value;
    public final Expr dimension;
    public UniformArray(SourceSpan span, Expr value, Expr dimension) {
      super(span);
      this.value     = value;
      this.dimension = dimension;
    }
    @Override public Kind getKind() { return Kind.UNIFORM_ARRAY; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitUniformArray(this); }
  }

  /**
   * Function call or template instantiation: id(args)
   */
  public static class Call extends Expr {
    public final String     id;
    public final List<Expr> args;
    public Call(SourceSpan span, String id, List<Expr> args) {
      super(span);
      this.id   = id;
      this.args = List.copyOf(args);
    }
    @Override public Kind getKind() { return Kind.CALL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitCall(this); }
  }

  /**
   * Instantiation of a bus. Created for declarations of bus type where the bus
   * instance is the implicit initialiser of the declared signal.
   */
  public static class BusCall extends Expr {
    public final String     id;
    public final List<Expr> args;
    public BusCall(SourceSpan span, String id, List<Expr> args) {
      super(span);
      this.id   = id;
      this.args = List.copyOf(args);
    }
    @Override public Kind getKind() { return Kind.BUS_CALL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitBusCall(this); }
  }

  /**
   * Anonymous component: id(params)(signals)
   * If the signals were given by name then names holds, for each signal, the
   * operator used and the name of the input. Otherwise names is null.
   */
  public static class AnonymousComponentCall extends Expr {
    public final String                     id;
    public final boolean                    isParallel;
    public final List<Expr>                 params;
    public final List<Expr>                 signals;
    public final List<Pair<AssignOp,String>> names;
    public AnonymousComponentCall(SourceSpan span, String id, boolean isParallel, List<Expr> params,
                                  List<Expr> signals, List<Pair<AssignOp,String>> names) {
      super(span);
      this.id         = id;
      this.isParallel = isParallel;
      this.params     = List.copyOf(params);
      this.signals    = List.copyOf(signals);
      this.names      = names == null ? null : List.copyOf(names);
    }

    /**
     * Same call with the parallel flag set and span widened to include "parallel"
     * @param span  the new span
     * @return the new call
     */
    AnonymousComponentCall asParallel(SourceSpan span) {
      return new AnonymousComponentCall(span, id, true, params, signals, names);
    }

    @Override public Kind getKind() { return Kind.ANONYMOUS_COMPONENT_CALL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAnonymousComponentCall(this); }
  }

  public interface Visitor<T> {
    T visitVariable(Variable expr);
    T visitNumber(Number expr);
    T visitInfixOp(InfixOp expr);
    T visitPrefixOp(PrefixOp expr);
    T visitInlineSwitch(InlineSwitch expr);
    T visitParallelOp(ParallelOp expr);
    T visitArrayLiteral(ArrayLiteral expr);
    T visitTupleLiteral(TupleLiteral expr);
    T visitUniformArray(UniformArray expr);
    T visitCall(Call expr);
    T visitBusCall(BusCall expr);
    T visitAnonymousComponentCall(AnonymousComponentCall expr);
  }
}
