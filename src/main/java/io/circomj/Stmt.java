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

import java.util.List;

/**
 * Stmt classes for our AST.
 * There is no statement for compound declarations: the Parser splits them into
 * single variable Declarations followed by the Substitutions for their initialisers,
 * all as siblings in the enclosing block.
 */
public abstract class Stmt {

  public enum Kind {
    BLOCK, IF_THEN_ELSE, WHILE, RETURN, SUBSTITUTION, MULTI_SUBSTITUTION, CONSTRAINT_EQUALITY,
    LOG_CALL, ASSERT, DECLARATION, ANONYMOUS_COMPONENT
  }

  public final SourceSpan span;

  Stmt(SourceSpan span) {
    this.span = span;
  }

  public abstract Kind getKind();

  public abstract <T> T accept(Visitor<T> visitor);

  public boolean is(Kind kind) {
    return getKind() == kind;
  }

  /**
   * Represents a block of statements. An empty block is also used as the placeholder
   * for statements that could not be parsed.
   */
  public static class Block extends Stmt {
    public final List<Stmt> stmts;
    public Block(SourceSpan span, List<Stmt> stmts) {
      super(span);
      this.stmts = List.copyOf(stmts);
    }
    public boolean isEmpty() { return stmts.isEmpty(); }
    @Override public Kind getKind() { return Kind.BLOCK; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitBlock(this); }
  }

  /**
   * If statement with condition and statement to execute if true
   * and optional statement to execute if false (null if there is no else).
   */
  public static class IfThenElse extends Stmt {
    public final Expr cond;
    public final Stmt ifCase;
    public final Stmt elseCase;
    public IfThenElse(SourceSpan span, Expr cond, Stmt ifCase, Stmt elseCase) {
      super(span);
      this.cond     = cond;
      this.ifCase   = ifCase;
      this.elseCase = elseCase;
    }
    @Override public Kind getKind() { return Kind.IF_THEN_ELSE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitIfThenElse(this); }
  }

  /**
   * While loop (for loops are also turned into while loops)
   */
  public static class While extends Stmt {
    public final Expr cond;
    public final Stmt body;
    public While(SourceSpan span, Expr cond, Stmt body) {
      super(span);
      this.cond = cond;
      this.body = body;
    }
    @Override public Kind getKind() { return Kind.WHILE; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitWhile(this); }
  }

  public static class Return extends Stmt {
    public final Expr value;
    public Return(SourceSpan span, Expr value) {
      super(span);
      this.value = value;
    }
    @Override public Kind getKind() { return Kind.RETURN; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitReturn(this); }
  }

  /**
   * Assignment of a value to a variable or signal: var[access] op rhe
   */
  public static class Substitution extends Stmt {
    public final String       var;
    public final List<Access> access;
    public final AssignOp     op;
    public final Expr         rhe;
    public Substitution(SourceSpan span, String var, List<Access> access, AssignOp op, Expr rhe) {
      super(span);
      this.var    = var;
      this.access = List.copyOf(access);
      this.op     = op;
      this.rhe    = rhe;
    }
    @Override public Kind getKind() { return Kind.SUBSTITUTION; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitSubstitution(this); }
  }

  /**
   * Substitution with a tuple of targets: (a, b, _) op rhe
   */
  public static class MultiSubstitution extends Stmt {
    public final Expr     lhe;
    public final AssignOp op;
    public final Expr     rhe;
    public MultiSubstitution(SourceSpan span, Expr lhe, AssignOp op, Expr rhe) {
      super(span);
      this.lhe = lhe;
      this.op  = op;
      this.rhe = rhe;
    }
    @Override public Kind getKind() { return Kind.MULTI_SUBSTITUTION; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitMultiSubstitution(this); }
  }

  /**
   * lhe === rhe
   */
  public static class ConstraintEquality extends Stmt {
    public final Expr lhe;
    public final Expr rhe;
    public ConstraintEquality(SourceSpan span, Expr lhe, Expr rhe) {
      super(span);
      this.lhe = lhe;
      this.rhe = rhe;
    }
    @Override public Kind getKind() { return Kind.CONSTRAINT_EQUALITY; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitConstraintEquality(this); }
  }

  public static class LogCall extends Stmt {
    public final List<LogArgument> args;
    public LogCall(SourceSpan span, List<LogArgument> args) {
      super(span);
      this.args = List.copyOf(args);
    }
    @Override public Kind getKind() { return Kind.LOG_CALL; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitLogCall(this); }
  }

  public static class Assert extends Stmt {
    public final Expr arg;
    public Assert(SourceSpan span, Expr arg) {
      super(span);
      this.arg = arg;
    }
    @Override public Kind getKind() { return Kind.ASSERT; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAssert(this); }
  }

  /**
   * Declaration of a single variable. Initialisers are separate Substitution statements.
   */
  public static class Declaration extends Stmt {
    public final VariableType xtype;
    public final String       name;
    public final List<Expr>   dimensions;
    public Declaration(SourceSpan span, VariableType xtype, String name, List<Expr> dimensions) {
      super(span);
      this.xtype      = xtype;
      this.name       = name;
      this.dimensions = List.copyOf(dimensions);
    }
    @Override public Kind getKind() { return Kind.DECLARATION; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitDeclaration(this); }
  }

  /**
   * Anonymous component used as a statement on its own:  T(params)(signals);
   */
  public static class AnonymousComponentStmt extends Stmt {
    public final Expr.AnonymousComponentCall call;
    public AnonymousComponentStmt(SourceSpan span, Expr.AnonymousComponentCall call) {
      super(span);
      this.call = call;
    }
    @Override public Kind getKind() { return Kind.ANONYMOUS_COMPONENT; }
    @Override public <T> T accept(Visitor<T> visitor) { return visitor.visitAnonymousComponentStmt(this); }
  }

  public interface Visitor<T> {
    T visitBlock(Block stmt);
    T visitIfThenElse(IfThenElse stmt);
    T visitWhile(While stmt);
    T visitReturn(Return stmt);
    T visitSubstitution(Substitution stmt);
    T visitMultiSubstitution(MultiSubstitution stmt);
    T visitConstraintEquality(ConstraintEquality stmt);
    T visitLogCall(LogCall stmt);
    T visitAssert(Assert stmt);
    T visitDeclaration(Declaration stmt);
    T visitAnonymousComponentStmt(AnonymousComponentStmt stmt);
  }
}
