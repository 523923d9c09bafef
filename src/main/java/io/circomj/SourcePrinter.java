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
import java.util.stream.Collectors;

/**
 * Renders an AST back into Circom source. Binary, prefix and ternary operations are fully
 * parenthesised so that the output does not depend on precedence rules. Parsing the output
 * again (with the same ParseContext) gives an AST with the same structure.
 *
 * Declarations were split up by the Parser so here we put them back together where we
 * recognise the pattern the Parser produced:
 * <pre>
 *   Declaration a, Substitution a = e              -&gt;  var a = e;
 *   Declaration a, Declaration b, (a, b) = e       -&gt;  var (a, b) = e;
 *   Declaration p (bus B), Substitution p = B(n)   -&gt;  B(n) p;
 * </pre>
 */
public class SourcePrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {

  private static final String INDENT = "  ";

  public static String print(Program program) {
    return new SourcePrinter().program(program);
  }

  public static String print(Stmt stmt) {
    return stmt.accept(new SourcePrinter());
  }

  public static String print(Expr expr) {
    return expr.accept(new SourcePrinter());
  }

  private SourcePrinter() {}

  ///////////////////////////////////////

  // = Program

  private String program(Program program) {
    StringBuilder sb = new StringBuilder();
    for (Pragma pragma: program.pragmas) {
      if (pragma instanceof Pragma.Version) {
        sb.append("pragma circom ").append(pragma).append(";\n");
      }
      else
      if (pragma instanceof Pragma.CustomGates) {
        sb.append("pragma custom_templates;\n");
      }
    }
    program.includes.forEach(include -> sb.append("include \"").append(include).append("\";\n"));
    program.definitions.forEach(definition -> sb.append(definition(definition)).append('\n'));
    MainComponent main = program.mainComponent;
    if (main != null) {
      sb.append("component main ");
      if (!main.publicSignals.isEmpty()) {
        sb.append("{public [").append(String.join(", ", main.publicSignals)).append("]} ");
      }
      sb.append("= ").append(main.initializer.accept(this)).append(";\n");
    }
    return sb.toString();
  }

  private String definition(Definition definition) {
    String keyword;
    if (definition instanceof Definition.Function) {
      keyword = "function ";
    }
    else
    if (definition instanceof Definition.Template) {
      Definition.Template template = (Definition.Template) definition;
      keyword = "template " + (template.customGate ? "custom " : "") + (template.parallel ? "parallel " : "");
    }
    else {
      keyword = "bus ";
    }
    return keyword + definition.name + "(" + String.join(", ", definition.args) + ") " + definition.body.accept(this);
  }

  ///////////////////////////////////////

  // = Stmt

  @Override public String visitBlock(Stmt.Block stmt) {
    if (stmt.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder("{\n");
    List<Stmt> stmts = stmt.stmts;
    for (int i = 0; i < stmts.size(); ) {
      StringBuilder line = new StringBuilder();
      i = statementAt(stmts, i, line);
      for (String text: line.toString().split("\n")) {
        sb.append(INDENT).append(text).append('\n');
      }
    }
    return sb.append('}').toString();
  }

  /**
   * Render the statement at given index (together with any following statements that came
   * from the same declaration) and return the index of the next statement to render.
   */
  private int statementAt(List<Stmt> stmts, int i, StringBuilder sb) {
    Stmt stmt = stmts.get(i);
    if (!stmt.is(Stmt.Kind.DECLARATION)) {
      sb.append(stmt.accept(this));
      return i + 1;
    }

    int tupleEnd = tupleDeclarationEnd(stmts, i);
    if (tupleEnd > i) {
      List<String> symbols = stmts.subList(i, tupleEnd - 1).stream()
                                  .map(decl -> symbol((Stmt.Declaration) decl))
                                  .collect(Collectors.toList());
      Stmt.MultiSubstitution multi = (Stmt.MultiSubstitution) stmts.get(tupleEnd - 1);
      sb.append(type(((Stmt.Declaration) stmt).xtype, null))
        .append("(").append(String.join(", ", symbols)).append(") ")
        .append(multi.op).append(' ').append(multi.rhe.accept(this)).append(';');
      return tupleEnd;
    }

    Stmt.Declaration decl = (Stmt.Declaration) stmt;
    Stmt next = i + 1 < stmts.size() ? stmts.get(i + 1) : null;
    if (next != null && next.is(Stmt.Kind.SUBSTITUTION)) {
      Stmt.Substitution subst = (Stmt.Substitution) next;
      Expr.BusCall busCall = busCall(subst.rhe);
      if (subst.var.equals(decl.name) && subst.access.isEmpty() && decl.xtype.is(VariableType.Kind.BUS) && busCall != null) {
        sb.append(type(decl.xtype, busCall)).append(symbol(decl)).append(';');
        return i + 2;
      }
      if (subst.var.equals(decl.name) && subst.access.isEmpty() && canInitialise(decl.xtype, subst.op)) {
        sb.append(type(decl.xtype, null)).append(symbol(decl));
        if (!subst.rhe.is(Expr.Kind.UNIFORM_ARRAY)) {
          sb.append(' ').append(subst.op).append(' ').append(subst.rhe.accept(this));
        }
        sb.append(';');
        return i + 2;
      }
    }
    sb.append(decl.accept(this));
    return i + 1;
  }

  /**
   * The bus instance assigned to a bus declaration, looking through the uniform arrays
   * that wrap it for array declarations.
   */
  private static Expr.BusCall busCall(Expr expr) {
    while (expr.is(Expr.Kind.UNIFORM_ARRAY)) {
      expr = ((Expr.UniformArray) expr).value;
    }
    return expr.is(Expr.Kind.BUS_CALL) ? (Expr.BusCall) expr : null;
  }

  /**
   * Whether the operator can be written as the initialiser of a declaration of the given type
   */
  private static boolean canInitialise(VariableType type, AssignOp op) {
    switch (type.getKind()) {
      case VAR:
      case COMPONENT: return op == AssignOp.ASSIGN_VAR;
      case SIGNAL:    return op != AssignOp.ASSIGN_VAR;
      default:        return false;
    }
  }

  /**
   * If the statements from index i are declarations followed by a MultiSubstitution to
   * exactly the declared names then return index after the MultiSubstitution. Otherwise
   * return i.
   */
  private int tupleDeclarationEnd(List<Stmt> stmts, int i) {
    VariableType type = ((Stmt.Declaration) stmts.get(i)).xtype;
    int j = i;
    while (j < stmts.size() && stmts.get(j).is(Stmt.Kind.DECLARATION) && ((Stmt.Declaration) stmts.get(j)).xtype.equals(type)) {
      j++;
    }
    if (j == stmts.size() || !stmts.get(j).is(Stmt.Kind.MULTI_SUBSTITUTION)) {
      return i;
    }
    Expr lhe = ((Stmt.MultiSubstitution) stmts.get(j)).lhe;
    if (!lhe.is(Expr.Kind.TUPLE_LITERAL) || ((Expr.TupleLiteral) lhe).values.size() != j - i) {
      return i;
    }
    List<Expr> targets = ((Expr.TupleLiteral) lhe).values;
    for (int k = 0; k < targets.size(); k++) {
      Expr target = targets.get(k);
      if (!target.is(Expr.Kind.VARIABLE)) {
        return i;
      }
      Expr.Variable variable = (Expr.Variable) target;
      if (!variable.access.isEmpty() || !variable.name.equals(((Stmt.Declaration) stmts.get(i + k)).name)) {
        return i;
      }
    }
    return j + 1;
  }

  private String type(VariableType type, Expr.BusCall busCall) {
    switch (type.getKind()) {
      case VAR:       return "var ";
      case COMPONENT: return "component ";
      case SIGNAL: {
        VariableType.Signal signal = (VariableType.Signal) type;
        return "signal " + direction(signal.signalType) + tags(signal.tags);
      }
      case BUS: {
        VariableType.Bus bus = (VariableType.Bus) type;
        String args = busCall == null || busCall.args.isEmpty() ? "" : "(" + exprs(busCall.args) + ")";
        return bus.busName + args + " " + direction(bus.signalType) + tags(bus.tags);
      }
      default:
        throw new IllegalStateException("Internal error: unexpected variable type " + type);
    }
  }

  private static String direction(SignalType signalType) {
    return signalType.keyword == null ? "" : signalType.keyword + " ";
  }

  private static String tags(List<String> tags) {
    return tags.isEmpty() ? "" : "{" + String.join(", ", tags) + "} ";
  }

  private String symbol(Stmt.Declaration decl) {
    return decl.name + decl.dimensions.stream().map(dim -> "[" + dim.accept(this) + "]").collect(Collectors.joining());
  }

  @Override public String visitDeclaration(Stmt.Declaration stmt) {
    return type(stmt.xtype, null) + symbol(stmt) + ";";
  }

  @Override public String visitIfThenElse(Stmt.IfThenElse stmt) {
    String result = "if (" + stmt.cond.accept(this) + ") " + stmt.ifCase.accept(this);
    if (stmt.elseCase != null) {
      result += "\nelse " + stmt.elseCase.accept(this);
    }
    return result;
  }

  @Override public String visitWhile(Stmt.While stmt) {
    return "while (" + stmt.cond.accept(this) + ") " + stmt.body.accept(this);
  }

  @Override public String visitReturn(Stmt.Return stmt) {
    return "return " + stmt.value.accept(this) + ";";
  }

  @Override public String visitSubstitution(Stmt.Substitution stmt) {
    return stmt.var + access(stmt.access) + " " + stmt.op + " " + stmt.rhe.accept(this) + ";";
  }

  @Override public String visitMultiSubstitution(Stmt.MultiSubstitution stmt) {
    return stmt.lhe.accept(this) + " " + stmt.op + " " + stmt.rhe.accept(this) + ";";
  }

  @Override public String visitConstraintEquality(Stmt.ConstraintEquality stmt) {
    return stmt.lhe.accept(this) + " === " + stmt.rhe.accept(this) + ";";
  }

  @Override public String visitLogCall(Stmt.LogCall stmt) {
    String args = stmt.args.stream()
                           .map(arg -> arg instanceof LogArgument.LogString ? "\"" + ((LogArgument.LogString) arg).value + "\""
                                                                             : ((LogArgument.LogExpr) arg).expr.accept(this))
                           .collect(Collectors.joining(", "));
    return "log(" + args + ");";
  }

  @Override public String visitAssert(Stmt.Assert stmt) {
    return "assert(" + stmt.arg.accept(this) + ");";
  }

  @Override public String visitAnonymousComponentStmt(Stmt.AnonymousComponentStmt stmt) {
    return stmt.call.accept(this) + ";";
  }

  ///////////////////////////////////////

  // = Expr

  @Override public String visitVariable(Expr.Variable expr) {
    return expr.name + access(expr.access);
  }

  private String access(List<Access> access) {
    StringBuilder sb = new StringBuilder();
    for (Access item: access) {
      if (item instanceof Access.ArrayIndex) {
        sb.append('[').append(((Access.ArrayIndex) item).index.accept(this)).append(']');
      }
      else {
        sb.append('.').append(((Access.ComponentMember) item).name);
      }
    }
    return sb.toString();
  }

  @Override public String visitNumber(Expr.Number expr) {
    return expr.value.toString();
  }

  @Override public String visitInfixOp(Expr.InfixOp expr) {
    return "(" + expr.lhe.accept(this) + " " + expr.op + " " + expr.rhe.accept(this) + ")";
  }

  @Override public String visitPrefixOp(Expr.PrefixOp expr) {
    return "(" + expr.op + expr.rhe.accept(this) + ")";
  }

  @Override public String visitInlineSwitch(Expr.InlineSwitch expr) {
    return "(" + expr.cond.accept(this) + " ? " + expr.ifTrue.accept(this) + " : " + expr.ifFalse.accept(this) + ")";
  }

  @Override public String visitParallelOp(Expr.ParallelOp expr) {
    return "(parallel " + expr.rhe.accept(this) + ")";
  }

  @Override public String visitArrayLiteral(Expr.ArrayLiteral expr) {
    return "[" + exprs(expr.values) + "]";
  }

  @Override public String visitTupleLiteral(Expr.TupleLiteral expr) {
    return "(" + exprs(expr.values) + ")";
  }

  @Override public String visitUniformArray(Expr.UniformArray expr) {
    return expr.value.accept(this);
  }

  @Override public String visitCall(Expr.Call expr) {
    return expr.id + "(" + exprs(expr.args) + ")";
  }

  @Override public String visitBusCall(Expr.BusCall expr) {
    return expr.id + "(" + exprs(expr.args) + ")";
  }

  @Override public String visitAnonymousComponentCall(Expr.AnonymousComponentCall expr) {
    String signals;
    if (expr.names == null) {
      signals = exprs(expr.signals);
    }
    else {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < expr.signals.size(); i++) {
        Pair<AssignOp,String> name = expr.names.get(i);
        sb.append(i > 0 ? ", " : "").append(name.second).append(' ').append(name.first).append(' ').append(expr.signals.get(i).accept(this));
      }
      signals = sb.toString();
    }
    String call = expr.id + "(" + exprs(expr.params) + ")(" + signals + ")";
    return expr.isParallel ? "(parallel " + call + ")" : call;
  }

  private String exprs(List<Expr> exprs) {
    return exprs.stream().map(expr -> expr.accept(this)).collect(Collectors.joining(", "));
  }
}
