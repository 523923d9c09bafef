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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static io.circomj.TokenType.*;

/**
 * Recursive descent parser for the Circom language.
 * In general we try to avoid too much lookahead but there are a couple of places (bus
 * declarations and named signals of anonymous component calls) where lookahead is needed
 * to disambiguate the grammar. Usually a single token lookahead suffices.
 *
 * The parser never gives up on a file. Errors are thrown as CompileErrors from within the
 * productions and caught at the statement and top level where they are turned into Reports.
 * We then skip tokens to a point where parsing can resume and return a placeholder (an empty
 * Block) in place of what could not be parsed. Some errors (missing semicolon, unrecognised
 * pragma, version or include) are reported without throwing and parsing continues as though
 * the input had been correct.
 *
 * Compound declarations, compound assignments and for loops are rewritten as they are parsed
 * (see Desugarer) so the resulting AST only contains the canonical statement forms.
 */
class Parser {
  private final Tokeniser    tokeniser;
  private final ParseContext context;
  private       List<Report> reports = new ArrayList<>();

  // Current nesting of statements and expressions. Checked against maxNestingDepth so
  // that deeply nested input gives an error rather than a StackOverflowError.
  private int depth = 0;

  Parser(Tokeniser tokeniser, ParseContext context) {
    this.tokeniser = tokeniser;
    this.context   = context;
  }

  List<Report> getReports() {
    return reports;
  }

  ////////////////////////////////////////////

  // = Program

  /**
   *# parseProgram -> pragma* include* ( definition | mainComponent )* EOF ;
   */
  Program parseProgram() {
    List<Pragma>     pragmas       = new ArrayList<>();
    List<String>     includes      = new ArrayList<>();
    List<Definition> definitions   = new ArrayList<>();
    MainComponent    mainComponent = null;

    // 0 - pragmas, 1 - includes, 2 - definitions, 3 - after main component
    int stage = 0;
    while (peek().isNot(EOF)) {
      Token start = peek();
      try {
        if (matchAny(PRAGMA)) {
          if (stage > 0) {
            report(ReportCode.IllegalExpression, "Pragma must appear before includes and definitions", start);
          }
          pragmas.add(pragma(start));
        }
        else
        if (matchAny(INCLUDE)) {
          if (stage > 1) {
            report(ReportCode.IllegalExpression, "Include must appear before definitions", start);
          }
          stage = Math.max(stage, 1);
          includes.add(include(start));
        }
        else
        if (peek().is(FUNCTION, TEMPLATE, BUS)) {
          if (stage > 2) {
            report(ReportCode.IllegalExpression, "Definitions must appear before the main component", start);
          }
          stage = Math.max(stage, 2);
          definitions.add(definition());
        }
        else
        if (matchAny(COMPONENT)) {
          MainComponent main = mainComponent(start);
          if (mainComponent != null) {
            reports.add(new Report(ReportCode.MultipleMain, "Main component already declared", main.span, start));
          }
          else {
            mainComponent = main;
          }
          stage = 3;
        }
        else {
          unexpected("Expecting pragma, include, function, template, bus or main component");
        }
      }
      catch (CompileError e) {
        report(e, start);
        skipToTopLevel(start);
      }
    }
    String source = tokeniser.getSource();
    return new Program(new SourceSpan(0, source.length(), context.getFileId()), pragmas, includes, definitions, mainComponent);
  }

  /**
   *# pragma -> "pragma" ( "circom" VERSION | "custom_templates" ) ";" ;
   */
  private Pragma pragma(Token start) {
    if (matchAny(CIRCOM)) {
      if (matchAny(VERSION)) {
        int[] version = (int[]) previous().getValue();
        SourceSpan span = span(start);
        expectSemicolon();
        return new Pragma.Version(span, version[0], version[1], version[2]);
      }
      Token versionStart = peek();
      skipToSemicolon();
      report(ReportCode.UnrecognizedVersion, "Unrecognized version: expecting major.minor.patch", versionStart, skippedSpan(versionStart));
      return new Pragma.Unrecognized(skippedSpan(start));
    }
    if (matchAny(CUSTOM_TEMPLATES)) {
      SourceSpan span = span(start);
      expectSemicolon();
      return new Pragma.CustomGates(span);
    }
    Token pragmaStart = peek();
    skipToSemicolon();
    report(ReportCode.UnrecognizedPragma, "Unrecognized pragma: expecting 'circom' or 'custom_templates'", pragmaStart, skippedSpan(pragmaStart));
    return new Pragma.Unrecognized(skippedSpan(start));
  }

  /**
   *# include -> "include" STRING_CONST ";" ;
   */
  private String include(Token start) {
    if (matchAny(STRING_CONST)) {
      String path = previous().getStringValue();
      expectSemicolon();
      return path;
    }
    Token includeStart = peek();
    skipToSemicolon();
    report(ReportCode.UnrecognizedInclude, "Unrecognized include: expecting quoted path", includeStart, skippedSpan(includeStart));
    return "";
  }

  /**
   *# definition -> "function" IDENTIFIER parameters block
   *#             | "template" ( "custom" | "parallel" )* IDENTIFIER parameters block
   *#             | "bus" IDENTIFIER parameters? block
   *#             ;
   */
  private Definition definition() {
    Token start = advance();
    boolean isCustom   = false;
    boolean isParallel = false;
    if (start.is(TEMPLATE)) {
      while (peek().is(CUSTOM, PARALLEL)) {
        Token modifier = advance();
        if (modifier.is(CUSTOM)) {
          isCustom = true;
        }
        else {
          isParallel = true;
        }
      }
    }
    String name = expect(IDENTIFIER).getStringValue();

    Token paramStart = peek();
    List<String> params = List.of();
    SourceSpan   argLocation;
    if (start.is(BUS) && peek().isNot(LEFT_PAREN)) {
      argLocation = new SourceSpan(previous().getEnd(), previous().getEnd(), context.getFileId());
    }
    else {
      params      = parameters();
      argLocation = span(paramStart);
    }

    Stmt.Block body = block();
    SourceSpan span = span(start);
    switch (start.getType()) {
      case FUNCTION: return new Definition.Function(span, name, params, argLocation, body);
      case TEMPLATE: return new Definition.Template(span, name, params, argLocation, body, isParallel, isCustom);
      case BUS:      return new Definition.Bus(span, name, params, argLocation, body);
      default:
        throw new IllegalStateException("Internal error: unexpected definition type " + start.getType());
    }
  }

  /**
   *# parameters -> "(" ( IDENTIFIER ( "," IDENTIFIER )* )? ")" ;
   */
  private List<String> parameters() {
    expect(LEFT_PAREN);
    List<String> params = new ArrayList<>();
    if (matchAny(RIGHT_PAREN)) {
      return params;
    }
    do {
      params.add(expect(IDENTIFIER).getStringValue());
    } while (matchAny(COMMA));
    expect(RIGHT_PAREN);
    return params;
  }

  /**
   *# mainComponent -> "component" "main" ( "{" "public" "[" IDENTIFIER ( "," IDENTIFIER )* "]" "}" )?
   *#                  "=" expression ";" ;
   */
  private MainComponent mainComponent(Token start) {
    expect(MAIN);
    List<String> publicSignals = new ArrayList<>();
    if (matchAny(LEFT_BRACE)) {
      expect(PUBLIC);
      expect(LEFT_SQUARE);
      if (!matchAny(RIGHT_SQUARE)) {
        do {
          publicSignals.add(expect(IDENTIFIER).getStringValue());
        } while (matchAny(COMMA));
        expect(RIGHT_SQUARE);
      }
      expect(RIGHT_BRACE);
    }
    expect(EQUAL);
    Expr initializer = expression();
    SourceSpan span = span(start);
    expectSemicolon();
    return new MainComponent(span, publicSignals, initializer);
  }

  /**
   * After an error at the top level skip tokens until we find something that can
   * start a new top level item. We always skip at least one token.
   */
  private void skipToTopLevel(Token start) {
    if (peek() == start && peek().isNot(EOF)) {
      advance();
    }
    while (!isTopLevelStart()) {
      advance();
    }
  }

  private boolean isTopLevelStart() {
    return peek().is(EOF, FUNCTION, TEMPLATE, BUS, PRAGMA, INCLUDE) ||
           lookahead(() -> matchAny(COMPONENT), () -> matchAny(MAIN));
  }

  /**
   * Skip to and consume the next ';'. We stop without consuming anything further if we
   * reach something that can only start a new top level item.
   */
  private void skipToSemicolon() {
    while (peek().isNot(SEMICOLON, EOF, FUNCTION, TEMPLATE, BUS, PRAGMA, INCLUDE)) {
      advance();
    }
    matchAny(SEMICOLON);
  }

  ////////////////////////////////////////////

  // = Stmt

  private static final List<TokenType> varAssignOps    = List.of(EQUAL);
  private static final List<TokenType> signalAssignOps = List.of(LEFT_CONSTRAINT_ASSIGN, LEFT_SIGNAL_ASSIGN);

  /**
   *# block -> "{" statement* "}" ;
   */
  private Stmt.Block block() {
    Token start = expect(LEFT_BRACE);
    List<Stmt> stmts = new ArrayList<>();
    while (peek().isNot(RIGHT_BRACE, EOF)) {
      stmts.addAll(statementWithRecovery());
    }
    if (!matchAny(RIGHT_BRACE)) {
      report(ReportCode.IllegalExpression, "Unexpected EOF: missing '}'", peek());
    }
    return new Stmt.Block(span(start), stmts);
  }

  /**
   * Parse a statement and if we get an error then report it, skip to the end of the
   * statement and return an empty block in its place.
   */
  private List<Stmt> statementWithRecovery() {
    Token start = peek();
    try {
      return statement();
    }
    catch (CompileError e) {
      report(e, start);
      skipStatement(start);
      return List.of(Desugarer.placeholder(span(start)));
    }
  }

  /**
   * Skip to the end of the statement in which an error occurred. We consume up to and
   * including the next ';' or up to the '}' that closes the first block we skip into. We
   * stop before a '}' that closes the enclosing block. We always skip at least one token.
   */
  private void skipStatement(Token start) {
    if (peek() == start && peek().isNot(EOF, RIGHT_BRACE)) {
      Token token = advance();
      if (token.is(SEMICOLON)) {
        return;
      }
      if (token.is(LEFT_BRACE)) {
        skipBlock();
        return;
      }
    }
    while (peek().isNot(EOF, RIGHT_BRACE)) {
      Token token = advance();
      if (token.is(SEMICOLON)) {
        return;
      }
      if (token.is(LEFT_BRACE)) {
        skipBlock();
        return;
      }
    }
  }

  private void skipBlock() {
    int braces = 1;
    while (braces > 0 && peek().isNot(EOF)) {
      Token token = advance();
      if (token.is(LEFT_BRACE))  { braces++; }
      if (token.is(RIGHT_BRACE)) { braces--; }
    }
  }

  /**
   * A statement where only a single statement is allowed (body of if/while/for). Declarations
   * desugar to multiple statements in which case we wrap them in a Block.
   */
  private Stmt singleStatement() {
    Token start = peek();
    List<Stmt> stmts = statementWithRecovery();
    return stmts.size() == 1 ? stmts.get(0) : new Stmt.Block(span(start), stmts);
  }

  /**
   *# statement -> block
   *#            | ifStmt
   *#            | whileStmt
   *#            | forStmt
   *#            | "return" expression ";"
   *#            | "log" "(" ( logArg ( "," logArg )* )? ")" ";"
   *#            | "assert" "(" expression ")" ";"
   *#            | declaration ";"
   *#            | substitution ";"
   *#            ;
   * Returns a list since declarations are split into multiple statements that become
   * siblings within the enclosing block.
   */
  private List<Stmt> statement() {
    return nested(peek(), () -> {
      Token start = peek();
      if (peek().is(LEFT_BRACE)) { return List.of(block()); }
      if (matchAny(IF))          { return List.of(ifStmt(start)); }
      if (matchAny(WHILE))       { return List.of(whileStmt(start)); }
      if (matchAny(FOR))         { return List.of(forStmt(start)); }
      if (matchAny(RETURN)) {
        Expr value = expression();
        SourceSpan span = span(start);
        expectSemicolon();
        return List.of(new Stmt.Return(span, value));
      }
      if (matchAny(LOG)) {
        Stmt.LogCall logCall = logCall(start);
        expectSemicolon();
        return List.of(logCall);
      }
      if (matchAny(ASSERT)) {
        expect(LEFT_PAREN);
        Expr arg = expression();
        expect(RIGHT_PAREN);
        SourceSpan span = span(start);
        expectSemicolon();
        return List.of(new Stmt.Assert(span, arg));
      }
      if (matchAny(PLUS_PLUS, MINUS_MINUS)) {
        return List.of(prefixIncrement(start));
      }
      List<Stmt> stmts;
      if (isDeclaration()) {
        stmts = declaration();
      }
      else {
        stmts = List.of(substitution());
      }
      expectSemicolon();
      return stmts;
    });
  }

  /**
   *# ifStmt -> "if" "(" expression ")" statement ( "else" statement )? ;
   * An "else" always binds to the innermost "if" that does not already have one.
   * Chains of "else if" are parsed iteratively so that a long chain does not count
   * towards the nesting depth.
   */
  private Stmt.IfThenElse ifStmt(Token start) {
    List<Token> starts   = new ArrayList<>();
    List<Expr>  conds    = new ArrayList<>();
    List<Stmt>  ifCases  = new ArrayList<>();
    Stmt        elseCase = null;
    Token       ifStart  = start;
    Expr        cond     = condition();
    while (true) {
      starts.add(ifStart);
      conds.add(cond);
      ifCases.add(singleStatement());
      if (!matchAny(ELSE)) {
        break;
      }
      if (!matchAny(IF)) {
        elseCase = singleStatement();
        break;
      }
      ifStart = previous();
      try {
        cond = condition();
      }
      catch (CompileError e) {
        report(e, ifStart);
        skipStatement(ifStart);
        elseCase = Desugarer.placeholder(span(ifStart));
        break;
      }
    }
    // Every "if" in the chain ends where the last one ends
    for (int i = starts.size() - 1; i >= 0; i--) {
      elseCase = new Stmt.IfThenElse(span(starts.get(i)), conds.get(i), ifCases.get(i), elseCase);
    }
    return (Stmt.IfThenElse) elseCase;
  }

  private Expr condition() {
    expect(LEFT_PAREN);
    Expr cond = expression();
    expect(RIGHT_PAREN);
    return cond;
  }

  /**
   *# whileStmt -> "while" "(" expression ")" statement ;
   */
  private Stmt.While whileStmt(Token start) {
    Expr cond = condition();
    Stmt body = singleStatement();
    return new Stmt.While(span(start), cond, body);
  }

  /**
   *# forStmt -> "for" "(" ( declaration | substitution ) ";" expression ";" substitution ")" statement ;
   * Turned into: { init; while (cond) { body; step; } }
   */
  private Stmt.Block forStmt(Token start) {
    expect(LEFT_PAREN);
    List<Stmt> init = isDeclaration() ? declaration() : List.of(substitution());
    expect(SEMICOLON);
    Expr cond = expression();
    expect(SEMICOLON);
    List<Stmt> step = List.of(substitution());
    expect(RIGHT_PAREN);
    Stmt body = singleStatement();
    return Desugarer.lowerFor(span(start), init, cond, step, body);
  }

  /**
   *# logArg -> STRING_CONST | expression ;
   */
  private Stmt.LogCall logCall(Token start) {
    expect(LEFT_PAREN);
    List<LogArgument> args = new ArrayList<>();
    if (!matchAny(RIGHT_PAREN)) {
      do {
        if (matchAny(STRING_CONST)) {
          args.add(new LogArgument.LogString(previous().getStringValue()));
        }
        else {
          args.add(new LogArgument.LogExpr(expression()));
        }
      } while (matchAny(COMMA));
      expect(RIGHT_PAREN);
    }
    return new Stmt.LogCall(span(start), args);
  }

  /**
   * "++x" and "--x" are not supported. We report an error and carry on with an empty block.
   */
  private Stmt prefixIncrement(Token start) {
    Token operator = previous();
    expression();
    SourceSpan span = span(start);
    reports.add(new Report(ReportCode.IllegalExpression,
                           "Prefix '" + operator.getChars() + "' not supported: use the postfix form",
                           span, start));
    expectSemicolon();
    return Desugarer.placeholder(span);
  }

  private boolean isDeclaration() {
    return peek().is(VAR, SIGNAL, COMPONENT) || isBusDeclaration();
  }

  /**
   * A bus declaration starts with the bus name (and optional bus parameters) followed by
   * the signal direction, tags or the first symbol.
   *   Point p;    Point(2) input {tag} p;
   */
  private boolean isBusDeclaration() {
    return peek().is(IDENTIFIER) &&
           lookahead(() -> matchAny(IDENTIFIER),
                     () -> !matchAny(LEFT_PAREN) || expressionList(RIGHT_PAREN) != null,
                     () -> peek().is(IDENTIFIER, INPUT, OUTPUT, LEFT_BRACE));
  }

  /**
   *# declaration -> "var" symbols
   *#              | "component" symbols
   *#              | "signal" ( "input" | "output" )? tags? symbols tags?
   *#              | IDENTIFIER ( "(" expressionList ")" )? ( "input" | "output" )? tags? symbols tags?
   *#              ;
   *# symbols     -> "(" symbol ( "," symbol )* ")" ( assignOp expression )?
   *#              | symbol ( assignOp expression )? ( "," symbol ( assignOp expression )? )*
   *#              ;
   *# symbol      -> IDENTIFIER ( "[" expression "]" )* ;
   *# tags        -> "{" IDENTIFIER ( "," IDENTIFIER )* "}" ;
   */
  private List<Stmt> declaration() {
    Token start = peek();
    if (matchAny(VAR, COMPONENT)) {
      VariableType type = previous().is(VAR) ? VariableType.VAR : VariableType.COMPONENT;
      String what = previous().getChars();
      if (peek().is(LEFT_PAREN)) {
        return tupleDeclaration(start, type, what, varAssignOps);
      }
      List<Symbol> symbols = symbols(what, varAssignOps);
      return Desugarer.splitDeclaration(span(start), type, symbols, context.initializeVars());
    }

    if (matchAny(SIGNAL)) {
      SignalType   signalType = signalType();
      List<String> tags       = tags();
      if (peek().is(LEFT_PAREN)) {
        VariableType type = new VariableType.Signal(signalType, tags);
        return tupleDeclaration(start, type, "signal", signalAssignOps);
      }
      List<Symbol> symbols = symbols("signal", signalAssignOps);
      List<String> allTags = new ArrayList<>(tags);
      allTags.addAll(tags());
      VariableType type = new VariableType.Signal(signalType, allTags);
      return Desugarer.splitDeclaration(span(start), type, symbols, context.initializeVars());
    }

    // Bus declaration
    String     busName = expect(IDENTIFIER).getStringValue();
    List<Expr> args    = matchAny(LEFT_PAREN) ? expressionList(RIGHT_PAREN) : List.of();
    Expr.BusCall busCall = new Expr.BusCall(span(start), busName, args);

    SignalType   signalType = signalType();
    List<String> tags       = new ArrayList<>(tags());
    List<Symbol> symbols    = symbols("bus", signalAssignOps);
    tags.addAll(tags());
    VariableType.Bus type = new VariableType.Bus(busName, signalType, tags);
    return Desugarer.splitBusDeclaration(span(start), type, symbols, busCall);
  }

  /**
   * Declaration of a parenthesised list of symbols with an optional shared initialiser:
   *   var (a, b[2], c) = f();
   */
  private List<Stmt> tupleDeclaration(Token start, VariableType type, String what, List<TokenType> assignOps) {
    expect(LEFT_PAREN);
    List<Symbol> symbols = new ArrayList<>();
    do {
      symbols.add(symbol());
    } while (matchAny(COMMA));
    expect(RIGHT_PAREN);
    if (!peek().getType().isAssignment()) {
      return Desugarer.splitDeclaration(span(start), type, symbols, context.initializeVars());
    }
    AssignOp op   = assignOp(what, assignOps);
    Expr     init = expression();
    return Desugarer.splitTupleDeclaration(span(start), type, symbols, op, init);
  }

  private List<Symbol> symbols(String what, List<TokenType> assignOps) {
    List<Symbol> symbols = new ArrayList<>();
    do {
      Token  start  = peek();
      Symbol symbol = symbol();
      if (peek().getType().isAssignment()) {
        AssignOp op   = assignOp(what, assignOps);
        Expr     init = expression();
        symbol = new Symbol(span(start), symbol.name, symbol.dimensions, op, init);
      }
      symbols.add(symbol);
    } while (matchAny(COMMA));
    return symbols;
  }

  private Symbol symbol() {
    Token      start      = peek();
    String     name       = expect(IDENTIFIER).getStringValue();
    List<Expr> dimensions = new ArrayList<>();
    while (matchAny(LEFT_SQUARE)) {
      dimensions.add(expression());
      expect(RIGHT_SQUARE);
    }
    return new Symbol(span(start), name, dimensions);
  }

  /**
   * Consume the assignment operator of a declaration making sure that it is one that
   * is allowed for what is being declared.
   */
  private AssignOp assignOp(String what, List<TokenType> allowed) {
    Token operator = advance();
    if (!allowed.contains(operator.getType())) {
      throw new CompileError("Operator '" + operator.getChars() + "' cannot be used to initialise " + what +
                             ": expecting " + allowed.stream().map(t -> "'" + t + "'").collect(Collectors.joining(" or ")),
                             operator);
    }
    return AssignOp.of(operator.getType());
  }

  private SignalType signalType() {
    if (matchAny(INPUT))  { return SignalType.INPUT; }
    if (matchAny(OUTPUT)) { return SignalType.OUTPUT; }
    return SignalType.INTERMEDIATE;
  }

  private List<String> tags() {
    List<String> tags = new ArrayList<>();
    if (matchAny(LEFT_BRACE)) {
      do {
        tags.add(expect(IDENTIFIER).getStringValue());
      } while (matchAny(COMMA));
      expect(RIGHT_BRACE);
    }
    return tags;
  }

  /**
   *# substitution -> expression ( ( "=" | "<--" | "<==" | "-->" | "==>" | "===" | compoundOp ) expression
   *#                            | "++" | "--" )? ;
   * Without an operator the expression must be an anonymous component call.
   */
  private Stmt substitution() {
    Token start = peek();
    Expr  lhe   = expression();
    Token operator = peek();
    if (matchAny(EQUAL, LEFT_SIGNAL_ASSIGN, LEFT_CONSTRAINT_ASSIGN)) {
      Expr rhe = expression();
      return Desugarer.substitution(span(start), lhe, AssignOp.of(operator.getType()), rhe, operator);
    }
    if (matchAny(RIGHT_SIGNAL_ASSIGN, RIGHT_CONSTRAINT_ASSIGN)) {
      // a ==> b is b <== a
      Expr rhe = expression();
      return Desugarer.substitution(span(start), rhe, AssignOp.of(operator.getType()), lhe, operator);
    }
    if (matchAny(TRIPLE_EQUAL)) {
      Expr rhe = expression();
      return new Stmt.ConstraintEquality(span(start), lhe, rhe);
    }
    if (operator.getType().isCompoundAssignment()) {
      advance();
      Expr rhe = expression();
      return Desugarer.compoundAssignment(span(start), variable(lhe, operator), operator.getType(), rhe);
    }
    if (matchAny(PLUS_PLUS, MINUS_MINUS)) {
      return Desugarer.increment(span(start), variable(lhe, operator), operator.getType(), context.one());
    }
    if (lhe.is(Expr.Kind.ANONYMOUS_COMPONENT_CALL)) {
      return new Stmt.AnonymousComponentStmt(span(start), (Expr.AnonymousComponentCall) lhe);
    }
    if (peek().isNot(SEMICOLON, RIGHT_BRACE, RIGHT_PAREN, EOF)) {
      unexpected("Expecting assignment or constraint operator");
    }
    SourceSpan span = span(start);
    reports.add(new Report(ReportCode.IllegalExpression,
                           "Expression statement must be a substitution, constraint or anonymous component call",
                           span, start));
    return Desugarer.placeholder(span);
  }

  private Expr.Variable variable(Expr expr, Token operator) {
    if (!expr.is(Expr.Kind.VARIABLE)) {
      throw new CompileError(ReportCode.IllegalExpression, "Invalid target for '" + operator.getChars() + "': expecting variable", operator, expr.span);
    }
    return (Expr.Variable) expr;
  }

  ////////////////////////////////////////////

  // = Expr

  private static final List<TokenType> unaryOps = List.of(BANG, GRAVE, MINUS);

  // Operators from least precedence to highest precedence. Each entry in list is
  // a pair of a boolean and a list of the operators at that level of precedence.
  // The boolean indicates whether the operators are left-associative (true) or
  // right-associative (false).
  private static final List<Pair<Boolean,List<TokenType>>> operatorsByPrecedence =
    List.of(
      // Ternary and parallel are handled separately before these
      Pair.create(true, List.of(PIPE_PIPE)),
      Pair.create(true, List.of(AMPERSAND_AMPERSAND)),
      Pair.create(true, List.of(EQUAL_EQUAL, BANG_EQUAL, LESS_THAN, GREATER_THAN, LESS_THAN_EQUAL, GREATER_THAN_EQUAL)),
      Pair.create(true, List.of(PIPE)),
      Pair.create(true, List.of(ACCENT)),
      Pair.create(true, List.of(AMPERSAND)),
      Pair.create(true, List.of(DOUBLE_LESS_THAN, DOUBLE_GREATER_THAN)),
      Pair.create(true, List.of(PLUS, MINUS)),
      Pair.create(true, List.of(STAR, SLASH, BACKSLASH, PERCENT)),
      Pair.create(false, List.of(STAR_STAR)),
      Pair.create(true, unaryOps)
    );

  /**
   *# expression -> "parallel"? ternary ;
   */
  private Expr expression() {
    return nested(peek(), () -> {
      if (matchAny(PARALLEL)) {
        Token start = previous();
        Expr  expr  = ternary();
        SourceSpan span = span(start);
        if (expr.is(Expr.Kind.ANONYMOUS_COMPONENT_CALL)) {
          return ((Expr.AnonymousComponentCall) expr).asParallel(span);
        }
        return new Expr.ParallelOp(span, expr);
      }
      return ternary();
    });
  }

  /**
   *# ternary -> orExpression ( "?" orExpression ":" orExpression )? ;
   * Operands of the ternary cannot themselves be ternaries unless parenthesised.
   */
  private Expr ternary() {
    Token start = peek();
    Expr  cond  = parseExpression(0);
    if (!matchAny(QUESTION)) {
      return cond;
    }
    Expr ifTrue = parseExpression(0);
    if (peek().isNot(QUESTION)) {
      expect(COLON);
      Expr ifFalse = parseExpression(0);
      if (peek().isNot(QUESTION)) {
        return new Expr.InlineSwitch(span(start), cond, ifTrue, ifFalse);
      }
    }
    Token question = peek();
    throw new CompileError(ReportCode.IllegalExpression, "Nested ternary must be parenthesised", question,
                           new SourceSpan(start.getOffset(), question.getEnd(), context.getFileId()));
  }

  /**
   * Precedence climbing over the binary operators. We check whether the current level of
   * precedence corresponds to the unary ops and return unary() if that is the case.
   */
  private Expr parseExpression(int level) {
    // Get list of operators at this level of precedence along with flag
    // indicating whether they are left-associative or not.
    var operatorsPair = operatorsByPrecedence.get(level);
    boolean isLeftAssociative = operatorsPair.first;
    List<TokenType> operators = operatorsPair.second;

    if (operators == unaryOps) {
      return unary(level);
    }

    Token start = peek();
    Expr  expr  = parseExpression(level + 1);
    while (matchAny(operators)) {
      Token operator = previous();
      Expr rhs = isLeftAssociative ? parseExpression(level + 1)
                                   : nested(operator, () -> parseExpression(level));
      expr = new Expr.InfixOp(span(start), expr, ExpressionInfixOpcode.of(operator.getType()), rhs);
    }
    return expr;
  }

  /**
   *# unary -> ( "!" | "~" | "-" ) unary
   *#        | primary ;
   */
  private Expr unary(int level) {
    if (matchAny(unaryOps)) {
      Token operator = previous();
      Expr  operand  = nested(operator, () -> unary(level));
      return new Expr.PrefixOp(span(operator), ExpressionPrefixOpcode.of(operator.getType()), operand);
    }
    return primary();
  }

  /**
   *# primary -> "_"
   *#          | NUMBER
   *#          | IDENTIFIER "(" expressionList ")" ( "(" signals ")" )?
   *#          | IDENTIFIER access*
   *#          | "[" expressionList "]"
   *#          | "(" expression ( "," expression )* ")"
   *#          ;
   *# access  -> "[" expression "]" | "." IDENTIFIER ;
   */
  private Expr primary() {
    Token start = peek();
    if (matchAny(UNDERSCORE)) {
      return new Expr.Variable(span(start), "_", List.of());
    }
    if (matchAny(NUMBER)) {
      return new Expr.Number(span(start), (BigInteger) previous().getValue());
    }
    if (matchAny(IDENTIFIER)) {
      String name = previous().getStringValue();
      if (matchAny(LEFT_PAREN)) {
        List<Expr> args = expressionList(RIGHT_PAREN);
        if (matchAny(LEFT_PAREN)) {
          return anonymousComponentCall(start, name, args);
        }
        return new Expr.Call(span(start), name, args);
      }
      List<Access> access = new ArrayList<>();
      while (peek().is(LEFT_SQUARE, DOT)) {
        if (matchAny(LEFT_SQUARE)) {
          access.add(new Access.ArrayIndex(expression()));
          expect(RIGHT_SQUARE);
        }
        else {
          advance();
          access.add(new Access.ComponentMember(expect(IDENTIFIER).getStringValue()));
        }
      }
      return new Expr.Variable(span(start), name, access);
    }
    if (matchAny(LEFT_SQUARE)) {
      List<Expr> values = expressionList(RIGHT_SQUARE);
      return new Expr.ArrayLiteral(span(start), values);
    }
    if (matchAny(LEFT_PAREN)) {
      List<Expr> values = expressionList(RIGHT_PAREN);
      if (values.isEmpty()) {
        throw new CompileError("Empty parentheses: expecting expression", start);
      }
      // Single expression in parentheses is just grouping
      return values.size() == 1 ? values.get(0) : new Expr.TupleLiteral(span(start), values);
    }
    unexpected("Expecting expression");
    return null;
  }

  /**
   *# signals -> ( signal ( "," signal )* )? ;
   *# signal  -> ( IDENTIFIER ( "=" | "<==" | "<--" ) )? expression ;
   * Signals must either all be named or all be positional.
   */
  private Expr anonymousComponentCall(Token start, String name, List<Expr> params) {
    List<Expr>                  signals    = new ArrayList<>();
    List<Pair<AssignOp,String>> names      = new ArrayList<>();
    int                         positional = 0;
    if (!matchAny(RIGHT_PAREN)) {
      do {
        if (lookahead(() -> matchAny(IDENTIFIER), () -> matchAny(EQUAL, LEFT_CONSTRAINT_ASSIGN, LEFT_SIGNAL_ASSIGN))) {
          String signalName = expect(IDENTIFIER).getStringValue();
          Token  operator   = advance();
          names.add(Pair.create(AssignOp.of(operator.getType()), signalName));
        }
        else {
          positional++;
        }
        signals.add(expression());
      } while (matchAny(COMMA));
      expect(RIGHT_PAREN);
    }
    if (!names.isEmpty() && positional > 0) {
      throw new CompileError(ReportCode.IllegalExpression,
                             "Signals of anonymous component '" + name + "' must be either all named or all positional",
                             start, span(start));
    }
    return new Expr.AnonymousComponentCall(span(start), name, false, params, signals, names.isEmpty() ? null : names);
  }

  /**
   *# expressionList -> ( expression ( "," expression )* )? endToken ;
   */
  private List<Expr> expressionList(TokenType endToken) {
    List<Expr> exprs = new ArrayList<>();
    if (matchAny(endToken)) {
      return exprs;
    }
    do {
      exprs.add(expression());
    } while (matchAny(COMMA));
    expect(endToken);
    return exprs;
  }

  /////////////////////////////////////////////////

  private Token advance() {
    return tokeniser.next();
  }

  private Token peek() {
    return tokeniser.peek();
  }

  private Token previous() {
    return tokeniser.previous();
  }

  /**
   * Check if next token matches any of the given types. If it matches then consume the token and return true.
   * If it does not match one of the types then return false and stay in current position in stream of tokens.
   *
   * @param types the types to match against
   * @return true if next token matches, false is not
   */
  private boolean matchAny(TokenType... types) {
    if (peek().is(types)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean matchAny(List<TokenType> types) {
    return matchAny(types.toArray(TokenType[]::new));
  }

  /**
   * Provide lookahead by remembering current token and state then checking that the list
   * of lambdas all return true. Each lambda should check for a token or invoke one of the
   * productions to partially parse some syntax. If the lambda returns false or throws a
   * CompileError then it is deemed to have failed and lookahead stops at that point.
   * Either way, we rewind to the point where we were at and restore our state.
   * @param lambdas  array of lambdas returning true/false
   */
  @SafeVarargs
  private boolean lookahead(Supplier<Boolean>... lambdas) {
    // Remember current state
    Token        previous       = previous();
    Token        current        = peek();
    List<Report> currentReports = new ArrayList<>(reports);
    int          currentDepth   = depth;
    try {
      for (Supplier<Boolean> lambda: lambdas) {
        try {
          if (!lambda.get()) {
            return false;
          }
        }
        catch (CompileError e) {
          return false;
        }
      }
      return true;
    }
    finally {
      // Restore state
      tokeniser.rewind(previous, current);
      reports = currentReports;
      depth   = currentDepth;
    }
  }

  /**
   * Run a production one level further down in the nesting of statements/expressions.
   */
  private <T> T nested(Token location, Supplier<T> production) {
    if (depth >= context.getMaxNestingDepth()) {
      throw new CompileError(ReportCode.NestingTooDeep,
                             "Nesting too deep: exceeds maximum depth of " + context.getMaxNestingDepth(), location);
    }
    depth++;
    try {
      return production.get();
    }
    finally {
      depth--;
    }
  }

  /**
   * Report a missing ';' at the end of the previous token and carry on as though it had been there.
   */
  private void expectSemicolon() {
    if (matchAny(SEMICOLON)) {
      return;
    }
    int end = previous() == null ? 0 : previous().getEnd();
    reports.add(new Report(ReportCode.MissingSemicolon, "Missing ';'",
                           new SourceSpan(end, end, context.getFileId()),
                           Location.at(tokeniser.getSource(), end)));
  }

  private void unexpected(String msg) {
    Token token = peek();
    if (token.isError()) {
      throw new CompileError(ReportCode.IllegalExpression, token.getStringValue(), token, tokenSpan(token));
    }
    if (token.is(EOF)) {
      throw new CompileError(ReportCode.IllegalExpression, "Unexpected EOF: " + msg, token, tokenSpan(token));
    }
    throw new CompileError(ReportCode.IllegalExpression, "Unexpected token '" + token.getChars() + "': " + msg, token, tokenSpan(token));
  }

  /**
   * Expect one of the given types and throw an error if no match. Consume and return the token matched.
   *
   * @param types types to match against
   * @return the matched token or throw error if no match
   */
  private Token expect(TokenType... types) {
    if (matchAny(types)) {
      return previous();
    }
    if (types.length > 1) {
      unexpected("Expecting one of " +
                 Arrays.stream(types)
                       .map(Enum::toString)
                       .map(t -> "'" + t + "'")
                       .collect(Collectors.joining(", ")));
    }
    else {
      var expected = types[0].is(IDENTIFIER) ? "identifier" : "'" + types[0] + "'";
      unexpected("Expecting " + expected);
    }
    return null;
  }

  private void report(ReportCode code, String msg, Token token) {
    reports.add(new Report(code, msg, tokenSpan(token), token));
  }

  private void report(ReportCode code, String msg, Location location, SourceSpan span) {
    reports.add(new Report(code, msg, span, location));
  }

  private void report(CompileError error, Token start) {
    SourceSpan span = error.getSpan();
    if (span == null) {
      span = error.getLocation() instanceof Token ? tokenSpan((Token) error.getLocation()) : tokenSpan(start);
    }
    reports.add(new Report(error.getCode(), error.getErrorMessage(), span, error.getLocation()));
  }

  /**
   * Span from start of given token to end of the last token consumed.
   */
  private SourceSpan span(Token start) {
    Token last = previous();
    int   end  = last == null ? start.getOffset() : Math.max(start.getOffset(), last.getEnd());
    return new SourceSpan(start.getOffset(), end, context.getFileId());
  }

  /**
   * Span of tokens skipped by skipToSemicolon() not including the ';' itself.
   */
  private SourceSpan skippedSpan(Token start) {
    if (previous() == null || previous().isNot(SEMICOLON)) {
      return span(start);
    }
    if (start == previous()) {
      return new SourceSpan(start.getOffset(), start.getOffset(), context.getFileId());
    }
    Token last = start;
    for (Token token = start; token != previous() && token.getNext() != null; token = token.getNext()) {
      last = token;
    }
    return new SourceSpan(start.getOffset(), last.getEnd(), context.getFileId());
  }

  private SourceSpan tokenSpan(Token token) {
    return new SourceSpan(token.getOffset(), token.getEnd(), context.getFileId());
  }
}
