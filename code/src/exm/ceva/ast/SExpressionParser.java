/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.ceva.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.tree.Tree;
import org.apache.log4j.Logger;

import exm.ceva.ast.antlr.ContractLexer;
import exm.ceva.ast.antlr.ContractParser;
import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.exceptions.UserException;
import exm.ceva.common.lang.Builtins;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Operators.BinaryOp;
import exm.ceva.common.lang.Operators.UnaryOp;
import exm.ceva.common.lang.SourceSpan;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;
import exm.ceva.common.lang.Value;

/**
 * Reads contract and body expressions written as S-expressions, e.g.
 * (&& (>= result min) (<= result max)), and assigns static types from a
 * Scope.
 *
 * The text is parsed by the generated ContractParser into a tree of
 * LIST, BLOCK and atom nodes, which is walked here.
 * Statement bodies use the same notation, see parseBody().
 *
 * Unsuffixed integer literals take the type of the other operand of the
 * operator they appear under, so (< x 10) with x:u8 compares two u8s.
 */
public class SExpressionParser {

  private static final Logger logger = Logging.getCevaLogger();

  private static final Pattern INT_LIT =
              Pattern.compile("(-?[0-9]+)((?:i|u)(?:8|16|32|64))?");
  private static final Pattern REAL_LIT =
              Pattern.compile("-?[0-9]+\\.[0-9]+(?:[eE]-?[0-9]+)?");
  private static final Pattern IDENT =
              Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.]*");

  private final Scope scope;
  private final String text;
  private final String file;
  private final int firstLine;
  private SourceSpan span;

  /** Integer literals whose type may still be adjusted by context */
  private final Map<Expression, Boolean> contextual =
                        new IdentityHashMap<Expression, Boolean>();

  private SExpressionParser(String text, Scope scope, SourceSpan span) {
    this.text = text;
    this.scope = scope;
    this.span = span == null ? SourceSpan.NONE : span;
    this.file = this.span.getFile();
    this.firstLine = this.span.getLine();
  }

  /**
   * Parse one expression
   * @param text
   * @param scope names in scope
   * @param span span given to all nodes of the expression
   * @return typed expression
   * @throws UserException if text is not a well-formed expression or
   *                       refers to an undefined variable
   */
  public static Expression parse(String text, Scope scope, SourceSpan span)
                                                  throws UserException {
    SExpressionParser p = new SExpressionParser(text, scope, span);
    return p.expr(p.readTree(false));
  }

  /* -- syntax tree -- */

  /**
   * Run the generated lexer and parser over the text
   * @param body true for a statement body, false for one expression
   */
  private Tree readTree(boolean body) throws UserException {
    ContractLexer lexer = new ContractLexer(new ANTLRStringStream(text));
    ContractParser parser = new ContractParser(new CommonTokenStream(lexer));
    Tree tree;
    try {
      if (body) {
        tree = (Tree)parser.bodyText().getTree();
      } else {
        tree = (Tree)parser.expressionText().getTree();
      }
    } catch (RecognitionException e) {
      throw new UserException(span, "Syntax error: " + e + " in: " + text);
    }
    List<String> errors = new ArrayList<String>(lexer.getErrors());
    errors.addAll(parser.getErrors());
    if (!errors.isEmpty()) {
      throw new UserException(span, "Syntax error: " + errors.get(0) +
                                    " in: " + text);
    }
    if (logger.isTraceEnabled()) {
      logger.trace("parsed: " + printTree(tree));
    }
    return tree;
  }

  private static String printTree(Tree tree) {
    if (tree.getChildCount() == 0) {
      return tree.getText();
    }
    StringBuilder sb = new StringBuilder();
    sb.append('(');
    sb.append(tree.getText());
    for (int i = 0; i < tree.getChildCount(); i++) {
      sb.append(' ');
      sb.append(printTree(tree.getChild(i)));
    }
    sb.append(')');
    return sb.toString();
  }

  /**
   * @param at node the error is at, or null if unknown
   */
  private UserException error(Tree at, String msg) {
    String where = "";
    if (at != null) {
      where = " at " + at.getLine() + ":" + (at.getCharPositionInLine() + 1);
    }
    return new UserException(span, msg + where + " in: " + text);
  }

  private static boolean isAtom(Tree t) {
    return t.getType() == ContractParser.ATOM ||
           t.getType() == ContractParser.STRING;
  }

  /**
   * Children of a LIST node, consumed left to right
   */
  private class ListCursor {
    private final Tree list;
    private int next;

    ListCursor(Tree list, int first) {
      this.list = list;
      this.next = first;
    }

    boolean more() {
      return next < list.getChildCount();
    }

    boolean atBlock() {
      return more() && list.getChild(next).getType() == ContractParser.BLOCK;
    }

    Tree next() throws UserException {
      if (!more()) {
        throw error(list, "Unexpected end of list " + printTree(list));
      }
      return list.getChild(next++);
    }

    String atom() throws UserException {
      Tree t = next();
      if (!isAtom(t)) {
        throw error(t, "Expected name, got " + printTree(t));
      }
      return t.getText();
    }

    Expression expr() throws UserException {
      return SExpressionParser.this.expr(next());
    }

    List<Statement> block() throws UserException {
      Tree t = next();
      if (t.getType() != ContractParser.BLOCK) {
        throw error(t, "Expected block, got " + printTree(t));
      }
      return statements(t);
    }

    void end() throws UserException {
      if (more()) {
        throw error(list.getChild(next), "Trailing input " +
                    printTree(list.getChild(next)));
      }
    }
  }

  /* -- expressions -- */

  private Expression expr(Tree t) throws UserException {
    switch (t.getType()) {
      case ContractParser.LIST:
        return compound(t);
      case ContractParser.ATOM:
      case ContractParser.STRING:
        return atom(t);
      default:
        throw error(t, "Unexpected " + printTree(t));
    }
  }

  private Expression compound(Tree list) throws UserException {
    if (list.getChildCount() == 0) {
      throw error(list, "Empty list");
    }
    ListCursor c = new ListCursor(list, 0);
    String head = c.atom();
    String target = null;
    Expression receiver = null;
    if (head.equals("call")) {
      target = c.atom();
    } else if (head.equals(".")) {
      receiver = c.expr();
      target = c.atom();
    }
    List<Expression> args = new ArrayList<Expression>();
    while (c.more()) {
      args.add(c.expr());
    }
    if (target != null) {
      return makeCall(target, receiver, args);
    }
    return makeCompound(head, args);
  }

  private Expression atom(Tree t) throws UserException {
    String atom = t.getText();
    if (t.getType() == ContractParser.STRING) {
      return new Literal(Value.createStringLit(Value.unquote(atom)),
                         Types.STRING, span);
    } else if (atom.equals("true") || atom.equals("false")) {
      return new Literal(Value.createBoolLit(atom.equals("true")),
                         Types.BOOL, span);
    } else if (atom.equals("null")) {
      return Literal.nullLit(span);
    }

    Matcher m = INT_LIT.matcher(atom);
    if (m.matches()) {
      BigInteger v = new BigInteger(m.group(1));
      if (m.group(2) != null) {
        return new Literal(Value.createIntLit(v), Types.parse(m.group(2)),
                           span);
      }
      Type t32 = Types.I32.inRange(v) ? Types.I32 : Types.I64;
      Literal lit = new Literal(Value.createIntLit(v), t32, span);
      contextual.put(lit, Boolean.TRUE);
      return lit;
    }
    if (REAL_LIT.matcher(atom).matches()) {
      return new Literal(Value.createRealLit(Double.parseDouble(atom)),
                         Types.F64, span);
    }
    if (IDENT.matcher(atom).matches()) {
      Type vt = scope.lookupVar(atom);
      if (vt == null) {
        throw new UserException(span, "Undefined variable " + atom +
                                      " in: " + text);
      }
      return new VarRef(atom, vt, span);
    }
    throw error(t, "Bad atom '" + atom + "'");
  }

  private Expression makeCompound(String head, List<Expression> args)
                                                  throws UserException {
    if (head.equals("len") || head.equals("length")) {
      checkArity(head, args, 1);
      return new LengthExpr(args.get(0), span);
    } else if (head.equals("at")) {
      checkArity(head, args, 2);
      Expression arr = args.get(0);
      Type elemType = arr.type().isArray() ? arr.type().elemType()
                                           : Scope.UNKNOWN;
      Expression index = adjustLiteral(args.get(1), Types.I32);
      return new IndexExpr(arr, index, elemType, span);
    }

    UnaryOp uop = Operators.unaryFromSymbol(head);
    BinaryOp bop = Operators.binaryFromSymbol(head);
    if (uop != null && args.size() == 1) {
      return makeUnary(uop, args.get(0));
    } else if (bop == BinaryOp.SUB && args.size() == 1) {
      return makeUnary(UnaryOp.NEG, args.get(0));
    } else if (bop != null) {
      if (args.size() < 2) {
        throw error(null, "Operator " + head + " needs two operands");
      }
      if (args.size() > 2 && bop != BinaryOp.AND && bop != BinaryOp.OR &&
          bop != BinaryOp.ADD && bop != BinaryOp.MUL) {
        throw error(null, "Operator " + head + " takes two operands");
      }
      // Associative operators fold left
      Expression acc = args.get(0);
      for (int i = 1; i < args.size(); i++) {
        acc = makeBinary(bop, acc, args.get(i));
      }
      return acc;
    }
    return makeCall(head, null, args);
  }

  private Expression makeUnary(UnaryOp op, Expression operand) {
    if (op == UnaryOp.NEG && operand.kind() == Expression.ExprKind.LITERAL &&
        ((Literal)operand).value().isIntVal()) {
      // Fold negative literals so that (- 5) and -5 are the same
      Literal lit = (Literal)operand;
      Literal neg = new Literal(Value.createIntLit(
              lit.value().getIntLit().negate()), lit.type(), span);
      if (contextual.containsKey(operand)) {
        contextual.put(neg, Boolean.TRUE);
      }
      return neg;
    }
    Type t = op == UnaryOp.NOT ? Types.BOOL : operand.type();
    return new UnaryExpr(op, operand, t, span);
  }

  private Expression makeBinary(BinaryOp op, Expression l, Expression r) {
    if (l.type().isNumeric() && r.type().isNumeric()) {
      if (contextual.containsKey(l) && !contextual.containsKey(r)) {
        l = adjustLiteral(l, r.type());
      } else if (contextual.containsKey(r) && !contextual.containsKey(l)) {
        r = adjustLiteral(r, l.type());
      }
    }

    Type t;
    if (Operators.isComparison(op) || Operators.isLogical(op)) {
      t = Types.BOOL;
    } else if (l.type().isInteger() && r.type().isInteger()) {
      if (op == BinaryOp.SHL || op == BinaryOp.SHR) {
        t = l.type();
      } else {
        t = Types.widerInt(l.type(), r.type());
      }
    } else if (l.type().isNumeric() && r.type().isNumeric()) {
      t = Types.F64;
    } else if (l.type().isBool() && r.type().isBool()) {
      t = Types.BOOL;
    } else {
      t = l.type();
    }
    Expression result = new BinaryExpr(op, l, r, t, span);
    if (contextual.containsKey(l) && contextual.containsKey(r)) {
      // e.g. (+ 1 2): still free to adopt a type
      contextual.put(result, Boolean.TRUE);
    }
    return result;
  }

  /**
   * Give an unsuffixed literal the type required by its context
   */
  private Expression adjustLiteral(Expression e, Type target) {
    if (!contextual.containsKey(e) ||
        e.kind() != Expression.ExprKind.LITERAL) {
      return e;
    }
    Literal lit = (Literal)e;
    BigInteger v = lit.value().getIntLit();
    if (target.isInteger() && target.inRange(v)) {
      return new Literal(lit.value(), target, span);
    } else if (target.isFloat()) {
      return new Literal(Value.createRealLit(v.doubleValue()), Types.F64,
                         span);
    }
    return e;
  }

  private Expression makeCall(String target, Expression receiver,
                              List<Expression> args) {
    Type t;
    if (receiver == null && Builtins.isBuiltin(target)) {
      List<Type> argTypes = new ArrayList<Type>();
      for (Expression a: args) {
        argTypes.add(a.type());
      }
      t = Builtins.resultType(target, argTypes);
      if (t == null) {
        t = Scope.UNKNOWN;
      }
    } else if (receiver == null) {
      t = scope.lookupFunction(target);
    } else {
      t = Scope.UNKNOWN;
    }
    return new CallExpr(target, receiver, args, t, span);
  }

  private void checkArity(String head, List<Expression> args, int n)
                                                  throws UserException {
    if (args.size() != n) {
      throw error(null, head + " expects " + n + " argument(s), got " +
                        args.size());
    }
  }

  /**
   * Parse a function body, e.g.
   * <pre>
   *   (bind r i32)
   *   (if (< n 0) {(assign r (- n))} {(assign r n)})
   *   (return r)
   * </pre>
   * The body may also be wrapped in a single {...} block.
   * Each statement's span is its position in the text, counting lines
   * from the line of the span passed in.  Locals are added to the scope
   * as their bind statements are read.
   * @param text
   * @param scope
   * @param start position of the first character of text
   * @return statements
   * @throws UserException
   */
  public static List<Statement> parseBody(String text, Scope scope,
                              SourceSpan start) throws UserException {
    SExpressionParser p = new SExpressionParser(text, scope, start);
    return p.statements(p.readTree(true));
  }

  /**
   * @param block a BLOCK or SEQUENCE node
   */
  private List<Statement> statements(Tree block) throws UserException {
    SourceSpan outer = span;
    List<Statement> result = new ArrayList<Statement>(block.getChildCount());
    for (int i = 0; i < block.getChildCount(); i++) {
      result.add(statement(block.getChild(i)));
    }
    span = outer;
    return result;
  }

  /**
   * Span of a node, relative to start line of input
   */
  private SourceSpan spanOf(Tree t) {
    int line = (firstLine <= 0 ? 1 : firstLine) + t.getLine() - 1;
    return SourceSpan.at(file, line, t.getCharPositionInLine() + 1);
  }

  private Type type(String name, SourceSpan at) throws UserException {
    try {
      return Types.parse(name);
    } catch (CevaRuntimeError e) {
      throw new UserException(at, e.getMessage());
    }
  }

  private Statement statement(Tree t) throws UserException {
    if (t.getType() != ContractParser.LIST || t.getChildCount() == 0) {
      throw error(t, "Expected statement, got " + printTree(t));
    }
    span = spanOf(t);
    SourceSpan stmtSpan = span;
    ListCursor c = new ListCursor(t, 0);
    String head = c.atom();
    Statement result;
    if (head.equals("bind")) {
      String name = c.atom();
      Type type = type(c.atom(), stmtSpan);
      Expression init = null;
      if (c.more()) {
        init = adjustLiteral(c.expr(), type);
      }
      scope.defineVar(name, type);
      result = new BindStatement(name, type, init, stmtSpan);
    } else if (head.equals("assign")) {
      String name = c.atom();
      Type type = scope.lookupVar(name);
      if (type == null) {
        throw new UserException(stmtSpan, "Assignment to undefined " + name);
      }
      result = new AssignStatement(name, adjustLiteral(c.expr(), type),
                                   stmtSpan);
    } else if (head.equals("store")) {
      Expression arr = c.expr();
      Expression index = adjustLiteral(c.expr(), Types.I32);
      Expression value = c.expr();
      if (arr.kind() != Expression.ExprKind.VARIABLE) {
        throw error(t, "store needs an array variable");
      }
      if (arr.type().isArray()) {
        value = adjustLiteral(value, arr.type().elemType());
      }
      result = new ArrayStoreStatement((VarRef)arr, index, value, stmtSpan);
    } else if (head.equals("if")) {
      Expression cond = c.expr();
      List<Statement> thenBody = c.block();
      List<Statement> elseBody = Collections.emptyList();
      if (c.atBlock()) {
        elseBody = c.block();
      }
      result = new IfStatement(cond, thenBody, elseBody, stmtSpan);
    } else if (head.equals("while") || head.equals("do-while")) {
      Expression cond = c.expr();
      List<Statement> body = c.block();
      result = new WhileStatement(cond, body, head.equals("while"), stmtSpan);
    } else if (head.equals("for")) {
      String var = c.atom();
      Type varType = type(c.atom(), stmtSpan);
      scope.defineVar(var, varType);
      Expression from = adjustLiteral(c.expr(), varType);
      Expression to = adjustLiteral(c.expr(), varType);
      Expression step = null;
      if (!c.atBlock()) {
        step = adjustLiteral(c.expr(), varType);
      }
      List<Statement> body = c.block();
      result = new ForStatement(var, varType, from, to, step, body, stmtSpan);
    } else if (head.equals("break")) {
      result = JumpStatement.breakStmt(stmtSpan);
    } else if (head.equals("continue")) {
      result = JumpStatement.continueStmt(stmtSpan);
    } else if (head.equals("return") || head.equals("throw")) {
      Expression value = null;
      if (c.more()) {
        value = c.expr();
        Type resultType = scope.lookupVar(VarRef.RESULT);
        if (head.equals("return") && resultType != null) {
          value = adjustLiteral(value, resultType);
        }
      }
      result = new ExitStatement(head.equals("throw"), value, stmtSpan);
    } else if (head.equals("do")) {
      Expression e = c.expr();
      if (e.kind() != Expression.ExprKind.CALL) {
        throw error(t, "do needs a call expression");
      }
      result = new CallStatement((CallExpr)e, stmtSpan);
    } else if (head.equals("unknown")) {
      String desc = c.more() ? Value.unquote(c.atom()) : "";
      result = new UnknownStatement(desc, stmtSpan);
    } else {
      throw error(t, "Unknown statement '" + head + "'");
    }
    c.end();
    return result;
  }

  /**
   * Parse a list of expressions, all with the same scope and span
   */
  public static List<Expression> parseAll(List<String> texts, Scope scope,
                              SourceSpan span) throws UserException {
    if (texts.isEmpty()) {
      return Collections.emptyList();
    }
    List<Expression> result = new ArrayList<Expression>(texts.size());
    for (String t: texts) {
      result.add(parse(t, scope, span));
    }
    return result;
  }
}
