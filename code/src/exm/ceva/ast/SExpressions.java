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

import java.util.List;

import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Operators;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Value;

/**
 * Canonical S-expression rendering of expressions and statements.
 * Expression output can be read back by SExpressionParser.  The rendering
 * is deterministic, so it is also what verification fingerprints hash.
 */
public class SExpressions {

  public static String print(Expression e) {
    StringBuilder sb = new StringBuilder();
    print(sb, e);
    return sb.toString();
  }

  public static String print(Statement s) {
    StringBuilder sb = new StringBuilder();
    print(sb, s);
    return sb.toString();
  }

  public static String print(List<Statement> body) {
    StringBuilder sb = new StringBuilder();
    printBody(sb, body);
    return sb.toString();
  }

  private static void print(StringBuilder sb, Expression e) {
    switch (e.kind()) {
      case LITERAL:
        printLiteral(sb, (Literal)e);
        break;
      case VARIABLE:
        sb.append(((VarRef)e).name());
        break;
      case UNARY: {
        UnaryExpr u = (UnaryExpr)e;
        sb.append('(').append(u.op().symbol()).append(' ');
        print(sb, u.operand());
        sb.append(')');
        break;
      }
      case BINARY: {
        BinaryExpr b = (BinaryExpr)e;
        sb.append('(').append(b.op().symbol()).append(' ');
        print(sb, b.left());
        sb.append(' ');
        print(sb, b.right());
        sb.append(')');
        break;
      }
      case CALL: {
        CallExpr c = (CallExpr)e;
        sb.append('(');
        if (c.receiver() != null) {
          sb.append(". ");
          print(sb, c.receiver());
          sb.append(' ').append(c.target());
        } else if (isReservedHead(c.target())) {
          sb.append("call ").append(c.target());
        } else {
          sb.append(c.target());
        }
        for (Expression arg: c.args()) {
          sb.append(' ');
          print(sb, arg);
        }
        sb.append(')');
        break;
      }
      case INDEX: {
        IndexExpr ix = (IndexExpr)e;
        sb.append("(at ");
        print(sb, ix.array());
        sb.append(' ');
        print(sb, ix.index());
        sb.append(')');
        break;
      }
      case LENGTH:
        sb.append("(len ");
        print(sb, ((LengthExpr)e).operand());
        sb.append(')');
        break;
      default:
        throw new CevaRuntimeError("Unexpected expression kind: " + e.kind());
    }
  }

  private static void printLiteral(StringBuilder sb, Literal lit) {
    Value v = lit.value();
    sb.append(v.toString());
    // Integer literals other than i32 carry their type as a suffix
    if (v.isIntVal() && lit.type().isInteger() &&
        !lit.type().equals(Types.I32)) {
      sb.append(lit.type().typeName());
    }
  }

  static boolean isReservedHead(String name) {
    return Operators.binaryFromSymbol(name) != null ||
           Operators.unaryFromSymbol(name) != null ||
           name.equals("len") || name.equals("length") ||
           name.equals("at") || name.equals("call") || name.equals(".");
  }

  private static void print(StringBuilder sb, Statement s) {
    switch (s.kind()) {
      case BIND: {
        BindStatement b = (BindStatement)s;
        sb.append("(bind ").append(b.name()).append(' ')
          .append(b.type().typeName());
        if (b.init() != null) {
          sb.append(' ');
          print(sb, b.init());
        }
        sb.append(')');
        break;
      }
      case ASSIGN: {
        AssignStatement a = (AssignStatement)s;
        sb.append("(assign ").append(a.name()).append(' ');
        print(sb, a.value());
        sb.append(')');
        break;
      }
      case ARRAY_STORE: {
        ArrayStoreStatement st = (ArrayStoreStatement)s;
        sb.append("(store ").append(st.arrayName()).append(' ');
        print(sb, st.index());
        sb.append(' ');
        print(sb, st.value());
        sb.append(')');
        break;
      }
      case IF: {
        IfStatement i = (IfStatement)s;
        sb.append("(if ");
        print(sb, i.condition());
        sb.append(' ');
        printBody(sb, i.thenBody());
        sb.append(' ');
        printBody(sb, i.elseBody());
        sb.append(')');
        break;
      }
      case WHILE:
      case DO_WHILE: {
        WhileStatement w = (WhileStatement)s;
        sb.append(w.testFirst() ? "(while " : "(do-while ");
        print(sb, w.condition());
        sb.append(' ');
        printBody(sb, w.body());
        sb.append(')');
        break;
      }
      case FOR: {
        ForStatement f = (ForStatement)s;
        sb.append("(for ").append(f.var()).append(' ')
          .append(f.varType().typeName()).append(' ');
        print(sb, f.from());
        sb.append(' ');
        print(sb, f.to());
        sb.append(' ');
        if (f.step() == null) {
          sb.append('1');
        } else {
          print(sb, f.step());
        }
        sb.append(' ');
        printBody(sb, f.body());
        sb.append(')');
        break;
      }
      case BREAK:
        sb.append("(break)");
        break;
      case CONTINUE:
        sb.append("(continue)");
        break;
      case RETURN:
      case THROW: {
        ExitStatement x = (ExitStatement)s;
        sb.append(s.kind() == Statement.StmtKind.RETURN ? "(return" : "(throw");
        if (x.value() != null) {
          sb.append(' ');
          print(sb, x.value());
        }
        sb.append(')');
        break;
      }
      case CALL:
        sb.append("(do ");
        print(sb, ((CallStatement)s).call());
        sb.append(')');
        break;
      case UNKNOWN:
        sb.append("(unknown ")
          .append(Value.quote(((UnknownStatement)s).description()))
          .append(')');
        break;
      default:
        throw new CevaRuntimeError("Unexpected statement kind: " + s.kind());
    }
  }

  private static void printBody(StringBuilder sb, List<Statement> body) {
    sb.append('{');
    boolean first = true;
    for (Statement s: body) {
      if (!first) {
        sb.append(' ');
      }
      first = false;
      print(sb, s);
    }
    sb.append('}');
  }
}
