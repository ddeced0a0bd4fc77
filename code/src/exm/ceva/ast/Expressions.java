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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries over expression trees and simple statements
 */
public class Expressions {

  /**
   * @return variable references in e, in evaluation order
   */
  public static List<VarRef> varRefs(Expression e) {
    List<VarRef> result = new ArrayList<VarRef>();
    collectVarRefs(e, result);
    return result;
  }

  private static void collectVarRefs(Expression e, List<VarRef> out) {
    if (e.kind() == Expression.ExprKind.VARIABLE) {
      out.add((VarRef)e);
    }
    for (Expression child: e.children()) {
      collectVarRefs(child, out);
    }
  }

  public static Set<String> varNames(Expression e) {
    Set<String> names = new LinkedHashSet<String>();
    for (VarRef v: varRefs(e)) {
      names.add(v.name());
    }
    return names;
  }

  /**
   * @return calls in e, innermost first
   */
  public static List<CallExpr> calls(Expression e) {
    List<CallExpr> result = new ArrayList<CallExpr>();
    collectCalls(e, result);
    return result;
  }

  private static void collectCalls(Expression e, List<CallExpr> out) {
    for (Expression child: e.children()) {
      collectCalls(child, out);
    }
    if (e.kind() == Expression.ExprKind.CALL) {
      out.add((CallExpr)e);
    }
  }

  public static boolean containsCall(Expression e) {
    if (e.kind() == Expression.ExprKind.CALL) {
      return true;
    }
    for (Expression child: e.children()) {
      if (containsCall(child)) {
        return true;
      }
    }
    return false;
  }

  /**
   * All calls made directly by a statement, not including nested bodies
   */
  public static List<CallExpr> calls(Statement stmt) {
    List<CallExpr> result = new ArrayList<CallExpr>();
    for (Expression e: stmt.expressions()) {
      collectCalls(e, result);
    }
    return result;
  }

  /**
   * All calls in a body, including nested bodies
   */
  public static List<CallExpr> callsInBody(List<Statement> body) {
    List<CallExpr> result = new ArrayList<CallExpr>();
    for (Statement stmt: body) {
      result.addAll(calls(stmt));
      for (List<Statement> nested: stmt.bodies()) {
        result.addAll(callsInBody(nested));
      }
    }
    return result;
  }

  /**
   * Variable references read by a simple statement
   */
  public static List<VarRef> reads(Statement stmt) {
    List<VarRef> result = new ArrayList<VarRef>();
    for (Expression e: stmt.expressions()) {
      collectVarRefs(e, result);
    }
    return result;
  }

  /**
   * @return name of the variable a statement (re)defines, or null.
   *    An array store does not define its array variable.
   */
  public static String definedVar(Statement stmt) {
    switch (stmt.kind()) {
      case BIND:
        return ((BindStatement)stmt).name();
      case ASSIGN:
        return ((AssignStatement)stmt).name();
      default:
        return null;
    }
  }

  /**
   * @return the value stored by a bind or assign, or null
   */
  public static Expression storedValue(Statement stmt) {
    switch (stmt.kind()) {
      case BIND:
        return ((BindStatement)stmt).init();
      case ASSIGN:
        return ((AssignStatement)stmt).value();
      default:
        return null;
    }
  }

  /**
   * Locals bound anywhere in a body, including for loop variables
   */
  public static Set<String> boundVars(List<Statement> body) {
    Set<String> result = new LinkedHashSet<String>();
    for (Statement stmt: body) {
      if (stmt.kind() == Statement.StmtKind.BIND) {
        result.add(((BindStatement)stmt).name());
      } else if (stmt.kind() == Statement.StmtKind.FOR) {
        result.add(((ForStatement)stmt).var());
      }
      for (List<Statement> nested: stmt.bodies()) {
        result.addAll(boundVars(nested));
      }
    }
    return result;
  }

  /**
   * Variables assigned anywhere in a body, e.g. to find what a loop
   * modifies.  Includes arrays stored into.
   */
  public static Set<String> assignedVars(List<Statement> body) {
    Set<String> result = new LinkedHashSet<String>();
    for (Statement stmt: body) {
      String def = definedVar(stmt);
      if (def != null) {
        result.add(def);
      } else if (stmt.kind() == Statement.StmtKind.ARRAY_STORE) {
        result.add(((ArrayStoreStatement)stmt).arrayName());
      } else if (stmt.kind() == Statement.StmtKind.FOR) {
        result.add(((ForStatement)stmt).var());
      }
      for (List<Statement> nested: stmt.bodies()) {
        result.addAll(assignedVars(nested));
      }
    }
    return result;
  }

  public static boolean containsKind(List<Statement> body,
                                     Statement.StmtKind kind) {
    for (Statement stmt: body) {
      if (stmt.kind() == kind) {
        return true;
      }
      for (List<Statement> nested: stmt.bodies()) {
        if (containsKind(nested, kind)) {
          return true;
        }
      }
    }
    return false;
  }
}
