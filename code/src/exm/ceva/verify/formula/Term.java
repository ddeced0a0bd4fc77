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

package exm.ceva.verify.formula;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Value;

/**
 * Immutable, solver-neutral formula term.
 *
 * Terms are built only through the static methods below, which do light
 * simplification of boolean structure and constant conditions.
 */
public class Term {
  public static enum TermKind {
    CONST,
    VAR,
    /** Built-in operator application */
    APP,
    /** Application of an uninterpreted function */
    CALL,
  }

  public static final Term TRUE = new Term(TermKind.CONST, Sort.BOOL,
      Value.createBoolLit(true), null, null, Collections.<Term>emptyList());
  public static final Term FALSE = new Term(TermKind.CONST, Sort.BOOL,
      Value.createBoolLit(false), null, null, Collections.<Term>emptyList());

  private final TermKind kind;
  private final Sort sort;
  private final Value value;
  private final String name;
  private final FormulaOp op;
  private final List<Term> args;

  private Term(TermKind kind, Sort sort, Value value, String name,
               FormulaOp op, List<Term> args) {
    this.kind = kind;
    this.sort = sort;
    this.value = value;
    this.name = name;
    this.op = op;
    this.args = args;
  }

  public static Term constant(Value value, Sort sort) {
    if (value.isBoolVal()) {
      return value.getBoolLit() ? TRUE : FALSE;
    }
    return new Term(TermKind.CONST, sort, value, null, null,
                    Collections.<Term>emptyList());
  }

  public static Term intConst(BigInteger v, Sort sort) {
    assert(sort.isBitVec());
    return constant(Value.createIntLit(v), sort);
  }

  public static Term intConst(long v, Sort sort) {
    return intConst(BigInteger.valueOf(v), sort);
  }

  public static Term boolConst(boolean b) {
    return b ? TRUE : FALSE;
  }

  public static Term var(String name, Sort sort) {
    return new Term(TermKind.VAR, sort, null, name, null,
                    Collections.<Term>emptyList());
  }

  public static Term app(FormulaOp op, Sort sort, Term... args) {
    return new Term(TermKind.APP, sort, null, null, op,
        Collections.unmodifiableList(new ArrayList<Term>(Arrays.asList(args))));
  }

  public static Term call(String function, Sort sort, List<Term> args) {
    return new Term(TermKind.CALL, sort, null, function, null,
        Collections.unmodifiableList(new ArrayList<Term>(args)));
  }

  public static Term and(Term a, Term b) {
    return and(Arrays.asList(a, b));
  }

  public static Term and(List<Term> terms) {
    List<Term> conj = new ArrayList<Term>();
    for (Term t: terms) {
      if (t.isFalse()) {
        return FALSE;
      } else if (!t.isTrue() && !conj.contains(t)) {
        conj.add(t);
      }
    }
    if (conj.isEmpty()) {
      return TRUE;
    } else if (conj.size() == 1) {
      return conj.get(0);
    }
    return app(FormulaOp.AND, Sort.BOOL, conj.toArray(new Term[conj.size()]));
  }

  public static Term or(Term a, Term b) {
    return or(Arrays.asList(a, b));
  }

  public static Term or(List<Term> terms) {
    List<Term> disj = new ArrayList<Term>();
    for (Term t: terms) {
      if (t.isTrue()) {
        return TRUE;
      } else if (!t.isFalse() && !disj.contains(t)) {
        disj.add(t);
      }
    }
    if (disj.isEmpty()) {
      return FALSE;
    } else if (disj.size() == 1) {
      return disj.get(0);
    }
    return app(FormulaOp.OR, Sort.BOOL, disj.toArray(new Term[disj.size()]));
  }

  public static Term not(Term t) {
    if (t.isTrue()) {
      return FALSE;
    } else if (t.isFalse()) {
      return TRUE;
    } else if (t.kind == TermKind.APP && t.op == FormulaOp.NOT) {
      return t.args.get(0);
    }
    return app(FormulaOp.NOT, Sort.BOOL, t);
  }

  public static Term implies(Term a, Term b) {
    if (a.isTrue() || b.isTrue()) {
      return b;
    } else if (a.isFalse()) {
      return TRUE;
    }
    return app(FormulaOp.IMPLIES, Sort.BOOL, a, b);
  }

  public static Term eq(Term a, Term b) {
    if (a.equals(b)) {
      return TRUE;
    }
    return app(FormulaOp.EQ, Sort.BOOL, a, b);
  }

  public static Term lt(Term a, Term b) {
    return app(FormulaOp.LT, Sort.BOOL, a, b);
  }

  public static Term le(Term a, Term b) {
    return app(FormulaOp.LE, Sort.BOOL, a, b);
  }

  public static Term ite(Term cond, Term then, Term otherwise) {
    if (cond.isTrue() || then.equals(otherwise)) {
      return then;
    } else if (cond.isFalse()) {
      return otherwise;
    }
    return app(FormulaOp.ITE, then.sort(), cond, then, otherwise);
  }

  public TermKind kind() {
    return kind;
  }

  public Sort sort() {
    return sort;
  }

  public boolean isTrue() {
    return this == TRUE;
  }

  public boolean isFalse() {
    return this == FALSE;
  }

  public boolean isConstant() {
    return kind == TermKind.CONST;
  }

  public Value value() {
    if (kind != TermKind.CONST) {
      throw new CevaRuntimeError("Not a constant: " + this);
    }
    return value;
  }

  /**
   * @return variable or uninterpreted function name
   */
  public String name() {
    if (kind != TermKind.VAR && kind != TermKind.CALL) {
      throw new CevaRuntimeError("No name: " + this);
    }
    return name;
  }

  public FormulaOp op() {
    if (kind != TermKind.APP) {
      throw new CevaRuntimeError("Not an application: " + this);
    }
    return op;
  }

  public List<Term> args() {
    return args;
  }

  @Override
  public int hashCode() {
    int h = kind.hashCode();
    h = h * 31 + sort.hashCode();
    if (value != null) {
      h = h * 31 + value.hashCode();
    }
    if (name != null) {
      h = h * 31 + name.hashCode();
    }
    if (op != null) {
      h = h * 31 + op.hashCode();
    }
    return h * 31 + args.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Term)) {
      return false;
    }
    Term o = (Term)obj;
    return kind == o.kind && sort.equals(o.sort) &&
        (value == null ? o.value == null : value.equals(o.value)) &&
        (name == null ? o.name == null : name.equals(o.name)) &&
        op == o.op && args.equals(o.args);
  }

  @Override
  public String toString() {
    switch (kind) {
      case CONST:
        return value.toString();
      case VAR:
        return name;
      case APP:
        return "(" + op.name().toLowerCase() + " " +
               StringUtils.join(args, " ") + ")";
      default:
        return "(" + name + (args.isEmpty() ? "" : " ") +
               StringUtils.join(args, " ") + ")";
    }
  }
}
