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

package exm.ceva.analysis.taint;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import exm.ceva.analysis.CallClassifier;
import exm.ceva.analysis.dataflow.DataflowAnalysis;
import exm.ceva.ast.ArrayStoreStatement;
import exm.ceva.ast.AssignStatement;
import exm.ceva.ast.BindStatement;
import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Function;
import exm.ceva.ast.Parameter;
import exm.ceva.ast.Statement;
import exm.ceva.ast.VarRef;
import exm.ceva.cfg.BasicBlock;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Effects.EffectSet;

/**
 * Forward may-analysis: which untrusted sources each variable's value
 * may derive from.
 *
 * Values computed from tainted operands are tainted, including the
 * results of calls that are not sanitizers.  Stores into an array add to
 * the labels of the whole array.
 */
public class TaintAnalysis extends DataflowAnalysis<TaintFacts> {

  private static final Pattern SOURCE_PARAM_NAME = Pattern.compile(
      "(?i).*(input|request|query|user|param|body|header|cookie).*");

  private static final Pattern SOURCE_CALL_NAME = Pattern.compile(
      "(?i)(read|input|recv|fetch|get(param|parameter|header|cookie|query))" +
      ".*");

  private final Function function;
  private final CallClassifier classifier;
  private final SanitizerRegistry sanitizers;
  private final boolean inferSources;

  /**
   * @param inferSources also guess sources from parameter and function
   *                     names
   */
  public TaintAnalysis(Function function, CallClassifier classifier,
                SanitizerRegistry sanitizers, boolean inferSources) {
    this.function = function;
    this.classifier = classifier;
    this.sanitizers = sanitizers;
    this.inferSources = inferSources;
  }

  @Override
  public Direction direction() {
    return Direction.FORWARD;
  }

  @Override
  public TaintFacts boundaryFact() {
    TaintFacts facts = TaintFacts.EMPTY;
    for (Parameter p: function.params()) {
      if (p.isUntrusted() ||
          (inferSources && SOURCE_PARAM_NAME.matcher(p.name()).matches())) {
        Set<TaintLabel> l = new TreeSet<TaintLabel>();
        l.add(new TaintLabel("parameter '" + p.name() + "'", p.span()));
        facts = facts.with(p.name(), l);
      }
    }
    return facts;
  }

  @Override
  public TaintFacts initialFact() {
    return TaintFacts.EMPTY;
  }

  @Override
  public TaintFacts join(TaintFacts a, TaintFacts b) {
    return a.join(b);
  }

  @Override
  public TaintFacts transferBlock(BasicBlock block, TaintFacts input) {
    TaintFacts facts = input;
    for (Statement stmt: block.statements()) {
      facts = transfer(stmt, facts);
    }
    return facts;
  }

  public TaintFacts transfer(Statement stmt, TaintFacts facts) {
    switch (stmt.kind()) {
      case BIND: {
        BindStatement b = (BindStatement)stmt;
        if (b.init() == null) {
          return facts.with(b.name(), new TreeSet<TaintLabel>());
        }
        return facts.with(b.name(), labels(b.init(), facts));
      }
      case ASSIGN: {
        AssignStatement a = (AssignStatement)stmt;
        return facts.with(a.name(), labels(a.value(), facts));
      }
      case ARRAY_STORE: {
        ArrayStoreStatement st = (ArrayStoreStatement)stmt;
        Set<TaintLabel> l = new TreeSet<TaintLabel>(
                                facts.get(st.arrayName()));
        l.addAll(labels(st.value(), facts));
        return facts.with(st.arrayName(), l);
      }
      default:
        // Other statements don't define variables.  Unknown statements
        // are not assumed to taint anything.
        return facts;
    }
  }

  /**
   * @return labels of every source the value of e may derive from
   */
  public Set<TaintLabel> labels(Expression e, TaintFacts facts) {
    Set<TaintLabel> result = new TreeSet<TaintLabel>();
    addLabels(e, facts, result);
    return result;
  }

  private void addLabels(Expression e, TaintFacts facts,
                         Set<TaintLabel> result) {
    switch (e.kind()) {
      case LITERAL:
        break;
      case VARIABLE:
        result.addAll(facts.get(((VarRef)e).name()));
        break;
      case CALL: {
        CallExpr call = (CallExpr)e;
        if (isSanitizer(call)) {
          break;
        }
        if (isSource(call)) {
          result.add(new TaintLabel("call to '" + call.target() + "'",
                                    call.span()));
        }
        for (Expression child: call.children()) {
          addLabels(child, facts, result);
        }
        break;
      }
      case UNARY:
      case BINARY:
      case INDEX:
      case LENGTH:
        for (Expression child: e.children()) {
          addLabels(child, facts, result);
        }
        break;
      default:
        throw new CevaRuntimeError("Unexpected expression kind: " + e.kind());
    }
  }

  public boolean isSanitizer(CallExpr call) {
    return sanitizers.isSanitizer(call.target(), classifier.module());
  }

  public boolean isSource(CallExpr call) {
    EffectSet effects = classifier.effectsOf(call.target());
    if (effects != null && EffectTaintMapping.isSource(effects)) {
      return true;
    }
    return inferSources &&
           SOURCE_CALL_NAME.matcher(call.target()).matches();
  }

  /**
   * @return the kind of sink the call is, or null if it is not a sink
   */
  public TaintSink sinkKind(CallExpr call) {
    if (isSanitizer(call)) {
      return null;
    }
    EffectSet effects = classifier.effectsOf(call.target());
    if (effects == null) {
      return null;
    }
    return EffectTaintMapping.sinkFor(effects);
  }
}
