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

package exm.ceva.verify.cache;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.base.Charsets;
import com.google.common.hash.Hashing;

import exm.ceva.ast.CallExpr;
import exm.ceva.ast.Expression;
import exm.ceva.ast.Expressions;
import exm.ceva.ast.ExternalFunction;
import exm.ceva.ast.Function;
import exm.ceva.ast.Module;
import exm.ceva.ast.SExpressions;
import exm.ceva.common.lang.IntegerMode;
import exm.ceva.verify.encode.FormulaEncoder;

/**
 * Content hash of everything verification outcomes of a function depend
 * on: the encoder version, integer semantics, the function's signature,
 * contracts and body, the declarations of everything it calls,
 * directly or indirectly, and the depth of loop invariant synthesis.
 * Source positions are not part of the key.
 */
public class CacheKey {
  private final String hash;

  private CacheKey(String hash) {
    this.hash = hash;
  }

  public static CacheKey forHash(String hash) {
    return new CacheKey(hash);
  }

  public static CacheKey compute(Function f, Module module,
                                 IntegerMode mode) {
    return compute(f, module, mode, 0);
  }

  /**
   * @param inductionDepth bound on k-induction for loop invariants,
   *                       0 if invariants are not synthesized
   */
  public static CacheKey compute(Function f, Module module,
                                 IntegerMode mode, int inductionDepth) {
    String canonical = canonicalForm(f, module, mode, inductionDepth);
    return new CacheKey(Hashing.sha256()
                   .hashString(canonical, Charsets.UTF_8).toString());
  }

  /**
   * Text that is hashed for the key
   */
  static String canonicalForm(Function f, Module module, IntegerMode mode,
                              int inductionDepth) {
    StringBuilder sb = new StringBuilder();
    sb.append("encoder ").append(FormulaEncoder.ENCODER_VERSION).append('\n');
    sb.append("mode ").append(mode).append('\n');
    if (inductionDepth > 0) {
      sb.append("k-induction ").append(inductionDepth).append('\n');
    }
    appendDeclaration(sb, f);
    sb.append("body ").append(SExpressions.print(f.body())).append('\n');

    if (module != null) {
      SortedSet<String> callees = callees(f, module);
      for (String callee: callees) {
        Function g = module.lookupFunction(callee);
        if (g != null) {
          sb.append("callee ");
          appendDeclaration(sb, g);
        } else {
          ExternalFunction ext = module.lookupExternal(callee);
          if (ext != null) {
            sb.append("extern ").append(ext.signature()).append('\n');
          }
        }
      }
    }
    return sb.toString();
  }

  private static void appendDeclaration(StringBuilder sb, Function f) {
    sb.append("function ").append(f.signature()).append(' ')
      .append(f.effects()).append('\n');
    for (Expression pre: f.preconditions()) {
      sb.append("requires ").append(SExpressions.print(pre)).append('\n');
    }
    for (Expression post: f.postconditions()) {
      sb.append("ensures ").append(SExpressions.print(post)).append('\n');
    }
  }

  /**
   * Names of declared functions reachable through calls from f,
   * excluding f itself
   */
  private static SortedSet<String> callees(Function f, Module module) {
    SortedSet<String> seen = new TreeSet<String>();
    Deque<Function> work = new ArrayDeque<Function>();
    work.push(f);
    while (!work.isEmpty()) {
      Function g = work.pop();
      for (CallExpr call: directCalls(g)) {
        String target = call.target();
        if (target.equals(f.name()) || !seen.add(target)) {
          continue;
        }
        Function h = module.lookupFunction(target);
        if (h != null) {
          work.push(h);
        } else if (module.lookupExternal(target) == null) {
          // Undeclared: nothing to hash
          seen.remove(target);
        }
      }
    }
    return seen;
  }

  private static List<CallExpr> directCalls(Function g) {
    List<CallExpr> calls = new ArrayList<CallExpr>(
                              Expressions.callsInBody(g.body()));
    for (Expression pre: g.preconditions()) {
      calls.addAll(Expressions.calls(pre));
    }
    for (Expression post: g.postconditions()) {
      calls.addAll(Expressions.calls(post));
    }
    return calls;
  }

  public String hash() {
    return hash;
  }

  /**
   * @return first two hex digits, used to shard cache directories
   */
  public String prefix() {
    return hash.substring(0, 2);
  }

  @Override
  public int hashCode() {
    return hash.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CacheKey && hash.equals(((CacheKey)obj).hash);
  }

  @Override
  public String toString() {
    return hash;
  }
}
