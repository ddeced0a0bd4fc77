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

package exm.ceva.verify.encode;

import java.util.List;

import exm.ceva.ast.CallExpr;
import exm.ceva.common.exceptions.UnsupportedConstructException;
import exm.ceva.verify.formula.Sort;
import exm.ceva.verify.formula.Term;

/**
 * Encodes calls to functions other than builtins
 */
public interface CallHandler {
  /**
   * @param args encoded arguments
   * @param sort sort of the call's value
   */
  public Term encodeCall(CallExpr call, List<Term> args, Sort sort,
             EncodeContext ctx) throws UnsupportedConstructException;
}
