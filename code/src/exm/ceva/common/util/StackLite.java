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

package exm.ceva.common.util;

import java.util.ArrayList;

/**
 * Minimal stack on top of an ArrayList.  Unlike java.util.Stack it is
 * not synchronized, and iteration order is bottom to top.
 */
public class StackLite<T> extends ArrayList<T> {

  public void push(T x) {
    add(x);
  }

  public T pop() {
    return remove(size() - 1);
  }

  /**
   * @return top element, or null if stack is empty
   */
  public T peek() {
    if (isEmpty()) {
      return null;
    }
    return get(size() - 1);
  }

  private static final long serialVersionUID = 1L;
}
