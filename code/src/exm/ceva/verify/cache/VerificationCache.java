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

/**
 * Persistent store of verification outcomes, keyed by content hash.
 * Implementations must be safe to use from several threads, and
 * several processes may share the same store.
 */
public interface VerificationCache {
  /**
   * @return the entry, or null if there is none or it can't be read
   */
  public CacheEntry get(CacheKey key);

  /**
   * Store an entry, replacing any previous one.  Either the whole entry
   * is stored or nothing is.
   */
  public void put(CacheKey key, CacheEntry entry);

  /**
   * Remove all entries
   */
  public void clear();
}
