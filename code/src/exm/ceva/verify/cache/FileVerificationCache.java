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

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.Striped;

import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Value;
import exm.ceva.common.lang.Value.ValueKind;
import exm.ceva.verify.ContractKind;
import exm.ceva.verify.Counterexample;
import exm.ceva.verify.VerificationOutcome.Status;
import exm.ceva.verify.cache.CacheEntry.StoredOutcome;

/**
 * Cache with one JSON file per key, at dir/hh/hash.json where hh is the
 * first two digits of the hash.
 *
 * Entries are written to a temporary file in the same directory and
 * renamed into place, so readers in this or other processes see either
 * the old or the new entry.  Writers of the same key in this process are
 * serialized.  Entries that can't be parsed are treated as missing and
 * overwritten by the next put.
 *
 * If a size limit is set, each put that takes the cache over it deletes
 * the least recently used entries until the cache is at 80% of the
 * limit.  Reading an entry counts as using it.
 */
public class FileVerificationCache implements VerificationCache {
  private static final Logger logger = Logging.getCevaLogger();

  /** Bump if the file layout changes */
  public static final int FORMAT_VERSION = 1;

  private static final int LOCK_STRIPES = 64;

  /** Eviction stops when the cache is this fraction of the limit */
  private static final double EVICT_TARGET = 0.8;

  private final File dir;
  /** 0 if unlimited */
  private final long maxBytes;
  private final ObjectMapper mapper = new ObjectMapper();
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  private final AtomicInteger hits = new AtomicInteger(0);
  private final AtomicInteger misses = new AtomicInteger(0);
  private final AtomicInteger writes = new AtomicInteger(0);
  private final AtomicInteger evictions = new AtomicInteger(0);

  /** Held while scanning the whole directory */
  private final Object evictLock = new Object();

  public FileVerificationCache(File dir) {
    this(dir, 0);
  }

  /**
   * @param maxBytes total size of entries to stay under, 0 for no limit
   */
  public FileVerificationCache(File dir, long maxBytes) {
    this.dir = dir;
    this.maxBytes = maxBytes;
  }

  public File directory() {
    return dir;
  }

  File fileFor(CacheKey key) {
    return new File(new File(dir, key.prefix()), key.hash() + ".json");
  }

  @Override
  public CacheEntry get(CacheKey key) {
    File file = fileFor(key);
    Lock lock = locks.get(key.hash());
    lock.lock();
    try {
      if (!file.isFile()) {
        misses.incrementAndGet();
        return null;
      }
      CacheEntry entry = fromJson(mapper.readTree(file));
      if (!entry.key().equals(key.hash())) {
        logger.warn("Cache entry " + file + " has key " + entry.key() +
                    ", ignoring");
        misses.incrementAndGet();
        return null;
      }
      hits.incrementAndGet();
      if (maxBytes > 0 && !file.setLastModified(System.currentTimeMillis())) {
        logger.debug("Could not touch cache entry " + file);
      }
      return entry;
    } catch (IOException e) {
      logger.warn("Could not read cache entry " + file + ": " +
                  e.getMessage());
      misses.incrementAndGet();
      return null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(CacheKey key, CacheEntry entry) {
    File file = fileFor(key);
    Lock lock = locks.get(key.hash());
    lock.lock();
    File tmp = null;
    try {
      File shard = file.getParentFile();
      FileUtils.forceMkdir(shard);
      tmp = File.createTempFile(key.hash(), ".tmp", shard);
      mapper.writerWithDefaultPrettyPrinter().writeValue(tmp, toJson(entry));
      try {
        Files.move(tmp.toPath(), file.toPath(),
                   StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp.toPath(), file.toPath(),
                   StandardCopyOption.REPLACE_EXISTING);
      }
      writes.incrementAndGet();
      if (logger.isTraceEnabled()) {
        logger.trace("Cached " + entry.functionName() + " as " + file);
      }
    } catch (IOException e) {
      // Not fatal: the function is verified again next time
      logger.warn("Could not write cache entry " + file + ": " +
                  e.getMessage());
    } finally {
      if (tmp != null) {
        FileUtils.deleteQuietly(tmp);
      }
      lock.unlock();
    }
    if (maxBytes > 0) {
      enforceLimit();
    }
  }

  @Override
  public void clear() {
    synchronized (evictLock) {
      if (!dir.exists()) {
        return;
      }
      try {
        FileUtils.cleanDirectory(dir);
        logger.debug("Cleared verification cache " + dir);
      } catch (IOException e) {
        // Stale entries are only a missed chance to skip work
        logger.warn("Could not clear cache " + dir + ": " + e.getMessage());
      }
    }
  }

  /**
   * Delete least recently used entries until under the target size
   */
  private void enforceLimit() {
    synchronized (evictLock) {
      if (!dir.isDirectory()) {
        return;
      }
      Collection<File> found = FileUtils.listFiles(dir,
                                      new String[] {"json"}, true);
      long total = 0;
      for (File f: found) {
        total += f.length();
      }
      if (total <= maxBytes) {
        return;
      }
      List<File> files = new ArrayList<File>(found);
      Collections.sort(files, new Comparator<File>() {
        @Override
        public int compare(File a, File b) {
          return Long.compare(a.lastModified(), b.lastModified());
        }
      });
      long target = (long)(maxBytes * EVICT_TARGET);
      for (File f: files) {
        if (total <= target) {
          break;
        }
        long size = f.length();
        if (FileUtils.deleteQuietly(f)) {
          total -= size;
          evictions.incrementAndGet();
          if (logger.isTraceEnabled()) {
            logger.trace("Evicted " + f);
          }
        }
      }
    }
  }

  public int hits() {
    return hits.get();
  }

  public int misses() {
    return misses.get();
  }

  public int writes() {
    return writes.get();
  }

  public int evictions() {
    return evictions.get();
  }

  private ObjectNode toJson(CacheEntry entry) {
    ObjectNode root = mapper.createObjectNode();
    root.put("format", FORMAT_VERSION);
    root.put("key", entry.key());
    root.put("timestamp", entry.timestamp());
    root.put("function", entry.functionName());
    ArrayNode outcomes = root.putArray("outcomes");
    for (StoredOutcome o: entry.outcomes()) {
      ObjectNode on = outcomes.addObject();
      on.put("kind", o.kind().name());
      on.put("index", o.index());
      on.put("status", o.status().name());
      if (o.reason() != null) {
        on.put("reason", o.reason());
      }
      if (o.counterexample() != null) {
        ObjectNode cex = on.putObject("counterexample");
        for (Map.Entry<String, Value> e:
                            o.counterexample().values().entrySet()) {
          ObjectNode vn = cex.putObject(e.getKey());
          vn.put("kind", e.getValue().getKind().name());
          vn.put("value", e.getValue().toString());
        }
      }
    }
    return root;
  }

  private static CacheEntry fromJson(JsonNode root) throws IOException {
    if (required(root, "format").asInt() != FORMAT_VERSION) {
      throw new IOException("unsupported format " + root.get("format"));
    }
    List<StoredOutcome> outcomes = new ArrayList<StoredOutcome>();
    try {
      for (JsonNode on: required(root, "outcomes")) {
        Counterexample cex = null;
        JsonNode cexNode = on.get("counterexample");
        if (cexNode != null) {
          Map<String, Value> values = new LinkedHashMap<String, Value>();
          Iterator<Map.Entry<String, JsonNode>> it = cexNode.fields();
          while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            ValueKind kind = ValueKind.valueOf(
                                required(e.getValue(), "kind").asText());
            values.put(e.getKey(), Value.parse(kind,
                                required(e.getValue(), "value").asText()));
          }
          cex = new Counterexample(values);
        }
        JsonNode reason = on.get("reason");
        outcomes.add(new StoredOutcome(
            ContractKind.valueOf(required(on, "kind").asText()),
            required(on, "index").asInt(),
            Status.valueOf(required(on, "status").asText()),
            cex, reason == null ? null : reason.asText()));
      }
    } catch (IllegalArgumentException e) {
      throw new IOException("corrupt entry: " + e.getMessage(), e);
    } catch (CevaRuntimeError e) {
      throw new IOException("corrupt entry: " + e.getMessage(), e);
    }
    return new CacheEntry(required(root, "key").asText(),
                          required(root, "timestamp").asLong(),
                          required(root, "function").asText(), outcomes);
  }

  private static JsonNode required(JsonNode node, String field)
                                                      throws IOException {
    JsonNode child = node.get(field);
    if (child == null || child.isNull()) {
      throw new IOException("missing field " + field);
    }
    return child;
  }
}
