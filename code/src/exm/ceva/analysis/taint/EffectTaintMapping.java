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

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.ceva.common.lang.Effects.Effect;
import exm.ceva.common.lang.Effects.EffectSet;

/**
 * Which declared effects make a call a taint source or a sink
 */
public class EffectTaintMapping {

  /** Resources whose reads bring in external data */
  private static final Set<String> SOURCE_RESOURCES = new HashSet<String>(
      Arrays.asList("console", "stdin", "net", "fs", "db", "env"));

  private static final Map<String, TaintSink> SINK_RESOURCES =
                                        new HashMap<String, TaintSink>();
  static {
    SINK_RESOURCES.put("db", TaintSink.SQL_QUERY);
    for (String r: Arrays.asList("process", "exec", "shell", "system")) {
      SINK_RESOURCES.put(r, TaintSink.COMMAND_EXECUTION);
    }
    SINK_RESOURCES.put("fs", TaintSink.FILE_PATH);
    for (String r: Arrays.asList("html", "web", "response")) {
      SINK_RESOURCES.put(r, TaintSink.HTML_OUTPUT);
    }
    SINK_RESOURCES.put("net", TaintSink.URL_REDIRECT);
    SINK_RESOURCES.put("http", TaintSink.URL_REDIRECT);
    for (String r: Arrays.asList("eval", "code", "script")) {
      SINK_RESOURCES.put(r, TaintSink.CODE_EVAL);
    }
    SINK_RESOURCES.put("serialize", TaintSink.DESERIALIZATION);
    SINK_RESOURCES.put("deserialize", TaintSink.DESERIALIZATION);
    SINK_RESOURCES.put("log", TaintSink.LOG_OUTPUT);
    SINK_RESOURCES.put("audit", TaintSink.LOG_OUTPUT);
  }

  public static boolean isSource(EffectSet effects) {
    for (Effect e: effects) {
      if (e.access().reads() && SOURCE_RESOURCES.contains(e.resource())) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the sink kind of the first effect that writes a sensitive
   *        resource, or null if none does
   */
  public static TaintSink sinkFor(EffectSet effects) {
    for (Effect e: effects) {
      TaintSink sink = SINK_RESOURCES.get(e.resource());
      if (sink != null && e.access().writes()) {
        return sink;
      }
    }
    return null;
  }

  public static List<String> sourceResources() {
    return Arrays.asList(SOURCE_RESOURCES.toArray(new String[0]));
  }
}
