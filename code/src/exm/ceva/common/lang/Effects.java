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

package exm.ceva.common.lang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ceva.common.exceptions.CevaRuntimeError;

/**
 * Declared side effects of functions.  An effect is written
 * "resource:access", e.g. db:w, fs:rw or net:r.  A bare resource name
 * means read-write.
 */
public class Effects {

  public static enum Access {
    READ("r"),
    WRITE("w"),
    READ_WRITE("rw");

    private final String code;

    private Access(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }

    public boolean reads() {
      return this != WRITE;
    }

    public boolean writes() {
      return this != READ;
    }

    public static Access fromCode(String code) {
      for (Access a: values()) {
        if (a.code.equalsIgnoreCase(code)) {
          return a;
        }
      }
      throw new CevaRuntimeError("Unknown effect access: " + code);
    }
  }

  public static class Effect {
    private final String resource;
    private final Access access;

    public Effect(String resource, Access access) {
      this.resource = resource.toLowerCase();
      this.access = access;
    }

    public static Effect parse(String text) {
      String s = text.trim();
      int colon = s.lastIndexOf(':');
      if (colon < 0) {
        return new Effect(s, Access.READ_WRITE);
      }
      return new Effect(s.substring(0, colon),
                        Access.fromCode(s.substring(colon + 1)));
    }

    public String resource() {
      return resource;
    }

    public Access access() {
      return access;
    }

    @Override
    public String toString() {
      return resource + ":" + access.code();
    }

    @Override
    public int hashCode() {
      return toString().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Effect)) {
        return false;
      }
      Effect other = (Effect) obj;
      return resource.equals(other.resource) && access == other.access;
    }
  }

  /**
   * Immutable set of declared effects, in declaration order
   */
  public static class EffectSet implements Iterable<Effect> {
    public static final EffectSet NONE =
              new EffectSet(Collections.<Effect>emptyList());

    private final List<Effect> effects;

    public EffectSet(Collection<Effect> effects) {
      List<Effect> unique = new ArrayList<Effect>();
      for (Effect e: effects) {
        if (!unique.contains(e)) {
          unique.add(e);
        }
      }
      this.effects = Collections.unmodifiableList(unique);
    }

    public static EffectSet parse(Collection<String> texts) {
      List<Effect> effects = new ArrayList<Effect>();
      for (String t: texts) {
        if (!StringUtils.isBlank(t)) {
          effects.add(Effect.parse(t));
        }
      }
      return new EffectSet(effects);
    }

    public boolean isEmpty() {
      return effects.isEmpty();
    }

    public List<Effect> asList() {
      return effects;
    }

    @Override
    public Iterator<Effect> iterator() {
      return effects.iterator();
    }

    @Override
    public String toString() {
      return "{" + StringUtils.join(effects, ", ") + "}";
    }

    @Override
    public int hashCode() {
      return effects.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof EffectSet &&
             effects.equals(((EffectSet)obj).effects);
    }
  }
}
