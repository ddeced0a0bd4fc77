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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.exceptions.UserException;
import exm.ceva.common.lang.Effects.EffectSet;
import exm.ceva.common.lang.Types;
import exm.ceva.common.lang.Types.Type;

/**
 * Reads a module handed over by the front end as JSON:
 * <pre>
 * {
 *   "name": "shapes", "file": "shapes.cv",
 *   "externals": [
 *     {"name": "execQuery", "effects": ["db:w"], "pure": false,
 *      "sanitizer": false, "returns": "str"}
 *   ],
 *   "functions": [
 *     {"name": "Abs", "line": 3,
 *      "params": [{"name": "n", "type": "i32", "untrusted": false}],
 *      "returns": "i32", "requires": [], "ensures": ["(>= result 0)"],
 *      "effects": [], "body": "(if (< n 0) {(return (- n))} {(return n)})"}
 *   ]
 * }
 * </pre>
 * Contracts and bodies are S-expressions.
 */
public class ModuleReader {
  private static final Logger logger = Logging.getCevaLogger();

  private final ObjectMapper mapper = new ObjectMapper();

  public Module read(File file) throws UserException {
    String text;
    try {
      text = FileUtils.readFileToString(file, "UTF-8");
    } catch (IOException e) {
      throw new UserException("Could not read " + file + ": " +
                              e.getMessage(), e);
    }
    return read(text, FilenameUtils.getName(file.getPath()));
  }

  /**
   * @param sourceName used for positions if the module names no file
   */
  public Module read(String json, String sourceName) throws UserException {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new UserException(sourceName + ": invalid JSON: " +
                              e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new UserException(sourceName + ": expected a JSON object");
    }
    return read(root, sourceName);
  }

  private Module read(JsonNode root, String sourceName)
                                              throws UserException {
    String name = text(root, "name", FilenameUtils.getBaseName(sourceName));
    String file = text(root, "file", sourceName);

    List<ExternalFunction> externals = new ArrayList<ExternalFunction>();
    for (JsonNode ext: array(root, "externals")) {
      externals.add(readExternal(ext, sourceName));
    }

    // Signatures first, so that functions can call each other
    List<JsonNode> fnNodes = array(root, "functions");
    List<Function> signatures = new ArrayList<Function>();
    for (JsonNode fn: fnNodes) {
      signatures.add(builder(fn, file, sourceName, false).build());
    }
    Module sigModule = new Module(name, signatures, externals);

    List<Function> functions = new ArrayList<Function>();
    for (JsonNode fn: fnNodes) {
      functions.add(builder(fn, file, sourceName, true).build(sigModule));
    }
    logger.debug("Read module " + name + ": " + functions.size() +
                 " functions, " + externals.size() + " externals");
    return new Module(name, functions, externals);
  }

  private ExternalFunction readExternal(JsonNode ext, String sourceName)
                                                      throws UserException {
    String extName = requiredText(ext, "name", sourceName);
    Type returnType = null;
    if (ext.hasNonNull("returns")) {
      returnType = type(ext.get("returns").asText(), sourceName);
    }
    return new ExternalFunction(extName, EffectSet.parse(
            strings(ext, "effects")), ext.path("pure").asBoolean(false),
            ext.path("sanitizer").asBoolean(false), returnType);
  }

  /**
   * @param full include contracts and body, otherwise only the signature
   */
  private FunctionBuilder builder(JsonNode fn, String file,
            String sourceName, boolean full) throws UserException {
    String fnName = requiredText(fn, "name", sourceName);
    FunctionBuilder b = new FunctionBuilder(fnName)
          .id(text(fn, "id", fnName))
          .at(file, fn.path("line").asInt(1));
    for (JsonNode p: array(fn, "params")) {
      String pName = requiredText(p, "name", sourceName);
      String pType = requiredText(p, "type", sourceName);
      type(pType, sourceName);
      if (p.path("untrusted").asBoolean(false)) {
        b.untrustedParam(pName, pType);
      } else {
        b.param(pName, pType);
      }
    }
    if (fn.hasNonNull("returns")) {
      type(fn.get("returns").asText(), sourceName);
      b.returns(fn.get("returns").asText());
    }
    if (!full) {
      return b;
    }
    b.requires(strings(fn, "requires").toArray(new String[0]));
    b.ensures(strings(fn, "ensures").toArray(new String[0]));
    b.effects(strings(fn, "effects").toArray(new String[0]));
    b.body(text(fn, "body", ""));
    if (fn.hasNonNull("bodyLine")) {
      b.bodyAt(fn.get("bodyLine").asInt());
    }
    return b;
  }

  private static Type type(String text, String sourceName)
                                                    throws UserException {
    try {
      return Types.parse(text);
    } catch (CevaRuntimeError e) {
      throw new UserException(sourceName + ": " + e.getMessage());
    }
  }

  private static String text(JsonNode node, String field, String dflt) {
    JsonNode child = node.get(field);
    return child == null || child.isNull() ? dflt : child.asText();
  }

  private static String requiredText(JsonNode node, String field,
                      String sourceName) throws UserException {
    JsonNode child = node.get(field);
    if (child == null || !child.isTextual()) {
      throw new UserException(sourceName + ": missing string field '" +
                              field + "' in " + node);
    }
    return child.asText();
  }

  private static List<JsonNode> array(JsonNode node, String field) {
    JsonNode child = node.get(field);
    if (child == null || !child.isArray()) {
      return Collections.emptyList();
    }
    List<JsonNode> result = new ArrayList<JsonNode>();
    for (JsonNode e: child) {
      result.add(e);
    }
    return result;
  }

  private static List<String> strings(JsonNode node, String field) {
    List<String> result = new ArrayList<String>();
    for (JsonNode e: array(node, field)) {
      result.add(e.asText());
    }
    return result;
  }
}
