package exm.ceva.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.UserException;

public class ModuleReaderTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ModuleReaderTest.ceva.log", true);
  }

  private static Module read(String json) throws UserException {
    return new ModuleReader().read(json.replace('\'', '"'), "input.json");
  }

  @Test
  public void testReadModule() throws Exception {
    Module m = read("{'name': 'orders', 'file': 'orders.src'," +
        " 'externals': [{'name': 'escape', 'sanitizer': true," +
        "   'returns': 'str'}, {'name': 'save', 'effects': ['db:w']}]," +
        " 'functions': [{'name': 'total', 'id': 'orders.total'," +
        "   'line': 7, 'params': [{'name': 'n', 'type': 'i32'}," +
        "   {'name': 'q', 'type': 'str', 'untrusted': true}]," +
        "   'returns': 'i32', 'requires': ['(>= n 0)']," +
        "   'ensures': ['(>= result n)'], 'effects': ['db:w']," +
        "   'body': '(do (save q)) (return n)'}]}");
    assertEquals("orders", m.name());
    assertEquals(1, m.functions().size());
    assertEquals(2, m.externals().size());
    assertTrue(m.lookupExternal("escape").isSanitizer());

    Function f = m.lookupFunction("total");
    assertNotNull(f);
    assertEquals("orders.total", f.id());
    assertEquals(2, f.params().size());
    assertFalse(f.params().get(0).isUntrusted());
    assertTrue(f.params().get(1).isUntrusted());
    assertEquals(1, f.preconditions().size());
    assertEquals(1, f.postconditions().size());
    assertEquals(2, f.body().size());
    assertEquals("orders.src", f.span().getFile());
    assertEquals(7, f.span().getLine());
    assertEquals(8, f.body().get(0).span().getLine());
  }

  @Test
  public void testFunctionsSeeEachOther() throws Exception {
    Module m = read("{'functions': [" +
        "{'name': 'even', 'params': [{'name': 'n', 'type': 'u32'}]," +
        " 'returns': 'bool'," +
        " 'body': '(if (== n 0u32) {(return true)}) (return (odd (- n 1u32)))'}," +
        "{'name': 'odd', 'params': [{'name': 'n', 'type': 'u32'}]," +
        " 'returns': 'bool'," +
        " 'body': '(if (== n 0u32) {(return false)}) (return (even (- n 1u32)))'}" +
        "]}");
    assertEquals("input", m.name());
    assertEquals(2, m.functions().size());
    assertEquals("input.json", m.lookupFunction("odd").span().getFile());
  }

  @Test
  public void testInvalidJson() throws Exception {
    try {
      read("{'functions': [");
      fail("expected UserException");
    } catch (UserException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("input.json"));
    }
  }

  @Test(expected=UserException.class)
  public void testMissingName() throws Exception {
    read("{'functions': [{'params': []}]}");
  }

  @Test(expected=UserException.class)
  public void testBadType() throws Exception {
    read("{'functions': [{'name': 'f', 'returns': 'i33'}]}");
  }

  @Test(expected=UserException.class)
  public void testBadBody() throws Exception {
    read("{'functions': [{'name': 'f', 'body': '(return undefined_var)'}]}");
  }
}
