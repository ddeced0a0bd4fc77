package exm.ceva.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ceva.common.Logging;
import exm.ceva.common.exceptions.CevaRuntimeError;
import exm.ceva.common.lang.Types.Type;

public class TypesTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("TypesTest.ceva.log", true);
  }

  @Test
  public void testBuiltins() {
    assertEquals(Types.I32, Types.parse("i32"));
    assertEquals(Types.U8, Types.parse("byte"));
    assertEquals(Types.arrayOf(Types.I64), Types.parse("[i64]"));
    Type nullable = Types.parse("u16?");
    assertTrue(nullable.isNullable());
  }

  @Test
  public void testOpaqueName() {
    Type t = Types.parse("Connection");
    assertEquals("Connection", t.typeName());
    assertTrue(!t.isInteger());
  }

  @Test
  public void testBadIntegerWidths() {
    for (String bad: new String[] {"i33", "u7", "I128", "[i12]", "u0?"}) {
      try {
        Types.parse(bad);
        fail("Expected error for " + bad);
      } catch (CevaRuntimeError e) {
        assertTrue(e.getMessage(), e.getMessage().contains("integer width"));
      }
    }
  }
}
