package exm.iulia.opt;

import static exm.iulia.ast.AsmParser.format;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.iulia.analysis.ScopeAnalyzer;
import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmPrinter;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.common.Logging;
import exm.iulia.common.Settings;
import exm.iulia.common.exceptions.InvalidOptionException;
import exm.iulia.common.exceptions.UserException;

public class AsmOptimizerTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final String SOURCE =
      "{ { let x := 1 } function f(x) -> y { y := add(x, 1) } " +
      "let x := f(2) }";

  @BeforeClass
  public static void setup() throws Exception {
    Settings.initProperties();
    logger = Logging.setupLogging();
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_FULL_INLINE);
    Settings.reset(Settings.COMPILER_DEBUG);
    Settings.reset(Settings.OPT_MAX_ITERATIONS);
  }

  private static String optimize(String source, PrintStream out)
                                                  throws UserException {
    Block program = AsmParser.parse(source);
    Block result = AsmOptimizer.optimize(logger, out, program,
                                         ScopeAnalyzer.analyze(program));
    return AsmPrinter.print(result);
  }

  @Test
  public void testDisambiguateThenInline() throws UserException {
    assertEquals(format("{ { let x := 1 } " +
        "function f(x_1) -> y { y := add(x_1, 1) } " +
        "let x_2 { x_2 := add(2, 1) } }"), optimize(SOURCE, null));
  }

  @Test
  public void testInputNotModified() throws UserException {
    Block program = AsmParser.parse(SOURCE);
    AsmOptimizer.optimize(logger, null, program,
                          ScopeAnalyzer.analyze(program));
    assertEquals(format(SOURCE), AsmPrinter.print(program));
  }

  @Test
  public void testInliningDisabled() throws UserException {
    Settings.set(Settings.OPT_FULL_INLINE, "false");
    assertEquals(format("{ { let x := 1 } " +
        "function f(x_1) -> y { y := add(x_1, 1) } let x_2 := f(2) }"),
        optimize(SOURCE, null));
  }

  @Test
  public void testTreeOutput() throws UserException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    String result = optimize(SOURCE, new PrintStream(bytes, true));
    String log = bytes.toString();
    assertTrue(log, log.contains("// Initial tree before optimization"));
    assertTrue(log, log.contains("// Iteration 1 after Inline functions"));
    assertTrue(log, log.contains("// Final optimized tree"));
    assertTrue(log, log.contains(result));
  }

  @Test
  public void testSettingsInTreeOutput() throws UserException {
    Settings.set(Settings.OPT_MAX_ITERATIONS, "4");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    optimize(SOURCE, new PrintStream(bytes, true));
    String log = bytes.toString();
    assertTrue(log, log.contains(String.format("// %-30s: %s",
                                  Settings.OPT_MAX_ITERATIONS, "4")));
    assertTrue(log, log.contains(Settings.OPT_FULL_INLINE));
  }

  @Test
  public void testInvalidSetting() throws UserException {
    Settings.set(Settings.COMPILER_DEBUG, "maybe");
    exception.expect(InvalidOptionException.class);
    optimize(SOURCE, null);
  }
}
