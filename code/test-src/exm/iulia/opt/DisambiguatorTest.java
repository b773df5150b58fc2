package exm.iulia.opt;

import static exm.iulia.ast.AsmParser.format;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.iulia.analysis.AnalysisInfo;
import exm.iulia.analysis.ScopeAnalyzer;
import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmPrinter;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.common.Logging;
import exm.iulia.common.exceptions.IuliaRuntimeError;

public class DisambiguatorTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() {
    logger = Logging.setupLogging("", true);
  }

  private static String disambiguate(String source) {
    Block program = AsmParser.parse(source);
    AnalysisInfo info = ScopeAnalyzer.analyze(program,
                                      Arrays.asList("builtin"));
    return AsmPrinter.print(
                Disambiguator.disambiguate(logger, program, info));
  }

  /**
   * Check expected output, and that running again changes nothing
   */
  private static void check(String source, String expected) {
    String result = disambiguate(source);
    assertEquals(format(expected), result);
    assertEquals("Should be idempotent", result, disambiguate(result));
  }

  @Test
  public void testEmpty() {
    check("{ }", "{ }");
  }

  @Test
  public void testSiblingBlocks() {
    check("{ { let a:u256 } { let a:u256 } }",
          "{ { let a:u256 } { let a_1:u256 } }");
  }

  @Test
  public void testSkipsTakenSuffix() {
    check("{ { let a:u256 let a_1:u256 } { let a:u256 } }",
          "{ { let a:u256 let a_1:u256 } { let a_2:u256 } }");
  }

  @Test
  public void testFunctionParamsAndReturns() {
    check("{ { let c:u256 let b:u256 } " +
          "function f(a:u256, c:u256) -> b:u256 { let x:u256 } " +
          "{ let a:u256 let x:u256 } }",
          "{ { let c:u256 let b:u256 } " +
          "function f(a:u256, c_1:u256) -> b_1:u256 { let x:u256 } " +
          "{ let a_1:u256 let x_1:u256 } }");
  }

  @Test
  public void testFunctionNameAndCall() {
    check("{ { let a:u256, b:u256, c:u256, d:u256, f:u256 } " +
          "{ function f(a:u256) -> c:u256, d:u256 " +
          "{ let b:u256, c_1:u256 := f(a) } } }",
          "{ { let a:u256, b:u256, c:u256, d:u256, f:u256 } " +
          "{ function f_1(a_1:u256) -> c_1:u256, d_1:u256 " +
          "{ let b_1:u256, c_1_1:u256 := f_1(a_1) } } }");
  }

  @Test
  public void testForLoop() {
    check("{ { let a:u256, b:u256 } " +
          "{ for { let a:u256 } a { a := a } { let b:u256 := a } } }",
          "{ { let a:u256, b:u256 } " +
          "{ for { let a_1:u256 } a_1 { a_1 := a_1 } " +
          "{ let b_1:u256 := a_1 } } }");
  }

  @Test
  public void testSwitch() {
    check("{ { let a:u256, b:u256, c:u256 } " +
          "{ let a:u256 switch a case 0:u256 { let b:u256 := a } " +
          "default { let c:u256 := a } } }",
          "{ { let a:u256, b:u256, c:u256 } " +
          "{ let a_1:u256 switch a_1 case 0:u256 { let b_1:u256 := a_1 } " +
          "default { let c_1:u256 := a_1 } } }");
  }

  @Test
  public void testIf() {
    check("{ { let a:u256, b:u256, c:u256 } " +
          "{ let a:bool if a { let b:bool := a } } }",
          "{ { let a:u256, b:u256, c:u256 } " +
          "{ let a_1:bool if a_1 { let b_1:bool := a_1 } } }");
  }

  @Test
  public void testShadowedOuterVariable() {
    check("{ let x := 1 { let x := 2 sstore(x, x) } sstore(x, 0) }",
          "{ let x := 1 { let x_1 := 2 sstore(x_1, x_1) } sstore(x, 0) }");
  }

  @Test
  public void testFunctionUsedBeforeDefinition() {
    check("{ { function g() { } } let r := f(2) " +
          "function f(a) -> g { g := a } }",
          "{ { function g() { } } let r := f(2) " +
          "function f(a) -> g_1 { g_1 := a } }");
  }

  @Test
  public void testRenamedFunctionUsedBeforeDefinition() {
    check("{ { function f() { } } { f() function f() { } } }",
          "{ { function f() { } } { f_1() function f_1() { } } }");
  }

  @Test
  public void testLabels() {
    check("{ { l: } { let x l: =: x } }",
          "{ { l: } { let x l_1: =: x } }");
  }

  @Test
  public void testBuiltinNotRenamed() {
    check("{ let y := builtin(1) { let y := builtin(y) } }",
          "{ let y := builtin(1) { let y_1 := builtin(y) } }");
  }

  @Test
  public void testInputUnchanged() {
    Block program = AsmParser.parse("{ { let a } { let a } }");
    String before = AsmPrinter.print(program);
    Block result = Disambiguator.disambiguate(logger, program,
                                  ScopeAnalyzer.analyze(program));
    assertNotSame(program, result);
    assertEquals(before, AsmPrinter.print(program));
  }

  @Test
  public void testDeterministic() {
    String source = "{ { let a function f(a) -> b { b := a } } " +
                    "{ let a let b := f(a) } }";
    assertEquals(disambiguate(source), disambiguate(source));
  }

  @Test
  public void testUnresolvedIdentifier() {
    Block program = AsmParser.parse("{ let a }");
    AnalysisInfo info = ScopeAnalyzer.analyze(program);
    // Identifier the analysis never saw
    program.addStatement(new Identifier("a"));

    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("Unresolved identifier a");
    Disambiguator.disambiguate(logger, program, info);
  }

  @Test
  public void testRunOnce() {
    Block program = AsmParser.parse("{ }");
    Disambiguator disambiguator = new Disambiguator(logger,
                                      ScopeAnalyzer.analyze(program));
    disambiguator.run(program);

    exception.expect(IuliaRuntimeError.class);
    disambiguator.run(program);
  }
}
