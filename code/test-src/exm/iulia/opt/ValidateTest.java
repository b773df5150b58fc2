package exm.iulia.opt;

import static org.junit.Assert.assertSame;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.common.Logging;
import exm.iulia.common.exceptions.IuliaRuntimeError;

public class ValidateTest {

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() {
    logger = Logging.setupLogging("", false);
  }

  private static Block validate(String source) {
    Block program = AsmParser.parse(source);
    return new Validate().optimize(logger, program);
  }

  @Test
  public void testValid() {
    Block program = AsmParser.parse("{ let x := f(1) " +
        "function f(a) -> b { b := builtin(a) l: } =: x }");
    assertSame(program, new Validate().optimize(logger, program));
  }

  @Test
  public void testDuplicateInSiblingBlocks() {
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("Duplicate declaration of a");
    validate("{ { let a } { let a } }");
  }

  @Test
  public void testDuplicateParameter() {
    exception.expect(IuliaRuntimeError.class);
    validate("{ let a function f(a) { } }");
  }

  @Test
  public void testUndeclaredVariable() {
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("undeclared variable y");
    validate("{ let x := add(y, 1) }");
  }

  @Test
  public void testFunctionUsedAsVariable() {
    exception.expect(IuliaRuntimeError.class);
    validate("{ function f() { } let x := f }");
  }

  @Test
  public void testArgumentCount() {
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("Call to f with 2 arguments, expected 1");
    validate("{ function f(a) { } f(1, 2) }");
  }

  @Test
  public void testInstructionArgumentCount() {
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("add takes 2 arguments, but got 1");
    validate("{ let x := add(1) }");
  }

  @Test
  public void testDiscardedInstructionResult() {
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("Result of mload is discarded");
    validate("{ mload(0) }");
  }
}
