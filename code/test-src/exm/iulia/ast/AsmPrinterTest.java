package exm.iulia.ast;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.Literal;
import exm.iulia.ast.AsmTree.LiteralKind;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;

public class AsmPrinterTest {

  @Test
  public void testEmptyBlock() {
    assertEquals("{ }", AsmPrinter.print(new Block()));
  }

  @Test
  public void testFunctionWithoutReturns() {
    FunctionDefinition fn = new FunctionDefinition("f",
        Arrays.asList(new TypedName("a", "u256"), new TypedName("b")),
        Collections.<TypedName>emptyList(), new Block());
    assertEquals("function f(a:u256, b) { }", AsmPrinter.print(fn));
  }

  @Test
  public void testLiterals() {
    Expression add = new FunctionalInstruction(Opcode.ADD,
        Arrays.<Expression>asList(
        new Literal(LiteralKind.NUMBER, "1", "u256"),
        new Literal(LiteralKind.STRING, "abc", ""),
        new Literal(LiteralKind.BOOLEAN, "true", "bool")));
    assertEquals("add(1:u256, \"abc\", true:bool)", AsmPrinter.print(add));
  }

  @Test
  public void testDeclarationWithoutValue() {
    VariableDeclaration decl = new VariableDeclaration(
        Arrays.asList(new TypedName("x", "u256"), new TypedName("y")), null);
    assertEquals("let x:u256, y", AsmPrinter.print(decl));
    decl.setValue(new Identifier("z"));
    assertEquals("let x:u256, y := z", decl.toString());
  }

  @Test
  public void testParsedForms() {
    String[] forms = {
      "{ for { let i := 0 } lt(i, 3) { i := add(i, 1) } { } }",
      "{ switch x case 0 { } default { stop } }",
      "{ l: =: y a, b := f() if a { pop(b) } }",
    };
    for (String form: forms) {
      assertEquals(form, AsmParser.format(form));
    }
  }
}
