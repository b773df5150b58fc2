package exm.iulia.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import org.junit.Test;

import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmPrinter;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.VariableDeclaration;

public class AsmCopierTest {

  private static final String PROGRAM =
      "{ function f(a:u256, b) -> c:u256 { c := add(a, b) l: =: c } " +
      "let x:u256, y := f(1:u256, \"s\") " +
      "if lt(x, 2) { pop(x) } " +
      "switch y case 0 { } case 1 { stop } default { y := true } " +
      "for { let i := 0 } lt(i, 10) { i := add(i, 1) } { { } } }";

  @Test
  public void testCopyIsEqual() {
    Block program = AsmParser.parse(PROGRAM);
    Block copy = new AsmCopier().copy(program);
    assertNotSame(program, copy);
    assertEquals(AsmPrinter.print(program), AsmPrinter.print(copy));
  }

  @Test
  public void testCopyIsDeep() {
    Block program = AsmParser.parse("{ let x := add(1, 2) }");
    Block copy = new AsmCopier().copy(program);
    VariableDeclaration orig = (VariableDeclaration)program.getStatements()
                                                           .get(0);
    ((FunctionalInstruction)orig.getValue()).setArgument(0,
                                                new Identifier("z"));
    assertEquals("{ let x := add(1, 2) }", AsmPrinter.print(copy));
    assertEquals("{ let x := add(z, 2) }", AsmPrinter.print(program));
  }

  @Test
  public void testRenameAllNames() {
    AsmCopier renamer = new AsmCopier() {
      @Override
      protected String translateIdentifier(String name) {
        return name + "2";
      }
    };
    Block copy = renamer.copy(AsmParser.parse(
        "{ function f(a) -> b { b := a } let x := f(x) l: }"));
    assertEquals("{ function f2(a2) -> b2 { b2 := a2 } " +
                 "let x2 := f2(x2) l2: }", AsmPrinter.print(copy));
  }
}
