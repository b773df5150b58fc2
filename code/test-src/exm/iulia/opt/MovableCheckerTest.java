package exm.iulia.opt;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.VariableDeclaration;

public class MovableCheckerTest {

  private static Expression expr(String text) {
    Block block = AsmParser.parse("{ let x := " + text + " }");
    return ((VariableDeclaration)block.getStatements().get(0)).getValue();
  }

  @Test
  public void testMovable() {
    assertTrue(MovableChecker.isMovable(expr("1")));
    assertTrue(MovableChecker.isMovable(expr("y")));
    assertTrue(MovableChecker.isMovable(expr("\"abc\"")));
    assertTrue(MovableChecker.isMovable(expr("add(y, mul(2, z))")));
  }

  @Test
  public void testStateReadNotMovable() {
    assertFalse(MovableChecker.isMovable(expr("mload(0)")));
    assertFalse(MovableChecker.isMovable(expr("add(1, sload(y))")));
  }

  @Test
  public void testCallNotMovable() {
    assertFalse(MovableChecker.isMovable(expr("f()")));
    assertFalse(MovableChecker.isMovable(expr("add(f(1), 2)")));
  }
}
