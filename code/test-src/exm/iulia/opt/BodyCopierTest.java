package exm.iulia.opt;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.iulia.ast.AsmParser;
import exm.iulia.ast.AsmPrinter;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.Literal;
import exm.iulia.common.exceptions.IuliaRuntimeError;

public class BodyCopierTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Map<String, Expression> replacements() {
    Map<String, Expression> repl = new HashMap<String, Expression>();
    repl.put("a", new Identifier("y"));
    repl.put("b", Literal.number(7));
    repl.put("c", new Identifier("res"));
    return repl;
  }

  @Test
  public void testReplaceAndRename() {
    Block body = AsmParser.parse("{ let t := add(a, b) c := t " +
        "function g(p) -> q { q := mul(p, b) } c := g(c) l: }");
    NameDispenser names = new NameDispenser(
                                NameCollector.collect(body).names());
    Block copy = new BodyCopier(names, "f_", replacements()).copy(body);
    assertEquals("{ let f_t := add(y, 7) res := f_t " +
        "function f_g(f_p) -> f_q { f_q := mul(f_p, 7) } " +
        "res := f_g(res) f_l: }", AsmPrinter.print(copy));
  }

  @Test
  public void testRenameAvoidsUsedNames() {
    Block body = AsmParser.parse("{ let t := a c := t }");
    NameDispenser names = new NameDispenser(Arrays.asList("f_t"));
    Block copy = new BodyCopier(names, "f_", replacements()).copy(body);
    assertEquals("{ let f_t_1 := y res := f_t_1 }", AsmPrinter.print(copy));
  }

  @Test
  public void testNestedBlocksShareRenames() {
    Block body = AsmParser.parse("{ let t { t := a } if t { c := t } }");
    Block copy = new BodyCopier(new NameDispenser(), "f_", replacements())
                                                                .copy(body);
    assertEquals("{ let f_t { f_t := y } if f_t { res := f_t } }",
                 AsmPrinter.print(copy));
  }

  @Test
  public void testValueReplacementAssigned() {
    Block body = AsmParser.parse("{ b := 1 }");
    exception.expect(IuliaRuntimeError.class);
    exception.expectMessage("Cannot use b as a name");
    new BodyCopier(new NameDispenser(), "f_", replacements()).copy(body);
  }
}
