package exm.iulia.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import exm.iulia.ast.AsmParser;

public class NameCollectorTest {

  @Test
  public void testCollectsAllDeclarations() {
    NameCollector names = NameCollector.collect(AsmParser.parse(
        "{ let a, b := 1 function f(p) -> r { let t l: } " +
        "for { let i } lt(i, 2) { } { let j } }"));
    assertEquals(Arrays.asList("a", "b", "f", "p", "r", "t", "l", "i", "j"),
                 new ArrayList<String>(names.names()));
  }

  @Test
  public void testReferencesNotCollected() {
    NameCollector names = NameCollector.collect(AsmParser.parse(
        "{ let a := foo(b) c := a }"));
    assertEquals(Arrays.asList("a"), new ArrayList<String>(names.names()));
    assertTrue(names.functions().isEmpty());
  }

  @Test
  public void testReferencedNames() {
    NameCollector names = NameCollector.collect(AsmParser.parse(
        "{ let a := foo(b) c := a =: d }"));
    assertEquals(Arrays.asList("foo", "b", "c", "a", "d"),
                 new ArrayList<String>(names.referencedNames()));
  }

  @Test
  public void testFunctions() {
    NameCollector names = NameCollector.collect(AsmParser.parse(
        "{ function f() { function g() { } } { function h(x) { } } }"));
    assertEquals(Arrays.asList("f", "g", "h"),
                 new ArrayList<String>(names.functions().keySet()));
    assertEquals(1, names.functions().get("h").getParameters().size());
  }
}
