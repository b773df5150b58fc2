package exm.iulia.analysis;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Test;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.ast.AsmTree.TypedName;

public class ScopeTest {

  @Test
  public void testDeclareTwice() {
    Scope scope = new Scope(null, false);
    assertTrue(scope.declare(new TypedName("a")));
    assertFalse(scope.declare(new TypedName("a")));
  }

  @Test
  public void testLookupOuter() {
    Scope outer = new Scope(null, false);
    TypedName a = new TypedName("a");
    outer.declare(a);
    Scope inner = new Scope(outer, false);
    assertSame(a, inner.lookup("a"));
    assertNull(inner.lookup("b"));
  }

  @Test
  public void testFunctionBoundary() {
    Scope outer = new Scope(null, false);
    TypedName a = new TypedName("a");
    FunctionDefinition f = new FunctionDefinition("f",
        Collections.<TypedName>emptyList(),
        Collections.<TypedName>emptyList(), new Block());
    Label l = new Label("l");
    outer.declare(a);
    outer.declare(f);
    outer.declare(l);

    Scope fnScope = new Scope(outer, true);
    Scope body = new Scope(fnScope, false);
    assertNull("Variables outside function not visible", body.lookup("a"));
    assertSame(f, body.lookup("f"));
    assertSame(l, body.lookup("l"));
  }
}
