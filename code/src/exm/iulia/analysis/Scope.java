/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.iulia.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Label;

/**
 * A lexical scope.  Passes treat scopes as opaque identifiers; the name
 * table is filled in by whatever analysis builds the scopes.
 */
public class Scope {
  private final Scope superScope;

  /** True for the scope holding a function's parameters and returns */
  private final boolean functionScope;

  private final Map<String, Declaration> identifiers =
                              new LinkedHashMap<String, Declaration>();

  public Scope(Scope superScope, boolean functionScope) {
    this.superScope = superScope;
    this.functionScope = functionScope;
  }

  /**
   * @param decl
   * @return false if the name was already declared in this scope
   */
  public boolean declare(Declaration decl) {
    if (identifiers.containsKey(decl.getName())) {
      return false;
    }
    identifiers.put(decl.getName(), decl);
    return true;
  }

  /**
   * Look up a name in this scope and enclosing scopes.  Variables of
   * scopes outside the innermost enclosing function are not visible.
   * @param name
   * @return the declaration, or null if not visible
   */
  public Declaration lookup(String name) {
    boolean crossedFunction = false;
    for (Scope s = this; s != null; s = s.superScope) {
      Declaration decl = s.identifiers.get(name);
      if (decl != null) {
        if (!crossedFunction || decl instanceof FunctionDefinition ||
            decl instanceof Label) {
          return decl;
        }
        return null;
      }
      if (s.functionScope) {
        crossedFunction = true;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Scope" + identifiers.keySet();
  }
}
