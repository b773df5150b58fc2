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

import java.util.IdentityHashMap;
import java.util.Map;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.Node;
import exm.iulia.common.exceptions.IuliaRuntimeError;

/**
 * Binding information for one tree, produced by the analysis that runs
 * before the optimizer:
 * - the scope opened by every block and function definition
 * - the scope every declaration belongs to
 * - the declaration every identifier use resolves to
 *
 * All maps are keyed by node identity.  A failed lookup means the
 * information does not match the tree, which is an internal error.
 */
public class AnalysisInfo {

  /**
   * Resolution of a use that does not refer to a user declaration,
   * e.g. a builtin function
   */
  public static final Declaration PRIMITIVE = new Declaration() {
    @Override
    public String getName() {
      return "<primitive>";
    }
  };

  private final Map<Node, Scope> scopes = new IdentityHashMap<Node, Scope>();

  private final Map<Declaration, Scope> declarationScopes =
                                  new IdentityHashMap<Declaration, Scope>();

  private final Map<Identifier, Declaration> references =
                              new IdentityHashMap<Identifier, Declaration>();

  /**
   * @param opener a block, or a function definition (whose scope holds
   *               the parameters and return variables)
   * @param scope
   */
  public void registerScope(Node opener, Scope scope) {
    assert(opener instanceof Block || opener instanceof FunctionDefinition);
    scopes.put(opener, scope);
  }

  public void registerDeclaration(Declaration decl, Scope scope) {
    declarationScopes.put(decl, scope);
  }

  public void registerReference(Identifier use, Declaration decl) {
    references.put(use, decl);
  }

  public Scope scopeOpenedBy(Node opener) {
    Scope scope = scopes.get(opener);
    if (scope == null) {
      throw new IuliaRuntimeError("No scope registered for " + opener);
    }
    return scope;
  }

  public Scope declarationScope(Declaration decl) {
    Scope scope = declarationScopes.get(decl);
    if (scope == null) {
      throw new IuliaRuntimeError("Declaration of " + decl.getName() +
                                  " not registered in any scope");
    }
    return scope;
  }

  /**
   * @param use
   * @return declaration, or {@link #PRIMITIVE}
   */
  public Declaration resolve(Identifier use) {
    Declaration decl = references.get(use);
    if (decl == null) {
      throw new IuliaRuntimeError("Unresolved identifier " + use.getName());
    }
    return decl;
  }
}
