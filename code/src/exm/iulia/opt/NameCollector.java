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
package exm.iulia.opt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.opt.TreeWalk.TreeWalker;

/**
 * Collects every name declared in a tree: variables, functions,
 * parameters, return variables and labels.  Also records every function
 * definition by name, and every name that is used.
 */
public class NameCollector extends TreeWalker {

  private final Set<String> names = new LinkedHashSet<String>();

  /** Every name used, including builtins with no declaration */
  private final Set<String> referencedNames = new LinkedHashSet<String>();

  private final Map<String, FunctionDefinition> functions =
                        new LinkedHashMap<String, FunctionDefinition>();

  public static NameCollector collect(Block block) {
    NameCollector collector = new NameCollector();
    TreeWalk.walk(block, collector);
    return collector;
  }

  @Override
  protected void visitDeclaration(Declaration declared) {
    names.add(declared.getName());
    if (declared instanceof FunctionDefinition) {
      functions.put(declared.getName(), (FunctionDefinition)declared);
    }
  }

  @Override
  protected void visitReference(Identifier ref) {
    referencedNames.add(ref.getName());
  }

  /**
   * @return declared names, in order of first declaration
   */
  public Set<String> names() {
    return Collections.unmodifiableSet(names);
  }

  /**
   * @return names of identifiers and callees, in order of first use
   */
  public Set<String> referencedNames() {
    return Collections.unmodifiableSet(referencedNames);
  }

  public Map<String, FunctionDefinition> functions() {
    return Collections.unmodifiableMap(functions);
  }
}
