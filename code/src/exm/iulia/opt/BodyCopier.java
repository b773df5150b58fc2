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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.ast.AsmTree.NodeKind;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;
import exm.iulia.common.exceptions.IuliaRuntimeError;

/**
 * Creates a copy of a block that is supposed to be the body of a function.
 * Applies replacements to referenced variables and creates new names for
 * everything declared inside: variables, nested functions with their
 * parameters and returns, and labels.
 */
public class BodyCopier extends AsmCopier {

  private final NameDispenser nameDispenser;
  private final String varNamePrefix;

  /**
   * Name -> replacement.  An identifier replacement renames; any other
   * expression is substituted by value at every use.
   */
  private final Map<String, Expression> replacements;

  /** Used to copy substituted expressions without renaming them */
  private final AsmCopier plainCopier = new AsmCopier();

  public BodyCopier(NameDispenser nameDispenser, String varNamePrefix,
                    Map<String, Expression> replacements) {
    this.nameDispenser = nameDispenser;
    this.varNamePrefix = varNamePrefix;
    this.replacements = new HashMap<String, Expression>(replacements);
  }

  /**
   * Functions and labels are visible in their whole block, so they are
   * renamed before anything in the block is copied
   */
  @Override
  protected List<Statement> translateStatements(Block block) {
    for (Statement stmt: block.getStatements()) {
      if (stmt.kind() == NodeKind.FUNCTION_DEFINITION) {
        rename(((FunctionDefinition)stmt).getName());
      } else if (stmt.kind() == NodeKind.LABEL) {
        rename(((Label)stmt).getName());
      }
    }
    return super.translateStatements(block);
  }

  @Override
  protected Statement translateVariableDeclaration(VariableDeclaration decl) {
    for (TypedName var: decl.getVariables()) {
      rename(var.getName());
    }
    return super.translateVariableDeclaration(decl);
  }

  @Override
  protected Statement translateFunctionDefinition(FunctionDefinition fn) {
    for (TypedName param: fn.getParameters()) {
      rename(param.getName());
    }
    for (TypedName ret: fn.getReturns()) {
      rename(ret.getName());
    }
    return super.translateFunctionDefinition(fn);
  }

  @Override
  protected Expression translateExpression(Expression expr) {
    if (expr.kind() == NodeKind.IDENTIFIER) {
      Expression repl = replacements.get(((Identifier)expr).getName());
      if (repl != null && repl.kind() != NodeKind.IDENTIFIER) {
        return plainCopier.copy(repl);
      }
    }
    return super.translateExpression(expr);
  }

  @Override
  protected String translateIdentifier(String name) {
    Expression repl = replacements.get(name);
    if (repl == null) {
      return name;
    } else if (repl.kind() == NodeKind.IDENTIFIER) {
      return ((Identifier)repl).getName();
    } else {
      throw new IuliaRuntimeError("Cannot use " + name + " as a name: " +
                                  "it is replaced by " + repl);
    }
  }

  private void rename(String name) {
    String newName = nameDispenser.newName(varNamePrefix + name);
    replacements.put(name, new Identifier(newName));
  }
}
