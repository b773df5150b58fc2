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

import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.opt.TreeWalk.TreeWalker;

/**
 * Checks whether an expression can be moved or duplicated without changing
 * behaviour: literals, identifiers and movable instructions over movable
 * arguments.  Identifiers qualify because expressions never assign
 * variables.  Calls to user functions never qualify.
 */
public class MovableChecker extends TreeWalker {

  private boolean movable = true;

  public static boolean isMovable(Expression expr) {
    MovableChecker checker = new MovableChecker();
    TreeWalk.walk(expr, checker);
    return checker.movable;
  }

  @Override
  protected void visitExpression(Expression expr) {
    switch (expr.kind()) {
      case LITERAL:
      case IDENTIFIER:
        break;
      case FUNCTIONAL_INSTRUCTION:
        if (!((FunctionalInstruction)expr).getInstruction().isMovable()) {
          movable = false;
        }
        break;
      case FUNCTION_CALL:
        movable = false;
        break;
      default:
        throw new IuliaRuntimeError("Unknown expression kind " + expr.kind());
    }
  }
}
