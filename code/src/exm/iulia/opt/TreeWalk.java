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

import exm.iulia.ast.AsmTree.Assignment;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Case;
import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.ForLoop;
import exm.iulia.ast.AsmTree.FunctionCall;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.If;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.ast.AsmTree.StackAssignment;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.Switch;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;
import exm.iulia.common.exceptions.IuliaRuntimeError;

public class TreeWalk {

  /**
   * Walk pre-order, in program order
   * @param block
   * @param walker
   */
  public static void walk(Block block, TreeWalker walker) {
    walkBlock(block, null, walker);
  }

  /**
   * Walk an expression and its arguments pre-order
   * @param expr
   * @param walker
   */
  public static void walk(Expression expr, TreeWalker walker) {
    walkExpression(expr, null, walker);
  }

  private static void walkBlock(Block block, FunctionDefinition function,
                                TreeWalker walker) {
    walker.visit(function, block);
    for (Statement stmt: block.getStatements()) {
      walkStatement(stmt, function, walker);
    }
  }

  private static void walkStatement(Statement stmt,
          FunctionDefinition function, TreeWalker walker) {
    walker.visit(function, stmt);
    switch (stmt.kind()) {
      case BLOCK:
        walkBlock((Block)stmt, function, walker);
        break;
      case FUNCTION_DEFINITION: {
        FunctionDefinition fn = (FunctionDefinition)stmt;
        walker.visitDeclaration(function, fn);
        for (TypedName param: fn.getParameters()) {
          walker.visitDeclaration(fn, param);
        }
        for (TypedName ret: fn.getReturns()) {
          walker.visitDeclaration(fn, ret);
        }
        walkBlock(fn.getBody(), fn, walker);
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        for (TypedName var: decl.getVariables()) {
          walker.visitDeclaration(function, var);
        }
        if (decl.getValue() != null) {
          walkExpression(decl.getValue(), function, walker);
        }
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        for (Identifier target: assign.getTargets()) {
          walker.visitReference(function, target);
        }
        walkExpression(assign.getValue(), function, walker);
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        walkExpression(ifStmt.getCondition(), function, walker);
        walkBlock(ifStmt.getBody(), function, walker);
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        walkExpression(sw.getExpression(), function, walker);
        for (Case c: sw.getCases()) {
          walkExpression(c.getValue(), function, walker);
          walkBlock(c.getBody(), function, walker);
        }
        if (sw.hasDefault()) {
          walkBlock(sw.getDefault(), function, walker);
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        walkBlock(loop.getPre(), function, walker);
        walkExpression(loop.getCondition(), function, walker);
        walkBlock(loop.getPost(), function, walker);
        walkBlock(loop.getBody(), function, walker);
        break;
      }
      case LABEL:
        walker.visitDeclaration(function, (Label)stmt);
        break;
      case STACK_ASSIGNMENT:
        walker.visitReference(function,
                      ((StackAssignment)stmt).getVariableName());
        break;
      case INSTRUCTION:
        break;
      case FUNCTION_CALL:
      case FUNCTIONAL_INSTRUCTION:
      case IDENTIFIER:
      case LITERAL:
        walkExpression((Expression)stmt, function, walker);
        break;
      default:
        throw new IuliaRuntimeError("Unknown statement kind " + stmt.kind());
    }
  }

  private static void walkExpression(Expression expr,
          FunctionDefinition function, TreeWalker walker) {
    walker.visitExpression(function, expr);
    switch (expr.kind()) {
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        walker.visitReference(function, call.getFunctionName());
        for (Expression arg: call.getArguments()) {
          walkExpression(arg, function, walker);
        }
        break;
      }
      case FUNCTIONAL_INSTRUCTION:
        for (Expression arg: ((FunctionalInstruction)expr).getArguments()) {
          walkExpression(arg, function, walker);
        }
        break;
      case IDENTIFIER:
        walker.visitReference(function, (Identifier)expr);
        break;
      case LITERAL:
        break;
      default:
        throw new IuliaRuntimeError("Unknown expression kind " + expr.kind());
    }
  }

  /**
   * Hooks called by the walk.  functionContext is the innermost function
   * definition around the visited node, or null at the top level.
   */
  public static abstract class TreeWalker {
    public void visit(FunctionDefinition functionContext, Block block) {
      visit(block);
    }
    protected void visit(Block block) {
      // Nothing
    }

    public void visit(FunctionDefinition functionContext, Statement stmt) {
      visit(stmt);
    }
    protected void visit(Statement stmt) {
      // Nothing
    }

    public void visitDeclaration(FunctionDefinition functionContext,
                                 Declaration declared) {
      visitDeclaration(declared);
    }
    protected void visitDeclaration(Declaration declared) {
      // Nothing
    }

    public void visitExpression(FunctionDefinition functionContext,
                                Expression expr) {
      visitExpression(expr);
    }
    protected void visitExpression(Expression expr) {
      // nothing
    }

    public void visitReference(FunctionDefinition functionContext,
                               Identifier ref) {
      visitReference(ref);
    }
    protected void visitReference(Identifier ref) {
      // nothing
    }
  }
}
