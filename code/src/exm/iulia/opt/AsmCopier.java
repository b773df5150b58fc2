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

import java.util.ArrayList;
import java.util.List;

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
import exm.iulia.ast.AsmTree.Instruction;
import exm.iulia.ast.AsmTree.Label;
import exm.iulia.ast.AsmTree.Literal;
import exm.iulia.ast.AsmTree.StackAssignment;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.Switch;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;
import exm.iulia.common.exceptions.IuliaRuntimeError;

/**
 * Creates a deep copy of a tree.  Subclasses can translate names on the
 * fly by overriding {@link #translateIdentifier(String)}, or the
 * declaration/reference specific hooks, and can track scopes through the
 * enter/leave hooks.
 *
 * Names are translated in program order: a function's name before its
 * parameters, returns and body; a declaration's variables before its
 * value.
 */
public class AsmCopier {

  public Block copy(Block block) {
    return translateBlock(block);
  }

  public Statement copy(Statement stmt) {
    return translateStatement(stmt);
  }

  public Expression copy(Expression expr) {
    return translateExpression(expr);
  }

  protected Statement translateStatement(Statement stmt) {
    switch (stmt.kind()) {
      case BLOCK:
        return translateBlock((Block)stmt);
      case FUNCTION_DEFINITION:
        return translateFunctionDefinition((FunctionDefinition)stmt);
      case VARIABLE_DECLARATION:
        return translateVariableDeclaration((VariableDeclaration)stmt);
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        List<Identifier> targets = new ArrayList<Identifier>();
        for (Identifier target: assign.getTargets()) {
          targets.add(translateReference(target));
        }
        return new Assignment(targets, translateExpression(assign.getValue()));
      }
      case IF: {
        If ifStmt = (If)stmt;
        Expression cond = translateExpression(ifStmt.getCondition());
        return new If(cond, translateBlock(ifStmt.getBody()));
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        Expression expr = translateExpression(sw.getExpression());
        List<Case> cases = new ArrayList<Case>();
        for (Case c: sw.getCases()) {
          cases.add(new Case(translateLiteral(c.getValue()),
                             translateBlock(c.getBody())));
        }
        Block defaultBody = sw.hasDefault() ?
                              translateBlock(sw.getDefault()) : null;
        return new Switch(expr, cases, defaultBody);
      }
      case FOR_LOOP:
        return translateForLoop((ForLoop)stmt);
      case INSTRUCTION:
        return new Instruction(((Instruction)stmt).getInstruction());
      case LABEL:
        return new Label(translateDeclaredName((Label)stmt));
      case STACK_ASSIGNMENT:
        return new StackAssignment(translateReference(
                        ((StackAssignment)stmt).getVariableName()));
      case FUNCTION_CALL:
      case FUNCTIONAL_INSTRUCTION:
      case IDENTIFIER:
      case LITERAL:
        return translateExpression((Expression)stmt);
      default:
        throw new IuliaRuntimeError("Unknown statement kind " + stmt.kind());
    }
  }

  protected Expression translateExpression(Expression expr) {
    switch (expr.kind()) {
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        Identifier name = translateReference(call.getFunctionName());
        return new FunctionCall(name,
                                translateExpressions(call.getArguments()));
      }
      case FUNCTIONAL_INSTRUCTION: {
        FunctionalInstruction instr = (FunctionalInstruction)expr;
        return new FunctionalInstruction(instr.getInstruction(),
                              translateExpressions(instr.getArguments()));
      }
      case IDENTIFIER:
        return translateReference((Identifier)expr);
      case LITERAL:
        return translateLiteral((Literal)expr);
      default:
        throw new IuliaRuntimeError("Unknown expression kind " + expr.kind());
    }
  }

  protected List<Expression> translateExpressions(List<Expression> exprs) {
    List<Expression> result = new ArrayList<Expression>(exprs.size());
    for (Expression expr: exprs) {
      result.add(translateExpression(expr));
    }
    return result;
  }

  protected Literal translateLiteral(Literal lit) {
    return new Literal(lit.getLiteralKind(), lit.getValue(), lit.getType());
  }

  protected Block translateBlock(Block block) {
    enterScope(block);
    List<Statement> statements = translateStatements(block);
    leaveScope(block);
    return new Block(statements);
  }

  /**
   * Translate the statements of a block without entering its scope
   */
  protected List<Statement> translateStatements(Block block) {
    List<Statement> result = new ArrayList<Statement>();
    for (Statement stmt: block.getStatements()) {
      result.add(translateStatement(stmt));
    }
    return result;
  }

  protected Statement translateFunctionDefinition(FunctionDefinition fn) {
    String name = translateDeclaredName(fn);
    enterFunction(fn);
    List<TypedName> params = translateTypedNames(fn.getParameters());
    List<TypedName> returns = translateTypedNames(fn.getReturns());
    Block body = translateBlock(fn.getBody());
    leaveFunction(fn);
    return new FunctionDefinition(name, params, returns, body);
  }

  protected Statement translateVariableDeclaration(VariableDeclaration decl) {
    List<TypedName> vars = translateTypedNames(decl.getVariables());
    Expression value = decl.getValue() == null ? null :
                              translateExpression(decl.getValue());
    return new VariableDeclaration(vars, value);
  }

  /**
   * The init block's scope stays open for condition, post and body
   */
  protected Statement translateForLoop(ForLoop loop) {
    enterScope(loop.getPre());
    Block pre = new Block(translateStatements(loop.getPre()));
    Expression cond = translateExpression(loop.getCondition());
    Block post = translateBlock(loop.getPost());
    Block body = translateBlock(loop.getBody());
    leaveScope(loop.getPre());
    return new ForLoop(pre, cond, post, body);
  }

  protected List<TypedName> translateTypedNames(List<TypedName> names) {
    List<TypedName> result = new ArrayList<TypedName>(names.size());
    for (TypedName tn: names) {
      result.add(new TypedName(translateDeclaredName(tn), tn.getType()));
    }
    return result;
  }

  protected Identifier translateReference(Identifier ref) {
    return new Identifier(translateReferencedName(ref));
  }

  /**
   * Called for the name of every declaration that is copied
   */
  protected String translateDeclaredName(Declaration decl) {
    return translateIdentifier(decl.getName());
  }

  /**
   * Called for every identifier use that is copied
   */
  protected String translateReferencedName(Identifier ref) {
    return translateIdentifier(ref.getName());
  }

  /**
   * Called for every name, declared or used, unless one of the more
   * specific hooks is overridden
   * @param name original name
   * @return name to use in copy
   */
  protected String translateIdentifier(String name) {
    return name;
  }

  protected void enterScope(Block block) {
    // Nothing
  }

  protected void leaveScope(Block block) {
    // Nothing
  }

  /**
   * Function scope holds parameters and return variables; the body block
   * gets its own scope
   */
  protected void enterFunction(FunctionDefinition fn) {
    // Nothing
  }

  protected void leaveFunction(FunctionDefinition fn) {
    // Nothing
  }
}
