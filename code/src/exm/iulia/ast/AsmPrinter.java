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
package exm.iulia.ast;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.iulia.ast.AsmTree.Assignment;
import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Case;
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
import exm.iulia.ast.AsmTree.Node;
import exm.iulia.ast.AsmTree.StackAssignment;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.Switch;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;
import exm.iulia.common.exceptions.IuliaRuntimeError;

/**
 * Renders a tree on a single line, e.g.
 * <pre>{ function f(a:u256) -> c:u256 { c := add(a, 1:u256) } let x := f(2) }</pre>
 */
public class AsmPrinter {

  public static String print(Node node) {
    StringBuilder sb = new StringBuilder();
    print(sb, node);
    return sb.toString();
  }

  private static void print(StringBuilder sb, Node node) {
    switch (node.kind()) {
      case BLOCK:
        printBlock(sb, (Block)node);
        break;
      case FUNCTION_DEFINITION: {
        FunctionDefinition fn = (FunctionDefinition)node;
        sb.append("function ").append(fn.getName()).append("(");
        sb.append(StringUtils.join(fn.getParameters(), ", "));
        sb.append(")");
        if (!fn.getReturns().isEmpty()) {
          sb.append(" -> ").append(StringUtils.join(fn.getReturns(), ", "));
        }
        sb.append(" ");
        printBlock(sb, fn.getBody());
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)node;
        sb.append("let ").append(StringUtils.join(decl.getVariables(), ", "));
        if (decl.getValue() != null) {
          sb.append(" := ");
          print(sb, decl.getValue());
        }
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)node;
        List<String> targets = new ArrayList<String>();
        for (Identifier target: assign.getTargets()) {
          targets.add(target.getName());
        }
        sb.append(StringUtils.join(targets, ", ")).append(" := ");
        print(sb, assign.getValue());
        break;
      }
      case IF: {
        If ifStmt = (If)node;
        sb.append("if ");
        print(sb, ifStmt.getCondition());
        sb.append(" ");
        printBlock(sb, ifStmt.getBody());
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)node;
        sb.append("switch ");
        print(sb, sw.getExpression());
        for (Case c: sw.getCases()) {
          sb.append(" case ");
          print(sb, c.getValue());
          sb.append(" ");
          printBlock(sb, c.getBody());
        }
        if (sw.hasDefault()) {
          sb.append(" default ");
          printBlock(sb, sw.getDefault());
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)node;
        sb.append("for ");
        printBlock(sb, loop.getPre());
        sb.append(" ");
        print(sb, loop.getCondition());
        sb.append(" ");
        printBlock(sb, loop.getPost());
        sb.append(" ");
        printBlock(sb, loop.getBody());
        break;
      }
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)node;
        sb.append(call.getFunctionName().getName());
        printArgs(sb, call.getArguments());
        break;
      }
      case FUNCTIONAL_INSTRUCTION: {
        FunctionalInstruction instr = (FunctionalInstruction)node;
        sb.append(instr.getInstruction().mnemonic());
        printArgs(sb, instr.getArguments());
        break;
      }
      case INSTRUCTION:
        sb.append(((Instruction)node).getInstruction().mnemonic());
        break;
      case IDENTIFIER:
        sb.append(((Identifier)node).getName());
        break;
      case LITERAL:
        printLiteral(sb, (Literal)node);
        break;
      case LABEL:
        sb.append(((Label)node).getName()).append(":");
        break;
      case STACK_ASSIGNMENT:
        sb.append("=: ");
        sb.append(((StackAssignment)node).getVariableName().getName());
        break;
      default:
        throw new IuliaRuntimeError("Unknown node kind " + node.kind());
    }
  }

  private static void printBlock(StringBuilder sb, Block block) {
    sb.append("{ ");
    for (Statement stmt: block.getStatements()) {
      print(sb, stmt);
      sb.append(" ");
    }
    sb.append("}");
  }

  private static void printArgs(StringBuilder sb, List<Expression> args) {
    sb.append("(");
    boolean first = true;
    for (Expression arg: args) {
      if (first) {
        first = false;
      } else {
        sb.append(", ");
      }
      print(sb, arg);
    }
    sb.append(")");
  }

  private static void printLiteral(StringBuilder sb, Literal lit) {
    switch (lit.getLiteralKind()) {
      case STRING:
        sb.append('"').append(lit.getValue()).append('"');
        break;
      case NUMBER:
      case BOOLEAN:
        sb.append(lit.getValue());
        break;
      default:
        throw new IuliaRuntimeError("Unknown literal kind "
                                    + lit.getLiteralKind());
    }
    if (lit.hasType()) {
      sb.append(":").append(lit.getType());
    }
  }
}
