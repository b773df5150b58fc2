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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.Sets;

import exm.iulia.ast.AsmTree.Block;
import exm.iulia.ast.AsmTree.Declaration;
import exm.iulia.ast.AsmTree.Expression;
import exm.iulia.ast.AsmTree.FunctionCall;
import exm.iulia.ast.AsmTree.FunctionDefinition;
import exm.iulia.ast.AsmTree.FunctionalInstruction;
import exm.iulia.ast.AsmTree.Identifier;
import exm.iulia.ast.AsmTree.NodeKind;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.Opcode;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.opt.TreeWalk.TreeWalker;

/**
 * Perform some sanity checks on the tree:
 * - Every declared name is unique in the whole program
 * - Every variable reference names a declared variable
 * - Calls to declared functions and instructions pass the right number
 *   of arguments
 * - Instructions used as statements return nothing
 *
 * Calls to undeclared functions are assumed to be builtins.
 */
public class Validate implements OptimizerPass {

  @Override
  public String getPassName() {
    return "Validate";
  }

  @Override
  public String getConfigEnabledKey() {
    return null;
  }

  @Override
  public Block optimize(Logger logger, Block program) {
    Checker checker = new Checker();
    TreeWalk.walk(program, checker);
    checker.finish();
    return program;
  }

  private static class Checker extends TreeWalker {
    private final Set<String> declared = new HashSet<String>();

    private final Map<String, FunctionDefinition> functions =
                            new HashMap<String, FunctionDefinition>();

    /** Function names of calls, which may be builtins */
    private final Set<Identifier> calleeNames = Sets.newIdentityHashSet();

    private final List<Identifier> variableRefs =
                            new ArrayList<Identifier>();

    private final List<FunctionCall> calls =
                            new ArrayList<FunctionCall>();

    @Override
    protected void visitDeclaration(Declaration decl) {
      if (!declared.add(decl.getName())) {
        throw new IuliaRuntimeError("Duplicate declaration of " +
                                    decl.getName());
      }
      if (decl instanceof FunctionDefinition) {
        functions.put(decl.getName(), (FunctionDefinition)decl);
      }
    }

    @Override
    protected void visit(Statement stmt) {
      if (stmt.kind() == NodeKind.FUNCTIONAL_INSTRUCTION) {
        Opcode op = ((FunctionalInstruction)stmt).getInstruction();
        if (op.returns() != 0) {
          throw new IuliaRuntimeError("Result of " + op.mnemonic() +
                                      " is discarded: " + stmt);
        }
      }
    }

    @Override
    protected void visitExpression(Expression expr) {
      if (expr.kind() == NodeKind.FUNCTION_CALL) {
        FunctionCall call = (FunctionCall)expr;
        calleeNames.add(call.getFunctionName());
        calls.add(call);
      } else if (expr.kind() == NodeKind.FUNCTIONAL_INSTRUCTION) {
        FunctionalInstruction instr = (FunctionalInstruction)expr;
        Opcode op = instr.getInstruction();
        if (instr.getArguments().size() != op.args()) {
          throw new IuliaRuntimeError(op.mnemonic() + " takes " + op.args()
              + " arguments, but got " + instr.getArguments().size());
        }
      }
    }

    @Override
    protected void visitReference(Identifier ref) {
      if (!calleeNames.contains(ref)) {
        variableRefs.add(ref);
      }
    }

    /**
     * Checks needing the whole tree, since functions can be used before
     * their definition
     */
    void finish() {
      for (Identifier ref: variableRefs) {
        if (!declared.contains(ref.getName()) ||
            functions.containsKey(ref.getName())) {
          throw new IuliaRuntimeError("Reference to undeclared variable " +
                                      ref.getName());
        }
      }
      for (FunctionCall call: calls) {
        FunctionDefinition fn = functions.get(
                                    call.getFunctionName().getName());
        if (fn != null &&
            fn.getParameters().size() != call.getArguments().size()) {
          throw new IuliaRuntimeError("Call to " + fn.getName() + " with " +
              call.getArguments().size() + " arguments, expected " +
              fn.getParameters().size());
        }
      }
    }
  }
}
