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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

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
import exm.iulia.ast.AsmTree.NodeKind;
import exm.iulia.ast.AsmTree.StackAssignment;
import exm.iulia.ast.AsmTree.Statement;
import exm.iulia.ast.AsmTree.Switch;
import exm.iulia.ast.AsmTree.TypedName;
import exm.iulia.ast.AsmTree.VariableDeclaration;
import exm.iulia.common.exceptions.IuliaRuntimeError;
import exm.iulia.common.util.Pair;
import exm.iulia.common.util.StackLite;
import exm.iulia.opt.TreeWalk.TreeWalker;

/**
 * Modifies a tree in place, inlining calls to arbitrary functions.
 *
 * Code of the form
 *
 * function f(a, b) -> c { ... }
 * let x := h(g(1), f(arg1(...), y))
 *
 * is transformed into
 *
 * function f(a, b) -> c { ... }
 * let h_1 := g(1) let f_a := arg1(...) let f_c
 * { code of f, with replacements: a -> f_a, b -> y, c -> f_c, d -> f_d }
 * let x := h(h_1, f_c)
 *
 * No temporary is created for arguments that are movable (see
 * {@link MovableChecker}) unless the function assigns to the parameter.
 * Arguments are evaluated left to right, so when an argument needs
 * statements hoisted in front of the call, non-movable arguments to its
 * left are first stored in temporaries.
 *
 * Function bodies are copied from a snapshot of the tree taken before any
 * change.  Functions that are (mutually) recursive are never inlined, and
 * a function is never inlined into its own body.
 *
 * The tree must have unique names (see {@link Disambiguator}).
 */
public class FullInliner {

  /** Prefix for temporaries of calls that are not inlined */
  private static final String TMP_PREFIX = "tmp";

  private final Logger logger;

  private final Block program;

  /** Functions in the snapshot; nothing else references the snapshot */
  private final ImmutableMap<String, FunctionDefinition> functions;

  /** Functions that can reach themselves through calls */
  private final ImmutableSet<String> recursiveFunctions;

  /** The functions we are inside of (we cannot inline them) */
  private final Set<String> functionScopes = new HashSet<String>();

  private final NameDispenser nameDispenser;

  private int inlinedCalls = 0;

  private boolean done = false;

  public FullInliner(Logger logger, Block program) {
    this.logger = logger;
    this.program = program;

    Block snapshot = new AsmCopier().copy(program);
    NameCollector names = NameCollector.collect(snapshot);
    this.functions = ImmutableMap.copyOf(names.functions());
    // Builtins are used but never declared: their names are taken too
    Set<String> usedNames = new HashSet<String>(names.names());
    usedNames.addAll(names.referencedNames());
    this.nameDispenser = new NameDispenser(usedNames);
    this.recursiveFunctions = findRecursive(logger, snapshot);
  }

  /**
   * Do the inlining
   * @return number of call sites expanded
   */
  public int run() {
    if (done) {
      throw new IuliaRuntimeError("FullInliner can only be run once");
    }
    done = true;
    visitBlock(program);
    logger.debug("Inlined " + inlinedCalls + " call sites");
    return inlinedCalls;
  }

  /**
   * Replace every statement of block with the statements returned for it.
   * The iterator is positioned after the inserted statements, so they are
   * not visited again.
   */
  private void visitBlock(Block block) {
    ListIterator<Statement> it = block.statementIterator();
    while (it.hasNext()) {
      Statement stmt = it.next();
      List<Statement> replacement = visitStatement(stmt);
      if (replacement.size() == 1 && replacement.get(0) == stmt) {
        continue;
      }
      it.remove();
      for (Statement newStmt: replacement) {
        it.add(newStmt);
      }
    }
  }

  /**
   * @return statements that replace stmt in its block
   */
  private List<Statement> visitStatement(Statement stmt) {
    switch (stmt.kind()) {
      case BLOCK:
        visitBlock((Block)stmt);
        return Collections.singletonList(stmt);
      case FUNCTION_DEFINITION: {
        FunctionDefinition fn = (FunctionDefinition)stmt;
        functionScopes.add(fn.getName());
        visitBlock(fn.getBody());
        functionScopes.remove(fn.getName());
        return Collections.singletonList(stmt);
      }
      case VARIABLE_DECLARATION:
        return visitVariableDeclaration((VariableDeclaration)stmt);
      case ASSIGNMENT:
        return visitAssignment((Assignment)stmt);
      case IF: {
        If ifStmt = (If)stmt;
        Pair<List<Statement>, Expression> cond =
                                  visitExpression(ifStmt.getCondition());
        ifStmt.setCondition(cond.val2);
        visitBlock(ifStmt.getBody());
        return withPrefix(cond.val1, stmt);
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        Pair<List<Statement>, Expression> expr =
                                  visitExpression(sw.getExpression());
        sw.setExpression(expr.val2);
        for (Case c: sw.getCases()) {
          visitBlock(c.getBody());
        }
        if (sw.hasDefault()) {
          visitBlock(sw.getDefault());
        }
        return withPrefix(expr.val1, stmt);
      }
      case FOR_LOOP: {
        // Condition is evaluated on each iteration: nothing can be hoisted
        ForLoop loop = (ForLoop)stmt;
        visitBlock(loop.getPre());
        visitBlock(loop.getPost());
        visitBlock(loop.getBody());
        return Collections.singletonList(stmt);
      }
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)stmt;
        if (canInline(call, 0)) {
          return inlineCall(call, null).val1;
        }
        return withPrefix(visitArguments(call), stmt);
      }
      case FUNCTIONAL_INSTRUCTION:
        return withPrefix(visitArguments((FunctionalInstruction)stmt), stmt);
      case IDENTIFIER:
      case LITERAL:
      case INSTRUCTION:
      case LABEL:
      case STACK_ASSIGNMENT:
        return Collections.singletonList(stmt);
      default:
        throw new IuliaRuntimeError("Unknown statement kind " + stmt.kind());
    }
  }

  private List<Statement> visitVariableDeclaration(VariableDeclaration decl) {
    Expression value = decl.getValue();
    if (value == null) {
      return Collections.<Statement>singletonList(decl);
    }
    if (value.kind() == NodeKind.FUNCTION_CALL) {
      FunctionCall call = (FunctionCall)value;
      int varCount = decl.getVariables().size();
      if (canInline(call, varCount)) {
        // Declared variables take the place of the return variables
        return inlineCall(call, decl.getVariables()).val1;
      } else if (varCount != 1) {
        return withPrefix(visitArguments(call), decl);
      }
    }
    Pair<List<Statement>, Expression> r = visitExpression(value);
    decl.setValue(r.val2);
    return withPrefix(r.val1, decl);
  }

  private List<Statement> visitAssignment(Assignment assign) {
    Expression value = assign.getValue();
    List<Identifier> targets = assign.getTargets();
    if (targets.size() > 1 && value.kind() == NodeKind.FUNCTION_CALL) {
      FunctionCall call = (FunctionCall)value;
      if (!canInline(call, targets.size())) {
        return withPrefix(visitArguments(call), assign);
      }
      Pair<List<Statement>, List<String>> inlined = inlineCall(call, null);
      List<Statement> result = new ArrayList<Statement>(inlined.val1);
      for (int i = 0; i < targets.size(); i++) {
        result.add(new Assignment(Collections.singletonList(targets.get(i)),
                                  new Identifier(inlined.val2.get(i))));
      }
      return result;
    }
    Pair<List<Statement>, Expression> r = visitExpression(value);
    assign.setValue(r.val2);
    return withPrefix(r.val1, assign);
  }

  /**
   * @return statements to hoist in front of the statement containing expr,
   *         and the expression to leave in its place
   */
  private Pair<List<Statement>, Expression> visitExpression(Expression expr) {
    switch (expr.kind()) {
      case LITERAL:
      case IDENTIFIER:
        return Pair.create(Collections.<Statement>emptyList(), expr);
      case FUNCTIONAL_INSTRUCTION:
        return Pair.create(visitArguments((FunctionalInstruction)expr), expr);
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        if (canInline(call, 1)) {
          Pair<List<Statement>, List<String>> inlined = inlineCall(call, null);
          return Pair.<List<Statement>, Expression>create(inlined.val1,
                                    new Identifier(inlined.val2.get(0)));
        }
        return Pair.create(visitArguments(call), expr);
      }
      default:
        throw new IuliaRuntimeError("Expected expression but got " +
                                    expr.kind());
    }
  }

  private List<Statement> visitArguments(FunctionCall call) {
    List<TypedName> hints = new ArrayList<TypedName>();
    FunctionDefinition fn = functions.get(call.getFunctionName().getName());
    for (int i = 0; i < call.getArguments().size(); i++) {
      if (fn != null && fn.getParameters().size() == call.getArguments().size()) {
        TypedName param = fn.getParameters().get(i);
        hints.add(new TypedName(fn.getName() + "_" + param.getName(),
                                param.getType()));
      } else {
        hints.add(new TypedName(TMP_PREFIX));
      }
    }
    Pair<List<Statement>, List<Expression>> r =
                            visitArguments(call.getArguments(), hints);
    for (int i = 0; i < r.val2.size(); i++) {
      call.setArgument(i, r.val2.get(i));
    }
    return r.val1;
  }

  private List<Statement> visitArguments(FunctionalInstruction instr) {
    List<TypedName> hints = new ArrayList<TypedName>();
    for (int i = 0; i < instr.getArguments().size(); i++) {
      hints.add(new TypedName(TMP_PREFIX));
    }
    Pair<List<Statement>, List<Expression>> r =
                            visitArguments(instr.getArguments(), hints);
    for (int i = 0; i < r.val2.size(); i++) {
      instr.setArgument(i, r.val2.get(i));
    }
    return r.val1;
  }

  /**
   * Visit arguments of a call that stays in place.  If argument i needs
   * statements in front of the call, all non-movable arguments left of it
   * are moved to temporaries in front of those statements, to keep the
   * order of evaluation.
   * @param args
   * @param nameHints name prefix and type for each temporary
   * @return hoisted statements and new arguments
   */
  private Pair<List<Statement>, List<Expression>> visitArguments(
          List<Expression> args, List<TypedName> nameHints) {
    List<List<Statement>> prefixes = new ArrayList<List<Statement>>();
    List<Expression> newArgs = new ArrayList<Expression>();
    int lastHoisted = -1;
    for (int i = 0; i < args.size(); i++) {
      Pair<List<Statement>, Expression> r = visitExpression(args.get(i));
      prefixes.add(r.val1);
      newArgs.add(r.val2);
      if (!r.val1.isEmpty()) {
        lastHoisted = i;
      }
    }

    List<Statement> hoisted = new ArrayList<Statement>();
    for (int i = 0; i <= lastHoisted; i++) {
      hoisted.addAll(prefixes.get(i));
      Expression arg = newArgs.get(i);
      if (i < lastHoisted && !MovableChecker.isMovable(arg)) {
        TypedName hint = nameHints.get(i);
        String tmp = nameDispenser.newName(hint.getName());
        hoisted.add(declare(tmp, hint.getType(), arg));
        newArgs.set(i, new Identifier(tmp));
      }
    }
    return Pair.create(hoisted, newArgs);
  }

  private boolean canInline(FunctionCall call, int returnCount) {
    String name = call.getFunctionName().getName();
    FunctionDefinition fn = functions.get(name);
    if (fn == null) {
      // Builtin, or a function created since the snapshot
      return false;
    }
    if (fn.getParameters().size() != call.getArguments().size() ||
        fn.getReturns().size() != returnCount) {
      logger.trace("Not inlining " + name + ": arity mismatch");
      return false;
    }
    if (functionScopes.contains(name)) {
      logger.trace("Not inlining " + name + " inside itself");
      return false;
    }
    if (recursiveFunctions.contains(name)) {
      logger.trace("Not inlining recursive function " + name);
      return false;
    }
    return true;
  }

  /**
   * Expand a call.  The caller must have checked that it can be inlined.
   * @param call
   * @param boundReturns variables to declare in place of the return
   *            variables.  If null, temporaries are created.
   * @return statements to insert in place, and names holding the results
   */
  private Pair<List<Statement>, List<String>> inlineCall(FunctionCall call,
                                            List<TypedName> boundReturns) {
    String name = call.getFunctionName().getName();
    FunctionDefinition fn = functions.get(name);
    logger.debug("Inlining call to " + name);

    List<Statement> hoisted = new ArrayList<Statement>();
    Map<String, Expression> replacements = new HashMap<String, Expression>();
    Set<String> assigned = AssignedNames.collect(fn.getBody());

    List<Expression> args = call.getArguments();
    for (int i = 0; i < args.size(); i++) {
      TypedName param = fn.getParameters().get(i);
      Pair<List<Statement>, Expression> r = visitExpression(args.get(i));
      hoisted.addAll(r.val1);
      Expression arg = r.val2;
      if (MovableChecker.isMovable(arg) &&
          !assigned.contains(param.getName())) {
        replacements.put(param.getName(), arg);
      } else {
        String tmp = nameDispenser.newName(name + "_" + param.getName());
        hoisted.add(declare(tmp, param.getType(), arg));
        replacements.put(param.getName(), new Identifier(tmp));
      }
    }

    List<String> resultNames = new ArrayList<String>();
    if (boundReturns != null) {
      assert(boundReturns.size() == fn.getReturns().size());
      for (int i = 0; i < boundReturns.size(); i++) {
        String bound = boundReturns.get(i).getName();
        replacements.put(fn.getReturns().get(i).getName(),
                         new Identifier(bound));
        resultNames.add(bound);
      }
      hoisted.add(new VariableDeclaration(boundReturns, null));
    } else {
      for (TypedName ret: fn.getReturns()) {
        String tmp = nameDispenser.newName(name + "_" + ret.getName());
        replacements.put(ret.getName(), new Identifier(tmp));
        resultNames.add(tmp);
        hoisted.add(declare(tmp, ret.getType(), null));
      }
    }

    Block body = new BodyCopier(nameDispenser, name + "_", replacements)
                                                      .copy(fn.getBody());
    // Calls in the copy can be inlined, but not further calls to fn
    functionScopes.add(name);
    visitBlock(body);
    functionScopes.remove(name);
    hoisted.add(body);

    inlinedCalls++;
    return Pair.create(hoisted, resultNames);
  }

  private static VariableDeclaration declare(String name, String type,
                                             Expression value) {
    return new VariableDeclaration(
        Collections.singletonList(new TypedName(name, type)), value);
  }

  private static List<Statement> withPrefix(List<Statement> prefix,
                                            Statement stmt) {
    if (prefix.isEmpty()) {
      return Collections.singletonList(stmt);
    }
    List<Statement> result = new ArrayList<Statement>(prefix);
    result.add(stmt);
    return result;
  }

  /**
   * Find functions that are part of a cycle in the call graph
   */
  private static ImmutableSet<String> findRecursive(Logger logger,
                                                    Block snapshot) {
    FuncCallFinder finder = new FuncCallFinder();
    TreeWalk.walk(snapshot, finder);

    ImmutableSet.Builder<String> recursive = ImmutableSet.builder();
    for (String fn: finder.calls.keySet()) {
      if (reaches(finder.calls, fn, fn)) {
        logger.debug("Function " + fn + " is recursive");
        recursive.add(fn);
      }
    }
    return recursive.build();
  }

  private static boolean reaches(SetMultimap<String, String> calls,
                                 String from, String target) {
    Set<String> visited = new HashSet<String>();
    StackLite<String> stack = new StackLite<String>();
    stack.addAll(calls.get(from));
    while (!stack.isEmpty()) {
      String curr = stack.pop();
      if (curr.equals(target)) {
        return true;
      }
      if (visited.add(curr)) {
        stack.addAll(calls.get(curr));
      }
    }
    return false;
  }

  private static class FuncCallFinder extends TreeWalker {

    /**
     * Map of calling function -> called functions.  Calls outside any
     * function are not recorded.  A function also "calls" the functions
     * defined inside it, since inlining it copies them.
     */
    final SetMultimap<String, String> calls = LinkedHashMultimap.create();

    @Override
    public void visitDeclaration(FunctionDefinition functionContext,
                                 Declaration declared) {
      if (functionContext != null &&
          declared instanceof FunctionDefinition &&
          declared != functionContext) {
        calls.put(functionContext.getName(), declared.getName());
      }
    }

    @Override
    public void visitExpression(FunctionDefinition functionContext,
                                Expression expr) {
      if (functionContext != null &&
          expr.kind() == NodeKind.FUNCTION_CALL) {
        calls.put(functionContext.getName(),
                  ((FunctionCall)expr).getFunctionName().getName());
      }
    }
  }

  /**
   * Names that are targets of assignments
   */
  private static class AssignedNames extends TreeWalker {
    final Set<String> names = new HashSet<String>();

    static Set<String> collect(Block block) {
      AssignedNames finder = new AssignedNames();
      TreeWalk.walk(block, finder);
      return finder.names;
    }

    @Override
    protected void visit(Statement stmt) {
      if (stmt.kind() == NodeKind.ASSIGNMENT) {
        for (Identifier target: ((Assignment)stmt).getTargets()) {
          names.add(target.getName());
        }
      } else if (stmt.kind() == NodeKind.STACK_ASSIGNMENT) {
        names.add(((StackAssignment)stmt).getVariableName().getName());
      }
    }
  }
}
