package exm.iulia.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

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

/**
 * Builds {@link AnalysisInfo} for a parsed tree, the way the front end
 * would.  Functions and labels are visible in their whole block; variables
 * from their declaration onwards.  Names in the builtin set that have no
 * declaration resolve to {@link AnalysisInfo#PRIMITIVE}.
 */
public class ScopeAnalyzer {

  private final AnalysisInfo info = new AnalysisInfo();
  private final Set<String> builtins;

  private ScopeAnalyzer(Collection<String> builtins) {
    this.builtins = new HashSet<String>(builtins);
  }

  public static AnalysisInfo analyze(Block program) {
    return analyze(program, Collections.<String>emptySet());
  }

  public static AnalysisInfo analyze(Block program,
                                     Collection<String> builtins) {
    ScopeAnalyzer analyzer = new ScopeAnalyzer(builtins);
    analyzer.block(program, null);
    return analyzer.info;
  }

  private void block(Block block, Scope parent) {
    Scope scope = new Scope(parent, false);
    info.registerScope(block, scope);
    statements(block, scope);
  }

  private void statements(Block block, Scope scope) {
    for (Statement stmt: block.getStatements()) {
      if (stmt instanceof FunctionDefinition || stmt instanceof Label) {
        declare((Declaration)stmt, scope);
      }
    }
    for (Statement stmt: block.getStatements()) {
      statement(stmt, scope);
    }
  }

  private void statement(Statement stmt, Scope scope) {
    switch (stmt.kind()) {
      case BLOCK:
        block((Block)stmt, scope);
        break;
      case FUNCTION_DEFINITION: {
        FunctionDefinition fn = (FunctionDefinition)stmt;
        Scope fnScope = new Scope(scope, true);
        info.registerScope(fn, fnScope);
        for (TypedName param: fn.getParameters()) {
          declare(param, fnScope);
        }
        for (TypedName ret: fn.getReturns()) {
          declare(ret, fnScope);
        }
        block(fn.getBody(), fnScope);
        break;
      }
      case VARIABLE_DECLARATION: {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        if (decl.getValue() != null) {
          expression(decl.getValue(), scope);
        }
        for (TypedName var: decl.getVariables()) {
          declare(var, scope);
        }
        break;
      }
      case ASSIGNMENT: {
        Assignment assign = (Assignment)stmt;
        expression(assign.getValue(), scope);
        for (Identifier target: assign.getTargets()) {
          reference(target, scope);
        }
        break;
      }
      case IF: {
        If ifStmt = (If)stmt;
        expression(ifStmt.getCondition(), scope);
        block(ifStmt.getBody(), scope);
        break;
      }
      case SWITCH: {
        Switch sw = (Switch)stmt;
        expression(sw.getExpression(), scope);
        for (Case c: sw.getCases()) {
          block(c.getBody(), scope);
        }
        if (sw.hasDefault()) {
          block(sw.getDefault(), scope);
        }
        break;
      }
      case FOR_LOOP: {
        ForLoop loop = (ForLoop)stmt;
        Scope loopScope = new Scope(scope, false);
        info.registerScope(loop.getPre(), loopScope);
        statements(loop.getPre(), loopScope);
        expression(loop.getCondition(), loopScope);
        block(loop.getPost(), loopScope);
        block(loop.getBody(), loopScope);
        break;
      }
      case STACK_ASSIGNMENT:
        reference(((StackAssignment)stmt).getVariableName(), scope);
        break;
      case LABEL:
      case INSTRUCTION:
        break;
      default:
        expression((Expression)stmt, scope);
        break;
    }
  }

  private void expression(Expression expr, Scope scope) {
    switch (expr.kind()) {
      case FUNCTION_CALL: {
        FunctionCall call = (FunctionCall)expr;
        reference(call.getFunctionName(), scope);
        for (Expression arg: call.getArguments()) {
          expression(arg, scope);
        }
        break;
      }
      case FUNCTIONAL_INSTRUCTION:
        for (Expression arg: ((FunctionalInstruction)expr).getArguments()) {
          expression(arg, scope);
        }
        break;
      case IDENTIFIER:
        reference((Identifier)expr, scope);
        break;
      default:
        break;
    }
  }

  private void declare(Declaration decl, Scope scope) {
    if (!scope.declare(decl)) {
      throw new IllegalArgumentException("Duplicate declaration of " +
                                         decl.getName() + " in " + scope);
    }
    info.registerDeclaration(decl, scope);
  }

  private void reference(Identifier use, Scope scope) {
    Declaration decl = scope.lookup(use.getName());
    if (decl == null) {
      if (!builtins.contains(use.getName())) {
        throw new IllegalArgumentException("Undeclared identifier " +
                                           use.getName());
      }
      decl = AnalysisInfo.PRIMITIVE;
    }
    info.registerReference(use, decl);
  }
}
