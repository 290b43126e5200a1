/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.pyfrontend.ast;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Renders a semantic tree as indented text, one node per line with its source line:
 *
 * <pre>
 * FuncDef:1(
 *   f
 *   Args(
 *     Var(x))
 *   Block:1(
 *     PassStmt:2()))
 * </pre>
 *
 * The output is deterministic and is what tests compare converted trees against.
 */
public final class AstPrinter implements NodeVisitor<String> {

  private static final AstPrinter INSTANCE = new AstPrinter();

  private AstPrinter() {}

  public static String print(SemanticModule module) {
    List<Object> items = new ArrayList<>(module.getDefs());
    if (module.getPath() != null) {
      items.add(0, module.getPath());
    }
    if (module.isStub()) {
      items.add("IsStub");
    }
    if (!module.getIgnoredLines().isEmpty()) {
      items.add("IgnoredLines(" + Joiner.on(", ").join(module.getIgnoredLines()) + ")");
    }
    return INSTANCE.dump("SemanticModule", module, items.toArray());
  }

  public static String print(Statement statement) {
    return statement.accept(INSTANCE);
  }

  public static String print(Expression expression) {
    return expression.accept(INSTANCE);
  }

  /** A labelled group of items without a position of its own. */
  private static final class Group {
    final String label;
    final List<?> items;

    Group(String label, List<?> items) {
      this.label = label;
      this.items = items;
    }
  }

  private static Group group(String label, @Nullable Object... items) {
    return new Group(label, Arrays.asList(items));
  }

  private String dump(String name, SyntaxNode node, @Nullable Object... items) {
    return render(name + ":" + node.getLine(), Arrays.asList(items));
  }

  private String render(String tag, List<?> items) {
    List<String> parts = new ArrayList<>();
    flatten(items, parts);
    StringBuilder sb = new StringBuilder(tag).append('(');
    for (String part : parts) {
      sb.append("\n  ").append(part.replace("\n", "\n  "));
    }
    return sb.append(')').toString();
  }

  private void flatten(List<?> items, List<String> parts) {
    for (Object item : items) {
      if (item == null) {
        continue;
      } else if (item instanceof List) {
        flatten((List<?>) item, parts);
      } else if (item instanceof Group) {
        Group g = (Group) item;
        parts.add(render(g.label, g.items));
      } else if (item instanceof Statement) {
        parts.add(((Statement) item).accept(this));
      } else if (item instanceof Expression) {
        parts.add(((Expression) item).accept(this));
      } else {
        parts.add(item.toString());
      }
    }
  }

  @Override
  public String visitDefault(SyntaxNode node) {
    throw new IllegalArgumentException("Cannot print " + node.getClass().getSimpleName());
  }

  // Statements

  @Override
  public String visitBlock(Block node) {
    return dump("Block", node, node.getBody());
  }

  @Override
  public String visitExpressionStmt(ExpressionStmt node) {
    return dump("ExpressionStmt", node, node.getExpr());
  }

  @Override
  public String visitAssignmentStmt(AssignmentStmt node) {
    List<Expression> lvalues = node.getLvalues();
    Object target = lvalues.size() > 1 ? group("Lvalues", lvalues) : lvalues.get(0);
    return dump("AssignmentStmt", node, target, node.getRvalue(), node.getType());
  }

  @Override
  public String visitOperatorAssignmentStmt(OperatorAssignmentStmt node) {
    return dump(
        "OperatorAssignmentStmt", node, node.getOp(), node.getLvalue(), node.getRvalue());
  }

  @Override
  public String visitReturnStmt(ReturnStmt node) {
    return dump("ReturnStmt", node, node.getExpr());
  }

  @Override
  public String visitDelStmt(DelStmt node) {
    return dump("DelStmt", node, node.getExpr());
  }

  @Override
  public String visitRaiseStmt(RaiseStmt node) {
    return dump("RaiseStmt", node, node.getExpr(), node.getFromExpr());
  }

  @Override
  public String visitAssertStmt(AssertStmt node) {
    return dump("AssertStmt", node, node.getExpr(), node.getMsg());
  }

  @Override
  public String visitPassStmt(PassStmt node) {
    return dump("PassStmt", node);
  }

  @Override
  public String visitBreakStmt(BreakStmt node) {
    return dump("BreakStmt", node);
  }

  @Override
  public String visitContinueStmt(ContinueStmt node) {
    return dump("ContinueStmt", node);
  }

  @Override
  public String visitGlobalDecl(GlobalDecl node) {
    return dump("GlobalDecl", node, node.getNames());
  }

  @Override
  public String visitNonlocalDecl(NonlocalDecl node) {
    return dump("NonlocalDecl", node, node.getNames());
  }

  @Override
  public String visitWhileStmt(WhileStmt node) {
    return dump(
        "WhileStmt", node, node.getExpr(), node.getBody(), elseGroup(node.getElseBody()));
  }

  @Override
  public String visitForStmt(ForStmt node) {
    return dump(
        "ForStmt",
        node,
        node.isAsync() ? "Async" : null,
        node.getIndex(),
        node.getIndexType(),
        node.getExpr(),
        node.getBody(),
        elseGroup(node.getElseBody()));
  }

  @Override
  public String visitIfStmt(IfStmt node) {
    List<Object> items = new ArrayList<>();
    for (int i = 0; i < node.getExpr().size(); i++) {
      items.add(group("If", node.getExpr().get(i)));
      items.add(group("Then", node.getBody().get(i).getBody()));
    }
    items.add(elseGroup(node.getElseBody()));
    return dump("IfStmt", node, items);
  }

  @Override
  public String visitWithStmt(WithStmt node) {
    List<Object> items = new ArrayList<>();
    if (node.isAsync()) {
      items.add("Async");
    }
    for (int i = 0; i < node.getExpr().size(); i++) {
      items.add(group("Expr", node.getExpr().get(i)));
      Expression target = node.getTarget().get(i);
      if (target != null) {
        items.add(group("Target", target));
      }
    }
    items.add(node.getTargetType());
    items.add(node.getBody());
    return dump("WithStmt", node, items);
  }

  @Override
  public String visitTryStmt(TryStmt node) {
    List<Object> items = new ArrayList<>();
    items.add(node.getBody());
    for (int i = 0; i < node.getHandlers().size(); i++) {
      items.add(node.getTypes().get(i));
      items.add(node.getVars().get(i));
      items.add(node.getHandlers().get(i));
    }
    items.add(elseGroup(node.getElseBody()));
    Block finallyBody = node.getFinallyBody();
    items.add(finallyBody != null ? group("Finally", finallyBody.getBody()) : null);
    return dump("TryStmt", node, items);
  }

  private static @Nullable Group elseGroup(@Nullable Block elseBody) {
    return elseBody != null ? group("Else", elseBody.getBody()) : null;
  }

  @Override
  public String visitImport(Import node) {
    return dump("Import", node, importedNames(node.getIds()));
  }

  @Override
  public String visitImportFrom(ImportFrom node) {
    return dump(
        "ImportFrom",
        node,
        dots(node.getRelative()) + node.getId(),
        importedNames(node.getNames()));
  }

  @Override
  public String visitImportAll(ImportAll node) {
    return dump("ImportAll", node, dots(node.getRelative()) + node.getId());
  }

  private static String dots(int relative) {
    return ".".repeat(relative);
  }

  private static String importedNames(List<ImportBase.ImportedName> names) {
    List<String> parts = new ArrayList<>();
    for (ImportBase.ImportedName n : names) {
      parts.add(n.alias() != null ? n.name() + " : " + n.alias() : n.name());
    }
    return "[" + Joiner.on(", ").join(parts) + "]";
  }

  @Override
  public String visitClassDef(ClassDef node) {
    List<Object> items = new ArrayList<>();
    items.add(node.getName());
    if (!node.getDecorators().isEmpty()) {
      items.add(group("Decorators", node.getDecorators()));
    }
    if (!node.getBaseTypeExprs().isEmpty()) {
      items.add(group("BaseTypeExprs", node.getBaseTypeExprs()));
    }
    node.getKeywords().forEach((k, v) -> items.add(group("Keyword", k, v)));
    items.add(node.getDefs().getBody());
    return dump("ClassDef", node, items);
  }

  @Override
  public String visitFuncDef(FuncDef node) {
    return dump(
        "FuncDef",
        node,
        node.getName(),
        node.isCoroutine() ? "Async" : null,
        arguments(node.getArguments()),
        node.getType(),
        node.getBody());
  }

  private static List<Object> arguments(List<Argument> arguments) {
    if (arguments.isEmpty()) {
      return ImmutableList.of();
    }
    List<Object> items = new ArrayList<>();
    List<Object> plain = new ArrayList<>();
    for (Argument a : arguments) {
      String var = "Var(" + a.getVariable().getName() + ")";
      switch (a.getKind()) {
        case POSITIONAL:
          plain.add(var);
          break;
        case OPTIONAL:
        case NAMED_OPTIONAL:
          plain.add(var);
          items.add(group("default", var, a.getInitializer()));
          break;
        case STAR:
          items.add(group("VarArg", var));
          break;
        case NAMED:
          items.add(group("KwOnly", var));
          break;
        case STAR2:
          items.add(group("DictVarArg", var));
          break;
      }
    }
    items.add(0, group("Args", plain));
    return items;
  }

  @Override
  public String visitDecorator(Decorator node) {
    return dump(
        "Decorator",
        node,
        "Var(" + node.getVar().getName() + ")",
        node.getDecorators(),
        node.getFunc());
  }

  @Override
  public String visitOverloadedFuncDef(OverloadedFuncDef node) {
    List<String> items = new ArrayList<>();
    for (OverloadPart part : node.getItems()) {
      items.add(part.accept(this));
    }
    return dump("OverloadedFuncDef", node, items);
  }

  @Override
  public String visitTempNode(TempNode node) {
    return dump("TempNode", node, node.getType());
  }

  // Expressions

  @Override
  public String visitNameExpr(NameExpr node) {
    return "NameExpr(" + node.getName() + ")";
  }

  @Override
  public String visitIntExpr(IntExpr node) {
    return "IntExpr(" + node.getValue() + ")";
  }

  @Override
  public String visitFloatExpr(FloatExpr node) {
    return "FloatExpr(" + node.getValue() + ")";
  }

  @Override
  public String visitComplexExpr(ComplexExpr node) {
    return "ComplexExpr(" + node.getImag() + "j)";
  }

  @Override
  public String visitStrExpr(StrExpr node) {
    return "StrExpr(" + node.getValue() + ")";
  }

  @Override
  public String visitBytesExpr(BytesExpr node) {
    return "BytesExpr(" + node.getValue() + ")";
  }

  @Override
  public String visitEllipsisExpr(EllipsisExpr node) {
    return "Ellipsis";
  }

  @Override
  public String visitTupleExpr(TupleExpr node) {
    return dump("TupleExpr", node, node.getItems());
  }

  @Override
  public String visitListExpr(ListExpr node) {
    return dump("ListExpr", node, node.getItems());
  }

  @Override
  public String visitSetExpr(SetExpr node) {
    return dump("SetExpr", node, node.getItems());
  }

  @Override
  public String visitDictExpr(DictExpr node) {
    List<Object> items = new ArrayList<>();
    for (DictExpr.Item item : node.getItems()) {
      items.add(item.key() != null ? item.key() : "**");
      items.add(item.value());
    }
    return dump("DictExpr", node, items);
  }

  @Override
  public String visitGeneratorExpr(GeneratorExpr node) {
    return dump("GeneratorExpr", node, node.getLeftExpr(), clauses(node.getClauses()));
  }

  @Override
  public String visitListComprehension(ListComprehension node) {
    return dump("ListComprehension", node, node.getGenerator());
  }

  @Override
  public String visitSetComprehension(SetComprehension node) {
    return dump("SetComprehension", node, node.getGenerator());
  }

  @Override
  public String visitDictionaryComprehension(DictionaryComprehension node) {
    return dump(
        "DictionaryComprehension",
        node,
        node.getKey(),
        node.getValue(),
        clauses(node.getClauses()));
  }

  private static List<Group> clauses(List<Comprehension> clauses) {
    List<Group> groups = new ArrayList<>();
    for (Comprehension c : clauses) {
      groups.add(
          group(
              c.isAsync() ? "AsyncFor" : "For",
              c.target(),
              c.iterable(),
              c.conditions().isEmpty() ? null : group("Condition", c.conditions())));
    }
    return groups;
  }

  @Override
  public String visitConditionalExpr(ConditionalExpr node) {
    return dump(
        "ConditionalExpr",
        node,
        group("Condition", node.getCond()),
        node.getIfExpr(),
        node.getElseExpr());
  }

  @Override
  public String visitOpExpr(OpExpr node) {
    return dump("OpExpr", node, node.getOp(), node.getLeft(), node.getRight());
  }

  @Override
  public String visitUnaryExpr(UnaryExpr node) {
    return dump("UnaryExpr", node, node.getOp(), node.getExpr());
  }

  @Override
  public String visitComparisonExpr(ComparisonExpr node) {
    return dump(
        "ComparisonExpr", node, Joiner.on(", ").join(node.getOperators()), node.getOperands());
  }

  @Override
  public String visitLambdaExpr(LambdaExpr node) {
    return dump("LambdaExpr", node, arguments(node.getArguments()), node.getBody());
  }

  @Override
  public String visitCallExpr(CallExpr node) {
    List<Object> items = new ArrayList<>();
    items.add(node.getCallee());
    List<Object> positional = new ArrayList<>();
    for (int i = 0; i < node.getArgs().size(); i++) {
      Expression arg = node.getArgs().get(i);
      switch (node.getArgKinds().get(i)) {
        case STAR:
          items.add(group("VarArg", arg));
          break;
        case NAMED:
          items.add(group("KwArgs", node.getArgNames().get(i), arg));
          break;
        case STAR2:
          items.add(group("DictVarArg", arg));
          break;
        default:
          positional.add(arg);
          break;
      }
    }
    items.add(1, group("Args", positional));
    return dump("CallExpr", node, items);
  }

  @Override
  public String visitMemberExpr(MemberExpr node) {
    return dump("MemberExpr", node, node.getExpr(), node.getName());
  }

  @Override
  public String visitSuperExpr(SuperExpr node) {
    return dump("SuperExpr", node, node.getName(), node.getCall());
  }

  @Override
  public String visitIndexExpr(IndexExpr node) {
    return dump("IndexExpr", node, node.getBase(), node.getIndex());
  }

  @Override
  public String visitSliceExpr(SliceExpr node) {
    return dump(
        "SliceExpr",
        node,
        orEmpty(node.getBeginIndex()),
        orEmpty(node.getEndIndex()),
        node.getStride());
  }

  private static Object orEmpty(@Nullable Expression e) {
    return e != null ? e : "<empty>";
  }

  @Override
  public String visitStarExpr(StarExpr node) {
    return dump("StarExpr", node, node.getExpr());
  }

  @Override
  public String visitAwaitExpr(AwaitExpr node) {
    return dump("AwaitExpr", node, node.getExpr());
  }

  @Override
  public String visitYieldExpr(YieldExpr node) {
    return dump("YieldExpr", node, node.getExpr());
  }

  @Override
  public String visitYieldFromExpr(YieldFromExpr node) {
    return dump("YieldFromExpr", node, node.getExpr());
  }
}
