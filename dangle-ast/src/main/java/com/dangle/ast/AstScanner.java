package com.dangle.ast;

import com.dangle.ast.decl.*;
import com.dangle.ast.expr.*;
import com.dangle.ast.stmt.*;

/**
 * 深度优先遍历所有子节点的访问者基类。
 *
 * <p>子类覆盖感兴趣的 visit 方法，需要继续向下遍历时调用 {@link #scanChildren}。
 * 点语法属性访问在解析后会生成隐式消息表达式，遍历时一并访问（见
 * {@link PropertyRefExpr#getGetterCall()}、{@link AssignExpr#getSetterCall()}）。</p>
 */
public abstract class AstScanner<C> implements AstVisitor<Void, C> {

    public void scan(AstNode node, C ctx) {
        if (node != null) node.accept(this, ctx);
    }

    /** 访问节点的全部直接子节点 */
    public void scanChildren(AstNode node, C ctx) {
        if (node instanceof TranslationUnit) {
            for (Declaration d : ((TranslationUnit) node).getDeclarations()) scan(d, ctx);
        } else if (node instanceof InterfaceDecl) {
            InterfaceDecl decl = (InterfaceDecl) node;
            for (FieldDecl f : decl.getIvars()) scan(f, ctx);
            for (PropertyDecl p : decl.getProperties()) scan(p, ctx);
            for (MethodDecl m : decl.getMethods()) scan(m, ctx);
        } else if (node instanceof ImplementationDecl) {
            ImplementationDecl decl = (ImplementationDecl) node;
            for (FieldDecl f : decl.getIvars()) scan(f, ctx);
            for (MethodDecl m : decl.getMethods()) scan(m, ctx);
        } else if (node instanceof MethodDecl) {
            MethodDecl decl = (MethodDecl) node;
            for (VarDecl p : decl.getParams()) scan(p, ctx);
            scan(decl.getBody(), ctx);
        } else if (node instanceof VarDecl) {
            scan(((VarDecl) node).getInitializer(), ctx);
        } else if (node instanceof Block) {
            for (Statement s : ((Block) node).getStatements()) scan(s, ctx);
        } else if (node instanceof ExpressionStmt) {
            scan(((ExpressionStmt) node).getExpression(), ctx);
        } else if (node instanceof IfStmt) {
            IfStmt stmt = (IfStmt) node;
            scan(stmt.getCondition(), ctx);
            scan(stmt.getThenBranch(), ctx);
            scan(stmt.getElseBranch(), ctx);
        } else if (node instanceof ReturnStmt) {
            scan(((ReturnStmt) node).getValue(), ctx);
        } else if (node instanceof AssertStmt) {
            scan(((AssertStmt) node).getCondition(), ctx);
        } else if (node instanceof DeclStmt) {
            scan(((DeclStmt) node).getVariable(), ctx);
        } else if (node instanceof PropertyRefExpr) {
            PropertyRefExpr expr = (PropertyRefExpr) node;
            // getter 消息的接收者就是 base，解析后只访问消息
            if (expr.getGetterCall() != null) {
                scan(expr.getGetterCall(), ctx);
            } else {
                scan(expr.getBase(), ctx);
            }
        } else if (node instanceof MessageExpr) {
            MessageExpr expr = (MessageExpr) node;
            scan(expr.getReceiver(), ctx);
            for (Expression arg : expr.getArgs()) scan(arg, ctx);
        } else if (node instanceof AssignExpr) {
            AssignExpr expr = (AssignExpr) node;
            if (expr.getSetterCall() != null) {
                // 属性赋值以 setter 消息为准，避免重复访问左右操作数
                scan(expr.getSetterCall(), ctx);
            } else {
                scan(expr.getTarget(), ctx);
                scan(expr.getValue(), ctx);
            }
        } else if (node instanceof BinaryExpr) {
            scan(((BinaryExpr) node).getLeft(), ctx);
            scan(((BinaryExpr) node).getRight(), ctx);
        } else if (node instanceof UnaryExpr) {
            scan(((UnaryExpr) node).getOperand(), ctx);
        } else if (node instanceof CastExpr) {
            scan(((CastExpr) node).getOperand(), ctx);
        }
    }

    // ============ 默认：继续遍历 ============

    @Override public Void visitTranslationUnit(TranslationUnit node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitInterfaceDecl(InterfaceDecl node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitImplementationDecl(ImplementationDecl node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitMethodDecl(MethodDecl node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitVarDecl(VarDecl node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitBlock(Block node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitExpressionStmt(ExpressionStmt node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitIfStmt(IfStmt node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitReturnStmt(ReturnStmt node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitAssertStmt(AssertStmt node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitDeclStmt(DeclStmt node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitPropertyRefExpr(PropertyRefExpr node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitMessageExpr(MessageExpr node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitAssignExpr(AssignExpr node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitBinaryExpr(BinaryExpr node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitUnaryExpr(UnaryExpr node, C ctx) { scanChildren(node, ctx); return null; }
    @Override public Void visitCastExpr(CastExpr node, C ctx) { scanChildren(node, ctx); return null; }
}
