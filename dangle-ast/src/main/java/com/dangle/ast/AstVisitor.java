package com.dangle.ast;

import com.dangle.ast.decl.*;
import com.dangle.ast.expr.*;
import com.dangle.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitTranslationUnit(TranslationUnit node, C ctx) { return null; }

    default R visitInterfaceDecl(InterfaceDecl node, C ctx) { return null; }

    default R visitImplementationDecl(ImplementationDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitPropertyDecl(PropertyDecl node, C ctx) { return null; }

    default R visitMethodDecl(MethodDecl node, C ctx) { return null; }

    default R visitVarDecl(VarDecl node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitAssertStmt(AssertStmt node, C ctx) { return null; }

    default R visitDeclStmt(DeclStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitSelfExpr(SelfExpr node, C ctx) { return null; }

    default R visitSuperExpr(SuperExpr node, C ctx) { return null; }

    default R visitNilLiteral(NilLiteral node, C ctx) { return null; }

    default R visitIvarRefExpr(IvarRefExpr node, C ctx) { return null; }

    default R visitPropertyRefExpr(PropertyRefExpr node, C ctx) { return null; }

    default R visitMessageExpr(MessageExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitLocalRefExpr(LocalRefExpr node, C ctx) { return null; }
}
