package com.dangle.ast.expr;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.SourceLocation;

/**
 * 二元表达式（比较与逻辑运算）
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        EQ("=="),
        NE("!="),
        AND("&&"),
        OR("||");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public static BinaryOp fromSource(String source) {
            for (BinaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            throw new IllegalArgumentException("不支持的二元运算符: " + source);
        }
    }
}
