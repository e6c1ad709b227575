package com.dangle.ast.sema;

import com.dangle.ast.AstVisitor;
import com.dangle.ast.decl.*;
import com.dangle.ast.expr.*;
import com.dangle.ast.stmt.*;
import com.dangle.ast.type.TypeRef;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 名字与类型解析。
 *
 * <p>完成以下工作：</p>
 * <ul>
 *   <li>为没有 @interface 的实现补隐式接口，链接超类与实现</li>
 *   <li>为属性合成后备实例变量（默认 {@code _name}）与隐式 getter/setter</li>
 *   <li>解析方法体中的实例变量、局部变量引用，计算表达式静态类型</li>
 *   <li>把点语法属性访问展开为合成的 getter/setter 消息</li>
 * </ul>
 */
public final class Resolver implements AstVisitor<TypeRef, Resolver.Scope> {
    private static final Logger LOG = Logger.getLogger(Resolver.class.getName());

    private final TranslationUnit unit;

    private Resolver(TranslationUnit unit) {
        this.unit = unit;
    }

    /** 解析整个编译单元（原地修改 AST） */
    public static TranslationUnit resolve(TranslationUnit unit) {
        new Resolver(unit).run();
        return unit;
    }

    /** 方法体内的解析上下文 */
    static final class Scope {
        final InterfaceDecl classInterface;
        final Map<String, VarDecl> locals = new HashMap<>();

        Scope(InterfaceDecl classInterface) {
            this.classInterface = classInterface;
        }
    }

    private void run() {
        for (ImplementationDecl impl : unit.getImplementations()) {
            if (unit.getInterface(impl.getName()) == null) {
                unit.addImplicitInterface(new InterfaceDecl(impl.getLocation(), impl.getName(), null,
                        Collections.<FieldDecl>emptyList(), Collections.<PropertyDecl>emptyList(),
                        Collections.<MethodDecl>emptyList(), true));
            }
        }
        for (InterfaceDecl iface : unit.getInterfaces()) {
            iface.setSuperInterface(unit.getInterface(iface.getSuperName()));
            ImplementationDecl impl = unit.getImplementation(iface.getName());
            iface.setImplementation(impl);
            if (impl != null) impl.setClassInterface(iface);
        }
        for (InterfaceDecl iface : unit.getInterfaces()) {
            synthesizeProperties(iface);
        }
        for (ImplementationDecl impl : unit.getImplementations()) {
            for (FieldDecl f : impl.getIvars()) f.setContainerName(impl.getName());
            for (MethodDecl m : impl.getMethods()) {
                m.setOwnerName(impl.getName());
                resolveMethod(impl.getClassInterface(), m);
            }
        }
        LOG.fine(() -> "解析完成: " + unit.getFileName());
    }

    private void synthesizeProperties(InterfaceDecl iface) {
        for (FieldDecl f : iface.getIvars()) f.setContainerName(iface.getName());
        for (MethodDecl m : iface.getMethods()) m.setOwnerName(iface.getName());
        for (PropertyDecl prop : iface.getProperties()) {
            FieldDecl ivar = iface.findIvar(prop.getIvarName());
            if (ivar == null) {
                ivar = new FieldDecl(prop.getLocation(), prop.getIvarName(), prop.getType(), true);
                ivar.setContainerName(iface.getName());
                iface.addIvar(ivar);
            }
            prop.setIvarDecl(ivar);

            MethodDecl getter = findOwnMethod(iface, prop.getGetterSelector());
            if (getter == null) {
                getter = MethodDecl.implicitGetter(prop);
                getter.setOwnerName(iface.getName());
                iface.addMethod(getter);
            }
            prop.setGetter(getter);

            MethodDecl setter = findOwnMethod(iface, prop.getSetterSelector());
            if (setter == null) {
                setter = MethodDecl.implicitSetter(prop);
                setter.setOwnerName(iface.getName());
                iface.addMethod(setter);
            }
            prop.setSetter(setter);
        }
    }

    private static MethodDecl findOwnMethod(InterfaceDecl iface, String selector) {
        for (MethodDecl m : iface.getMethods()) {
            if (m.getSelector().equals(selector)) return m;
        }
        return null;
    }

    private void resolveMethod(InterfaceDecl iface, MethodDecl method) {
        Scope scope = new Scope(iface);
        for (VarDecl p : method.getParams()) {
            scope.locals.put(p.getName(), p);
        }
        if (method.getBody() != null) {
            method.getBody().accept(this, scope);
        }
    }

    private TypeRef resolveExpr(Expression expr, Scope scope) {
        if (expr == null) return null;
        TypeRef type = expr.accept(this, scope);
        if (type == null) type = TypeRef.ID;
        expr.setStaticType(type);
        return type;
    }

    // ============ 语句 ============

    @Override
    public TypeRef visitBlock(Block node, Scope scope) {
        for (Statement s : node.getStatements()) s.accept(this, scope);
        return null;
    }

    @Override
    public TypeRef visitExpressionStmt(ExpressionStmt node, Scope scope) {
        resolveExpr(node.getExpression(), scope);
        return null;
    }

    @Override
    public TypeRef visitIfStmt(IfStmt node, Scope scope) {
        resolveExpr(node.getCondition(), scope);
        node.getThenBranch().accept(this, scope);
        if (node.hasElse()) node.getElseBranch().accept(this, scope);
        return null;
    }

    @Override
    public TypeRef visitReturnStmt(ReturnStmt node, Scope scope) {
        resolveExpr(node.getValue(), scope);
        return null;
    }

    @Override
    public TypeRef visitAssertStmt(AssertStmt node, Scope scope) {
        resolveExpr(node.getCondition(), scope);
        return null;
    }

    @Override
    public TypeRef visitDeclStmt(DeclStmt node, Scope scope) {
        VarDecl var = node.getVariable();
        resolveExpr(var.getInitializer(), scope);
        scope.locals.put(var.getName(), var);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public TypeRef visitSelfExpr(SelfExpr node, Scope scope) {
        return TypeRef.object(scope.classInterface.getName());
    }

    @Override
    public TypeRef visitSuperExpr(SuperExpr node, Scope scope) {
        return TypeRef.object(scope.classInterface.getSuperName());
    }

    @Override
    public TypeRef visitNilLiteral(NilLiteral node, Scope scope) {
        return TypeRef.ID;
    }

    @Override
    public TypeRef visitIvarRefExpr(IvarRefExpr node, Scope scope) {
        FieldDecl decl = scope.classInterface.findIvar(node.getName());
        if (decl == null) {
            throw new ResolveException("未知实例变量 '" + node.getName() + "'（类 "
                    + scope.classInterface.getName() + "）", node.getLocation());
        }
        node.setDecl(decl);
        return decl.getType();
    }

    @Override
    public TypeRef visitLocalRefExpr(LocalRefExpr node, Scope scope) {
        VarDecl decl = scope.locals.get(node.getName());
        if (decl == null) {
            throw new ResolveException("未知变量 '" + node.getName() + "'", node.getLocation());
        }
        node.setDecl(decl);
        return decl.getType();
    }

    @Override
    public TypeRef visitCastExpr(CastExpr node, Scope scope) {
        resolveExpr(node.getOperand(), scope);
        return node.getTargetType();
    }

    @Override
    public TypeRef visitBinaryExpr(BinaryExpr node, Scope scope) {
        resolveExpr(node.getLeft(), scope);
        resolveExpr(node.getRight(), scope);
        return TypeRef.BOOL;
    }

    @Override
    public TypeRef visitUnaryExpr(UnaryExpr node, Scope scope) {
        resolveExpr(node.getOperand(), scope);
        return TypeRef.BOOL;
    }

    @Override
    public TypeRef visitPropertyRefExpr(PropertyRefExpr node, Scope scope) {
        TypeRef baseType = resolveExpr(node.getBase(), scope);
        PropertyDecl prop = lookupProperty(baseType, node.getPropertyName());
        node.setExplicitProperty(prop);
        MessageExpr getter = new MessageExpr(node.getLocation(), node.getBase(), null,
                node.getPropertyName(), Collections.<Expression>emptyList(), node);
        node.setGetterCall(getter);
        TypeRef type = bindMessage(getter, scope);
        getter.setStaticType(type);
        return prop != null ? prop.getType() : type;
    }

    @Override
    public TypeRef visitAssignExpr(AssignExpr node, Scope scope) {
        TypeRef valueType = resolveExpr(node.getValue(), scope);
        Expression target = node.getTarget();
        if (target instanceof PropertyRefExpr) {
            PropertyRefExpr ref = (PropertyRefExpr) target;
            TypeRef baseType = resolveExpr(ref.getBase(), scope);
            PropertyDecl prop = lookupProperty(baseType, ref.getPropertyName());
            ref.setExplicitProperty(prop);
            String name = ref.getPropertyName();
            String selector = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1) + ":";
            MessageExpr setter = new MessageExpr(node.getLocation(), ref.getBase(), null, selector,
                    Collections.singletonList(node.getValue()), node);
            node.setSetterCall(setter);
            setter.setStaticType(bindMessage(setter, scope));
            TypeRef type = prop != null ? prop.getType() : valueType;
            ref.setStaticType(type);
            return type;
        }
        return resolveExpr(target, scope);
    }

    @Override
    public TypeRef visitMessageExpr(MessageExpr node, Scope scope) {
        resolveExpr(node.getReceiver(), scope);
        for (Expression arg : node.getArgs()) resolveExpr(arg, scope);
        return bindMessage(node, scope);
    }

    private PropertyDecl lookupProperty(TypeRef baseType, String name) {
        InterfaceDecl iface = baseType != null ? unit.getInterface(baseType.getClassName()) : null;
        return iface != null ? iface.findProperty(name) : null;
    }

    /** 绑定消息的接收者接口与方法声明，返回结果静态类型（子表达式须已解析） */
    private TypeRef bindMessage(MessageExpr msg, Scope scope) {
        InterfaceDecl receiverIface;
        String receiverClass;
        switch (msg.getReceiverKind()) {
            case CLASS:
                receiverClass = msg.getReceiverClassName();
                break;
            case SUPER_INSTANCE:
                receiverClass = scope.classInterface.getSuperName();
                break;
            default:
                TypeRef t = msg.getReceiver().getStaticType();
                receiverClass = t != null ? t.getClassName() : null;
                break;
        }
        receiverIface = unit.getInterface(receiverClass);
        msg.setReceiverInterface(receiverIface);

        MethodDecl method = null;
        if (receiverIface != null) {
            method = receiverIface.findMethod(msg.getSelector());
            for (InterfaceDecl c = receiverIface; method == null && c != null; c = c.getSuperInterface()) {
                if (c.getImplementation() != null) {
                    method = c.getImplementation().findMethod(msg.getSelector());
                }
            }
        }
        msg.setMethodDecl(method);

        MethodFamily family = MethodFamily.of(msg.getSelector());
        TypeRef returnType = method != null ? method.getReturnType() : TypeRef.ID;
        boolean relatedResult = family == MethodFamily.ALLOC || family == MethodFamily.INIT
                || family == MethodFamily.NEW;
        if (relatedResult && returnType.isObjectPointer() && returnType.getClassName() == null) {
            if (msg.getReceiverKind() == MessageExpr.ReceiverKind.SUPER_INSTANCE) {
                return TypeRef.object(scope.classInterface.getName());
            }
            return TypeRef.object(receiverClass);
        }
        return returnType;
    }
}
