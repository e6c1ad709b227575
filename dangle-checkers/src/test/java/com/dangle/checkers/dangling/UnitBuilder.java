package com.dangle.checkers.dangling;

import com.dangle.ast.decl.TranslationUnit;
import com.dangle.ast.json.AstJsonReader;
import com.dangle.ast.sema.Resolver;

/**
 * 测试用的编译单元 JSON 片段拼装。
 *
 * <p>固定包含 Worker（assign 属性 delegate）与 Owner（实例变量 _w、retain 属性 w、
 * 备用实例变量 _spare），调用方只提供 Owner 实现中的方法。</p>
 */
final class UnitBuilder {
    static final String SELF = "{\"kind\": \"self\"}";
    static final String NIL = "{\"kind\": \"nil\"}";
    static final String W = "{\"kind\": \"ivar\", \"name\": \"_w\"}";
    static final String SPARE = "{\"kind\": \"ivar\", \"name\": \"_spare\"}";

    private UnitBuilder() {}

    static TranslationUnit owner(boolean arc, String... methods) {
        return owner("Owner.m", arc, methods);
    }

    static TranslationUnit owner(String file, boolean arc, String... methods) {
        String json = "{\"file\": \"" + file + "\", \"arc\": " + arc + ", \"decls\": ["
                + "{\"kind\": \"interface\", \"name\": \"Worker\", \"super\": \"NSObject\","
                + " \"properties\": [{\"name\": \"delegate\", \"type\": \"Owner *\", \"attrs\": [\"assign\"]},"
                + " {\"name\": \"name\", \"type\": \"NSString *\", \"attrs\": [\"retain\"]}],"
                + " \"methods\": [{\"selector\": \"run\"}]},"
                + "{\"kind\": \"interface\", \"name\": \"Owner\", \"super\": \"NSObject\", \"line\": 10,"
                + " \"ivars\": [{\"name\": \"_spare\", \"type\": \"Worker *\"}],"
                + " \"properties\": [{\"name\": \"w\", \"type\": \"Worker *\", \"attrs\": [\"retain\"]}]},"
                + "{\"kind\": \"implementation\", \"name\": \"Owner\", \"line\": 20, \"methods\": ["
                + String.join(",", methods) + "]}]}";
        return Resolver.resolve(AstJsonReader.readString(json, file));
    }

    static String method(String selector, String... stmts) {
        return "{\"selector\": \"" + selector + "\", \"line\": 21, \"body\": [" + String.join(",", stmts) + "]}";
    }

    static String expr(String e) {
        return "{\"kind\": \"expr\", \"expr\": " + e + "}";
    }

    static String ifStmt(String cond, String... then) {
        return "{\"kind\": \"if\", \"cond\": " + cond + ", \"then\": [" + String.join(",", then) + "]}";
    }

    static String assertStmt(String cond) {
        return "{\"kind\": \"assert\", \"cond\": " + cond + "}";
    }

    static String binary(String op, String l, String r) {
        return "{\"kind\": \"binary\", \"op\": \"" + op + "\", \"lhs\": " + l + ", \"rhs\": " + r + "}";
    }

    static String msg(String receiver, String selector, String... args) {
        return "{\"kind\": \"msg\", \"receiver\": " + receiver + ", \"selector\": \"" + selector
                + "\", \"args\": [" + String.join(",", args) + "]}";
    }

    static String classMsg(String className, String selector) {
        return "{\"kind\": \"msg\", \"class\": \"" + className + "\", \"selector\": \"" + selector + "\"}";
    }

    static String prop(String base, String name) {
        return "{\"kind\": \"prop\", \"base\": " + base + ", \"name\": \"" + name + "\"}";
    }

    static String assign(String target, String value) {
        return "{\"kind\": \"assign\", \"target\": " + target + ", \"value\": " + value + "}";
    }

    static String assignAt(int line, String target, String value) {
        return "{\"kind\": \"assign\", \"line\": " + line + ", \"target\": " + target + ", \"value\": " + value + "}";
    }

    static String msgAt(int line, String receiver, String selector, String... args) {
        return "{\"kind\": \"msg\", \"line\": " + line + ", \"receiver\": " + receiver + ", \"selector\": \""
                + selector + "\", \"args\": [" + String.join(",", args) + "]}";
    }

    static String cast(String type, String operand) {
        return "{\"kind\": \"cast\", \"type\": \"" + type + "\", \"operand\": " + operand + "}";
    }
}
