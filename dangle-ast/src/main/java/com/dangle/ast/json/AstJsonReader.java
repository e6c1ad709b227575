package com.dangle.ast.json;

import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.*;
import com.dangle.ast.expr.*;
import com.dangle.ast.stmt.*;
import com.dangle.ast.type.TypeRef;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 读取编译单元。
 *
 * <pre>
 * {
 *   "file": "Test.m", "arc": true,
 *   "decls": [
 *     {"kind": "interface", "name": "Worker", "super": "NSObject",
 *      "ivars": [{"name": "_w", "type": "Worker *"}],
 *      "properties": [{"name": "delegate", "type": "Test *", "attrs": ["atomic", "assign"]}],
 *      "methods": [{"selector": "run", "returns": "void", "params": []}]},
 *     {"kind": "implementation", "name": "Test", "ivars": [],
 *      "methods": [{"selector": "dealloc", "body": [ ... ]}]}
 *   ]
 * }
 * </pre>
 *
 * <p>语句：{@code expr / if / return / assert / var / block}；
 * 表达式：{@code self / super / nil / ivar / local / prop / msg / assign / binary / not / cast}。
 * 任意节点可带 {@code line}、{@code col}。属性未写 setter 修饰符时，ARC 下默认 strong，否则 assign。</p>
 */
public final class AstJsonReader {

    private final String fileName;
    private boolean arc;

    private AstJsonReader(String fileName) {
        this.fileName = fileName;
    }

    public static TranslationUnit read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        }
    }

    public static TranslationUnit read(Reader reader, String defaultFileName) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new AstFormatException("$", "无效的 JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new AstFormatException("$", "顶层必须是对象");
        }
        JsonObject obj = root.getAsJsonObject();
        String file = optString(obj, "file", defaultFileName, "$");
        return new AstJsonReader(file).readUnit(obj);
    }

    public static TranslationUnit readString(String json, String defaultFileName) {
        return read(new StringReader(json), defaultFileName);
    }

    // ============ 声明 ============

    private TranslationUnit readUnit(JsonObject obj) {
        arc = optBoolean(obj, "arc", false, "$");
        List<Declaration> decls = new ArrayList<>();
        JsonArray arr = optArray(obj, "decls", "$");
        for (int i = 0; i < arr.size(); i++) {
            String path = "$.decls[" + i + "]";
            JsonObject d = asObject(arr.get(i), path);
            String kind = requireString(d, "kind", path);
            switch (kind) {
                case "interface":
                    decls.add(readInterface(d, path));
                    break;
                case "implementation":
                    decls.add(readImplementation(d, path));
                    break;
                default:
                    throw new AstFormatException(path, "未知声明类型 '" + kind + "'");
            }
        }
        return new TranslationUnit(SourceLocation.of(fileName, 1, 1), fileName, arc, decls);
    }

    private InterfaceDecl readInterface(JsonObject d, String path) {
        String name = requireString(d, "name", path);
        List<FieldDecl> ivars = readIvars(d, path);
        List<PropertyDecl> props = new ArrayList<>();
        JsonArray arr = optArray(d, "properties", path);
        for (int i = 0; i < arr.size(); i++) {
            props.add(readProperty(asObject(arr.get(i), path + ".properties[" + i + "]"),
                    path + ".properties[" + i + "]"));
        }
        List<MethodDecl> methods = readMethods(d, path);
        return new InterfaceDecl(loc(d, path), name, optString(d, "super", null, path), ivars, props, methods, false);
    }

    private ImplementationDecl readImplementation(JsonObject d, String path) {
        String name = requireString(d, "name", path);
        return new ImplementationDecl(loc(d, path), name, readIvars(d, path), readMethods(d, path));
    }

    private List<FieldDecl> readIvars(JsonObject d, String path) {
        List<FieldDecl> ivars = new ArrayList<>();
        JsonArray arr = optArray(d, "ivars", path);
        for (int i = 0; i < arr.size(); i++) {
            String p = path + ".ivars[" + i + "]";
            JsonObject f = asObject(arr.get(i), p);
            ivars.add(new FieldDecl(loc(f, p), requireString(f, "name", p),
                    TypeRef.parse(requireString(f, "type", p)), false));
        }
        return ivars;
    }

    private PropertyDecl readProperty(JsonObject p, String path) {
        String name = requireString(p, "name", path);
        PropertyDecl.SetterKind kind = arc ? PropertyDecl.SetterKind.STRONG : PropertyDecl.SetterKind.ASSIGN;
        JsonArray attrs = optArray(p, "attrs", path);
        for (int i = 0; i < attrs.size(); i++) {
            JsonElement a = attrs.get(i);
            if (!a.isJsonPrimitive() || !a.getAsJsonPrimitive().isString()) {
                throw new AstFormatException(path + ".attrs[" + i + "]", "应为字符串");
            }
            String attr = a.getAsString();
            switch (attr) {
                case "atomic":
                case "nonatomic":
                case "readonly":
                case "readwrite":
                    break;
                default:
                    try {
                        kind = PropertyDecl.SetterKind.fromAttribute(attr);
                    } catch (IllegalArgumentException e) {
                        throw new AstFormatException(path + ".attrs[" + i + "]", e.getMessage(), e);
                    }
            }
        }
        return new PropertyDecl(loc(p, path), name, TypeRef.parse(requireString(p, "type", path)),
                kind, optString(p, "ivar", null, path));
    }

    private List<MethodDecl> readMethods(JsonObject d, String path) {
        List<MethodDecl> methods = new ArrayList<>();
        JsonArray arr = optArray(d, "methods", path);
        for (int i = 0; i < arr.size(); i++) {
            String p = path + ".methods[" + i + "]";
            methods.add(readMethod(asObject(arr.get(i), p), p));
        }
        return methods;
    }

    private MethodDecl readMethod(JsonObject m, String path) {
        String selector = requireString(m, "selector", path);
        List<VarDecl> params = new ArrayList<>();
        JsonArray arr = optArray(m, "params", path);
        for (int i = 0; i < arr.size(); i++) {
            String p = path + ".params[" + i + "]";
            JsonObject param = asObject(arr.get(i), p);
            params.add(new VarDecl(loc(param, p), VarDecl.Kind.PARAM, requireString(param, "name", p),
                    TypeRef.parse(optString(param, "type", "id", p)), null));
        }
        Block body = m.has("body") ? readBlock(m.get("body"), loc(m, path), path + ".body") : null;
        boolean instance = !optBoolean(m, "static", false, path);
        return new MethodDecl(loc(m, path), selector, instance, params,
                TypeRef.parse(optString(m, "returns", "void", path)), body);
    }

    // ============ 语句 ============

    private Block readBlock(JsonElement e, SourceLocation fallback, String path) {
        if (e.isJsonArray()) {
            JsonArray arr = e.getAsJsonArray();
            List<Statement> stmts = new ArrayList<>();
            for (int i = 0; i < arr.size(); i++) {
                stmts.add(readStmt(arr.get(i), path + "[" + i + "]"));
            }
            return new Block(fallback, stmts);
        }
        Statement s = readStmt(e, path);
        return s instanceof Block ? (Block) s : new Block(s.getLocation(), Collections.singletonList(s));
    }

    private Statement readStmt(JsonElement e, String path) {
        JsonObject s = asObject(e, path);
        String kind = requireString(s, "kind", path);
        SourceLocation loc = loc(s, path);
        switch (kind) {
            case "expr":
                return new ExpressionStmt(loc, readExpr(s, "expr", path));
            case "if": {
                Expression cond = readExpr(s, "cond", path);
                Statement then = readBlock(require(s, "then", path), loc, path + ".then");
                Statement other = s.has("else") ? readBlock(s.get("else"), loc, path + ".else") : null;
                return new IfStmt(loc, cond, then, other);
            }
            case "return":
                return new ReturnStmt(loc, s.has("value") ? readExpr(s, "value", path) : null);
            case "assert":
                return new AssertStmt(loc, readExpr(s, "cond", path));
            case "var": {
                Expression init = s.has("init") ? readExpr(s, "init", path) : null;
                VarDecl var = new VarDecl(loc, VarDecl.Kind.LOCAL, requireString(s, "name", path),
                        TypeRef.parse(optString(s, "type", "id", path)), init);
                return new DeclStmt(loc, var);
            }
            case "block":
                return readBlock(require(s, "body", path), loc, path + ".body");
            default:
                throw new AstFormatException(path, "未知语句类型 '" + kind + "'");
        }
    }

    // ============ 表达式 ============

    private Expression readExpr(JsonObject parent, String key, String path) {
        return readExpr(require(parent, key, path), path + "." + key);
    }

    private Expression readExpr(JsonElement e, String path) {
        JsonObject x = asObject(e, path);
        String kind = requireString(x, "kind", path);
        SourceLocation loc = loc(x, path);
        switch (kind) {
            case "self":
                return new SelfExpr(loc);
            case "super":
                return new SuperExpr(loc);
            case "nil":
                return new NilLiteral(loc);
            case "ivar":
                return new IvarRefExpr(loc, requireString(x, "name", path));
            case "local":
                return new LocalRefExpr(loc, requireString(x, "name", path));
            case "prop":
                return new PropertyRefExpr(loc, readExpr(x, "base", path), requireString(x, "name", path));
            case "msg": {
                String selector = requireString(x, "selector", path);
                List<Expression> args = new ArrayList<>();
                JsonArray arr = optArray(x, "args", path);
                for (int i = 0; i < arr.size(); i++) {
                    args.add(readExpr(arr.get(i), path + ".args[" + i + "]"));
                }
                if (x.has("class")) {
                    return MessageExpr.classMessage(loc, requireString(x, "class", path), selector, args);
                }
                return new MessageExpr(loc, readExpr(x, "receiver", path), selector, args);
            }
            case "assign":
                return new AssignExpr(loc, readExpr(x, "target", path), readExpr(x, "value", path));
            case "binary": {
                String op = requireString(x, "op", path);
                BinaryExpr.BinaryOp binOp;
                try {
                    binOp = BinaryExpr.BinaryOp.fromSource(op);
                } catch (IllegalArgumentException ex) {
                    throw new AstFormatException(path + ".op", ex.getMessage(), ex);
                }
                return new BinaryExpr(loc, readExpr(x, "lhs", path), binOp, readExpr(x, "rhs", path));
            }
            case "not":
                return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, readExpr(x, "operand", path));
            case "cast":
                return new CastExpr(loc, TypeRef.parse(requireString(x, "type", path)),
                        readExpr(x, "operand", path));
            default:
                throw new AstFormatException(path, "未知表达式类型 '" + kind + "'");
        }
    }

    // ============ 辅助 ============

    private SourceLocation loc(JsonObject obj, String path) {
        return SourceLocation.of(fileName, optInt(obj, "line", path), optInt(obj, "col", path));
    }

    private static int optInt(JsonObject obj, String key, String path) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return 0;
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new AstFormatException(path + "." + key, "应为整数");
        }
        try {
            return e.getAsInt();
        } catch (NumberFormatException ex) {
            throw new AstFormatException(path + "." + key, "应为整数", ex);
        }
    }

    private static JsonObject asObject(JsonElement e, String path) {
        if (e == null || !e.isJsonObject()) {
            throw new AstFormatException(path, "应为对象");
        }
        return e.getAsJsonObject();
    }

    private static JsonElement require(JsonObject obj, String key, String path) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            throw new AstFormatException(path, "缺少字段 '" + key + "'");
        }
        return e;
    }

    private static String requireString(JsonObject obj, String key, String path) {
        JsonElement e = require(obj, key, path);
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new AstFormatException(path + "." + key, "应为字符串");
        }
        String value = e.getAsString();
        if (value.isEmpty()) {
            throw new AstFormatException(path + "." + key, "不能为空");
        }
        return value;
    }

    private static String optString(JsonObject obj, String key, String def, String path) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return def;
        return requireString(obj, key, path);
    }

    private static boolean optBoolean(JsonObject obj, String key, boolean def, String path) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return def;
        if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
            throw new AstFormatException(path + "." + key, "应为布尔值");
        }
        return e.getAsBoolean();
    }

    private static JsonArray optArray(JsonObject obj, String key, String path) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return new JsonArray();
        if (!e.isJsonArray()) {
            throw new AstFormatException(path + "." + key, "应为数组");
        }
        return e.getAsJsonArray();
    }
}
