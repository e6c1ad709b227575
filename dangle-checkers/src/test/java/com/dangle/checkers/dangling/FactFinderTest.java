package com.dangle.checkers.dangling;

import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.decl.InterfaceDecl;
import com.dangle.ast.decl.TranslationUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.dangle.checkers.dangling.UnitBuilder.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("FactFinder 测试")
class FactFinderTest {

    private static TypeFacts collect(TranslationUnit unit) {
        TypeFacts facts = new TypeFacts("Owner");
        FactFinder.analyzeImplementation(unit.getImplementation("Owner"), facts);
        return facts;
    }

    private static FieldDecl field(TranslationUnit unit, String name) {
        return unit.getInterface("Owner").findIvar(name);
    }

    @Nested
    @DisplayName("字段事实")
    class FieldFactTests {

        @Test
        @DisplayName("消息与点语法写入 self 都记为危险属性")
        void testDangerousProperties() {
            TranslationUnit unit = owner(false, method("wire",
                    expr(msg(W, "setDelegate:", SELF)),
                    expr(assign(prop(SPARE, "delegate"), SELF))));
            TypeFacts facts = collect(unit);

            assertThat(facts.getFields()).hasSize(2);
            assertThat(facts.getFieldFacts(field(unit, "_w")).getDangerousProperties()).containsExactly("delegate");
            assertThat(facts.getFieldFacts(field(unit, "_spare")).getDangerousProperties()).containsExactly("delegate");
        }

        @Test
        @DisplayName("retain 属性、非 self 实参不产生事实")
        void testHarmlessWrites() {
            TranslationUnit unit = owner(false, method("wire",
                    expr(msg(W, "setName:", SELF)),
                    expr(msg(W, "setDelegate:", NIL)),
                    expr(msg(W, "run"))));
            TypeFacts facts = collect(unit);

            assertThat(facts.getFields()).isEmpty();
            assertThat(facts.isInteresting(field(unit, "_w"))).isFalse();
            assertThat(facts.isInteresting(null)).isFalse();
        }

        @Test
        @DisplayName("通过 self 的属性访问也能定位到后备变量")
        void testThroughSelfProperty() {
            TranslationUnit unit = owner(false, method("wire",
                    expr(msg(prop(SELF, "w"), "setDelegate:", SELF))));
            TypeFacts facts = collect(unit);

            assertThat(facts.isInteresting(field(unit, "_w"))).isTrue();
        }

        @Test
        @DisplayName("addTarget / addObserver 登记")
        void testTargetAndObserver() {
            TranslationUnit unit = owner(false, method("wire",
                    expr(msg(prop(SELF, "w"), "addTarget:action:", SELF, NIL)),
                    expr(msg(SPARE, "addObserver:forKeyPath:", SELF, NIL))));
            TypeFacts facts = collect(unit);

            FieldFacts w = facts.getFieldFacts(field(unit, "_w"));
            FieldFacts spare = facts.getFieldFacts(field(unit, "_spare"));
            assertThat(w.mayBeEventTarget()).isTrue();
            assertThat(w.mayBeEventObserver()).isFalse();
            assertThat(w.getDangerousProperties()).isEmpty();
            assertThat(spare.mayBeEventObserver()).isTrue();
        }

        @Test
        @DisplayName("在通知中心登记观察者只记录方法名")
        void testSharedObserver() {
            TranslationUnit unit = owner(false, method("listen",
                    expr(msg(classMsg("NSNotificationCenter", "defaultCenter"), "addObserver:selector:", SELF, NIL))));
            TypeFacts facts = collect(unit);

            assertThat(facts.getFields()).isEmpty();
            assertThat(facts.getSharedObserverFacts())
                    .containsOnlyKeys("+[NSNotificationCenter defaultCenter]");
            assertThat(facts.getSharedObserverFacts().get("+[NSNotificationCenter defaultCenter]"))
                    .containsExactly("listen");
        }

        @Test
        @DisplayName("init 方法体同样被扫描")
        void testInitBodyIsScanned() {
            TranslationUnit unit = owner(false, method("init",
                    expr(msg(W, "setDelegate:", SELF))));
            TypeFacts facts = collect(unit);

            assertThat(facts.isPseudoConstructor("init")).isTrue();
            assertThat(facts.isInteresting(field(unit, "_w"))).isTrue();
        }
    }

    @Nested
    @DisplayName("方法分类")
    class MethodClassificationTests {

        @Test
        @DisplayName("init 族与约定前缀是伪构造方法")
        void testPseudoConstructors() {
            TranslationUnit unit = owner(false,
                    method("init"), method("initWithFrame:"), method("setupViews"),
                    method("_loadData"), method("viewDidLoad"), method("_setup"),
                    method("reload"), method("wire"), method("dealloc"));
            TypeFacts facts = collect(unit);

            assertThat(facts.getPseudoConstructorMethods())
                    .containsExactly("init", "initWithFrame:", "setupViews", "_loadData", "viewDidLoad", "_setup");
            assertThat(facts.isPseudoConstructor("reload")).isFalse();
            assertThat(facts.isPseudoConstructor("dealloc")).isFalse();
        }

        @Test
        @DisplayName("dealloc 标记显式析构")
        void testExplicitTeardown() {
            assertThat(collect(owner(true, method("dealloc"))).hasExplicitTeardown()).isTrue();
            assertThat(collect(owner(true, method("wire"))).hasExplicitTeardown()).isFalse();
        }
    }

    @Nested
    @DisplayName("事实表")
    class FactStoreTests {

        @Test
        @DisplayName("查找时按需创建，清空后重新开始")
        void testLazyCreation() {
            FactStore store = new FactStore();
            TypeFacts first = store.getOrCreate("Owner");

            assertThat(store.getOrCreate("Owner")).isSameAs(first);
            assertThat(store.contains("Owner")).isTrue();
            assertThat(store.lookup(null)).isNull();

            store.clear();
            assertThat(store.size()).isZero();
            assertThat(store.getOrCreate("Owner")).isNotSameAs(first);
        }

        @Test
        @DisplayName("按接口名查找")
        void testLookupByInterface() {
            FactStore store = new FactStore();
            InterfaceDecl iface = owner(false).getInterface("Owner");

            assertThat(store.lookup(iface).getTypeName()).isEqualTo("Owner");
            assertThat(store.lookup(iface).getFields()).isEmpty();
        }
    }
}
