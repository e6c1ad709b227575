package com.dangle.checkers.dangling;

import com.dangle.ast.SourceLocation;
import com.dangle.ast.decl.FieldDecl;
import com.dangle.ast.type.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("清除记录测试")
class ClearanceRecordTest {

    private FieldDecl w;
    private FieldDecl other;
    private FieldFacts wFacts;

    @BeforeEach
    void setUp() {
        w = new FieldDecl(SourceLocation.UNKNOWN, "_w", TypeRef.parse("Worker *"), false);
        other = new FieldDecl(SourceLocation.UNKNOWN, "_other", TypeRef.parse("Worker *"), false);
        wFacts = new FieldFacts();
        wFacts.addDangerousProperty("delegate");
        wFacts.addDangerousProperty("dataSource");
        wFacts.markEventTarget();
    }

    @Nested
    @DisplayName("ClearanceRecord")
    class RecordTests {

        @Test
        @DisplayName("清除与恢复属性")
        void testClearAndReactivate() {
            ClearanceRecord r = ClearanceRecord.EMPTY.withClearedProperty("delegate");
            assertThat(r.isPropertyCleared("delegate")).isTrue();
            assertThat(ClearanceRecord.EMPTY.isPropertyCleared("delegate")).isFalse();

            ClearanceRecord back = r.withoutClearedProperty("delegate");
            assertThat(back.isPropertyCleared("delegate")).isFalse();
            assertThat(back).isEqualTo(ClearanceRecord.EMPTY);
        }

        @Test
        @DisplayName("无变化时返回同一实例")
        void testNoOpReturnsSame() {
            ClearanceRecord r = ClearanceRecord.EMPTY.withClearedProperty("delegate");
            assertThat(r.withClearedProperty("delegate")).isSameAs(r);
            assertThat(ClearanceRecord.EMPTY.withoutClearedProperty("delegate")).isSameAs(ClearanceRecord.EMPTY);
        }

        @Test
        @DisplayName("完全清除覆盖全部危险属性与登记")
        void testFullyCleared() {
            ClearanceRecord r = ClearanceRecord.fullyCleared(wFacts);
            assertThat(r.getClearedProperties()).containsExactly("dataSource", "delegate");
            assertThat(r.isTargetCleared()).isTrue();
            assertThat(r.isObserverCleared()).isFalse();
        }

        @Test
        @DisplayName("target / observer 标记互不影响")
        void testTargetObserverFlags() {
            ClearanceRecord r = ClearanceRecord.EMPTY.withTargetCleared();
            assertThat(r.isTargetCleared()).isTrue();
            assertThat(r.isObserverCleared()).isFalse();
            assertThat(r.withObserverCleared().isObserverCleared()).isTrue();
            assertThat(r).isNotEqualTo(ClearanceRecord.EMPTY);
        }
    }

    @Nested
    @DisplayName("ClearanceMap")
    class MapTests {

        @Test
        @DisplayName("没有记录的字段视为未清除")
        void testAbsentIsEmpty() {
            assertThat(ClearanceMap.EMPTY.get(w)).isSameAs(ClearanceRecord.EMPTY);
            assertThat(ClearanceMap.EMPTY.contains(w)).isFalse();
        }

        @Test
        @DisplayName("设置返回新映射，原映射不变")
        void testImmutable() {
            ClearanceMap m = ClearanceMap.EMPTY.set(w, ClearanceRecord.EMPTY.withClearedProperty("delegate"));

            assertThat(m.get(w).isPropertyCleared("delegate")).isTrue();
            assertThat(m.get(other)).isSameAs(ClearanceRecord.EMPTY);
            assertThat(ClearanceMap.EMPTY.size()).isZero();
            assertThat(m.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("内容相同的映射相等")
        void testEquality() {
            ClearanceMap a = ClearanceMap.EMPTY.set(w, ClearanceRecord.EMPTY.withClearedProperty("delegate"));
            ClearanceMap b = ClearanceMap.EMPTY.set(w, ClearanceRecord.EMPTY.withClearedProperty("delegate"));
            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
            assertThat(a).isNotEqualTo(ClearanceMap.EMPTY.set(other, ClearanceRecord.EMPTY.withClearedProperty("delegate")));
        }
    }

    @Nested
    @DisplayName("ConditionPattern")
    class PatternTests {

        @Test
        @DisplayName("属性条件只清除该属性")
        void testPropertyPatterns() {
            TypeFacts facts = new TypeFacts("Owner");
            ClearanceMap m = ConditionPattern.propertyNotEqualSelf(w, "delegate").apply(ClearanceMap.EMPTY, facts);
            assertThat(m.get(w).getClearedProperties()).containsExactly("delegate");

            m = ConditionPattern.propertyEqualNil(w, "dataSource").apply(m, facts);
            assertThat(m.get(w).getClearedProperties()).containsExactly("dataSource", "delegate");
            assertThat(m.get(w).isTargetCleared()).isFalse();
        }

        @Test
        @DisplayName("字段为 nil 时完全清除")
        void testFieldEqualNil() {
            TypeFacts facts = new TypeFacts("Owner");
            facts.getOrCreateFieldFacts(w).addDangerousProperty("delegate");
            facts.getOrCreateFieldFacts(w).markEventObserver();

            ConditionPattern p = ConditionPattern.fieldEqualNil(w);
            ClearanceMap m = p.apply(ClearanceMap.EMPTY, facts);

            assertThat(p.getProperty()).isNull();
            assertThat(m.get(w).isPropertyCleared("delegate")).isTrue();
            assertThat(m.get(w).isObserverCleared()).isTrue();
        }
    }
}
