package com.dangle.checkers;

import com.dangle.checkers.dangling.DanglingDelegateChecker;
import com.dangle.engine.checker.Checker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CheckerRegistry 测试")
class CheckerRegistryTest {

    @Test
    @DisplayName("注册了悬空 delegate 检查器")
    void testRegistered() {
        assertThat(CheckerRegistry.has("memory.DanglingDelegate")).isTrue();
        assertThat(CheckerRegistry.has("memory.Unknown")).isFalse();
        assertThat(CheckerRegistry.entries())
                .extracting(CheckerRegistry.Entry::getName)
                .containsExactly(DanglingDelegateChecker.NAME);
    }

    @Test
    @DisplayName("每次创建新实例")
    void testCreateReturnsFreshInstance() {
        Checker a = CheckerRegistry.create(DanglingDelegateChecker.NAME);
        Checker b = CheckerRegistry.create(DanglingDelegateChecker.NAME);
        assertThat(a).isInstanceOf(DanglingDelegateChecker.class).isNotSameAs(b);
    }

    @Test
    @DisplayName("未知名字抛出异常")
    void testUnknownName() {
        assertThatThrownBy(() -> CheckerRegistry.create("memory.Unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("未知检查器: memory.Unknown");
    }

    @Test
    @DisplayName("名字为空时创建全部检查器")
    void testCreateAll() {
        List<Checker> all = CheckerRegistry.createAll(Collections.<String>emptyList());
        assertThat(all).hasSize(CheckerRegistry.entries().size());
        assertThat(CheckerRegistry.createAll(null)).hasSameSizeAs(all);
        assertThat(CheckerRegistry.createAll(Collections.singletonList(DanglingDelegateChecker.NAME))).hasSize(1);
    }
}
