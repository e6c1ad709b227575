package com.dangle.checkers.dangling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DiagnosticFormatter 测试")
class DiagnosticFormatterTest {

    @Test
    @DisplayName("完整报告文本")
    void testFullMessage() {
        assertThat(DiagnosticFormatter.format("_worker1", "delegate", "Worker", null)).isEqualTo(
                "Leaking unsafe reference to self stored in _worker1.delegate. "
                        + "The assign property 'delegate' of the instance of Worker stored in '_worker1' "
                        + "appears to occasionally point to self. "
                        + "For memory safety, you need to clear this property explicitly before losing reference "
                        + "to this object, typically by adding a line: '_worker1.delegate = nil;'. "
                        + "In case of a false warning, consider adding an assert instead: "
                        + "'FBAssert(_worker1.delegate != self);' or, if applicable: 'FBAssert(!_worker1);'.");
    }

    @Test
    @DisplayName("带上下文")
    void testWithContext() {
        assertThat(DiagnosticFormatter.format("_w", "delegate", "Worker", "ARC-generated dealloc"))
                .startsWith("Leaking unsafe reference to self stored in _w.delegate (in ARC-generated dealloc). ");
        assertThat(DiagnosticFormatter.format("_w", "delegate", "Worker", ""))
                .startsWith("Leaking unsafe reference to self stored in _w.delegate. ");
    }

    @Test
    @DisplayName("id 类型的字段不写类名")
    void testUnknownClass() {
        assertThat(DiagnosticFormatter.format("_w", "delegate", null, null))
                .contains("The assign property 'delegate' of the object stored in '_w'");
    }
}
