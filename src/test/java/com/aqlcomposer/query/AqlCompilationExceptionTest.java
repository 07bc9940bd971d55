package com.aqlcomposer.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AqlCompilationExceptionTest {

    @Test
    void testMessageIncludesTypeAndScope() {
        AqlCompilationException e = new AqlCompilationException("bad prune",
                CompilationErrorType.INVALID_PRUNE, "b");

        assertThat(e.getMessage()).isEqualTo("bad prune [Type: INVALID_PRUNE] [Scope: b]");
        assertThat(e.getReason()).isEqualTo("bad prune");
        assertThat(e.getScope()).isEqualTo("b");
    }

    @Test
    void testMessageWithoutScope() {
        IllegalStateException cause = new IllegalStateException("boom");
        AqlCompilationException e = new AqlCompilationException("bad operand",
                CompilationErrorType.UNSUPPORTED_OPERAND, cause);

        assertThat(e.getMessage()).isEqualTo("bad operand [Type: UNSUPPORTED_OPERAND]");
        assertThat(e.getScope()).isNull();
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    void testDepthRangeValidation() {
        assertThat(DepthRange.of(0, 0).toString()).isEqualTo("0..0");
        assertThat(DepthRange.of(1, DepthRange.MAX_DEPTH).getMax()).isEqualTo(65535);

        AqlCompilationException e = catchThrowableOfType(
                () -> DepthRange.of(5, 2), AqlCompilationException.class);
        assertThat(e.getErrorType()).isEqualTo(CompilationErrorType.INVALID_TRAVERSAL_DEPTH);
    }
}
