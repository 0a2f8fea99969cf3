package com.phillippitts.voiceforge.exception;

import com.phillippitts.voiceforge.domain.TaskErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsExtendVoiceForgeException() {
        assertThat(new TaskFailedException(TaskErrorKind.TASK_FAILED, "t", null, "m"))
                .isInstanceOf(VoiceForgeException.class);
        assertThat(new UnknownTaskTypeException("x")).isInstanceOf(VoiceForgeException.class);
        assertThat(new SessionProtocolException(SessionErrorKind.INVALID_FRAME, "m"))
                .isInstanceOf(VoiceForgeException.class);
        assertThat(new WorkerProtocolException("m", "line")).isInstanceOf(VoiceForgeException.class);
    }

    @Test
    void voiceForgeExceptionIsUnchecked() {
        assertThat(new VoiceForgeException("m")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void unknownTaskTypeKeepsRequestedName() {
        UnknownTaskTypeException ex = new UnknownTaskTypeException("juggle");

        assertThat(ex.getTaskType()).isEqualTo("juggle");
        assertThat(ex.getMessage()).contains("juggle");
    }

    @Test
    void workerProtocolExceptionKeepsOffendingLine() {
        RuntimeException cause = new RuntimeException("bad");
        WorkerProtocolException ex = new WorkerProtocolException("Malformed", "{oops", cause);

        assertThat(ex.getLine()).isEqualTo("{oops");
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
