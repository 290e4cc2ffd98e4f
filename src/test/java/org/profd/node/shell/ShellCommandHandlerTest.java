package org.profd.node.shell;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.profd.api.errors.AlreadyRunningException;
import org.profd.api.errors.ConfigDecodeException;
import org.profd.api.errors.NotRunningException;
import org.profd.session.SessionController;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("ShellCommandHandler")
class ShellCommandHandlerTest {

    @Mock
    private SessionController controller;

    private ShellCommandHandler handler;
    private ByteArrayOutputStream output;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        handler = new ShellCommandHandler(controller);
        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    private int run(final InputStream stdin, final String... args) {
        return handler.execute(List.of(args), stdin, out);
    }

    private int run(final String... args) {
        return run(InputStream.nullInputStream(), args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void dumpPrintsControllerDump() {
        when(controller.dump()).thenReturn("state: IDLE\n");

        assertThat(run("dump")).isEqualTo(ShellCommandHandler.OK);
        assertThat(printed()).isEqualTo("state: IDLE\n");
    }

    @Test
    void startProfilingAcceptsPrefixedNumbers() {
        assertThat(run("startProfiling", "10", "0x2", "010")).isEqualTo(ShellCommandHandler.OK);

        verify(controller).startSimple(10, 2, 8);
    }

    @Test
    void startProfilingRejectsNonNumericArgument() {
        assertThat(run("startProfiling", "10", "two", "3")).isEqualTo(ShellCommandHandler.BAD_VALUE);
        verifyNoInteractions(controller);
    }

    @Test
    void startProfilingRejectsMissingArguments() {
        assertThat(run("startProfiling", "10")).isEqualTo(ShellCommandHandler.BAD_VALUE);
        verifyNoInteractions(controller);
    }

    @Test
    void startProfilingIgnoresTrailingArguments() {
        assertThat(run("startProfiling", "5", "60", "2", "extra")).isEqualTo(ShellCommandHandler.OK);

        verify(controller).startSimple(5, 60, 2);
    }

    @Test
    void startProfilingWhileRunningIsServiceError() {
        doThrow(new AlreadyRunningException("Profiling session already active")).when(controller).startSimple(1, 1, 1);

        assertThat(run("startProfiling", "1", "1", "1")).isEqualTo(ShellCommandHandler.SERVICE_ERROR);
        assertThat(printed()).contains("already active");
    }

    @Test
    void startProfilingProtoReadsBlobFromStdin() throws Exception {
        final byte[] blob = {0x08, 0x05};

        assertThat(run(new ByteArrayInputStream(blob), "startProfilingProto", "-")).isEqualTo(ShellCommandHandler.OK);

        verify(controller).startStructured(blob);
    }

    @Test
    void startProfilingProtoIgnoresTrailingArguments() throws Exception {
        final byte[] blob = {0x18, 0x01};

        assertThat(run(new ByteArrayInputStream(blob), "startProfilingProto", "-", "extra")).isEqualTo(ShellCommandHandler.OK);

        verify(controller).startStructured(blob);
    }

    @Test
    void startProfilingProtoOnlyReadsStdin() {
        assertThat(run("startProfilingProto", "/etc/profd/config.pb")).isEqualTo(ShellCommandHandler.BAD_VALUE);
        verifyNoInteractions(controller);
    }

    @Test
    void malformedBlobIsReported() throws Exception {
        doThrow(new ConfigDecodeException("Malformed profiling configuration: truncated")).when(controller).startStructured(any());

        assertThat(run(new ByteArrayInputStream(new byte[]{0x08}), "startProfilingProto", "-"))
            .isEqualTo(ShellCommandHandler.MALFORMED_CONFIG);
        assertThat(printed()).contains("Malformed");
    }

    @Test
    void stopProfilingWhileIdleIsServiceError() {
        doThrow(new NotRunningException("No active profiling session")).when(controller).stop();

        assertThat(run("stopProfiling")).isEqualTo(ShellCommandHandler.SERVICE_ERROR);
    }

    @Test
    void stopProfilingRequestsStop() {
        assertThat(run("stopProfiling")).isEqualTo(ShellCommandHandler.OK);
        verify(controller).stop();
    }

    @Test
    void unknownOrMissingCommandIsBadValue() {
        assertThat(run("reboot")).isEqualTo(ShellCommandHandler.BAD_VALUE);
        assertThat(handler.execute(List.of(), InputStream.nullInputStream(), out)).isEqualTo(ShellCommandHandler.BAD_VALUE);
        verifyNoInteractions(controller);
    }
}
