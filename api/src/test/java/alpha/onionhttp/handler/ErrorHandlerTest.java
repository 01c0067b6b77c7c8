package alpha.onionhttp.handler;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.lang.System.Logger.Level.ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link ErrorHandler#BASE}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ErrorHandlerTest
{
    private LogRecorder log;
    
    @BeforeEach
    void startRecording() {
        log = LogRecorder.startRecording();
    }
    
    @AfterEach
    void stopRecording() {
        log.stopRecording();
    }
    
    @Test
    void logsIndentedStackTrace() {
        ErrorHandler.BASE.handle(new IllegalStateException("boom"), app(false));
        var msg = log.assertRemoveContaining(ERROR, "java.lang.IllegalStateException: boom");
        var nl = System.lineSeparator();
        assertThat(msg)
                .startsWith(nl + "  java.lang.IllegalStateException: boom")
                .contains(nl + "  \tat ")
                .endsWith(nl);
        log.assertNoProblem();
    }
    
    @Test
    void notFoundIsNotLogged() {
        ErrorHandler.BASE.handle(new HttpException(404), app(false));
        log.assertNoProblem();
    }
    
    @Test
    void exposedIsNotLogged() {
        ErrorHandler.BASE.handle(new HttpException(500, "fine", null, true), app(false));
        ErrorHandler.BASE.handle(new HttpException(400), app(false));
        log.assertNoProblem();
    }
    
    @Test
    void unexposedServerErrorIsLogged() {
        ErrorHandler.BASE.handle(new HttpException(503), app(false));
        log.assertRemoveContaining(ERROR, "Service Unavailable");
    }
    
    @Test
    void silent() {
        ErrorHandler.BASE.handle(new RuntimeException(), app(true));
        log.assertNoProblem();
    }
    
    @Test
    void nullIsRejected() {
        assertThatThrownBy(() -> ErrorHandler.BASE.handle(null, app(false)))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("non-error thrown: null");
    }
    
    private static Application app(boolean silent) {
        var app = mock(Application.class);
        when(app.getConfig()).thenReturn(
                Config.configuration().silent(silent).build());
        return app;
    }
}
