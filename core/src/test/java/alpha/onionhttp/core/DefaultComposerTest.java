package alpha.onionhttp.core;

import alpha.onionhttp.context.Context;
import alpha.onionhttp.middleware.Middleware;
import alpha.onionhttp.middleware.MultipleCallException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Tests for {@link DefaultComposer}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultComposerTest
{
    private final Context ctx = mock(Context.class);
    private final List<String> trace = new ArrayList<>();
    
    @Test
    void onionOrder() {
        var p = DefaultComposer.INSTANCE.compose(List.of(
                    tracing("1"), tracing("2"), tracing("3")));
        p.execute(ctx).toCompletableFuture().join();
        assertThat(trace).containsExactly(
                "1 before", "2 before", "3 before",
                "3 after",  "2 after",  "1 after");
    }
    
    @Test
    void onionOrder_async() {
        var gate = new CompletableFuture<Void>();
        var p = DefaultComposer.INSTANCE.compose(List.of(
                    tracing("1"),
                    (c, next) -> gate.thenCompose(nil -> next.proceed()),
                    tracing("3")));
        var stage = p.execute(ctx).toCompletableFuture();
        assertThat(trace).containsExactly("1 before");
        assertThat(stage).isNotDone();
        gate.complete(null);
        stage.join();
        assertThat(trace).containsExactly(
                "1 before", "3 before", "3 after", "1 after");
    }
    
    @Test
    void empty() {
        var p = DefaultComposer.INSTANCE.compose(List.of());
        assertThat(p.execute(ctx).toCompletableFuture()).isCompleted();
    }
    
    @Test
    void proceedPastLastCompletesImmediately() {
        Middleware last = (c, next) -> next.proceed();
        var p = DefaultComposer.INSTANCE.compose(List.of(last));
        assertThat(p.execute(ctx).toCompletableFuture()).isCompleted();
    }
    
    @Test
    void contextIsPassedThrough() {
        List<Context> seen = new ArrayList<>();
        Middleware mw = (c, next) -> {
            seen.add(c);
            return next.proceed();
        };
        DefaultComposer.INSTANCE.compose(List.of(mw, mw)).execute(ctx)
                .toCompletableFuture().join();
        assertThat(seen).containsExactly(ctx, ctx);
    }
    
    @Test
    void multipleCall() {
        Middleware twice = (c, next) -> {
            next.proceed();
            return next.proceed();
        };
        var p = DefaultComposer.INSTANCE.compose(List.of(twice, tracing("2")));
        assertFailsWith(p.execute(ctx), MultipleCallException.class);
        // The first call went through
        assertThat(trace).containsExactly("2 before", "2 after");
    }
    
    @Test
    void multipleCall_message() {
        var e = new MultipleCallException();
        assertThat(e).hasMessage("Chain.proceed() called multiple times");
    }
    
    @Test
    void synchronousThrowFailsPipeline() {
        Middleware thrower = (c, next) -> {
            throw new IOException("boom");
        };
        var p = DefaultComposer.INSTANCE.compose(List.of(tracing("1"), thrower));
        assertFailsWith(p.execute(ctx), IOException.class);
        assertThat(trace).containsExactly("1 before");
    }
    
    @Test
    void returnedFailureFailsPipeline() {
        Middleware failer = (c, next) ->
                CompletableFuture.failedFuture(new IllegalStateException());
        var p = DefaultComposer.INSTANCE.compose(List.of(failer));
        assertFailsWith(p.execute(ctx), IllegalStateException.class);
    }
    
    @Test
    void nullReturnIsCompleted() {
        Middleware nil = (c, next) -> null;
        var p = DefaultComposer.INSTANCE.compose(List.of(nil, tracing("never")));
        assertThat(p.execute(ctx).toCompletableFuture()).isCompleted();
        assertThat(trace).isEmpty();
    }
    
    @Test
    void listIsSnapshotted() {
        var list = new ArrayList<Middleware>();
        list.add(tracing("1"));
        var p = DefaultComposer.INSTANCE.compose(list);
        list.add(tracing("2"));
        p.execute(ctx).toCompletableFuture().join();
        assertThat(trace).containsExactly("1 before", "1 after");
    }
    
    @Test
    void nullElementIsRejected() {
        var list = new ArrayList<Middleware>();
        list.add(null);
        assertThatThrownBy(() -> DefaultComposer.INSTANCE.compose(list))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    private Middleware tracing(String name) {
        return (c, next) -> {
            trace.add(name + " before");
            return next.proceed().thenRun(() -> trace.add(name + " after"));
        };
    }
    
    private static void assertFailsWith(
            CompletionStage<Void> stage, Class<? extends Throwable> type) {
        assertThatThrownBy(() -> stage.toCompletableFuture().join())
                .isExactlyInstanceOf(CompletionException.class)
                .hasCauseExactlyInstanceOf(type);
    }
}
