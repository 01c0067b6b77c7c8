package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.Config;
import alpha.onionhttp.context.Context;
import alpha.onionhttp.handler.ErrorHandler;
import alpha.onionhttp.middleware.Middleware;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for {@link DefaultApplication}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultApplicationTest
{
    @Test
    void createLoadsDefaultImplementation() {
        var handler = mock(ErrorHandler.class);
        var conf = Config.configuration().env("test").build();
        var app = Application.create(conf, handler);
        assertThat(app).isExactlyInstanceOf(DefaultApplication.class);
        assertThat(app.getConfig()).isSameAs(conf);
        assertThat(app.errorHandler()).isSameAs(handler);
        assertThat(Application.create().errorHandler()).isSameAs(ErrorHandler.BASE);
    }
    
    @Test
    void use_appendsInOrder() {
        var app = Application.create();
        Middleware a = (ctx, next) -> next.proceed(),
                   b = (ctx, next) -> next.proceed();
        assertThat(app.use(a).use(b)).isSameAs(app);
        assertThat(app.middleware()).containsExactly(a, b);
    }
    
    @Test
    void use_null() {
        var app = Application.create();
        assertThatThrownBy(() -> app.use(null))
                .isExactlyInstanceOf(NullPointerException.class)
                .hasMessage("middleware");
        assertThat(app.middleware()).isEmpty();
    }
    
    @Test
    void middlewareAddedLaterNeedsNewCallback() {
        var app = Application.create();
        var first = app.callback();
        app.use((ctx, next) -> {
            ctx.body("late");
            return next.proceed();
        });
        var out1 = new FakeOutgoing();
        first.handle(FakeIncoming.get("/"), out1).toCompletableFuture().join();
        assertThat(out1.statusCode()).isEqualTo(404);
        var out2 = new FakeOutgoing();
        app.callback().handle(FakeIncoming.get("/"), out2).toCompletableFuture().join();
        assertThat(out2.body()).isEqualTo("late");
    }
    
    @Test
    void toJson() {
        var conf = Config.configuration()
                .subdomainOffset(3).proxy(true).env("production").build();
        var app = Application.create(conf);
        assertThat(app.toJson()).containsExactly(
                entry("subdomainOffset", 3),
                entry("proxy", true),
                entry("env", "production"));
        assertThat(app.toString())
                .isEqualTo("{subdomainOffset=3, proxy=true, env=production}");
        assertThatThrownBy(() -> app.toJson().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void createContext() {
        var app = Application.create();
        app.defaults().set("db", "pool");
        var in = FakeIncoming.get("/x?y=z");
        var out = new FakeOutgoing();
        var c1 = app.createContext(in, out);
        var c2 = app.createContext(in, out);
        assertThat(c1.app()).isSameAs(app);
        assertThat(c1.incoming()).isSameAs(in);
        assertThat(c1.outgoing()).isSameAs(out);
        assertThat(c1.request().context()).isSameAs(c1);
        assertThat(c1.response().context()).isSameAs(c1);
        assertThat(c1.originalUrl()).isEqualTo("/x?y=z");
        assertThat(c1.state()).isNotSameAs(c2.state());
        assertThat(c1.respond()).isTrue();
        
        c1.state().set("user", "alice");
        assertThat(c1.attribute("user")).hasValue("alice");
        assertThat(c2.attribute("user")).isEmpty();
        assertThat(c1.attribute("db")).hasValue("pool");
        c1.state().set("db", "override");
        assertThat(c1.attribute("db")).hasValue("override");
        assertThat(c2.attribute("db")).hasValue("pool");
    }
    
    @Test
    void errorHandlerIsReplaceable() {
        var first = mock(ErrorHandler.class);
        var second = mock(ErrorHandler.class);
        var app = Application.create(Config.DEFAULT, first);
        assertThat(app.errorHandler(second)).isSameAs(app);
        var err = new IllegalStateException();
        app.use((ctx, next) -> {
            throw err;
        });
        app.callback().handle(FakeIncoming.get("/"), new FakeOutgoing())
                .toCompletableFuture().join();
        verifyNoInteractions(first);
        verify(second).handle(same(err), same(app));
        assertThatThrownBy(() -> app.errorHandler(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void currentContext_disabledByDefault() {
        var app = Application.create();
        var seen = new ArrayList<Optional<Context>>();
        app.use((ctx, next) -> {
            seen.add(app.currentContext());
            return next.proceed();
        });
        run(app);
        assertThat(seen).containsExactly(Optional.empty());
    }
    
    @Test
    void currentContext_propagated() {
        var app = Application.create(
                Config.configuration().contextPropagation(true).build());
        var pool = Executors.newSingleThreadExecutor();
        try {
            var seen = new ArrayList<Context>();
            var async = new CompletableFuture<Void>();
            app.use((ctx, next) -> {
                seen.add(app.currentContext().orElse(null));
                return next.proceed().thenRun(() ->
                        seen.add(app.currentContext().orElse(null)));
            });
            app.use(hop(async, pool));
            var ctx = run(app);
            assertThat(seen).hasSize(2).containsOnly(ctx);
            assertThat(app.currentContext()).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }
    
    @Test
    void currentContext_downstreamOfAsyncHop() {
        var app = Application.create(
                Config.configuration().contextPropagation(true).build());
        var pool = Executors.newSingleThreadExecutor();
        try {
            var seen = new ArrayList<Optional<Context>>();
            app.use(hop(new CompletableFuture<>(), pool));
            app.use((ctx, next) -> {
                seen.add(app.currentContext());
                return next.proceed();
            });
            var ctx = run(app);
            assertThat(seen).containsExactly(Optional.of(ctx));
        } finally {
            pool.shutdownNow();
        }
    }
    
    @Test
    void contextStorageMiddleware_downstreamOfAsyncHop() {
        var app = Application.create();
        var pool = Executors.newSingleThreadExecutor();
        try {
            var seen = new ArrayList<Optional<Context>>();
            app.use(app.contextStorageMiddleware());
            app.use(hop(new CompletableFuture<>(), pool));
            app.use((ctx, next) -> {
                seen.add(app.currentContext());
                return next.proceed();
            });
            var ctx = run(app);
            assertThat(seen).containsExactly(Optional.of(ctx));
        } finally {
            pool.shutdownNow();
        }
    }
    
    // Calls proceed() from a thread unaware of the context
    private static Middleware hop(CompletableFuture<Void> async, Executor pool) {
        return (ctx, next) -> {
            var stage = async.thenCompose(nil -> next.proceed());
            pool.execute(() -> async.complete(null));
            return stage;
        };
    }
    
    @Test
    void currentContext_notSharedAcrossApplications() {
        var app = Application.create(
                Config.configuration().contextPropagation(true).build());
        var other = Application.create();
        var seen = new ArrayList<Optional<Context>>();
        app.use((ctx, next) -> {
            seen.add(other.currentContext());
            return next.proceed();
        });
        run(app);
        assertThat(seen).containsExactly(Optional.empty());
    }
    
    @Test
    void contextStorageMiddleware() {
        var app = Application.create();
        var seen = new ArrayList<Optional<Context>>();
        Middleware record = (ctx, next) -> {
            seen.add(app.currentContext());
            return next.proceed();
        };
        app.use(record).use(app.contextStorageMiddleware()).use(record);
        var ctx = run(app);
        assertThat(seen).containsExactly(Optional.empty(), Optional.of(ctx));
    }
    
    @Test
    void contextExecutor() throws Exception {
        var app = Application.create(
                Config.configuration().contextPropagation(true).build());
        var pool = Executors.newSingleThreadExecutor();
        try {
            var exec = app.contextExecutor(pool);
            var seen = new CompletableFuture<Context>();
            app.use((ctx, next) -> {
                exec.execute(() -> seen.complete(app.currentContext().orElse(null)));
                return next.proceed();
            });
            var ctx = run(app);
            assertThat(seen.get(1, TimeUnit.SECONDS)).isSameAs(ctx);
        } finally {
            pool.shutdownNow();
        }
    }
    
    @Test
    void handleRequest_customPipeline() {
        var app = Application.create();
        var out = new FakeOutgoing();
        var ctx = app.createContext(FakeIncoming.get("/"), out);
        List<String> trace = new ArrayList<>();
        app.handleRequest(ctx, c -> {
            trace.add("pipeline");
            c.body("custom");
            return CompletableFuture.completedFuture(null);
        }).toCompletableFuture().join();
        assertThat(trace).containsExactly("pipeline");
        assertThat(out.body()).isEqualTo("custom");
        assertThatThrownBy(() -> app.handleRequest(ctx, null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void composerFromConfig() {
        var conf = Config.configuration().composer(mws -> ctx -> {
            ctx.body("composed by " + mws.size());
            return CompletableFuture.completedFuture(null);
        }).build();
        var app = Application.create(conf, mock(ErrorHandler.class));
        app.use((ctx, next) -> next.proceed()).use((ctx, next) -> next.proceed());
        var out = new FakeOutgoing();
        app.callback().handle(FakeIncoming.get("/"), out).toCompletableFuture().join();
        assertThat(out.body()).isEqualTo("composed by 2");
        verify(app.errorHandler(), never()).handle(any(), any());
    }
    
    private static Context run(Application app) {
        var ctx = new CompletableFuture<Context>();
        app.use((c, next) -> {
            ctx.complete(c);
            return next.proceed();
        });
        app.callback().handle(FakeIncoming.get("/"), new FakeOutgoing())
                .toCompletableFuture().join();
        return ctx.join();
    }
}
