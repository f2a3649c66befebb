package com.sqlrecorder.agent;

import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import static net.bytebuddy.matcher.ElementMatchers.isDeclaredBy;
import static net.bytebuddy.matcher.ElementMatchers.named;

/**
 * ByteBuddy delegation target wrapped around a {@link QueryExecutor}.
 *
 * Each {@code sql(...)} call is timed around the delegate. After the delegate returns, the literal
 * statement is read from the executor's side channel, formatted, and registered together with the
 * caller's stack on the Recorder attached to the current thread.
 *
 * A call that throws propagates unchanged and is not recorded. Side-channel accessors pass through.
 *
 * Only reachable through {@link QueryDispatch}, which routes a thread here exclusively while a
 * Recorder is attached to it.
 */
public class CallInterceptor {

    private static final String SQL_METHOD = "sql";

    private final QueryExecutor delegate;
    private final SqlFormatter formatter;
    private final int stackDepth;

    CallInterceptor(QueryExecutor delegate, SqlFormatter formatter, int stackDepth) {
        this.delegate = delegate;
        this.formatter = formatter;
        this.stackDepth = stackDepth;
    }

    /**
     * Generates a {@link QueryExecutor} implementation whose methods all delegate to a new
     * interceptor around {@code delegate}.
     */
    static QueryExecutor wrap(QueryExecutor delegate, RecorderConfig config) {
        CallInterceptor interceptor =
            new CallInterceptor(delegate, new SqlFormatter(config.formatSql()), config.stackDepth());
        try {
            return new ByteBuddy()
                .subclass(Object.class)
                .implement(QueryExecutor.class)
                .method(isDeclaredBy(QueryExecutor.class))
                .intercept(MethodDelegation.withDefaultConfiguration()
                    .filter(named("intercept"))
                    .to(interceptor))
                .make()
                .load(QueryExecutor.class.getClassLoader(), ClassLoadingStrategy.Default.WRAPPER)
                .getLoaded()
                .asSubclass(QueryExecutor.class)
                .getDeclaredConstructor()
                .newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Could not create call interceptor for "
                + delegate.getClass().getName(), e);
        }
    }

    @RuntimeType
    public Object intercept(@Origin Method method, @AllArguments Object[] args) throws Throwable {
        if (!SQL_METHOD.equals(method.getName())) {
            return invoke(method, args);
        }

        double startTime = System.currentTimeMillis() / 1000.0;
        long start = System.nanoTime();
        Object result = invoke(method, args);
        long end = System.nanoTime();

        String stack = captureStack(stackDepth);
        String query = formatter.format(executedText(args));
        double durationMs = (end - start) / 1_000_000.0;

        RecorderContext.require().register(new CallRecord(query, stack, startTime, durationMs));
        return result;
    }

    /** The adapter's literal statement, or the query as passed in when the adapter reports none. */
    private String executedText(Object[] args) {
        String literal = delegate.lastExecutedQuery();
        if (literal != null && !literal.isBlank()) return literal;
        return args.length > 0 && args[0] != null ? String.valueOf(args[0]) : "";
    }

    private Object invoke(Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(delegate, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    /**
     * Renders the current thread's stack, starting at the first application frame above the
     * interception machinery. {@code maxFrames <= 0} keeps every frame.
     */
    static String captureStack(int maxFrames) {
        StackTraceElement[] frames = Thread.currentThread().getStackTrace();
        StringBuilder sb = new StringBuilder();
        int written = 0;
        boolean inCaller = false;
        for (StackTraceElement frame : frames) {
            if (!inCaller) {
                if (isMachinery(frame)) continue;
                inCaller = true;
            }
            if (maxFrames > 0 && written >= maxFrames) break;
            sb.append("  at ").append(frame).append('\n');
            written++;
        }
        return sb.toString();
    }

    private static boolean isMachinery(StackTraceElement frame) {
        String cls = frame.getClassName();
        return cls.equals(Thread.class.getName())
            || cls.equals(CallInterceptor.class.getName())
            || cls.equals(QueryDispatch.class.getName())
            || cls.contains("$ByteBuddy$")
            || cls.startsWith("java.lang.reflect.")
            || cls.startsWith("jdk.internal.reflect.");
    }
}
