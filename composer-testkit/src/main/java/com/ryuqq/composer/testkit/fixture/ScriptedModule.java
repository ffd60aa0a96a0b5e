package com.ryuqq.composer.testkit.fixture;

import com.ryuqq.composer.core.contract.ContentModule;
import com.ryuqq.composer.core.contract.ModuleContext;
import com.ryuqq.composer.core.contract.ModuleOutput;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Configurable {@link ContentModule} for scheduler tests.
 *
 * <p>Behaviour is fixed at construction; the only mutable state is invocation bookkeeping,
 * which is safe to read from the test thread.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScriptedModule categorise = ScriptedModule.emitting("category: proces")
 *     .writing("ontological_category", "proces");
 * ScriptedModule slow = ScriptedModule.emitting("slow").delayedBy(500);
 * ScriptedModule broken = ScriptedModule.throwing(new IllegalStateException("boom"));
 * ScriptedModule echo = ScriptedModule.rendering(ctx -&gt; "category=" + ctx.get("ontological_category").orElse("?"));
 * </pre>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class ScriptedModule implements ContentModule {

    private final Function<ModuleContext, String> renderer;
    private final Map<String, Object> writes;
    private final long delayMs;
    private final RuntimeException failure;
    private final String failureMessage;
    private final String unmetPrecondition;

    private final AtomicInteger invocations = new AtomicInteger();
    private final List<String> threadNames = new CopyOnWriteArrayList<>();

    private ScriptedModule(Function<ModuleContext, String> renderer, Map<String, Object> writes, long delayMs,
                           RuntimeException failure, String failureMessage, String unmetPrecondition) {
        this.renderer = renderer;
        this.writes = writes;
        this.delayMs = delayMs;
        this.failure = failure;
        this.failureMessage = failureMessage;
        this.unmetPrecondition = unmetPrecondition;
    }

    /**
     * Module returning fixed content.
     */
    public static ScriptedModule emitting(String content) {
        return rendering(context -> content);
    }

    /**
     * Module computing its content from the context.
     */
    public static ScriptedModule rendering(Function<ModuleContext, String> renderer) {
        return new ScriptedModule(renderer, Map.of(), 0, null, null, null);
    }

    /**
     * Module that throws from {@code execute}.
     */
    public static ScriptedModule throwing(RuntimeException failure) {
        return new ScriptedModule(context -> "", Map.of(), 0, failure, null, null);
    }

    /**
     * Module that returns a FAILURE output.
     */
    public static ScriptedModule failingWith(String message) {
        return new ScriptedModule(context -> "", Map.of(), 0, null, message, null);
    }

    /**
     * Copy that also writes the given shared-state entry.
     */
    public ScriptedModule writing(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(writes);
        merged.put(key, value);
        return new ScriptedModule(renderer, merged, delayMs, failure, failureMessage, unmetPrecondition);
    }

    /**
     * Copy that sleeps before producing its result.
     */
    public ScriptedModule delayedBy(long delayMs) {
        return new ScriptedModule(renderer, writes, delayMs, failure, failureMessage, unmetPrecondition);
    }

    /**
     * Copy whose precondition is never met.
     */
    public ScriptedModule unmetPrecondition(String reason) {
        return new ScriptedModule(renderer, writes, delayMs, failure, failureMessage, reason);
    }

    @Override
    public Optional<String> precondition(ModuleContext context) {
        return Optional.ofNullable(unmetPrecondition);
    }

    @Override
    public ModuleOutput execute(ModuleContext context) {
        invocations.incrementAndGet();
        threadNames.add(Thread.currentThread().getName());
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while delayed", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        if (failureMessage != null) {
            return ModuleOutput.failure(failureMessage);
        }
        return ModuleOutput.success(renderer.apply(context), writes);
    }

    public int invocations() {
        return invocations.get();
    }

    public List<String> threadNames() {
        return List.copyOf(threadNames);
    }
}
