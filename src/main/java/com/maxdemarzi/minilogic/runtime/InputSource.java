package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.Bit;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supplies the value for an INPUT builtin. The engine waits on the returned stage,
 * completing it exceptionally or cancelling it aborts the whole run.
 */
@FunctionalInterface
public interface InputSource {

    CompletionStage<Bit> request(String prompt);

    InputSource NONE = prompt -> CompletableFuture.failedFuture(
            new IllegalStateException("No input source available for: " + prompt));

    static InputSource of(Bit... answers) {
        AtomicInteger next = new AtomicInteger();
        return prompt -> {
            int index = next.getAndIncrement();
            if (index >= answers.length) {
                return CompletableFuture.failedFuture(new IllegalStateException("No more input for: " + prompt));
            }
            return CompletableFuture.completedFuture(answers[index]);
        };
    }
}
