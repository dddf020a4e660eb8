/*
 * Copyright (c) 2025-2026, The niv editor authors
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice,
 * this list of conditions and the following disclaimer.
 *
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 * this list of conditions and the following disclaimer in the documentation
 * and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.niv.lsp.util.concurrent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

public class CompletableFutureUtils {
    private CompletableFutureUtils() {/* hidden */ }

    /**
     * Combines futures that each produce a list into a single future of the
     * concatenation. The result follows the order of {@code futures}, not the
     * order in which they complete.
     * @param <T> The element type of the lists.
     * @param futures The futures to combine.
     * @return A future that yields all elements, in order.
     */
    public static <T> CompletableFuture<List<T>> flattenInOrder(List<CompletableFuture<List<T>>> futures) {
        return combineAll(futures,
            ArrayList::new,
            Function.identity(),
            CompletableFutureUtils::concat
        );
    }

    /**
     * Combines an {@link Iterable} of {@link CompletableFuture} into a single future that yields a {@link C}.
     * @param <I> The type of the results of the input futures.
     * @param <C> The type of the result of the combined future.
     * @param futures The futures to combine, in the order their results are folded.
     * @param identity The identity function of {@link C}.
     * @param wrap A function that converts an {@link I} to an {@link C}.
     * @param concat A function that merges two values of {@link C}.
     * @return A single future that, if it completes, yields the combined result.
     */
    public static <I, C> CompletableFuture<C> combineAll(Iterable<CompletableFuture<I>> futures,
            Supplier<C> identity, Function<I, C> wrap, BinaryOperator<C> concat) {
        CompletableFuture<C> result = CompletableFuture.completedFuture(identity.get());
        for (var fut : futures) {
            result = result.thenCombine(fut, (acc, t) -> concat.apply(acc, wrap.apply(t)));
        }

        return result;
    }

    /**
     * Appends {@code r} to {@code l}. Only used on accumulators created by the fold itself.
     */
    private static <T> List<T> concat(List<T> l, Collection<T> r) {
        if (l instanceof ArrayList) {
            ((ArrayList<T>) l).ensureCapacity(l.size() + r.size());
        }
        l.addAll(r);
        return l;
    }
}
