package org.broadinstitute.repeatresolver.utils;

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.function.Function;
import java.util.function.Supplier;

public final class Utils {

    private Utils(){}

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link Collection} is not {@code null} and that it is not empty.
     * If it's non-null and non-empty it returns the input, otherwise it throws an {@link IllegalArgumentException}
     * @param collection any Collection
     * @param message a message to include in the output
     * @return the original collection
     * @throws IllegalArgumentException if collection is null or empty
     */
    public static <I, T extends Collection<I>> T nonEmpty(T collection, String message){
        nonNull(collection, "The collection is null: " + message);
        if(collection.isEmpty()){
            throw new IllegalArgumentException("The collection is empty: " + message);
        } else {
            return collection;
        }
    }

    /**
     * Checks that the collection does not contain a {@code null} value (throws an {@link IllegalArgumentException} if it does).
     * @param collection collection
     * @param message the text message that would be pass to the exception thrown when c contains a null.
     * @throws IllegalArgumentException if collection is null or contains any null elements
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        Utils.nonNull(collection, message);
        for ( final Object element : collection ) {
            if ( element == null ) {
                throw new IllegalArgumentException(message);
            }
        }
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.  If msg is not a
     * String literal i.e. if it requires computation, use the Supplier<String> version, below.
     */
    public static void validate(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalStateException(msg.get());
        }
    }

    /**
     * Applies {@code function} to every element of {@code inputs}, using up to {@code numThreads} threads, and
     * returns the results in input order. The call does not return until every task has finished, so callers
     * always see the complete result set.
     *
     * @param inputs the elements to transform
     * @param function a function safe to call from several threads at once
     * @param numThreads number of worker threads; 1 means the work is done on the calling thread
     * @param threadNameFormat name format for worker threads, as accepted by {@link ThreadFactoryBuilder#setNameFormat}
     */
    public static <F, T> List<T> transformParallel( final List<F> inputs,
                                                    final Function<F, T> function,
                                                    final int numThreads,
                                                    final String threadNameFormat ) {
        Utils.nonNull(inputs, "inputs");
        Utils.nonNull(function, "function");
        Utils.validateArg(numThreads >= 1, "numThreads must be at least 1");

        if ( numThreads == 1 || inputs.size() < 2 ) {
            return new ArrayList<>(Lists.transform(inputs, function::apply));
        }

        final ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat(threadNameFormat)
                .setDaemon(true).build();
        final ExecutorService executorService =
                Executors.newFixedThreadPool(Math.min(numThreads, inputs.size()), threadFactory);
        try {
            final List<Future<T>> futures = new ArrayList<>(inputs.size());
            for ( final F input : inputs ) {
                futures.add(executorService.submit(() -> function.apply(input)));
            }
            final List<T> results = new ArrayList<>(inputs.size());
            for ( final Future<T> future : futures ) {
                results.add(future.get());
            }
            return results;
        } catch ( final ExecutionException e ) {
            throw new ResolverException("Problem running task", e.getCause());
        } catch ( final InterruptedException e ) {
            Thread.currentThread().interrupt();
            throw new ResolverException("Interrupted while waiting for task", e);
        } finally {
            executorService.shutdownNow();
        }
    }
}
