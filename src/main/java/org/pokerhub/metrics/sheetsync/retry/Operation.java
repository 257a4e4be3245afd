/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

/**
 * A fallible unit of work, typically one call into an external
 * collaborator. Wrappers like {@link RetryPolicy#wrap(Operation)} and
 * {@link Operations#timed(String, long, Operation)} take an operation and
 * return another one, so they can be chained.
 *
 * @param <T> Result type.
 */
@FunctionalInterface
public interface Operation<T> {

  T call() throws Exception;

}
