package com.verlumen.filtertune.optimization;

import com.google.common.collect.ImmutableMap;

/**
 * Applies one named filter to an image.
 *
 * <p>Implementations must not mutate {@code image}: they return a new image, so the optimizer can
 * keep evaluating candidates against the caller's original. For identical inputs the result must
 * be identical.
 *
 * @param <I> the image representation, opaque to the optimizer
 */
@FunctionalInterface
public interface FilterApplier<I> {
  I apply(I image, String filterName, ImmutableMap<String, Object> params);
}
