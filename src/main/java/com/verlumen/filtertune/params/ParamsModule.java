package com.verlumen.filtertune.params;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

/** Binds a {@link ParamBoundsRegistry} over every {@link NoiseFilter}. */
public final class ParamsModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(ParamBoundsRegistry.class).to(ParamBoundsRegistryImpl.class);
  }

  @Provides
  ImmutableList<FilterSpec> provideFilterSpecs() {
    return NoiseFilter.allSpecs();
  }
}
