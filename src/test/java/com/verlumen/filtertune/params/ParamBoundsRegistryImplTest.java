package com.verlumen.filtertune.params;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParamBoundsRegistryImplTest {
  private static final ParamSpec STRENGTH = ParamSpec.ofDouble("strength", 0.0, 1.0, 0.05);
  private static final ParamSpec WINDOW = ParamSpec.ofOddInteger("window_size", 3, 31, 2);

  @Bind
  private ImmutableList<FilterSpec> filterSpecs =
      ImmutableList.of(FilterSpec.create("Linewise", WINDOW, STRENGTH));

  @Inject private ParamBoundsRegistryImpl registry;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void getParamSpec_declaredParam_returnsSpec() {
    assertThat(registry.getParamSpec("Linewise", "window_size")).isEqualTo(WINDOW);
  }

  @Test
  public void getParamSpecs_keepsDeclarationOrder() {
    assertThat(registry.getParamSpecs("Linewise")).containsExactly(WINDOW, STRENGTH).inOrder();
  }

  @Test
  public void getParamSpecs_unknownFilter_isEmpty() {
    assertThat(registry.getParamSpecs("Median")).isEmpty();
  }

  @Test
  public void containsFilter() {
    assertThat(registry.containsFilter("Linewise")).isTrue();
    assertThat(registry.containsFilter("Median")).isFalse();
  }

  @Test
  public void getParamSpec_unknownParam_returnsPermissiveDefault() {
    ParamSpec spec = registry.getParamSpec("Linewise", "direction");

    assertThat(spec.name()).isEqualTo("direction");
    assertThat(spec.type()).isEqualTo(ParamType.DOUBLE);
    assertThat(spec.min()).isEqualTo(0.0);
    assertThat(spec.max()).isEqualTo(1.0);
    assertThat(spec.step()).isEqualTo(0.1);
  }

  @Test
  public void getParamSpec_unknownFilter_returnsPermissiveDefault() {
    ParamSpec spec = registry.getParamSpec("Median", "ksize");

    assertThat(spec.getRange()).isEqualTo(ParamBoundsRegistry.DEFAULT_SPEC_TEMPLATE.getRange());
  }

  @Test
  public void of_duplicateFilterNames_throws() {
    FilterSpec spec = FilterSpec.create("Linewise", STRENGTH);

    assertThrows(IllegalArgumentException.class, () -> ParamBoundsRegistry.of(spec, spec));
  }

  @Test
  public void noiseFilters_declaresEveryFilter() {
    ParamBoundsRegistry all = ParamBoundsRegistry.noiseFilters();

    for (NoiseFilter filter : NoiseFilter.values()) {
      assertThat(all.containsFilter(filter.filterName())).isTrue();
    }
  }
}
