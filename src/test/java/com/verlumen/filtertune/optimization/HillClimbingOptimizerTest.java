package com.verlumen.filtertune.optimization;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import com.verlumen.filtertune.params.FilterSpec;
import com.verlumen.filtertune.params.ParamBoundsRegistry;
import com.verlumen.filtertune.params.ParamSpec;
import com.verlumen.filtertune.scoring.NoiseMetrics;
import com.verlumen.filtertune.scoring.ScoreConfig;
import com.verlumen.filtertune.scoring.ScoreFunction;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HillClimbingOptimizerTest {
  private static final ScoreFunction NOISE_STD_ONLY =
      ScoreFunction.create(
          ScoreConfig.builder().setWeights(ImmutableMap.of(NoiseMetrics.NOISE_STD, 1.0)).build());

  private static final ParamBoundsRegistry BLUR_REGISTRY =
      ParamBoundsRegistry.of(
          FilterSpec.create("Blur", ParamSpec.ofDouble("strength", 0.0, 1.0, 0.1)));

  /** Noise is lowest when the blur strength is 0.7. */
  private static final ImageAnalyzer<FakeImage> BLUR_ANALYZER =
      image -> {
        double distance = image.get("Blur", "strength", 0.0) - 0.7;
        return ImmutableMap.of(NoiseMetrics.NOISE_STD, 1.0 + distance * distance);
      };

  private static HillClimbingOptimizer optimizer(
      ParamBoundsRegistry registry, ProgressListener listener) {
    return new HillClimbingOptimizer(
        NOISE_STD_ONLY, registry, HillClimbingConfig.defaults(), listener);
  }

  @Test
  public void optimize_convergesToOptimum() {
    PipelineParams start = PipelineParams.builder().put("Blur", "strength", 0.2).build();

    OptimizationResult result =
        optimizer(BLUR_REGISTRY, ProgressListener.none())
            .optimize(
                FakeImage.ORIGINAL,
                ImmutableList.of("Blur"),
                start,
                FakeImage.applier(),
                BLUR_ANALYZER);

    assertThat(result.bestParams().getNumber("Blur", "strength").getAsDouble())
        .isWithin(0.1)
        .of(0.7);
    assertThat(result.improved()).isTrue();
    assertThat(result.bestScore()).isGreaterThan(result.initialScore());
    assertThat(start.getNumber("Blur", "strength").getAsDouble()).isEqualTo(0.2);
  }

  @Test
  public void optimize_scoreHistoryNeverDecreases() {
    PipelineParams start = PipelineParams.builder().put("Blur", "strength", 0.0).build();

    OptimizationResult result =
        optimizer(BLUR_REGISTRY, ProgressListener.none())
            .optimize(
                FakeImage.ORIGINAL,
                ImmutableList.of("Blur"),
                start,
                FakeImage.applier(),
                BLUR_ANALYZER);

    assertThat(result.scoreHistory()).isInOrder(Ordering.natural());
    assertThat(result.scoreHistory().get(0)).isEqualTo(result.initialScore());
    assertThat(Iterables.getLast(result.scoreHistory())).isEqualTo(result.bestScore());
    assertThat(result.scoreHistory()).hasSize(result.iterations() + 1);
  }

  @Test
  public void optimize_alreadyOptimal_stopsWithoutImprovement() {
    PipelineParams start = PipelineParams.builder().put("Blur", "strength", 0.7).build();

    OptimizationResult result =
        optimizer(BLUR_REGISTRY, ProgressListener.none())
            .optimize(
                FakeImage.ORIGINAL,
                ImmutableList.of("Blur"),
                start,
                FakeImage.applier(),
                BLUR_ANALYZER);

    assertThat(result.improved()).isFalse();
    assertThat(result.bestParams()).isEqualTo(start);
    assertThat(result.iterations()).isEqualTo(HillClimbingConfig.DEFAULT_MAX_NO_IMPROVEMENT);
  }

  @Test
  public void optimize_oddOnlyParam_onlyOddValuesEvaluated() {
    List<Double> windowSizes = new ArrayList<>();
    FilterApplier<FakeImage> recordingApplier =
        (image, filterName, params) -> {
          windowSizes.add(((Number) params.get("window_size")).doubleValue());
          return image.with(filterName, params);
        };
    ImageAnalyzer<FakeImage> analyzer =
        image -> {
          double distance = image.get("Linewise", "window_size", 3.0) - 12.0;
          return ImmutableMap.of(NoiseMetrics.NOISE_STD, 1.0 + distance * distance);
        };
    PipelineParams start =
        PipelineParams.builder()
            .put("Linewise", "window_size", 5)
            .put("Linewise", "direction", "horizontal")
            .build();

    OptimizationResult result =
        optimizer(ParamBoundsRegistry.noiseFilters(), ProgressListener.none())
            .optimize(
                FakeImage.ORIGINAL,
                ImmutableList.of("Linewise"),
                start,
                recordingApplier,
                analyzer);

    assertThat(windowSizes).isNotEmpty();
    for (double windowSize : windowSizes) {
      assertThat(windowSize % 2).isEqualTo(1.0);
    }
    Object best = result.bestParams().getFilterParams("Linewise").get("window_size");
    assertThat(best).isInstanceOf(Integer.class);
    assertThat((Integer) best).isAnyOf(11, 13);
    assertThat(result.bestParams().getFilterParams("Linewise"))
        .containsEntry("direction", "horizontal");
  }

  @Test
  public void optimize_stopFromProgressListener_returnsBestSoFar() {
    List<Integer> progress = new ArrayList<>();
    HillClimbingOptimizer[] holder = new HillClimbingOptimizer[1];
    holder[0] =
        optimizer(
            BLUR_REGISTRY,
            (current, total, bestScore) -> {
              progress.add(current);
              holder[0].stop();
            });
    PipelineParams start = PipelineParams.builder().put("Blur", "strength", 0.0).build();

    OptimizationResult result =
        holder[0].optimize(
            FakeImage.ORIGINAL,
            ImmutableList.of("Blur"),
            start,
            FakeImage.applier(),
            BLUR_ANALYZER);

    assertThat(progress).containsExactly(1);
    assertThat(result.iterations()).isEqualTo(1);
    assertThat(result.bestScore()).isAtLeast(result.initialScore());
  }

  @Test
  public void optimize_reportsProgressAgainstMaxIterations() {
    List<Integer> totals = new ArrayList<>();
    PipelineParams start = PipelineParams.builder().put("Blur", "strength", 0.2).build();

    optimizer(BLUR_REGISTRY, (current, total, bestScore) -> totals.add(total))
        .optimize(
            FakeImage.ORIGINAL,
            ImmutableList.of("Blur"),
            start,
            FakeImage.applier(),
            BLUR_ANALYZER);

    assertThat(ImmutableSet.copyOf(totals))
        .containsExactly(HillClimbingConfig.DEFAULT_MAX_ITERATIONS);
  }

  @Test
  public void stepSize_integerParams_neverRoundToZero() {
    ParamSpec iterations = ParamSpec.ofInteger("iterations", 5, 30, 5);
    ParamSpec window = ParamSpec.ofOddInteger("window_size", 3, 31, 2);

    assertThat(HillClimbingOptimizer.stepSize(iterations, 0.1)).isEqualTo(1.0);
    assertThat(HillClimbingOptimizer.stepSize(iterations, 1.0)).isEqualTo(5.0);
    assertThat(HillClimbingOptimizer.stepSize(window, 0.1)).isEqualTo(2.0);
    assertThat(HillClimbingOptimizer.stepSize(ParamSpec.ofOddInteger("k", 3, 31, 6), 0.5))
        .isEqualTo(4.0);
  }
}
