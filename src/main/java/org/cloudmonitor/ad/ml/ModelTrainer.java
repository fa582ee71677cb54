/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.cloudmonitor.ad.ml;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.cloudmonitor.ad.model.DataPoint;
import org.cloudmonitor.ad.stats.ADStats;
import org.cloudmonitor.ad.stats.StatNames;
import org.cloudmonitor.ad.tracking.ExperimentTracker;
import org.cloudmonitor.ad.tracking.TrainingRunMetadata;
import org.cloudmonitor.timeseries.common.exception.InsufficientDataException;
import org.cloudmonitor.timeseries.constant.CommonName;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.cloudmonitor.timeseries.util.ErrorBoundary;
import org.opensearch.common.UUIDs;

import com.amazon.randomcutforest.RandomCutForest;
import com.google.common.collect.ImmutableList;

/**
 * Trains one model per (service, metric) pair from historical points and installs it in the
 * registry.
 */
public class ModelTrainer {
    private static final Logger logger = LogManager.getLogger(ModelTrainer.class);

    private static final List<String> FEATURE_NAMES = ImmutableList.of(CommonName.VALUE_FEATURE);

    private final ModelRegistry registry;
    private final ForestParameters parameters;
    private final int minSamples;
    private final boolean persistModels;
    private final ExperimentTracker tracker;
    private final Executor sideEffectExecutor;
    private final ADStats stats;
    private final Clock clock;

    /**
     * Constructor.
     *
     * @param registry registry the trained models go to
     * @param parameters forest and contamination hyperparameters
     * @param minSamples smallest number of finite values a pair needs
     * @param persistModels whether a trained model is written to its checkpoint
     * @param tracker experiment tracker
     * @param sideEffectExecutor executor for checkpoint writes and tracking calls
     * @param stats engine stats
     * @param clock clock
     */
    public ModelTrainer(
        ModelRegistry registry,
        ForestParameters parameters,
        int minSamples,
        boolean persistModels,
        ExperimentTracker tracker,
        Executor sideEffectExecutor,
        ADStats stats,
        Clock clock
    ) {
        this.registry = registry;
        this.parameters = parameters;
        this.minSamples = minSamples;
        this.persistModels = persistModels;
        this.tracker = tracker;
        this.sideEffectExecutor = sideEffectExecutor;
        this.stats = stats;
        this.clock = clock;
    }

    /**
     * Trains every pair found in the points. A pair without enough samples, or whose fit fails,
     * is logged and skipped; it never stops the other pairs.
     *
     * @param points historical points of any number of pairs
     * @return pairs that got a new model
     */
    public Set<MetricPair> train(List<DataPoint> points) {
        Instant startTime = clock.instant();
        String runId = UUIDs.base64UUID();
        stats.increment(StatNames.TRAINING_RUN_COUNT);

        Map<MetricPair, double[]> groups = group(points);
        logger.info("Training run {} started with {} points over {} pairs", runId, points.size(), groups.size());

        TrainingRunMetadata.Builder metadata = TrainingRunMetadata
            .builder()
            .runId(runId)
            .startTime(startTime)
            .hyperparameters(parameters.toMap())
            .dataPoints(points.size());

        Set<MetricPair> trained = new LinkedHashSet<>();
        for (Map.Entry<MetricPair, double[]> group : groups.entrySet()) {
            MetricPair pair = group.getKey();
            try {
                ModelState state = trainPair(pair, group.getValue());
                trained.add(pair);
                metadata.trained(pair, state.getBaseline());
            } catch (InsufficientDataException e) {
                logger.info("Skipping {}: {}", pair, e.getMessage());
                stats.increment(StatNames.PAIRS_SKIPPED_COUNT);
                metadata.skipped(pair, e.getSampleCount());
            } catch (RuntimeException e) {
                logger.error(new ParameterizedMessage("Failed to train model for [{}]", pair), e);
                stats.increment(StatNames.TRAINING_FAILURE_COUNT);
                metadata.failed(pair, String.valueOf(e.getMessage()));
            }
        }

        TrainingRunMetadata run = metadata.durationMillis(Duration.between(startTime, clock.instant()).toMillis()).build();
        ErrorBoundary
            .submitQuietly(
                sideEffectExecutor,
                "Recording training run " + runId,
                stats.getStat(StatNames.TRACKING_FAILURE_COUNT),
                () -> tracker.recordTrainingRun(run)
            );

        logger.info("Training run {} finished: {} trained, {} skipped", runId, trained.size(), groups.size() - trained.size());
        return Collections.unmodifiableSet(trained);
    }

    /**
     * Fits and installs the model of one pair, then schedules its checkpoint write.
     *
     * @param pair pair to train
     * @param values finite training values in input order
     * @return the installed state
     * @throws InsufficientDataException when there are fewer values than the minimum
     */
    public ModelState trainPair(MetricPair pair, double[] values) {
        if (values.length < minSamples) {
            throw new InsufficientDataException(pair.getModelId(), values.length, minSamples);
        }
        StatBaseline baseline = new StatBaseline(values);
        PairModel model = fit(pair, values);
        ModelState state = registry.put(pair.getService(), pair.getMetric(), model, baseline);
        stats.increment(StatNames.PAIRS_TRAINED_COUNT);
        logger
            .debug(
                "Trained {} on {} samples, mean {} std {} threshold {}",
                pair,
                baseline.size(),
                baseline.mean(),
                baseline.standardDeviation(),
                model.getThreshold()
            );

        if (persistModels) {
            ErrorBoundary.submitQuietly(sideEffectExecutor, "Persisting model of " + pair, stats.getStat(StatNames.CHECKPOINT_FAILURE_COUNT), () -> {
                registry.persist(pair.getService(), pair.getMetric());
                stats.increment(StatNames.CHECKPOINT_WRITE_COUNT);
            });
        }
        return state;
    }

    /**
     * Builds a forest from the values, scores each of them with the finished forest and sets the
     * threshold so that the contamination share of training values lies above it.
     *
     * @param pair pair the model is for
     * @param values training values
     * @return fitted model
     */
    PairModel fit(MetricPair pair, double[] values) {
        RandomCutForest forest = RandomCutForest
            .builder()
            .randomSeed(parameters.getRandomSeed())
            .dimensions(FEATURE_NAMES.size())
            .sampleSize(parameters.getSampleSize())
            .numberOfTrees(parameters.getNumberOfTrees())
            .timeDecay(0)
            .outputAfter(1)
            .parallelExecutionEnabled(false)
            .build();
        for (double value : values) {
            forest.update(new double[] { value });
        }

        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.getAnomalyScore(new double[] { values[i] });
        }
        ContaminationThresholdingModel thresholding = new ContaminationThresholdingModel(parameters.getContamination());
        thresholding.train(scores);
        return new PairModel(pair, FEATURE_NAMES, forest, thresholding, parameters);
    }

    private Map<MetricPair, double[]> group(List<DataPoint> points) {
        Map<MetricPair, List<Double>> values = new LinkedHashMap<>();
        for (DataPoint point : points) {
            List<Double> pairValues = values.computeIfAbsent(point.getPair(), k -> new ArrayList<>());
            if (Double.isFinite(point.getValue())) {
                pairValues.add(point.getValue());
            } else {
                logger.warn("Dropping non-finite value {} of {} at {}", point.getValue(), point.getPair(), point.getTimestamp());
            }
        }
        Map<MetricPair, double[]> groups = new LinkedHashMap<>();
        for (Map.Entry<MetricPair, List<Double>> entry : values.entrySet()) {
            groups.put(entry.getKey(), entry.getValue().stream().mapToDouble(Double::doubleValue).toArray());
        }
        return groups;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public ForestParameters getParameters() {
        return parameters;
    }
}
