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

package org.cloudmonitor.ad;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudmonitor.ad.evaluation.DetectionEvaluator;
import org.cloudmonitor.ad.ml.CheckpointDao;
import org.cloudmonitor.ad.ml.ForestParameters;
import org.cloudmonitor.ad.ml.MetricAnomalyDetector;
import org.cloudmonitor.ad.ml.ModelRegistry;
import org.cloudmonitor.ad.ml.ModelTrainer;
import org.cloudmonitor.ad.ml.RunTracker;
import org.cloudmonitor.ad.ml.SeverityScorer;
import org.cloudmonitor.ad.model.AnomalyRecord;
import org.cloudmonitor.ad.model.DataPoint;
import org.cloudmonitor.ad.model.RunSummary;
import org.cloudmonitor.ad.remediation.RemediationSelector;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.ad.stats.ADStats;
import org.cloudmonitor.ad.stats.StatsMetricsExporter;
import org.cloudmonitor.ad.tracking.ExperimentTracker;
import org.cloudmonitor.ad.tracking.LoggingExperimentTracker;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.opensearch.common.settings.Settings;

import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import io.protostuff.LinkedBuffer;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Entry point of the engine. Reads the settings, wires every component and owns the thread
 * that runs checkpoint writes and tracking calls.
 */
public class AnomalyEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AnomalyEngine.class);

    private static final Duration BUFFER_EVICTION_INTERVAL = Duration.ofHours(1);

    private final Settings settings;
    private final ExecutorService sideEffectExecutor;
    private final GenericObjectPool<LinkedBuffer> serializeRCFBufferPool;
    private final ADStats stats;
    private final ModelRegistry registry;
    private final ModelTrainer trainer;
    private final MetricAnomalyDetector detector;
    private final RunTracker runTracker;
    private final StatsMetricsExporter exporter;
    private final RemediationSelector remediationSelector;
    private final DetectionEvaluator evaluator;

    public AnomalyEngine(Settings settings, Clock clock) {
        this(settings, clock, new LoggingExperimentTracker(newGson()));
    }

    /**
     * Constructor.
     *
     * @param settings engine settings
     * @param clock clock used for training, checkpoint and run times
     * @param tracker experiment tracker notified after every run
     */
    public AnomalyEngine(Settings settings, Clock clock, ExperimentTracker tracker) {
        this.settings = settings;
        ForestParameters parameters = ForestParameters.fromSettings(settings);

        this.sideEffectExecutor = Executors
            .newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("cloudmonitor-side-effect-%d").setDaemon(true).build());

        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveExecutorContextEnabled(true);
        mapper.setSaveTreeStateEnabled(true);
        mapper.setPartialTreeStateEnabled(true);

        serializeRCFBufferPool = new GenericObjectPool<>(new BasePooledObjectFactory<LinkedBuffer>() {
            @Override
            public LinkedBuffer create() throws Exception {
                return LinkedBuffer.allocate(AnomalyDetectorSettings.SERIALIZATION_BUFFER_BYTES);
            }

            @Override
            public PooledObject<LinkedBuffer> wrap(LinkedBuffer obj) {
                return new DefaultPooledObject<>(obj);
            }
        });
        serializeRCFBufferPool.setMaxTotal(AnomalyDetectorSettings.MAX_TOTAL_RCF_SERIALIZATION_BUFFERS);
        serializeRCFBufferPool.setMaxIdle(AnomalyDetectorSettings.MAX_TOTAL_RCF_SERIALIZATION_BUFFERS);
        serializeRCFBufferPool.setMinIdle(0);
        serializeRCFBufferPool.setBlockWhenExhausted(false);
        serializeRCFBufferPool.setTimeBetweenEvictionRuns(BUFFER_EVICTION_INTERVAL);

        CheckpointDao checkpointDao = new CheckpointDao(
            Paths.get(AnomalyDetectorSettings.MODELS_DIR.get(settings)),
            newGson(),
            mapper,
            RuntimeSchema.getSchema(RandomCutForestState.class),
            serializeRCFBufferPool,
            AnomalyDetectorSettings.SERIALIZATION_BUFFER_BYTES,
            AnomalyDetectorSettings.MAX_CHECKPOINT_BYTES,
            clock
        );

        this.registry = new ModelRegistry(checkpointDao, clock);
        this.stats = ADStats.create(registry::size);
        this.runTracker = new RunTracker();
        this.exporter = new StatsMetricsExporter();
        this.remediationSelector = RemediationSelector.fromSettings(settings);
        this.evaluator = new DetectionEvaluator();

        this.trainer = new ModelTrainer(
            registry,
            parameters,
            AnomalyDetectorSettings.MIN_TRAINING_SAMPLES.get(settings),
            AnomalyDetectorSettings.PERSIST_MODELS.get(settings),
            tracker,
            sideEffectExecutor,
            stats,
            clock
        );
        this.detector = new MetricAnomalyDetector(
            registry,
            SeverityScorer.fromSettings(registry, settings),
            runTracker,
            exporter,
            tracker,
            sideEffectExecutor,
            stats,
            clock
        );
        logger.info("Anomaly engine started with {} and models in {}", parameters, checkpointDao.getModelsDir());
    }

    public static AnomalyEngine fromConfigFile(Path path) throws IOException {
        return new AnomalyEngine(AnomalyDetectorSettings.load(path), Clock.systemUTC());
    }

    public static AnomalyEngine fromDefaultConfig() throws IOException {
        return new AnomalyEngine(AnomalyDetectorSettings.loadDefault(), Clock.systemUTC());
    }

    static Gson newGson() {
        return new GsonBuilder().serializeSpecialFloatingPointValues().create();
    }

    /**
     * @param points historical points
     * @return pairs that got a new model
     */
    public Set<MetricPair> train(List<DataPoint> points) {
        return trainer.train(points);
    }

    /**
     * @param points new points
     * @return anomalies of the latest point of each pair
     */
    public List<AnomalyRecord> detect(List<DataPoint> points) {
        return detector.detect(points);
    }

    /**
     * Loads every checkpoint found in the models directory.
     *
     * @return restored pairs
     */
    public Set<MetricPair> restoreModels() {
        return registry.restoreAll();
    }

    public List<RunSummary> getRunHistory() {
        return runTracker.getHistory();
    }

    public Settings getSettings() {
        return settings;
    }

    public ADStats getStats() {
        return stats;
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public StatsMetricsExporter getExporter() {
        return exporter;
    }

    public RemediationSelector getRemediationSelector() {
        return remediationSelector;
    }

    public DetectionEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * Waits for pending checkpoint writes and tracking calls, then stops the side-effect thread.
     */
    @Override
    public void close() {
        sideEffectExecutor.shutdown();
        try {
            if (!sideEffectExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Side-effect tasks still running after 30 seconds, interrupting");
                sideEffectExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sideEffectExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        serializeRCFBufferPool.close();
        logger.info("Anomaly engine stopped");
    }
}
