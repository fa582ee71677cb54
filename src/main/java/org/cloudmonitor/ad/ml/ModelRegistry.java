/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.cloudmonitor.timeseries.common.exception.PersistenceException;
import org.cloudmonitor.timeseries.common.exception.ResourceNotFoundException;
import org.cloudmonitor.timeseries.constant.CommonMessages;
import org.cloudmonitor.timeseries.model.MetricPair;

/**
 * Owns the model and baseline of every pair.
 *
 * Each pair maps to one immutable {@link ModelState}; {@link #put} replaces it in a single step so
 * concurrent readers see either the old model and baseline or the new ones, never a mix.
 * Pairs are independent and share no lock.
 */
public class ModelRegistry {
    private static final Logger logger = LogManager.getLogger(ModelRegistry.class);

    private final Map<MetricPair, ModelState> states;
    private final CheckpointDao checkpointDao;
    private final Clock clock;

    public ModelRegistry(CheckpointDao checkpointDao, Clock clock) {
        this.states = new ConcurrentHashMap<>();
        this.checkpointDao = checkpointDao;
        this.clock = clock;
    }

    /**
     * @param service service name
     * @param metric metric name
     * @return the trained model, empty before the first successful training
     */
    public Optional<PairModel> get(String service, String metric) {
        return getState(service, metric).map(ModelState::getModel);
    }

    public Optional<StatBaseline> getBaseline(String service, String metric) {
        return getState(service, metric).map(ModelState::getBaseline);
    }

    public Optional<ModelState> getState(String service, String metric) {
        return getState(MetricPair.of(service, metric));
    }

    public Optional<ModelState> getState(MetricPair pair) {
        return Optional.ofNullable(states.get(pair));
    }

    /**
     * Installs or replaces the model and baseline of a pair in one step.
     *
     * @param service service name
     * @param metric metric name
     * @param model fitted model
     * @param baseline training values of the model
     * @return the installed state
     */
    public ModelState put(String service, String metric, PairModel model, StatBaseline baseline) {
        MetricPair pair = MetricPair.of(service, metric);
        ModelState state = new ModelState(pair, model, baseline, clock.instant());
        ModelState previous = states.put(pair, state);
        if (previous == null) {
            logger.info("Installed model for {} trained on {} samples", pair, baseline.size());
        } else {
            logger.info("Replaced model for {}, samples {} -> {}", pair, previous.getBaseline().size(), baseline.size());
        }
        return state;
    }

    /**
     * Writes the in-memory model of a pair to its checkpoint. Detection keeps using the in-memory
     * model whatever the outcome.
     *
     * @param service service name
     * @param metric metric name
     * @return checkpoint location
     * @throws ResourceNotFoundException when the pair has no model
     * @throws PersistenceException when the checkpoint cannot be written
     */
    public Path persist(String service, String metric) {
        MetricPair pair = MetricPair.of(service, metric);
        ModelState state = states.get(pair);
        if (state == null) {
            throw new ResourceNotFoundException(pair.getModelId(), CommonMessages.NO_MODEL_MSG + pair);
        }
        Path path = checkpointDao.write(state);
        state.setLastCheckpointTime(clock.instant());
        return path;
    }

    /**
     * Loads the checkpoint of a pair and installs it.
     *
     * @param service service name
     * @param metric metric name
     * @return the restored model, empty if no checkpoint exists
     * @throws PersistenceException when the checkpoint exists but cannot be read or holds another pair
     */
    public Optional<PairModel> restore(String service, String metric) {
        Optional<ModelState> restored = checkpointDao.read(MetricPair.of(service, metric));
        restored.ifPresent(this::install);
        return restored.map(ModelState::getModel);
    }

    /**
     * Restores every checkpoint under the models directory. A checkpoint that cannot be read is
     * logged and skipped.
     *
     * @return restored pairs
     */
    public Set<MetricPair> restoreAll() {
        Set<MetricPair> restored = new TreeSet<>();
        for (CheckpointInfo info : checkpointDao.listCheckpoints()) {
            try {
                ModelState state = checkpointDao.read(info.getPath(), info.getPair());
                install(state);
                restored.add(state.getPair());
            } catch (PersistenceException e) {
                logger.warn(new ParameterizedMessage("Skipping unreadable checkpoint [{}]", info.getPath()), e);
            }
        }
        logger.info("Restored {} models from {}", restored.size(), checkpointDao.getModelsDir());
        return restored;
    }

    private void install(ModelState state) {
        states.put(state.getPair(), state);
        logger.info("Restored model for {} trained on {} samples", state.getPair(), state.getBaseline().size());
    }

    /**
     * @return checkpoint files found on disk
     */
    public List<CheckpointInfo> listCheckpoints() {
        return checkpointDao.listCheckpoints();
    }

    /**
     * @return one map per in-memory model, sorted by pair
     */
    public List<Map<String, Object>> getModelProfiles() {
        List<Map<String, Object>> profiles = new ArrayList<>();
        for (MetricPair pair : getPairs()) {
            ModelState state = states.get(pair);
            if (state != null) {
                profiles.add(state.getModelStateAsMap());
            }
        }
        return profiles;
    }

    public Set<MetricPair> getPairs() {
        return Collections.unmodifiableSet(new TreeSet<>(states.keySet()));
    }

    public boolean contains(String service, String metric) {
        return states.containsKey(MetricPair.of(service, metric));
    }

    public int size() {
        return states.size();
    }
}
