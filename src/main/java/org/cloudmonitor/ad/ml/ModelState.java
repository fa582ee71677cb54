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

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.cloudmonitor.timeseries.constant.CommonName;
import org.cloudmonitor.timeseries.model.MetricPair;

import com.google.common.base.Preconditions;

/**
 * A model and the baseline it was trained on. The registry swaps whole states, so a reader
 * always sees a model together with its own baseline.
 */
public class ModelState {
    private final MetricPair pair;
    private final PairModel model;
    private final StatBaseline baseline;
    private final Instant lastTrainedTime;
    // Instant.MIN until the state has been written to disk
    private volatile Instant lastCheckpointTime;

    /**
     * Constructor.
     *
     * @param pair pair the model is bound to
     * @param model fitted model
     * @param baseline training values of the model
     * @param lastTrainedTime when the model was fitted
     */
    public ModelState(MetricPair pair, PairModel model, StatBaseline baseline, Instant lastTrainedTime) {
        this.pair = Preconditions.checkNotNull(pair, "pair");
        this.model = Preconditions.checkNotNull(model, "model");
        this.baseline = Preconditions.checkNotNull(baseline, "baseline");
        this.lastTrainedTime = lastTrainedTime;
        this.lastCheckpointTime = Instant.MIN;
    }

    public MetricPair getPair() {
        return pair;
    }

    public PairModel getModel() {
        return model;
    }

    public StatBaseline getBaseline() {
        return baseline;
    }

    public Instant getLastTrainedTime() {
        return lastTrainedTime;
    }

    /**
     * Returns the time when a checkpoint for the model was made last time.
     *
     * @return the time when a checkpoint for the model was made last time.
     */
    public Instant getLastCheckpointTime() {
        return lastCheckpointTime;
    }

    /**
     * Sets the time when a checkpoint for the model was made last time.
     *
     * @param lastCheckpointTime time when a checkpoint for the model was made last time.
     */
    public void setLastCheckpointTime(Instant lastCheckpointTime) {
        this.lastCheckpointTime = lastCheckpointTime;
    }

    /**
     * Gets the Model State as a map
     *
     * @return Map of ModelStates
     */
    public Map<String, Object> getModelStateAsMap() {
        Map<String, Object> map = new HashMap<>(baseline.toStat());
        map.put(CommonName.MODEL_ID_KEY, pair.getModelId());
        map.putAll(pair.toStat());
        map.put(CommonName.THRESHOLD_FIELD, model.getThreshold());
        if (lastTrainedTime != null) {
            map.put(CommonName.LAST_TRAINED_TIME_KEY, lastTrainedTime.toEpochMilli());
        }
        if (lastCheckpointTime != Instant.MIN) {
            map.put(CommonName.LAST_CHECKPOINT_TIME_KEY, lastCheckpointTime.toEpochMilli());
        }
        return map;
    }
}
