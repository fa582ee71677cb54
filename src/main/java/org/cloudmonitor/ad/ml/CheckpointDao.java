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

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.timeseries.common.exception.IncompatibleCheckpointException;
import org.cloudmonitor.timeseries.common.exception.PersistenceException;
import org.cloudmonitor.timeseries.constant.CommonMessages;
import org.cloudmonitor.timeseries.constant.CommonName;
import org.cloudmonitor.timeseries.model.MetricPair;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;

/**
 * DAO for model checkpoints. One JSON file per pair under the models directory:
 * {@code <models_dir>/<service>/<metric>_model.ckpt}.
 */
public class CheckpointDao {

    private static final Logger logger = LogManager.getLogger(CheckpointDao.class);

    // letters, digits, dash and underscore are kept; anything else, dots included, is percent-encoded
    private static final Escaper FILE_NAME_ESCAPER = new PercentEscaper("-_", false);

    // dependencies
    private final Gson gson;
    private final RandomCutForestMapper mapper;
    private final Schema<RandomCutForestState> rcfSchema;
    private final GenericObjectPool<LinkedBuffer> serializeRCFBufferPool;
    private final Clock clock;

    // configuration
    private final Path modelsDir;
    private final int serializeRCFBufferSize;
    // we won't read/write a checkpoint larger than a threshold
    private final int maxCheckpointBytes;

    /**
     * Constructor with dependencies and configuration.
     *
     * @param modelsDir root directory of checkpoint files
     * @param gson accessor to Gson functionality
     * @param mapper RCF model serialization utility
     * @param rcfSchema RCF serialization schema
     * @param serializeRCFBufferPool object pool for serializing rcf models
     * @param serializeRCFBufferSize the size of the buffer for RCF serialization
     * @param maxCheckpointBytes max checkpoint size in bytes
     * @param clock UTC clock
     */
    public CheckpointDao(
        Path modelsDir,
        Gson gson,
        RandomCutForestMapper mapper,
        Schema<RandomCutForestState> rcfSchema,
        GenericObjectPool<LinkedBuffer> serializeRCFBufferPool,
        int serializeRCFBufferSize,
        int maxCheckpointBytes,
        Clock clock
    ) {
        this.modelsDir = modelsDir;
        this.gson = gson;
        this.mapper = mapper;
        this.rcfSchema = rcfSchema;
        this.serializeRCFBufferPool = serializeRCFBufferPool;
        this.serializeRCFBufferSize = serializeRCFBufferSize;
        this.maxCheckpointBytes = maxCheckpointBytes;
        this.clock = clock;
    }

    public Path getModelsDir() {
        return modelsDir;
    }

    /**
     * Deterministic checkpoint location of a pair. Distinct pairs never share a location and the
     * location never leaves the models directory.
     *
     * @param pair pair
     * @return checkpoint path
     */
    public Path checkpointPath(MetricPair pair) {
        return modelsDir.resolve(toFileName(pair.getService())).resolve(toFileName(pair.getMetric()) + CommonName.CHECKPOINT_FILE_SUFFIX);
    }

    static String toFileName(String identifier) {
        return FILE_NAME_ESCAPER.escape(identifier);
    }

    static String fromFileName(String fileName) {
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }

    /**
     * Writes the checkpoint of a model state, replacing any previous one.
     *
     * @param modelState state to save
     * @return where the checkpoint was written
     * @throws PersistenceException when the checkpoint cannot be serialized or written
     */
    public Path write(ModelState modelState) {
        MetricPair pair = modelState.getPair();
        String checkpoint = toCheckpoint(modelState);
        byte[] bytes = checkpoint.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxCheckpointBytes) {
            throw new PersistenceException(
                pair.getModelId(),
                String.format(Locale.ROOT, CommonMessages.CHECKPOINT_TOO_LARGE, pair.getModelId(), bytes.length)
            );
        }
        Path target = checkpointPath(pair);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, bytes);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new PersistenceException(pair.getModelId(), "Failed to write checkpoint to " + target, e);
        }
        logger.debug("Saved checkpoint of {} to {} ({} bytes)", pair, target, bytes.length);
        return target;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads the checkpoint of a pair.
     *
     * @param pair pair
     * @return the restored state, empty if there is no checkpoint
     * @throws PersistenceException when the checkpoint exists but cannot be read or holds another pair
     */
    public Optional<ModelState> read(MetricPair pair) {
        Path path = checkpointPath(pair);
        if (!Files.isRegularFile(path)) {
            logger.debug(CommonMessages.NO_CHECKPOINT_MSG + "{}", pair);
            return Optional.empty();
        }
        return Optional.of(read(path, pair));
    }

    /**
     * Reads a checkpoint file that must hold the model of the given pair.
     *
     * @param path checkpoint file
     * @param expected pair the file belongs to
     * @return the restored state
     * @throws PersistenceException when the checkpoint cannot be read or holds another pair
     */
    public ModelState read(Path path, MetricPair expected) {
        ModelState state = read(path);
        if (!expected.equals(state.getPair())) {
            throw new PersistenceException(
                expected.getModelId(),
                String.format(Locale.ROOT, CommonMessages.CHECKPOINT_PAIR_MISMATCH, path, state.getPair(), expected)
            );
        }
        return state;
    }

    /**
     * Reads a checkpoint file.
     *
     * @param path checkpoint file
     * @return the restored state
     * @throws PersistenceException when the checkpoint cannot be read
     */
    public ModelState read(Path path) {
        String checkpoint;
        try {
            long size = Files.size(path);
            if (size > maxCheckpointBytes) {
                throw new PersistenceException(
                    path.toString(),
                    String.format(Locale.ROOT, CommonMessages.CHECKPOINT_TOO_LARGE, path, size)
                );
            }
            checkpoint = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException(path.toString(), "Failed to read checkpoint " + path, e);
        }
        return fromCheckpoint(checkpoint, path.toString());
    }

    /**
     * Lists checkpoint files under the models directory.
     *
     * @return checkpoints sorted by path, empty if the directory does not exist
     * @throws PersistenceException when the directory cannot be listed
     */
    public List<CheckpointInfo> listCheckpoints() {
        if (!Files.isDirectory(modelsDir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.walk(modelsDir, 2)) {
            List<Path> paths = files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(CommonName.CHECKPOINT_FILE_SUFFIX))
                .filter(p -> modelsDir.equals(p.getParent().getParent()))
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
            List<CheckpointInfo> infos = new ArrayList<>();
            for (Path path : paths) {
                String fileName = path.getFileName().toString();
                String metric;
                String service;
                try {
                    metric = fromFileName(fileName.substring(0, fileName.length() - CommonName.CHECKPOINT_FILE_SUFFIX.length()));
                    service = fromFileName(path.getParent().getFileName().toString());
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring checkpoint with undecodable path {}", path);
                    continue;
                }
                if (metric.isEmpty() || service.isEmpty()) {
                    logger.warn("Ignoring checkpoint with undecodable path {}", path);
                    continue;
                }
                infos
                    .add(new CheckpointInfo(service, metric, path, Files.size(path), Files.getLastModifiedTime(path).toInstant()));
            }
            return infos;
        } catch (IOException e) {
            throw new PersistenceException(modelsDir.toString(), "Failed to list checkpoints under " + modelsDir, e);
        }
    }

    /**
     * Serializes a model state.
     *
     * @param modelState model state
     * @return serialized JSON string
     * @throws PersistenceException when the forest cannot be serialized
     */
    public String toCheckpoint(ModelState modelState) {
        PairModel model = modelState.getModel();
        MetricPair pair = modelState.getPair();
        ForestParameters parameters = model.getParameters();
        JsonObject json = new JsonObject();
        json.addProperty(CommonName.SCHEMA_VERSION_FIELD, AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION);
        json.addProperty(CommonName.SERVICE_FIELD, pair.getService());
        json.addProperty(CommonName.METRIC_FIELD, pair.getMetric());
        json.addProperty(CommonName.TIMESTAMP, modelState.getLastTrainedTime().toEpochMilli());
        json.addProperty(CommonName.CHECKPOINT_TIME_FIELD, clock.millis());
        json.add(CommonName.FEATURE_NAMES_FIELD, gson.toJsonTree(model.getFeatureNames()));
        json.addProperty(CommonName.THRESHOLD_FIELD, model.getThreshold());
        json.addProperty(CommonName.CONTAMINATION_FIELD, parameters.getContamination());
        json.addProperty(CommonName.NUM_TREES_FIELD, parameters.getNumberOfTrees());
        json.addProperty(CommonName.SAMPLE_SIZE_FIELD, parameters.getSampleSize());
        json.addProperty(CommonName.RANDOM_SEED_FIELD, parameters.getRandomSeed());
        json.add(CommonName.BASELINE_FIELD, gson.toJsonTree(modelState.getBaseline().getValues()));
        json.addProperty(CommonName.FIELD_MODELV2, toCheckpoint(model.getForest(), pair));
        return gson.toJson(json);
    }

    private String toCheckpoint(RandomCutForest forest, MetricPair pair) {
        String checkpoint = null;
        Map.Entry<LinkedBuffer, Boolean> result = checkoutOrNewBuffer();
        LinkedBuffer buffer = result.getKey();
        boolean needCheckin = result.getValue();
        try {
            checkpoint = toCheckpoint(forest, buffer);
        } catch (RuntimeException e) {
            logger.error(new ParameterizedMessage("Failed to serialize model of [{}]", pair), e);
            if (needCheckin) {
                try {
                    serializeRCFBufferPool.invalidateObject(buffer);
                    needCheckin = false;
                } catch (Exception x) {
                    logger.warn("Failed to invalidate buffer", x);
                }
            }
            try {
                checkpoint = toCheckpoint(forest, LinkedBuffer.allocate(serializeRCFBufferSize));
            } catch (RuntimeException ex) {
                throw new PersistenceException(pair.getModelId(), "Failed to serialize model", ex);
            }
        } finally {
            if (needCheckin) {
                try {
                    serializeRCFBufferPool.returnObject(buffer);
                } catch (Exception e) {
                    logger.warn("Failed to return buffer to pool", e);
                }
            }
        }
        return checkpoint;
    }

    private Map.Entry<LinkedBuffer, Boolean> checkoutOrNewBuffer() {
        LinkedBuffer buffer = null;
        boolean isCheckout = true;
        try {
            buffer = serializeRCFBufferPool.borrowObject();
        } catch (Exception e) {
            logger.warn("Failed to borrow a buffer from pool", e);
        }
        if (buffer == null) {
            buffer = LinkedBuffer.allocate(serializeRCFBufferSize);
            isCheckout = false;
        }
        return new SimpleImmutableEntry<LinkedBuffer, Boolean>(buffer, isCheckout);
    }

    private String toCheckpoint(RandomCutForest forest, LinkedBuffer buffer) {
        try {
            RandomCutForestState state;
            // same lock as PairModel scoring
            synchronized (forest) {
                state = mapper.toState(forest);
            }
            byte[] bytes = ProtostuffIOUtil.toByteArray(state, rcfSchema, buffer);
            return Base64.getEncoder().encodeToString(bytes);
        } finally {
            buffer.clear();
        }
    }

    /**
     * Deserializes a checkpoint.
     *
     * @param checkpoint serialized JSON string
     * @param source where the checkpoint came from, used in errors
     * @return restored model state
     * @throws IncompatibleCheckpointException when the schema version is not the current one
     * @throws PersistenceException when the checkpoint is malformed
     */
    public ModelState fromCheckpoint(String checkpoint, String source) {
        JsonObject json;
        try {
            json = JsonParser.parseString(checkpoint).getAsJsonObject();
        } catch (RuntimeException e) {
            throw new PersistenceException(source, "Checkpoint is not a JSON object", e);
        }
        int version = requireField(json, CommonName.SCHEMA_VERSION_FIELD, source).getAsInt();
        if (version != AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION) {
            throw new IncompatibleCheckpointException(source, version, AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION);
        }
        try {
            MetricPair pair = new MetricPair(
                requireField(json, CommonName.SERVICE_FIELD, source).getAsString(),
                requireField(json, CommonName.METRIC_FIELD, source).getAsString()
            );
            ForestParameters parameters = new ForestParameters(
                requireField(json, CommonName.CONTAMINATION_FIELD, source).getAsDouble(),
                requireField(json, CommonName.NUM_TREES_FIELD, source).getAsInt(),
                requireField(json, CommonName.SAMPLE_SIZE_FIELD, source).getAsInt(),
                requireField(json, CommonName.RANDOM_SEED_FIELD, source).getAsLong()
            );
            List<String> featureNames = new ArrayList<>();
            for (JsonElement name : requireField(json, CommonName.FEATURE_NAMES_FIELD, source).getAsJsonArray()) {
                featureNames.add(name.getAsString());
            }
            JsonArray baselineJson = requireField(json, CommonName.BASELINE_FIELD, source).getAsJsonArray();
            double[] baselineValues = new double[baselineJson.size()];
            for (int i = 0; i < baselineValues.length; i++) {
                baselineValues[i] = baselineJson.get(i).getAsDouble();
            }
            double threshold = requireField(json, CommonName.THRESHOLD_FIELD, source).getAsDouble();
            RandomCutForest forest = toRcf(requireField(json, CommonName.FIELD_MODELV2, source).getAsString());
            Instant trainedTime = Instant.ofEpochMilli(requireField(json, CommonName.TIMESTAMP, source).getAsLong());
            Instant checkpointTime = Instant.ofEpochMilli(requireField(json, CommonName.CHECKPOINT_TIME_FIELD, source).getAsLong());

            PairModel model = new PairModel(
                pair,
                featureNames,
                forest,
                new ContaminationThresholdingModel(parameters.getContamination(), threshold),
                parameters
            );
            ModelState state = new ModelState(pair, model, new StatBaseline(baselineValues), trainedTime);
            state.setLastCheckpointTime(checkpointTime);
            return state;
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException(source, "Failed to restore checkpoint", e);
        }
    }

    private JsonElement requireField(JsonObject json, String field, String source) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new PersistenceException(source, "Checkpoint misses field " + field);
        }
        return element;
    }

    private RandomCutForest toRcf(String serialized) {
        byte[] bytes = Base64.getDecoder().decode(serialized);
        RandomCutForestState state = rcfSchema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state, rcfSchema);
        return mapper.toModel(state);
    }
}
