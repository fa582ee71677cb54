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

import static org.cloudmonitor.timeseries.AbstractTimeSeriesTest.expectThrows;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.apache.commons.pool2.impl.GenericObjectPool;
import org.cloudmonitor.TestHelpers;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.timeseries.common.exception.IncompatibleCheckpointException;
import org.cloudmonitor.timeseries.common.exception.PersistenceException;
import org.cloudmonitor.timeseries.constant.CommonName;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import io.protostuff.LinkedBuffer;

public class CheckpointDaoTests {
    private static final MetricPair PAIR = MetricPair.of("api-gateway", "cpu_usage");

    private static ModelState state;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path modelsDir;
    private CheckpointDao checkpointDao;

    @BeforeClass
    public static void setUpModel() {
        state = ModelTestUtil.state(PAIR, TestHelpers.gaussianValues(64, 7, 30, 3));
    }

    @Before
    public void setUp() throws IOException {
        modelsDir = folder.newFolder("models").toPath();
        checkpointDao = TestHelpers.checkpointDao(modelsDir);
    }

    @Test
    public void testCheckpointPath() {
        assertEquals(modelsDir.resolve("api-gateway").resolve("cpu_usage" + CommonName.CHECKPOINT_FILE_SUFFIX), checkpointDao.checkpointPath(PAIR));
    }

    @Test
    public void testFileNameEncoding() {
        assertEquals("a%20b%2Fc", CheckpointDao.toFileName("a b/c"));
        assertEquals("svc-1%2Eeu_west", CheckpointDao.toFileName("svc-1.eu_west"));
        assertEquals("%2E%2E", CheckpointDao.toFileName(".."));
        assertEquals("a b/c", CheckpointDao.fromFileName(CheckpointDao.toFileName("a b/c")));
    }

    @Test
    public void testDistinctPairsHaveDistinctPaths() {
        Path spaced = checkpointDao.checkpointPath(MetricPair.of("svc a", "cpu_usage"));
        Path underscored = checkpointDao.checkpointPath(MetricPair.of("svc_a", "cpu_usage"));
        assertFalse(spaced.equals(underscored));
        assertFalse(
            checkpointDao.checkpointPath(MetricPair.of("svc", "a b")).equals(checkpointDao.checkpointPath(MetricPair.of("svc", "a_b")))
        );
    }

    @Test
    public void testPathStaysInsideModelsDir() {
        Path path = checkpointDao.checkpointPath(MetricPair.of("..", "..")).normalize();
        assertTrue(path.startsWith(modelsDir));
        assertEquals(modelsDir, path.getParent().getParent());
    }

    @Test
    public void testWritingOnePairKeepsTheOther() {
        MetricPair spaced = MetricPair.of("svc a", "cpu_usage");
        MetricPair underscored = MetricPair.of("svc_a", "cpu_usage");
        checkpointDao.write(ModelTestUtil.state(spaced, TestHelpers.gaussianValues(32, 4, 30, 3)));
        checkpointDao.write(ModelTestUtil.state(underscored, TestHelpers.gaussianValues(40, 5, 30, 3)));

        assertEquals(spaced, checkpointDao.read(spaced).get().getPair());
        assertEquals(32, checkpointDao.read(spaced).get().getBaseline().size());
        assertEquals(underscored, checkpointDao.read(underscored).get().getPair());

        List<CheckpointInfo> infos = checkpointDao.listCheckpoints();
        assertEquals(2, infos.size());
        assertEquals(spaced, infos.get(0).getPair());
        assertEquals(underscored, infos.get(1).getPair());
    }

    @Test
    public void testReadRejectsCheckpointOfAnotherPair() throws IOException {
        MetricPair other = MetricPair.of("database", "cpu_usage");
        Path path = checkpointDao.write(state);
        Path otherPath = checkpointDao.checkpointPath(other);
        Files.createDirectories(otherPath.getParent());
        Files.copy(path, otherPath);

        PersistenceException e = expectThrows(PersistenceException.class, () -> checkpointDao.read(other));
        assertThat(e.getMessage(), containsString("holds the model of api-gateway/cpu_usage, not database/cpu_usage"));
    }

    @Test
    public void testUndecodableFileNamesAreIgnored() throws IOException {
        checkpointDao.write(state);
        Path bad = modelsDir.resolve("svc%zz");
        Files.createDirectories(bad);
        Files.write(bad.resolve("cpu_usage" + CommonName.CHECKPOINT_FILE_SUFFIX), new byte[] { '{', '}' });

        List<CheckpointInfo> infos = checkpointDao.listCheckpoints();
        assertEquals(1, infos.size());
        assertEquals(PAIR, infos.get(0).getPair());
    }

    @Test
    public void testWriteAndRead() {
        Path path = checkpointDao.write(state);
        assertTrue(Files.isRegularFile(path));

        Optional<ModelState> restored = checkpointDao.read(PAIR);
        assertTrue(restored.isPresent());
        ModelState restoredState = restored.get();
        assertEquals(PAIR, restoredState.getPair());
        assertEquals(TestHelpers.START, restoredState.getLastTrainedTime());
        assertEquals(TestHelpers.START, restoredState.getLastCheckpointTime());
        assertArrayEquals(state.getBaseline().getValues(), restoredState.getBaseline().getValues(), 0);

        PairModel original = state.getModel();
        PairModel model = restoredState.getModel();
        assertEquals(original.getFeatureNames(), model.getFeatureNames());
        assertEquals(original.getParameters(), model.getParameters());
        assertEquals(original.getThreshold(), model.getThreshold(), 0);
        for (double value : new double[] { 20, 30, 33, 60 }) {
            ThresholdingResult expected = original.predict(new double[] { value });
            ThresholdingResult actual = model.predict(new double[] { value });
            assertEquals(expected.getRcfScore(), actual.getRcfScore(), 1e-6);
            assertEquals(expected.isAnomaly(), actual.isAnomaly());
        }
    }

    @Test
    public void testTrainingTimeSurvivesRestore() {
        Instant trainedTime = TestHelpers.START.minus(Duration.ofHours(6));
        ModelState older = new ModelState(PAIR, state.getModel(), state.getBaseline(), trainedTime);
        checkpointDao.write(older);

        ModelState restored = checkpointDao.read(PAIR).get();
        assertEquals(trainedTime, restored.getLastTrainedTime());
        assertEquals(TestHelpers.START, restored.getLastCheckpointTime());
    }

    @Test
    public void testWriteWhileScoring() throws Exception {
        PairModel model = state.getModel();
        double expected = model.score(new double[] { 45 });
        ExecutorService scorer = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> scores = scorer.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    if (model.score(new double[] { 45 }) != expected) {
                        return false;
                    }
                }
                return true;
            });
            for (int i = 0; i < 5; i++) {
                checkpointDao.write(state);
            }
            assertTrue(scores.get(30, TimeUnit.SECONDS));
        } finally {
            scorer.shutdownNow();
        }
        assertEquals(expected, checkpointDao.read(PAIR).get().getModel().score(new double[] { 45 }), 1e-6);
    }

    @Test
    public void testWriteReplacesPreviousCheckpoint() throws IOException {
        checkpointDao.write(state);
        ModelState retrained = ModelTestUtil.state(PAIR, TestHelpers.gaussianValues(32, 8, 50, 2));
        checkpointDao.write(retrained);
        assertEquals(32, checkpointDao.read(PAIR).get().getBaseline().size());
        try (Stream<Path> files = Files.list(modelsDir.resolve("api-gateway"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    public void testCheckpointContent() {
        JsonObject json = JsonParser.parseString(checkpointDao.toCheckpoint(state)).getAsJsonObject();
        assertEquals(AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION, json.get(CommonName.SCHEMA_VERSION_FIELD).getAsInt());
        assertEquals("api-gateway", json.get(CommonName.SERVICE_FIELD).getAsString());
        assertEquals("cpu_usage", json.get(CommonName.METRIC_FIELD).getAsString());
        assertEquals(TestHelpers.START.toEpochMilli(), json.get(CommonName.TIMESTAMP).getAsLong());
        assertEquals(TestHelpers.START.toEpochMilli(), json.get(CommonName.CHECKPOINT_TIME_FIELD).getAsLong());
        assertEquals(64, json.get(CommonName.BASELINE_FIELD).getAsJsonArray().size());
        assertFalse(json.get(CommonName.FIELD_MODELV2).getAsString().isEmpty());
    }

    @Test
    public void testReadMissingCheckpoint() {
        assertFalse(checkpointDao.read(MetricPair.of("database", "cpu_usage")).isPresent());
    }

    @Test
    public void testIncompatibleSchemaVersion() throws IOException {
        JsonObject json = JsonParser.parseString(checkpointDao.toCheckpoint(state)).getAsJsonObject();
        json.addProperty(CommonName.SCHEMA_VERSION_FIELD, AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION + 1);
        Path path = checkpointDao.checkpointPath(PAIR);
        Files.createDirectories(path.getParent());
        Files.write(path, json.toString().getBytes(StandardCharsets.UTF_8));

        IncompatibleCheckpointException e = expectThrows(IncompatibleCheckpointException.class, () -> checkpointDao.read(PAIR));
        assertEquals(AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION + 1, e.getFoundVersion());
    }

    @Test
    public void testMissingField() {
        String checkpoint = "{\"schema_version\":" + AnomalyDetectorSettings.CHECKPOINT_SCHEMA_VERSION + ",\"service\":\"a\"}";
        PersistenceException e = expectThrows(PersistenceException.class, () -> checkpointDao.fromCheckpoint(checkpoint, "test"));
        assertThat(e.getMessage(), containsString(CommonName.METRIC_FIELD));
    }

    @Test
    public void testMalformedCheckpoint() {
        expectThrows(PersistenceException.class, () -> checkpointDao.fromCheckpoint("not json", "test"));
    }

    @Test
    public void testCorruptedModel() {
        JsonObject json = JsonParser.parseString(checkpointDao.toCheckpoint(state)).getAsJsonObject();
        json.addProperty(CommonName.FIELD_MODELV2, "@@@");
        expectThrows(PersistenceException.class, () -> checkpointDao.fromCheckpoint(json.toString(), "test"));
    }

    @Test
    public void testTooLargeCheckpoint() {
        CheckpointDao smallDao = TestHelpers.checkpointDao(modelsDir, TestHelpers.bufferPool(), 100);
        PersistenceException e = expectThrows(PersistenceException.class, () -> smallDao.write(state));
        assertThat(e.getMessage(), containsString("too large"));
        assertFalse(Files.exists(smallDao.checkpointPath(PAIR)));
    }

    @Test
    public void testUnwritableDirectory() throws IOException {
        Path file = folder.newFile("not-a-dir").toPath();
        CheckpointDao badDao = TestHelpers.checkpointDao(file);
        expectThrows(PersistenceException.class, () -> badDao.write(state));
    }

    @Test
    public void testListCheckpoints() {
        checkpointDao.write(state);
        checkpointDao.write(ModelTestUtil.state(MetricPair.of("database", "error_rate"), TestHelpers.gaussianValues(32, 3, 1, 0.1)));

        List<CheckpointInfo> infos = checkpointDao.listCheckpoints();
        assertEquals(2, infos.size());
        assertEquals("api-gateway", infos.get(0).getService());
        assertEquals("cpu_usage", infos.get(0).getMetric());
        assertEquals("database", infos.get(1).getService());
        assertEquals("error_rate", infos.get(1).getMetric());
        assertTrue(infos.get(0).getSizeBytes() > 0);
    }

    @Test
    public void testListWithoutDirectory() {
        assertTrue(TestHelpers.checkpointDao(modelsDir.resolve("missing")).listCheckpoints().isEmpty());
    }

    @SuppressWarnings("unchecked")
    @Test
    public void testBorrowFromPoolFailure() throws Exception {
        GenericObjectPool<LinkedBuffer> mockSerializeRCFBufferPool = mock(GenericObjectPool.class);
        when(mockSerializeRCFBufferPool.borrowObject()).thenThrow(new RuntimeException("pool exhausted"));
        CheckpointDao dao = TestHelpers.checkpointDao(modelsDir, mockSerializeRCFBufferPool, AnomalyDetectorSettings.MAX_CHECKPOINT_BYTES);

        dao.write(state);

        assertTrue(dao.read(PAIR).isPresent());
        verify(mockSerializeRCFBufferPool, never()).returnObject(any());
    }
}
