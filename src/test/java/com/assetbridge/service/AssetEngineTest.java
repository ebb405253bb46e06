package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.model.Association;
import com.assetbridge.model.ResourceHandle;
import com.assetbridge.model.UnifiedObject;
import com.assetbridge.model.UnifiedObject.Progression;
import com.assetbridge.repository.EngineStateStore;
import com.assetbridge.repository.EngineStateStore.Snapshot;
import com.assetbridge.util.FileUtils;
import com.assetbridge.util.SettingsManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AssetEngineTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    private static final Instant SESSION_START = NOW.minus(Duration.ofHours(1));

    @TempDir
    Path tempDir;

    @Mock
    private EngineListener listener;

    private Path imagesDir;
    private Path modelsDir;
    private Path texturedDir;
    private Path stagingDir;
    private SettingsManager settings;
    private AssetEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        imagesDir = tempDir.resolve("out/images");
        modelsDir = tempDir.resolve("out/models");
        texturedDir = tempDir.resolve("out/textured");
        stagingDir = Files.createDirectories(tempDir.resolve("staging"));

        settings = new SettingsManager(tempDir.resolve("config"));
        settings.setImagesDir(imagesDir);
        settings.setModelsDir(modelsDir);
        settings.setTexturedModelsDir(texturedDir);
        settings.setStateDir(tempDir.resolve("state"));
        settings.setWatcherPollInterval(Duration.ofMillis(50));
        settings.setWatcherMaxBackoff(Duration.ofMillis(500));
        settings.setPreviewTotalQuota(2);
        settings.setPreviewSessionQuota(1);

        engine = newEngine();
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    private AssetEngine newEngine() {
        AssetEngine created = new AssetEngine(settings, SESSION_START, new ServiceManager());
        created.addListener(listener);
        return created;
    }

    /**
     * Writes the file outside the watched directories and moves it in with its final modification time,
     * the way the generation service publishes finished files.
     */
    private Path publish(Path directory, String name, Instant mtime) throws IOException {
        Files.createDirectories(directory);
        Path staged = Files.writeString(stagingDir.resolve(name), "content of " + name);
        Files.setLastModifiedTime(staged, FileTime.from(mtime));
        return Files.move(staged, directory.resolve(name), StandardCopyOption.REPLACE_EXISTING);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertTrue(condition.getAsBoolean(), "Condition not reached in time");
    }

    /**
     * Full lineage: a session image is selected, its model is generated and auto-linked, then textured.
     * The image stays selected throughout and the lineage is shown once at its most-derived state.
     */
    @Test
    void testEndToEnd_ImageToModelToTextured() throws Exception {
        Path image = publish(imagesDir, "a.png", NOW);
        Asset imageAsset = await(engine.discover(image, AssetKind.IMAGE));

        List<Asset> sessionImages = await(engine.getSessionAssets(AssetKind.IMAGE));
        assertEquals(List.of(imageAsset), sessionImages);
        verify(listener).onAssetDiscovered(imageAsset, true);

        assertTrue(await(engine.toggle(image)));

        Path model = publish(modelsDir, "a.glb", NOW.plusSeconds(60));
        await(engine.discover(model, AssetKind.MODEL));

        List<UnifiedObject> view = await(engine.getUnifiedView());
        assertEquals(1, view.size());
        assertEquals(Progression.HAS_MODEL, view.get(0).getProgression());
        assertEquals(FileUtils.normalize(model), view.get(0).getKey());
        assertTrue(await(engine.isSelected(model)));
        verify(listener).onAssociationChanged(FileUtils.normalize(image), FileUtils.normalize(model));

        await(engine.markTextured(model));

        view = await(engine.getUnifiedView());
        assertEquals(1, view.size());
        assertEquals(Progression.TEXTURED, view.get(0).getProgression());
        assertTrue(await(engine.isSelected(image)));
        assertEquals(List.of(FileUtils.normalize(model)), await(engine.getPipelineTargets()));
    }

    @Test
    void testTexturedFile_ShouldRepresentLineage() throws Exception {
        Path image = publish(imagesDir, "ship.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));
        await(engine.setSelected(image, true));
        Path model = publish(modelsDir, "ship.glb", NOW.plusSeconds(30));
        await(engine.discover(model, AssetKind.MODEL));

        Path textured = publish(texturedDir, "ship_textured.glb", NOW.plusSeconds(90));
        await(engine.discover(textured, AssetKind.TEXTURED_MODEL));

        UnifiedObject object = await(engine.getUnifiedView()).get(0);
        assertEquals(FileUtils.normalize(textured), object.getKey());
        assertEquals(Progression.TEXTURED, object.getProgression());
        assertEquals(Map.of(Progression.IMAGE_ONLY, 0, Progression.HAS_MODEL, 0, Progression.TEXTURED, 1),
                await(engine.getSelectionSummary()));
    }

    @Test
    void testDiscover_SameFileTwice_ShouldNotifyOnce() throws Exception {
        Path image = publish(imagesDir, "twice.png", NOW);

        Asset first = await(engine.discover(image, AssetKind.IMAGE));
        Asset second = await(engine.discover(image, AssetKind.IMAGE));

        assertSame(first, second);
        verify(listener, times(1)).onAssetDiscovered(any(), anyBoolean());
    }

    /**
     * Files written by the generation service are picked up by the watcher without explicit discovery.
     */
    @Test
    void testWatcher_NewFile_ShouldBeDiscovered() throws Exception {
        eventually(engine::isWatching);

        Path image = publish(imagesDir, "watched.png", NOW);

        verify(listener, timeout(10_000)).onAssetDiscovered(
                argThat(asset -> asset.getPath().equals(FileUtils.normalize(image))), eq(true));
    }

    @Test
    void testDeletedModel_ShouldDropAssociation() throws Exception {
        eventually(engine::isWatching);
        Path image = publish(imagesDir, "d.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));
        Path model = publish(modelsDir, "d.glb", NOW.plusSeconds(10));
        await(engine.discover(model, AssetKind.MODEL));
        assertEquals(1, await(engine.getAssociations()).size());

        Files.delete(model);

        verify(listener, timeout(10_000)).onAssetRemoved(FileUtils.normalize(model));
        assertTrue(await(engine.getAssociations()).isEmpty());
    }

    @Test
    void testToggle_UnknownPath_ShouldFailWithNotFound() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> await(engine.toggle(imagesDir.resolve("ghost.png"))));

        assertInstanceOf(AssetNotFoundException.class, e.getCause());
    }

    @Test
    void testLink_UnknownModel_ShouldFailWithNotFound() throws Exception {
        Path image = publish(imagesDir, "l.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> await(engine.link(image, modelsDir.resolve("missing.glb"))));

        assertInstanceOf(AssetNotFoundException.class, e.getCause());
        assertTrue(await(engine.getAssociations()).isEmpty());
    }

    @Test
    void testResetSession_Backwards_ShouldFail() throws Exception {
        await(engine.resetSession(NOW));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> await(engine.resetSession(NOW.minusSeconds(5))));

        assertInstanceOf(OutOfOrderResetException.class, e.getCause());
    }

    @Test
    void testResetSession_ShouldMoveOlderAssetsToHistory() throws Exception {
        Path image = publish(imagesDir, "before.png", NOW.minusSeconds(120));
        await(engine.discover(image, AssetKind.IMAGE));
        assertEquals(1, await(engine.getSessionAssets(AssetKind.IMAGE)).size());

        await(engine.resetSession(NOW.minusSeconds(60)));

        assertTrue(await(engine.getSessionAssets(AssetKind.IMAGE)).isEmpty());
    }

    /**
     * The first activation enumerates the directory; later activations are served from the cache.
     */
    @Test
    void testActivate_ShouldScanOnce() throws Exception {
        publish(imagesDir, "v1.png", NOW.minusSeconds(30));
        publish(imagesDir, "v2.png", NOW);

        List<Asset> first = await(engine.activate(AssetEngine.VIEW_IMAGES));
        List<Asset> second = await(engine.activate(AssetEngine.VIEW_IMAGES));

        assertEquals(2, first.size());
        assertTrue(first.get(0).getPath().endsWith("v2.png"));
        assertEquals(first, second);
        assertEquals(1, engine.getScanCount());
    }

    /**
     * Associations and selection flags survive a restart and are applied when the files are seen again.
     */
    @Test
    void testRestart_ShouldRestorePersistedState() throws Exception {
        Path image = publish(imagesDir, "p.png", NOW);
        Path model = publish(modelsDir, "p_final.glb", NOW.plusSeconds(20));
        await(engine.discover(image, AssetKind.IMAGE));
        await(engine.discover(model, AssetKind.MODEL));
        await(engine.link(image, model));
        await(engine.setSelected(image, true));
        engine.stop();

        engine = newEngine();
        engine.start();
        await(engine.discover(image, AssetKind.IMAGE));
        await(engine.discover(model, AssetKind.MODEL));

        assertTrue(await(engine.isSelected(image)));
        assertEquals(1, await(engine.getAssociations()).size());
        assertEquals(Progression.HAS_MODEL, await(engine.getUnifiedView()).get(0).getProgression());
    }

    /**
     * Watchers run per directory, so a model can be seen before its source image.
     * The image then links to the waiting model when it arrives.
     */
    @Test
    void testImageDiscoveredAfterModel_ShouldAutoLink() throws Exception {
        Path model = publish(modelsDir, "tower.glb", NOW.plusSeconds(5));
        await(engine.discover(model, AssetKind.MODEL));
        assertTrue(await(engine.getAssociations()).isEmpty());

        Path image = publish(imagesDir, "tower.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));

        List<Association> links = await(engine.getAssociations());
        assertEquals(1, links.size());
        assertEquals(FileUtils.normalize(image), links.get(0).getImagePath());
        assertEquals(FileUtils.normalize(model), links.get(0).getModelPath());
        verify(listener).onAssociationChanged(FileUtils.normalize(image), FileUtils.normalize(model));
        assertEquals(1, await(engine.getAssociationStats()).get("images_with_models"));
    }

    @Test
    void testImageDiscoveredAfterTwoMatchingModels_ShouldStayUnlinked() throws Exception {
        Path first = publish(modelsDir, "tower.glb", NOW.plusSeconds(5));
        Path second = publish(modelsDir, "tower_v2.glb", NOW.plusSeconds(8));
        await(engine.discover(first, AssetKind.MODEL));
        await(engine.discover(second, AssetKind.MODEL));

        Path image = publish(imagesDir, "tower.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));

        assertTrue(await(engine.getAssociations()).isEmpty());
        // The explicit pass applies the same uniqueness rule
        assertEquals(0, await(engine.autoDetect()));
    }

    @Test
    void testAutoDetect_AfterManualUnlink_ShouldRelink() throws Exception {
        Path image = publish(imagesDir, "bridge.png", NOW);
        await(engine.discover(image, AssetKind.IMAGE));
        Path model = publish(modelsDir, "bridge.glb", NOW.plusSeconds(5));
        await(engine.discover(model, AssetKind.MODEL));
        assertTrue(await(engine.unlink(image)));

        assertEquals(1, await(engine.autoDetect()));

        assertEquals(FileUtils.normalize(model), await(engine.getAssociations()).get(0).getModelPath());
        assertEquals(0, await(engine.cleanupMissing()));
    }

    /**
     * A restored flag for a file that never comes back is dropped by the cleanup pass and not persisted again.
     */
    @Test
    void testCleanupMissing_ShouldDropRestoredFlagsOfVanishedFiles() throws Exception {
        engine.stop();
        String gone = FileUtils.normalize(imagesDir.resolve("gone.png"));
        EngineStateStore store = new EngineStateStore(settings.getStateDir());
        store.save(new Snapshot(Map.of(), Map.of(), Map.of(gone, true)));

        engine = newEngine();
        engine.start();
        Path kept = publish(imagesDir, "kept.png", NOW);
        await(engine.discover(kept, AssetKind.IMAGE));
        await(engine.toggle(kept));
        assertTrue(store.load().getSelection().containsKey(gone));

        await(engine.cleanupMissing());
        engine.stop();

        Map<String, Boolean> persisted = store.load().getSelection();
        assertFalse(persisted.containsKey(gone));
        assertEquals(Boolean.TRUE, persisted.get(FileUtils.normalize(kept)));
    }

    @Test
    void testRoutedCall_BeforeStart_ShouldFailFast() throws Exception {
        AssetEngine idle = newEngine();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> idle.toggle(imagesDir.resolve("a.png")).get(2, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertThrows(IllegalStateException.class, () -> idle.notifyGenerated(imagesDir.resolve("a.png"), AssetKind.IMAGE));
    }

    @Test
    void testRoutedCall_AfterStop_ShouldFailFast() throws Exception {
        assertTrue(await(engine.getTrackedAssets()).isEmpty());
        engine.stop();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> engine.getTrackedAssets().get(2, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testTouchPreview_ShouldProtectRecentlyUsedFromEviction() {
        ResourceHandle first = engine.acquirePreview(false, "first.glb");
        ResourceHandle second = engine.acquirePreview(false, "second.glb");
        assertTrue(engine.touchPreview(first));

        ResourceHandle session = engine.acquirePreview(true, "fresh.glb");

        assertTrue(engine.getAdmissionController().isActive(first));
        assertFalse(engine.getAdmissionController().isActive(second));
        assertTrue(engine.getAdmissionController().isActive(session));
        assertFalse(engine.touchPreview(second));
    }

    @Test
    void testAcquirePreview_ShouldApplyConfiguredQuotas() {
        ResourceHandle history = engine.acquirePreview(false, "old.glb");
        ResourceHandle session = engine.acquirePreview(true, "new.glb");

        assertThrows(ResourceRejectedException.class, () -> engine.acquirePreview(true, "newer.glb"));
        assertThrows(ResourceRejectedException.class, () -> engine.acquirePreview(false, "older.glb"));

        assertTrue(engine.releasePreview(history));
        assertFalse(engine.releasePreview(history));
        assertTrue(engine.getAdmissionController().isActive(session));
    }
}
