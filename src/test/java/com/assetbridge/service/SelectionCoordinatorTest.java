package com.assetbridge.service;

import com.assetbridge.model.Asset;
import com.assetbridge.model.Asset.AssetKind;
import com.assetbridge.model.UnifiedObject;
import com.assetbridge.model.UnifiedObject.Progression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SelectionCoordinatorTest {

    private static final String IMAGE = "/out/images/a.png";
    private static final String MODEL = "/out/models/a.glb";
    private static final String OTHER_MODEL = "/out/models/b.glb";

    @Mock
    private Lineage lineage;

    @Mock
    private Consumer<List<UnifiedObject>> listener;

    @Mock
    private Runnable onMutation;

    private AssetTracker tracker;
    private SelectionCoordinator selection;

    @BeforeEach
    void setUp() {
        tracker = new AssetTracker();
        Instant now = Instant.now();
        tracker.add(IMAGE, AssetKind.IMAGE, now);
        tracker.add(MODEL, AssetKind.MODEL, now);
        tracker.add(OTHER_MODEL, AssetKind.MODEL, now);

        selection = new SelectionCoordinator(tracker);
        selection.setLineage(lineage);
        selection.setOnSelectionChanged(listener);
        selection.setOnMutation(onMutation);
    }

    @Test
    void testToggle_ImageWithoutModel_ShouldBeImageOnly() {
        boolean selected = selection.toggle(IMAGE);

        assertTrue(selected);
        List<UnifiedObject> view = selection.getUnifiedView();
        assertEquals(1, view.size());
        assertEquals(IMAGE, view.get(0).getKey());
        assertEquals(Progression.IMAGE_ONLY, view.get(0).getProgression());
        verify(onMutation).run();
        verify(listener).accept(view);
    }

    /**
     * A selected image with a model is represented once, by its model, even when the model is selected too.
     */
    @Test
    void testUnifiedView_ImageAndModelSelected_ShouldCollapseToModel() {
        when(lineage.getModelForImage(IMAGE)).thenReturn(Optional.of(MODEL));
        when(lineage.getImageForModel(MODEL)).thenReturn(Optional.of(IMAGE));

        selection.setSelected(IMAGE, true);
        selection.setSelected(MODEL, true);

        List<UnifiedObject> view = selection.getUnifiedView();
        assertEquals(1, view.size());
        UnifiedObject object = view.get(0);
        assertEquals(MODEL, object.getKey());
        assertEquals(IMAGE, object.getSourceImage());
        assertEquals(Progression.HAS_MODEL, object.getProgression());
    }

    @Test
    void testUnifiedView_TexturedModel_ShouldBeKeyedByTexturedFile() {
        when(lineage.getModelForImage(IMAGE)).thenReturn(Optional.of(MODEL));
        when(lineage.isTextured(MODEL)).thenReturn(true);
        when(lineage.getTexturedModel(MODEL)).thenReturn(Optional.of("/out/textured/textured_a.glb"));

        selection.setSelected(IMAGE, true);

        UnifiedObject object = selection.getUnifiedView().get(0);
        assertEquals("/out/textured/textured_a.glb", object.getKey());
        assertEquals(Progression.TEXTURED, object.getProgression());
    }

    @Test
    void testUnifiedView_ModelWithoutImage_ShouldBeStandalone() {
        selection.setSelected(OTHER_MODEL, true);

        UnifiedObject object = selection.getUnifiedView().get(0);
        assertEquals(OTHER_MODEL, object.getKey());
        assertTrue(object.isStandalone());
        assertEquals(Progression.HAS_MODEL, object.getProgression());
    }

    /**
     * Toggling a path that was never discovered fails and leaves the selection untouched.
     */
    @Test
    void testToggle_UnknownPath_ShouldThrowNotFound() {
        assertThrows(AssetNotFoundException.class, () -> selection.toggle("/out/images/ghost.png"));

        assertTrue(selection.getSelectedPaths().isEmpty());
        verify(listener, never()).accept(any());
        verify(onMutation, never()).run();
    }

    @Test
    void testSetSelected_SameValue_ShouldNotNotifyTwice() {
        selection.setSelected(IMAGE, true);
        selection.setSelected(IMAGE, true);

        verify(onMutation, times(1)).run();
        verify(listener, times(1)).accept(any());
    }

    @Test
    void testSummaryAndPipelineTargets() {
        when(lineage.getModelForImage(IMAGE)).thenReturn(Optional.of(MODEL));

        selection.setSelected(IMAGE, true);
        selection.setSelected(OTHER_MODEL, true);

        Map<Progression, Integer> summary = selection.getSelectionSummary();
        assertEquals(0, summary.get(Progression.IMAGE_ONLY));
        assertEquals(2, summary.get(Progression.HAS_MODEL));
        assertEquals(0, summary.get(Progression.TEXTURED));
        assertEquals(List.of(MODEL, OTHER_MODEL), selection.getPipelineTargets());
    }

    @Test
    void testClearSelection_ByKind_ShouldOnlyClearThatKind() {
        selection.setSelected(IMAGE, true);
        selection.setSelected(OTHER_MODEL, true);

        int cleared = selection.clearSelection(AssetKind.MODEL);

        assertEquals(1, cleared);
        assertEquals(List.of(IMAGE), selection.getSelectedPaths());
    }

    /**
     * A restored flag waits for its asset and is applied when the asset is discovered.
     */
    @Test
    void testRestore_PendingFlag_ShouldApplyOnDiscovery() {
        String later = "/out/images/later.png";
        selection.restore(Map.of(later, true));

        assertFalse(selection.isSelected(later));
        assertEquals(Boolean.TRUE, selection.getPersistentFlags().get(later));

        Asset asset = tracker.add(later, AssetKind.IMAGE, Instant.now()).getAsset();
        assertTrue(selection.onAssetTracked(asset));
        assertTrue(selection.isSelected(later));

        ArgumentCaptor<List<UnifiedObject>> captor = ArgumentCaptor.forClass(List.class);
        assertTrue(selection.recompute());
        verify(listener).accept(captor.capture());
        assertEquals(later, captor.getValue().get(0).getKey());
    }

    @Test
    void testDropMissingPending_ShouldKeepFlagsOfExistingFiles(@TempDir Path tempDir) throws Exception {
        String present = Files.writeString(tempDir.resolve("present.png"), "png").toString();
        String gone = tempDir.resolve("gone.png").toString();
        selection.restore(Map.of(present, true, gone, false));

        assertEquals(1, selection.dropMissingPending());

        assertEquals(Map.of(present, true), selection.getPersistentFlags());
        assertEquals(0, selection.dropMissingPending());
        verifyNoInteractions(onMutation);
    }
}
