package com.vibeforge.core.artifact;

import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.storage.PayloadStorage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {

    private static final String CODE = String.join("\n",
            "export const Legend = () => null;",
            "export default function SalesChart({ model, html, React }) {",
            "  return html`<div></div>`;",
            "}");

    @TempDir
    Path tempDir;

    private PayloadStorage storage;
    private ArtifactStore  store;

    @BeforeEach
    void setUp() {
        storage = new PayloadStorage(VibeForgeSettings.forStore(tempDir));
        store   = newStore();
    }

    private ArtifactStore newStore() {
        return new ArtifactStore(storage, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static CacheKey salesKey() {
        return CacheKey.builder("bar chart of sales by region", new DataShape(120, 3)).build();
    }

    @Test
    void testMissThenSaveThenHit() {
        CacheKey key = salesKey();
        assertTrue(store.lookup(key).isEmpty());

        Artifact saved = store.save(CODE, key, "mock");

        assertEquals("bar_chart_sales_region", saved.getSlug());
        assertEquals(1, saved.getVersion());
        assertEquals(key.getShortHash() + "-v1", saved.getId());
        assertEquals("bar_chart_sales_region__" + key.getShortHash() + "__v1.js", saved.getFileName());
        assertEquals(List.of("Legend", "SalesChart"), saved.getComponentNames());

        Optional<Artifact> hit = store.lookup(key);
        assertTrue(hit.isPresent());
        assertEquals(saved.getId(), hit.get().getId());
        assertEquals(CODE, store.loadCode(hit.get()));
    }

    @Test
    void testReplayingSaveAppendsNextVersion() {
        CacheKey key = salesKey();

        Artifact first  = store.save(CODE, key, "mock");
        Artifact second = store.save(CODE, key, "mock");

        assertEquals(1, first.getVersion());
        assertEquals(2, second.getVersion());
        assertEquals(2, store.findBySlug("bar_chart_sales_region").size());
        assertEquals(second.getId(), store.lookup(key).orElseThrow().getId());
    }

    @Test
    void testVersionsCountPerSlugAcrossKeys() {
        Artifact small = store.save(CODE, salesKey(), "mock");
        Artifact large = store.save(CODE,
                CacheKey.builder("bar chart of sales by region", new DataShape(5000, 3)).build(), "mock");

        assertEquals(small.getSlug(), large.getSlug());
        assertEquals(2, large.getVersion());
        assertNotEquals(small.getContentHash(), large.getContentHash());
    }

    @Test
    void testModelIdDoesNotAffectLookup() {
        Artifact saved = store.save(CODE, salesKey(), "ollama:qwen");

        assertEquals(saved.getId(), store.lookup(salesKey()).orElseThrow().getId());
    }

    @Test
    void testMissingPayloadIsCacheMiss() throws Exception {
        Artifact saved = store.save(CODE, salesKey(), "mock");
        Files.delete(tempDir.resolve("artifacts").resolve(saved.getFileName()));

        assertTrue(store.lookup(salesKey()).isEmpty());
    }

    @Test
    void testIndexSurvivesRestart() {
        Artifact saved = store.save(CODE, salesKey(), "mock");

        ArtifactStore reopened = newStore();

        assertEquals(saved.getId(), reopened.lookup(salesKey()).orElseThrow().getId());
        assertEquals(2, reopened.save(CODE, salesKey(), "mock").getVersion());
    }

    @Test
    void testLinkBaseRecordsLineage() {
        Artifact base  = store.save(CODE, salesKey(), "mock");
        Artifact child = store.save(CODE,
                CacheKey.builder("bar chart of sales by region in red", new DataShape(120, 3)).build(), "mock");

        Artifact linked = store.linkBase(child.getId(), base.getId());

        assertEquals(base.getId(), linked.getBaseArtifactId());
        assertEquals(base.getId(), store.findById(child.getId()).orElseThrow().getBaseArtifactId());
        assertEquals(List.of(child.getId()),
                store.findRevisionsOf(base.getId()).stream().map(Artifact::getId).collect(Collectors.toList()));
    }

    @Test
    void testLinkToUnknownBaseIsStale() {
        Artifact child = store.save(CODE, salesKey(), "mock");

        assertThrows(StaleReferenceException.class, () -> store.linkBase(child.getId(), "nope-v1"));
    }

    @Test
    void testSaveSuccessorTakesOverCacheSlot() {
        Artifact broken = store.save(CODE, salesKey(), "mock");

        Artifact fixed = store.saveSuccessor(CODE + "\n// fixed", broken, "mock");

        assertEquals(broken.getContentHash(), fixed.getContentHash());
        assertEquals(2, fixed.getVersion());
        assertNull(fixed.getBaseArtifactId());
        assertEquals(fixed.getId(), store.lookup(salesKey()).orElseThrow().getId());
    }

    @Test
    void testDeclaredStateContractSurvivesRestartAndFix() {
        CacheKey key = CacheKey.builder("bar chart of sales by region", new DataShape(120, 3))
                .exports(Map.of("selection", "selected region"))
                .imports(Map.of("filter", "active filter"))
                .build();
        Artifact broken = store.save(CODE, key, "mock");

        Artifact reloaded = newStore().findById(broken.getId()).orElseThrow();
        Artifact fixed = store.saveSuccessor(CODE + "\n// fixed", reloaded, "mock");

        assertEquals(Map.of("selection", "selected region"), reloaded.getExports());
        assertEquals(Map.of("filter", "active filter"), reloaded.getImports());
        assertEquals(reloaded.getExports(), fixed.getExports());
        assertEquals(reloaded.getImports(), fixed.getImports());
    }

    @Test
    void testExternalArtifacts() throws Exception {
        Path source = tempDir.resolve("outside.js");
        Files.writeString(source, CODE);

        Artifact external = store.loadExternal(source);

        assertTrue(external.getId().startsWith(ArtifactStore.EXTERNAL_PREFIX));
        assertEquals(ArtifactOrigin.EXTERNAL, external.getOrigin());
        assertEquals(CODE, store.loadCode(external));
        assertEquals(external, store.findById(external.getId()).orElseThrow());
        assertTrue(store.findAll().isEmpty(), "externals are not index rows");
    }

    @Test
    void testRemoveWhereDeletesPayloadsAndExternals() {
        Artifact saved = store.save(CODE, salesKey(), "mock");
        Artifact external = store.registerExternal(CODE, "pasted.js");

        int removed = store.removeWhere(a -> true);

        assertEquals(2, removed);
        assertTrue(store.findById(saved.getId()).isEmpty());
        assertTrue(store.findById(external.getId()).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("artifacts").resolve(saved.getFileName())));
    }
}
