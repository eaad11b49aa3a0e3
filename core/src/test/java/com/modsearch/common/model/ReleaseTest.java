package com.modsearch.common.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReleaseTest {

    private static Release withFiles(ReleaseFile... files) {
        return new Release("r1", Maturity.STABLE, "1.0", "One", 0, List.of(), List.of(), List.of(files), List.of());
    }

    @Test
    void testMarkedPrimaryIsKept() {
        Release release = withFiles(
                new ReleaseFile("u1", "sources.jar", 1, false),
                new ReleaseFile("u2", "main.jar", 2, true));

        assertEquals("main.jar", release.getPrimaryFile().filename());
        assertFalse(release.getFiles().get(0).primary());
    }

    @Test
    void testFirstFileBecomesPrimaryWhenNoneIsMarked() {
        Release release = withFiles(
                new ReleaseFile("u1", "first.jar", 1, false),
                new ReleaseFile("u2", "second.jar", 2, false));

        assertEquals("first.jar", release.getPrimaryFile().filename());
        assertEquals(1, release.getFiles().stream().filter(ReleaseFile::primary).count());
    }

    @Test
    void testOnlyOnePrimaryWhenSeveralAreMarked() {
        Release release = withFiles(
                new ReleaseFile("u1", "a.jar", 1, true),
                new ReleaseFile("u2", "b.jar", 2, true));

        assertEquals("a.jar", release.getPrimaryFile().filename());
        assertEquals(1, release.getFiles().stream().filter(ReleaseFile::primary).count());
    }

    @Test
    void testNoFiles() {
        assertNull(withFiles().getPrimaryFile());
    }

    @Test
    void testDependencyCacheStartsEmpty() {
        Release release = new Release("r1", Maturity.BETA, "1.0", "One", 0, List.of(), List.of(), List.of(),
                List.of("dep1"));

        assertTrue(release.hasRequiredDependencies());
        assertNull(release.getResolvedDependencies());
    }

    @Test
    void testMaturityOrder() {
        assertTrue(Maturity.STABLE.isHigherThan(Maturity.BETA));
        assertTrue(Maturity.BETA.isHigherThan(Maturity.DRAFT));
        assertFalse(Maturity.BETA.isHigherThan(Maturity.BETA));
        assertEquals(Maturity.DRAFT, Maturity.fromWireName("alpha"));
        assertThrows(IllegalArgumentException.class, () -> Maturity.fromWireName("nightly"));
    }
}
