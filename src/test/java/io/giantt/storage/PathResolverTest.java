package io.giantt.storage;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathResolverTest {
    @Test
    void normalizeUnifiesSeparators() {
        assertEquals("a/b/c", PathResolver.normalize("a\\b//c", '/'));
        assertEquals("a\\b\\c", PathResolver.normalize("a/b\\\\c", '\\'));
        assertEquals("\\\\server\\share", PathResolver.normalize("//server/share", '\\'));
        assertEquals("", PathResolver.normalize(null, '/'));
    }

    @Test
    void absoluteDetectionFollowsPlatformRules() {
        assertTrue(PathResolver.isAbsolute("/etc/items.txt", false));
        assertFalse(PathResolver.isAbsolute("items.txt", false));
        assertTrue(PathResolver.isAbsolute("C:\\items.txt", true));
        assertTrue(PathResolver.isAbsolute("\\\\server\\share", true));
        assertFalse(PathResolver.isAbsolute("C:items.txt", true));
        assertFalse(PathResolver.isAbsolute("", false));
    }

    @Test
    void resolveUsesContainingDirectory() {
        Path containing = Paths.get("/work/plans/main.txt");

        assertEquals(Paths.get("/work/shared/base.txt"), PathResolver.resolve(containing, "../shared/base.txt"));
        assertEquals(Paths.get("/work/plans/sub/x.txt"), PathResolver.resolve(containing, "sub\\x.txt"));
        assertEquals(Paths.get("/abs/y.txt"), PathResolver.resolve(containing, "/abs/y.txt"));
    }

    @Test
    void relativePathIsSlashSeparated() {
        assertEquals("plans/main.txt", PathResolver.relativePath(Paths.get("/work"), Paths.get("/work/plans/main.txt")));
        assertEquals("../other", PathResolver.relativePath(Paths.get("/work/plans"), Paths.get("/work/other")));
        assertEquals(".", PathResolver.relativePath(Paths.get("/work"), Paths.get("/work")));
    }

    @Test
    void safeFilenameDropsReservedCharacters() {
        assertEquals("weekly plan v2.txt", PathResolver.safeFilename("weekly plan: v2?.txt"));
        assertEquals("abc", PathResolver.safeFilename("a<b>c\u0001"));
        assertEquals("", PathResolver.safeFilename(null));
    }
}
