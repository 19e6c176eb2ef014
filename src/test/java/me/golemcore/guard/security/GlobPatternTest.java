package me.golemcore.guard.security;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    @Test
    void shouldAnchorAndTranslateWildcards() {
        assertEquals("^\\Q/etc/\\E.*$", GlobPattern.toRegex("/etc/*"));
        assertEquals("^.*$", GlobPattern.toRegex("*"));
    }

    @Test
    void shouldMatchWildcardAcrossSeparators() {
        Pattern pattern = GlobPattern.compile("/projects/*", false);

        assertTrue(pattern.matcher("/projects/app/src/Main.java").matches());
        assertTrue(pattern.matcher("/projects/").matches());
        assertFalse(pattern.matcher("/other/projects/app").matches());
    }

    @Test
    void shouldTreatRegexMetacharactersLiterally() {
        Pattern pattern = GlobPattern.compile("/data/file.(json)?", false);

        assertTrue(pattern.matcher("/data/file.(json)?").matches());
        assertFalse(pattern.matcher("/data/fileXjson").matches());
    }

    @Test
    void shouldHonorCaseSensitivityFlag() {
        assertTrue(GlobPattern.compile("/ETC/*", true).matcher("/etc/passwd").matches());
        assertFalse(GlobPattern.compile("/ETC/*", false).matcher("/etc/passwd").matches());
    }
}
