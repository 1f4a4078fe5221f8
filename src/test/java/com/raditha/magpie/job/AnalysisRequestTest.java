package com.raditha.magpie.job;

import com.raditha.magpie.config.AnalysisConfig;
import com.raditha.magpie.normalization.Language;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisRequestTest {

    private final AnalysisConfig config = AnalysisConfig.moderate(Language.PYTHON);

    @Test
    void testValidRequestIsTrimmed() {
        AnalysisRequest request = new AnalysisRequest(List.of(" repo-a ", "repo-b"), "  ", config);

        assertEquals(List.of("repo-a", "repo-b"), request.repositories());
        assertNull(request.branch());
    }

    @Test
    void testTooFewRepositories() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new AnalysisRequest(List.of("only"), null, config));
        assertEquals("At least 2 repositories are required", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new AnalysisRequest(null, null, config));
    }

    @Test
    void testTooManyRepositories() {
        List<String> repos = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            repos.add("repo-" + i);
        }

        assertThrows(IllegalArgumentException.class, () -> new AnalysisRequest(repos, null, config));
    }

    @Test
    void testTenRepositoriesAllowed() {
        List<String> repos = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            repos.add("repo-" + i);
        }

        assertEquals(10, new AnalysisRequest(repos, "main", config).repositories().size());
    }

    @Test
    void testDuplicateAndBlankRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new AnalysisRequest(List.of("a", " a"), null, config));
        assertTrue(ex.getMessage().startsWith("Duplicate repository"));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisRequest(List.of("a", ""), null, config));
    }

    @Test
    void testConfigRequired() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisRequest(List.of("a", "b"), null, null));
    }
}
