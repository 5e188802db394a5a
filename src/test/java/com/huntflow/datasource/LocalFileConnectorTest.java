package com.huntflow.datasource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.store.StorePatternException;
import com.huntflow.syntax.StatementParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for LocalFileConnector
 * Tests bundle layouts, wire pattern evaluation and time windows
 */
class LocalFileConnectorTest {

    @TempDir
    Path tempDir;

    private LocalFileConnector connector;
    private String bundleUri;

    @BeforeEach
    void setUp() throws Exception {
        connector = new LocalFileConnector(List.of("/data/a.json", "/data/b.json"), new StatementParser(),
                new ObjectMapper());
        Path bundle = Paths.get(getClass().getResource("/bundles/host-activity.json").toURI());
        bundleUri = "file://" + bundle.toAbsolutePath();
    }

    private static List<Object> ids(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> row.get("id")).collect(Collectors.toList());
    }

    @Test
    void testListDataSources_returnsConfiguredBundles() {
        assertThat(connector.scheme()).isEqualTo("file");
        assertThat(connector.listDataSources()).containsExactly("/data/a.json", "/data/b.json");
    }

    @Test
    void testQuery_filtersByCenterType() {
        // When: Querying processes by pid
        List<Map<String, Object>> rows = connector.query(bundleUri, "[process:pid > 5]");

        // Then: Only processes match, never other types
        assertThat(ids(rows)).containsExactly("process--2");
    }

    @Test
    void testQuery_followsReferencesInsideBundle() {
        List<Map<String, Object>> rows = connector.query(bundleUri,
                "[network-traffic:src_ref.value = '10.0.0.5' AND network-traffic:dst_ref.value ISSUBSET '192.168.0.0/16']");

        assertThat(ids(rows)).containsExactly("network-traffic--2");
    }

    @Test
    void testQuery_appliesTimeWindow() {
        List<Map<String, Object>> rows = connector.query(bundleUri,
                "[network-traffic:dst_port > 0] START t'2021-05-06T10:00:00.000Z' STOP t'2021-05-06T10:01:00.000Z'");

        assertThat(ids(rows)).containsExactly("network-traffic--1");
    }

    @Test
    void testQuery_entityTypeKeyedBundle() throws Exception {
        Path bundle = tempDir.resolve("typed.json");
        Files.writeString(bundle, "{\"url\": [{\"value\": \"http://a.example\"}, {\"value\": \"http://b.example\"}]}");

        List<Map<String, Object>> rows = connector.query("file://" + bundle, "[url:value LIKE '%b.example']");

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row).containsEntry("type", "url");
            assertThat(String.valueOf(row.get("id"))).startsWith("url--");
        });
    }

    @Test
    void testQuery_nestedObjectsAreFlattened() throws Exception {
        Path bundle = tempDir.resolve("nested.json");
        Files.writeString(bundle, "[{\"type\": \"process\", \"id\": \"process--9\", \"binary\": {\"name\": \"x.exe\"}}]");

        List<Map<String, Object>> rows = connector.query("file://" + bundle, "[process:binary.name = 'x.exe']");

        assertThat(rows).singleElement().satisfies(row -> assertThat(row).containsEntry("binary.name", "x.exe"));
    }

    @Test
    void testQuery_malformedPatternIsAPatternError() {
        assertThatThrownBy(() -> connector.query(bundleUri, "[process:pid = ]"))
                .isInstanceOf(StorePatternException.class)
                .satisfies(e -> assertThat(((StorePatternException) e).getPattern()).isEqualTo("[process:pid = ]"));
    }

    @Test
    void testQuery_missingBundleIsADataSourceError() {
        String uri = "file://" + tempDir.resolve("missing.json");

        assertThatThrownBy(() -> connector.query(uri, "[process:pid = 1]"))
                .isInstanceOf(DataSourceException.class)
                .satisfies(e -> assertThat(((DataSourceException) e).getUri()).isEqualTo(uri));
    }

    @Test
    void testToPath_rejectsOtherSchemes() {
        assertThatThrownBy(() -> LocalFileConnector.toPath("http://example.com/a.json"))
                .isInstanceOf(DataSourceException.class);
        assertThat(LocalFileConnector.toPath("file:///tmp/../tmp/a.json")).isEqualTo(Paths.get("/tmp/a.json"));
    }
}
