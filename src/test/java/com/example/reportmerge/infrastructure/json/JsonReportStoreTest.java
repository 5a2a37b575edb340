package com.example.reportmerge.infrastructure.json;

import com.example.reportmerge.domain.model.ReportCorpus;
import com.example.reportmerge.infrastructure.exception.ReportCorpusException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonReportStoreTest {

    private final JsonReportStore store = new JsonReportStore(new ObjectMapper());

    @TempDir
    Path dir;

    @Test
    void readsRecordsIndexedByPosition() throws Exception {
        Path corpus = Files.writeString(dir.resolve("a_reports.json"),
                "{\"emdat_event\": {\"DisNo\": \"1\"}, \"reports\": [{\"title\": \"Crise à Port-au-Prince\"}, {\"title\": \"B\"}]}",
                StandardCharsets.UTF_8);

        ReportCorpus result = store.readCorpus(corpus);

        assertThat(result.reports()).hasSize(2);
        assertThat(result.reports().get(1).index()).isEqualTo(1);
        assertThat(result.reports().get(0).title()).contains("Crise à Port-au-Prince");
        assertThat(result.root().path("emdat_event").path("DisNo").asText()).isEqualTo("1");
    }

    @Test
    void corpusWithoutReportsArrayHasNoRecords() throws Exception {
        Path corpus = Files.writeString(dir.resolve("b_reports.json"), "{\"reports\": {}}");

        assertThat(store.readCorpus(corpus).reports()).isEmpty();
    }

    @Test
    void unreadableCorpusIsReported() throws Exception {
        Path broken = Files.writeString(dir.resolve("c_reports.json"), "{ not json");

        assertThatThrownBy(() -> store.readCorpus(broken))
                .isInstanceOf(ReportCorpusException.class)
                .hasMessageStartingWith("Failed to load source JSON");
        assertThatThrownBy(() -> store.readCorpus(dir.resolve("missing.json")))
                .isInstanceOf(ReportCorpusException.class);
        Path array = Files.writeString(dir.resolve("d_reports.json"), "[]");
        assertThatThrownBy(() -> store.readCorpus(array)).isInstanceOf(ReportCorpusException.class);
    }

    @Test
    void writesIndentedJsonCreatingDirectories() throws Exception {
        Path target = dir.resolve("out/nested/result.json");

        store.write(target, Map.of("title", "Séisme"));

        String written = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(written).contains("\"title\" : \"Séisme\"");
    }
}
