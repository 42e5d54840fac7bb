package com.studioscout.core.service.export;

import com.studioscout.core.service.BatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExportCoordinator: 포맷별 격리와 JSON 폴백")
class ExportCoordinatorTest {

    @TempDir
    Path tmp;

    private static final RecordExporter BROKEN = (baseDir, result, startedIso) -> {
        throw new IOException("disk full");
    };

    @Test
    void writes_every_requested_format_in_fixed_order() throws Exception {
        List<Path> files = new ExportCoordinator().exportAll(tmp, ExportFixtures.sample(), ExportFixtures.STARTED,
                new LinkedHashSet<>(List.of("errors", "json", "csv")));

        assertThat(files).hasSize(3);
        assertThat(files.get(0).getFileName().toString()).startsWith("studios-").endsWith(".csv");
        assertThat(files.get(1).getFileName().toString()).endsWith(".json");
        assertThat(files.get(2).getFileName().toString()).startsWith("errors-");
        assertThat(files).allMatch(p -> Files.exists(p));
    }

    @Test
    @DisplayName("하나가 실패해도 나머지는 계속")
    void failing_exporter_does_not_stop_others() throws Exception {
        ExportCoordinator coord = new ExportCoordinator(BROKEN, new JsonRecordExporter(), new ErrorCsvExporter());

        List<Path> files = coord.exportAll(tmp, ExportFixtures.sample(), ExportFixtures.STARTED,
                Set.of("csv", "errors"));

        assertThat(files).singleElement().satisfies(p ->
                assertThat(p.getFileName().toString()).startsWith("errors-"));
    }

    @Test
    @DisplayName("아무 것도 못 만들면 JSON 폴백")
    void nothing_written_falls_back_to_json() throws Exception {
        BatchResult none = ExportFixtures.none();

        List<Path> noFormats = new ExportCoordinator().exportAll(tmp, none, ExportFixtures.STARTED, Set.of());
        assertThat(noFormats).singleElement().satisfies(p -> assertThat(p.toString()).endsWith(".json"));

        ExportCoordinator broken = new ExportCoordinator(BROKEN, new JsonRecordExporter(), BROKEN);
        List<Path> files = broken.exportAll(tmp, none, ExportFixtures.STARTED, Set.of("csv"));
        assertThat(files).singleElement().satisfies(p -> assertThat(p).exists());
    }

    @Test
    void naming_uses_exports_dir_and_minute_timestamp() {
        var ctx = ReportNaming.context(tmp, "2025-03-01T21:34:56Z");
        assertThat(ReportNaming.exportsDir(ctx)).isEqualTo(tmp.resolve("exports"));
        assertThat(ReportNaming.csvPath(ctx).getFileName().toString())
                .matches("studios-\\d{8}-\\d{4}\\.csv");
        assertThat(ReportNaming.context(null, "not-a-date").baseDir()).isEqualTo(Path.of("out"));
    }
}
