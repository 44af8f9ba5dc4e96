package org.csits.reportd.dao;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.Optional;
import org.csits.reportd.dao.serializer.ReportJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryScheduledReportRepositoryTest {

    private InMemoryScheduledReportRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryScheduledReportRepository(ReportJson.newMapper(ZoneId.of("UTC")));
    }

    @Test
    void save_storesCopyNotReference() throws IOException {
        ScheduledReportEntity report = FileScheduledReportRepositoryTest.sampleReport("a", "Alpha");
        repository.save(report);

        report.setName("changed after save");

        assertThat(repository.findById("a").get().getName()).isEqualTo("Alpha");
    }

    @Test
    void findAll_excludesIndexAndSortsByFileName() throws IOException {
        repository.save(FileScheduledReportRepositoryTest.sampleReport("b", "Beta"));
        repository.save(FileScheduledReportRepositoryTest.sampleReport("a", "Alpha"));
        repository.saveIndex("{\"reports\":[]}".getBytes(StandardCharsets.UTF_8));

        assertThat(repository.findAll()).extracting(ScheduledReportEntity::getId).containsExactly("a", "b");
        assertThat(repository.readIndex()).isPresent();
    }

    @Test
    void update_appliesChangeToStoredCopy() throws IOException {
        ScheduledReportEntity stale = FileScheduledReportRepositoryTest.sampleReport("a", "Alpha");
        repository.save(stale);
        repository.update("a", r -> r.setEnabled(false));

        stale.setName("stale write");
        Optional<ScheduledReportEntity> updated = repository.update("a", r -> r.setNextRun(stale.getNextRun()));

        assertThat(updated).isPresent();
        ScheduledReportEntity stored = repository.findById("a").get();
        assertThat(stored.isEnabled()).isFalse();
        assertThat(stored.getName()).isEqualTo("Alpha");
    }

    @Test
    void update_missingReportWritesNothing() throws IOException {
        assertThat(repository.update("ghost", r -> r.setEnabled(false))).isEmpty();
        assertThat(repository.findAll()).isEmpty();
    }
}
