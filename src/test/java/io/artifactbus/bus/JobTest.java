package io.artifactbus.bus;

import io.artifactbus.model.JobState;
import io.artifactbus.model.Manifest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class JobTest {

    private static final Manifest MANIFEST = new Manifest(Manifest.SCHEMA_VERSION, "r1", "sim", "trades", "a1",
            null, 3L, Map.of(), "0".repeat(64), "sha256", 10L, Manifest.DEFAULT_DATA_FILE, 1L);

    @Test
    void happyPathShouldMoveThroughValidatedToCommitted() {
        Job job = Job.incoming("job-1");
        Job validated = job.validated(MANIFEST, "producer=sim/kind=trades/run_id=r1/a1.parquet");
        Job committed = validated.committed();

        Assertions.assertEquals(JobState.INCOMING, job.state());
        Assertions.assertEquals(JobState.VALIDATED, validated.state());
        Assertions.assertEquals(JobState.COMMITTED, committed.state());
        Assertions.assertEquals("producer=sim/kind=trades/run_id=r1/a1.parquet", committed.canonicalKey());
    }

    @Test
    void commitWithoutValidationShouldBeRefused() {
        Assertions.assertThrows(IllegalStateException.class, () -> Job.incoming("job-1").committed());
    }

    @Test
    void rejectedJobShouldBeTerminal() {
        Rejection reason = new Rejection("HASH_MISMATCH", "content hash mismatch", "job-1", null, 1L);
        Job rejected = Job.incoming("job-1").rejected(reason);

        Assertions.assertEquals(JobState.REJECTED, rejected.state());
        Assertions.assertSame(reason, rejected.rejection());
        Assertions.assertThrows(IllegalStateException.class, () -> rejected.validated(MANIFEST, "k"));
        Assertions.assertThrows(IllegalStateException.class, () -> rejected.committed());
        Assertions.assertThrows(IllegalStateException.class, () -> rejected.rejected(reason));
    }

    @Test
    void committedJobShouldNotBeRejected() {
        Job committed = Job.incoming("job-1").validated(MANIFEST, "k").committed();
        Rejection reason = new Rejection("WRITE_ONCE_VIOLATION", "late", "job-1", null, 1L);
        Assertions.assertThrows(IllegalStateException.class, () -> committed.rejected(reason));
    }

    @Test
    void validatedJobMayStillBeRejected() {
        Job validated = Job.incoming("job-1").validated(MANIFEST, "k");
        Rejection reason = new Rejection("WRITE_ONCE_VIOLATION", "hash differs", "job-1", "r1/sim/trades/a1", 1L);
        Assertions.assertEquals(JobState.REJECTED, validated.rejected(reason).state());
    }
}
