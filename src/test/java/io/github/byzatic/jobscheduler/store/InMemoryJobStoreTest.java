package io.github.byzatic.jobscheduler.store;

import io.github.byzatic.jobscheduler.base_exceptions.NotFoundException;
import io.github.byzatic.jobscheduler.model.Job;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private static Job job(String id, boolean active) {
        return Job.newBuilder()
                .setId(id)
                .setName("job " + id)
                .setJobType("custom")
                .setFrequencyType("interval")
                .putFrequencyConfig("minutes", 5)
                .setActive(active)
                .build();
    }

    @Test
    void saveGeneratesMissingId() {
        InMemoryJobStore store = new InMemoryJobStore();
        Job saved = store.save(job(null, true));
        assertNotNull(saved.getId());
        assertEquals(saved, store.find(saved.getId()).get());
    }

    @Test
    void listsOnlyActiveJobs() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        store.save(job("a", true));
        store.save(job("b", false));
        store.save(job("c", true));

        List<Job> active = store.listActiveJobs();
        assertEquals(2, active.size());
        assertEquals("a", active.get(0).getId());
        assertEquals("c", active.get(1).getId());

        store.setActive("b", true);
        assertEquals(3, store.listActiveJobs().size());
        assertEquals(3, store.listAll().size());
    }

    @Test
    void deleteAndMissingIds() {
        InMemoryJobStore store = new InMemoryJobStore();
        store.save(job("a", true));
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertTrue(store.find("a").isEmpty());
        assertThrows(NotFoundException.class, () -> store.setActive("a", false));
    }
}
