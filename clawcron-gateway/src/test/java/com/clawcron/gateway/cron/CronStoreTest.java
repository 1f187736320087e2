package com.clawcron.gateway.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CronStoreTest {

    @TempDir
    Path tempDir;

    private static CronTypes.CronJob job(String id) {
        return CronTypes.CronJob.builder()
                .id(id)
                .name("job " + id)
                .schedule(CronTypes.CronSchedule.every(60_000))
                .payload(CronTypes.CronPayload.builder().kind(CronTypes.PayloadKind.ECHO).message("hi").build())
                .state(CronTypes.CronJobState.builder().nextRunAtMs(1_000L).build())
                .createdAtMs(1L)
                .updatedAtMs(1L)
                .build();
    }

    @Test
    void missingFile_loadsEmpty() {
        CronStore store = new CronStore(tempDir.resolve("cron/jobs.json"));
        assertTrue(store.load().isEmpty());
        assertTrue(store.isLoaded());
    }

    @Test
    void saveThenLoad_preservesJobsAndOrder() throws Exception {
        Path file = tempDir.resolve("cron/jobs.json");
        CronStore store = new CronStore(file);
        store.put(job("b"));
        store.put(job("a"));
        store.save();

        CronStore other = new CronStore(file);
        assertEquals(2, other.load().size());
        assertEquals(java.util.List.of("b", "a"), java.util.List.copyOf(other.jobs().keySet()));
        CronTypes.CronJob loaded = other.get("b");
        assertEquals(CronTypes.ScheduleKind.EVERY, loaded.getSchedule().getKind());
        assertEquals(CronTypes.PayloadKind.ECHO, loaded.getPayload().getKind());
        assertEquals(1_000L, loaded.getState().getNextRunAtMs());

        String json = Files.readString(file);
        assertTrue(json.contains("\"kind\" : \"every\""));
        assertTrue(json.contains("\"kind\" : \"echo\""));
    }

    @Test
    void malformedJson_loadsEmptyAndKeepsBackup() throws Exception {
        Path file = tempDir.resolve("jobs.json");
        Files.writeString(file, "{ not json");

        CronStore store = new CronStore(file);
        assertTrue(store.load().isEmpty());

        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("jobs.json.corrupt-")));
        }
    }

    @Test
    void wrongDocumentShape_loadsEmpty() throws Exception {
        Path file = tempDir.resolve("jobs.json");
        Files.writeString(file, "{\"version\":1,\"jobs\":{\"id\":\"x\"}}");
        assertTrue(new CronStore(file).load().isEmpty());

        Files.writeString(file, "[1,2,3]");
        assertTrue(new CronStore(file).load().isEmpty());
    }

    @Test
    void entryWithoutIdOrUnknownKind_isHandled() throws Exception {
        Path file = tempDir.resolve("jobs.json");
        Files.writeString(file, """
                {"version":1,"jobs":[
                  {"name":"no id","schedule":{"kind":"every","everyMs":1000}},
                  {"id":"weird","schedule":{"kind":"lunar"},"enabled":true},
                  {"id":"ok","schedule":{"kind":"at","atMs":5},"payload":{"kind":"agent_turn","message":"m"},
                   "state":{"nextRunAtMs":5,"lastStatus":"error","lastError":"boom"},"extra":"ignored"}
                ]}
                """);

        CronStore store = new CronStore(file);
        store.load();
        assertEquals(2, store.jobs().size());
        assertNull(store.get("weird").getSchedule().getKind());
        assertEquals("weird", store.get("weird").getName());

        CronTypes.CronJob ok = store.get("ok");
        assertTrue(ok.isOneShot());
        assertEquals(CronTypes.RunStatus.ERROR, ok.getState().getLastStatus());
        assertEquals("boom", ok.getState().getLastError());
    }

    @Test
    void ownSave_isNotAnExternalChange() throws Exception {
        CronStore store = new CronStore(tempDir.resolve("jobs.json"));
        store.put(job("a"));
        store.save();
        assertFalse(store.hasChangedOnDisk());
        assertFalse(store.reloadIfChanged());
    }

    @Test
    void externalEdit_isDetectedAndReloaded() throws Exception {
        Path file = tempDir.resolve("jobs.json");
        CronStore store = new CronStore(file);
        store.put(job("a"));
        store.save();

        CronStore writer = new CronStore(file);
        writer.load();
        writer.put(job("b"));
        writer.save();
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 5_000));

        assertTrue(store.hasChangedOnDisk());
        assertTrue(store.reloadIfChanged());
        assertEquals(2, store.jobs().size());
        assertFalse(store.hasChangedOnDisk());
    }

    @Test
    void externalEdit_withinSameMtimeTick_isDetectedBySize() throws Exception {
        Path file = tempDir.resolve("jobs.json");
        CronStore store = new CronStore(file);
        store.put(job("a"));
        store.save();
        FileTime seen = Files.getLastModifiedTime(file);

        CronStore writer = new CronStore(file);
        writer.load();
        writer.put(job("b"));
        writer.save();
        Files.setLastModifiedTime(file, seen);

        assertTrue(store.hasChangedOnDisk());
        assertTrue(store.reloadIfChanged());
        assertNotNull(store.get("b"));
    }

    @Test
    void copy_isDeep() {
        CronTypes.CronJob original = job("a");
        CronTypes.CronJob copy = original.copy();
        copy.getState().setNextRunAtMs(99L);
        copy.getPayload().setMessage("changed");
        assertEquals(1_000L, original.getState().getNextRunAtMs());
        assertEquals("hi", original.getPayload().getMessage());
    }
}
