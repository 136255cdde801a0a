package org.scriptonbasestar.sync.store.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.model.CombinedView;
import org.scriptonbasestar.sync.core.model.FrequencyClass;
import org.scriptonbasestar.sync.core.model.TimeSeries;
import org.scriptonbasestar.sync.core.support.ManualClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-02
 */
public class SnapshotManagerTest {

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	private ManualClock clock;
	private SnapshotManager manager;
	private Path dir;

	@Before
	public void setUp() {
		clock = ManualClock.at("2024-03-01T06:00:00Z");
		dir = temp.getRoot().toPath().resolve("backups");
		manager = new SnapshotManager(dir, new ObjectMapper(), clock);
	}

	private CombinedView view() {
		Instant at = Instant.parse("2024-02-29T00:00:00Z");
		return new CombinedView(
			Collections.singletonMap("DGS10", TimeSeries.builder().point(at, 4.25).build()),
			Collections.singletonMap("DGS10", new CombinedView.Provenance(FrequencyClass.DAILY, clock.instant())));
	}

	@Test
	public void snapshotWritesTimestampedFile() throws IOException {
		assertTrue(manager.snapshot(view(), "combined"));

		Path file = dir.resolve("20240301T060000Z_combined.json");
		assertTrue(Files.exists(file));
		JsonNode json = new ObjectMapper().readTree(file.toFile());
		assertEquals(1, json.get("seriesCount").asInt());
		assertEquals("daily", json.get("series").get("DGS10").get("frequencyClass").asText());
	}

	@Test
	public void sameSecondDoesNotOverwrite() {
		assertTrue(manager.snapshot(view(), "combined"));
		assertTrue(manager.snapshot(view(), "combined"));
		assertEquals(2, manager.list().size());
		assertTrue(Files.exists(dir.resolve("20240301T060000Z_combined-1.json")));
	}

	@Test
	public void listIsNewestFirst() {
		manager.snapshot(view(), "combined");
		clock.advance(Duration.ofDays(1));
		manager.snapshot(view(), "combined");

		List<Path> files = manager.list();
		assertEquals("20240302T060000Z_combined.json", files.get(0).getFileName().toString());
	}

	@Test
	public void pruneRemovesOldSnapshotsOnly() {
		manager.snapshot(view(), "combined");
		clock.advance(Duration.ofDays(10));
		manager.snapshot(view(), "combined");
		clock.advance(Duration.ofDays(25));

		assertEquals(1, manager.prune(30));
		assertEquals(1, manager.list().size());
		assertEquals("20240311T060000Z_combined.json", manager.list().get(0).getFileName().toString());
	}

	@Test
	public void negativeRetentionKeepsEverything() {
		manager.snapshot(view(), "combined");
		clock.advance(Duration.ofDays(400));
		assertEquals(0, manager.prune(-1));
		assertEquals(1, manager.list().size());
	}

	@Test
	public void pruneFallsBackToModifiedTime() throws IOException {
		Files.createDirectories(dir);
		Path legacy = Files.write(dir.resolve("legacy_cache.json"), "{}".getBytes());
		Files.setLastModifiedTime(legacy, FileTime.from(clock.instant().minus(Duration.ofDays(90))));

		assertEquals(1, manager.prune(30));
		assertFalse(Files.exists(legacy));
	}

	@Test
	public void failureIsReportedNotThrown() throws IOException {
		Path blocker = temp.newFile("not-a-dir").toPath();
		SnapshotManager broken = new SnapshotManager(blocker, new ObjectMapper(), clock);
		assertFalse(broken.snapshot(view(), "combined"));
	}

	@Test
	public void labelIsSanitized() {
		manager.snapshot(view(), "../evil label");
		assertTrue(Files.exists(dir.resolve("20240301T060000Z_.._evil_label.json")));
	}
}
