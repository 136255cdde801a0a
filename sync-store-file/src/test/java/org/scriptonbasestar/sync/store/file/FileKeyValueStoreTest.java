package org.scriptonbasestar.sync.store.file;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.sync.core.exception.SBStoreUnavailableException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Stream;

import static org.junit.Assert.*;

/**
 * FileKeyValueStore 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
public class FileKeyValueStoreTest {

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	private FileKeyValueStore store;

	@Before
	public void setUp() throws IOException {
		store = new FileKeyValueStore(temp.getRoot().toPath().resolve("kv"));
	}

	@Test
	public void missingKeyReturnsNull() {
		assertNull(store.get("nothing"));
	}

	@Test
	public void putThenGetReplacesWholeValue() {
		store.put("frequency-cache:daily", "first".getBytes(StandardCharsets.UTF_8));
		store.put("frequency-cache:daily", "second-value".getBytes(StandardCharsets.UTF_8));

		assertEquals("second-value", new String(store.get("frequency-cache:daily"), StandardCharsets.UTF_8));
	}

	@Test
	public void noTempFilesLeftBehind() throws IOException {
		store.put("a", new byte[]{1, 2, 3});
		store.put("b", new byte[]{4});

		try (Stream<Path> files = Files.list(store.getDirectory())) {
			assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
		}
		assertEquals(Arrays.asList("a", "b"), store.keys());
	}

	@Test
	public void keysWithSeparatorsRoundTrip() {
		store.put("frequency-cache:monthly", new byte[]{9});
		store.put("http/cache?x=1", new byte[]{8});

		assertTrue(store.keys().contains("frequency-cache:monthly"));
		assertTrue(store.keys().contains("http/cache?x=1"));
		assertArrayEquals(new byte[]{8}, store.get("http/cache?x=1"));
	}

	@Test
	public void delete() {
		store.put("a", new byte[]{1});
		assertTrue(store.delete("a"));
		assertFalse(store.delete("a"));
		assertNull(store.get("a"));
	}

	@Test(expected = SBStoreUnavailableException.class)
	public void putFailsWhenDirectoryIsAFile() throws IOException {
		Path blocker = temp.newFile("blocker").toPath();
		new FileKeyValueStore(blocker).put("a", new byte[]{1});
	}

	@Test(expected = IllegalArgumentException.class)
	public void emptyKeyRejected() {
		store.get("");
	}
}
