package org.springaicommunity.github.teamhealth.app.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NumberChunks Tests")
class NumberChunksTest {

	@Test
	@DisplayName("Splits a full sync into lookups of at most the chunk size")
	void splitsLargeLists() {
		List<Integer> numbers = IntStream.rangeClosed(1, 2500).boxed().toList();

		List<List<Integer>> chunks = NumberChunks.of(numbers, NumberChunks.DEFAULT_SIZE);

		assertThat(chunks).extracting(List::size).containsExactly(1000, 1000, 500);
		assertThat(chunks.get(2)).startsWith(2001).endsWith(2500);
	}

	@Test
	@DisplayName("Drops duplicate numbers")
	void dropsDuplicates() {
		assertThat(NumberChunks.of(List.of(7, 7, 8), 10)).containsExactly(List.of(7, 8));
	}

	@Test
	@DisplayName("Empty input gives no lookups")
	void emptyInput() {
		assertThat(NumberChunks.of(List.of(), 10)).isEmpty();
	}

	@Test
	@DisplayName("Rejects a non-positive chunk size")
	void rejectsChunkSize() {
		assertThatThrownBy(() -> NumberChunks.of(List.of(1), 0)).isInstanceOf(IllegalArgumentException.class);
	}

}
