package org.springaicommunity.github.teamhealth.app.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits GitHub number lookups so an {@code IN} list stays below the bind-parameter limit
 * of the database.
 */
final class NumberChunks {

	static final int DEFAULT_SIZE = 1000;

	private NumberChunks() {
	}

	static List<List<Integer>> of(List<Integer> numbers, int size) {
		if (size < 1) {
			throw new IllegalArgumentException("Chunk size must be positive, got " + size);
		}
		List<Integer> distinct = numbers.stream().distinct().toList();
		List<List<Integer>> chunks = new ArrayList<>();
		for (int start = 0; start < distinct.size(); start += size) {
			chunks.add(distinct.subList(start, Math.min(start + size, distinct.size())));
		}
		return chunks;
	}

}
