package com.distopik.wampsession;

import java.util.Map;

import com.distopik.wampsession.message.MessageLayout;

/**
 * Sequential request ids in {@code [1, 2^53]}. After the upper bound the sequence
 * starts over at 1, skipping ids that still have a response outstanding.
 */
final class IdGenerator {
	private long last;

	IdGenerator() {
		this(0);
	}

	IdGenerator(long last) {
		this.last = last;
	}

	long next(Map<Long, ?> outstanding) {
		do {
			last = last >= MessageLayout.MAX_ID ? 1 : last + 1;
		} while (outstanding.containsKey(last));
		return last;
	}
}
