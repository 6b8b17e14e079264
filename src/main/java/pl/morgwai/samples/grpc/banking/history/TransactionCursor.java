// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.history;

import java.util.NoSuchElementException;

import pl.morgwai.samples.grpc.banking.TransactionRecord;



/**
 * Lazy, non-restartable sequence of {@link TransactionRecord}s. Not thread-safe: callers must
 * ensure happens-before between subsequent calls made from different threads.
 */
public interface TransactionCursor extends AutoCloseable {

	boolean hasNext() throws TransactionSourceException;

	/** @throws NoSuchElementException if the cursor is exhausted. */
	TransactionRecord next() throws TransactionSourceException;

	/** Releases resources held by this cursor. Must be idempotent. */
	@Override void close();
}
