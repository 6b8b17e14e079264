// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.history;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import pl.morgwai.samples.grpc.banking.*;



/**
 * Thread-safe {@link TransactionSource} keeping append-only histories in memory.
 * Cursors iterate over a snapshot taken when they are opened, so records appended later are not
 * visible to already opened cursors.
 */
public class InMemoryTransactionSource implements TransactionSource {



	final ConcurrentMap<String, List<TransactionRecord>> histories = new ConcurrentHashMap<>();



	public void append(TransactionRecord record) {
		histories
			.computeIfAbsent(record.getAccountId(), (accountId) -> new CopyOnWriteArrayList<>())
			.add(record);
		if (log.isLoggable(Level.FINER)) log.finer("appended " + record.getTransactionId());
	}



	/**
	 * Appends a record of an approved payment to the history of the paying account. Payments
	 * without an account id are not recorded. Suitable as an approval listener of
	 * {@link pl.morgwai.samples.grpc.banking.payment.SimulatedPaymentProcessor}.
	 */
	public void recordPayment(PaymentRequest request, PaymentResponse response) {
		if (request.getAccountId().isBlank()) return;
		append(TransactionRecord.newBuilder()
			.setTransactionId(response.getId())
			.setAccountId(request.getAccountId())
			.setAmount(-response.getAmount())
			.setCurrency(response.getCurrency())
			.setDescription(request.getDescription())
			.setTimestampMillis(response.getProcessedAtMillis())
			.build());
	}



	@Override
	public TransactionCursor openHistory(String accountId) {
		final var snapshot = List.copyOf(histories.getOrDefault(accountId, List.of()));
		return new SnapshotCursor(snapshot.iterator());
	}



	static class SnapshotCursor implements TransactionCursor {

		final Iterator<TransactionRecord> records;
		boolean closed = false;

		SnapshotCursor(Iterator<TransactionRecord> records) { this.records = records; }

		@Override public boolean hasNext() {
			return !closed && records.hasNext();
		}

		@Override public TransactionRecord next() {
			if (closed) throw new NoSuchElementException("cursor closed");
			return records.next();
		}

		@Override public void close() {
			closed = true;
		}
	}



	static final Logger log = Logger.getLogger(InMemoryTransactionSource.class.getName());
}
