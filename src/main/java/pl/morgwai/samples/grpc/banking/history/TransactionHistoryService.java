// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.history;

import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import pl.morgwai.samples.grpc.banking.*;
import pl.morgwai.samples.grpc.banking.utils.DispatchingServerStreamingCallOnReadyHandler;



/**
 * Implements {@code TransactionHistoryService}: streams records of the requested account from a
 * {@link TransactionSource} in their stored order, one record per response message, with respect
 * to flow-control. A failure of the source ends the stream with
 * {@link io.grpc.Status#UNAVAILABLE} after the records sent so far.
 */
public class TransactionHistoryService
		extends TransactionHistoryServiceGrpc.TransactionHistoryServiceImplBase {



	final TransactionSource source;
	final Executor executor;



	public TransactionHistoryService(TransactionSource source, Executor executor) {
		this.source = source;
		this.executor = executor;
	}



	@Override
	public void getTransactionHistory(
		TransactionHistoryRequest request,
		StreamObserver<TransactionRecord> basicResponseObserver
	) {
		final var responseObserver =
				(ServerCallStreamObserver<TransactionRecord>) basicResponseObserver;
		try {
			validate(request);
		} catch (InvalidRequestException e) {
			if (log.isLoggable(Level.FINE)) log.fine("invalid history request: " + e);
			CallErrors.sendAndRethrowErrorIfNeeded(e, responseObserver);
			return;
		}

		final var history = new HistoryStream(request);
		DispatchingServerStreamingCallOnReadyHandler.copyWithFlowControl(
			responseObserver,
			executor,
			history::hasNext,
			history::next,
			(error) -> CallErrors.sendAndRethrowErrorIfNeeded(error, responseObserver),
			history::close,
			"history of " + request.getAccountId()
		);
	}



	static void validate(TransactionHistoryRequest request) throws InvalidRequestException {
		if (request.getAccountId().isBlank()) {
			throw new InvalidRequestException("account_id must not be blank");
		}
		if (request.getMaxRecords() < 0) {
			throw new InvalidRequestException("max_records must not be negative");
		}
	}



	/**
	 * Lazily opens a {@link TransactionCursor} on the first call to {@link #hasNext()}, so that a
	 * possibly blocking {@link TransactionSource#openHistory(String)} runs on a worker thread.
	 */
	class HistoryStream {

		final TransactionHistoryRequest request;
		TransactionCursor cursor;
		int sentCount = 0;

		HistoryStream(TransactionHistoryRequest request) { this.request = request; }



		boolean hasNext() throws TransactionSourceException {
			if (cursor == null) cursor = source.openHistory(request.getAccountId());
			if (request.getMaxRecords() > 0 && sentCount >= request.getMaxRecords()) return false;
			return cursor.hasNext();
		}



		TransactionRecord next() throws TransactionSourceException {
			final var record = cursor.next();
			sentCount++;
			return record;
		}



		void close() {
			if (cursor != null) cursor.close();
			if (log.isLoggable(Level.FINE)) {
				log.fine("history stream of " + request.getAccountId() + " closed after "
						+ sentCount + " records");
			}
		}
	}



	static final Logger log = Logger.getLogger(TransactionHistoryService.class.getName());
}
