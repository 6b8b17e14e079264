// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.*;
import io.grpc.stub.StreamObserver;
import pl.morgwai.samples.grpc.banking.history.TransactionSourceException;



/**
 * Maps the service error taxonomy onto gRPC {@link Status}es.
 * <ul>
 *   <li>{@link InvalidRequestException} &rarr; {@link Status#INVALID_ARGUMENT}</li>
 *   <li>{@link ProcessingFailureException} &rarr; {@link Status#FAILED_PRECONDITION}</li>
 *   <li>{@link TransactionSourceException} &rarr; {@link Status#UNAVAILABLE}</li>
 *   <li>{@link TimeoutException} &rarr; {@link Status#DEADLINE_EXCEEDED}</li>
 *   <li>{@link CancellationException} &rarr; {@link Status#CANCELLED}</li>
 *   <li>{@link StatusException} and {@link StatusRuntimeException} keep their own status</li>
 *   <li>anything else &rarr; {@link Status#INTERNAL} with the error attached only as a cause, so
 *     that its message does not leak to the client</li>
 * </ul>
 */
public final class CallErrors {



	public static Status toStatus(Throwable error) {
		if (error instanceof StatusException) return ((StatusException) error).getStatus();
		if (error instanceof StatusRuntimeException) {
			return ((StatusRuntimeException) error).getStatus();
		}
		if (error instanceof InvalidRequestException) {
			return Status.INVALID_ARGUMENT.withDescription(error.getMessage());
		}
		if (error instanceof ProcessingFailureException) {
			return Status.FAILED_PRECONDITION.withDescription(error.getMessage()).withCause(error);
		}
		if (error instanceof TransactionSourceException) {
			return Status.UNAVAILABLE.withDescription(error.getMessage()).withCause(error);
		}
		if (error instanceof TimeoutException) {
			return Status.DEADLINE_EXCEEDED.withDescription(error.getMessage());
		}
		if (error instanceof CancellationException) {
			return Status.CANCELLED.withDescription(error.getMessage());
		}
		return Status.INTERNAL.withCause(error);
	}



	/**
	 * Reports {@code error} to the remote peer via {@code outboundObserver} as a {@link Status}
	 * obtained from {@link #toStatus(Throwable)} and re-throws {@code error} if it is an
	 * {@link Error}. If the call has been already finalized or cancelled, the failed report is
	 * only logged.
	 */
	public static void sendAndRethrowErrorIfNeeded(
			Throwable error, StreamObserver<?> outboundObserver) {
		try {
			outboundObserver.onError(toStatus(error).asException());
		} catch (IllegalStateException | StatusRuntimeException e) {
			if (log.isLoggable(Level.FINE)) {
				log.fine("could not report " + error + " to the client: " + e);
			}
		}
		if (error instanceof Error) throw (Error) error;
	}



	CallErrors() {}

	static final Logger log = Logger.getLogger(CallErrors.class.getName());
}
