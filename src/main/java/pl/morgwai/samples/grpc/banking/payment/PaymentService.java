// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.payment;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import pl.morgwai.samples.grpc.banking.*;
import pl.morgwai.samples.grpc.banking.PaymentServiceGrpc.PaymentServiceImplBase;

import static java.util.concurrent.TimeUnit.MILLISECONDS;



/**
 * Implements {@code PaymentService}. Each call is dispatched to {@link #executor} and produces
 * exactly 1 response or exactly 1 error:
 * <ul>
 *   <li>processing that does not finish within {@link #timeoutMillis} is interrupted and the
 *     client receives {@link Status#DEADLINE_EXCEEDED},</li>
 *   <li>processing of a call cancelled by the client is interrupted and nothing is sent,</li>
 *   <li>domain errors are mapped by {@link CallErrors#toStatus(Throwable)}.</li>
 * </ul>
 * The timeout, the client cancellation and {@link PaymentProcessor}'s commit permit all race for
 * a single finalization of the call, so a payment is never committed after its call has been
 * finalized in any other way. Failed payments are never retried.
 */
public class PaymentService extends PaymentServiceImplBase {



	final PaymentProcessor processor;
	final ExecutorService executor;
	final ScheduledExecutorService timeoutScheduler;
	final long timeoutMillis;



	/**
	 * @param timeoutMillis processing timeout of a single call. {@code 0} disables the timeout, in
	 *     which case only the client's deadline applies.
	 */
	public PaymentService(
		PaymentProcessor processor,
		ExecutorService executor,
		ScheduledExecutorService timeoutScheduler,
		long timeoutMillis
	) {
		this.processor = processor;
		this.executor = executor;
		this.timeoutScheduler = timeoutScheduler;
		this.timeoutMillis = timeoutMillis;
	}



	@Override
	public void processPayment(
			PaymentRequest request, StreamObserver<PaymentResponse> basicResponseObserver) {
		final var responseObserver =
				(ServerCallStreamObserver<PaymentResponse>) basicResponseObserver;
		final var call = new PaymentCall(request, responseObserver);
		responseObserver.setOnCancelHandler(call::onCancel);
		call.start();
	}



	/**
	 * State of a single {@code processPayment} call.
	 */
	class PaymentCall implements Runnable {

		final PaymentRequest request;
		final ServerCallStreamObserver<PaymentResponse> responseObserver;

		final AtomicBoolean finalized = new AtomicBoolean(false);
		volatile boolean committed = false;

		Future<?> processing;  // guarded by this
		ScheduledFuture<?> timeout;  // guarded by this



		PaymentCall(PaymentRequest request, ServerCallStreamObserver<PaymentResponse> observer) {
			this.request = request;
			this.responseObserver = observer;
		}



		synchronized void start() {
			processing = executor.submit(this);
			if (timeoutMillis > 0L) {
				timeout = timeoutScheduler.schedule(this::onTimeout, timeoutMillis, MILLISECONDS);
			}
		}



		@Override
		public void run() {
			try {
				final var response = processor.process(request, this::obtainCommitPermit);
				if ( !committed && !finalized.compareAndSet(false, true)) return;
				cancelTimeout();
				responseObserver.onNext(response);
				responseObserver.onCompleted();
			} catch (CancellationException e) {
				log.fine("payment call finalized before commit, nothing committed");
			} catch (InterruptedException e) {
				if (finalized.compareAndSet(false, true)) {
					log.warning("payment processing interrupted before finalization");
					cancelTimeout();
					reportError(Status.UNAVAILABLE
						.withDescription("payment processing interrupted")
						.asException());
				} else {
					log.fine("payment processing aborted");
				}
			} catch (StatusRuntimeException e) {
				log.fine("client gone before the response could be sent: " + e);
			} catch (Throwable t) {
				if ( !committed && !finalized.compareAndSet(false, true)) {
					if (log.isLoggable(Level.FINE)) log.fine("error after finalization: " + t);
					if (t instanceof Error) throw (Error) t;
					return;
				}
				cancelTimeout();
				if (t instanceof InvalidRequestException) {
					if (log.isLoggable(Level.FINE)) log.fine("invalid payment request: " + t);
				} else if (t instanceof ProcessingFailureException) {
					log.info("payment failed: " + t.getMessage());
				} else {
					log.log(Level.SEVERE, "unexpected error during payment processing", t);
				}
				reportError(t);
			}
		}



		/** Commit permit passed to {@link PaymentProcessor}. */
		boolean obtainCommitPermit() {
			if ( !finalized.compareAndSet(false, true)) return false;
			committed = true;
			cancelTimeout();
			return true;
		}



		void onTimeout() {
			if ( !finalized.compareAndSet(false, true)) return;
			log.warning("payment processing exceeded " + timeoutMillis + "ms, aborting");
			synchronized (this) {
				processing.cancel(true);
			}
			reportError(new TimeoutException(
					"payment processing exceeded " + timeoutMillis + "ms"));
		}



		/** {@link ServerCallStreamObserver#setOnCancelHandler(Runnable) onCancelHandler}. */
		void onCancel() {
			if ( !finalized.compareAndSet(false, true)) return;
			log.fine("client cancelled payment call, aborting");
			synchronized (this) {
				if (processing != null) processing.cancel(true);
				if (timeout != null) timeout.cancel(false);
			}
		}



		synchronized void cancelTimeout() {
			if (timeout != null) timeout.cancel(false);
		}



		void reportError(Throwable error) {
			CallErrors.sendAndRethrowErrorIfNeeded(error, responseObserver);
		}
	}



	static final Logger log = Logger.getLogger(PaymentService.class.getName());
}
