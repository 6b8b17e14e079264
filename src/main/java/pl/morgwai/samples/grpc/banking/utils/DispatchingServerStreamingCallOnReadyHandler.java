// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.utils;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.stub.ServerCallStreamObserver;



/**
 * Streams responses of a server streaming call from a possibly blocking producer, dispatching the
 * production to {@link #processingExecutor} with respect to flow-control.
 * The effect is similar to dispatching the below code to {@link #processingExecutor}:
 * <pre>
 *try {
 *    while (producerHasNext.call()) responseObserver.onNext(responseProducer.call());
 *    responseObserver.onCompleted();
 *} catch (Throwable t) {
 *    errorHandler.accept(t);
 *} finally {
 *    cleanupHandler.run();
 *}</pre>
 * <p>
 * However, whenever {@link #responseObserver} becomes unready, the production is suspended and
 * the executor's thread is released. The production is redispatched when the observer becomes
 * ready again. No more than 1 response is ever produced ahead of the observer's readiness.</p>
 * <p>
 * If the client cancels the call, the production stops at the latest when the current response is
 * produced. {@code cleanupHandler} is called exactly once in every case: after completion, after
 * a failure reported with {@code errorHandler} or after a cancellation. It is never called
 * concurrently with the producer.</p>
 * <p>
 * Typical usage:</p>
 * <pre>
 *public void myServerStreamingMethod(
 *        RequestMessage request, StreamObserver&lt;ResponseMessage&gt; basicResponseObserver) {
 *    final var responseObserver =
 *            (ServerCallStreamObserver&lt;ResponseMessage&gt;) basicResponseObserver;
 *    final var cursor = new MyCursor(request);
 *    DispatchingServerStreamingCallOnReadyHandler.copyWithFlowControl(
 *        responseObserver,
 *        processingExecutor,
 *        cursor::hasNext,
 *        cursor::next,
 *        (error) -&gt; CallErrors.sendAndRethrowErrorIfNeeded(error, responseObserver),
 *        cursor::close,
 *        "myServerStreamingMethod"
 *    );
 *}</pre>
 */
public class DispatchingServerStreamingCallOnReadyHandler<ResponseT> implements Runnable {



	/**
	 * Creates a new handler and sets it as both {@code onReadyHandler} and
	 * {@code onCancelHandler} of {@code responseObserver}. Must be called within the server method
	 * that received {@code responseObserver}.
	 * @return the newly created handler.
	 */
	public static <ResponseT> DispatchingServerStreamingCallOnReadyHandler<ResponseT>
	copyWithFlowControl(
		ServerCallStreamObserver<ResponseT> responseObserver,
		Executor processingExecutor,
		Callable<Boolean> producerHasNext,
		Callable<? extends ResponseT> responseProducer,
		Consumer<Throwable> errorHandler,
		Runnable cleanupHandler,
		String label
	) {
		final var handler = new DispatchingServerStreamingCallOnReadyHandler<ResponseT>(
			responseObserver,
			processingExecutor,
			producerHasNext,
			responseProducer,
			errorHandler,
			cleanupHandler,
			label
		);
		responseObserver.setOnCancelHandler(handler::onCancel);
		responseObserver.setOnReadyHandler(handler);
		return handler;
	}



	final ServerCallStreamObserver<ResponseT> responseObserver;
	final Executor processingExecutor;
	final Callable<Boolean> producerHasNext;
	final Callable<? extends ResponseT> responseProducer;
	final Consumer<Throwable> errorHandler;
	final Runnable cleanupHandler;
	final String label;

	boolean processingInProgress = false;  // guarded by lock
	boolean cancelled = false;  // guarded by lock
	final AtomicBoolean terminated = new AtomicBoolean(false);
	final Object lock = new Object();



	/**
	 * Low level constructor: does not set the handler on {@code responseObserver}.
	 * @param producerHasNext tells whether the producer has more responses. May block.
	 * @param responseProducer produces the next response. May block.
	 * @param errorHandler receives any failure of the producer or of the executor. Should report it
	 *     to the client: the stream is not finalized otherwise.
	 * @param cleanupHandler called exactly once when the stream terminates in any way.
	 * @param label for logging and debugging purposes.
	 * @see #copyWithFlowControl(ServerCallStreamObserver, Executor, Callable, Callable, Consumer,
	 *     Runnable, String)
	 */
	public DispatchingServerStreamingCallOnReadyHandler(
		ServerCallStreamObserver<ResponseT> responseObserver,
		Executor processingExecutor,
		Callable<Boolean> producerHasNext,
		Callable<? extends ResponseT> responseProducer,
		Consumer<Throwable> errorHandler,
		Runnable cleanupHandler,
		String label
	) {
		this.responseObserver = responseObserver;
		this.processingExecutor = processingExecutor;
		this.producerHasNext = producerHasNext;
		this.responseProducer = responseProducer;
		this.errorHandler = errorHandler;
		this.cleanupHandler = cleanupHandler;
		this.label = label;
	}



	/**
	 * Dispatches {@link #handleSingleReadinessCycle()} to {@link #processingExecutor} unless it is
	 * already running or the stream is terminated.
	 */
	@Override
	public void run() {
		synchronized (lock) {
			if (processingInProgress || cancelled || terminated.get()) return;
			processingInProgress = true;
		}
		try {
			processingExecutor.execute(this::handleSingleReadinessCycle);
		} catch (RejectedExecutionException e) {
			log.warning(label + ": executor rejected streaming task");
			synchronized (lock) {
				processingInProgress = false;
			}
			try {
				errorHandler.accept(e);
			} finally {
				terminate();
			}
		}
	}



	/**
	 * Produces and sends responses as long as {@link #responseObserver} is ready.
	 * <p>
	 * Note: {@link #responseObserver} may flip from unready to ready before this method notices
	 * the first state. In such case a single invocation spans over more than 1 readiness cycle and
	 * {@link #processingInProgress} flag prevents {@link #run()} from dispatching a duplicate.</p>
	 */
	void handleSingleReadinessCycle() {
		try {
			while (true) {
				synchronized (lock) {
					if (cancelled) break;
					if ( !responseObserver.isReady()) {
						processingInProgress = false;
						return;
					}
				}
				if ( !producerHasNext.call()) {
					responseObserver.onCompleted();
					if (log.isLoggable(Level.FINE)) log.fine(label + ": stream completed");
					break;
				}
				responseObserver.onNext(responseProducer.call());
			}
		} catch (Throwable t) {
			final boolean wasCancelled;
			synchronized (lock) {
				wasCancelled = cancelled;
			}
			if (wasCancelled) {
				if (log.isLoggable(Level.FINE)) log.fine(label + ": error after cancel: " + t);
			} else {
				log.log(Level.WARNING, label + ": producer failed, terminating stream", t);
				try {
					errorHandler.accept(t);
				} finally {
					terminate();
				}
				return;
			}
		}
		terminate();
	}



	/**
	 * {@link ServerCallStreamObserver#setOnCancelHandler(Runnable) onCancelHandler}: marks the
	 * stream as cancelled and performs the cleanup unless the producer is currently running,
	 * in which case it will perform the cleanup itself at its next suspension point.
	 */
	public void onCancel() {
		synchronized (lock) {
			cancelled = true;
			if (processingInProgress) return;
		}
		if (log.isLoggable(Level.FINE)) log.fine(label + ": client cancelled");
		terminate();
	}



	void terminate() {
		if (terminated.compareAndSet(false, true)) cleanupHandler.run();
	}



	/** Whether the stream has terminated and {@code cleanupHandler} has been called. */
	public boolean isTerminated() {
		return terminated.get();
	}



	@Override
	public String toString() {
		return "DispatchingServerStreamingCallOnReadyHandler { label=\"" + label + "\" }";
	}



	static final Logger log =
			Logger.getLogger(DispatchingServerStreamingCallOnReadyHandler.class.getName());
}
