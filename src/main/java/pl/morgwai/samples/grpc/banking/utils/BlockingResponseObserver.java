// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.utils;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import pl.morgwai.base.utils.concurrent.Awaitable;



/**
 * Client response observer that lets the calling thread await the end of the response stream.
 * Used by {@code chat} and {@code getTransactionHistory} clients, which consume their responses
 * asynchronously while keeping the request side available through
 * {@link #getRequestObserver()}.
 * <p>
 * Typical usage:</p>
 * <pre>
 *final var responseObserver = new BlockingResponseObserver&lt;ChatMessage, ChatMessage&gt;(
 *        (message) -&gt; System.out.println(message.getSender() + ": " + message.getText()));
 *final var requestObserver = chatStub.chat(responseObserver);
 *requestObserver.onNext(ChatMessage.newBuilder().setText("hello").build());
 *requestObserver.onCompleted();
 *try {
 *    responseObserver.awaitCompletion(5, TimeUnit.SECONDS);
 *} catch (ErrorReportedException e) {
 *    System.out.println("call failed: " + e.getStatus());
 *}</pre>
 */
public class BlockingResponseObserver<RequestT, ResponseT>
		implements ClientResponseObserver<RequestT, ResponseT> {



	final Consumer<? super ResponseT> responseHandler;
	final Consumer<? super ClientCallStreamObserver<RequestT>> beforeStartHandler;

	volatile ClientCallStreamObserver<RequestT> requestObserver;
	volatile Throwable error;
	volatile boolean completed = false;
	final CountDownLatch completionLatch = new CountDownLatch(1);



	/**
	 * @param responseHandler called for each response.
	 * @param beforeStartHandler called from {@link #beforeStart(ClientCallStreamObserver)}, may be
	 *     {@code null}. May set up flow-control of the request observer.
	 */
	public BlockingResponseObserver(
		Consumer<? super ResponseT> responseHandler,
		Consumer<? super ClientCallStreamObserver<RequestT>> beforeStartHandler
	) {
		this.responseHandler = responseHandler;
		this.beforeStartHandler = beforeStartHandler;
	}

	public BlockingResponseObserver(Consumer<? super ResponseT> responseHandler) {
		this(responseHandler, null);
	}



	@Override
	public void beforeStart(ClientCallStreamObserver<RequestT> requestObserver) {
		this.requestObserver = requestObserver;
		if (beforeStartHandler != null) beforeStartHandler.accept(requestObserver);
	}

	/**
	 * Request observer of the call or {@code empty} if the call has not been started yet.
	 */
	public Optional<ClientCallStreamObserver<RequestT>> getRequestObserver() {
		return Optional.ofNullable(requestObserver);
	}



	@Override
	public void onNext(ResponseT response) {
		responseHandler.accept(response);
	}

	@Override
	public void onCompleted() {
		completed = true;
		completionLatch.countDown();
	}

	@Override
	public void onError(Throwable error) {
		this.error = error;
		onCompleted();
	}



	/**
	 * Awaits up to {@code timeout} for the response stream to end.
	 * @return {@code true} if the stream completed successfully, {@code false} if the timeout
	 *     passed first.
	 * @throws ErrorReportedException if the stream ended with an error.
	 */
	public boolean awaitCompletion(long timeout, TimeUnit unit)
			throws ErrorReportedException, InterruptedException {
		completionLatch.await(timeout, unit);
		if (error != null) throw new ErrorReportedException(error);
		return completed;
	}

	/** Awaits without a timeout. @see #awaitCompletion(long, TimeUnit) */
	public void awaitCompletion() throws ErrorReportedException, InterruptedException {
		completionLatch.await();
		if (error != null) throw new ErrorReportedException(error);
	}

	/**
	 * {@link Awaitable} of the end of the response stream regardless whether it ended successfully
	 * or with an error.
	 */
	public Awaitable.WithUnit toAwaitable() {
		return completionLatch::await;
	}



	public boolean isCompleted() { return completed; }

	public Optional<Throwable> getError() { return Optional.ofNullable(error); }



	/**
	 * Thrown by {@code awaitCompletion(...)} methods if the response stream ended with an error.
	 * {@link #getCause()} returns the reported error.
	 */
	public static class ErrorReportedException extends Exception {

		ErrorReportedException(Throwable reportedError) { super(reportedError); }

		/** {@link Status} of the reported error. */
		public Status getStatus() { return Status.fromThrowable(getCause()); }

		private static final long serialVersionUID = -3404713254207785461L;
	}
}
